/*-
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2024 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */
package org.taxosplit;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.taxosplit.analysis.graph.SynsetGraph;
import org.taxosplit.io.WordNetLoader;

/**
 * WordNet ids of the toy taxonomy bundled as a test resource
 * ({@code taxonomy/toy.json}). Its classes are the 11 leaves below
 * {@link #ANIMAL} and {@link #ARTIFACT}.
 */
public final class ToyTaxonomy {

	public static final String RESOURCE = "taxonomy/toy.json";

	public static final String ENTITY = "n00001740";
	public static final String ABSTRACTION = "n00002137";
	public static final String IDEA = "n05810143";
	public static final String ANIMAL = "n00015388";
	public static final String DOMESTIC_ANIMAL = "n01317541";
	public static final String DOG = "n02084071";
	public static final String BEAGLE = "n02088364";
	public static final String DALMATIAN = "n02110341";
	public static final String POODLE = "n02113799";
	public static final String CAT = "n02121808";
	public static final String TABBY = "n02123045";
	public static final String PERSIAN = "n02123394";
	public static final String BIRD = "n01503061";
	public static final String FINCH = "n01530575";
	public static final String GOLDFINCH = "n01531178";
	public static final String HOUSE_FINCH = "n01532829";
	public static final String ARTIFACT = "n00021939";
	public static final String VEHICLE = "n03791235";
	public static final String CAR = "n02958343";
	public static final String BEACH_WAGON = "n02814533";
	public static final String CONVERTIBLE = "n03100240";
	public static final String BUS = "n02924116";
	public static final String MOTORCYCLE = "n03790512";

	public static final int NUM_SYNSETS = 23;
	public static final int NUM_LINKS = 23;

	public static final List<String> DOGS = Arrays.asList(BEAGLE, DALMATIAN, POODLE);
	public static final List<String> VEHICLES = Arrays.asList(BEACH_WAGON, BUS, CONVERTIBLE, MOTORCYCLE);
	public static final List<String> CLASSES = Arrays.asList(BEAGLE, DALMATIAN, POODLE, TABBY, PERSIAN, GOLDFINCH,
			HOUSE_FINCH, BEACH_WAGON, CONVERTIBLE, BUS, MOTORCYCLE);

	/** Synsets that survive collapsing the sampling graph of {@link #CLASSES} */
	public static final List<String> SAMPLING_GRAPH = Arrays.asList(ENTITY, ANIMAL, DOG, CAT, FINCH, VEHICLE, CAR,
			BEAGLE, DALMATIAN, POODLE, TABBY, PERSIAN, GOLDFINCH, HOUSE_FINCH, BEACH_WAGON, CONVERTIBLE, BUS,
			MOTORCYCLE);

	private ToyTaxonomy() {
	}

	public static SynsetGraph load() throws IOException {
		return WordNetLoader.fromResource(RESOURCE);
	}

}
