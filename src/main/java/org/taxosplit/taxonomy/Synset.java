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
package org.taxosplit.taxonomy;

import java.util.Comparator;
import java.util.Objects;

/**
 * Defines a WordNet concept node ("synset"). A Synset is identified by its
 * WordNet id (e.g., {@code n02084071}) and carries a human-readable label.
 * Links to parent and child synsets are not stored here: they are owned by the
 * {@link org.taxosplit.analysis.graph.SynsetGraph} the synset belongs to.
 * <p>
 * Synsets use identity equality: copies of a graph hold distinct synsets that
 * share ids and labels with the originals, so that mutating one copy never
 * affects another.
 * </p>
 */
public class Synset {

	private final String id;
	private final String label;

	/**
	 * Instantiates a new synset.
	 *
	 * @param id    the WordNet id. Must not be null or blank
	 * @param label the word description of the synset. If null, the id is used
	 */
	public Synset(final String id, final String label) {
		if (id == null || id.trim().isEmpty())
			throw new IllegalArgumentException("Synset id cannot be empty");
		this.id = id.trim();
		this.label = (label == null) ? this.id : label;
	}

	/** @return the synset's WordNet id */
	public String id() {
		return id;
	}

	/** @return the synset's word description */
	public String label() {
		return label;
	}

	/**
	 * Creates a synset with the same id and label of this one.
	 *
	 * @return the copy, which is not {@code ==} to this synset
	 */
	public Synset duplicate() {
		return new Synset(id, label);
	}

	/**
	 * @return a comparator sorting synsets by id (nulls last)
	 */
	public static Comparator<Synset> comparator() {
		return Comparator.nullsLast(Comparator.comparing(Synset::id));
	}

	/**
	 * Assesses whether two synsets describe the same WordNet concept, i.e.,
	 * whether they share the same id, even if they belong to different graphs.
	 *
	 * @param other the synset to be compared against
	 * @return true if both synsets have the same id
	 */
	public boolean sameConcept(final Synset other) {
		return other != null && Objects.equals(id, other.id);
	}

	@Override
	public String toString() {
		return label + " [" + id + "]";
	}

}
