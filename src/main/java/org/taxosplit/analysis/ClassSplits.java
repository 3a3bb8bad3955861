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
package org.taxosplit.analysis;

import java.util.*;

/**
 * The assignment of classes (WordNet ids of graph leaves) to splits.
 */
public class ClassSplits {

	private final Map<Split, SortedSet<String>> splits;

	public ClassSplits(final Collection<String> train, final Collection<String> valid, final Collection<String> test) {
		splits = new EnumMap<>(Split.class);
		splits.put(Split.TRAIN, Collections.unmodifiableSortedSet(new TreeSet<>(train)));
		splits.put(Split.VALID, Collections.unmodifiableSortedSet(new TreeSet<>(valid)));
		splits.put(Split.TEST, Collections.unmodifiableSortedSet(new TreeSet<>(test)));
	}

	/**
	 * @param split the split
	 * @return the ids of the classes assigned to {@code split}, sorted
	 */
	public SortedSet<String> get(final Split split) {
		return splits.get(split);
	}

	/** @return the split a class was assigned to, or null if unknown */
	public Split getSplitOf(final String id) {
		for (final Map.Entry<Split, SortedSet<String>> entry : splits.entrySet()) {
			if (entry.getValue().contains(id))
				return entry.getKey();
		}
		return null;
	}

	/** @return the total number of classes across all splits */
	public int size() {
		return splits.values().stream().mapToInt(Set::size).sum();
	}

	/** @return the ids of all classes, sorted */
	public SortedSet<String> getAllIds() {
		final SortedSet<String> all = new TreeSet<>();
		splits.values().forEach(all::addAll);
		return all;
	}

	@Override
	public String toString() {
		return "train: " + get(Split.TRAIN).size() + ", valid: " + get(Split.VALID).size() + ", test: "
				+ get(Split.TEST).size() + " classes";
	}
}
