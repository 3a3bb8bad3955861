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

import java.util.EnumMap;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * Computes descriptive statistics on the number of images per class of each
 * split.
 */
public class SplitStatistics {

	private final Map<Split, SummaryStatistics> stats;

	/**
	 * @param classSplits the class assignment
	 * @param leafCounts  a map of class (leaf) WordNet ids to their number of
	 *                    images
	 * @throws IllegalArgumentException if a class has no count
	 */
	public SplitStatistics(final ClassSplits classSplits, final Map<String, Integer> leafCounts) {
		stats = new EnumMap<>(Split.class);
		for (final Split split : Split.values()) {
			final SummaryStatistics summary = new SummaryStatistics();
			for (final String id : classSplits.get(split)) {
				final Integer count = leafCounts.get(id);
				if (count == null)
					throw new IllegalArgumentException("No image count available for class " + id);
				summary.addValue(count);
			}
			stats.put(split, summary);
		}
	}

	public int getNumClasses(final Split split) {
		return (int) stats.get(split).getN();
	}

	public long getNumImages(final Split split) {
		return Math.round(stats.get(split).getSum());
	}

	/**
	 * @return the fraction of all images assigned to {@code split}
	 */
	public double getImageFraction(final Split split) {
		final double total = stats.values().stream().mapToDouble(SummaryStatistics::getSum).sum();
		return (total == 0) ? 0 : stats.get(split).getSum() / total;
	}

	public SummaryStatistics getSummary(final Split split) {
		return stats.get(split);
	}

	@Override
	public String toString() {
		final StringBuilder sb = new StringBuilder();
		for (final Split split : Split.values()) {
			final SummaryStatistics s = stats.get(split);
			sb.append(String.format("%s: %d classes, %d images (%.1f%%), images/class: mean %.1f, min %.0f, max %.0f%n",
					split, s.getN(), getNumImages(split), 100 * getImageFraction(split),
					(s.getN() == 0) ? 0d : s.getMean(), (s.getN() == 0) ? 0d : s.getMin(),
					(s.getN() == 0) ? 0d : s.getMax()));
		}
		return sb.toString();
	}
}
