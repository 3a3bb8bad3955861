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
import java.util.stream.Collectors;

import org.taxosplit.SplitPrefs;
import org.taxosplit.taxonomy.Synset;
import org.taxosplit.util.Logger;

/**
 * Proposes the roots of the validation and test sub-graphs. Each root is the
 * synset spanning the largest number of leaves that is still within the
 * allowed window of its split, i.e., the desired number of classes for that
 * split +/- a margin. A margin is required because there may be no synset
 * spanning exactly the desired number of classes.
 */
public class RootProposer {

	private final int margin;
	private final int targetValidSize;
	private final int targetTestSize;
	private final Logger logger;

	/**
	 * @param margin          the number of additional or fewer leaves that a
	 *                        split root may span relative to its target size
	 * @param targetValidSize the desired number of validation classes
	 * @param targetTestSize  the desired number of test classes
	 */
	public RootProposer(final int margin, final int targetValidSize, final int targetTestSize) {
		this.margin = margin;
		this.targetValidSize = targetValidSize;
		this.targetTestSize = targetTestSize;
		logger = new Logger(getClass());
	}

	/**
	 * Creates a proposer with the default window: 150 +/- 50 classes for both
	 * validation and test (ca. 15% of the 1000 ILSVRC-2012 classes).
	 */
	public RootProposer() {
		this(SplitPrefs.DEF_MARGIN, SplitPrefs.DEF_VALID_SIZE, SplitPrefs.DEF_TEST_SIZE);
	}

	public static RootProposer fromPrefs(final SplitPrefs prefs) {
		return new RootProposer(prefs.getMargin(), prefs.getValidSize(), prefs.getTestSize());
	}

	/**
	 * Ranks synsets by the number of leaves they span (descending), breaking ties
	 * by id (ascending).
	 *
	 * @param spanningLeaves a map of synsets to the leaves they span
	 * @return the ranked synsets
	 */
	public static List<Synset> rank(final Map<Synset, Set<Synset>> spanningLeaves) {
		final Comparator<Synset> bySpan = Comparator.comparingInt(s -> spanningLeaves.get(s).size());
		return spanningLeaves.keySet().stream()
				.sorted(bySpan.reversed().thenComparing(Synset::id))
				.collect(Collectors.toList());
	}

	/**
	 * @return the ranked synsets whose span is strictly within
	 *         {@code targetValidSize +/- margin}
	 */
	public List<Synset> getValidCandidates(final Map<Synset, Set<Synset>> spanningLeaves) {
		return getCandidates(spanningLeaves, targetValidSize);
	}

	/**
	 * @return the ranked synsets whose span is strictly within
	 *         {@code targetTestSize +/- margin}
	 */
	public List<Synset> getTestCandidates(final Map<Synset, Set<Synset>> spanningLeaves) {
		return getCandidates(spanningLeaves, targetTestSize);
	}

	private List<Synset> getCandidates(final Map<Synset, Set<Synset>> spanningLeaves, final int target) {
		final int low = target - margin;
		final int high = target + margin;
		return rank(spanningLeaves).stream().filter(s -> {
			final int numLeaves = spanningLeaves.get(s).size();
			return low < numLeaves && numLeaves < high;
		}).collect(Collectors.toList());
	}

	/**
	 * Proposes the validation and test roots: the highest ranked validation
	 * candidate, and the highest ranked test candidate that differs from it.
	 *
	 * @param spanningLeaves a map of synsets to the leaves they span
	 * @return the proposed roots
	 * @throws SplitException if no candidates exist for either split, or if the
	 *                        only test candidate is the validation root
	 */
	public SplitRoots propose(final Map<Synset, Set<Synset>> spanningLeaves) {
		final List<Synset> validCandidates = getValidCandidates(spanningLeaves);
		final List<Synset> testCandidates = getTestCandidates(spanningLeaves);
		if (validCandidates.isEmpty() || testCandidates.isEmpty()) {
			throw new SplitException(SplitException.Reason.NO_CANDIDATE,
					"Found no root candidates. Try a different margin (currently " + margin + ").");
		}
		for (final Synset candidate : validCandidates) {
			logger.debug("Candidate " + candidate + " with " + spanningLeaves.get(candidate).size()
					+ " spanning leaves");
		}
		final Synset validRoot = validCandidates.get(0);
		final Synset testRoot = testCandidates.stream().filter(s -> s != validRoot).findFirst()
				.orElseThrow(() -> new SplitException(SplitException.Reason.NO_DISTINCT_TEST_ROOT,
						"No candidates for test root. Try a different margin (currently " + margin + ")."));
		logger.info("Proposed roots: valid " + validRoot + ", test " + testRoot);
		return new SplitRoots(validRoot, testRoot);
	}

	public int getMargin() {
		return margin;
	}

	public int getTargetValidSize() {
		return targetValidSize;
	}

	public int getTargetTestSize() {
		return targetTestSize;
	}

}
