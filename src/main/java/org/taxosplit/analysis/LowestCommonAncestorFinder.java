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

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.taxosplit.analysis.graph.SynsetGraph;
import org.taxosplit.taxonomy.Synset;

/**
 * Finds the lowest common ancestor (LCA) of two leaves of a
 * {@link SynsetGraph}. The height of a common ancestor is the maximum of its
 * positions along the two upward paths considered, so the LCA is the common
 * ancestor closest to both leaves.
 */
public class LowestCommonAncestorFinder {

	/** Which upward paths are considered when a leaf has several of them. */
	public enum Mode {
		/** Use only the longest upward path of each leaf */
		LONGEST,
		/** Use all upward paths, returning the overall lowest ancestor */
		ALL;

		public static Mode fromString(final String mode) {
			if (mode != null) {
				for (final Mode m : values()) {
					if (m.name().equalsIgnoreCase(mode.trim()))
						return m;
				}
			}
			throw new SplitException(SplitException.Reason.INVALID_MODE,
					"Invalid path mode '" + mode + "'. Must be \"longest\", or \"all\".");
		}
	}

	/** A common ancestor and its height. */
	public static class LowestCommonAncestor {

		private final Synset synset;
		private final int height;

		LowestCommonAncestor(final Synset synset, final int height) {
			this.synset = synset;
			this.height = height;
		}

		public Synset getSynset() {
			return synset;
		}

		public int getHeight() {
			return height;
		}

		@Override
		public String toString() {
			return synset + " (height " + height + ")";
		}
	}

	private final SynsetGraph graph;

	public LowestCommonAncestorFinder(final SynsetGraph graph) {
		this.graph = graph;
	}

	/**
	 * Finds the element of minimum height common to two paths. If several
	 * elements share the minimum height, the first one along {@code pathA} is
	 * returned.
	 *
	 * @param pathA the first path
	 * @param pathB the second path
	 * @return the lowest common element and its height
	 * @throws SplitException        if the paths have no common element
	 * @throws IllegalStateException if the lowest common element has height 0,
	 *                               which can only happen with a malformed graph
	 */
	public static LowestCommonAncestor lowestCommonInPaths(final List<Synset> pathA, final List<Synset> pathB) {
		Synset lowest = null;
		int minHeight = Integer.MAX_VALUE;
		for (int i = 0; i < pathA.size(); i++) {
			final Synset element = pathA.get(i);
			final int j = pathB.indexOf(element);
			if (j < 0 || pathA.indexOf(element) != i) continue;
			final int height = Math.max(i, j);
			if (height < minHeight) {
				minHeight = height;
				lowest = element;
			}
		}
		if (lowest == null) {
			throw new SplitException(SplitException.Reason.NO_COMMON_NODE,
					"No common nodes in given paths " + labels(pathA) + " and " + labels(pathB));
		}
		if (minHeight <= 0) {
			throw new IllegalStateException(
					"The lowest common ancestor between two distinct leaves cannot be a leaf: " + lowest);
		}
		return new LowestCommonAncestor(lowest, minHeight);
	}

	/**
	 * Finds the lowest common ancestor of two leaves.
	 *
	 * @param leafA the first leaf
	 * @param leafB the second leaf
	 * @param mode  either "longest" or "all"
	 * @return the lowest common ancestor and its height
	 * @throws SplitException if {@code mode} is not recognized
	 */
	public LowestCommonAncestor find(final Synset leafA, final Synset leafB, final String mode) {
		return find(leafA, leafB, Mode.fromString(mode));
	}

	/**
	 * Finds the lowest common ancestor of two leaves.
	 *
	 * @param leafA the first leaf
	 * @param leafB the second leaf
	 * @param mode  {@link Mode#LONGEST} to consider only the longest upward path
	 *              of each leaf (the first one found, if several share the
	 *              maximum length), or {@link Mode#ALL} to consider all pairs of
	 *              upward paths
	 * @return the lowest common ancestor and its height
	 * @throws SplitException with {@link SplitException.Reason#NO_COMMON_NODE}
	 *                        if the compared paths share no synset. In
	 *                        {@link Mode#ALL}, every pair of paths must share
	 *                        one: in a graph with several roots, a single pair
	 *                        ending at different roots fails the lookup even if
	 *                        other pairs meet
	 */
	public LowestCommonAncestor find(final Synset leafA, final Synset leafB, final Mode mode) {
		final List<List<Synset>> pathsA = graph.getUpwardPaths(leafA);
		final List<List<Synset>> pathsB = graph.getUpwardPaths(leafB);
		if (mode == Mode.LONGEST) {
			return lowestCommonInPaths(longest(pathsA), longest(pathsB));
		}
		LowestCommonAncestor lca = null;
		for (final List<Synset> pathA : pathsA) {
			for (final List<Synset> pathB : pathsB) {
				final LowestCommonAncestor candidate = lowestCommonInPaths(pathA, pathB);
				if (lca == null || candidate.getHeight() < lca.getHeight()) {
					lca = candidate;
				}
			}
		}
		return lca;
	}

	private static List<Synset> longest(final List<List<Synset>> paths) {
		List<Synset> longest = new ArrayList<>();
		for (final List<Synset> path : paths) {
			if (path.size() > longest.size()) longest = path;
		}
		return longest;
	}

	private static List<String> labels(final List<Synset> path) {
		return path.stream().map(Synset::label).collect(Collectors.toList());
	}

}
