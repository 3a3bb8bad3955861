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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.taxosplit.analysis.graph.SynsetGraph;

/**
 * The result of splitting a sampling graph: one standalone graph per split,
 * the roots of the validation and test graphs, and the class assignment they
 * were built from.
 */
public class SplitGraphs {

	private final Map<Split, SynsetGraph> graphs;
	private final SplitRoots roots;
	private final ClassSplits classSplits;

	protected SplitGraphs(final Map<Split, SynsetGraph> graphs, final SplitRoots roots,
			final ClassSplits classSplits) {
		this.graphs = Collections.unmodifiableMap(new EnumMap<>(graphs));
		this.roots = roots;
		this.classSplits = classSplits;
	}

	/**
	 * @param split the split
	 * @return the isolated and collapsed sub-graph of {@code split}
	 */
	public SynsetGraph get(final Split split) {
		return graphs.get(split);
	}

	public Map<Split, SynsetGraph> getGraphs() {
		return graphs;
	}

	/**
	 * @return the validation and test roots. These are synsets of the
	 *         validation and test graphs, not of the graph the splits were
	 *         computed from
	 */
	public SplitRoots getRoots() {
		return roots;
	}

	public ClassSplits getClassSplits() {
		return classSplits;
	}

	@Override
	public String toString() {
		final StringBuilder sb = new StringBuilder();
		for (final Split split : Split.values()) {
			final SynsetGraph graph = graphs.get(split);
			sb.append(split).append(": ").append(graph.vertexSet().size()).append(" synsets, ")
					.append(graph.getLeaves().size()).append(" leaves");
			if (split != Split.TEST) sb.append("; ");
		}
		return sb.toString();
	}
}
