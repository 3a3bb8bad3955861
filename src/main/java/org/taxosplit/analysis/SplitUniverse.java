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
import java.util.Set;

import org.taxosplit.analysis.graph.SynsetGraph;
import org.taxosplit.taxonomy.Synset;

/**
 * An independent copy of the sampling graph reserved for a single split,
 * together with the copies of the split's classes and (for validation and
 * test) of its root.
 */
public class SplitUniverse {

	private final Split split;
	private final SynsetGraph graph;
	private final Set<Synset> leaves;
	private final Synset root;

	protected SplitUniverse(final Split split, final SynsetGraph graph, final Set<Synset> leaves,
			final Synset root) {
		this.split = split;
		this.graph = graph;
		this.leaves = Collections.unmodifiableSet(leaves);
		this.root = root;
	}

	public Split getSplit() {
		return split;
	}

	/** @return the graph copy owned by this split */
	public SynsetGraph getGraph() {
		return graph;
	}

	/** @return the synsets of {@link #getGraph()} assigned to this split */
	public Set<Synset> getLeaves() {
		return leaves;
	}

	/** @return the split root in {@link #getGraph()}, or null for the train split */
	public Synset getRoot() {
		return root;
	}

}
