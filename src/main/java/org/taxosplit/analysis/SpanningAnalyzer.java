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

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.DepthFirstIterator;

import org.taxosplit.analysis.graph.SynsetGraph;
import org.taxosplit.taxonomy.Synset;

/**
 * Computes the leaves "spanned" by each synset of a sampling graph, i.e., the
 * leaf synsets reachable from it through repeated child traversal. The number
 * of spanned leaves estimates how general a concept is: synsets representing
 * broad concepts span more leaves.
 */
public class SpanningAnalyzer {

	private final SynsetGraph graph;
	private final Set<Synset> nodes;
	private Map<Synset, Set<Synset>> spanningLeaves;

	/**
	 * @param graph the graph holding {@code nodes}
	 * @param nodes the (isolated) node set of the sampling graph
	 */
	public SpanningAnalyzer(final SynsetGraph graph, final Collection<Synset> nodes) {
		this.graph = graph;
		this.nodes = new LinkedHashSet<>(nodes);
		for (final Synset node : this.nodes) {
			if (!graph.containsVertex(node))
				throw new IllegalArgumentException("Synset not contained in graph: " + node);
		}
	}

	/**
	 * @param graph the graph whose synsets are analyzed in full
	 */
	public SpanningAnalyzer(final SynsetGraph graph) {
		this(graph, graph.vertexSet());
	}

	public SynsetGraph getGraph() {
		return graph;
	}

	public Set<Synset> getNodes() {
		return Collections.unmodifiableSet(nodes);
	}

	/**
	 * @return the synsets of the node set without children, sorted by id
	 */
	public List<Synset> getLeaves() {
		return graph.getLeaves(nodes);
	}

	/**
	 * Gets the leaves spanned by every synset of the node set. A leaf spans
	 * exactly one leaf: itself.
	 *
	 * @return a map of synsets (sorted by id) to the set of leaves (sorted by
	 *         id) they span
	 */
	public Map<Synset, Set<Synset>> getSpanningLeaves() {
		if (spanningLeaves != null)
			return spanningLeaves;
		final Set<Synset> leaves = new HashSet<>(getLeaves());
		final Map<Synset, Set<Synset>> map = new LinkedHashMap<>();
		for (final Synset node : sorted(nodes)) {
			final List<Synset> spanned = new ArrayList<>();
			final DepthFirstIterator<Synset, DefaultEdge> iter = new DepthFirstIterator<>(graph, node);
			while (iter.hasNext()) {
				final Synset descendant = iter.next();
				if (leaves.contains(descendant))
					spanned.add(descendant);
			}
			map.put(node, new LinkedHashSet<>(sorted(spanned)));
		}
		spanningLeaves = Collections.unmodifiableMap(map);
		return spanningLeaves;
	}

	/**
	 * Sums external per-leaf counts (e.g., number of images) over the leaves
	 * spanned by each synset. The sums are also assigned as vertex values of the
	 * graph.
	 *
	 * @param leafCounts a map of leaf WordNet ids to counts
	 * @return a map of synsets to the summed counts of their spanned leaves
	 * @throws IllegalArgumentException if a spanned leaf has no count
	 */
	public Map<Synset, Integer> getSpanningCounts(final Map<String, Integer> leafCounts) {
		final Map<Synset, Integer> counts = getSpanningCounts(getSpanningLeaves(), leafCounts);
		counts.forEach((synset, count) -> graph.setVertexValue(synset, count));
		return counts;
	}

	/**
	 * Sums external per-leaf counts over the leaves spanned by each synset.
	 *
	 * @param spanningLeaves a map of synsets to the leaves they span
	 * @param leafCounts     a map of leaf WordNet ids to counts
	 * @return a map of synsets to the summed counts of their spanned leaves
	 * @throws IllegalArgumentException if a spanned leaf has no count
	 */
	public static Map<Synset, Integer> getSpanningCounts(final Map<Synset, Set<Synset>> spanningLeaves,
			final Map<String, Integer> leafCounts) {
		final Map<Synset, Integer> counts = new LinkedHashMap<>();
		for (final Map.Entry<Synset, Set<Synset>> entry : spanningLeaves.entrySet()) {
			int sum = 0;
			for (final Synset leaf : entry.getValue()) {
				final Integer count = leafCounts.get(leaf.id());
				if (count == null)
					throw new IllegalArgumentException("No count available for leaf " + leaf);
				sum += count;
			}
			counts.put(entry.getKey(), sum);
		}
		return counts;
	}

	private static List<Synset> sorted(final Collection<Synset> synsets) {
		return synsets.stream().sorted(Synset.comparator()).collect(Collectors.toList());
	}

}
