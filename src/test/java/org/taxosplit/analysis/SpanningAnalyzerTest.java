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

import static org.junit.Assert.*;

import java.util.*;

import org.junit.Before;
import org.junit.Test;

import org.taxosplit.ToyTaxonomy;
import org.taxosplit.analysis.graph.SynsetGraph;
import org.taxosplit.taxonomy.Synset;

/**
 * Tests for {@link SpanningAnalyzer}
 */
public class SpanningAnalyzerTest {

	private SynsetGraph graph;
	private Synset a, b, c, d, e;

	@Before
	public void setUp() {
		graph = new SynsetGraph();
		a = graph.addSynset("A", null);
		b = graph.addSynset("B", null);
		c = graph.addSynset("C", null);
		d = graph.addSynset("D", null);
		e = graph.addSynset("E", null);
		graph.addLink(a, b);
		graph.addLink(a, c);
		graph.addLink(b, d);
		graph.addLink(b, e);
	}

	@Test
	public void testSpanningLeaves() {
		final SpanningAnalyzer analyzer = new SpanningAnalyzer(graph);
		assertEquals(Arrays.asList(c, d, e), analyzer.getLeaves());
		final Map<Synset, Set<Synset>> spanning = analyzer.getSpanningLeaves();
		assertEquals(5, spanning.size());
		assertEquals(Arrays.asList(c, d, e), new ArrayList<>(spanning.get(a)));
		assertEquals(new HashSet<>(Arrays.asList(d, e)), spanning.get(b));
		assertEquals(Collections.singleton(c), spanning.get(c));
		assertSame(spanning, analyzer.getSpanningLeaves());
	}

	@Test
	public void testSpanningLeavesOfSamplingGraph() throws Exception {
		final SynsetGraph taxonomy = ToyTaxonomy.load();
		final Set<Synset> nodes = SplitAssigner.createSamplingGraph(taxonomy,
				taxonomy.getSynsets(ToyTaxonomy.CLASSES).values());
		final SpanningAnalyzer analyzer = new SpanningAnalyzer(taxonomy, nodes);
		final Map<Synset, Set<Synset>> spanning = analyzer.getSpanningLeaves();
		assertEquals(nodes, spanning.keySet());
		assertEquals(11, spanning.get(taxonomy.getSynset(ToyTaxonomy.ENTITY)).size());
		assertEquals(7, spanning.get(taxonomy.getSynset(ToyTaxonomy.ANIMAL)).size());
		assertEquals(4, spanning.get(taxonomy.getSynset(ToyTaxonomy.VEHICLE)).size());
		for (final Synset node : nodes) {
			final List<Synset> children = taxonomy.getChildren(node);
			if (children.isEmpty()) {
				assertEquals(Collections.singleton(node), spanning.get(node));
				continue;
			}
			final Set<Synset> union = new HashSet<>();
			children.forEach(child -> union.addAll(spanning.get(child)));
			assertEquals(union, spanning.get(node));
		}
	}

	@Test
	public void testSpanningCounts() {
		final SpanningAnalyzer analyzer = new SpanningAnalyzer(graph);
		final Map<String, Integer> leafCounts = new HashMap<>();
		leafCounts.put("C", 5);
		leafCounts.put("D", 2);
		leafCounts.put("E", 3);
		final Map<Synset, Integer> counts = analyzer.getSpanningCounts(leafCounts);
		assertEquals(10, (int) counts.get(a));
		assertEquals(5, (int) counts.get(b));
		assertEquals(2, (int) counts.get(d));
		assertEquals(10d, graph.getVertexValue(a), 0);
		assertTrue(graph.hasVertexValue(e));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSpanningCountsWithMissingLeaf() {
		new SpanningAnalyzer(graph).getSpanningCounts(Collections.singletonMap("C", 5));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testForeignNodes() {
		new SpanningAnalyzer(graph, Collections.singleton(new Synset("A", null)));
	}

}
