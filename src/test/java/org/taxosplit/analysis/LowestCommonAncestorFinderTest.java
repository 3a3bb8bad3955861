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

import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import org.taxosplit.analysis.LowestCommonAncestorFinder.LowestCommonAncestor;
import org.taxosplit.analysis.LowestCommonAncestorFinder.Mode;
import org.taxosplit.analysis.graph.SynsetGraph;
import org.taxosplit.taxonomy.Synset;

/**
 * Tests for {@link LowestCommonAncestorFinder}
 */
public class LowestCommonAncestorFinderTest {

	private SynsetGraph graph;
	private Synset root, m, n1, n2, a, b;

	/*
	 * root -> m -> {a, b}
	 * root -> n1 -> n2 -> a
	 */
	@Before
	public void setUp() {
		graph = new SynsetGraph();
		root = graph.addSynset("root", null);
		m = graph.addSynset("m", null);
		n1 = graph.addSynset("n1", null);
		n2 = graph.addSynset("n2", null);
		a = graph.addSynset("a", null);
		b = graph.addSynset("b", null);
		graph.addLink(root, m);
		graph.addLink(root, n1);
		graph.addLink(n1, n2);
		graph.addLink(n2, a);
		graph.addLink(m, a);
		graph.addLink(m, b);
	}

	@Test
	public void testLowestCommonInPaths() {
		final Synset leaf1 = new Synset("leaf1", null);
		final Synset leaf2 = new Synset("leaf2", null);
		final Synset p1 = new Synset("p1", null);
		final Synset top = new Synset("root", null);
		final LowestCommonAncestor lca = LowestCommonAncestorFinder.lowestCommonInPaths(
				Arrays.asList(leaf1, p1, top), Arrays.asList(leaf2, p1, top));
		assertSame(p1, lca.getSynset());
		assertEquals(1, lca.getHeight());
	}

	@Test
	public void testHeightIsMaxOfPositions() {
		final Synset x = new Synset("x", null);
		final Synset y = new Synset("y", null);
		final LowestCommonAncestor lca = LowestCommonAncestorFinder.lowestCommonInPaths(
				Arrays.asList(a, x, y, root), Arrays.asList(b, y, m, x, root));
		// y: max(2, 1); x: max(1, 3)
		assertSame(y, lca.getSynset());
		assertEquals(2, lca.getHeight());
	}

	@Test
	public void testTiesFavorFirstPath() {
		final Synset x = new Synset("x", null);
		final Synset y = new Synset("y", null);
		final LowestCommonAncestor lca = LowestCommonAncestorFinder.lowestCommonInPaths(
				Arrays.asList(a, x, y, root), Arrays.asList(b, y, x, root));
		assertSame(x, lca.getSynset());
		assertEquals(2, lca.getHeight());
	}

	@Test
	public void testNoCommonNode() {
		try {
			LowestCommonAncestorFinder.lowestCommonInPaths(Arrays.asList(a, m), Arrays.asList(b, n1));
			fail("Disjoint paths have no common ancestor");
		} catch (final SplitException e) {
			assertEquals(SplitException.Reason.NO_COMMON_NODE, e.getReason());
		}
	}

	@Test(expected = IllegalStateException.class)
	public void testCommonLeaf() {
		LowestCommonAncestorFinder.lowestCommonInPaths(Arrays.asList(a, m, root), Collections.singletonList(a));
	}

	@Test
	public void testFindLongest() {
		final LowestCommonAncestor lca = new LowestCommonAncestorFinder(graph).find(a, b, Mode.LONGEST);
		// longest paths: [a, n2, n1, root] and [b, m, root]
		assertSame(root, lca.getSynset());
		assertEquals(3, lca.getHeight());
	}

	@Test
	public void testFindAll() {
		final LowestCommonAncestor lca = new LowestCommonAncestorFinder(graph).find(a, b, "all");
		assertSame(m, lca.getSynset());
		assertEquals(1, lca.getHeight());
	}

	@Test
	public void testFindAllWithSeveralRoots() {
		final SynsetGraph forest = new SynsetGraph();
		final Synset r1 = forest.addSynset("r1", null);
		final Synset r2 = forest.addSynset("r2", null);
		final Synset x = forest.addSynset("x", null);
		final Synset y = forest.addSynset("y", null);
		forest.addLink(r1, x);
		forest.addLink(r2, x);
		forest.addLink(r1, y);
		final LowestCommonAncestorFinder finder = new LowestCommonAncestorFinder(forest);
		final LowestCommonAncestor lca = finder.find(x, y, Mode.LONGEST);
		assertSame(r1, lca.getSynset());
		assertEquals(1, lca.getHeight());
		try {
			// [x, r2] and [y, r1] share no synset
			finder.find(x, y, Mode.ALL);
			fail("Paths ending at different roots accepted");
		} catch (final SplitException e) {
			assertEquals(SplitException.Reason.NO_COMMON_NODE, e.getReason());
		}
	}

	@Test
	public void testModes() {
		assertEquals(Mode.LONGEST, Mode.fromString("longest"));
		assertEquals(Mode.ALL, Mode.fromString(" ALL "));
		for (final String invalid : Arrays.asList("shortest", "", null)) {
			try {
				new LowestCommonAncestorFinder(graph).find(a, b, invalid);
				fail("Invalid mode accepted: " + invalid);
			} catch (final SplitException e) {
				assertEquals(SplitException.Reason.INVALID_MODE, e.getReason());
			}
		}
	}

}
