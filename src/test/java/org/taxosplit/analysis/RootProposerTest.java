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
import static org.taxosplit.ToyTaxonomy.*;

import java.util.*;
import java.util.stream.Collectors;

import org.junit.Before;
import org.junit.Test;

import org.taxosplit.SplitPrefs;
import org.taxosplit.ToyTaxonomy;
import org.taxosplit.analysis.graph.SynsetGraph;
import org.taxosplit.taxonomy.Synset;

/**
 * Tests for {@link RootProposer}, using the collapsed sampling graph of the
 * toy taxonomy. Spans: entity 11, animal 7, vehicle 4, dog 3, and 2 for car,
 * cat and finch.
 */
public class RootProposerTest {

	private SynsetGraph taxonomy;
	private Map<Synset, Set<Synset>> spanning;

	@Before
	public void setUp() throws Exception {
		taxonomy = ToyTaxonomy.load();
		final Set<Synset> nodes = SplitAssigner.createSamplingGraph(taxonomy, taxonomy.getSynsets(CLASSES).values());
		spanning = new SpanningAnalyzer(taxonomy, nodes).getSpanningLeaves();
	}

	@Test
	public void testRank() {
		final List<Synset> ranked = RootProposer.rank(spanning);
		assertEquals(spanning.size(), ranked.size());
		assertEquals(Arrays.asList(ENTITY, ANIMAL, VEHICLE, DOG, FINCH, CAT, CAR),
				ranked.subList(0, 7).stream().map(Synset::id).collect(Collectors.toList()));
		for (int i = 1; i < ranked.size(); i++) {
			final int previous = spanning.get(ranked.get(i - 1)).size();
			final int current = spanning.get(ranked.get(i)).size();
			assertTrue(previous >= current);
			if (previous == current) assertTrue(ranked.get(i - 1).id().compareTo(ranked.get(i).id()) < 0);
		}
	}

	@Test
	public void testWindowIsExclusive() {
		final RootProposer proposer = new RootProposer(1, 3, 4);
		assertEquals(Collections.singletonList(taxonomy.getSynset(DOG)), proposer.getValidCandidates(spanning));
		assertEquals(Collections.singletonList(taxonomy.getSynset(VEHICLE)), proposer.getTestCandidates(spanning));
		assertTrue(new RootProposer(0, 3, 4).getValidCandidates(spanning).isEmpty());
	}

	@Test
	public void testPropose() {
		final SplitRoots roots = new RootProposer(1, 3, 4).propose(spanning);
		assertSame(taxonomy.getSynset(DOG), roots.valid());
		assertSame(taxonomy.getSynset(VEHICLE), roots.test());
		assertNull(roots.get(Split.TRAIN));
	}

	@Test
	public void testProposeDistinctRoots() {
		// finch, cat and car all span 2 leaves: ties are broken by id
		final SplitRoots roots = new RootProposer(1, 2, 2).propose(spanning);
		assertSame(taxonomy.getSynset(FINCH), roots.valid());
		assertSame(taxonomy.getSynset(CAT), roots.test());
	}

	@Test
	public void testNoCandidate() {
		try {
			new RootProposer(5, 100, 4).propose(spanning);
			fail("Empty validation window was accepted");
		} catch (final SplitException e) {
			assertEquals(SplitException.Reason.NO_CANDIDATE, e.getReason());
		}
	}

	@Test
	public void testNoDistinctTestRoot() {
		try {
			new RootProposer(1, 4, 4).propose(spanning);
			fail("Validation root was reused as test root");
		} catch (final SplitException e) {
			assertEquals(SplitException.Reason.NO_DISTINCT_TEST_ROOT, e.getReason());
		}
	}

	@Test
	public void testFromPrefs() {
		final SplitPrefs prefs = new SplitPrefs();
		prefs.setMargin(1);
		prefs.setValidSize(3);
		prefs.setTestSize(4);
		final RootProposer proposer = RootProposer.fromPrefs(prefs);
		assertEquals(1, proposer.getMargin());
		assertEquals(3, proposer.getTargetValidSize());
		assertEquals(4, proposer.getTargetTestSize());
		final RootProposer defaults = new RootProposer();
		assertEquals(50, defaults.getMargin());
		assertEquals(150, defaults.getTargetValidSize());
	}

}
