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

import org.taxosplit.TaxoSplitUtils;
import org.taxosplit.analysis.graph.SynsetGraph;
import org.taxosplit.taxonomy.Synset;
import org.taxosplit.util.Logger;

/**
 * Splits the classes (leaves) of a sampling graph into train, validation and
 * test. All classes spanned by the validation root are assigned to the
 * validation split, all classes spanned by the test root to the test split,
 * and the remaining ones to the train split. Each split is then represented
 * as its own sub-graph, built from an independent copy of the sampling graph:
 * the leaves of a split's sub-graph are the classes assigned to it, and its
 * internal nodes are (a collapsed version of) their ancestors.
 */
public class SplitAssigner {

	private final RootProposer proposer;
	private final Logger logger;

	/**
	 * @param proposer the proposer used when split roots are not specified
	 */
	public SplitAssigner(final RootProposer proposer) {
		this.proposer = proposer;
		logger = new Logger(getClass());
	}

	public SplitAssigner() {
		this(new RootProposer());
	}

	/**
	 * Creates a sampling graph: a DAG containing only {@code leaves} and their
	 * ancestors. The node set is isolated from the rest of {@code graph} and
	 * collapsed, so that no synset of the sampling graph has a single child.
	 *
	 * @param graph  the graph holding {@code leaves}. It is modified in place
	 * @param leaves the synsets that are to become the leaves of the sampling
	 *               graph
	 * @param root   if not null, only ancestors that are {@code root} or
	 *               descendants of it are kept, so that {@code root} is the top
	 *               of the sampling graph
	 * @return the synsets of the sampling graph
	 */
	public static Set<Synset> createSamplingGraph(final SynsetGraph graph, final Collection<Synset> leaves,
			final Synset root) {
		final Set<Synset> nodes = graph.getAncestors(leaves);
		if (root != null) {
			nodes.removeIf(n -> n != root && !graph.isDescendant(n, root));
		}
		nodes.addAll(leaves);
		graph.isolate(nodes);
		return graph.collapse(nodes);
	}

	/**
	 * Creates an unrooted sampling graph.
	 *
	 * @see #createSamplingGraph(SynsetGraph, Collection, Synset)
	 */
	public static Set<Synset> createSamplingGraph(final SynsetGraph graph, final Collection<Synset> leaves) {
		return createSamplingGraph(graph, leaves, null);
	}

	/**
	 * Assigns classes to splits. Leaves spanned by both roots are sorted by id
	 * and assigned alternately to validation and test, starting with
	 * validation.
	 *
	 * @param spanningLeaves a map of the synsets of the sampling graph to the
	 *                       leaves they span
	 * @param roots          the validation and test roots. If null, roots are
	 *                       proposed by this assigner's {@link RootProposer}
	 * @return the class assignment
	 * @throws SplitException if a specified root is null or not part of
	 *                        {@code spanningLeaves}, or if roots could not be
	 *                        proposed
	 */
	public ClassSplits getClassSplits(final Map<Synset, Set<Synset>> spanningLeaves, final SplitRoots roots) {
		final SplitRoots chosen = resolveRoots(spanningLeaves, roots);
		final SortedSet<String> validIds = ids(spanningLeaves.get(chosen.valid()));
		final SortedSet<String> testIds = ids(spanningLeaves.get(chosen.test()));

		final List<String> overlap = new ArrayList<>(validIds);
		overlap.retainAll(testIds);
		logger.info("Size of overlap: " + overlap.size() + " leaves");
		boolean assignToValid = true;
		for (final String id : overlap) {
			if (assignToValid)
				testIds.remove(id);
			else
				validIds.remove(id);
			assignToValid = !assignToValid;
		}

		final SortedSet<String> trainIds = new TreeSet<>();
		for (final Map.Entry<Synset, Set<Synset>> entry : spanningLeaves.entrySet()) {
			final Synset node = entry.getKey();
			if (!entry.getValue().contains(node)) continue; // only leaves span themselves
			if (!validIds.contains(node.id()) && !testIds.contains(node.id()))
				trainIds.add(node.id());
		}
		final ClassSplits splits = new ClassSplits(trainIds, validIds, testIds);
		logger.info("Class splits: " + splits);
		return splits;
	}

	/**
	 * Creates three independent copies of the sampling graph, one per split. A
	 * split's copy can be modified without affecting the copies of other splits.
	 *
	 * @param analyzer    the analyzer of the sampling graph
	 * @param classSplits the class assignment
	 * @param roots       the validation and test roots (synsets of the
	 *                    analyzer's graph)
	 * @return the copies, with the synsets corresponding to each split's classes
	 *         and roots
	 */
	public Map<Split, SplitUniverse> cloneSplitUniverses(final SpanningAnalyzer analyzer,
			final ClassSplits classSplits, final SplitRoots roots) {
		final SplitRoots chosen = resolveRoots(analyzer.getSpanningLeaves(), roots);
		final Set<Synset> nodes = analyzer.getSpanningLeaves().keySet();
		final Map<Split, SplitUniverse> universes = new EnumMap<>(Split.class);
		for (final Split split : Split.values()) {
			final SynsetGraph copy = analyzer.getGraph().copy(nodes);
			final Set<Synset> leaves = new LinkedHashSet<>(copy.getSynsets(classSplits.get(split)).values());
			final Synset rootInOriginal = chosen.get(split);
			final Synset root = (rootInOriginal == null) ? null : copy.getSynset(rootInOriginal.id());
			universes.put(split, new SplitUniverse(split, copy, leaves, root));
		}
		return universes;
	}

	/**
	 * Splits the sampling graph into train, validation and test sub-graphs.
	 *
	 * @param analyzer the analyzer of the sampling graph
	 * @param roots    the validation and test roots. If null, roots are
	 *                 proposed by this assigner's {@link RootProposer}
	 * @return the sub-graph of each split. The graph of {@code analyzer} is not
	 *         modified
	 */
	public SplitGraphs buildSplits(final SpanningAnalyzer analyzer, final SplitRoots roots) {
		final long start = System.currentTimeMillis();
		final Map<Synset, Set<Synset>> spanningLeaves = analyzer.getSpanningLeaves();
		final SplitRoots chosen = resolveRoots(spanningLeaves, roots);
		final ClassSplits classSplits = getClassSplits(spanningLeaves, chosen);
		final Map<Split, SplitUniverse> universes = cloneSplitUniverses(analyzer, classSplits, chosen);
		final Map<Split, SynsetGraph> graphs = new EnumMap<>(Split.class);
		for (final SplitUniverse universe : universes.values()) {
			final SynsetGraph graph = universe.getGraph();
			final Set<Synset> nodes = createSamplingGraph(graph, universe.getLeaves(), universe.getRoot());
			graph.retainAll(nodes);
			graphs.put(universe.getSplit(), graph);
			TaxoSplitUtils.log(universe.getSplit() + " graph: " + nodes.size() + " synsets");
		}
		final SplitRoots splitRoots = new SplitRoots(universes.get(Split.VALID).getRoot(),
				universes.get(Split.TEST).getRoot());
		final SplitGraphs result = new SplitGraphs(graphs, splitRoots, classSplits);
		logger.debug("Splits built in " + TaxoSplitUtils.getElapsedTime(start) + ": " + result);
		return result;
	}

	/**
	 * Splits the sampling graph using proposed roots.
	 *
	 * @see #buildSplits(SpanningAnalyzer, SplitRoots)
	 */
	public SplitGraphs buildSplits(final SpanningAnalyzer analyzer) {
		return buildSplits(analyzer, null);
	}

	private SplitRoots resolveRoots(final Map<Synset, Set<Synset>> spanningLeaves, final SplitRoots roots) {
		if (roots == null) {
			return proposer.propose(spanningLeaves);
		}
		for (final Split split : new Split[] { Split.VALID, Split.TEST }) {
			final Synset root = roots.get(split);
			if (root == null) {
				throw new SplitException(SplitException.Reason.INVALID_ROOT, "A root cannot be null (" + split + ")");
			}
			if (!spanningLeaves.containsKey(root)) {
				throw new SplitException(SplitException.Reason.INVALID_ROOT,
						"Root " + root + " (" + split + ") is not part of the sampling graph");
			}
		}
		return roots;
	}

	private static SortedSet<String> ids(final Collection<Synset> synsets) {
		final SortedSet<String> ids = new TreeSet<>();
		synsets.forEach(s -> ids.add(s.id()));
		return ids;
	}

}
