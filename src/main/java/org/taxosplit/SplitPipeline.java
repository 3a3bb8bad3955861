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
package org.taxosplit;

import java.io.IOException;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.taxosplit.analysis.LowestCommonAncestorFinder;
import org.taxosplit.analysis.RootProposer;
import org.taxosplit.analysis.SpanningAnalyzer;
import org.taxosplit.analysis.SplitAssigner;
import org.taxosplit.analysis.SplitGraphs;
import org.taxosplit.analysis.SplitRoots;
import org.taxosplit.analysis.SplitStatistics;
import org.taxosplit.analysis.graph.SynsetGraph;
import org.taxosplit.io.ImageCountCache;
import org.taxosplit.taxonomy.Synset;
import org.taxosplit.util.Logger;

/**
 * Splits the classes of a dataset into train, validation and test graphs:
 * <ol>
 * <li>image counts of the classes are obtained (if a dataset root or a cache
 * is configured)</li>
 * <li>the sampling graph (classes and their ancestors) is carved out of the
 * full taxonomy, isolated and collapsed</li>
 * <li>the leaves spanned by each synset are computed and split roots
 * proposed (unless specified)</li>
 * <li>classes are assigned to splits and each split's graph is built on its
 * own copy of the sampling graph</li>
 * </ol>
 */
public class SplitPipeline {

	private final SplitPrefs prefs;
	private final Logger logger;
	private Map<String, Integer> imageCounts;
	private SpanningAnalyzer analyzer;
	private SplitStatistics statistics;

	public SplitPipeline(final SplitPrefs prefs) {
		this.prefs = prefs;
		logger = new Logger(getClass());
	}

	public SplitPipeline() {
		this(new SplitPrefs());
	}

	/**
	 * Runs the pipeline.
	 *
	 * @param taxonomy the full taxonomy. It is modified in place: the sampling
	 *                 graph is isolated and collapsed within it
	 * @param classIds the WordNet ids of the dataset classes
	 * @param roots    the validation and test roots (synsets of
	 *                 {@code taxonomy}), or null to have them proposed
	 * @return the split graphs
	 * @throws IOException if image counts could not be read or computed, or if
	 *                     they do not cover every class. The taxonomy is left
	 *                     untouched in that case
	 */
	public SplitGraphs run(final SynsetGraph taxonomy, final Collection<String> classIds, final SplitRoots roots)
			throws IOException {
		final long start = System.currentTimeMillis();
		imageCounts = null;
		analyzer = null;
		statistics = null;
		final Collection<Synset> classes = taxonomy.getSynsets(classIds).values();
		if (prefs.getImagesRoot() != null || prefs.getImagesCache() != null) {
			final Map<String, Integer> counts = ImageCountCache.fromPrefs(prefs).getCounts(classes);
			final SortedSet<String> uncounted = new TreeSet<>();
			for (final Synset synset : classes) {
				if (!counts.containsKey(synset.id())) uncounted.add(synset.id());
			}
			if (!uncounted.isEmpty()) {
				throw new IOException("No image counts for classes " + uncounted
						+ ((prefs.getImagesCache() == null) ? "" : ". Stale cache file " + prefs.getImagesCache() + "?"));
			}
			imageCounts = counts;
		}
		final Set<Synset> samplingGraph = SplitAssigner.createSamplingGraph(taxonomy, classes);
		logger.info("Sampling graph: " + samplingGraph.size() + " synsets, " + classes.size() + " classes");
		analyzer = new SpanningAnalyzer(taxonomy, samplingGraph);
		if (imageCounts != null) {
			analyzer.getSpanningCounts(imageCounts);
		}
		final SplitAssigner assigner = new SplitAssigner(RootProposer.fromPrefs(prefs));
		final SplitGraphs splits = assigner.buildSplits(analyzer, roots);
		if (imageCounts != null) {
			statistics = new SplitStatistics(splits.getClassSplits(), imageCounts);
			logger.info("Split statistics:\n" + statistics);
		}
		logger.info("Done (" + TaxoSplitUtils.getElapsedTime(start) + "). " + splits);
		return splits;
	}

	/**
	 * Runs the pipeline with proposed roots.
	 *
	 * @see #run(SynsetGraph, Collection, SplitRoots)
	 */
	public SplitGraphs run(final SynsetGraph taxonomy, final Collection<String> classIds) throws IOException {
		return run(taxonomy, classIds, null);
	}

	/**
	 * @return the lowest common ancestor of two leaves of {@code graph}, using
	 *         the preferred path mode
	 */
	public LowestCommonAncestorFinder.LowestCommonAncestor getLowestCommonAncestor(final SynsetGraph graph,
			final Synset leafA, final Synset leafB) {
		return new LowestCommonAncestorFinder(graph).find(leafA, leafB, prefs.getLcaMode());
	}

	/** @return the image counts of the last successful run, or null if not available */
	public Map<String, Integer> getImageCounts() {
		return imageCounts;
	}

	/** @return the spanning analyzer of the last run's sampling graph */
	public SpanningAnalyzer getAnalyzer() {
		return analyzer;
	}

	/** @return the statistics of the last successful run, or null if image counts were not available */
	public SplitStatistics getStatistics() {
		return statistics;
	}

}
