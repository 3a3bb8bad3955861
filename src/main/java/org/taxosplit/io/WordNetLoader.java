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
package org.taxosplit.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.*;

import org.apache.commons.lang3.StringUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import org.taxosplit.TaxoSplitUtils;
import org.taxosplit.analysis.graph.SynsetGraph;
import org.taxosplit.taxonomy.Synset;

/**
 * Loads WordNet taxonomies into {@link SynsetGraph}s. Two formats are
 * supported:
 * <ul>
 * <li>ImageNet-style text files: a relations file listing one
 * {@code parent child} pair of WordNet ids per line (e.g.,
 * {@code wordnet.is_a.txt}) and a words file listing one
 * {@code id<TAB>label} pair per line (e.g., {@code words.txt})</li>
 * <li>JSON: an array of records of the form
 * {@code {"id": ..., "label": ..., "parents": [...], "children": [...]}}</li>
 * </ul>
 * Loaded graphs are checked for cycles.
 */
public class WordNetLoader {

	private WordNetLoader() {
	}

	/**
	 * Loads a taxonomy from ImageNet-style relation and words files.
	 *
	 * @param isAFile   the relations file ({@code parent child} per line)
	 * @param wordsFile the words file ({@code id<TAB>label} per line). May be
	 *                  null, in which case ids are used as labels
	 * @return the taxonomy graph
	 * @throws IOException              if a file could not be read
	 * @throws IllegalArgumentException if a line is malformed or the taxonomy
	 *                                  is cyclic
	 */
	public static SynsetGraph fromText(final File isAFile, final File wordsFile) throws IOException {
		final Map<String, String> words = (wordsFile == null) ? Collections.emptyMap()
				: readWords(Files.newInputStream(wordsFile.toPath()));
		try (InputStream is = Files.newInputStream(isAFile.toPath())) {
			return fromText(is, words);
		}
	}

	/**
	 * Loads a taxonomy from a relations stream.
	 *
	 * @param isAStream the relations stream ({@code parent child} per line)
	 * @param words     a map of WordNet ids to labels
	 * @return the taxonomy graph
	 * @throws IOException if stream could not be read
	 */
	public static SynsetGraph fromText(final InputStream isAStream, final Map<String, String> words)
			throws IOException {
		final SynsetGraph graph = new SynsetGraph();
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(isAStream, StandardCharsets.UTF_8))) {
			String line;
			int lineNumber = 0;
			while ((line = reader.readLine()) != null) {
				lineNumber++;
				if (StringUtils.isBlank(line) || line.trim().startsWith("#")) continue;
				final String[] tokens = StringUtils.split(line.trim());
				if (tokens.length != 2) {
					throw new IllegalArgumentException("Malformed relation at line " + lineNumber + ": " + line);
				}
				graph.addLink(graph.addSynset(tokens[0], words.get(tokens[0])),
						graph.addSynset(tokens[1], words.get(tokens[1])));
			}
		}
		return validated(graph);
	}

	/**
	 * Reads a words file.
	 *
	 * @param is the stream of the words file ({@code id<TAB>label} per line). It
	 *           is closed after reading
	 * @return a map of WordNet ids to labels
	 * @throws IOException if stream could not be read
	 */
	public static Map<String, String> readWords(final InputStream is) throws IOException {
		final Map<String, String> words = new HashMap<>();
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				final int tab = line.indexOf('\t');
				if (tab < 1) continue;
				words.put(line.substring(0, tab).trim(), line.substring(tab + 1).trim());
			}
		}
		return words;
	}

	/**
	 * Loads a taxonomy from a JSON file.
	 *
	 * @param jsonFile the JSON file
	 * @return the taxonomy graph
	 * @throws IOException if file could not be read
	 */
	public static SynsetGraph fromJSON(final File jsonFile) throws IOException {
		try (InputStream is = Files.newInputStream(jsonFile.toPath())) {
			return fromJSON(is);
		}
	}

	/**
	 * Loads a taxonomy from a JSON resource available to the context class
	 * loader.
	 *
	 * @param resourcePath the resource path, e.g., {@code taxonomy/toy.json}
	 * @return the taxonomy graph
	 * @throws IOException if resource could not be found or read
	 */
	public static SynsetGraph fromResource(final String resourcePath) throws IOException {
		final ClassLoader classloader = Thread.currentThread().getContextClassLoader();
		try (InputStream is = classloader.getResourceAsStream(resourcePath)) {
			if (is == null) throw new IOException("Resource not found: " + resourcePath);
			return fromJSON(is);
		}
	}

	/**
	 * Loads a taxonomy from a JSON stream. Parent and children lists of all
	 * records are merged, so each link needs to be listed only once.
	 *
	 * @param is the JSON stream (closed by the caller)
	 * @return the taxonomy graph
	 * @throws IllegalArgumentException if the JSON is malformed, if a record
	 *                                  references an unknown id, or if the
	 *                                  taxonomy is cyclic
	 */
	public static SynsetGraph fromJSON(final InputStream is) {
		final JSONArray records;
		try {
			records = new JSONArray(new JSONTokener(is));
		} catch (final JSONException e) {
			throw new IllegalArgumentException("Invalid taxonomy JSON: " + e.getMessage(), e);
		}
		final SynsetGraph graph = new SynsetGraph();
		for (int i = 0; i < records.length(); i++) {
			final JSONObject record = records.getJSONObject(i);
			final String id = record.getString("id");
			if (graph.getSynset(id) != null) {
				throw new IllegalArgumentException("Duplicate synset id: " + id);
			}
			graph.addSynset(id, record.optString("label", id));
		}
		for (int i = 0; i < records.length(); i++) {
			final JSONObject record = records.getJSONObject(i);
			final String id = record.getString("id");
			for (final String parentId : getIds(record, "parents")) {
				graph.addLink(lookup(graph, parentId, id), graph.getSynset(id));
			}
			for (final String childId : getIds(record, "children")) {
				graph.addLink(graph.getSynset(id), lookup(graph, childId, id));
			}
		}
		return validated(graph);
	}

	private static List<String> getIds(final JSONObject record, final String key) {
		final JSONArray array = record.optJSONArray(key);
		if (array == null) return Collections.emptyList();
		final List<String> ids = new ArrayList<>(array.length());
		for (int i = 0; i < array.length(); i++) {
			ids.add(array.getString(i));
		}
		return ids;
	}

	private static Synset lookup(final SynsetGraph graph, final String id,
			final String referrer) {
		final Synset synset = graph.getSynset(id);
		if (synset == null) {
			throw new IllegalArgumentException("Synset " + referrer + " references unknown id " + id);
		}
		return synset;
	}

	private static SynsetGraph validated(final SynsetGraph graph) {
		try {
			graph.validate();
		} catch (final IllegalStateException e) {
			TaxoSplitUtils.error("Invalid taxonomy", e);
			throw new IllegalArgumentException(e.getMessage(), e);
		}
		TaxoSplitUtils.log("Loaded taxonomy: " + graph.vertexSet().size() + " synsets, "
				+ graph.edgeSet().size() + " links");
		return graph;
	}

}
