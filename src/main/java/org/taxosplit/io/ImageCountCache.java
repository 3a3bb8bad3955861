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

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.*;
import java.util.stream.Collectors;

import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import org.taxosplit.SplitPrefs;
import org.taxosplit.taxonomy.Synset;
import org.taxosplit.util.Logger;

/**
 * Counts the number of images of each class of a dataset, memoizing the
 * result in a JSON file. The dataset root is expected to contain one directory
 * per class, named by the class' WordNet id (e.g., {@code n15075141}), holding
 * all the images of that class.
 */
public class ImageCountCache {

	private final File datasetRoot;
	private final File cacheFile;
	private final String extension;
	private final Set<String> filesToSkip;
	private final Logger logger;

	/**
	 * @param datasetRoot the dataset root holding one directory per class
	 * @param cacheFile   the JSON file where counts are (or will be) stored. May
	 *                    be null, in which case counts are never memoized
	 * @param extension   the image file extension (case-insensitive), e.g.,
	 *                    {@code "jpeg"}
	 * @param filesToSkip file names to be excluded from counts (e.g., images
	 *                    duplicated in other datasets)
	 */
	public ImageCountCache(final File datasetRoot, final File cacheFile, final String extension,
			final Set<String> filesToSkip) {
		this.datasetRoot = datasetRoot;
		this.cacheFile = cacheFile;
		this.extension = extension.toLowerCase(Locale.ROOT);
		this.filesToSkip = (filesToSkip == null) ? Collections.emptySet() : new HashSet<>(filesToSkip);
		logger = new Logger(getClass());
	}

	public static ImageCountCache fromPrefs(final SplitPrefs prefs) {
		return new ImageCountCache(prefs.getImagesRoot(), prefs.getImagesCache(), prefs.getImagesExtension(),
				prefs.getFilesToSkip());
	}

	/**
	 * Gets the number of images of each class. If the cache file exists, its
	 * content is returned as is. Otherwise, images are counted and the result
	 * stored in the cache file.
	 *
	 * @param classes the classes to be counted
	 * @return a map of WordNet ids to number of images
	 * @throws IOException if the cache could not be read or written, or if a
	 *                     class directory could not be listed
	 */
	public Map<String, Integer> getCounts(final Collection<Synset> classes) throws IOException {
		if (cacheFile != null) {
			logger.info("Attempting to read number of leaf images from " + cacheFile + "...");
			if (cacheFile.exists()) {
				final Map<String, Integer> counts = read(cacheFile);
				logger.info("Successful.");
				return counts;
			}
		}
		logger.info("Unsuccessful. Deriving number of leaf images...");
		final Map<String, Integer> counts = count(classes);
		if (cacheFile != null) {
			write(counts, cacheFile);
		}
		return counts;
	}

	/**
	 * Counts the images of each class, ignoring the cache file.
	 *
	 * @param classes the classes to be counted
	 * @return a map of WordNet ids to number of images
	 * @throws IOException if a class directory could not be listed
	 */
	public Map<String, Integer> count(final Collection<Synset> classes) throws IOException {
		if (datasetRoot == null) {
			throw new IllegalStateException("Dataset root has not been specified");
		}
		final Map<String, Integer> counts = new TreeMap<>();
		for (final Synset synset : classes) {
			final File dir = new File(datasetRoot, synset.id());
			final String[] list = dir.list();
			if (list == null) {
				throw new IOException("Could not list files of " + dir);
			}
			final Set<String> allFiles = new TreeSet<>(Arrays.asList(list));
			final Set<String> finalFiles = allFiles.stream()
					.filter(f -> f.toLowerCase(Locale.ROOT).endsWith(extension))
					.filter(f -> !filesToSkip.contains(f))
					.collect(Collectors.toCollection(TreeSet::new));
			final Set<String> skipped = new TreeSet<>(allFiles);
			skipped.removeAll(finalFiles);
			if (!skipped.isEmpty()) {
				logger.info("Synset: " + synset.id() + ", files_skipped: " + skipped);
			}
			if (finalFiles.isEmpty()) {
				logger.warn("No images found for " + synset.id());
			}
			counts.put(synset.id(), finalFiles.size());
		}
		return counts;
	}

	/**
	 * Reads a counts file.
	 *
	 * @param file the JSON file mapping WordNet ids to counts
	 * @return the map of WordNet ids to counts
	 * @throws IOException if file could not be read or parsed, or if a count is
	 *                     not a non-negative integer
	 */
	public static Map<String, Integer> read(final File file) throws IOException {
		try (InputStream is = Files.newInputStream(file.toPath())) {
			final JSONObject json = new JSONObject(new JSONTokener(is));
			final Map<String, Integer> counts = new TreeMap<>();
			for (final String key : json.keySet()) {
				final Object value = json.get(key);
				if (!(value instanceof Integer) || (Integer) value < 0) {
					throw new IOException("Invalid image count for " + key + " in " + file + ": " + value);
				}
				counts.put(key, (Integer) value);
			}
			return counts;
		} catch (final JSONException e) {
			throw new IOException("Invalid counts file " + file + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Writes counts as a JSON object with keys sorted, so that files are
	 * reproducible.
	 *
	 * @param counts the map of WordNet ids to counts
	 * @param file   the destination file
	 * @throws IOException if file could not be written
	 */
	public static void write(final Map<String, Integer> counts, final File file) throws IOException {
		final File parent = file.getAbsoluteFile().getParentFile();
		if (parent != null && !parent.exists()) {
			Files.createDirectories(parent.toPath());
		}
		try (Writer writer = new BufferedWriter(Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8))) {
			writer.write("{");
			final Iterator<Map.Entry<String, Integer>> it = new TreeMap<>(counts).entrySet().iterator();
			while (it.hasNext()) {
				final Map.Entry<String, Integer> entry = it.next();
				writer.write("\n  " + JSONObject.quote(entry.getKey()) + ": " + entry.getValue());
				if (it.hasNext()) writer.write(",");
			}
			writer.write(counts.isEmpty() ? "}\n" : "\n}\n");
		}
	}

}
