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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;

/**
 * Class handling TaxoSplit preferences: the root-proposal window, the image
 * counting options and the lowest common ancestor mode. Preferences can be
 * read from a {@code .properties} file; keys that are absent keep their
 * default values.
 */
public class SplitPrefs {

	public static final String MARGIN = "split.margin";
	public static final String VALID_SIZE = "split.valid.size";
	public static final String TEST_SIZE = "split.test.size";
	public static final String LCA_MODE = "lca.mode";
	public static final String IMAGES_ROOT = "images.root";
	public static final String IMAGES_CACHE = "images.cache";
	public static final String IMAGES_EXTENSION = "images.extension";
	public static final String IMAGES_SKIP = "images.skip";
	public static final String DEBUG = "debug";

	public static final int DEF_MARGIN = 50;
	public static final int DEF_VALID_SIZE = 150;
	public static final int DEF_TEST_SIZE = 150;
	public static final String DEF_LCA_MODE = "longest";
	public static final String DEF_IMAGES_EXTENSION = "jpeg";

	private int margin = DEF_MARGIN;
	private int validSize = DEF_VALID_SIZE;
	private int testSize = DEF_TEST_SIZE;
	private String lcaMode = DEF_LCA_MODE;
	private File imagesRoot;
	private File imagesCache;
	private String imagesExtension = DEF_IMAGES_EXTENSION;
	private Set<String> filesToSkip = Collections.emptySet();
	private boolean debug;

	/**
	 * Reads preferences from a properties file.
	 *
	 * @param file the {@code .properties} file
	 * @return the preferences
	 * @throws IOException if file could not be read
	 */
	public static SplitPrefs load(final File file) throws IOException {
		try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
			final Properties props = new Properties();
			props.load(reader);
			return fromProperties(props);
		}
	}

	/**
	 * Reads preferences from a properties stream.
	 *
	 * @param is the stream (closed by the caller)
	 * @return the preferences
	 * @throws IOException if stream could not be read
	 */
	public static SplitPrefs load(final InputStream is) throws IOException {
		final Properties props = new Properties();
		props.load(is);
		return fromProperties(props);
	}

	public static SplitPrefs fromProperties(final Properties props) {
		final SplitPrefs prefs = new SplitPrefs();
		prefs.setMargin(getInt(props, MARGIN, DEF_MARGIN));
		prefs.setValidSize(getInt(props, VALID_SIZE, DEF_VALID_SIZE));
		prefs.setTestSize(getInt(props, TEST_SIZE, DEF_TEST_SIZE));
		prefs.setLcaMode(props.getProperty(LCA_MODE, DEF_LCA_MODE).trim());
		prefs.setImagesExtension(props.getProperty(IMAGES_EXTENSION, DEF_IMAGES_EXTENSION).trim());
		final String root = props.getProperty(IMAGES_ROOT);
		if (StringUtils.isNotBlank(root)) prefs.setImagesRoot(new File(root.trim()));
		final String cache = props.getProperty(IMAGES_CACHE);
		if (StringUtils.isNotBlank(cache)) prefs.setImagesCache(new File(cache.trim()));
		final String skip = props.getProperty(IMAGES_SKIP);
		if (StringUtils.isNotBlank(skip)) {
			prefs.setFilesToSkip(Arrays.stream(StringUtils.split(skip, ','))
					.map(String::trim).filter(StringUtils::isNotEmpty)
					.collect(Collectors.toCollection(LinkedHashSet::new)));
		}
		prefs.setDebug(Boolean.parseBoolean(props.getProperty(DEBUG, "false").trim()));
		return prefs;
	}

	private static int getInt(final Properties props, final String key, final int defaultValue) {
		final String value = props.getProperty(key);
		if (StringUtils.isBlank(value)) return defaultValue;
		try {
			return Integer.parseInt(value.trim());
		} catch (final NumberFormatException e) {
			throw new IllegalArgumentException("Invalid integer for '" + key + "': " + value, e);
		}
	}

	public int getMargin() {
		return margin;
	}

	public void setMargin(final int margin) {
		if (margin < 0) throw new IllegalArgumentException("Margin cannot be negative");
		this.margin = margin;
	}

	public int getValidSize() {
		return validSize;
	}

	public void setValidSize(final int validSize) {
		this.validSize = validSize;
	}

	public int getTestSize() {
		return testSize;
	}

	public void setTestSize(final int testSize) {
		this.testSize = testSize;
	}

	public String getLcaMode() {
		return lcaMode;
	}

	public void setLcaMode(final String lcaMode) {
		this.lcaMode = lcaMode;
	}

	public File getImagesRoot() {
		return imagesRoot;
	}

	public void setImagesRoot(final File imagesRoot) {
		this.imagesRoot = imagesRoot;
	}

	public File getImagesCache() {
		return imagesCache;
	}

	public void setImagesCache(final File imagesCache) {
		this.imagesCache = imagesCache;
	}

	public String getImagesExtension() {
		return imagesExtension;
	}

	public void setImagesExtension(final String imagesExtension) {
		this.imagesExtension = imagesExtension;
	}

	public Set<String> getFilesToSkip() {
		return filesToSkip;
	}

	public void setFilesToSkip(final Set<String> filesToSkip) {
		this.filesToSkip = (filesToSkip == null) ? Collections.emptySet() : filesToSkip;
	}

	public boolean isDebug() {
		return debug;
	}

	public void setDebug(final boolean debug) {
		this.debug = debug;
		TaxoSplitUtils.setDebugMode(debug);
	}

}
