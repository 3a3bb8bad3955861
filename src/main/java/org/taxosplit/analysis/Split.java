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

/**
 * The class splits of a few-shot benchmark.
 */
public enum Split {

	TRAIN("train"), VALID("valid"), TEST("test");

	private final String key;

	Split(final String key) {
		this.key = key;
	}

	/** @return the lower-case name of this split (e.g., {@code "valid"}) */
	public String key() {
		return key;
	}

	public static Split fromString(final String key) {
		for (final Split split : values()) {
			if (split.key.equalsIgnoreCase(key.trim()) || split.name().equalsIgnoreCase(key.trim()))
				return split;
		}
		throw new IllegalArgumentException("Unrecognized split '" + key + "'. Must be 'train', 'valid' or 'test'");
	}

	@Override
	public String toString() {
		return key;
	}
}
