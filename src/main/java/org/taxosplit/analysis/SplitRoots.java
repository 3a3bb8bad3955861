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

import org.taxosplit.taxonomy.Synset;

/**
 * The synsets whose spanned leaves are assigned to the validation and test
 * splits.
 */
public class SplitRoots {

	private final Synset valid;
	private final Synset test;

	/**
	 * @param valid the root of the validation sub-graph
	 * @param test  the root of the test sub-graph
	 */
	public SplitRoots(final Synset valid, final Synset test) {
		this.valid = valid;
		this.test = test;
	}

	public Synset valid() {
		return valid;
	}

	public Synset test() {
		return test;
	}

	/**
	 * @param split either {@link Split#VALID} or {@link Split#TEST}
	 * @return the root of the specified split, or null for {@link Split#TRAIN}
	 */
	public Synset get(final Split split) {
		switch (split) {
		case VALID:
			return valid;
		case TEST:
			return test;
		default:
			return null;
		}
	}

	@Override
	public String toString() {
		return "valid: " + valid + ", test: " + test;
	}
}
