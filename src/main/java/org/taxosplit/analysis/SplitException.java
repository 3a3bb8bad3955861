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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Signals that class splits (or one of the graph queries they rely on) could
 * not be computed from the given inputs. These failures are deterministic:
 * retrying with the same inputs fails the same way.
 */
public class SplitException extends RuntimeException {

	private static final long serialVersionUID = -2370469843115206527L;

	/** The reason a split computation failed. */
	public enum Reason {
		/** No synset spans a number of leaves within the margin window */
		NO_CANDIDATE,
		/** Every test-root candidate is the chosen validation root */
		NO_DISTINCT_TEST_ROOT,
		/** A user-supplied split root is missing */
		INVALID_ROOT,
		/** Unknown lowest common ancestor mode */
		INVALID_MODE,
		/** Two upward paths share no synset */
		NO_COMMON_NODE,
		/** A batch lookup requested ids absent from the node set */
		MISSING_IDS
	}

	private final Reason reason;
	private final List<String> missingIds;

	public SplitException(final Reason reason, final String message) {
		this(reason, message, Collections.emptyList());
	}

	private SplitException(final Reason reason, final String message, final List<String> missingIds) {
		super(message);
		this.reason = reason;
		this.missingIds = missingIds;
	}

	public static SplitException missingIds(final Collection<String> ids) {
		final List<String> missing = Collections.unmodifiableList(new ArrayList<>(ids));
		return new SplitException(Reason.MISSING_IDS, "Did not find synsets for ids: " + missing, missing);
	}

	public Reason getReason() {
		return reason;
	}

	/**
	 * @return the ids that could not be found (empty unless the reason is
	 *         {@link Reason#MISSING_IDS})
	 */
	public List<String> getMissingIds() {
		return missingIds;
	}

}
