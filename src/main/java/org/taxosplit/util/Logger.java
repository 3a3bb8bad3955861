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
package org.taxosplit.util;

import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;
import org.taxosplit.TaxoSplitUtils;

/**
 * Logs the progress of a split component (loaders, root proposal, class
 * assignment) through the {@link LogService} of the shared TaxoSplit context,
 * tagging each message with the component's class name. Debug messages are
 * emitted only when {@link TaxoSplitUtils#isDebugMode()} or the log service is
 * in debug mode at construction time.
 */
public class Logger {

	@Parameter
	private LogService logService;

	private final String component;
	private final boolean debug;

	public Logger(final Class<?> component) {
		TaxoSplitUtils.getContext().inject(this);
		this.component = component.getSimpleName();
		debug = TaxoSplitUtils.isDebugMode() || logService.isDebug();
	}

	public void info(final Object msg) {
		logService.info(component + ": " + msg);
	}

	/** Emitted at info level, in debug mode only. */
	public void debug(final Object msg) {
		if (debug) logService.info(component + ": " + msg);
	}

	public void warn(final Object msg) {
		logService.warn(component + ": " + msg);
	}

	/** @return whether debug messages are emitted */
	public boolean isDebug() {
		return debug;
	}

}
