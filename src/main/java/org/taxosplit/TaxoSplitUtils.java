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

import java.util.concurrent.TimeUnit;

import org.scijava.Context;
import org.scijava.log.LogService;

/**
 * Static utilities shared by TaxoSplit components: access to the SciJava
 * context and debug-mode logging.
 */
public class TaxoSplitUtils {

	private static Context context;
	private static LogService logService;
	private static boolean initialized;
	private static volatile boolean verbose;

	private TaxoSplitUtils() {}

	private static synchronized void initialize() {
		if (initialized) return;
		if (context == null) getContext();
		if (logService == null) logService = context.getService(LogService.class);
		initialized = true;
	}

	public static synchronized void error(final String string, final Throwable t) {
		if (!initialized) initialize();
		if (t == null)
			logService.error("[TaxoSplit] " + string);
		else
			logService.error("[TaxoSplit] " + string, t);
	}

	public static synchronized void log(final String string) {
		if (!isDebugMode()) return;
		if (!initialized) initialize();
		logService.info("[TaxoSplit] " + string);
	}

	/**
	 * Assesses if TaxoSplit is running in debug mode
	 *
	 * @return the debug flag
	 */
	public static boolean isDebugMode() {
		return verbose;
	}

	/**
	 * Enables/disables debug mode
	 *
	 * @param b verbose flag
	 */
	public static void setDebugMode(final boolean b) {
		if (isDebugMode() && !b) {
			log("Exiting debug mode...");
		}
		verbose = b;
		if (isDebugMode()) {
			log("Entering debug mode...");
		}
	}

	public static String getElapsedTime(final long fromStart) {
		final long time = System.currentTimeMillis() - fromStart;
		if (time < 1000)
			return String.format("%02d msec", time);
		else if (time < 90000)
			return String.format("%02d sec", TimeUnit.MILLISECONDS.toSeconds(time));
		return String.format("%02d min, %02d sec", TimeUnit.MILLISECONDS.toMinutes(time),
				TimeUnit.MILLISECONDS.toSeconds(time)
						- TimeUnit.MINUTES.toSeconds(TimeUnit.MILLISECONDS.toMinutes(time)));
	}

	/**
	 * Gets the SciJava context used for logging, creating a minimal one (with a
	 * {@link LogService} only) if none has been set.
	 *
	 * @return the context. Never null
	 */
	public static synchronized Context getContext() {
		if (context == null) {
			context = new Context(LogService.class);
		}
		return context;
	}

}
