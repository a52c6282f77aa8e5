/*
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
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

package sc.fiji.damvis;

import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.util.Locale;

import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.prefs.PrefService;
import org.scijava.util.VersionUtils;

/** Static utilities for DamVis **/
public class DamVisUtils {

	private static Context context;
	private static LogService logService;
	private static boolean debug;

	public static final String VERSION = getVersion();

	private static boolean initialized;

	private DamVisUtils() {}

	private static synchronized void initialize() {
		if (initialized) return;
		if (logService == null) logService = getContext().getService(LogService.class);
		initialized = true;
	}

	/**
	 * Retrieves DamVis's version
	 *
	 * @return the version or a non-empty place holder string if version could
	 *         not be retrieved.
	 */
	private static String getVersion() {
		try {
			return VersionUtils.getVersion(DamVisUtils.class);
		} catch (final Throwable ignored) {
			return "N/A";
		}
	}

	/**
	 * Gets the SciJava context used by DamVis. A minimal context (logging and
	 * preferences) is created on first access if none has been set.
	 *
	 * @return the context. Never null
	 */
	public static synchronized Context getContext() {
		if (context == null) {
			context = new Context(LogService.class, PrefService.class);
		}
		return context;
	}

	/**
	 * Sets the context to be used by DamVis, e.g., that of a running Fiji
	 * instance.
	 *
	 * @param ctx the context
	 */
	public static synchronized void setContext(final Context ctx) {
		if (ctx == null) throw new IllegalArgumentException("Context cannot be null");
		context = ctx;
		logService = null;
		initialized = false;
	}

	public static synchronized void log(final String string) {
		if (!isDebugMode()) return;
		if (!initialized) initialize();
		logService.info("[DamVis] " + string);
	}

	public static synchronized void warn(final String string) {
		if (!initialized) initialize();
		logService.warn("[DamVis] " + string);
	}

	public static synchronized void error(final String string) {
		if (!initialized) initialize();
		logService.error("[DamVis] " + string);
	}

	public static synchronized void error(final String string, final Throwable t) {
		if (!initialized) initialize();
		if (t == null)
			logService.error("[DamVis] " + string);
		else
			logService.error("[DamVis] " + string, t);
	}

	/**
	 * Assesses if DamVis is running in debug mode
	 *
	 * @return the debug flag
	 */
	public static boolean isDebugMode() {
		return debug;
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
		debug = b;
		if (isDebugMode()) {
			log("Entering debug mode...");
		}
	}

	public static String formatDouble(final double value, final int digits) {
		return (Double.isNaN(value)) ? "NaN" : getDecimalFormat(value, digits).format(value);
	}

	public static DecimalFormat getDecimalFormat(final double value, final int digits) {
		final StringBuilder pattern = new StringBuilder("0.");
		while (pattern.length() < digits + 2)
			pattern.append("0");
		final double absValue = Math.abs(value);
		if ((absValue > 0 && absValue < 0.01) || absValue >= 1000) pattern.append("E0");
		final NumberFormat nf = NumberFormat.getNumberInstance(Locale.US);
		final DecimalFormat df = (DecimalFormat) nf;
		df.applyLocalizedPattern(pattern.toString());
		return df;
	}

}
