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

package sc.fiji.damvis.util;

import org.scijava.Context;
import org.scijava.log.LogLevel;
import org.scijava.log.LogService;

import sc.fiji.damvis.DamVisPrefs;
import sc.fiji.damvis.DamVisUtils;

/**
 * Per-component logger used by the frame pipeline and the batch exporter.
 * Messages are routed through the SciJava {@link LogService} of the DamVis
 * context and prefixed with {@code [DamVis:<component>]}.
 * <p>
 * Verbose output is enabled if any of the following is set when the logger is
 * created: the global debug flag ({@link DamVisUtils#isDebugMode()}), the
 * stored {@link DamVisPrefs#DEBUG} preference, or a LogService level of
 * {@link LogLevel#DEBUG} or finer. Stack traces of errors are only printed
 * when verbose.
 * </p>
 */
public class Logger {

	private final LogService logService;
	private final String tag;
	private boolean verbose;

	public Logger(final Class<?> component) {
		this(DamVisUtils.getContext(), component.getSimpleName());
	}

	/**
	 * @param context the context providing the LogService and PrefService
	 * @param component the name shown in the prefix of every message
	 */
	public Logger(final Context context, final String component) {
		logService = context.getService(LogService.class);
		tag = "[DamVis:" + component + "] ";
		verbose = DamVisUtils.isDebugMode() || new DamVisPrefs(context).isDebug()
				|| logService.getLevel() >= LogLevel.DEBUG;
	}

	public void info(final Object msg) {
		logService.info(tag + msg);
	}

	/** Logs at info level, but only when verbose. */
	public void debug(final Object msg) {
		if (verbose) logService.info(tag + msg);
	}

	public void warn(final Object msg) {
		logService.warn(tag + msg);
	}

	/**
	 * Logs an error. The cause is appended to the message and, when verbose,
	 * its stack trace is logged as well.
	 *
	 * @param msg the error message
	 * @param cause the cause of the error. May be null
	 */
	public void error(final Object msg, final Throwable cause) {
		if (cause == null) {
			logService.error(tag + msg);
		} else if (verbose) {
			logService.error(tag + msg, cause);
		} else {
			logService.error(tag + msg + " (" + describe(cause) + ")");
		}
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(final boolean verbose) {
		this.verbose = verbose;
	}

	static String describe(final Throwable cause) {
		final String message = cause.getMessage();
		return (message == null) ? cause.getClass().getSimpleName()
				: cause.getClass().getSimpleName() + ": " + message;
	}

}
