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

import static org.junit.Assert.*;

import org.junit.Test;

import sc.fiji.damvis.DamVisUtils;

/**
 * Tests for {@link Logger}.
 */
public class LoggerTest {

	@Test
	public void testDescribeCause() {
		assertEquals("IllegalStateException: bad header", Logger.describe(new IllegalStateException("bad header")));
		assertEquals("NullPointerException", Logger.describe(new NullPointerException()));
	}

	@Test
	public void testVerbosity() {
		final Logger logger = new Logger(DamVisUtils.getContext(), "LoggerTest");
		logger.setVerbose(true);
		assertTrue(logger.isVerbose());
		logger.debug("shown");
		logger.error("with stack trace", new IllegalArgumentException("verbose"));
		logger.setVerbose(false);
		assertFalse(logger.isVerbose());
		logger.debug("hidden");
		logger.error("without cause", null);
		logger.error("cause summarized", new IllegalArgumentException("quiet"));
	}

}
