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

import static org.junit.Assert.*;

import org.junit.Test;
import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.prefs.PrefService;

/**
 * Tests for {@link DamVisUtils}.
 */
public class DamVisUtilsTest {

	@Test
	public void testFormatDouble() {
		assertEquals("1.23", DamVisUtils.formatDouble(1.2345, 2));
		assertEquals("1.23E4", DamVisUtils.formatDouble(12345, 2));
		assertEquals("NaN", DamVisUtils.formatDouble(Double.NaN, 2));
	}

	@Test
	public void testContextCanBeReplaced() {
		final Context ctx = new Context(LogService.class, PrefService.class);
		DamVisUtils.setContext(ctx);
		assertSame(ctx, DamVisUtils.getContext());
		assertNotNull(DamVisUtils.VERSION);
		DamVisUtils.warn("logging through the replacement context");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullContextIsRejected() {
		DamVisUtils.setContext(null);
	}

}
