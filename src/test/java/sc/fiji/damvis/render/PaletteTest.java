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

package sc.fiji.damvis.render;

import static org.junit.Assert.*;

import org.junit.Test;

/**
 * Tests for {@link Palette}.
 */
public class PaletteTest {

	@Test
	public void testLookupIsCaseInsensitive() {
		assertEquals(Palette.VIRIDIS, Palette.fromName("Viridis"));
		assertEquals(Palette.RDYLBU_R, Palette.fromName("rdylbu_r"));
		assertEquals(Palette.JET, Palette.fromName(" JET "));
	}

	@Test
	public void testUnknownNamesFallBackToDefault() {
		assertEquals(Palette.DEFAULT, Palette.fromName("cividis"));
		assertEquals(Palette.DEFAULT, Palette.fromName(null));
		assertEquals(Palette.RDYLBU_R, Palette.DEFAULT);
	}

	@Test
	public void testAnchorsSpanUnitInterval() {
		for (final Palette palette : Palette.values()) {
			final double[][] anchors = palette.anchors();
			assertEquals(palette.label(), 0, anchors[0][0], 0);
			assertEquals(palette.label(), 1, anchors[anchors.length - 1][0], 0);
			for (int i = 1; i < anchors.length; i++)
				assertTrue(palette.label(), anchors[i][0] > anchors[i - 1][0]);
		}
	}

	@Test
	public void testAnchorsAreCopies() {
		Palette.PLASMA.anchors()[0][1] = 42;
		assertNotEquals(42, Palette.PLASMA.anchors()[0][1], 0);
	}

	@Test
	public void testLabels() {
		assertEquals(Palette.values().length, Palette.labels().size());
		assertEquals("RdYlBu_r", Palette.labels().get(0));
	}

}
