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

import java.util.List;

import org.junit.Test;
import org.scijava.util.ColorRGB;

/**
 * Tests for {@link TransferFunctionBuilder} and the transfer functions it
 * produces.
 */
public class TransferFunctionBuilderTest {

	private static final ValueRange RANGE = ValueRange.auto(-0.189, 4.970);

	@Test
	public void testPaletteAnchorsAreStretchedOverRange() {
		final ColorTransferFunction ctf = TransferFunctionBuilder.buildColor(RANGE, "RdYlBu_r");
		final List<ColorPoint> points = ctf.getPoints();
		assertEquals(5, points.size());
		assertEquals(-0.189, points.get(0).value(), 1e-12);
		assertEquals(-0.189 + 0.3 * 5.159, points.get(1).value(), 1e-9);
		assertEquals(4.970, points.get(4).value(), 1e-12);
		assertArrayEquals(new double[] { 0, 0, 1 }, ctf.getColor(-0.189), 0);
		assertArrayEquals(new double[] { 1, 0, 0 }, ctf.getColor(4.970), 0);
	}

	@Test
	public void testColorIsInterpolatedAndClamped() {
		final ColorTransferFunction ctf = TransferFunctionBuilder.buildColor(ValueRange.auto(0, 10), Palette.RDYLBU_R);
		// halfway between yellow (5) and orange (7)
		assertArrayEquals(new double[] { 1, 0.75, 0 }, ctf.getColor(6), 1e-12);
		assertArrayEquals(ctf.getColor(0), ctf.getColor(-100), 0);
		assertArrayEquals(ctf.getColor(10), ctf.getColor(100), 0);
		final ColorRGB red = ctf.getColorRGB(10);
		assertEquals(255, red.getRed());
		assertEquals(0, red.getGreen());
		assertEquals(0, red.getBlue());
		assertEquals(red.getRed(), ctf.getPoints().get(ctf.size() - 1).toColorRGB().getRed());
	}

	@Test
	public void testUnknownPaletteFallsBackToDefault() {
		final ColorTransferFunction ctf = TransferFunctionBuilder.buildColor(RANGE, "no-such-palette");
		assertEquals(Palette.DEFAULT.anchors().length, ctf.size());
	}

	@Test
	public void testOpacityChannelsAreEvenlySpaced() {
		final OpacityChannels channels = OpacityPreset.LINEAR_UP.channels(9);
		final OpacityTransferFunction otf = TransferFunctionBuilder.buildOpacity(ValueRange.auto(0, 8), channels);
		final List<OpacityPoint> points = otf.getPoints();
		assertEquals(9, points.size());
		for (int i = 0; i < 9; i++) {
			assertEquals(i, points.get(i).value(), 1e-12);
			assertEquals(i / 8d, points.get(i).opacity(), 1e-12);
		}
		assertEquals(0.5625, otf.getOpacity(4.5), 1e-12);
	}

	@Test
	public void testZeroSpanYieldsNoOpacityPoints() {
		final OpacityTransferFunction otf = TransferFunctionBuilder.buildOpacity(ValueRange.auto(3, 3),
				OpacityChannels.DEFAULT);
		assertTrue(otf.isEmpty());
	}

	@Test
	public void testScaledOpacity() {
		final OpacityTransferFunction otf = TransferFunctionBuilder.buildOpacity(ValueRange.auto(0, 1),
				OpacityPreset.FULL.channels(4)).scaled(0.7);
		for (final OpacityPoint p : otf.getPoints())
			assertEquals(0.7, p.opacity(), 1e-12);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidRangeIsRejected() {
		TransferFunctionBuilder.buildColor(ValueRange.UNSET, Palette.VIRIDIS);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvertedRangeIsRejected() {
		TransferFunctionBuilder.buildOpacity(ValueRange.manual(5, 0), OpacityChannels.DEFAULT);
	}

}
