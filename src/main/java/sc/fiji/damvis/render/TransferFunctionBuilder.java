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

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the color and opacity transfer functions of a volume rendering from
 * the effective value range, a palette and opacity channels.
 */
public class TransferFunctionBuilder {

	private TransferFunctionBuilder() {}

	/**
	 * Builds a color transfer function by stretching a palette over a range.
	 *
	 * @param range the effective value range
	 * @param paletteName the palette name. Unrecognized names fall back to
	 *          {@link Palette#DEFAULT}
	 * @return the color transfer function
	 * @throws IllegalArgumentException if range is invalid
	 */
	public static ColorTransferFunction buildColor(final ValueRange range, final String paletteName) {
		return buildColor(range, Palette.fromName(paletteName));
	}

	/**
	 * Builds a color transfer function by stretching a palette over a range:
	 * each anchor is placed at {@code min + fraction * (max - min)}.
	 *
	 * @param range the effective value range
	 * @param palette the palette
	 * @return the color transfer function
	 * @throws IllegalArgumentException if range is invalid
	 */
	public static ColorTransferFunction buildColor(final ValueRange range, final Palette palette) {
		checkRange(range);
		final double[][] anchors = palette.anchors();
		final List<ColorPoint> points = new ArrayList<>(anchors.length);
		for (final double[] anchor : anchors) {
			points.add(new ColorPoint(range.valueAt(anchor[0]), anchor[1], anchor[2], anchor[3]));
		}
		return new ColorTransferFunction(points);
	}

	/**
	 * Builds an opacity transfer function with channels evenly spaced over a
	 * range. If the range has zero span no control points are created.
	 *
	 * @param range the effective value range
	 * @param channels the opacity channels
	 * @return the opacity transfer function
	 * @throws IllegalArgumentException if range is invalid
	 */
	public static OpacityTransferFunction buildOpacity(final ValueRange range, final OpacityChannels channels) {
		checkRange(range);
		final List<OpacityPoint> points = new ArrayList<>(channels.size());
		if (range.getSpan() > 0) {
			final int last = channels.size() - 1;
			for (int i = 0; i <= last; i++) {
				points.add(new OpacityPoint(range.valueAt((double) i / last), channels.get(i)));
			}
		}
		return new OpacityTransferFunction(points);
	}

	private static void checkRange(final ValueRange range) {
		if (range == null || !range.isValid()) throw new IllegalArgumentException("Invalid value range: " + range);
	}

}
