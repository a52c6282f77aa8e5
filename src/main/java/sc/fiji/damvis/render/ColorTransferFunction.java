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
import java.util.Collections;
import java.util.List;

import org.scijava.util.ColorRGB;

/**
 * Maps scalar values to colors by linear interpolation between control
 * points. Values beyond the first/last control point take the color of that
 * point.
 */
public class ColorTransferFunction {

	private final List<ColorPoint> points;

	/**
	 * @param points the control points, ordered by non-decreasing value
	 * @throws IllegalArgumentException if points are not ordered
	 */
	public ColorTransferFunction(final List<ColorPoint> points) {
		for (int i = 1; i < points.size(); i++) {
			if (points.get(i).value() < points.get(i - 1).value())
				throw new IllegalArgumentException("Control point values must be non-decreasing");
		}
		this.points = Collections.unmodifiableList(new ArrayList<>(points));
	}

	public List<ColorPoint> getPoints() {
		return points;
	}

	public int size() {
		return points.size();
	}

	/**
	 * @param value the scalar value
	 * @return the interpolated {red, green, blue} color, channels in [0, 1]
	 * @throws IllegalStateException if this function has no control points
	 */
	public double[] getColor(final double value) {
		if (points.isEmpty()) throw new IllegalStateException("Transfer function has no control points");
		final ColorPoint first = points.get(0);
		if (value <= first.value()) return new double[] { first.red(), first.green(), first.blue() };
		for (int i = 1; i < points.size(); i++) {
			final ColorPoint b = points.get(i);
			if (value <= b.value()) {
				final ColorPoint a = points.get(i - 1);
				final double span = b.value() - a.value();
				final double t = (span > 0) ? (value - a.value()) / span : 1;
				return new double[] { a.red() + t * (b.red() - a.red()), a.green() + t * (b.green() - a.green()),
						a.blue() + t * (b.blue() - a.blue()) };
			}
		}
		final ColorPoint last = points.get(points.size() - 1);
		return new double[] { last.red(), last.green(), last.blue() };
	}

	/** @return the interpolated color as 8-bit RGB */
	public ColorRGB getColorRGB(final double value) {
		final double[] rgb = getColor(value);
		return new ColorRGB(ColorPoint.to8bit(rgb[0]), ColorPoint.to8bit(rgb[1]), ColorPoint.to8bit(rgb[2]));
	}

	@Override
	public String toString() {
		return "ColorTransferFunction" + points;
	}

}
