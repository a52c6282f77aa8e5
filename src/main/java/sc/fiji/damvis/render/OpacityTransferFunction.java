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

/**
 * Maps scalar values to opacities by linear interpolation between control
 * points. An empty function (e.g., built over a degenerate range) maps every
 * value to full opacity, which is what volume renderers assume when no
 * opacity function is set.
 */
public class OpacityTransferFunction {

	private final List<OpacityPoint> points;

	/**
	 * @param points the control points, ordered by non-decreasing value
	 * @throws IllegalArgumentException if points are not ordered or an opacity
	 *           is outside [0, 1]
	 */
	public OpacityTransferFunction(final List<OpacityPoint> points) {
		for (int i = 0; i < points.size(); i++) {
			final double o = points.get(i).opacity();
			if (!(o >= 0 && o <= 1)) throw new IllegalArgumentException("Opacity out of [0, 1]: " + o);
			if (i > 0 && points.get(i).value() < points.get(i - 1).value())
				throw new IllegalArgumentException("Control point values must be non-decreasing");
		}
		this.points = Collections.unmodifiableList(new ArrayList<>(points));
	}

	public List<OpacityPoint> getPoints() {
		return points;
	}

	public int size() {
		return points.size();
	}

	public boolean isEmpty() {
		return points.isEmpty();
	}

	public double getOpacity(final double value) {
		if (points.isEmpty()) return 1d;
		final OpacityPoint first = points.get(0);
		if (value <= first.value()) return first.opacity();
		for (int i = 1; i < points.size(); i++) {
			final OpacityPoint b = points.get(i);
			if (value <= b.value()) {
				final OpacityPoint a = points.get(i - 1);
				final double span = b.value() - a.value();
				final double t = (span > 0) ? (value - a.value()) / span : 1;
				return a.opacity() + t * (b.opacity() - a.opacity());
			}
		}
		return points.get(points.size() - 1).opacity();
	}

	/**
	 * @param factor a multiplier in [0, 1]
	 * @return a copy of this function with every opacity multiplied by factor
	 */
	public OpacityTransferFunction scaled(final double factor) {
		if (!(factor >= 0 && factor <= 1)) throw new IllegalArgumentException("Scale factor out of [0, 1]: " + factor);
		final List<OpacityPoint> scaled = new ArrayList<>(points.size());
		for (final OpacityPoint p : points)
			scaled.add(new OpacityPoint(p.value(), p.opacity() * factor));
		return new OpacityTransferFunction(scaled);
	}

	@Override
	public String toString() {
		return "OpacityTransferFunction" + points;
	}

}
