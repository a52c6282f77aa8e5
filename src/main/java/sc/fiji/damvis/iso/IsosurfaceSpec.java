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

package sc.fiji.damvis.iso;

/**
 * Describes the isosurfaces requested by the operator: either a single
 * surface at a given value, or a number of surfaces evenly spread inside the
 * active value range.
 */
public final class IsosurfaceSpec {

	public enum Mode {
		SINGLE, MULTIPLE
	}

	private final Mode mode;
	private final double value;
	private final int count;
	private final double opacity;

	/**
	 * @param mode single or multiple surfaces
	 * @param value the isovalue of single mode (also the fallback of multiple
	 *          mode). NaN to use the center of the active range
	 * @param count the number of surfaces in multiple mode
	 * @param opacity the surface opacity, in [0, 1]
	 */
	public IsosurfaceSpec(final Mode mode, final double value, final int count, final double opacity) {
		if (mode == null) throw new IllegalArgumentException("Isosurface mode cannot be null");
		if (!(opacity >= 0 && opacity <= 1)) throw new IllegalArgumentException("Opacity out of [0, 1]: " + opacity);
		this.mode = mode;
		this.value = value;
		this.count = count;
		this.opacity = opacity;
	}

	public static IsosurfaceSpec single(final double value, final double opacity) {
		return new IsosurfaceSpec(Mode.SINGLE, value, 1, opacity);
	}

	public static IsosurfaceSpec multiple(final int count, final double opacity) {
		return new IsosurfaceSpec(Mode.MULTIPLE, Double.NaN, count, opacity);
	}

	public Mode getMode() {
		return mode;
	}

	public double getValue() {
		return value;
	}

	public int getCount() {
		return count;
	}

	public double getOpacity() {
		return opacity;
	}

	@Override
	public String toString() {
		return (mode == Mode.SINGLE) ? "Single isosurface at " + value + " (opacity " + opacity + ")"
				: count + " isosurfaces (opacity " + opacity + ")";
	}

}
