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

import java.util.Arrays;

/**
 * An axis-aligned bounding box, stored in the VTK order
 * {@code (xmin, xmax, ymin, ymax, zmin, zmax)}.
 */
public class BoundingBox {

	private final double[] bounds;

	/**
	 * @param xmin lower x bound
	 * @param xmax upper x bound
	 * @param ymin lower y bound
	 * @param ymax upper y bound
	 * @param zmin lower z bound
	 * @param zmax upper z bound
	 */
	public BoundingBox(final double xmin, final double xmax, final double ymin, final double ymax,
			final double zmin, final double zmax) {
		bounds = new double[] { xmin, xmax, ymin, ymax, zmin, zmax };
	}

	/**
	 * @param bounds six values in {@code (xmin, xmax, ymin, ymax, zmin, zmax)}
	 *          order
	 * @throws IllegalArgumentException if array does not hold six values
	 */
	public static BoundingBox of(final double[] bounds) {
		if (bounds == null || bounds.length != 6)
			throw new IllegalArgumentException("Bounds must contain exactly 6 values");
		return new BoundingBox(bounds[0], bounds[1], bounds[2], bounds[3], bounds[4], bounds[5]);
	}

	/**
	 * Computes the bounding box of a set of 3D coordinates.
	 *
	 * @param points the coordinates, each as {x, y, z}
	 * @return the minimum bounding box
	 */
	public static BoundingBox enclosing(final double[][] points) {
		if (points == null || points.length == 0)
			throw new IllegalArgumentException("Cannot compute bounds of an empty point set");
		final double[] b = { Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY,
				Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY };
		for (final double[] p : points) {
			for (int d = 0; d < 3; d++) {
				b[2 * d] = Math.min(b[2 * d], p[d]);
				b[2 * d + 1] = Math.max(b[2 * d + 1], p[d]);
			}
		}
		return of(b);
	}

	public double min(final int axis) {
		return bounds[2 * axis];
	}

	public double max(final int axis) {
		return bounds[2 * axis + 1];
	}

	/** @return the (x, y, z) minimum corner */
	public double[] origin() {
		return new double[] { bounds[0], bounds[2], bounds[4] };
	}

	/** @return the side lengths along x, y and z. May be negative if box is empty */
	public double[] extents() {
		return new double[] { bounds[1] - bounds[0], bounds[3] - bounds[2], bounds[5] - bounds[4] };
	}

	/** @return the product of the three extents, or 0 if any extent is negative */
	public double volume() {
		final double[] e = extents();
		if (e[0] < 0 || e[1] < 0 || e[2] < 0) return 0;
		return e[0] * e[1] * e[2];
	}

	public boolean isEmpty() {
		return !(volume() > 0);
	}

	public boolean contains(final double x, final double y, final double z, final double tolerance) {
		return x >= bounds[0] - tolerance && x <= bounds[1] + tolerance //
				&& y >= bounds[2] - tolerance && y <= bounds[3] + tolerance //
				&& z >= bounds[4] - tolerance && z <= bounds[5] + tolerance;
	}

	/**
	 * Intersects this box with another one. If the two boxes do not overlap the
	 * result is an inverted (empty) box with zero {@link #volume()}.
	 */
	public BoundingBox intersection(final BoundingBox other) {
		return new BoundingBox(Math.max(bounds[0], other.bounds[0]), Math.min(bounds[1], other.bounds[1]),
				Math.max(bounds[2], other.bounds[2]), Math.min(bounds[3], other.bounds[3]),
				Math.max(bounds[4], other.bounds[4]), Math.min(bounds[5], other.bounds[5]));
	}

	public double[] toArray() {
		return bounds.clone();
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof BoundingBox)) return false;
		return Arrays.equals(bounds, ((BoundingBox) o).bounds);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bounds);
	}

	@Override
	public String toString() {
		return "BoundingBox" + Arrays.toString(bounds);
	}

}
