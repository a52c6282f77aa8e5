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

package sc.fiji.damvis.mesh;

import sc.fiji.damvis.util.BoundingBox;

/**
 * A named scalar array at point granularity, together with the coordinates of
 * the points it is attached to. This is the input of the resampling step.
 */
public class ScalarField {

	private final String name;
	private final double[][] points;
	private final double[] values;
	private BoundingBox bounds;

	/**
	 * @param name the array name
	 * @param points the point coordinates, each as {x, y, z}
	 * @param values one value per point
	 * @throws IllegalArgumentException if sizes do not match or the field is
	 *           empty
	 */
	public ScalarField(final String name, final double[][] points, final double[] values) {
		if (points == null || values == null || points.length == 0)
			throw new IllegalArgumentException("Scalar field '" + name + "' is empty");
		if (points.length != values.length)
			throw new IllegalArgumentException("Scalar field '" + name + "' has " + values.length
					+ " values for " + points.length + " points");
		this.name = name;
		this.points = points;
		this.values = values;
	}

	public String getName() {
		return name;
	}

	public double[][] getPoints() {
		return points;
	}

	public double[] getValues() {
		return values;
	}

	public int size() {
		return values.length;
	}

	public BoundingBox getBounds() {
		if (bounds == null) bounds = BoundingBox.enclosing(points);
		return bounds;
	}

	/**
	 * @return the {min, max} of the finite values of this field, or
	 *         {NaN, NaN} if it has none
	 */
	public double[] getRange() {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (final double v : values) {
			if (!Double.isFinite(v)) continue;
			if (v < min) min = v;
			if (v > max) max = v;
		}
		if (min > max) return new double[] { Double.NaN, Double.NaN };
		return new double[] { min, max };
	}

	@Override
	public String toString() {
		return "ScalarField[" + name + ", " + values.length + " points]";
	}

}
