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

package sc.fiji.damvis.volume;

import java.util.Arrays;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * A regular 3D lattice of points with constant axis-aligned spacing, holding
 * one scalar value per point. Values are stored with x varying fastest, then
 * y, then z.
 */
public class UniformGrid {

	private final int[] dims;
	private final double[] spacing;
	private final double[] origin;
	private final String scalarName;
	private final double[] values;

	/**
	 * @param dims number of points along x, y, z. Each must be at least 2
	 * @param spacing point spacing along x, y, z. Each must be positive
	 * @param origin the position of the first grid point
	 * @param scalarName the name of the sampled array
	 * @param values the sampled values, of length {@code nx * ny * nz}
	 */
	public UniformGrid(final int[] dims, final double[] spacing, final double[] origin, final String scalarName,
			final double[] values) {
		if (dims.length != 3 || spacing.length != 3 || origin.length != 3)
			throw new IllegalArgumentException("Grid must be three-dimensional");
		for (int d = 0; d < 3; d++) {
			if (dims[d] < 2) throw new IllegalArgumentException("Grid needs at least 2 points per axis: " + Arrays.toString(dims));
			if (!(spacing[d] > 0)) throw new IllegalArgumentException("Grid spacing must be positive: " + Arrays.toString(spacing));
		}
		if ((long) dims[0] * dims[1] * dims[2] != values.length)
			throw new IllegalArgumentException("Expected " + (long) dims[0] * dims[1] * dims[2] + " values but got " + values.length);
		this.dims = dims.clone();
		this.spacing = spacing.clone();
		this.origin = origin.clone();
		this.scalarName = scalarName;
		this.values = values;
	}

	/**
	 * @return a grid with the same geometry as this one holding the specified
	 *         values
	 */
	public UniformGrid withValues(final double[] newValues) {
		return new UniformGrid(dims, spacing, origin, scalarName, newValues);
	}

	public int[] getDimensions() {
		return dims.clone();
	}

	public double[] getSpacing() {
		return spacing.clone();
	}

	public double[] getOrigin() {
		return origin.clone();
	}

	public String getScalarName() {
		return scalarName;
	}

	/** @return the backing value array (not a copy) */
	public double[] getValues() {
		return values;
	}

	public int getNumberOfPoints() {
		return values.length;
	}

	public long getNumberOfCells() {
		return (long) (dims[0] - 1) * (dims[1] - 1) * (dims[2] - 1);
	}

	public int index(final int i, final int j, final int k) {
		return i + dims[0] * (j + dims[1] * k);
	}

	public double getValue(final int i, final int j, final int k) {
		return values[index(i, j, k)];
	}

	public void position(final int i, final int j, final int k, final double[] pos) {
		pos[0] = origin[0] + i * spacing[0];
		pos[1] = origin[1] + j * spacing[1];
		pos[2] = origin[2] + k * spacing[2];
	}

	/**
	 * Wraps the grid values as an imglib2 image, e.g., for handing the volume
	 * over to a renderer. The image shares storage with this grid.
	 */
	public ArrayImg<DoubleType, DoubleArray> getImg() {
		return ArrayImgs.doubles(values, dims[0], dims[1], dims[2]);
	}

	@Override
	public String toString() {
		return "UniformGrid[dims=" + Arrays.toString(dims) + ", spacing=" + Arrays.toString(spacing) + ", origin="
				+ Arrays.toString(origin) + ", scalar=" + scalarName + "]";
	}

}
