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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import sc.fiji.damvis.util.BoundingBox;

/**
 * A minimal in-memory unstructured mesh: point coordinates, cells given as
 * lists of point indices, and named point/cell scalar arrays. Suitable as the
 * product of a {@link sc.fiji.damvis.io.MeshReader}.
 */
public class UnstructuredMesh implements ResistivityMesh {

	private final double[][] points;
	private final int[][] cells;
	private final Map<String, double[]> pointArrays;
	private final Map<String, double[]> cellArrays;
	private BoundingBox bounds;

	/**
	 * @param points the point coordinates, each as {x, y, z}
	 * @param cells the cells, each as an array of point indices. May be empty
	 *          for point clouds
	 */
	public UnstructuredMesh(final double[][] points, final int[][] cells) {
		if (points == null || points.length == 0) throw new IllegalArgumentException("Mesh has no points");
		this.points = points;
		this.cells = (cells == null) ? new int[0][] : cells;
		for (final int[] cell : this.cells) {
			for (final int idx : cell) {
				if (idx < 0 || idx >= points.length)
					throw new IllegalArgumentException("Cell references unknown point " + idx);
			}
		}
		pointArrays = new LinkedHashMap<>();
		cellArrays = new LinkedHashMap<>();
	}

	public UnstructuredMesh addPointArray(final String name, final double[] values) {
		if (values.length != points.length)
			throw new IllegalArgumentException("Point array '" + name + "' must have " + points.length + " values");
		pointArrays.put(name, values);
		return this;
	}

	public UnstructuredMesh addCellArray(final String name, final double[] values) {
		if (values.length != cells.length)
			throw new IllegalArgumentException("Cell array '" + name + "' must have " + cells.length + " values");
		cellArrays.put(name, values);
		return this;
	}

	public int[][] getCells() {
		return cells;
	}

	@Override
	public BoundingBox getBounds() {
		if (bounds == null) bounds = BoundingBox.enclosing(points);
		return bounds;
	}

	@Override
	public double[][] getPoints() {
		return points;
	}

	@Override
	public Map<String, double[]> getPointArrays() {
		return Collections.unmodifiableMap(pointArrays);
	}

	@Override
	public Map<String, double[]> getCellArrays() {
		return Collections.unmodifiableMap(cellArrays);
	}

	/**
	 * {@inheritDoc} Each point receives the mean of the values of the cells that
	 * use it. Points not used by any cell are assigned NaN.
	 */
	@Override
	public double[] cellToPoint(final String cellArrayName) {
		final double[] cellValues = cellArrays.get(cellArrayName);
		if (cellValues == null) throw new IllegalArgumentException("No cell array named '" + cellArrayName + "'");
		final double[] sum = new double[points.length];
		final int[] count = new int[points.length];
		for (int c = 0; c < cells.length; c++) {
			for (final int p : cells[c]) {
				sum[p] += cellValues[c];
				count[p]++;
			}
		}
		final double[] result = new double[points.length];
		for (int p = 0; p < points.length; p++) {
			result[p] = (count[p] == 0) ? Double.NaN : sum[p] / count[p];
		}
		return result;
	}

	@Override
	public String toString() {
		return "UnstructuredMesh[" + points.length + " points, " + cells.length + " cells, point arrays: "
				+ pointArrays.keySet() + ", cell arrays: " + cellArrays.keySet() + "]";
	}

}
