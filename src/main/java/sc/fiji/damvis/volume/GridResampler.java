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

import org.apache.commons.math3.util.FastMath;

import sc.fiji.damvis.DamVisUtils;
import sc.fiji.damvis.mesh.ScalarField;
import sc.fiji.damvis.util.BoundingBox;
import smile.neighbor.KDTree;
import smile.neighbor.Neighbor;

/**
 * Resamples a scalar field defined on scattered (mesh) points onto a
 * {@link UniformGrid} whose resolution is derived from a target cell budget.
 * <p>
 * The cell size is the cube root of {@code volume / targetCells}, so that cells
 * are (nearly) cubic regardless of the aspect ratio of the bounding box. Each
 * axis then gets {@code ceil(extent / cellSize) + 1} points so that the far
 * boundary is always sampled. The resulting number of cells approximates, but
 * rarely equals, the budget.
 * </p>
 * <p>
 * Grid values are interpolated by inverse distance weighting of the nearest
 * source points. Grid points outside the coverage of the source field (its
 * bounding box, and twice the mean source point spacing, or at least one grid
 * cell diagonal, from the closest source point) are assigned NaN and are expected to be handled by {@link ArtifactCleaner}.
 * </p>
 */
public class GridResampler {

	/** Default number of source points contributing to each grid value */
	public static final int DEFAULT_NEIGHBORS = 8;
	/** Grid points are never allowed to exceed the capacity of a Java array */
	private static final long MAX_POINTS = Integer.MAX_VALUE - 8;
	/** Absorbs floating point noise when extents are exact multiples of the cell size */
	private static final double CEIL_TOLERANCE = 1e-9;
	private static final double POWER = 2d;
	/** Coverage radius, in units of the mean spacing of source points */
	private static final double COVERAGE_FACTOR = 2d;

	private final int neighbors;

	public GridResampler() {
		this(DEFAULT_NEIGHBORS);
	}

	/**
	 * @param neighbors the number of nearest source points used to interpolate
	 *          each grid value
	 */
	public GridResampler(final int neighbors) {
		if (neighbors < 1) throw new IllegalArgumentException("At least one neighbor is required");
		this.neighbors = neighbors;
	}

	/**
	 * Computes the number of grid points along each axis for the specified box
	 * and cell budget.
	 *
	 * @param bounds the region to be sampled
	 * @param targetCells the desired total number of grid cells
	 * @return the number of points along x, y and z (each &ge; 2)
	 * @throws DegenerateGridException if the box has no volume or targetCells is
	 *           not positive
	 */
	public static int[] dimensions(final BoundingBox bounds, final long targetCells) throws DegenerateGridException {
		final double[] e = bounds.extents();
		final double volume = e[0] * e[1] * e[2];
		if (targetCells <= 0)
			throw new DegenerateGridException("Target cell count must be positive but was " + targetCells);
		if (!Double.isFinite(volume) || e[0] <= 0 || e[1] <= 0 || e[2] <= 0)
			throw new DegenerateGridException("Bounding box has no volume: " + bounds);
		final double cellSize = FastMath.cbrt(volume / targetCells);
		final int[] dims = new int[3];
		long total = 1;
		for (int d = 0; d < 3; d++) {
			final double n = FastMath.ceil(e[d] / cellSize - CEIL_TOLERANCE) + 1;
			if (n > MAX_POINTS)
				throw new IllegalArgumentException("Grid too large along axis " + d + ": " + n + " points");
			dims[d] = (int) Math.max(2, n);
			total *= dims[d];
			if (total > MAX_POINTS)
				throw new IllegalArgumentException("Grid too large: cell budget of " + targetCells + " is excessive for " + bounds);
		}
		return dims;
	}

	/**
	 * Resamples the field onto a uniform grid spanning the specified bounds.
	 *
	 * @param field the source field (point granularity)
	 * @param bounds the region to be sampled, typically the clipping box
	 *          intersected with the mesh bounds
	 * @param targetCells the desired total number of grid cells
	 * @return the sampled grid. Values outside the coverage of the field are NaN
	 * @throws DegenerateGridException if the box has no volume or targetCells is
	 *           not positive
	 * @throws IllegalArgumentException if the field has no finite values
	 */
	public UniformGrid resample(final ScalarField field, final BoundingBox bounds, final long targetCells)
			throws DegenerateGridException {
		final int[] dims = dimensions(bounds, targetCells);
		final double[] e = bounds.extents();
		final double[] spacing = new double[3];
		for (int d = 0; d < 3; d++)
			spacing[d] = e[d] / (dims[d] - 1);
		final double[] origin = bounds.origin();
		DamVisUtils.log("Resampling " + field + " onto " + Arrays.toString(dims) + " grid (target cells: "
				+ targetCells + ")");

		final Sampler sampler = new Sampler(field, spacing);
		final double[] values = new double[dims[0] * dims[1] * dims[2]];
		final double[] pos = new double[3];
		int idx = 0;
		for (int k = 0; k < dims[2]; k++) {
			pos[2] = origin[2] + k * spacing[2];
			for (int j = 0; j < dims[1]; j++) {
				pos[1] = origin[1] + j * spacing[1];
				for (int i = 0; i < dims[0]; i++) {
					pos[0] = origin[0] + i * spacing[0];
					values[idx++] = sampler.sample(pos);
				}
			}
		}
		final UniformGrid grid = new UniformGrid(dims, spacing, origin, field.getName(), values);
		DamVisUtils.log("Resampled: " + grid + ", total cells: " + grid.getNumberOfCells());
		return grid;
	}

	/** The edge of the cube each source point would occupy if evenly spread */
	static double meanSpacing(final BoundingBox box, final int nPoints) {
		final double volume = box.volume();
		return (volume > 0 && nPoints > 0) ? FastMath.cbrt(volume / nPoints) : 0;
	}

	/**
	 * Inverse distance weighting over a KD-tree of the finite source values.
	 */
	private class Sampler {

		private final KDTree<Double> tree;
		private final int k;
		private final BoundingBox coverage;
		private final double tolerance;
		private final double radius;

		Sampler(final ScalarField field, final double[] gridSpacing) {
			final double[][] allPoints = field.getPoints();
			final double[] allValues = field.getValues();
			int n = 0;
			for (final double v : allValues)
				if (Double.isFinite(v)) n++;
			if (n == 0) throw new IllegalArgumentException("Scalar field '" + field.getName() + "' has no finite values");
			final double[][] keys = new double[n][];
			final Double[] data = new Double[n];
			for (int i = 0, j = 0; i < allValues.length; i++) {
				if (!Double.isFinite(allValues[i])) continue;
				keys[j] = allPoints[i];
				data[j++] = allValues[i];
			}
			tree = new KDTree<>(keys, data);
			k = Math.min(neighbors, n);
			coverage = BoundingBox.enclosing(keys);
			final double[] e = coverage.extents();
			tolerance = CEIL_TOLERANCE * Math.max(e[0], Math.max(e[1], e[2]));
			final double gridDiagonal = Math.sqrt(gridSpacing[0] * gridSpacing[0] + gridSpacing[1] * gridSpacing[1]
					+ gridSpacing[2] * gridSpacing[2]);
			radius = Math.max(COVERAGE_FACTOR * meanSpacing(coverage, n), gridDiagonal);
		}

		double sample(final double[] pos) {
			if (!coverage.contains(pos[0], pos[1], pos[2], tolerance)) return Double.NaN;
			final Neighbor<double[], Double>[] nbs = tree.knn(pos.clone(), k);
			double closest = Double.POSITIVE_INFINITY;
			for (final Neighbor<double[], Double> nb : nbs) {
				if (nb.distance <= tolerance) return nb.value;
				closest = Math.min(closest, nb.distance);
			}
			if (closest > radius) return Double.NaN;
			double weightedSum = 0;
			double weightSum = 0;
			for (final Neighbor<double[], Double> nb : nbs) {
				final double w = 1d / FastMath.pow(nb.distance, POWER);
				weightedSum += w * nb.value;
				weightSum += w;
			}
			return weightedSum / weightSum;
		}

	}

}
