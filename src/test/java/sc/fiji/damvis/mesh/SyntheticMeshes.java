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

/**
 * Builds lattice-shaped {@link UnstructuredMesh}es holding analytic fields.
 */
public class SyntheticMeshes {

	@FunctionalInterface
	public interface Field {
		double valueAt(double x, double y, double z);
	}

	private SyntheticMeshes() {}

	/**
	 * Builds a mesh of {@code n^3} points spanning {@code [origin, origin + (n-1) * spacing]}
	 * on each axis, with one hexahedral cell per lattice voxel.
	 */
	public static UnstructuredMesh lattice(final int n, final double origin, final double spacing) {
		final double[][] points = new double[n * n * n][];
		int idx = 0;
		for (int k = 0; k < n; k++)
			for (int j = 0; j < n; j++)
				for (int i = 0; i < n; i++)
					points[idx++] = new double[] { origin + i * spacing, origin + j * spacing, origin + k * spacing };
		final int m = n - 1;
		final int[][] cells = new int[m * m * m][];
		idx = 0;
		for (int k = 0; k < m; k++) {
			for (int j = 0; j < m; j++) {
				for (int i = 0; i < m; i++) {
					final int p = i + n * (j + n * k);
					cells[idx++] = new int[] { p, p + 1, p + 1 + n, p + n, p + n * n, p + 1 + n * n, p + 1 + n + n * n,
							p + n + n * n };
				}
			}
		}
		return new UnstructuredMesh(points, cells);
	}

	/** Evaluates a field at every point of a mesh. */
	public static double[] sample(final UnstructuredMesh mesh, final Field field) {
		final double[][] points = mesh.getPoints();
		final double[] values = new double[points.length];
		for (int i = 0; i < points.length; i++)
			values[i] = field.valueAt(points[i][0], points[i][1], points[i][2]);
		return values;
	}

	/** A lattice mesh holding a single point array. */
	public static UnstructuredMesh withPointField(final int n, final double origin, final double spacing,
			final String name, final Field field) {
		final UnstructuredMesh mesh = lattice(n, origin, spacing);
		return mesh.addPointArray(name, sample(mesh, field));
	}

}
