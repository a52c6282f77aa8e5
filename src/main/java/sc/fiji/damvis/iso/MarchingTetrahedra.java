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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import sc.fiji.damvis.volume.UniformGrid;

/**
 * Isosurface extraction on a {@link UniformGrid}. Every grid cell is split
 * into six tetrahedra sharing the cell's main diagonal, and each tetrahedron
 * contributes zero, one or two triangles. Vertices lying on the same grid
 * edge are shared between neighboring cells. Triangle winding is not
 * consistent, so surfaces are meant to be lit from both sides.
 */
public class MarchingTetrahedra {

	/** Cell corner offsets (i, j, k) */
	private static final int[][] CORNERS = { { 0, 0, 0 }, { 1, 0, 0 }, { 1, 1, 0 }, { 0, 1, 0 }, { 0, 0, 1 },
			{ 1, 0, 1 }, { 1, 1, 1 }, { 0, 1, 1 } };
	/** Decomposition of a cell into tetrahedra around the 0-6 diagonal */
	private static final int[][] TETRAHEDRA = { { 0, 5, 1, 6 }, { 0, 1, 2, 6 }, { 0, 2, 3, 6 }, { 0, 3, 7, 6 },
			{ 0, 7, 4, 6 }, { 0, 4, 5, 6 } };

	private final UniformGrid grid;
	private final int[] dims;
	private final double isovalue;
	private final List<Float> vertices = new ArrayList<>();
	private final List<Integer> triangles = new ArrayList<>();
	private final Map<Long, Integer> edgeVertices = new HashMap<>();

	private MarchingTetrahedra(final UniformGrid grid, final double isovalue) {
		this.grid = grid;
		this.dims = grid.getDimensions();
		this.isovalue = isovalue;
	}

	/**
	 * @param grid the grid to contour
	 * @param isovalue the contour value
	 * @return the surface separating values below isovalue from the others
	 */
	public static IsosurfaceMesh extract(final UniformGrid grid, final double isovalue) {
		return new MarchingTetrahedra(grid, isovalue).run();
	}

	private IsosurfaceMesh run() {
		final double[] values = grid.getValues();
		final int[] index = new int[8];
		final double[] val = new double[8];
		for (int k = 0; k < dims[2] - 1; k++) {
			for (int j = 0; j < dims[1] - 1; j++) {
				for (int i = 0; i < dims[0] - 1; i++) {
					boolean finite = true;
					int below = 0;
					for (int c = 0; c < 8; c++) {
						index[c] = grid.index(i + CORNERS[c][0], j + CORNERS[c][1], k + CORNERS[c][2]);
						val[c] = values[index[c]];
						if (!Double.isFinite(val[c])) finite = false;
						if (val[c] < isovalue) below++;
					}
					if (!finite || below == 0 || below == 8) continue;
					for (final int[] tet : TETRAHEDRA) {
						polygonize(tet, index, val);
					}
				}
			}
		}
		final float[] v = new float[vertices.size()];
		for (int i = 0; i < v.length; i++)
			v[i] = vertices.get(i);
		final int[] t = new int[triangles.size()];
		for (int i = 0; i < t.length; i++)
			t[i] = triangles.get(i);
		return new IsosurfaceMesh(v, t);
	}

	private void polygonize(final int[] tet, final int[] index, final double[] val) {
		final List<Integer> in = new ArrayList<>(4);
		final List<Integer> out = new ArrayList<>(4);
		for (final int c : tet) {
			if (val[c] < isovalue) in.add(c);
			else out.add(c);
		}
		switch (in.size()) {
		case 1:
			fan(in.get(0), out, index, val);
			break;
		case 3:
			fan(out.get(0), in, index, val);
			break;
		case 2:
			final int a = in.get(0), b = in.get(1), c = out.get(0), d = out.get(1);
			final int ac = edgeVertex(a, c, index, val);
			final int ad = edgeVertex(a, d, index, val);
			final int bd = edgeVertex(b, d, index, val);
			final int bc = edgeVertex(b, c, index, val);
			addTriangle(ac, ad, bd);
			addTriangle(ac, bd, bc);
			break;
		default:
			break; // tetrahedron entirely on one side
		}
	}

	private void fan(final int apex, final List<Integer> others, final int[] index, final double[] val) {
		addTriangle(edgeVertex(apex, others.get(0), index, val), edgeVertex(apex, others.get(1), index, val),
				edgeVertex(apex, others.get(2), index, val));
	}

	private void addTriangle(final int v0, final int v1, final int v2) {
		triangles.add(v0);
		triangles.add(v1);
		triangles.add(v2);
	}

	/** Returns the index of the surface vertex on the edge between two cell corners */
	private int edgeVertex(final int c0, final int c1, final int[] index, final double[] val) {
		final int p0 = Math.min(index[c0], index[c1]);
		final int p1 = Math.max(index[c0], index[c1]);
		final long key = (long) p0 * grid.getNumberOfPoints() + p1;
		final Integer existing = edgeVertices.get(key);
		if (existing != null) return existing;

		final double v0 = val[c0];
		final double v1 = val[c1];
		final double t = (v1 == v0) ? 0.5 : (isovalue - v0) / (v1 - v0);
		final double[] pos0 = cornerPosition(index[c0]);
		final double[] pos1 = cornerPosition(index[c1]);
		final int vertex = vertices.size() / 3;
		for (int d = 0; d < 3; d++) {
			vertices.add((float) (pos0[d] + t * (pos1[d] - pos0[d])));
		}
		edgeVertices.put(key, vertex);
		return vertex;
	}

	private double[] cornerPosition(final int gridIndex) {
		final int i = gridIndex % dims[0];
		final int j = (gridIndex / dims[0]) % dims[1];
		final int k = gridIndex / (dims[0] * dims[1]);
		final double[] pos = new double[3];
		grid.position(i, j, k, pos);
		return pos;
	}

}
