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
 * A triangle mesh in world coordinates. Vertices are stored as consecutive
 * (x, y, z) triplets and triangles as consecutive vertex index triplets.
 */
public class IsosurfaceMesh {

	private final float[] vertices;
	private final int[] triangles;

	public IsosurfaceMesh(final float[] vertices, final int[] triangles) {
		if (vertices.length % 3 != 0 || triangles.length % 3 != 0)
			throw new IllegalArgumentException("Vertex and triangle arrays must hold triplets");
		this.vertices = vertices;
		this.triangles = triangles;
	}

	public float[] getVertices() {
		return vertices;
	}

	public int[] getTriangles() {
		return triangles;
	}

	public int getVertexCount() {
		return vertices.length / 3;
	}

	public int getTriangleCount() {
		return triangles.length / 3;
	}

	public boolean isEmpty() {
		return triangles.length == 0;
	}

	public void getVertex(final int index, final double[] pos) {
		pos[0] = vertices[3 * index];
		pos[1] = vertices[3 * index + 1];
		pos[2] = vertices[3 * index + 2];
	}

	@Override
	public String toString() {
		return "IsosurfaceMesh[" + getVertexCount() + " vertices, " + getTriangleCount() + " triangles]";
	}

}
