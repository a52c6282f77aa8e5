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

import java.util.Map;

import sc.fiji.damvis.util.BoundingBox;

/**
 * Read-only view of one frame of an inversion mesh, as supplied by a
 * {@link sc.fiji.damvis.io.MeshReader}. Implementations own the mesh topology;
 * DamVis only needs coordinates, named scalar arrays and cell-to-point
 * promotion.
 */
public interface ResistivityMesh {

	/** @return the axis-aligned bounds of all mesh points */
	BoundingBox getBounds();

	/** @return the point coordinates, each as {x, y, z} */
	double[][] getPoints();

	/** @return the named scalar arrays defined per point, in insertion order */
	Map<String, double[]> getPointArrays();

	/** @return the named scalar arrays defined per cell, in insertion order */
	Map<String, double[]> getCellArrays();

	/**
	 * Promotes a cell array to point granularity.
	 *
	 * @param cellArrayName the name of an existing cell array
	 * @return one value per mesh point
	 * @throws IllegalArgumentException if no such cell array exists
	 */
	double[] cellToPoint(String cellArrayName);

}
