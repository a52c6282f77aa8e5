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

import sc.fiji.damvis.DamVisUtils;

/**
 * Resolves a {@link ScalarSelection} against a mesh into a point-granularity
 * {@link ScalarField}. Cell data is promoted to point data. If the requested
 * array does not exist the first available array is used instead: point
 * arrays are preferred over cell arrays.
 */
public class ScalarResolver {

	private ScalarResolver() {}

	/**
	 * @param mesh the frame mesh
	 * @param selection the requested scalar
	 * @return the resolved field. Its name reflects any substitution
	 * @throws IllegalArgumentException if the mesh holds no scalar arrays at all
	 */
	public static ScalarField resolve(final ResistivityMesh mesh, final ScalarSelection selection) {
		final ScalarSelection resolved = resolveSelection(mesh, selection);
		final double[] values = (resolved.isCellData()) ? mesh.cellToPoint(resolved.getName())
				: mesh.getPointArrays().get(resolved.getName());
		return new ScalarField(resolved.getName(), mesh.getPoints(), values);
	}

	/**
	 * Determines which array will actually be used for a selection.
	 *
	 * @return the selection itself if available, otherwise its substitute
	 * @throws IllegalArgumentException if the mesh holds no scalar arrays at all
	 */
	public static ScalarSelection resolveSelection(final ResistivityMesh mesh, final ScalarSelection selection) {
		final Map<String, double[]> requested = (selection.isCellData()) ? mesh.getCellArrays()
				: mesh.getPointArrays();
		if (requested.containsKey(selection.getName())) return selection;
		final ScalarSelection substitute;
		if (!mesh.getPointArrays().isEmpty()) {
			substitute = ScalarSelection.point(mesh.getPointArrays().keySet().iterator().next());
		} else if (!mesh.getCellArrays().isEmpty()) {
			substitute = ScalarSelection.cell(mesh.getCellArrays().keySet().iterator().next());
		} else {
			throw new IllegalArgumentException("Mesh has no scalar arrays: cannot resolve " + selection);
		}
		DamVisUtils.warn("Scalar " + selection + " not found. Using " + substitute + " instead");
		return substitute;
	}

}
