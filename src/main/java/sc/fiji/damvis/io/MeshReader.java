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

package sc.fiji.damvis.io;

import java.io.File;
import java.io.IOException;

import sc.fiji.damvis.mesh.ResistivityMesh;

/**
 * Reads the mesh of one frame. Parsing of mesh file formats is left to
 * implementations of this interface.
 */
@FunctionalInterface
public interface MeshReader {

	/**
	 * @param file the frame file
	 * @return the frame's mesh
	 * @throws IOException if the file cannot be read or parsed
	 */
	ResistivityMesh read(File file) throws IOException;

}
