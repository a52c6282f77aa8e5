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
 * One isosurface to be displayed: its isovalue, its opacity and, once
 * extracted, its geometry.
 */
public class Isosurface {

	private final double isovalue;
	private final double opacity;
	private final IsosurfaceMesh mesh;

	public Isosurface(final double isovalue, final double opacity) {
		this(isovalue, opacity, null);
	}

	private Isosurface(final double isovalue, final double opacity, final IsosurfaceMesh mesh) {
		this.isovalue = isovalue;
		this.opacity = opacity;
		this.mesh = mesh;
	}

	public Isosurface withMesh(final IsosurfaceMesh mesh) {
		return new Isosurface(isovalue, opacity, mesh);
	}

	public double getIsovalue() {
		return isovalue;
	}

	public double getOpacity() {
		return opacity;
	}

	/** @return the geometry, or null if not yet extracted */
	public IsosurfaceMesh getMesh() {
		return mesh;
	}

	@Override
	public String toString() {
		return "Isosurface[value=" + isovalue + ", opacity=" + opacity + ((mesh == null) ? "" : ", " + mesh) + "]";
	}

}
