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
import java.util.Collections;
import java.util.List;

import sc.fiji.damvis.DamVisUtils;
import sc.fiji.damvis.render.ValueRange;
import sc.fiji.damvis.volume.UniformGrid;

/**
 * Selects isovalues, decides how isosurfaces and the volume rendering are
 * displayed together, and extracts isosurface geometry.
 * <p>
 * In multiple mode surfaces are placed strictly inside the active range, at
 * {@code min + k * (max - min) / (count + 1)} for {@code k = 1..count}, since
 * surfaces at the range ends would be degenerate. The thresholds of the
 * co-visibility policy are fixed heuristics.
 * </p>
 */
public class IsosurfaceGenerator {

	/** Opacity multiplier applied to each surface when more than one is shown */
	public static final double MULTI_SURFACE_OPACITY_FACTOR = 0.7;
	/** Surface opacity at or above which the volume is hidden */
	public static final double VOLUME_HIDE_THRESHOLD = 0.9;
	/** Surface opacity at or above which volume opacity is reduced */
	public static final double VOLUME_DIM_THRESHOLD = 0.8;
	/** Volume opacity multiplier applied above {@link #VOLUME_DIM_THRESHOLD} */
	public static final double VOLUME_DIM_FACTOR = 0.7;

	private IsosurfaceGenerator() {}

	/**
	 * Selects the isosurfaces to be displayed.
	 *
	 * @param range the active value range
	 * @param spec the isosurface settings
	 * @return the isosurfaces (without geometry), ordered by isovalue
	 */
	public static List<Isosurface> generate(final ValueRange range, final IsosurfaceSpec spec) {
		if (spec.getMode() == IsosurfaceSpec.Mode.MULTIPLE) {
			final int count = spec.getCount();
			if (range.isValid() && range.getMax() > range.getMin() && count > 1) {
				final double step = range.getSpan() / (count + 1);
				final double opacity = spec.getOpacity() * MULTI_SURFACE_OPACITY_FACTOR;
				final List<Isosurface> surfaces = new ArrayList<>(count);
				for (int k = 1; k <= count; k++) {
					surfaces.add(new Isosurface(range.getMin() + k * step, opacity));
				}
				return surfaces;
			}
			DamVisUtils.log("Multiple isosurfaces not possible over " + range + " with count " + count
					+ ": falling back to a single surface");
		}
		return Collections.singletonList(new Isosurface(singleValue(range, spec), spec.getOpacity()));
	}

	private static double singleValue(final ValueRange range, final IsosurfaceSpec spec) {
		if (!Double.isNaN(spec.getValue())) return spec.getValue();
		if (!range.isValid()) throw new IllegalArgumentException("No isovalue specified and range is invalid: " + range);
		return range.valueAt(0.5);
	}

	/**
	 * Decides how the volume rendering is displayed alongside isosurfaces: with
	 * opaque surfaces (opacity &ge; {@value #VOLUME_HIDE_THRESHOLD}) the volume
	 * is hidden; with nearly opaque surfaces (opacity &ge;
	 * {@value #VOLUME_DIM_THRESHOLD}) volume opacity is scaled by
	 * {@value #VOLUME_DIM_FACTOR}.
	 *
	 * @param showVolume whether the volume rendering is requested
	 * @param showIsosurfaces whether isosurfaces are requested
	 * @param spec the isosurface settings
	 * @return the co-visibility decision
	 */
	public static CoVisibility coVisibility(final boolean showVolume, final boolean showIsosurfaces,
			final IsosurfaceSpec spec) {
		if (!showVolume) return CoVisibility.HIDDEN;
		if (!showIsosurfaces) return CoVisibility.UNCHANGED;
		if (spec.getOpacity() >= VOLUME_HIDE_THRESHOLD) return CoVisibility.HIDDEN;
		if (spec.getOpacity() >= VOLUME_DIM_THRESHOLD) return new CoVisibility(true, VOLUME_DIM_FACTOR);
		return CoVisibility.UNCHANGED;
	}

	/**
	 * Extracts the geometry of each isosurface from a grid.
	 *
	 * @param grid the (cleaned) uniform grid
	 * @param surfaces the isosurfaces to extract
	 * @return the isosurfaces with their geometry
	 */
	public static List<Isosurface> extract(final UniformGrid grid, final List<Isosurface> surfaces) {
		final List<Isosurface> result = new ArrayList<>(surfaces.size());
		for (final Isosurface surface : surfaces) {
			final IsosurfaceMesh mesh = MarchingTetrahedra.extract(grid, surface.getIsovalue());
			DamVisUtils.log("Isosurface at " + DamVisUtils.formatDouble(surface.getIsovalue(), 3) + ": " + mesh);
			result.add(surface.withMesh(mesh));
		}
		return result;
	}

}
