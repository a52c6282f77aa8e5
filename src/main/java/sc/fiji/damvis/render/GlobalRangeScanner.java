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

package sc.fiji.damvis.render;

import java.io.IOException;

import sc.fiji.damvis.DamVisUtils;
import sc.fiji.damvis.io.Frame;
import sc.fiji.damvis.io.FrameCatalog;
import sc.fiji.damvis.io.MeshReader;
import sc.fiji.damvis.mesh.ScalarField;
import sc.fiji.damvis.mesh.ScalarResolver;
import sc.fiji.damvis.mesh.ScalarSelection;

/**
 * Computes the range of a scalar over a whole frame sequence, so that every
 * frame can be displayed with the same color scale.
 */
public class GlobalRangeScanner {

	private GlobalRangeScanner() {}

	/**
	 * Reads every frame of a catalog and returns the extrema of the selected
	 * scalar. Frames that cannot be read are skipped.
	 *
	 * @param catalog the frame catalog
	 * @param reader the mesh reader
	 * @param selection the scalar of interest
	 * @return the automatic range over all readable frames, or
	 *         {@link ValueRange#UNSET} if no frame could be read
	 */
	public static ValueRange scan(final FrameCatalog catalog, final MeshReader reader,
			final ScalarSelection selection) {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (final Frame frame : catalog.frames()) {
			final ScalarField field;
			try {
				field = ScalarResolver.resolve(reader.read(frame.file()), selection);
			} catch (final IOException | RuntimeException e) {
				DamVisUtils.warn("Skipping frame " + frame.index() + " in range scan: " + e.getMessage());
				continue;
			}
			final double[] range = field.getRange();
			if (Double.isNaN(range[0])) continue;
			min = Math.min(min, range[0]);
			max = Math.max(max, range[1]);
			DamVisUtils.log("Frame " + frame.index() + ": min=" + DamVisUtils.formatDouble(range[0], 3) + ", max="
					+ DamVisUtils.formatDouble(range[1], 3));
		}
		if (min > max) return ValueRange.UNSET;
		return ValueRange.auto(min, max);
	}

}
