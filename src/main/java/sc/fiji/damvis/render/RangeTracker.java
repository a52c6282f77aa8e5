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

import org.apache.commons.math3.util.Precision;

import sc.fiji.damvis.DamVisUtils;
import sc.fiji.damvis.mesh.ScalarSelection;

/**
 * Keeps track of the effective value range used to map scalars to colors and
 * opacities, so that the scale stays consistent across frames.
 * <p>
 * A manual range that matches the auto-detected range within
 * {@link #TOLERANCE} on both ends is treated as automatic, and the displayed
 * manual values are snapped to the automatic ones. Any other manual range is
 * an override: it is used verbatim on every frame until the scalar selection
 * changes, at which point the tracker resets to the automatic range of the new
 * scalar.
 * </p>
 */
public class RangeTracker {

	/** Maximum difference between manual and auto values still considered equal */
	public static final double TOLERANCE = 0.001;

	private ScalarSelection selection;
	private ValueRange range = ValueRange.UNSET;
	private double manualMin = Double.NaN;
	private double manualMax = Double.NaN;

	/**
	 * Updates the effective range.
	 *
	 * @param scalarSelection the scalar currently displayed
	 * @param autoMin the auto-detected minimum
	 * @param autoMax the auto-detected maximum
	 * @param currentManualMin the minimum currently entered by the operator. NaN
	 *          if none
	 * @param currentManualMax the maximum currently entered by the operator. NaN
	 *          if none
	 * @return the effective range
	 * @throws IllegalArgumentException if the auto-detected range is invalid
	 */
	public ValueRange update(final ScalarSelection scalarSelection, final double autoMin, final double autoMax,
			final double currentManualMin, final double currentManualMax) {
		final ValueRange auto = ValueRange.auto(autoMin, autoMax);
		if (!auto.isValid()) throw new IllegalArgumentException("Invalid auto-detected range " + auto);
		if (selection != null && !selection.equals(scalarSelection)) {
			DamVisUtils.log("Scalar changed from " + selection + " to " + scalarSelection + ": range reset");
			selection = scalarSelection;
			return snapToAuto(auto);
		}
		selection = scalarSelection;
		if (Double.isNaN(currentManualMin) || Double.isNaN(currentManualMax)) {
			return snapToAuto(auto);
		}
		if (Precision.equals(currentManualMin, autoMin, TOLERANCE)
				&& Precision.equals(currentManualMax, autoMax, TOLERANCE)) {
			return snapToAuto(auto);
		}
		final ValueRange manual = ValueRange.manual(currentManualMin, currentManualMax);
		if (!manual.isValid()) {
			DamVisUtils.warn("Ignoring invalid manual range " + manual + ". Using " + auto);
			return snapToAuto(auto);
		}
		if (!manual.equals(range)) DamVisUtils.log("Manual range override: " + manual);
		manualMin = currentManualMin;
		manualMax = currentManualMax;
		range = manual;
		return range;
	}

	private ValueRange snapToAuto(final ValueRange auto) {
		manualMin = auto.getMin();
		manualMax = auto.getMax();
		range = auto;
		return range;
	}

	/** @return the effective range of the last update, or {@link ValueRange#UNSET} */
	public ValueRange getRange() {
		return range;
	}

	/** @return the minimum to be displayed in manual-entry fields */
	public double getManualMin() {
		return manualMin;
	}

	/** @return the maximum to be displayed in manual-entry fields */
	public double getManualMax() {
		return manualMax;
	}

	public ScalarSelection getSelection() {
		return selection;
	}

	/** Forgets any tracked selection and override. */
	public void reset() {
		selection = null;
		range = ValueRange.UNSET;
		manualMin = Double.NaN;
		manualMax = Double.NaN;
	}

}
