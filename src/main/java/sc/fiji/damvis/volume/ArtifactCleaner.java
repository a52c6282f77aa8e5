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

package sc.fiji.damvis.volume;

import org.apache.commons.math3.stat.StatUtils;

import sc.fiji.damvis.DamVisUtils;

/**
 * Removes interpolation artifacts from resampled data so that they fall below
 * the visible value range.
 * <p>
 * Two passes are applied, always in this order: non-finite samples (NaN,
 * &plusmn;Infinity) are replaced by the smallest finite sample minus one; then
 * samples outside the source range, widened by 10% of its span on each side,
 * are replaced by the source minimum minus one. The range check relies on the
 * first pass having removed non-finite values.
 * </p>
 */
public class ArtifactCleaner {

	/** Fraction of the source span tolerated beyond each end of the source range */
	public static final double RANGE_BUFFER = 0.1;
	/** Offset below the relevant minimum used for replacement values */
	public static final double SENTINEL_OFFSET = 1.0;

	private ArtifactCleaner() {}

	/**
	 * Cleans a resampled grid.
	 *
	 * @param grid the resampled grid
	 * @param source the values of the field the grid was sampled from
	 * @return the cleanup result, holding a new grid with cleaned values
	 */
	public static CleanupResult clean(final UniformGrid grid, final double[] source) {
		final CleanupResult result = clean(grid.getValues(), source);
		return result.withGrid(grid.withValues(result.getValues()));
	}

	/**
	 * Cleans resampled values. Neither input array is modified.
	 *
	 * @param resampled the interpolated values
	 * @param source the values of the original (irregular) field
	 * @return the cleaned values and the number of replacements of each kind
	 * @throws IllegalArgumentException if source holds no finite value
	 */
	public static CleanupResult clean(final double[] resampled, final double[] source) {
		final double[] validSource = finiteValues(source);
		if (validSource.length == 0) throw new IllegalArgumentException("Source field has no finite values");
		final double validMin = StatUtils.min(validSource);
		final double validMax = StatUtils.max(validSource);

		final double[] data = resampled.clone();

		// Pass 1: non-finite values
		final double[] finite = finiteValues(data);
		final double nanReplacement = ((finite.length == 0) ? validMin : StatUtils.min(finite)) - SENTINEL_OFFSET;
		int nanCount = 0;
		for (int i = 0; i < data.length; i++) {
			if (!Double.isFinite(data[i])) {
				data[i] = nanReplacement;
				nanCount++;
			}
		}
		if (nanCount > 0) DamVisUtils.log("Replaced " + nanCount + " NaN/Inf values");

		// Pass 2: out-of-range values
		final double buffer = (validMax - validMin) * RANGE_BUFFER;
		final double lower = validMin - buffer;
		final double upper = validMax + buffer;
		final double rangeReplacement = validMin - SENTINEL_OFFSET;
		int rangeCount = 0;
		for (int i = 0; i < data.length; i++) {
			if (data[i] < lower || data[i] > upper) {
				data[i] = rangeReplacement;
				rangeCount++;
			}
		}
		if (rangeCount > 0) DamVisUtils.log("Removed " + rangeCount + " out-of-range values");
		return new CleanupResult(data, nanCount, rangeCount, validMin, validMax);
	}

	private static double[] finiteValues(final double[] values) {
		int n = 0;
		for (final double v : values)
			if (Double.isFinite(v)) n++;
		final double[] result = new double[n];
		int i = 0;
		for (final double v : values)
			if (Double.isFinite(v)) result[i++] = v;
		return result;
	}

}
