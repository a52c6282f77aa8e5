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

/**
 * The outcome of {@link ArtifactCleaner#clean(double[], double[])}: cleaned
 * values and diagnostic counts. Neither count signals an error.
 */
public class CleanupResult {

	private final double[] values;
	private final int nanCount;
	private final int rangeCount;
	private final double sourceMin;
	private final double sourceMax;
	private UniformGrid grid;

	CleanupResult(final double[] values, final int nanCount, final int rangeCount, final double sourceMin,
			final double sourceMax) {
		this.values = values;
		this.nanCount = nanCount;
		this.rangeCount = rangeCount;
		this.sourceMin = sourceMin;
		this.sourceMax = sourceMax;
	}

	CleanupResult withGrid(final UniformGrid grid) {
		this.grid = grid;
		return this;
	}

	/** @return the cleaned values. Free of NaN and infinite entries */
	public double[] getValues() {
		return values;
	}

	/** @return the cleaned grid, or null if cleanup was applied to a bare array */
	public UniformGrid getGrid() {
		return grid;
	}

	/** @return the number of NaN/Infinity samples that were replaced */
	public int getNanCount() {
		return nanCount;
	}

	/** @return the number of out-of-range samples that were replaced */
	public int getRangeCount() {
		return rangeCount;
	}

	/** @return the smallest finite value of the source field */
	public double getSourceMin() {
		return sourceMin;
	}

	/** @return the largest finite value of the source field */
	public double getSourceMax() {
		return sourceMax;
	}

	@Override
	public String toString() {
		return "CleanupResult[NaN/Inf replaced: " + nanCount + ", out-of-range replaced: " + rangeCount + "]";
	}

}
