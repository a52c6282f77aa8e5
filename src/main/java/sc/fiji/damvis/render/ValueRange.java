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

import java.util.Objects;

/**
 * A scalar value range and where it came from. A range whose minimum exceeds
 * its maximum (or that holds NaN) is considered unset.
 */
public final class ValueRange {

	public enum Provenance {
		/** detected from the data */
		AUTO,
		/** entered by the operator */
		MANUAL
	}

	public static final ValueRange UNSET = new ValueRange(Double.NaN, Double.NaN, Provenance.AUTO);

	private final double min;
	private final double max;
	private final Provenance provenance;

	public ValueRange(final double min, final double max, final Provenance provenance) {
		this.min = min;
		this.max = max;
		this.provenance = Objects.requireNonNull(provenance);
	}

	public static ValueRange auto(final double min, final double max) {
		return new ValueRange(min, max, Provenance.AUTO);
	}

	public static ValueRange manual(final double min, final double max) {
		return new ValueRange(min, max, Provenance.MANUAL);
	}

	public double getMin() {
		return min;
	}

	public double getMax() {
		return max;
	}

	public double getSpan() {
		return max - min;
	}

	public Provenance getProvenance() {
		return provenance;
	}

	public boolean isManual() {
		return provenance == Provenance.MANUAL;
	}

	/** @return true if min &le; max and both are finite */
	public boolean isValid() {
		return Double.isFinite(min) && Double.isFinite(max) && min <= max;
	}

	/** @return the value at the specified fraction of this range */
	public double valueAt(final double fraction) {
		return min + fraction * (max - min);
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof ValueRange)) return false;
		final ValueRange other = (ValueRange) o;
		return Double.compare(min, other.min) == 0 && Double.compare(max, other.max) == 0
				&& provenance == other.provenance;
	}

	@Override
	public int hashCode() {
		return Objects.hash(min, max, provenance);
	}

	@Override
	public String toString() {
		return "[" + min + ", " + max + "] (" + provenance.name().toLowerCase() + ")";
	}

}
