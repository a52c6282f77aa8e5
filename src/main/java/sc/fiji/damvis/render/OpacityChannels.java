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

import java.util.Arrays;

/**
 * A fixed-length sequence of opacity samples in [0, 1], evenly distributed
 * over the value range when converted into an
 * {@link OpacityTransferFunction}.
 */
public final class OpacityChannels {

	/** The 18-channel profile of the interactive viewer */
	public static final OpacityChannels DEFAULT = of(0.0, 0.05, 0.1, 0.15, 0.2, 0.4, 0.6, 0.8, 1.0, 0.9, 0.7, 0.5,
			0.3, 0.2, 0.1, 0.05, 0.0, 0.0);

	private final double[] samples;

	private OpacityChannels(final double[] samples) {
		if (samples == null || samples.length < 2)
			throw new IllegalArgumentException("At least two opacity channels are required");
		for (final double s : samples) {
			if (!(s >= 0 && s <= 1)) throw new IllegalArgumentException("Opacity out of [0, 1]: " + s);
		}
		this.samples = samples;
	}

	/**
	 * @param samples the opacity samples, each in [0, 1]
	 * @throws IllegalArgumentException if fewer than two samples are given or
	 *           any sample is outside [0, 1]
	 */
	public static OpacityChannels of(final double... samples) {
		return new OpacityChannels(samples.clone());
	}

	/**
	 * Parses a comma-separated list of samples, e.g., as stored in preferences.
	 */
	public static OpacityChannels parse(final String csv) {
		if (csv == null || csv.isBlank()) throw new IllegalArgumentException("No opacity channels specified");
		final String[] tokens = csv.split(",");
		final double[] samples = new double[tokens.length];
		try {
			for (int i = 0; i < tokens.length; i++)
				samples[i] = Double.parseDouble(tokens[i].trim());
		} catch (final NumberFormatException e) {
			throw new IllegalArgumentException("Invalid opacity channels: " + csv, e);
		}
		return new OpacityChannels(samples);
	}

	public int size() {
		return samples.length;
	}

	public double get(final int index) {
		return samples[index];
	}

	public double[] toArray() {
		return samples.clone();
	}

	/**
	 * Linearly resamples these channels to a different channel count, keeping
	 * the first and last samples in place.
	 *
	 * @param n the new number of channels (&ge; 2)
	 */
	public OpacityChannels resampledTo(final int n) {
		if (n == samples.length) return this;
		if (n < 2) throw new IllegalArgumentException("At least two opacity channels are required");
		final double[] result = new double[n];
		for (int i = 0; i < n; i++) {
			final double x = (double) i * (samples.length - 1) / (n - 1);
			final int lo = (int) Math.floor(x);
			final int hi = Math.min(lo + 1, samples.length - 1);
			final double t = x - lo;
			result[i] = Math.max(0, Math.min(1, samples[lo] + t * (samples[hi] - samples[lo])));
		}
		return new OpacityChannels(result);
	}

	/** @return the channels as a comma-separated list */
	public String toCsv() {
		final StringBuilder sb = new StringBuilder();
		for (int i = 0; i < samples.length; i++) {
			if (i > 0) sb.append(",");
			sb.append(samples[i]);
		}
		return sb.toString();
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof OpacityChannels)) return false;
		return Arrays.equals(samples, ((OpacityChannels) o).samples);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(samples);
	}

	@Override
	public String toString() {
		return Arrays.toString(samples);
	}

}
