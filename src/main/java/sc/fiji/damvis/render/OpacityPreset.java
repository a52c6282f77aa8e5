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

import java.util.Locale;

/**
 * Opacity channel presets. Shape presets are computed for any channel count;
 * profile presets are fixed 9-channel tables linearly resampled to the
 * requested count.
 */
public enum OpacityPreset {

	/** All channels fully opaque */
	FULL,
	/** Opacity rising linearly from 0 to 1 */
	LINEAR_UP,
	/** Opacity falling linearly from 1 to 0 */
	LINEAR_DOWN,
	/** Peak of 1 at the center, 0 at both ends */
	MAX_MIDDLE,
	/** 1 at both ends, 0 at the center */
	MAX_SIDES,
	/** Narrow opaque band in the lower-middle range */
	SHARP_CORE(0.1, 0.2, 1.0, 0.9, 0.2, 0.1, 0.0, 0.0, 0.0),
	/** Opaque core with faint surroundings */
	CORE_CONTEXT(0.4, 0.5, 1.0, 1.0, 0.5, 0.3, 0.1, 0.1, 0.0),
	/** Wider, smoother core */
	SMOOTH_CORE(0.3, 0.6, 1.0, 0.8, 0.4, 0.2, 0.1, 0.0, 0.0);

	private final double[] profile;

	OpacityPreset(final double... profile) {
		this.profile = profile;
	}

	/**
	 * @param name the preset name, e.g., "linear-up", "MAX_MIDDLE", "Sharp core"
	 * @return the matching preset
	 * @throws IllegalArgumentException if name is not recognized
	 */
	public static OpacityPreset fromName(final String name) {
		if (name == null) throw new IllegalArgumentException("Preset name cannot be null");
		return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_'));
	}

	/**
	 * Computes this preset for the specified number of channels.
	 *
	 * @param n the number of channels (&ge; 2)
	 * @return the preset samples
	 */
	public OpacityChannels channels(final int n) {
		if (n < 2) throw new IllegalArgumentException("At least two opacity channels are required");
		if (profile.length > 0) return OpacityChannels.of(profile).resampledTo(n);
		final double last = n - 1;
		final double mid = last / 2;
		final double[] samples = new double[n];
		for (int i = 0; i < n; i++) {
			samples[i] = switch (this) {
				case FULL -> 1d;
				case LINEAR_UP -> i / last;
				case LINEAR_DOWN -> (last - i) / last;
				case MAX_MIDDLE -> Math.max(0, 1 - Math.abs(i - mid) / mid);
				case MAX_SIDES -> Math.min(1, Math.abs(i - mid) / mid);
				default -> throw new IllegalStateException("Unhandled preset " + this);
			};
		}
		return OpacityChannels.of(samples);
	}

	/**
	 * Computes this preset for the channel count of the specified channels.
	 */
	public OpacityChannels channels(final OpacityChannels current) {
		return channels(current.size());
	}

}
