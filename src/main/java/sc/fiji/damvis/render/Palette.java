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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import sc.fiji.damvis.DamVisUtils;

/**
 * Named colormaps used to build color transfer functions. Each palette is an
 * ordered table of anchors {@code {fraction, red, green, blue}}, with fractions
 * in [0, 1] (not necessarily evenly spaced) and color channels in [0, 1].
 */
public enum Palette {

	RDYLBU_R("RdYlBu_r", new double[][] { //
			{ 0.0, 0.0, 0.0, 1.0 }, // blue
			{ 0.3, 0.0, 1.0, 1.0 }, // cyan
			{ 0.5, 1.0, 1.0, 0.0 }, // yellow
			{ 0.7, 1.0, 0.5, 0.0 }, // orange
			{ 1.0, 1.0, 0.0, 0.0 } // red
	}),

	VIRIDIS("viridis", new double[][] { //
			{ 0.00, 0.267, 0.004, 0.329 }, //
			{ 0.25, 0.229, 0.322, 0.545 }, //
			{ 0.50, 0.127, 0.566, 0.550 }, //
			{ 0.75, 0.369, 0.788, 0.382 }, //
			{ 1.00, 0.993, 0.906, 0.144 } //
	}),

	PLASMA("plasma", new double[][] { //
			{ 0.00, 0.050, 0.030, 0.529 }, //
			{ 0.25, 0.494, 0.016, 0.655 }, //
			{ 0.50, 0.808, 0.067, 0.472 }, //
			{ 0.75, 0.965, 0.451, 0.176 }, //
			{ 1.00, 0.984, 0.906, 0.145 } //
	}),

	INFERNO("inferno", new double[][] { //
			{ 0.00, 0.000, 0.000, 0.014 }, //
			{ 0.25, 0.341, 0.062, 0.429 }, //
			{ 0.50, 0.733, 0.216, 0.329 }, //
			{ 0.75, 0.976, 0.576, 0.176 }, //
			{ 1.00, 0.988, 0.998, 0.645 } //
	}),

	JET("jet", new double[][] { //
			{ 0.0, 0.0, 0.0, 0.5 }, //
			{ 0.2, 0.0, 0.0, 1.0 }, //
			{ 0.4, 0.0, 1.0, 1.0 }, //
			{ 0.6, 1.0, 1.0, 0.0 }, //
			{ 0.8, 1.0, 0.0, 0.0 }, //
			{ 1.0, 0.5, 0.0, 0.0 } //
	}),

	RAINBOW("rainbow", new double[][] { //
			{ 0.00, 0.5, 0.0, 1.0 }, //
			{ 0.17, 0.0, 0.0, 1.0 }, //
			{ 0.33, 0.0, 1.0, 1.0 }, //
			{ 0.50, 0.0, 1.0, 0.0 }, //
			{ 0.67, 1.0, 1.0, 0.0 }, //
			{ 0.83, 1.0, 0.5, 0.0 }, //
			{ 1.00, 1.0, 0.0, 0.0 } //
	});

	/** The palette used when a name cannot be resolved */
	public static final Palette DEFAULT = RDYLBU_R;

	private static final Map<String, Palette> BY_NAME = new LinkedHashMap<>();

	static {
		for (final Palette p : values()) {
			BY_NAME.put(p.label.toLowerCase(Locale.ROOT), p);
			BY_NAME.put(p.name().toLowerCase(Locale.ROOT), p);
		}
	}

	private final String label;
	private final double[][] anchors;

	Palette(final String label, final double[][] anchors) {
		this.label = label;
		this.anchors = anchors;
	}

	/**
	 * Returns a palette from its name (e.g., "RdYlBu_r", "viridis", "jet").
	 * Matching is case-insensitive.
	 *
	 * @param name the palette name
	 * @return the matching palette, or {@link #DEFAULT} if name is not recognized
	 */
	public static Palette fromName(final String name) {
		if (name == null || name.isBlank()) return DEFAULT;
		final Palette palette = BY_NAME.get(name.trim().toLowerCase(Locale.ROOT));
		if (palette == null) {
			DamVisUtils.warn("Unknown palette '" + name + "'. Using " + DEFAULT.label);
			return DEFAULT;
		}
		return palette;
	}

	/** @return the labels of all palettes, in display order */
	public static List<String> labels() {
		return Collections.unmodifiableList(Arrays.stream(values()).map(Palette::label).collect(Collectors.toList()));
	}

	public String label() {
		return label;
	}

	/** @return a copy of this palette's anchors as {fraction, r, g, b} rows */
	public double[][] anchors() {
		final double[][] copy = new double[anchors.length][];
		for (int i = 0; i < anchors.length; i++)
			copy[i] = anchors[i].clone();
		return copy;
	}

	@Override
	public String toString() {
		return label;
	}

}
