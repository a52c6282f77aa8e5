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

package sc.fiji.damvis;

import java.util.Arrays;
import java.util.stream.Collectors;

import org.scijava.Context;
import org.scijava.prefs.PrefService;

import sc.fiji.damvis.iso.IsosurfaceSpec;
import sc.fiji.damvis.mesh.ScalarSelection;
import sc.fiji.damvis.render.OpacityChannels;
import sc.fiji.damvis.util.BoundingBox;

/**
 * Class handling DamVis preferences, i.e., the session settings that persist
 * across runs.
 */
public class DamVisPrefs {

	public static final String DEBUG = "debug";
	public static final boolean DEF_DEBUG = false;

	public static final String TARGET_CELLS = "targetCells";
	public static final String CLIP_BOUNDS = "clipBounds";
	/** Stored under {@link #CLIP_BOUNDS} when the whole mesh is shown */
	public static final String NO_CLIP_BOUNDS = "none";
	public static final String SCALAR_NAME = "scalarName";
	public static final String SCALAR_CELL_DATA = "scalarCellData";
	public static final String PALETTE = "palette";
	public static final String OPACITY_CHANNELS = "opacityChannels";
	public static final String ISO_MODE = "isoMode";
	public static final String ISO_VALUE = "isoValue";
	public static final String ISO_COUNT = "isoCount";
	public static final String ISO_OPACITY = "isoOpacity";
	public static final String SHOW_VOLUME = "showVolume";
	public static final String SHOW_ISOSURFACES = "showIsosurfaces";
	public static final String FILE_PREFIX = "filePrefix";
	public static final String FILE_EXTENSION = "fileExtension";
	public static final String FRAME_RATE = "frameRate";

	/** Valid range of the cell budget offered to the operator */
	public static final long MIN_TARGET_CELLS = 10_000;
	public static final long MAX_TARGET_CELLS = 2_000_000;

	private static final int DEF_ISO_COUNT = 5;

	private final PrefService prefService;

	public DamVisPrefs() {
		this(DamVisUtils.getContext());
	}

	/**
	 * @param context the SciJava context providing the PrefService
	 */
	public DamVisPrefs(final Context context) {
		prefService = context.getService(PrefService.class);
	}

	/**
	 * Gets a boolean preference value.
	 *
	 * @param key the preference key
	 * @param defaultValue the default value if the key is not found
	 * @return the boolean preference value
	 */
	public boolean getBoolean(final String key, final boolean defaultValue) {
		return prefService.getBoolean(DamVisPrefs.class, key, defaultValue);
	}

	public String get(final String key, final String defaultValue) {
		return prefService.get(DamVisPrefs.class, key, defaultValue);
	}

	public int getInt(final String key, final int defaultValue) {
		return prefService.getInt(DamVisPrefs.class, key, defaultValue);
	}

	public long getLong(final String key, final long defaultValue) {
		return prefService.getLong(DamVisPrefs.class, key, defaultValue);
	}

	public double getDouble(final String key, final double defaultValue) {
		return prefService.getDouble(DamVisPrefs.class, key, defaultValue);
	}

	/**
	 * Sets a string preference value. A null value removes the key.
	 *
	 * @param key the preference key
	 * @param value the value to set
	 */
	public void set(final String key, final String value) {
		if (value == null)
			prefService.remove(DamVisPrefs.class, key);
		else
			prefService.put(DamVisPrefs.class, key, value);
	}

	public void set(final String key, final boolean value) {
		prefService.put(DamVisPrefs.class, key, value);
	}

	public void set(final String key, final int value) {
		prefService.put(DamVisPrefs.class, key, value);
	}

	public void set(final String key, final long value) {
		prefService.put(DamVisPrefs.class, key, value);
	}

	public void set(final String key, final double value) {
		prefService.put(DamVisPrefs.class, key, value);
	}

	public boolean isDebug() {
		return getBoolean(DEBUG, DEF_DEBUG);
	}

	public void setDebug(final boolean debug) {
		set(DEBUG, debug);
		DamVisUtils.setDebugMode(debug);
	}

	/**
	 * Applies stored preferences to a session. Keys that were never stored leave
	 * the session defaults untouched. Malformed values are ignored with a
	 * warning.
	 *
	 * @param session the session to be configured
	 */
	public void applyTo(final VisualizationSession session) {
		final long cells = getLong(TARGET_CELLS, session.getTargetCells());
		if (cells >= MIN_TARGET_CELLS && cells <= MAX_TARGET_CELLS)
			session.setTargetCells(cells);
		else
			DamVisUtils.warn("Ignoring stored cell budget out of range: " + cells);

		final String bounds = get(CLIP_BOUNDS, null);
		if (NO_CLIP_BOUNDS.equals(bounds)) {
			session.setClipBounds(null);
		} else if (bounds != null) {
			try {
				session.setClipBounds(parseBounds(bounds));
			} catch (final IllegalArgumentException ex) {
				DamVisUtils.warn("Ignoring stored clipping bounds '" + bounds + "': " + ex.getMessage());
			}
		}

		final String scalarName = get(SCALAR_NAME, null);
		if (scalarName != null && !scalarName.isEmpty()) {
			session.setScalar(ScalarSelection.of(scalarName, getBoolean(SCALAR_CELL_DATA, false)));
		}
		session.setPalette(get(PALETTE, session.getPalette()));

		final String channels = get(OPACITY_CHANNELS, null);
		if (channels != null) {
			try {
				session.setOpacityChannels(OpacityChannels.parse(channels));
			} catch (final IllegalArgumentException ex) {
				DamVisUtils.warn("Ignoring stored opacity channels '" + channels + "': " + ex.getMessage());
			}
		}

		session.setIsosurfaceSpec(readIsosurfaceSpec(session.getIsosurfaceSpec()));
		session.setShowVolume(getBoolean(SHOW_VOLUME, session.isShowVolume()));
		session.setShowIsosurfaces(getBoolean(SHOW_ISOSURFACES, session.isShowIsosurfaces()));
		session.setFilePattern(get(FILE_PREFIX, session.getFilePrefix()),
				get(FILE_EXTENSION, session.getFileExtension()));
		final int fps = getInt(FRAME_RATE, session.getFrameRate());
		if (fps > 0) session.setFrameRate(fps);
		if (isDebug()) DamVisUtils.setDebugMode(true);
	}

	private IsosurfaceSpec readIsosurfaceSpec(final IsosurfaceSpec current) {
		final String mode = get(ISO_MODE, current.getMode().name());
		final double opacity = getDouble(ISO_OPACITY, current.getOpacity());
		try {
			if (IsosurfaceSpec.Mode.MULTIPLE.name().equalsIgnoreCase(mode)) {
				return IsosurfaceSpec.multiple(getInt(ISO_COUNT, DEF_ISO_COUNT), opacity);
			}
			return IsosurfaceSpec.single(getDouble(ISO_VALUE, current.getValue()), opacity);
		} catch (final IllegalArgumentException ex) {
			DamVisUtils.warn("Ignoring stored isosurface settings: " + ex.getMessage());
			return current;
		}
	}

	/**
	 * Stores the persistable settings of a session. The manual range and the
	 * sequence-wide range are session-only and are not stored.
	 *
	 * @param session the session to be persisted
	 */
	public void storeFrom(final VisualizationSession session) {
		set(TARGET_CELLS, session.getTargetCells());
		set(CLIP_BOUNDS, (session.getClipBounds() == null) ? NO_CLIP_BOUNDS : toCsv(session.getClipBounds()));
		set(SCALAR_NAME, session.getScalar().getName());
		set(SCALAR_CELL_DATA, session.getScalar().isCellData());
		set(PALETTE, session.getPalette());
		set(OPACITY_CHANNELS, session.getOpacityChannels().toCsv());
		final IsosurfaceSpec spec = session.getIsosurfaceSpec();
		set(ISO_MODE, spec.getMode().name());
		set(ISO_VALUE, spec.getValue());
		set(ISO_COUNT, (spec.getMode() == IsosurfaceSpec.Mode.MULTIPLE) ? spec.getCount() : DEF_ISO_COUNT);
		set(ISO_OPACITY, spec.getOpacity());
		set(SHOW_VOLUME, session.isShowVolume());
		set(SHOW_ISOSURFACES, session.isShowIsosurfaces());
		set(FILE_PREFIX, session.getFilePrefix());
		set(FILE_EXTENSION, session.getFileExtension());
		set(FRAME_RATE, session.getFrameRate());
	}

	/** Clears all stored preferences. */
	public void reset() {
		prefService.clear(DamVisPrefs.class);
		DamVisUtils.setDebugMode(DEF_DEBUG);
	}

	/**
	 * Parses clipping bounds from six comma-separated values in
	 * {@code xmin,xmax,ymin,ymax,zmin,zmax} order.
	 */
	public static BoundingBox parseBounds(final String csv) {
		final String[] tokens = csv.split(",");
		if (tokens.length != 6) throw new IllegalArgumentException("Expected 6 values but got " + tokens.length);
		final double[] values = new double[6];
		for (int i = 0; i < 6; i++) {
			try {
				values[i] = Double.parseDouble(tokens[i].trim());
			} catch (final NumberFormatException ex) {
				throw new IllegalArgumentException("Not a number: " + tokens[i].trim());
			}
		}
		return BoundingBox.of(values);
	}

	private static String toCsv(final BoundingBox bounds) {
		return Arrays.stream(bounds.toArray()).mapToObj(String::valueOf).collect(Collectors.joining(","));
	}

}
