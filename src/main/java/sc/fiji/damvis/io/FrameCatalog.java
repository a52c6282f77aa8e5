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

package sc.fiji.damvis.io;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

import sc.fiji.damvis.DamVisUtils;

/**
 * The ordered set of frame files in a data directory. Frame files are named
 * {@code <prefix>..._<index><extension>}, e.g., {@code dcinv_12.vtk}: frames
 * are ordered by the numeric value of their index, not by file name.
 */
public class FrameCatalog {

	public static final String DEFAULT_PREFIX = "dcinv";
	public static final String DEFAULT_EXTENSION = ".vtk";

	private static final Pattern INDEX_PATTERN = Pattern.compile("\\d+");

	private final File directory;
	private final SortedMap<Integer, File> files;

	private FrameCatalog(final File directory, final SortedMap<Integer, File> files) {
		this.directory = directory;
		this.files = Collections.unmodifiableSortedMap(files);
	}

	/** @return a catalog with no frames and no directory */
	public static FrameCatalog empty() {
		return new FrameCatalog(null, new TreeMap<>());
	}

	/**
	 * Discovers frame files using the default prefix and extension.
	 *
	 * @see #discover(File, String, String)
	 */
	public static FrameCatalog discover(final File directory) {
		return discover(directory, DEFAULT_PREFIX, DEFAULT_EXTENSION);
	}

	/**
	 * Discovers frame files in a directory. Files not matching the naming
	 * scheme are ignored. An empty catalog is not an error, but is logged as a
	 * warning.
	 *
	 * @param directory the data directory
	 * @param prefix the required file name prefix
	 * @param extension the required file name extension, including the dot
	 * @return the catalog
	 * @throws IllegalArgumentException if directory is not a readable directory
	 */
	public static FrameCatalog discover(final File directory, final String prefix, final String extension) {
		if (directory == null || !directory.isDirectory())
			throw new IllegalArgumentException("Not a directory: " + directory);
		final File[] candidates = directory.listFiles();
		if (candidates == null) throw new IllegalArgumentException("Directory cannot be read: " + directory);
		Arrays.sort(candidates);
		final SortedMap<Integer, File> files = new TreeMap<>();
		for (final File file : candidates) {
			if (!file.isFile()) continue;
			final Integer index = parseIndex(file.getName(), prefix, extension);
			if (index == null) continue;
			final File previous = files.putIfAbsent(index, file);
			if (previous != null) {
				DamVisUtils.warn("Frame " + index + " found in both " + previous.getName() + " and "
						+ file.getName() + ". Ignoring the latter");
			}
		}
		if (files.isEmpty()) {
			DamVisUtils.warn("No " + prefix + "*" + extension + " files found in " + directory);
		} else {
			DamVisUtils.log("Found " + files.size() + " frames in " + directory);
		}
		return new FrameCatalog(directory, files);
	}

	/**
	 * Extracts the frame index of a file name.
	 *
	 * @return the integer between the last underscore and the extension, or
	 *         null if the file name does not follow the naming scheme
	 */
	static Integer parseIndex(final String fileName, final String prefix, final String extension) {
		if (!fileName.startsWith(prefix) || !fileName.endsWith(extension)) return null;
		final String stem = fileName.substring(0, fileName.length() - extension.length());
		final int underscore = stem.lastIndexOf('_');
		if (underscore < 0) return null;
		final String token = stem.substring(underscore + 1);
		if (!INDEX_PATTERN.matcher(token).matches()) return null;
		try {
			return Integer.valueOf(token);
		} catch (final NumberFormatException ignored) {
			return null; // too many digits
		}
	}

	/** @return the directory this catalog was built from, or null */
	public File getDirectory() {
		return directory;
	}

	/** @return the file of a frame, or null if no such frame exists */
	public File get(final int index) {
		return files.get(index);
	}

	public boolean contains(final int index) {
		return files.containsKey(index);
	}

	/** @return frame indices in ascending numeric order */
	public List<Integer> indices() {
		return new ArrayList<>(files.keySet());
	}

	/** @return frames in ascending index order */
	public List<Frame> frames() {
		final List<Frame> frames = new ArrayList<>(files.size());
		for (final Map.Entry<Integer, File> entry : files.entrySet())
			frames.add(new Frame(entry.getKey(), entry.getValue()));
		return frames;
	}

	/** @return the index → file map, in ascending index order */
	public SortedMap<Integer, File> asMap() {
		return files;
	}

	/** @return the first frame index. Throws if empty */
	public int first() {
		return files.firstKey();
	}

	/** @return the last frame index. Throws if empty */
	public int last() {
		return files.lastKey();
	}

	public int size() {
		return files.size();
	}

	public boolean isEmpty() {
		return files.isEmpty();
	}

	@Override
	public String toString() {
		return "FrameCatalog[" + directory + ", " + files.size() + " frames]";
	}

}
