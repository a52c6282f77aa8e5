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

import java.io.File;

import sc.fiji.damvis.io.FrameCatalog;
import sc.fiji.damvis.io.MeshReader;
import sc.fiji.damvis.iso.IsosurfaceSpec;
import sc.fiji.damvis.mesh.ScalarSelection;
import sc.fiji.damvis.render.GlobalRangeScanner;
import sc.fiji.damvis.render.OpacityChannels;
import sc.fiji.damvis.render.Palette;
import sc.fiji.damvis.render.RangeTracker;
import sc.fiji.damvis.render.ValueRange;
import sc.fiji.damvis.util.BoundingBox;

/**
 * The operator-editable state of a visualization session, passed explicitly
 * to every {@link FramePipeline} call. Not thread-safe: sessions are meant to
 * be driven from a single thread.
 *
 * @see DamVisPrefs#applyTo(VisualizationSession)
 */
public class VisualizationSession {

	public static final long DEFAULT_TARGET_CELLS = 500_000;
	public static final double[] DEFAULT_BOUNDS = { 2, 17, 2, 22, 22, 27 };
	public static final String DEFAULT_SCALAR = "Resistivity(log10)";
	public static final int DEFAULT_FRAME_RATE = 10;

	private File dataLocation;
	private FrameCatalog catalog = FrameCatalog.empty();
	private String filePrefix = FrameCatalog.DEFAULT_PREFIX;
	private String fileExtension = FrameCatalog.DEFAULT_EXTENSION;
	private MeshReader meshReader;

	private long targetCells = DEFAULT_TARGET_CELLS;
	private BoundingBox clipBounds = BoundingBox.of(DEFAULT_BOUNDS);
	private ScalarSelection scalar = ScalarSelection.point(DEFAULT_SCALAR);
	private String palette = Palette.DEFAULT.label();
	private OpacityChannels opacityChannels = OpacityChannels.DEFAULT;
	private double manualMin = Double.NaN;
	private double manualMax = Double.NaN;
	private ValueRange autoRange = ValueRange.UNSET;
	private IsosurfaceSpec isosurfaceSpec = IsosurfaceSpec.single(Double.NaN, 0.5);
	private boolean showVolume = true;
	private boolean showIsosurfaces;
	private int frameRate = DEFAULT_FRAME_RATE;
	private int currentFrame = -1;

	private final RangeTracker rangeTracker = new RangeTracker();

	public VisualizationSession() {
	}

	public VisualizationSession(final MeshReader meshReader) {
		this.meshReader = meshReader;
	}

	/**
	 * Sets the data directory and rebuilds the frame catalog.
	 *
	 * @param directory the directory holding frame files
	 * @return the new catalog. May be empty
	 * @throws IllegalArgumentException if directory is not a readable directory
	 */
	public FrameCatalog setDataLocation(final File directory) {
		catalog = FrameCatalog.discover(directory, filePrefix, fileExtension);
		dataLocation = directory;
		currentFrame = -1;
		return catalog;
	}

	public File getDataLocation() {
		return dataLocation;
	}

	public FrameCatalog getCatalog() {
		return catalog;
	}

	public String getFilePrefix() {
		return filePrefix;
	}

	public String getFileExtension() {
		return fileExtension;
	}

	/**
	 * Sets the naming scheme of frame files. Takes effect the next time the
	 * data location is set.
	 */
	public void setFilePattern(final String prefix, final String extension) {
		if (prefix == null || extension == null) throw new IllegalArgumentException("File pattern cannot be null");
		this.filePrefix = prefix;
		this.fileExtension = extension;
	}

	public MeshReader getMeshReader() {
		return meshReader;
	}

	public void setMeshReader(final MeshReader meshReader) {
		this.meshReader = meshReader;
	}

	public long getTargetCells() {
		return targetCells;
	}

	public void setTargetCells(final long targetCells) {
		this.targetCells = targetCells;
	}

	/** @return the clipping box, or null if the whole mesh is to be shown */
	public BoundingBox getClipBounds() {
		return clipBounds;
	}

	public void setClipBounds(final BoundingBox clipBounds) {
		this.clipBounds = clipBounds;
	}

	public ScalarSelection getScalar() {
		return scalar;
	}

	/**
	 * Selects the displayed scalar. Changing the selection discards the
	 * sequence-wide range and any manual range override.
	 */
	public void setScalar(final ScalarSelection scalar) {
		if (scalar == null) throw new IllegalArgumentException("Scalar selection cannot be null");
		if (!scalar.equals(this.scalar)) {
			autoRange = ValueRange.UNSET;
			manualMin = Double.NaN;
			manualMax = Double.NaN;
		}
		this.scalar = scalar;
	}

	public String getPalette() {
		return palette;
	}

	public void setPalette(final String palette) {
		this.palette = palette;
	}

	public OpacityChannels getOpacityChannels() {
		return opacityChannels;
	}

	public void setOpacityChannels(final OpacityChannels opacityChannels) {
		if (opacityChannels == null) throw new IllegalArgumentException("Opacity channels cannot be null");
		this.opacityChannels = opacityChannels;
	}

	public double getManualMin() {
		return manualMin;
	}

	public double getManualMax() {
		return manualMax;
	}

	/**
	 * Sets the range entered by the operator. NaN values clear the override.
	 */
	public void setManualRange(final double min, final double max) {
		this.manualMin = min;
		this.manualMax = max;
	}

	/** @return the sequence-wide automatic range, or {@link ValueRange#UNSET} */
	public ValueRange getAutoRange() {
		return autoRange;
	}

	public void setAutoRange(final ValueRange autoRange) {
		this.autoRange = (autoRange == null) ? ValueRange.UNSET : autoRange;
	}

	/**
	 * Scans every frame of the catalog for the extrema of the selected scalar
	 * and stores them as the sequence-wide automatic range.
	 *
	 * @return the scanned range. {@link ValueRange#UNSET} if no frame could be
	 *         read
	 * @throws IllegalStateException if no mesh reader has been set
	 */
	public ValueRange scanGlobalRange() {
		if (meshReader == null) throw new IllegalStateException("No mesh reader available");
		autoRange = GlobalRangeScanner.scan(catalog, meshReader, scalar);
		return autoRange;
	}

	public IsosurfaceSpec getIsosurfaceSpec() {
		return isosurfaceSpec;
	}

	public void setIsosurfaceSpec(final IsosurfaceSpec isosurfaceSpec) {
		if (isosurfaceSpec == null) throw new IllegalArgumentException("Isosurface settings cannot be null");
		this.isosurfaceSpec = isosurfaceSpec;
	}

	public boolean isShowVolume() {
		return showVolume;
	}

	public void setShowVolume(final boolean showVolume) {
		this.showVolume = showVolume;
	}

	public boolean isShowIsosurfaces() {
		return showIsosurfaces;
	}

	public void setShowIsosurfaces(final boolean showIsosurfaces) {
		this.showIsosurfaces = showIsosurfaces;
	}

	public int getFrameRate() {
		return frameRate;
	}

	public void setFrameRate(final int frameRate) {
		if (frameRate < 1) throw new IllegalArgumentException("Frame rate must be positive");
		this.frameRate = frameRate;
	}

	/** @return the index of the last frame rendered, or -1 */
	public int getCurrentFrame() {
		return currentFrame;
	}

	void setCurrentFrame(final int currentFrame) {
		this.currentFrame = currentFrame;
	}

	public RangeTracker getRangeTracker() {
		return rangeTracker;
	}

}
