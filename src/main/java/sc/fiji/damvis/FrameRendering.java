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

import java.util.Collections;
import java.util.List;

import sc.fiji.damvis.iso.CoVisibility;
import sc.fiji.damvis.iso.Isosurface;
import sc.fiji.damvis.mesh.ScalarField;
import sc.fiji.damvis.render.ColorTransferFunction;
import sc.fiji.damvis.render.OpacityTransferFunction;
import sc.fiji.damvis.render.ValueRange;
import sc.fiji.damvis.util.BoundingBox;
import sc.fiji.damvis.volume.CleanupResult;
import sc.fiji.damvis.volume.UniformGrid;

/**
 * The product of running the {@link FramePipeline} on one frame: everything a
 * renderer needs to draw it. Depending on {@link #getMode()} some properties
 * are not available (null).
 */
public class FrameRendering {

	public enum Mode {
		/** volume rendering of a resampled grid, optionally with isosurfaces */
		VOLUME,
		/** the clipped region could not be gridded: the mesh surface is shown instead */
		FALLBACK_SURFACE,
		/** the frame could not be processed */
		FAILED
	}

	private final int frameIndex;
	private final Mode mode;
	private ScalarField field;
	private BoundingBox bounds;
	private CleanupResult cleanup;
	private ValueRange range = ValueRange.UNSET;
	private ColorTransferFunction color;
	private OpacityTransferFunction opacity;
	private List<Isosurface> isosurfaces = Collections.emptyList();
	private CoVisibility visibility = CoVisibility.UNCHANGED;
	private String message;
	private Throwable error;

	private FrameRendering(final int frameIndex, final Mode mode) {
		this.frameIndex = frameIndex;
		this.mode = mode;
	}

	static FrameRendering volume(final int frameIndex, final ScalarField field, final BoundingBox bounds,
			final CleanupResult cleanup, final ValueRange range, final ColorTransferFunction color,
			final OpacityTransferFunction opacity, final List<Isosurface> isosurfaces, final CoVisibility visibility) {
		final FrameRendering r = new FrameRendering(frameIndex, Mode.VOLUME);
		r.field = field;
		r.bounds = bounds;
		r.cleanup = cleanup;
		r.range = range;
		r.color = color;
		r.opacity = opacity;
		r.isosurfaces = Collections.unmodifiableList(isosurfaces);
		r.visibility = visibility;
		return r;
	}

	static FrameRendering fallback(final int frameIndex, final ScalarField field, final BoundingBox bounds,
			final ValueRange range, final ColorTransferFunction color, final String reason) {
		final FrameRendering r = new FrameRendering(frameIndex, Mode.FALLBACK_SURFACE);
		r.field = field;
		r.bounds = bounds;
		r.range = range;
		r.color = color;
		r.message = reason;
		return r;
	}

	static FrameRendering failed(final int frameIndex, final Throwable error) {
		final FrameRendering r = new FrameRendering(frameIndex, Mode.FAILED);
		r.error = error;
		r.message = (error.getMessage() == null) ? error.getClass().getSimpleName() : error.getMessage();
		return r;
	}

	public int getFrameIndex() {
		return frameIndex;
	}

	public Mode getMode() {
		return mode;
	}

	public boolean isFailed() {
		return mode == Mode.FAILED;
	}

	/** @return the resolved scalar field on the mesh points, or null if failed */
	public ScalarField getField() {
		return field;
	}

	/** @return the name of the displayed scalar, or null if failed */
	public String getScalarName() {
		return (field == null) ? null : field.getName();
	}

	/** @return the clipping box intersected with the mesh bounds, or null if failed */
	public BoundingBox getBounds() {
		return bounds;
	}

	/** @return the cleaned grid. Only available in {@link Mode#VOLUME} */
	public UniformGrid getGrid() {
		return (cleanup == null) ? null : cleanup.getGrid();
	}

	public CleanupResult getCleanup() {
		return cleanup;
	}

	public ValueRange getRange() {
		return range;
	}

	public ColorTransferFunction getColorFunction() {
		return color;
	}

	/**
	 * @return the volume opacity function, already scaled according to
	 *         {@link #getVisibility()}. Only available in {@link Mode#VOLUME}
	 */
	public OpacityTransferFunction getOpacityFunction() {
		return opacity;
	}

	/** @return the isosurfaces to be displayed. Never null */
	public List<Isosurface> getIsosurfaces() {
		return isosurfaces;
	}

	public CoVisibility getVisibility() {
		return visibility;
	}

	/** @return the reason for a fallback or failure, or null */
	public String getMessage() {
		return message;
	}

	/** @return the cause of a failure, or null */
	public Throwable getError() {
		return error;
	}

	@Override
	public String toString() {
		final StringBuilder sb = new StringBuilder("Frame ").append(frameIndex).append(" [").append(mode);
		if (field != null) sb.append(", ").append(field.getName());
		if (range.isValid()) sb.append(", range ").append(range);
		if (!isosurfaces.isEmpty()) sb.append(", ").append(isosurfaces.size()).append(" isosurface(s)");
		if (message != null) sb.append(": ").append(message);
		return sb.append("]").toString();
	}

}
