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
import java.io.IOException;
import java.util.Collections;
import java.util.List;

import sc.fiji.damvis.iso.CoVisibility;
import sc.fiji.damvis.iso.Isosurface;
import sc.fiji.damvis.iso.IsosurfaceGenerator;
import sc.fiji.damvis.mesh.ResistivityMesh;
import sc.fiji.damvis.mesh.ScalarField;
import sc.fiji.damvis.mesh.ScalarResolver;
import sc.fiji.damvis.mesh.ScalarSelection;
import sc.fiji.damvis.render.ColorTransferFunction;
import sc.fiji.damvis.render.OpacityTransferFunction;
import sc.fiji.damvis.render.TransferFunctionBuilder;
import sc.fiji.damvis.render.ValueRange;
import sc.fiji.damvis.util.BoundingBox;
import sc.fiji.damvis.util.Logger;
import sc.fiji.damvis.volume.ArtifactCleaner;
import sc.fiji.damvis.volume.CleanupResult;
import sc.fiji.damvis.volume.DegenerateGridException;
import sc.fiji.damvis.volume.GridResampler;
import sc.fiji.damvis.volume.UniformGrid;

/**
 * Runs the per-frame numeric pipeline: mesh reading, scalar resolution,
 * clipping, resampling, artifact cleanup, range tracking, transfer functions
 * and isosurfaces. Every call is synchronous; later calls supersede earlier
 * ones.
 */
public class FramePipeline {

	private final GridResampler resampler;
	private final Logger logger;

	public FramePipeline() {
		this(new GridResampler());
	}

	public FramePipeline(final GridResampler resampler) {
		this.resampler = resampler;
		logger = new Logger(FramePipeline.class);
	}

	/**
	 * Processes a frame, reporting rather than propagating failures. Use this
	 * method whenever the session must remain usable after a bad frame.
	 *
	 * @param session the session state
	 * @param frameIndex the index of the frame in the session catalog
	 * @return the rendering. Its mode is {@link FrameRendering.Mode#FAILED} if
	 *         the frame could not be processed
	 */
	public FrameRendering update(final VisualizationSession session, final int frameIndex) {
		try {
			return render(session, frameIndex);
		} catch (final IOException | RuntimeException ex) {
			logger.error("Frame " + frameIndex + " could not be processed", ex);
			return FrameRendering.failed(frameIndex, ex);
		}
	}

	/**
	 * Processes a frame.
	 *
	 * @param session the session state
	 * @param frameIndex the index of the frame in the session catalog
	 * @return the rendering, either {@link FrameRendering.Mode#VOLUME} or
	 *         {@link FrameRendering.Mode#FALLBACK_SURFACE}
	 * @throws IOException if the frame file could not be read
	 * @throws IllegalArgumentException if the frame does not exist or holds no
	 *           usable scalar data
	 * @throws IllegalStateException if the session has no mesh reader
	 */
	public FrameRendering render(final VisualizationSession session, final int frameIndex) throws IOException {
		if (session.getMeshReader() == null) throw new IllegalStateException("No mesh reader available");
		final File file = session.getCatalog().get(frameIndex);
		if (file == null) throw new IllegalArgumentException("No frame with index " + frameIndex);
		logger.debug("Loading frame " + frameIndex + ": " + file.getName());

		final ResistivityMesh mesh = session.getMeshReader().read(file);
		final ScalarSelection resolved = ScalarResolver.resolveSelection(mesh, session.getScalar());
		final ScalarField field = ScalarResolver.resolve(mesh, resolved);
		final boolean substituted = !resolved.equals(session.getScalar());

		final BoundingBox bounds = (session.getClipBounds() == null) ? mesh.getBounds()
				: session.getClipBounds().intersection(mesh.getBounds());
		logger.debug("Clipped bounds: " + bounds);

		UniformGrid grid;
		try {
			grid = resampler.resample(field, bounds, session.getTargetCells());
		} catch (final DegenerateGridException ex) {
			logger.warn("Frame " + frameIndex + ": " + ex.getMessage() + ". Showing mesh surface instead");
			final ValueRange range = updateRange(session, field, substituted);
			session.setCurrentFrame(frameIndex);
			return FrameRendering.fallback(frameIndex, field, bounds, range,
					TransferFunctionBuilder.buildColor(range, session.getPalette()), ex.getMessage());
		}
		final CleanupResult cleanup = ArtifactCleaner.clean(grid, field.getValues());
		if (cleanup.getNanCount() > 0 || cleanup.getRangeCount() > 0) logger.debug(cleanup);

		final ValueRange range = updateRange(session, field, substituted);
		final ColorTransferFunction color = TransferFunctionBuilder.buildColor(range, session.getPalette());
		OpacityTransferFunction opacity = TransferFunctionBuilder.buildOpacity(range, session.getOpacityChannels());

		final CoVisibility visibility = IsosurfaceGenerator.coVisibility(session.isShowVolume(),
				session.isShowIsosurfaces(), session.getIsosurfaceSpec());
		if (visibility.isScaled()) opacity = opacity.scaled(visibility.volumeOpacityScale());

		List<Isosurface> isosurfaces = Collections.emptyList();
		if (session.isShowIsosurfaces()) {
			isosurfaces = IsosurfaceGenerator.extract(cleanup.getGrid(),
					IsosurfaceGenerator.generate(range, session.getIsosurfaceSpec()));
		}
		session.setCurrentFrame(frameIndex);
		final FrameRendering rendering = FrameRendering.volume(frameIndex, field, bounds, cleanup, range, color,
				opacity, isosurfaces, visibility);
		logger.debug(rendering);
		return rendering;
	}

	/*
	 * The sequence-wide range applies only to the scalar it was scanned for: a
	 * substituted scalar falls back to the range of the current frame.
	 */
	private ValueRange updateRange(final VisualizationSession session, final ScalarField field,
			final boolean substituted) {
		ValueRange auto = session.getAutoRange();
		if (substituted || !auto.isValid()) {
			final double[] frameRange = field.getRange();
			auto = ValueRange.auto(frameRange[0], frameRange[1]);
		}
		if (!auto.isValid()) throw new IllegalArgumentException("Scalar '" + field.getName() + "' has no finite values");
		final ValueRange range = session.getRangeTracker().update(session.getScalar(), auto.getMin(), auto.getMax(),
				session.getManualMin(), session.getManualMax());
		if (!range.isManual()) session.setManualRange(Double.NaN, Double.NaN);
		return range;
	}

}
