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

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import sc.fiji.damvis.io.Frame;
import sc.fiji.damvis.util.Logger;

/**
 * Renders every frame of a session catalog, in order, and assembles the
 * captured images into a video. Frames that fail are skipped and reported;
 * the export carries on with the next frame.
 */
public class BatchExporter {

	private final FramePipeline pipeline;
	private final Logger logger;

	public BatchExporter() {
		this(new FramePipeline());
	}

	public BatchExporter(final FramePipeline pipeline) {
		this.pipeline = pipeline;
		logger = new Logger(BatchExporter.class);
	}

	/**
	 * Exports all frames of the session catalog.
	 *
	 * @param session the session state. Its frame rate sets the playback rate
	 * @param capture renders and captures each frame
	 * @param encoder writes the video
	 * @param output the video file
	 * @return the export report. Empty, with no video written, if no frame could
	 *         be captured
	 * @throws IOException if the video could not be written
	 */
	public ExportReport export(final VisualizationSession session, final FrameCapture capture,
			final VideoEncoder encoder, final File output) throws IOException {
		final ExportReport report = new ExportReport(output);
		final List<Frame> frames = session.getCatalog().frames();
		if (frames.isEmpty()) {
			logger.warn("No frames to export");
			return report;
		}
		logger.info("DamVis " + DamVisUtils.VERSION + ": exporting " + frames.size() + " frames to " + output.getAbsolutePath());
		final List<BufferedImage> images = new ArrayList<>(frames.size());
		for (final Frame frame : frames) {
			final FrameRendering rendering = pipeline.update(session, frame.index());
			if (rendering.isFailed()) {
				report.addSkipped(frame.index(), rendering.getMessage());
				continue;
			}
			try {
				final BufferedImage image = capture.capture(rendering);
				if (image == null) throw new IOException("No image captured");
				images.add(image);
				report.addExported(frame.index());
			} catch (final IOException | RuntimeException ex) {
				logger.error("Frame " + frame.index() + " could not be captured", ex);
				report.addSkipped(frame.index(), ex.getMessage());
			}
		}
		if (images.isEmpty()) {
			logger.warn("No frame could be captured: " + output.getName() + " not written");
			return report;
		}
		encoder.encode(images, session.getFrameRate(), output);
		report.setWritten(true);
		logger.info(report);
		return report;
	}

}
