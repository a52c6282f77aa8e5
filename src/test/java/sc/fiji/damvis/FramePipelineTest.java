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

import static org.junit.Assert.*;

import java.io.IOException;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import sc.fiji.damvis.iso.CoVisibility;
import sc.fiji.damvis.iso.IsosurfaceSpec;
import sc.fiji.damvis.mesh.ScalarSelection;
import sc.fiji.damvis.mesh.SyntheticMeshes;
import sc.fiji.damvis.render.OpacityTransferFunction;
import sc.fiji.damvis.render.TransferFunctionBuilder;
import sc.fiji.damvis.render.ValueRange;
import sc.fiji.damvis.util.BoundingBox;

/**
 * Tests for {@link FramePipeline}, using a three-frame sequence whose last
 * frame cannot be read.
 */
public class FramePipelineTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private VisualizationSession session;
	private FramePipeline pipeline;

	@Before
	public void setUp() throws IOException {
		folder.newFile("dcinv_1.vtk");
		folder.newFile("dcinv_2.vtk");
		folder.newFile("dcinv_3.vtk");
		final InMemoryMeshReader reader = new InMemoryMeshReader()
				.put("dcinv_1.vtk", SyntheticMeshes.withPointField(5, 0, 1, VisualizationSession.DEFAULT_SCALAR,
						(x, y, z) -> x + y + z))
				.put("dcinv_2.vtk", SyntheticMeshes.withPointField(5, 0, 1, VisualizationSession.DEFAULT_SCALAR,
						(x, y, z) -> 2 * (x + y + z)));
		session = new VisualizationSession(reader);
		session.setDataLocation(folder.getRoot());
		session.setClipBounds(new BoundingBox(0, 4, 0, 4, 0, 4));
		session.setTargetCells(1000);
		pipeline = new FramePipeline();
	}

	@Test
	public void testVolumeRendering() {
		final FrameRendering rendering = pipeline.update(session, 1);
		assertEquals(FrameRendering.Mode.VOLUME, rendering.getMode());
		assertEquals(VisualizationSession.DEFAULT_SCALAR, rendering.getScalarName());
		assertArrayEquals(new int[] { 11, 11, 11 }, rendering.getGrid().getDimensions());
		assertEquals(ValueRange.auto(0, 12), rendering.getRange());
		assertEquals(5, rendering.getColorFunction().size());
		assertEquals(18, rendering.getOpacityFunction().size());
		assertEquals(CoVisibility.UNCHANGED, rendering.getVisibility());
		assertTrue(rendering.getIsosurfaces().isEmpty());
		assertEquals(0, rendering.getCleanup().getRangeCount());
		assertEquals(1, session.getCurrentFrame());
	}

	@Test
	public void testClipBoundsAreIntersectedWithMeshBounds() {
		session.setClipBounds(new BoundingBox(1, 10, 1, 10, -5, 3));
		final FrameRendering rendering = pipeline.update(session, 1);
		assertEquals(new BoundingBox(1, 4, 1, 4, 0, 3), rendering.getBounds());
		assertArrayEquals(new double[] { 1, 1, 0 }, rendering.getGrid().getOrigin(), 0);
	}

	@Test
	public void testDegenerateBoundsFallBackToSurface() {
		// the default clipping box does not overlap the synthetic mesh
		session.setClipBounds(BoundingBox.of(VisualizationSession.DEFAULT_BOUNDS));
		final FrameRendering rendering = pipeline.update(session, 1);
		assertEquals(FrameRendering.Mode.FALLBACK_SURFACE, rendering.getMode());
		assertNull(rendering.getGrid());
		assertNotNull(rendering.getField());
		assertNotNull(rendering.getColorFunction());
		assertTrue(rendering.getRange().isValid());
		assertNotNull(rendering.getMessage());
		assertFalse(rendering.isFailed());
	}

	@Test
	public void testWholeMeshIsUsedWithoutClipBounds() {
		session.setClipBounds(null);
		assertEquals(new BoundingBox(0, 4, 0, 4, 0, 4), pipeline.update(session, 2).getBounds());
	}

	@Test
	public void testGlobalRangeIsSharedAcrossFrames() {
		assertEquals(ValueRange.auto(0, 12), pipeline.update(session, 1).getRange());
		assertEquals(ValueRange.auto(0, 24), session.scanGlobalRange());
		assertEquals(ValueRange.auto(0, 24), pipeline.update(session, 1).getRange());
		assertEquals(ValueRange.auto(0, 24), pipeline.update(session, 2).getRange());
	}

	@Test
	public void testManualRangePersistsAcrossFrames() {
		session.setManualRange(1, 5);
		assertEquals(ValueRange.manual(1, 5), pipeline.update(session, 1).getRange());
		assertEquals(ValueRange.manual(1, 5), pipeline.update(session, 2).getRange());
	}

	@Test
	public void testManualRangeMatchingAutoIsCleared() {
		session.setManualRange(0.0005, 12.0005);
		final FrameRendering rendering = pipeline.update(session, 1);
		assertFalse(rendering.getRange().isManual());
		assertTrue(Double.isNaN(session.getManualMin()));
		assertEquals(0, session.getRangeTracker().getManualMin(), 0);
		assertEquals(12, session.getRangeTracker().getManualMax(), 0);
		// the next frame follows its own auto range
		assertEquals(ValueRange.auto(0, 24), pipeline.update(session, 2).getRange());
	}

	@Test
	public void testSubstitutedScalarIgnoresGlobalRange() {
		session.setScalar(ScalarSelection.point("Conductivity"));
		session.setAutoRange(ValueRange.auto(-100, 100));
		final FrameRendering rendering = pipeline.update(session, 1);
		assertEquals(VisualizationSession.DEFAULT_SCALAR, rendering.getScalarName());
		assertEquals(ValueRange.auto(0, 12), rendering.getRange());
	}

	@Test
	public void testIsosurfacesDimTheVolume() {
		session.setShowIsosurfaces(true);
		session.setIsosurfaceSpec(IsosurfaceSpec.single(6, 0.85));
		final FrameRendering rendering = pipeline.update(session, 1);
		assertEquals(1, rendering.getIsosurfaces().size());
		assertFalse(rendering.getIsosurfaces().get(0).getMesh().isEmpty());
		assertTrue(rendering.getVisibility().isScaled());
		final OpacityTransferFunction unscaled = TransferFunctionBuilder.buildOpacity(rendering.getRange(),
				session.getOpacityChannels());
		assertEquals(0.7 * unscaled.getOpacity(6), rendering.getOpacityFunction().getOpacity(6), 1e-12);
	}

	@Test
	public void testOpaqueIsosurfacesHideTheVolume() {
		session.setShowIsosurfaces(true);
		session.setIsosurfaceSpec(IsosurfaceSpec.multiple(3, 0.95));
		final FrameRendering rendering = pipeline.update(session, 1);
		assertEquals(CoVisibility.HIDDEN, rendering.getVisibility());
		assertEquals(3, rendering.getIsosurfaces().size());
		assertEquals(3, rendering.getIsosurfaces().get(0).getIsovalue(), 1e-12);
	}

	@Test
	public void testFailuresAreReportedAndSessionRemainsUsable() {
		final FrameRendering unreadable = pipeline.update(session, 3);
		assertTrue(unreadable.isFailed());
		assertTrue(unreadable.getError() instanceof IOException);
		assertTrue(pipeline.update(session, 99).isFailed());
		assertEquals(FrameRendering.Mode.VOLUME, pipeline.update(session, 2).getMode());
		assertEquals(2, session.getCurrentFrame());
	}

	@Test(expected = IOException.class)
	public void testRenderPropagatesFailures() throws IOException {
		pipeline.render(session, 3);
	}

	@Test
	public void testMissingReader() {
		session.setMeshReader(null);
		final FrameRendering rendering = pipeline.update(session, 1);
		assertTrue(rendering.isFailed());
		assertTrue(rendering.getError() instanceof IllegalStateException);
	}

}
