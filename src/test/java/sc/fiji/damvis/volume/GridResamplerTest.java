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

package sc.fiji.damvis.volume;

import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.Test;

import sc.fiji.damvis.mesh.ScalarField;
import sc.fiji.damvis.mesh.ScalarResolver;
import sc.fiji.damvis.mesh.ScalarSelection;
import sc.fiji.damvis.mesh.SyntheticMeshes;
import sc.fiji.damvis.mesh.UnstructuredMesh;
import sc.fiji.damvis.util.BoundingBox;

/**
 * Tests for {@link GridResampler}.
 */
public class GridResamplerTest {

	private ScalarField linearField;

	@Before
	public void setUp() {
		// 21^3 points spaced 0.5 apart over [0, 10]^3
		final UnstructuredMesh mesh = SyntheticMeshes.withPointField(21, 0, 0.5, "f", (x, y, z) -> x + 2 * y - z);
		linearField = ScalarResolver.resolve(mesh, ScalarSelection.point("f"));
	}

	@Test
	public void testDimensionsFollowCellBudget() {
		final BoundingBox box = new BoundingBox(0, 10, 0, 20, 0, 5);
		final int[] dims = GridResampler.dimensions(box, 500_000);
		assertArrayEquals(new int[] { 81, 160, 41 }, dims);
		final long cells = (long) (dims[0] - 1) * (dims[1] - 1) * (dims[2] - 1);
		assertEquals(1.0, cells / 500_000d, 0.05);
	}

	@Test
	public void testSpacingIsNearlyIsotropic() {
		final BoundingBox box = new BoundingBox(2, 17, 2, 22, 22, 27);
		final int[] dims = GridResampler.dimensions(box, 500_000);
		final double[] e = box.extents();
		final double sx = e[0] / (dims[0] - 1);
		final double sy = e[1] / (dims[1] - 1);
		final double sz = e[2] / (dims[2] - 1);
		assertEquals(sx, sy, 0.02 * sx);
		assertEquals(sx, sz, 0.02 * sx);
	}

	@Test
	public void testExactMultiplesAreNotRoundedUp() {
		// cell size is exactly 1: 10 cells per axis, hence 11 points
		assertArrayEquals(new int[] { 11, 11, 11 }, GridResampler.dimensions(new BoundingBox(0, 10, 0, 10, 0, 10), 1000));
	}

	@Test
	public void testTinyBudgetStillYieldsTwoPointsPerAxis() {
		final int[] dims = GridResampler.dimensions(new BoundingBox(0, 100, 0, 1, 0, 1), 1);
		for (final int d : dims)
			assertTrue(d >= 2);
	}

	@Test(expected = DegenerateGridException.class)
	public void testFlatBoxIsDegenerate() {
		GridResampler.dimensions(new BoundingBox(0, 10, 0, 10, 5, 5), 1000);
	}

	@Test(expected = DegenerateGridException.class)
	public void testInvertedBoxIsDegenerate() {
		new GridResampler().resample(linearField, new BoundingBox(0, 10, 0, 10, 0, 10).intersection(
				new BoundingBox(20, 30, 0, 10, 0, 10)), 1000);
	}

	@Test(expected = DegenerateGridException.class)
	public void testNonPositiveBudgetIsDegenerate() {
		GridResampler.dimensions(new BoundingBox(0, 1, 0, 1, 0, 1), 0);
	}

	@Test
	public void testSamplesCoincidingWithSourcePointsAreExact() {
		final UniformGrid grid = new GridResampler().resample(linearField, new BoundingBox(0, 10, 0, 10, 0, 10), 1000);
		assertArrayEquals(new int[] { 11, 11, 11 }, grid.getDimensions());
		assertEquals("f", grid.getScalarName());
		final double[] pos = new double[3];
		for (int k = 0; k < 11; k += 5) {
			for (int j = 0; j < 11; j += 3) {
				for (int i = 0; i < 11; i += 2) {
					grid.position(i, j, k, pos);
					assertEquals(pos[0] + 2 * pos[1] - pos[2], grid.getValue(i, j, k), 1e-9);
				}
			}
		}
	}

	@Test
	public void testInterpolatedValuesStayWithinNeighborhood() {
		// cell size of 0.8 places most samples between source points
		final UniformGrid grid = new GridResampler().resample(linearField, new BoundingBox(1, 9, 1, 9, 1, 9), 1000);
		final double[] pos = new double[3];
		final int[] dims = grid.getDimensions();
		for (int i = 0; i < dims[0]; i++) {
			grid.position(i, i % dims[1], (2 * i) % dims[2], pos);
			final double expected = pos[0] + 2 * pos[1] - pos[2];
			// bounded by |grad f| times the half diagonal of a source voxel
			assertEquals(expected, grid.getValue(i, i % dims[1], (2 * i) % dims[2]), 2.2);
		}
	}

	@Test
	public void testPointsOutsideCoverageAreNaN() {
		final UniformGrid grid = new GridResampler().resample(linearField, new BoundingBox(0, 20, 0, 10, 0, 10), 2000);
		final int[] dims = grid.getDimensions();
		assertFalse(Double.isNaN(grid.getValue(0, 0, 0)));
		assertTrue(Double.isNaN(grid.getValue(dims[0] - 1, 0, 0)));
	}

	@Test
	public void testOutlierDoesNotWidenCoverage() {
		// 5^3 points over [0, 2]^3 plus a single point at (10, 10, 10)
		final double[][] points = new double[126][];
		final double[] values = new double[126];
		int idx = 0;
		for (int k = 0; k < 5; k++)
			for (int j = 0; j < 5; j++)
				for (int i = 0; i < 5; i++) {
					points[idx] = new double[] { 0.5 * i, 0.5 * j, 0.5 * k };
					values[idx++] = 1;
				}
		points[idx] = new double[] { 10, 10, 10 };
		values[idx] = 5;
		final ScalarField field = new ScalarField("f", points, values);
		// mean spacing cbrt(1000 / 126) ~ 2: coverage radius ~ 4
		assertEquals(1.995, GridResampler.meanSpacing(field.getBounds(), 126), 1e-3);

		final UniformGrid grid = new GridResampler().resample(field, new BoundingBox(0, 10, 0, 10, 0, 10), 1000);
		assertArrayEquals(new int[] { 11, 11, 11 }, grid.getDimensions());
		assertEquals(1, grid.getValue(0, 0, 0), 1e-12);
		assertEquals(1, grid.getValue(3, 0, 0), 1e-12);
		assertEquals(5, grid.getValue(10, 10, 10), 1e-12);
		// ~6.9 away from both the lattice and the outlier
		assertTrue(Double.isNaN(grid.getValue(6, 6, 6)));
		assertTrue(Double.isNaN(grid.getValue(8, 2, 2)));
	}

	@Test
	public void testNonFiniteSourceValuesAreIgnored() {
		final double[][] points = { { 0, 0, 0 }, { 1, 0, 0 }, { 0, 1, 0 }, { 1, 1, 0 }, { 0, 0, 1 }, { 1, 0, 1 },
				{ 0, 1, 1 }, { 1, 1, 1 } };
		final double[] values = { 1, 1, 1, 1, 1, 1, 1, Double.NaN };
		final ScalarField field = new ScalarField("f", points, values);
		final UniformGrid grid = new GridResampler().resample(field, new BoundingBox(0, 1, 0, 1, 0, 1), 8);
		for (final double v : grid.getValues())
			assertEquals(1, v, 1e-12);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testFieldWithoutFiniteValues() {
		final double[][] points = { { 0, 0, 0 }, { 1, 1, 1 } };
		new GridResampler().resample(new ScalarField("f", points, new double[] { Double.NaN, Double.NaN }),
				new BoundingBox(0, 1, 0, 1, 0, 1), 8);
	}

}
