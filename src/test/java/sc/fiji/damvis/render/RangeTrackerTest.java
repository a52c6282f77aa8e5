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

import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.Test;

import sc.fiji.damvis.mesh.ScalarSelection;

/**
 * Tests for {@link RangeTracker}, using the range of a typical resistivity
 * inversion sequence.
 */
public class RangeTrackerTest {

	private static final double AUTO_MIN = -0.189;
	private static final double AUTO_MAX = 4.970;
	private static final ScalarSelection RESISTIVITY = ScalarSelection.point("Resistivity(log10)");

	private RangeTracker tracker;

	@Before
	public void setUp() {
		tracker = new RangeTracker();
	}

	@Test
	public void testNoManualEntryIsAuto() {
		final ValueRange range = tracker.update(RESISTIVITY, AUTO_MIN, AUTO_MAX, Double.NaN, Double.NaN);
		assertFalse(range.isManual());
		assertEquals(AUTO_MIN, range.getMin(), 0);
		assertEquals(AUTO_MAX, range.getMax(), 0);
		assertEquals(AUTO_MIN, tracker.getManualMin(), 0);
		assertEquals(AUTO_MAX, tracker.getManualMax(), 0);
	}

	@Test
	public void testEditsWithinToleranceStayAuto() {
		final ValueRange range = tracker.update(RESISTIVITY, AUTO_MIN, AUTO_MAX, -0.1895, 4.9705);
		assertFalse(range.isManual());
		assertEquals(AUTO_MIN, range.getMin(), 0);
		assertEquals(AUTO_MAX, range.getMax(), 0);
		// displayed values snap to the auto range
		assertEquals(AUTO_MIN, tracker.getManualMin(), 0);
		assertEquals(AUTO_MAX, tracker.getManualMax(), 0);
	}

	@Test
	public void testManualOverridePersistsAcrossFrames() {
		ValueRange range = tracker.update(RESISTIVITY, AUTO_MIN, AUTO_MAX, 0.0, 5.0);
		assertTrue(range.isManual());
		assertEquals(ValueRange.manual(0.0, 5.0), range);
		// new frames report slightly different extrema
		for (int frame = 0; frame < 5; frame++) {
			range = tracker.update(RESISTIVITY, AUTO_MIN + frame * 0.01, AUTO_MAX - frame * 0.01, 0.0, 5.0);
			assertEquals(ValueRange.manual(0.0, 5.0), range);
		}
		assertEquals(range, tracker.getRange());
	}

	@Test
	public void testSelectionChangeResetsToAuto() {
		tracker.update(RESISTIVITY, AUTO_MIN, AUTO_MAX, 0.0, 5.0);
		final ScalarSelection coverage = ScalarSelection.cell("Coverage");
		final ValueRange range = tracker.update(coverage, 0, 1, 0.0, 5.0);
		assertFalse(range.isManual());
		assertEquals(0, range.getMin(), 0);
		assertEquals(1, range.getMax(), 0);
		assertEquals(coverage, tracker.getSelection());
		// subsequent manual edits apply to the new scalar
		assertTrue(tracker.update(coverage, 0, 1, 0.2, 0.8).isManual());
	}

	@Test
	public void testSameNameDifferentAssociationIsADifferentSelection() {
		tracker.update(RESISTIVITY, AUTO_MIN, AUTO_MAX, 0.0, 5.0);
		final ValueRange range = tracker.update(ScalarSelection.cell("Resistivity(log10)"), AUTO_MIN, AUTO_MAX, 0.0,
				5.0);
		assertFalse(range.isManual());
	}

	@Test
	public void testInvalidManualRangeIsIgnored() {
		final ValueRange range = tracker.update(RESISTIVITY, AUTO_MIN, AUTO_MAX, 5.0, 0.0);
		assertFalse(range.isManual());
		assertEquals(AUTO_MIN, range.getMin(), 0);
	}

	@Test
	public void testSingleValueRangeIsValid() {
		final ValueRange range = tracker.update(RESISTIVITY, 2, 2, Double.NaN, Double.NaN);
		assertTrue(range.isValid());
		assertEquals(0, range.getSpan(), 0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidAutoRange() {
		tracker.update(RESISTIVITY, 1, 0, Double.NaN, Double.NaN);
	}

	@Test
	public void testReset() {
		tracker.update(RESISTIVITY, AUTO_MIN, AUTO_MAX, 0.0, 5.0);
		tracker.reset();
		assertNull(tracker.getSelection());
		assertEquals(ValueRange.UNSET, tracker.getRange());
		assertFalse(tracker.getRange().isValid());
	}

}
