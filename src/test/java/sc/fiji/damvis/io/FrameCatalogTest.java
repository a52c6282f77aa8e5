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

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests for {@link FrameCatalog} discovery.
 */
public class FrameCatalogTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testIndicesAreSortedNumerically() throws IOException {
		folder.newFile("dcinv_1.vtk");
		folder.newFile("dcinv_10.vtk");
		folder.newFile("dcinv_2.vtk");
		final FrameCatalog catalog = FrameCatalog.discover(folder.getRoot());
		assertEquals(Arrays.asList(1, 2, 10), catalog.indices());
		assertEquals(1, catalog.first());
		assertEquals(10, catalog.last());
		assertEquals("dcinv_10.vtk", catalog.get(10).getName());
		assertEquals(folder.getRoot(), catalog.getDirectory());
		assertEquals(catalog.indices(), new ArrayList<>(catalog.asMap().keySet()));
	}

	@Test
	public void testNonMatchingFilesAreIgnored() throws IOException {
		folder.newFile("dcinv_3.vtk");
		folder.newFile("dcinv_4.vtu");
		folder.newFile("model_5.vtk");
		folder.newFile("dcinv_final.vtk");
		folder.newFile("notes.txt");
		folder.newFolder("dcinv_6.vtk");
		final FrameCatalog catalog = FrameCatalog.discover(folder.getRoot());
		assertEquals(Arrays.asList(3), catalog.indices());
	}

	@Test
	public void testIndexFollowsLastUnderscore() {
		assertEquals(Integer.valueOf(7), FrameCatalog.parseIndex("dcinv_run2_7.vtk", "dcinv", ".vtk"));
		assertNull(FrameCatalog.parseIndex("dcinv12.vtk", "dcinv", ".vtk"));
		assertNull(FrameCatalog.parseIndex("dcinv_.vtk", "dcinv", ".vtk"));
		assertNull(FrameCatalog.parseIndex("dcinv_99999999999999.vtk", "dcinv", ".vtk"));
	}

	@Test
	public void testEmptyDirectory() {
		final FrameCatalog catalog = FrameCatalog.discover(folder.getRoot());
		assertTrue(catalog.isEmpty());
		assertTrue(catalog.frames().isEmpty());
	}

	@Test
	public void testCustomPattern() throws IOException {
		folder.newFile("model_3.vtu");
		folder.newFile("dcinv_1.vtk");
		final FrameCatalog catalog = FrameCatalog.discover(folder.getRoot(), "model", ".vtu");
		assertEquals(Arrays.asList(3), catalog.indices());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNotADirectory() throws IOException {
		final File file = folder.newFile("dcinv_1.vtk");
		FrameCatalog.discover(file);
	}

}
