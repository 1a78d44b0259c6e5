/**
 **
 ** CropCommensuratorTest.java - tests of the crop and lattice commensuration
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CropCommensuratorTest.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

package com.elphel.driftcorr.correction;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.elphel.driftcorr.SyntheticLattice;
import com.elphel.driftcorr.common.ConfigurationException;
import com.elphel.driftcorr.lattice.BraggPeakDetector;
import com.elphel.driftcorr.lattice.BraggPeaks;

public class CropCommensuratorTest {
	private static final int N = 128;
	private static final double [][] BP = {{48, 48}, {48, 80}, {80, 80}, {80, 48}};

	@Test
	public void marginForms() {
		assertArrayEquals(new int [] {0, 0, 0, 0}, CropCommensurator.margins(null));
		assertArrayEquals(new int [] {3, 3, 3, 3}, CropCommensurator.margins(new int [] {3}));
		assertArrayEquals(new int [] {1, 2, 3, 4}, CropCommensurator.margins(new int [] {1, 2, 3, 4}));
	}

	@Test(expected = ConfigurationException.class)
	public void twoMarginsAreRejected() {
		CropCommensurator.margins(new int [] {1, 2});
	}

	@Test
	public void plainCrop() {
		CropCommensurator.Result r = new CropCommensurator().crop(SyntheticLattice.square(N, 16), new int [] {2, 4, 6, 8});
		assertFalse(r.isCommensurate());
		assertEquals(N - 6, r.getImage()[0].length);
		assertEquals(N - 14, r.getImage().length);
		assertEquals(SyntheticLattice.value(N, 16, 2, 6), r.getImage()[0][0], 1e-12);
	}

	@Test
	public void commensurateCropKeepsWholePeriods() {
		double [][] image = SyntheticLattice.square(N, 16);
		CropCommensurator.Result r = new CropCommensurator().crop(
				new double [][][] {image}, new int [] {5}, BP, true, null, null);
		assertTrue(r.isCommensurate());
		assertEquals(8.0, r.a1, 1e-12);
		assertEquals(8.0, r.a2, 1e-12);
		assertEquals(14, r.cells_x);
		assertEquals(14, r.cells_y);
		double [][] out = r.getImage();
		assertEquals(118, out.length);
		assertEquals(118, out[0].length);
		assertEquals(118.0 / 14, r.getOutputPeriodX(), 1e-12);
		// centered: 112 of 118 pixels resampled, 3 pixels dropped at each side
		for (int j = 8; j < 110; j += 7) {
			for (int i = 8; i < 110; i += 5) {
				double x = 5 + 3 + i * 112.0 / 118;
				double y = 5 + 3 + j * 112.0 / 118;
				assertEquals(SyntheticLattice.value(N, 16, x, y), out[j][i], 0.02);
			}
		}
		double [][] bp = BraggPeaks.sortBraggs(new BraggPeakDetector(null).findBraggs(out), 118, 118);
		assertArrayEquals(new double [] {59 - 14, 59 - 14}, bp[0], 0.0);
		assertArrayEquals(new double [] {59 + 14, 59 + 14}, bp[2], 0.0);
	}

	@Test
	public void peaksDetectedFromLayerMean() {
		double [][] image = SyntheticLattice.square(N, 16);
		double [][] negative = new double [N][N];
		double [][] doubled = new double [N][N];
		for (int y = 0; y < N; y++) {
			for (int x = 0; x < N; x++) {
				negative[y][x] = 1.0 - 0.5 * image[y][x];
				doubled[y][x] = 2.0 * image[y][x];
			}
		}
		CropCommensurator.Result r = new CropCommensurator(2.0, null, null, 2).crop(
				new double [][][] {image, negative, doubled}, new int [] {4}, null, true, null, null);
		assertEquals(3, r.layers.length);
		assertEquals(8.0, r.a1, 1e-12);
		assertEquals(15, r.cells_x);
		for (int y = 0; y < 120; y += 11) {
			assertEquals(2 * r.layers[0][y][y], r.layers[2][y][y], 1e-9);
		}
	}

	@Test
	public void explicitPeriods() {
		CropCommensurator.Result r = new CropCommensurator(2.0, 10.0, 12.0, 1).crop(
				new double [][][] {SyntheticLattice.square(64, 8)}, new int [] {2}, null, true, null, null);
		assertEquals(6, r.cells_x);
		assertEquals(5, r.cells_y);
		assertEquals(60, r.getImage()[0].length);
	}

	@Test(expected = ConfigurationException.class)
	public void periodLargerThanImage() {
		new CropCommensurator(2.0, 100.0, null, 1).crop(
				new double [][][] {SyntheticLattice.square(64, 8)}, new int [] {2}, BP, true, null, null);
	}
}
