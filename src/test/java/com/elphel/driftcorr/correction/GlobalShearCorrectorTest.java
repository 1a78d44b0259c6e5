/**
 **
 ** GlobalShearCorrectorTest.java - tests of the global shear correction
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  GlobalShearCorrectorTest.java is free software: you can redistribute it and/or modify
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
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.elphel.driftcorr.SyntheticLattice;
import com.elphel.driftcorr.common.DegenerateGeometryException;
import com.elphel.driftcorr.lattice.BraggPeakDetector;
import com.elphel.driftcorr.lattice.BraggPeakParameters;
import com.elphel.driftcorr.lattice.BraggPeaks;

public class GlobalShearCorrectorTest {
	private static final int N = 128;

	@Test
	public void affineFromThreePoints() {
		double [][] m = {{1.2, -0.3, 4.0}, {0.1, 0.9, -2.0}};
		double [][] pts1 = {{0, 0}, {10, 3}, {-4, 7}};
		double [][] pts2 = new double [3][2];
		for (int i = 0; i < 3; i++) {
			pts2[i][0] = m[0][0] * pts1[i][0] + m[0][1] * pts1[i][1] + m[0][2];
			pts2[i][1] = m[1][0] * pts1[i][0] + m[1][1] * pts1[i][1] + m[1][2];
		}
		double [][] a = GlobalShearCorrector.getAffine(pts1, pts2);
		assertArrayEquals(m[0], a[0], 1e-9);
		assertArrayEquals(m[1], a[1], 1e-9);
	}

	@Test(expected = DegenerateGeometryException.class)
	public void collinearPointsAreRejected() {
		GlobalShearCorrector.getAffine(
				new double [][] {{0, 0}, {1, 1}, {2, 2}},
				new double [][] {{0, 0}, {1, 0}, {0, 1}});
	}

	@Test
	public void idealLatticeNeedsNoCorrection() {
		double [][] bp = {{48, 48}, {48, 80}, {80, 80}, {80, 48}};
		double [][] m = GlobalShearCorrector.getMatrix(bp, N, N, Math.PI / 2, Math.PI / 4);
		assertArrayEquals(new double [] {1, 0, 0}, m[0], 1e-9);
		assertArrayEquals(new double [] {0, 1, 0}, m[1], 1e-9);
	}

	@Test
	public void shearedLatticeIsStraightened() {
		double [][] image = SyntheticLattice.sheared(N, 16, 0.1);
		BraggPeakDetector detector = new BraggPeakDetector(null);
		GlobalShearCorrector.Result r = GlobalShearCorrector.correct(
				image, detector.findBraggs(image), Math.PI / 2, Math.PI / 4, true);
		// spectrum x' = x, y' = y - s * x, up to peak rounding
		assertEquals(1.0, r.matrix[0][0], 1e-9);
		assertEquals(0.0, r.matrix[0][1], 1e-9);
		assertTrue("shear term "+r.matrix[1][0], (r.matrix[1][0] < -0.06) && (r.matrix[1][0] > -0.15));
		assertEquals(1.0, r.matrix[1][1], 1e-9);
		// zero filled corners add low-q content
		BraggPeakDetector masked = new BraggPeakDetector(BraggPeakParameters.builder().r(0.05).build());
		double [][] bp = BraggPeaks.sortBraggs(masked.findBraggs(r.image), N, N);
		double [][] expected = {{48, 48}, {48, 80}, {80, 80}, {80, 48}};
		for (int i = 0; i < 4; i++) {
			assertArrayEquals(expected[i], bp[i], 0.0);
		}
	}

	@Test
	public void realSpaceMapIsTransposed() {
		double [][] m = {{1.0, 0.2, 0}, {-0.1, 1.0, 0}};
		double [][] inv = GlobalShearCorrector.realSpaceInverseMap(m, N, N);
		assertArrayEquals(new double [] {1.0, -0.1}, inv[0], 1e-12);
		assertArrayEquals(new double [] {0.2, 1.0}, inv[1], 1e-12);
	}

	@Test
	public void spectrumTranslation() {
		double [][] spectrum = new double [32][32];
		spectrum[10][12] = 1.0;
		double [][] out = GlobalShearCorrector.apply(spectrum, new double [][] {{1, 0, 2}, {0, 1, -3}}, false);
		assertEquals(1.0, out[7][14], 1e-9);
		assertEquals(0.0, out[10][12], 1e-9);
	}

	@Test
	public void stackLayersShareTheMatrix() {
		double [][] image = SyntheticLattice.sheared(64, 8, 0.05);
		double [][] m = {{1, 0, 0}, {-0.05, 1, 0}};
		double [][][] out = GlobalShearCorrector.apply(new double [][][] {image, image}, m, true, 2, null);
		double [][] single = GlobalShearCorrector.apply(image, m, true);
		for (int y = 0; y < 64; y++) {
			assertArrayEquals(single[y], out[0][y], 0.0);
			assertArrayEquals(single[y], out[1][y], 0.0);
		}
	}
}
