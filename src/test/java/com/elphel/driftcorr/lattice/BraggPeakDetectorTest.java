/**
 **
 ** BraggPeakDetectorTest.java - tests of the Bragg peak detection
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  BraggPeakDetectorTest.java is free software: you can redistribute it and/or modify
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

package com.elphel.driftcorr.lattice;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import com.elphel.driftcorr.SyntheticLattice;
import com.elphel.driftcorr.common.ConfigurationException;
import com.elphel.driftcorr.common.FourierTools;
import com.elphel.driftcorr.common.InsufficientPeaksException;

public class BraggPeakDetectorTest {

	@Test
	public void squareLatticePeaks() {
		double [][] image = SyntheticLattice.square(128, 16);
		double [][] bp = BraggPeaks.sortBraggs(new BraggPeakDetector(null).findBraggs(image), 128, 128);
		double [][] expected = {{48, 48}, {48, 80}, {80, 80}, {80, 48}};
		for (int i = 0; i < 4; i++) {
			assertArrayEquals(expected[i], bp[i], 0.0);
		}
	}

	@Test
	public void distortedLatticeKeepsPeakPositions() {
		double [][] image = SyntheticLattice.distorted(128, 16, 0.5);
		double [][] bp = BraggPeaks.sortBraggs(new BraggPeakDetector(null).findBraggs(image), 128, 128);
		assertArrayEquals(new double [] {48, 48}, bp[0], 0.0);
		assertArrayEquals(new double [] {80, 48}, bp[3], 0.0);
	}

	@Test
	public void localMaximaRespectSpacingAndBorder() {
		double [][] data = new double [32][32];
		data[10][10] = 5.0;
		data[12][13] = 4.0; // within 3 of the stronger one
		data[20][20] = 3.0;
		data[1][16] =  9.0; // too close to the border
		double [][] peaks = BraggPeakDetector.localMaxima(data, 3, 0.1);
		assertEquals(2, peaks.length);
		assertArrayEquals(new double [] {10, 10}, peaks[0], 0.0);
		assertArrayEquals(new double [] {20, 20}, peaks[1], 0.0);
	}

	@Test
	public void thresholdIsRelativeToMaximum() {
		double [][] data = new double [32][32];
		data[10][10] = 10.0;
		data[20][20] = 2.0;
		assertEquals(1, BraggPeakDetector.localMaxima(data, 3, 0.25).length);
		assertEquals(2, BraggPeakDetector.localMaxima(data, 3, 0.1).length);
	}

	@Test
	public void subPixelRefinement() {
		int n = 64;
		double [][] offsets = {{-10.3, -9.6}, {-9.6, 10.3}, {10.3, 9.6}, {9.6, -10.3}};
		double [][] spectrum = new double [n][n];
		for (double [] o : offsets) {
			double [][] g = FourierTools.gaussian2d(n, n, n / 2 + o[0], n / 2 + o[1], 1.5, 1.5, 100.0);
			for (int y = 0; y < n; y++) {
				for (int x = 0; x < n; x++) {
					spectrum[y][x] += g[y][x];
				}
			}
		}
		BraggPeakParameters bpp = BraggPeakParameters.builder().rspace(false).precise(true).fitWidth(6).build();
		double [][] bp = BraggPeaks.sortBraggs(new BraggPeakDetector(bpp).findBraggs(spectrum), n, n);
		for (int i = 0; i < 4; i++) {
			assertEquals(n / 2 + offsets[i][0], bp[i][0], 0.02);
			assertEquals(n / 2 + offsets[i][1], bp[i][1], 0.02);
		}
	}

	@Test
	public void maskRemovesAxisPeaks() {
		int n = 64;
		double [][] spectrum = new double [n][n];
		spectrum[32][44] = 50.0; // on the x axis
		spectrum[20][20] = 10.0;
		BraggPeakParameters bpp = BraggPeakParameters.builder().rspace(false).w(0.05).build();
		double [][] peaks = new BraggPeakDetector(bpp).findPeaks(spectrum);
		assertEquals(1, peaks.length);
		assertArrayEquals(new double [] {20, 20}, peaks[0], 0.0);
	}

	@Test(expected = InsufficientPeaksException.class)
	public void featurelessImageHasNoPeaks() {
		new BraggPeakDetector(null).findBraggs(new double [64][64]);
	}

	@Test(expected = ConfigurationException.class)
	public void invalidThreshold() {
		BraggPeakParameters.builder().thres(1.5).build();
	}
}
