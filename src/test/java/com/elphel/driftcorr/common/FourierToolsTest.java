/**
 **
 ** FourierToolsTest.java - tests of the FFT helpers
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FourierToolsTest.java is free software: you can redistribute it and/or modify
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

package com.elphel.driftcorr.common;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class FourierToolsTest {
	private static final double EPS = 1e-9;

	private static double [][] ramp(int width, int height) {
		double [][] a = new double [height][width];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				a[y][x] = 100 * y + x;
			}
		}
		return a;
	}

	@Test
	public void shiftMovesOriginToCenter() {
		double [][] a = ramp(5, 4);
		double [][] s = FourierTools.fftshift(a, false);
		assertEquals(a[0][0], s[2][2], EPS);
		assertEquals(a[3][4], s[1][1], EPS);
	}

	@Test
	public void inverseShiftRestoresOddAndEvenSizes() {
		double [][] a = ramp(7, 6);
		double [][] back = FourierTools.ifftshift(FourierTools.fftshift(a, false), false);
		for (int y = 0; y < a.length; y++) {
			assertArrayEquals(a[y], back[y], EPS);
		}
		double [][] c = FourierTools.toComplex(ramp(5, 3));
		double [][] cback = FourierTools.ifftshift(FourierTools.fftshift(c, true), true);
		for (int y = 0; y < c.length; y++) {
			assertArrayEquals(c[y], cback[y], EPS);
		}
	}

	@Test
	public void magnitudeSpectrumOfCosine() {
		int n = 32;
		double [][] a = new double [n][n];
		for (int y = 0; y < n; y++) {
			for (int x = 0; x < n; x++) {
				a[y][x] = 3.0 + Math.cos(2 * Math.PI * 8 * x / n);
			}
		}
		double [][] m = FourierTools.magnitudeSpectrum(a);
		assertEquals(0.0, m[16][16], EPS);
		assertEquals(n * n / 2.0, m[16][24], 1e-6);
		assertEquals(n * n / 2.0, m[16][8], 1e-6);
		assertEquals(0.0, m[20][20], 1e-6);
	}

	@Test
	public void forwardInverseTransform() {
		double [][] a = ramp(6, 5);
		double [][] c = FourierTools.fft2Real(a);
		FourierTools.ifft2(c);
		double [][] re = FourierTools.real(c);
		for (int y = 0; y < a.length; y++) {
			assertArrayEquals(a[y], re[y], 1e-9);
		}
	}

	@Test
	public void lowPassKeepsConstantAndSuppressesHighFrequency() {
		int n = 32;
		double [][] a = new double [n][n];
		for (int y = 0; y < n; y++) {
			for (int x = 0; x < n; x++) {
				a[y][x] = 2.0 + (((x + y) % 2 == 0) ? 1.0 : -1.0);
			}
		}
		double [][] f = FourierTools.lowPass(a, 2.0, 2.0);
		for (int y = 0; y < n; y++) {
			for (int x = 0; x < n; x++) {
				assertEquals(2.0, f[y][x], 1e-6);
			}
		}
	}

	@Test
	public void signedIndex() {
		assertEquals(0, FourierTools.signedIndex(0, 8));
		assertEquals(3, FourierTools.signedIndex(3, 8));
		assertEquals(-4, FourierTools.signedIndex(4, 8));
		assertEquals(-1, FourierTools.signedIndex(7, 8));
		assertEquals(2, FourierTools.signedIndex(2, 5));
		assertEquals(-2, FourierTools.signedIndex(3, 5));
	}

	@Test
	public void convolutionWithCenteredDeltaIsIdentity() {
		double [][] c = FourierTools.toComplex(ramp(9, 7));
		for (int y = 0; y < c.length; y++) {
			for (int x = 0; x < 9; x++) c[y][2 * x + 1] = -y;
		}
		double [][] kernel = new double [5][4];
		kernel[2][1] = 1.0; // ((n - 1) / 2)
		double [][] r = FourierTools.convolveSame(c, kernel);
		for (int y = 0; y < c.length; y++) {
			assertArrayEquals(c[y], r[y], 1e-9);
		}
	}

	@Test
	public void gaussianPeak() {
		double [][] g = FourierTools.gaussian2d(11, 9, 5, 4, 2.0, 1.0, 3.0);
		assertEquals(3.0, g[4][5], EPS);
		assertEquals(3.0 * Math.exp(-0.5), g[4][7], EPS);
		assertEquals(3.0 * Math.exp(-0.5), g[5][5], EPS);
	}
}
