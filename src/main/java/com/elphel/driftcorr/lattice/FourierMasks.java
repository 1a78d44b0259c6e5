/**
 **
 ** FourierMasks.java - multiplicative masks for the magnitude spectrum
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FourierMasks.java is free software: you can redistribute it and/or modify
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

import java.util.Arrays;

import com.elphel.driftcorr.common.FourierTools;

/**
 * Masks are [height][width] arrays of the shifted spectrum, 1.0 where data is kept.
 */
public class FourierMasks {

	/**
	 * Suppress the strong low-q background: 1 - Gaussian centered on DC. The Gaussian is
	 * rotated by pi/2, so x uses the height-scaled width and y the width-scaled one.
	 * @param r width as a fraction of the image size
	 */
	public static double [][] lowQ(int width, int height, double r) {
		double [][] g = FourierTools.gaussian2d(width, height, width / 2, height / 2, height * r, width * r, 1.0);
		for (double [] row : g) {
			for (int x = 0; x < row.length; x++) {
				row[x] = 1.0 - row[x];
			}
		}
		return g;
	}

	/**
	 * Zero bands along the frequency axes through DC (scan line noise).
	 * @param w band half-width as a fraction of the image size
	 */
	public static double [][] axes(int width, int height, double w) {
		double [][] m = ones(width, height);
		int hy = (int) (height * w);
		int hx = (int) (width * w);
		for (int y = Math.max(0, height / 2 - hy); y < Math.min(height, height / 2 + hy); y++) {
			Arrays.fill(m[y], 0.0);
		}
		for (double [] row : m) {
			for (int x = Math.max(0, width / 2 - hx); x < Math.min(width, width / 2 + hx); x++) {
				row[x] = 0.0;
			}
		}
		return m;
	}

	/**
	 * Zero n lines through DC at angles 2*pi*i/n + offset.
	 * @param mask3 {n, offset, width}
	 */
	public static double [][] angular(int width, int height, double [] mask3) {
		int n = (int) mask3[0];
		double offset = mask3[1];
		double lw = mask3[2];
		double cx = width / 2;
		double cy = height / 2;
		double aspect = ((double) height) / width;
		double [][] m = ones(width, height);
		for (int i = 0; i < n; i++) {
			double a = 2 * Math.PI * i / n + offset;
			double ca = Math.cos(a);
			double sa = Math.sin(a);
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					if (Math.abs(ca * (y - cy) - sa * (x - cx) * aspect) < lw) {
						m[y][x] = 0.0;
					}
				}
			}
		}
		return m;
	}

	/** Multiply data in place by all masks enabled in the parameters. */
	public static void apply(double [][] spectrum, BraggPeakParameters bpp) {
		int height = spectrum.length;
		int width = spectrum[0].length;
		if (bpp.getR() != null) {
			multiply(spectrum, lowQ(width, height, bpp.getR()));
		}
		if (bpp.getW() != null) {
			multiply(spectrum, axes(width, height, bpp.getW()));
		}
		if (bpp.getMask3() != null) {
			multiply(spectrum, angular(width, height, bpp.getMask3()));
		}
	}

	static void multiply(double [][] data, double [][] mask) {
		for (int y = 0; y < data.length; y++) {
			for (int x = 0; x < data[y].length; x++) {
				data[y][x] *= mask[y][x];
			}
		}
	}

	static double [][] ones(int width, int height) {
		double [][] m = new double [height][width];
		for (double [] row : m) Arrays.fill(row, 1.0);
		return m;
	}
}
