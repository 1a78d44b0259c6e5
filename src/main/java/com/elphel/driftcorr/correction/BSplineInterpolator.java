/**
 **
 ** BSplineInterpolator.java - linear and cubic B-spline interpolation of 2D images
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  BSplineInterpolator.java is free software: you can redistribute it and/or modify
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

import com.elphel.driftcorr.common.ImageArrays;
import com.elphel.driftcorr.common.UnsupportedMethodException;

/**
 * Tensor-product B-spline interpolant of an image [y][x], passing through every pixel.
 * Cubic coefficients are obtained with the recursive prefilter (pole sqrt(3)-2) under
 * mirror boundary conditions. Coordinates are pixel indices, samples outside
 * [0, width-1] x [0, height-1] either clamp to the border or return zero.
 */
public class BSplineInterpolator {
	private static final double POLE = Math.sqrt(3.0) - 2.0;
	private static final int    HORIZON = (int) Math.ceil(Math.log(1e-17) / Math.log(-POLE));

	private final Interpolation interpolation;
	private final double [][]   coeff;
	private final int           width;
	private final int           height;

	public BSplineInterpolator(double [][] image, Interpolation interpolation) {
		if (interpolation == null) {
			throw new UnsupportedMethodException("Interpolation is not specified");
		}
		int [] wh = ImageArrays.shape(image);
		this.width =  wh[0];
		this.height = wh[1];
		this.interpolation = interpolation;
		switch (interpolation) {
		case LINEAR:
			this.coeff = image;
			break;
		case CUBIC:
			this.coeff = ImageArrays.copy(image);
			for (int y = 0; y < height; y++) {
				prefilter(coeff[y]);
			}
			double [] column = new double [height];
			for (int x = 0; x < width; x++) {
				for (int y = 0; y < height; y++) column[y] = coeff[y][x];
				prefilter(column);
				for (int y = 0; y < height; y++) coeff[y][x] = column[y];
			}
			break;
		default:
			throw new UnsupportedMethodException("Unsupported interpolation "+interpolation);
		}
	}

	public int getWidth()  {return width;}
	public int getHeight() {return height;}

	/**
	 * In-place conversion of samples to cubic B-spline coefficients, mirror boundaries.
	 */
	static void prefilter(double [] c) {
		int n = c.length;
		if (n < 2) return;
		double z = POLE;
		for (int k = 0; k < n; k++) {
			c[k] *= 6.0; // (1 - z) * (1 - 1/z)
		}
		// causal initialization
		if (n > HORIZON) { // z^k is negligible beyond the horizon
			double sum = c[0];
			double zk = z;
			for (int k = 1; k < HORIZON; k++) {
				sum += zk * c[k];
				zk *= z;
			}
			c[0] = sum;
		} else { // exact for the mirror-extended (period 2n-2) signal
			double zn = Math.pow(z, n - 1);
			double z2n = zn * zn / z;
			double sum = c[0] + zn * c[n - 1];
			double zk = z;
			for (int k = 1; k < n - 1; k++) {
				sum += (zk + z2n / zk * z) * c[k];
				zk *= z;
			}
			c[0] = sum / (1.0 - zn * zn);
		}
		for (int k = 1; k < n; k++) {
			c[k] += z * c[k - 1];
		}
		c[n - 1] = z / (z * z - 1.0) * (c[n - 1] + z * c[n - 2]);
		for (int k = n - 2; k >= 0; k--) {
			c[k] = z * (c[k + 1] - c[k]);
		}
	}

	private static int mirror(int k, int n) {
		if (n == 1) return 0;
		int period = 2 * n - 2;
		k = Math.abs(k) % period;
		return (k < n) ? k : (period - k);
	}

	/**
	 * @param x column coordinate
	 * @param y row coordinate
	 * @return interpolated value, coordinates clamped to the image
	 */
	public double value(double x, double y) {
		x = Math.min(Math.max(x, 0.0), width - 1);
		y = Math.min(Math.max(y, 0.0), height - 1);
		int ix = (int) Math.floor(x);
		int iy = (int) Math.floor(y);
		double tx = x - ix;
		double ty = y - iy;
		if (interpolation == Interpolation.LINEAR) {
			int ix1 = Math.min(ix + 1, width - 1);
			int iy1 = Math.min(iy + 1, height - 1);
			return (1 - ty) * ((1 - tx) * coeff[iy][ix]  + tx * coeff[iy][ix1]) +
					     ty * ((1 - tx) * coeff[iy1][ix] + tx * coeff[iy1][ix1]);
		}
		double [] wx = cubicWeights(tx);
		double [] wy = cubicWeights(ty);
		double v = 0.0;
		for (int j = 0; j < 4; j++) {
			double [] row = coeff[mirror(iy - 1 + j, height)];
			double r = 0.0;
			for (int i = 0; i < 4; i++) {
				r += wx[i] * row[mirror(ix - 1 + i, width)];
			}
			v += wy[j] * r;
		}
		return v;
	}

	static double [] cubicWeights(double t) {
		double t2 = t * t;
		double t3 = t2 * t;
		double u = 1.0 - t;
		return new double [] {
				u * u * u / 6.0,
				(4.0 - 6.0 * t2 + 3.0 * t3) / 6.0,
				(1.0 + 3.0 * t + 3.0 * t2 - 3.0 * t3) / 6.0,
				t3 / 6.0};
	}

	/**
	 * Sample the interpolant on a coordinate grid.
	 * @param xs column coordinates [y][x]
	 * @param ys row coordinates [y][x]
	 * @param zero_outside return 0 for coordinates outside the image instead of clamping
	 * @return sampled image of the grid shape
	 */
	public double [][] sample(double [][] xs, double [][] ys, boolean zero_outside) {
		double [][] r = new double [xs.length][xs[0].length];
		for (int y = 0; y < r.length; y++) {
			for (int x = 0; x < r[y].length; x++) {
				double sx = xs[y][x];
				double sy = ys[y][x];
				if (zero_outside && ((sx < 0) || (sy < 0) || (sx > width - 1) || (sy > height - 1))) {
					continue;
				}
				r[y][x] = value(sx, sy);
			}
		}
		return r;
	}

	/**
	 * Sample on a separable grid: pixel (i, j) of the result is value(xs[i], ys[j]).
	 */
	public double [][] sampleGrid(double [] xs, double [] ys) {
		double [][] r = new double [ys.length][xs.length];
		for (int j = 0; j < ys.length; j++) {
			for (int i = 0; i < xs.length; i++) {
				r[j][i] = value(xs[i], ys[j]);
			}
		}
		return r;
	}
}
