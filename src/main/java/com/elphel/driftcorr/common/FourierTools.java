/**
 **
 ** FourierTools.java - 2D FFT, spectrum shifts, Gaussian filters and convolution
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FourierTools.java is free software: you can redistribute it and/or modify
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

import org.jtransforms.fft.DoubleFFT_2D;

/**
 * Frequency domain helpers over JTransforms. Complex 2D data is stored as
 * double [height][2*width] with interleaved (re, im) pairs, the layout
 * DoubleFFT_2D.complexForward() expects. Real images are double [height][width].
 * Shifted spectra have the DC component at (width/2, height/2).
 */
public class FourierTools {

	public static double [][] toComplex(double [][] re) {
		int height = re.length;
		int width = re[0].length;
		double [][] c = new double [height][2 * width];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				c[y][2 * x] = re[y][x];
			}
		}
		return c;
	}

	/** In-place forward transform of complex data. */
	public static void fft2(double [][] c) {
		new DoubleFFT_2D(c.length, c[0].length / 2).complexForward(c);
	}

	/** In-place scaled inverse transform of complex data. */
	public static void ifft2(double [][] c) {
		new DoubleFFT_2D(c.length, c[0].length / 2).complexInverse(c, true);
	}

	public static double [][] fft2Real(double [][] re) {
		double [][] c = toComplex(re);
		fft2(c);
		return c;
	}

	public static double [][] real(double [][] c) {
		int height = c.length;
		int width = c[0].length / 2;
		double [][] re = new double [height][width];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				re[y][x] = c[y][2 * x];
			}
		}
		return re;
	}

	public static double [][] abs(double [][] c) {
		int height = c.length;
		int width = c[0].length / 2;
		double [][] a = new double [height][width];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				a[y][x] = Math.hypot(c[y][2 * x], c[y][2 * x + 1]);
			}
		}
		return a;
	}

	public static double [][] arg(double [][] c) {
		int height = c.length;
		int width = c[0].length / 2;
		double [][] a = new double [height][width];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				a[y][x] = Math.atan2(c[y][2 * x + 1], c[y][2 * x]);
			}
		}
		return a;
	}

	/**
	 * Circular shift moving element (0,0) to (width/2, height/2).
	 * @param a real or complex array
	 * @param complex true if a holds interleaved complex data
	 * @return new shifted array
	 */
	public static double [][] fftshift(double [][] a, boolean complex) {
		int stride = complex ? 2 : 1;
		int height = a.length;
		int width = a[0].length / stride;
		return roll(a, height / 2, width / 2, stride);
	}

	/** Inverse of {@link #fftshift(double[][], boolean)}, moves (width/2, height/2) back to (0,0). */
	public static double [][] ifftshift(double [][] a, boolean complex) {
		int stride = complex ? 2 : 1;
		int height = a.length;
		int width = a[0].length / stride;
		return roll(a, height - height / 2, width - width / 2, stride);
	}

	static double [][] roll(double [][] a, int dy, int dx, int stride) {
		int height = a.length;
		int width = a[0].length / stride;
		double [][] r = new double [height][a[0].length];
		for (int y = 0; y < height; y++) {
			int yd = (y + dy) % height;
			for (int x = 0; x < width; x++) {
				int xd = (x + dx) % width;
				for (int k = 0; k < stride; k++) {
					r[yd][stride * xd + k] = a[y][stride * x + k];
				}
			}
		}
		return r;
	}

	/**
	 * Shifted magnitude spectrum with the DC bin set to zero.
	 * @param image real image [y][x]
	 * @return |fftshift(fft2(image))| with zero at (width/2, height/2)
	 */
	public static double [][] magnitudeSpectrum(double [][] image) {
		double [][] c = fft2Real(image);
		c[0][0] = 0.0;
		c[0][1] = 0.0;
		return fftshift(abs(c), false);
	}

	/**
	 * Signed frequency index of an unshifted FFT bin (0, 1, ... n/2-1, -n/2, ... -1 for even n).
	 */
	public static int signedIndex(int i, int n) {
		return (i < (n - n / 2)) ? i : (i - n);
	}

	/**
	 * Keep only low spatial frequencies of a real image: multiply its spectrum by a unit height
	 * Gaussian centered on DC, transform back and return the real part.
	 * @param image real image [y][x]
	 * @param sigma_x Gaussian width along x, in frequency bins
	 * @param sigma_y Gaussian width along y, in frequency bins
	 * @return filtered real image
	 */
	public static double [][] lowPass(double [][] image, double sigma_x, double sigma_y) {
		int height = image.length;
		int width = image[0].length;
		double [][] c = fft2Real(image);
		double [] gx = new double [width];
		double [] gy = new double [height];
		for (int x = 0; x < width; x++) {
			double k = signedIndex(x, width);
			gx[x] = Math.exp(-k * k / (2 * sigma_x * sigma_x));
		}
		for (int y = 0; y < height; y++) {
			double k = signedIndex(y, height);
			gy[y] = Math.exp(-k * k / (2 * sigma_y * sigma_y));
		}
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				double g = gy[y] * gx[x];
				c[y][2 * x]     *= g;
				c[y][2 * x + 1] *= g;
			}
		}
		ifft2(c);
		return real(c);
	}

	/**
	 * Axis aligned 2D Gaussian sampled on an integer grid.
	 * @return amp * exp(-((x-xc)^2/(2 sx^2) + (y-yc)^2/(2 sy^2))), [height][width]
	 */
	public static double [][] gaussian2d(
			int    width,
			int    height,
			double xc,
			double yc,
			double sx,
			double sy,
			double amp) {
		double [][] g = new double [height][width];
		for (int y = 0; y < height; y++) {
			double dy = (y - yc) / sy;
			for (int x = 0; x < width; x++) {
				double dx = (x - xc) / sx;
				g[y][x] = amp * Math.exp(-0.5 * (dx * dx + dy * dy));
			}
		}
		return g;
	}

	/**
	 * Linear (zero padded) convolution of complex data with a real kernel, cropped to the
	 * size of the data and centered as scipy "same" mode.
	 * @param c complex data [height][2*width]
	 * @param kernel real kernel [kh][kw]
	 * @return complex result of the same size as c
	 */
	public static double [][] convolveSame(double [][] c, double [][] kernel) {
		int height = c.length;
		int width = c[0].length / 2;
		int kh = kernel.length;
		int kw = kernel[0].length;
		int ph = height + kh - 1;
		int pw = width + kw - 1;
		double [][] a = new double [ph][2 * pw];
		for (int y = 0; y < height; y++) {
			System.arraycopy(c[y], 0, a[y], 0, 2 * width);
		}
		double [][] k = new double [ph][2 * pw];
		for (int y = 0; y < kh; y++) {
			for (int x = 0; x < kw; x++) {
				k[y][2 * x] = kernel[y][x];
			}
		}
		DoubleFFT_2D fft = new DoubleFFT_2D(ph, pw);
		fft.complexForward(a);
		fft.complexForward(k);
		for (int y = 0; y < ph; y++) {
			for (int x = 0; x < pw; x++) {
				double re = a[y][2 * x] * k[y][2 * x]     - a[y][2 * x + 1] * k[y][2 * x + 1];
				double im = a[y][2 * x] * k[y][2 * x + 1] + a[y][2 * x + 1] * k[y][2 * x];
				a[y][2 * x] =     re;
				a[y][2 * x + 1] = im;
			}
		}
		fft.complexInverse(a, true);
		int y0 = (kh - 1) / 2;
		int x0 = (kw - 1) / 2;
		double [][] r = new double [height][2 * width];
		for (int y = 0; y < height; y++) {
			System.arraycopy(a[y + y0], 2 * x0, r[y], 0, 2 * width);
		}
		return r;
	}
}
