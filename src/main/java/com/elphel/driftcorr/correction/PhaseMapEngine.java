/**
 **
 ** PhaseMapEngine.java - lock-in and convolution demodulation of lattice phase
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PhaseMapEngine.java is free software: you can redistribute it and/or modify
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.driftcorr.common.ConfigurationException;
import com.elphel.driftcorr.common.FourierTools;
import com.elphel.driftcorr.common.ImageArrays;
import com.elphel.driftcorr.common.UnsupportedMethodException;
import com.elphel.driftcorr.lattice.BraggPeaks;

/**
 * Local phase of the lattice relative to ideal cosine gratings at the frequencies of the
 * first two sorted peaks. For image cos(Q*r + phi(r)) the lock-in method returns -phi, the
 * convolution method +phi, {@link DriftFieldCalculator} accounts for the difference.
 */
public class PhaseMapEngine {
	private static final Logger LOGGER = LoggerFactory.getLogger(PhaseMapEngine.class);

	/**
	 * Lattice frequency of a peak, radians per pixel.
	 */
	public static double [] frequency(double [] peak, int width, int height) {
		double [] c = BraggPeaks.center(width, height);
		return new double [] {
				2 * Math.PI * (peak[0] - c[0]) / width,
				2 * Math.PI * (peak[1] - c[1]) / height};
	}

	/**
	 * @param image real space image [y][x]
	 * @param bp peaks, sorted internally
	 * @param sigma {sigma} or {sigma_x, sigma_y}: low-pass width in frequency bins (lock-in)
	 *        or Gaussian kernel width in pixels (convolution)
	 * @param method demodulation method
	 */
	public static PhaseMaps phaseMap(
			double [][]      image,
			double [][]      bp,
			double []        sigma,
			CorrectionMethod method) {
		int [] wh = ImageArrays.shape(image);
		int width = wh[0];
		int height = wh[1];
		double [] sxy = sigmaXY(sigma);
		double [][] sorted = BraggPeaks.sortBraggs(bp, width, height);
		double [] q1 = frequency(sorted[0], width, height);
		double [] q2 = frequency(sorted[1], width, height);
		if (method == null) {
			throw new UnsupportedMethodException("Phase map method is not specified");
		}
		LOGGER.debug("Phase map ("+method+"): Q1=("+q1[0]+", "+q1[1]+"), Q2=("+q2[0]+", "+q2[1]+"), sigma="+sxy[0]+","+sxy[1]);
		switch (method) {
		case LOCKIN:
			return new PhaseMaps(
					lockin(image, q1, sxy[0], sxy[1]),
					lockin(image, q2, sxy[0], sxy[1]),
					q1, q2, null, null, method);
		case CONVOLUTION:
			double [][] kernel = kernel(width, height, sxy[0], sxy[1]);
			double [][] t1 = demodulate(image, q1, kernel);
			double [][] t2 = demodulate(image, q2, kernel);
			return new PhaseMaps(
					FourierTools.arg(t1),
					FourierTools.arg(t2),
					q1, q2,
					FourierTools.abs(t1),
					FourierTools.abs(t2),
					method);
		default:
			throw new UnsupportedMethodException("Unsupported phase map method "+method);
		}
	}

	static double [] sigmaXY(double [] sigma) {
		if ((sigma == null) || (sigma.length == 0)) {
			throw new ConfigurationException("Phase map sigma is not specified");
		}
		double [] sxy = {sigma[0], (sigma.length > 1) ? sigma[1] : sigma[0]};
		if (!(sxy[0] > 0) || !(sxy[1] > 0)) {
			throw new ConfigurationException("Phase map sigma should be positive");
		}
		return sxy;
	}

	/**
	 * atan2 of the low-passed sine and cosine channels.
	 */
	static double [][] lockin(double [][] image, double [] q, double sigma_x, double sigma_y) {
		int height = image.length;
		int width = image[0].length;
		double [][] as = new double [height][width];
		double [][] ac = new double [height][width];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				double a = q[0] * x + q[1] * y;
				as[y][x] = image[y][x] * Math.sin(a);
				ac[y][x] = image[y][x] * Math.cos(a);
			}
		}
		double [][] asf = FourierTools.lowPass(as, sigma_x, sigma_y);
		double [][] acf = FourierTools.lowPass(ac, sigma_x, sigma_y);
		double [][] theta = new double [height][width];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				theta[y][x] = Math.atan2(asf[y][x], acf[y][x]);
			}
		}
		return theta;
	}

	/**
	 * Gaussian kernel of the image size, amplitude 1/(4 pi sx sy). Centered at ((n-1)/2) so
	 * that the "same" convolution does not shift the result.
	 */
	static double [][] kernel(int width, int height, double sx, double sy) {
		return FourierTools.gaussian2d(width, height, (width - 1) / 2, (height - 1) / 2, sx, sy, 1.0 / (4 * Math.PI * sx * sy));
	}

	/**
	 * Multiply by exp(-i Q*r) and convolve with the kernel, complex result.
	 */
	static double [][] demodulate(double [][] image, double [] q, double [][] kernel) {
		int height = image.length;
		int width = image[0].length;
		double [][] c = new double [height][2 * width];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				double a = q[0] * x + q[1] * y;
				c[y][2 * x] =      image[y][x] * Math.cos(a);
				c[y][2 * x + 1] = -image[y][x] * Math.sin(a);
			}
		}
		return FourierTools.convolveSame(c, kernel);
	}
}
