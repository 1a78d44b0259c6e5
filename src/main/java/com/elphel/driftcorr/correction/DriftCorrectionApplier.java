/**
 **
 ** DriftCorrectionApplier.java - applies a drift field to an image or a stack
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DriftCorrectionApplier.java is free software: you can redistribute it and/or modify
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

import com.elphel.driftcorr.common.FourierTools;
import com.elphel.driftcorr.common.ImageArrays;
import com.elphel.driftcorr.common.MultiThreading;
import com.elphel.driftcorr.common.ProgressMonitor;
import com.elphel.driftcorr.common.UnsupportedMethodException;

/**
 * Produces corrected(r) = image(r - u(r)) either by B-spline resampling (LOCKIN) or by
 * evaluating the Fourier sum of the image at the displaced pixel positions and transforming
 * back (CONVOLUTION). Stack layers share the field and are processed in parallel.
 */
public class DriftCorrectionApplier {
	private static final Logger LOGGER = LoggerFactory.getLogger(DriftCorrectionApplier.class);
	/** Fixed partition of the Fourier sum, keeps the summation order independent of the thread count. */
	static final int FOURIER_CHUNKS = 16;

	private final CorrectionMethod method;
	private final Interpolation    interpolation;
	private final int              threadsMax;

	public DriftCorrectionApplier(CorrectionMethod method, Interpolation interpolation, int threadsMax) {
		if (method == null) {
			throw new UnsupportedMethodException("Drift correction method is not specified");
		}
		if ((method == CorrectionMethod.LOCKIN) && (interpolation == null)) {
			throw new UnsupportedMethodException("Interpolation is not specified");
		}
		this.method =        method;
		this.interpolation = interpolation;
		this.threadsMax =    threadsMax;
	}

	public double [][] apply(double [][] image, DriftField field) {
		int [] wh = ImageArrays.shape(image);
		field.checkShape(wh[0], wh[1]);
		switch (method) {
		case LOCKIN:
			return resample(image, field, interpolation);
		case CONVOLUTION:
			return inverseFourier(image, field, threadsMax);
		default:
			throw new UnsupportedMethodException("Unsupported drift correction method "+method);
		}
	}

	/**
	 * Correct each layer with the same field.
	 * @param monitor optional progress/cancellation, may be null
	 * @throws java.util.concurrent.CancellationException if canceled by the monitor
	 */
	public double [][][] apply(final double [][][] stack, final DriftField field, final ProgressMonitor monitor) {
		int [] wh = ImageArrays.shape(stack);
		field.checkShape(wh[0], wh[1]);
		final double [][][] result = new double [stack.length][][];
		LOGGER.info("Applying drift field ("+method+") to "+stack.length+" layers "+wh[0]+"x"+wh[1]);
		MultiThreading.runIndexed(stack.length, threadsMax, nLayer -> {
			switch (method) {
			case LOCKIN:
				result[nLayer] = resample(stack[nLayer], field, interpolation);
				break;
			case CONVOLUTION:
				result[nLayer] = inverseFourier(stack[nLayer], field, 1);
				break;
			default:
				throw new UnsupportedMethodException("Unsupported drift correction method "+method);
			}
			LOGGER.debug("Layer "+nLayer+" corrected");
		}, monitor);
		return result;
	}

	/**
	 * Sample the spline interpolant at (x - ux, y - uy), coordinates clamped to the image.
	 */
	public static double [][] resample(double [][] image, DriftField field, Interpolation interpolation) {
		int height = image.length;
		int width = image[0].length;
		double [][] xs = new double [height][width];
		double [][] ys = new double [height][width];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				xs[y][x] = x - field.ux[y][x];
				ys[y][x] = y - field.uy[y][x];
			}
		}
		return new BSplineInterpolator(image, interpolation).sample(xs, ys, false);
	}

	/**
	 * Each pixel is moved to (x + ux, y + uy) and the image is rebuilt from the Fourier sum
	 * over the moved positions. Pixels moved outside [0, width] x [0, height] are zeroed
	 * before the mean is removed.
	 */
	public static double [][] inverseFourier(final double [][] image, final DriftField field, int threadsMax) {
		final int height = image.length;
		final int width = image[0].length;
		final double [][] a = ImageArrays.copy(image);
		int num_zeroed = 0;
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				double xs = x + field.ux[y][x];
				double ys = y + field.uy[y][x];
				if ((xs < 0) || (ys < 0) || (xs > width) || (ys > height)) {
					a[y][x] = 0.0;
					num_zeroed++;
				}
			}
		}
		final double mean = ImageArrays.mean(a);
		for (double [] row : a) {
			for (int x = 0; x < width; x++) row[x] -= mean;
		}
		if (num_zeroed > 0) {
			LOGGER.debug("Inverse Fourier correction: "+num_zeroed+" pixels moved outside the image");
		}
		final double [] qx = new double [width];
		final double [] qy = new double [height];
		for (int k = 0; k < width; k++)  qx[k] = 2 * Math.PI / width *  (k - width / 2);
		for (int k = 0; k < height; k++) qy[k] = 2 * Math.PI / height * (k - height / 2);
		final int num_chunks = Math.min(FOURIER_CHUNKS, height);
		final double [][][] partial = new double [num_chunks][][];
		MultiThreading.runIndexed(num_chunks, threadsMax, nChunk -> {
			double [][] ft = new double [height][2 * width];
			double [] ex_re = new double [width];
			double [] ex_im = new double [width];
			int y0 = nChunk * height / num_chunks;
			int y1 = (nChunk + 1) * height / num_chunks;
			for (int y = y0; y < y1; y++) {
				for (int x = 0; x < width; x++) {
					double v = a[y][x];
					if (v == 0.0) continue;
					double xs = x + field.ux[y][x];
					double ys = y + field.uy[y][x];
					for (int kx = 0; kx < width; kx++) {
						ex_re[kx] =  Math.cos(qx[kx] * xs);
						ex_im[kx] = -Math.sin(qx[kx] * xs);
					}
					for (int ky = 0; ky < height; ky++) {
						double ey_re =  v * Math.cos(qy[ky] * ys);
						double ey_im = -v * Math.sin(qy[ky] * ys);
						double [] row = ft[ky];
						for (int kx = 0; kx < width; kx++) {
							row[2 * kx]     += ey_re * ex_re[kx] - ey_im * ex_im[kx];
							row[2 * kx + 1] += ey_re * ex_im[kx] + ey_im * ex_re[kx];
						}
					}
				}
			}
			partial[nChunk] = ft;
		}, null);
		double [][] ft = partial[0];
		for (int n = 1; n < num_chunks; n++) {
			for (int ky = 0; ky < height; ky++) {
				for (int i = 0; i < 2 * width; i++) {
					ft[ky][i] += partial[n][ky][i];
				}
			}
		}
		double [][] c = FourierTools.ifftshift(ft, true);
		FourierTools.ifft2(c);
		double [][] result = FourierTools.real(c);
		for (double [] row : result) {
			for (int x = 0; x < width; x++) row[x] += mean;
		}
		return result;
	}
}
