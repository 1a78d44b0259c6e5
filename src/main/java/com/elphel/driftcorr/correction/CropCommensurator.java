/**
 **
 ** CropCommensurator.java - edge trimming and resampling to whole lattice periods
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CropCommensurator.java is free software: you can redistribute it and/or modify
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
import com.elphel.driftcorr.common.ImageArrays;
import com.elphel.driftcorr.common.MultiThreading;
import com.elphel.driftcorr.common.ProgressMonitor;
import com.elphel.driftcorr.lattice.BraggPeakDetector;
import com.elphel.driftcorr.lattice.BraggPeaks;

/**
 * Trims image edges ({left, right, down, up}: columns from the row start and end, rows from
 * the top and bottom of the array) and optionally resamples the trimmed image so that it
 * spans a whole number of lattice periods while keeping its pixel count.
 */
public class CropCommensurator {
	private static final Logger LOGGER = LoggerFactory.getLogger(CropCommensurator.class);

	public static final double DEFAULT_C1 = 2.0;

	public static class Result {
		public final double [][][] layers;
		public final double        a1;      // lattice period along x, input pixels (NaN - not commensurated)
		public final double        a2;      // lattice period along y, input pixels
		public final int           cells_x; // whole periods kept along x
		public final int           cells_y; // whole periods kept along y

		Result(double [][][] layers, double a1, double a2, int cells_x, int cells_y) {
			this.layers =  layers;
			this.a1 =      a1;
			this.a2 =      a2;
			this.cells_x = cells_x;
			this.cells_y = cells_y;
		}

		public double [][] getImage() {
			return layers[0];
		}

		public boolean isCommensurate() {
			return cells_x > 0;
		}

		/** Lattice period along x in output pixels, width / period is integer. */
		public double getOutputPeriodX() {
			return ((double) layers[0][0].length) / cells_x;
		}

		public double getOutputPeriodY() {
			return ((double) layers[0].length) / cells_y;
		}
	}

	private final double c1;
	private final Double a1;
	private final Double a2;
	private final int    threadsMax;

	public CropCommensurator() {
		this(DEFAULT_C1, null, null, MultiThreading.THREADS_MAX);
	}

	/**
	 * @param c1 period scale along x: a1 = c1 * width / |bp0 - bp1|
	 * @param a1 explicit period along x in pixels, null to measure
	 * @param a2 explicit period along y in pixels, null to use a1
	 */
	public CropCommensurator(double c1, Double a1, Double a2, int threadsMax) {
		this.c1 =         c1;
		this.a1 =         a1;
		this.a2 =         a2;
		this.threadsMax = threadsMax;
	}

	/**
	 * @param n null, {n} for all edges or {left, right, down, up}
	 * @return {left, right, down, up}
	 */
	public static int [] margins(int [] n) {
		if ((n == null) || (n.length == 0)) {
			return new int [4];
		}
		if (n.length == 1) {
			return new int [] {n[0], n[0], n[0], n[0]};
		}
		if (n.length == 4) {
			return n.clone();
		}
		throw new ConfigurationException("Crop needs 1 or 4 values, got "+n.length);
	}

	public static double [][] trim(double [][] image, int [] n) {
		int [] m = margins(n);
		return ImageArrays.trim(image, m[0], m[1], m[2], m[3]);
	}

	public Result crop(double [][] image, int [] n) {
		return crop(new double [][][] {image}, n, null, false, null, null);
	}

	/**
	 * @param stack one or more co-registered layers
	 * @param n margins, see {@link #margins(int[])}
	 * @param bp peaks of the untrimmed image, null to detect them when needed
	 * @param force_commen resample to whole lattice periods
	 * @param detector peak detector used when bp is null, may be null for defaults
	 * @param monitor optional progress/cancellation
	 */
	public Result crop(
			final double [][][]   stack,
			int []                n,
			double [][]           bp,
			boolean               force_commen,
			BraggPeakDetector     detector,
			ProgressMonitor       monitor) {
		final int [] m = margins(n);
		int [] wh = ImageArrays.shape(stack);
		final double [][][] trimmed = new double [stack.length][][];
		for (int i = 0; i < stack.length; i++) {
			trimmed[i] = ImageArrays.trim(stack[i], m[0], m[1], m[2], m[3]);
		}
		int width = trimmed[0][0].length;
		int height = trimmed[0].length;
		LOGGER.info("Shape before crop: "+wh[0]+"x"+wh[1]+", after crop: "+width+"x"+height);
		if (!force_commen) {
			return new Result(trimmed, Double.NaN, Double.NaN, 0, 0);
		}
		if (bp == null) {
			if (detector == null) {
				detector = new BraggPeakDetector(null);
			}
			bp = detector.findBraggs(meanLayer(stack));
		}
		double [][] sorted = BraggPeaks.sortBraggs(bp, wh[0], wh[1]);
		double n1 = BraggPeaks.computeDist(sorted[0], sorted[1]);
		if (!(n1 > 0)) {
			throw new ConfigurationException("First two Bragg peaks coincide, can not measure the lattice period");
		}
		double p1 = (a1 != null) ? a1 : (c1 * wh[0] / n1);
		double p2 = (a2 != null) ? a2 : p1;
		final int cells_x = (int) Math.floor(width / p1);
		final int cells_y = (int) Math.floor(height / p2);
		if ((cells_x < 1) || (cells_y < 1)) {
			throw new ConfigurationException("Image "+width+"x"+height+" is smaller than one lattice period ("+p1+", "+p2+")");
		}
		double l_new1 = p1 * cells_x;
		double l_new2 = p2 * cells_y;
		final double [] xs = new double [width];
		final double [] ys = new double [height];
		double dx = (width - l_new1) / 2;
		double dy = (height - l_new2) / 2;
		for (int i = 0; i < width; i++)  xs[i] = dx + i * l_new1 / width;
		for (int j = 0; j < height; j++) ys[j] = dy + j * l_new2 / height;
		final double [][][] resampled = new double [stack.length][][];
		MultiThreading.runIndexed(stack.length, threadsMax,
				nLayer -> resampled[nLayer] = new BSplineInterpolator(trimmed[nLayer], Interpolation.CUBIC).sampleGrid(xs, ys),
				monitor);
		LOGGER.info(String.format("Commensurate crop: period (%.3f, %.3f) pixels, %d x %d cells", p1, p2, cells_x, cells_y));
		return new Result(resampled, p1, p2, cells_x, cells_y);
	}

	static double [][] meanLayer(double [][][] stack) {
		if (stack.length == 1) {
			return stack[0];
		}
		int height = stack[0].length;
		int width = stack[0][0].length;
		double [][] mean = new double [height][width];
		for (double [][] layer : stack) {
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					mean[y][x] += layer[y][x] / stack.length;
				}
			}
		}
		return mean;
	}
}
