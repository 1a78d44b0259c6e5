/**
 **
 ** GlobalShearCorrector.java - affine (shear) correction from Bragg peak geometry
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  GlobalShearCorrector.java is free software: you can redistribute it and/or modify
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

import com.elphel.driftcorr.common.DegenerateGeometryException;
import com.elphel.driftcorr.common.ImageArrays;
import com.elphel.driftcorr.common.MultiThreading;
import com.elphel.driftcorr.common.ProgressMonitor;
import com.elphel.driftcorr.lattice.BraggPeaks;

import Jama.Matrix;

/**
 * Removes the linear part of the scan distortion. The affine matrix (2x3, spectrum pixel
 * coordinates) maps the spectrum center and the first two sorted peaks onto the ideal
 * symmetric peaks. A spectrum is warped with the matrix directly, a real space image with
 * the corresponding real space map of the linear part about the image center.
 */
public class GlobalShearCorrector {
	private static final Logger LOGGER = LoggerFactory.getLogger(GlobalShearCorrector.class);

	public static final double DEFAULT_ANGLE =  Math.PI / 2;
	public static final double DEFAULT_ORIENT = Math.PI / 4;

	public static class Result {
		public final double [][] matrix; // 2x3 affine in spectrum pixels
		public final double [][] image;
		public Result(double [][] matrix, double [][] image) {
			this.matrix = matrix;
			this.image =  image;
		}
	}

	/**
	 * Affine transform exactly mapping 3 points onto 3 points.
	 * @param pts1 source {x, y} x 3
	 * @param pts2 destination {x, y} x 3
	 * @return 2x3 matrix, dst = M * {x, y, 1}
	 * @throws DegenerateGeometryException for collinear source points
	 */
	public static double [][] getAffine(double [][] pts1, double [][] pts2) {
		double area2 =
				(pts1[1][0] - pts1[0][0]) * (pts1[2][1] - pts1[0][1]) -
				(pts1[2][0] - pts1[0][0]) * (pts1[1][1] - pts1[0][1]);
		if (Math.abs(area2) < 1e-9) {
			throw new DegenerateGeometryException("Shear correction points are collinear");
		}
		double [][] a = new double [6][6];
		double [] b = new double [6];
		for (int i = 0; i < 3; i++) {
			a[2 * i][0] =     pts1[i][0];
			a[2 * i][1] =     pts1[i][1];
			a[2 * i][2] =     1.0;
			a[2 * i + 1][3] = pts1[i][0];
			a[2 * i + 1][4] = pts1[i][1];
			a[2 * i + 1][5] = 1.0;
			b[2 * i] =        pts2[i][0];
			b[2 * i + 1] =    pts2[i][1];
		}
		double [] m;
		try {
			m = new Matrix(a).solve(new Matrix(b, 6)).getColumnPackedCopy();
		} catch (RuntimeException e) {
			throw new DegenerateGeometryException("Singular shear correction system", e);
		}
		return new double [][] {{m[0], m[1], m[2]}, {m[3], m[4], m[5]}};
	}

	/**
	 * Matrix mapping detected peak geometry onto the ideal one.
	 * @param bp detected peaks (any order)
	 * @param angle target angle between neighbor peaks
	 * @param orient target orientation of the first ideal peak
	 */
	public static double [][] getMatrix(double [][] bp, int width, int height, double angle, double orient) {
		double [][] sorted = BraggPeaks.sortBraggs(bp, width, height);
		double [][] ideal = BraggPeaks.generateIdeal(sorted, width, height, angle, orient, false);
		double [] c = BraggPeaks.center(width, height);
		double [][] pts1 = {c, sorted[0], sorted[1]};
		double [][] pts2 = {c, ideal[0],  ideal[1]};
		return getAffine(pts1, pts2);
	}

	/**
	 * Detect-independent entry: compute the matrix from peaks and apply it.
	 * @param rspace true for a real space image, false for a spectrum
	 */
	public static Result correct(
			double [][] image,
			double [][] bp,
			double      angle,
			double      orient,
			boolean     rspace) {
		int [] wh = ImageArrays.shape(image);
		double [][] matrix = getMatrix(bp, wh[0], wh[1], angle, orient);
		LOGGER.info(String.format("Shear matrix: [[%.5f, %.5f, %.3f], [%.5f, %.5f, %.3f]]",
				matrix[0][0], matrix[0][1], matrix[0][2], matrix[1][0], matrix[1][1], matrix[1][2]));
		return new Result(matrix, apply(image, matrix, rspace));
	}

	/** Correction with explicit 3-point correspondences. */
	public static Result correct(double [][] image, double [][] pts1, double [][] pts2, boolean rspace) {
		double [][] matrix = getAffine(pts1, pts2);
		return new Result(matrix, apply(image, matrix, rspace));
	}

	/**
	 * Real space inverse map of the spectrum linear part L: output(r) = input(c + Lq^T (r - c)),
	 * Lq = D L D^-1, D = diag(2*pi/width, 2*pi/height).
	 * @return 2x2 matrix
	 */
	public static double [][] realSpaceInverseMap(double [][] matrix, int width, int height) {
		double [] d = {2 * Math.PI / width, 2 * Math.PI / height};
		double [][] lq = new double [2][2];
		for (int i = 0; i < 2; i++) {
			for (int j = 0; j < 2; j++) {
				lq[i][j] = d[i] * matrix[i][j] / d[j];
			}
		}
		return new double [][] {{lq[0][0], lq[1][0]}, {lq[0][1], lq[1][1]}};
	}

	/**
	 * Apply a previously computed matrix (cubic interpolation, zero outside the source).
	 */
	public static double [][] apply(double [][] image, double [][] matrix, boolean rspace) {
		int [] wh = ImageArrays.shape(image);
		int width = wh[0];
		int height = wh[1];
		double [][] xs = new double [height][width];
		double [][] ys = new double [height][width];
		if (rspace) {
			double [][] inv = realSpaceInverseMap(matrix, width, height);
			double [] c = BraggPeaks.center(width, height);
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					xs[y][x] = c[0] + inv[0][0] * (x - c[0]) + inv[0][1] * (y - c[1]);
					ys[y][x] = c[1] + inv[1][0] * (x - c[0]) + inv[1][1] * (y - c[1]);
				}
			}
			double offset = ImageArrays.min(image);
			double [][] shifted = new double [height][width];
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					shifted[y][x] = image[y][x] - offset;
				}
			}
			double [][] warped = new BSplineInterpolator(shifted, Interpolation.CUBIC).sample(xs, ys, true);
			for (double [] row : warped) {
				for (int x = 0; x < width; x++) {
					row[x] += offset;
				}
			}
			return warped;
		}
		double [][] m3 = {matrix[0], matrix[1], {0, 0, 1}};
		double [][] inv;
		try {
			inv = new Matrix(m3).inverse().getArray();
		} catch (RuntimeException e) {
			throw new DegenerateGeometryException("Shear matrix is singular", e);
		}
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				xs[y][x] = inv[0][0] * x + inv[0][1] * y + inv[0][2];
				ys[y][x] = inv[1][0] * x + inv[1][1] * y + inv[1][2];
			}
		}
		return new BSplineInterpolator(image, Interpolation.CUBIC).sample(xs, ys, true);
	}

	/**
	 * Apply the same matrix to each layer of a stack.
	 */
	public static double [][][] apply(
			final double [][][]   stack,
			final double [][]     matrix,
			final boolean         rspace,
			final int             threadsMax,
			final ProgressMonitor monitor) {
		ImageArrays.shape(stack);
		final double [][][] result = new double [stack.length][][];
		MultiThreading.runIndexed(stack.length, threadsMax,
				nLayer -> result[nLayer] = apply(stack[nLayer], matrix, rspace), monitor);
		return result;
	}
}
