/**
 **
 ** PhaseUnwrapper.java - removal of 2*pi phase slips from phase maps
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PhaseUnwrapper.java is free software: you can redistribute it and/or modify
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

import com.elphel.driftcorr.common.ConfigurationException;
import com.elphel.driftcorr.common.ImageArrays;

/**
 * Removes 2*pi discontinuities. A step between neighbor samples larger than thres*2*pi is
 * replaced by the nearest step modulo 2*pi, the correction carried to all following
 * samples. The result may differ from the true phase by a constant 2*pi*k.
 */
public class PhaseUnwrapper {
	public static final double DEFAULT_THRES = 0.25;

	public enum Strategy {
		/** Every row, then every column, then alignment through the center row and column. */
		SWEEP,
		/** One 1D pass along a spiral from the outer ring inward. */
		SPIRAL
	}

	public enum Traversal {
		/** Walk from (0, 0). */
		FORWARD,
		/** Walk from the opposite corner (image flipped in both axes). */
		REVERSE
	}

	private final double    thres;
	private final Strategy  strategy;
	private final Traversal traversal;
	private final boolean   clockwise;

	public PhaseUnwrapper() {
		this(DEFAULT_THRES, Strategy.SWEEP, Traversal.REVERSE, true);
	}

	/**
	 * @param thres slip detection threshold, fraction of 2*pi
	 * @param strategy unwrap path
	 * @param traversal walk direction
	 * @param clockwise spiral direction (display orientation, y down), SPIRAL only
	 */
	public PhaseUnwrapper(double thres, Strategy strategy, Traversal traversal, boolean clockwise) {
		if (!(thres > 0) || (thres >= 1)) {
			throw new ConfigurationException("Phase slip threshold should be in (0, 1), got "+thres);
		}
		this.thres =     thres;
		this.strategy =  (strategy == null) ? Strategy.SWEEP : strategy;
		this.traversal = (traversal == null) ? Traversal.REVERSE : traversal;
		this.clockwise = clockwise;
	}

	public double [][] unwrap(double [][] phase) {
		ImageArrays.shape(phase);
		double tol = thres * 2 * Math.PI;
		double [][] p = (traversal == Traversal.REVERSE) ? flip(phase) : ImageArrays.copy(phase);
		if (strategy == Strategy.SPIRAL) {
			spiral(p, tol, clockwise);
		} else {
			sweep(p, tol);
		}
		return (traversal == Traversal.REVERSE) ? flip(p) : p;
	}

	/**
	 * Unwrap a sequence in place.
	 * @param p samples
	 * @param tol step threshold, radians
	 */
	public static void unwrap1d(double [] p, double tol) {
		double correction = 0.0;
		double prev = (p.length > 0) ? p[0] : 0.0;
		for (int k = 1; k < p.length; k++) {
			double d = p[k] - prev;
			prev = p[k];
			if (Math.abs(d) > tol) {
				correction -= 2 * Math.PI * Math.rint(d / (2 * Math.PI));
			}
			p[k] += correction;
		}
	}

	static void sweep(double [][] p, double tol) {
		int height = p.length;
		int width = p[0].length;
		for (int y = 0; y < height; y++) {
			unwrap1d(p[y], tol);
		}
		double [] column = new double [height];
		for (int x = 0; x < width; x++) {
			for (int y = 0; y < height; y++) column[y] = p[y][x];
			unwrap1d(column, tol);
			for (int y = 0; y < height; y++) p[y][x] = column[y];
		}
		// rows: steps along the center column
		int cx = width / 2;
		double correction = 0.0;
		for (int y = 1; y < height; y++) {
			double d = p[y][cx] - (p[y - 1][cx] - correction);
			if (Math.abs(d) > tol) {
				correction -= 2 * Math.PI * Math.rint(d / (2 * Math.PI));
			}
			if (correction != 0.0) {
				for (int x = 0; x < width; x++) p[y][x] += correction;
			}
		}
		// columns: steps along the center row
		int cy = height / 2;
		correction = 0.0;
		for (int x = 1; x < width; x++) {
			double d = p[cy][x] - (p[cy][x - 1] - correction);
			if (Math.abs(d) > tol) {
				correction -= 2 * Math.PI * Math.rint(d / (2 * Math.PI));
			}
			if (correction != 0.0) {
				for (int y = 0; y < height; y++) p[y][x] += correction;
			}
		}
	}

	static void spiral(double [][] p, double tol, boolean clockwise) {
		int [][] path = spiralPath(p[0].length, p.length, clockwise);
		double [] seq = new double [path.length];
		for (int i = 0; i < path.length; i++) seq[i] = p[path[i][1]][path[i][0]];
		unwrap1d(seq, tol);
		for (int i = 0; i < path.length; i++) p[path[i][1]][path[i][0]] = seq[i];
	}

	/**
	 * Visit order of all pixels along a spiral starting at (0, 0).
	 * @return {x, y} for each pixel
	 */
	static int [][] spiralPath(int width, int height, boolean clockwise) {
		int [][] path = new int [width * height][];
		int left = 0, right = width - 1, top = 0, bottom = height - 1;
		int n = 0;
		while ((left <= right) && (top <= bottom)) {
			if (clockwise) {
				for (int x = left; x <= right; x++)                            path[n++] = new int [] {x, top};
				for (int y = top + 1; y <= bottom; y++)                        path[n++] = new int [] {right, y};
				if (top < bottom)  for (int x = right - 1; x >= left; x--)     path[n++] = new int [] {x, bottom};
				if (left < right)  for (int y = bottom - 1; y > top; y--)      path[n++] = new int [] {left, y};
			} else {
				for (int y = top; y <= bottom; y++)                            path[n++] = new int [] {left, y};
				for (int x = left + 1; x <= right; x++)                        path[n++] = new int [] {x, bottom};
				if (left < right)  for (int y = bottom - 1; y >= top; y--)     path[n++] = new int [] {right, y};
				if (top < bottom)  for (int x = right - 1; x > left; x--)      path[n++] = new int [] {x, top};
			}
			left++;
			right--;
			top++;
			bottom--;
		}
		return path;
	}

	static double [][] flip(double [][] a) {
		int height = a.length;
		int width = a[0].length;
		double [][] f = new double [height][width];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				f[height - 1 - y][width - 1 - x] = a[y][x];
			}
		}
		return f;
	}
}
