/**
 **
 ** BraggPeaks.java - Bragg peak set geometry: centering, ordering, ideal lattice
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  BraggPeaks.java is free software: you can redistribute it and/or modify
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
import java.util.Comparator;

import org.apache.commons.math3.util.FastMath;

import com.elphel.driftcorr.common.InsufficientPeaksException;

/**
 * Peak coordinates are {x, y} pixels of the shifted spectrum, so (width/2, height/2) is the
 * DC component. A lattice is described by 4 peaks, the two +/- pairs nearest the center,
 * sorted by {@link #sortBraggs(double[][], int, int)}: ascending atan2(qx, qy) of the offset
 * from the center. Peak 0 defines lattice direction 1, peak 1 lattice direction 2.
 */
public class BraggPeaks {
	public static final int NUM_PEAKS = 4;
	/** Peak separation angles found in real lattices, used to snap the measured one. */
	public static final double [] COMMON_ANGLES = {0, Math.PI/6, Math.PI/4, Math.PI/3, Math.PI/2};

	public static double [] center(int width, int height) {
		return new double [] {width / 2, height / 2};
	}

	/** Peak offsets from the center, {qx, qy} pixels. */
	public static double [][] toQ(double [][] bp, int width, int height) {
		double [] c = center(width, height);
		double [][] q = new double [bp.length][];
		for (int i = 0; i < bp.length; i++) {
			q[i] = new double [] {bp[i][0] - c[0], bp[i][1] - c[1]};
		}
		return q;
	}

	public static double [][] copy(double [][] bp) {
		if (bp == null) return null;
		double [][] c = new double [bp.length][];
		for (int i = 0; i < bp.length; i++) c[i] = bp[i].clone();
		return c;
	}

	/**
	 * Canonical order: ascending atan2(qx, qy), ties (equal angles) by distance from the
	 * center. Result does not depend on the input order, sorting sorted peaks is identity.
	 * @return sorted copy
	 */
	public static double [][] sortBraggs(double [][] bp, int width, int height) {
		final double [] c = center(width, height);
		double [][] sorted = copy(bp);
		Arrays.sort(sorted, new Comparator<double []>() {
			@Override
			public int compare(double [] p1, double [] p2) {
				int cmp = Double.compare(
						FastMath.atan2(p1[0] - c[0], p1[1] - c[1]),
						FastMath.atan2(p2[0] - c[0], p2[1] - c[1]));
				if (cmp != 0) return cmp;
				return Double.compare(
						computeDist(p1, c),
						computeDist(p2, c));
			}
		});
		return sorted;
	}

	/**
	 * Keep the num peaks nearest to the center.
	 * @param peaks all detected peaks
	 * @throws InsufficientPeaksException if fewer than num peaks are available
	 */
	public static double [][] selectNearest(double [][] peaks, int num, int width, int height) {
		if ((peaks == null) || (peaks.length < num)) {
			throw new InsufficientPeaksException("Found "+((peaks == null) ? 0 : peaks.length)+
					" Bragg peaks, need "+num+". Lower the threshold or the minimal distance.");
		}
		final double [] c = center(width, height);
		double [][] sorted = copy(peaks);
		Arrays.sort(sorted, Comparator.comparingDouble(p -> computeDist(p, c)));
		return Arrays.copyOf(sorted, num);
	}

	public static double computeDist(double [] p1, double [] p2) {
		return computeDist(p1, p2, null);
	}

	/**
	 * Euclidean distance.
	 * @param scale per-axis scale {sx, sy} for non-square pixels, null for 1
	 */
	public static double computeDist(double [] p1, double [] p2, double [] scale) {
		double dx = p1[0] - p2[0];
		double dy = p1[1] - p2[1];
		if (scale != null) {
			dx *= scale[0];
			dy *= scale[1];
		}
		return Math.sqrt(dx * dx + dy * dy);
	}

	/**
	 * Round each offset from the center to the nearest even integer, odd offsets that are
	 * exact integers move away from zero.
	 * @return new peak array
	 */
	public static double [][] evenOut(double [][] bp, int width, int height) {
		double [] c = center(width, height);
		double [][] even = new double [bp.length][2];
		for (int i = 0; i < bp.length; i++) {
			for (int k = 0; k < 2; k++) {
				double d = bp[i][k] - c[k];
				double r = Math.rint(d);
				if ((((long) r) & 1) != 0) {
					double dir = d - r;
					if (dir == 0) dir = r;
					r += Math.signum(dir);
				}
				even[i][k] = c[k] + r;
			}
		}
		return even;
	}

	/**
	 * Angle between neighbor peaks: mean of consecutive separations of sorted peaks, snapped
	 * to the nearest of {@link #COMMON_ANGLES}.
	 */
	public static double detectAngle(double [][] bp, int width, int height) {
		double [][] q = toQ(sortBraggs(bp, width, height), width, height);
		double s = 0;
		for (int i = 0; i < q.length - 1; i++) {
			s += FastMath.atan2(q[i + 1][0], q[i + 1][1]) - FastMath.atan2(q[i][0], q[i][1]);
		}
		double mean = s / (q.length - 1);
		double best = COMMON_ANGLES[0];
		for (double a : COMMON_ANGLES) {
			if (Math.abs(mean - a) < Math.abs(mean - best)) {
				best = a;
			}
		}
		return best;
	}

	/** Direction of the first sorted peak, atan2(qy, qx). */
	public static double detectOrient(double [][] bp, int width, int height) {
		double [][] q = toQ(sortBraggs(bp, width, height), width, height);
		return FastMath.atan2(q[0][1], q[0][0]);
	}

	/**
	 * Ideal symmetric peak set at the mean radius of the first two sorted peaks.
	 * @param bp detected peaks
	 * @param angle angle between neighbor peaks (2*pi/n)
	 * @param orient direction of the first peak, null to use the detected first peak
	 * @param even_out round offsets to even integers
	 * @return sorted ideal peaks, integer offsets from the center
	 */
	public static double [][] generateIdeal(
			double [][] bp,
			int         width,
			int         height,
			double      angle,
			Double      orient,
			boolean     even_out) {
		double [][] sorted = sortBraggs(bp, width, height);
		double [] c = center(width, height);
		if (orient == null) {
			orient = FastMath.atan2(sorted[0][1] - c[1], sorted[0][0] - c[0]);
		}
		double q_corr = (computeDist(sorted[0], c) + computeDist(sorted[1], c)) / 2;
		double [] qc1 = {
				Math.rint(q_corr * FastMath.cos(orient + Math.PI)),
				Math.rint(q_corr * FastMath.sin(orient + Math.PI))};
		double [] qc2 = {
				Math.rint(q_corr * FastMath.cos(orient + Math.PI - angle)),
				Math.rint(q_corr * FastMath.sin(orient + Math.PI - angle))};
		double [][] ideal = {
				{c[0] + qc1[0], c[1] + qc1[1]},
				{c[0] + qc2[0], c[1] + qc2[1]},
				{c[0] - qc1[0], c[1] - qc1[1]},
				{c[0] - qc2[0], c[1] - qc2[1]}};
		if (even_out) {
			ideal = evenOut(ideal, width, height);
		}
		return sortBraggs(ideal, width, height);
	}

	public static String toString(double [][] bp) {
		StringBuilder sb = new StringBuilder("[");
		for (int i = 0; i < bp.length; i++) {
			sb.append(String.format("(%.2f, %.2f)", bp[i][0], bp[i][1]));
			if (i < bp.length - 1) sb.append(", ");
		}
		return sb.append(']').toString();
	}
}
