/**
 **
 ** DriftFieldCalculator.java - conversion of unwrapped phase maps to displacements
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DriftFieldCalculator.java is free software: you can redistribute it and/or modify
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
import com.elphel.driftcorr.common.UnsupportedMethodException;

/**
 * Turns the two phase maps into a displacement field. Both methods return the same
 * convention (see {@link DriftField}): for image(r) = lattice(r + v(r)) the field is u = v.
 */
public class DriftFieldCalculator {
	private static final Logger LOGGER = LoggerFactory.getLogger(DriftFieldCalculator.class);
	public static final double MIN_DETERMINANT = 1e-12;

	private final double convolution_sign;

	public DriftFieldCalculator() {
		this(1.0);
	}

	/**
	 * @param convolution_sign multiplier of the convolution method projection, +1 matches
	 *        the lock-in convention
	 */
	public DriftFieldCalculator(double convolution_sign) {
		this.convolution_sign = convolution_sign;
	}

	public DriftField driftMap(PhaseMaps phases) {
		return driftMap(phases.theta1, phases.theta2, phases.q1, phases.q2, phases.method);
	}

	public DriftField driftMap(
			double [][]      theta1,
			double [][]      theta2,
			double []        q1,
			double []        q2,
			CorrectionMethod method) {
		ImageArrays.checkSameShape(theta1, theta2, "Second phase map");
		if (method == null) {
			throw new UnsupportedMethodException("Drift map method is not specified");
		}
		int height = theta1.length;
		int width = theta1[0].length;
		double [][] ux = new double [height][width];
		double [][] uy = new double [height][width];
		switch (method) {
		case LOCKIN: {
			double det = q1[0] * q2[1] - q1[1] * q2[0];
			if (Math.abs(det) < MIN_DETERMINANT) {
				throw new DegenerateGeometryException("Lattice frequencies are collinear or zero, det="+det);
			}
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					double tx = theta1[y][x];
					double ty = theta2[y][x];
					ux[y][x] = -(q2[1] * tx - q1[1] * ty) / det;
					uy[y][x] = -(q2[0] * tx - q1[0] * ty) / (-det);
				}
			}
			break;
		}
		case CONVOLUTION: {
			double q1_mag = Math.hypot(q1[0], q1[1]);
			double q2_mag = Math.hypot(q2[0], q2[1]);
			if ((q1_mag < MIN_DETERMINANT) || (q2_mag < MIN_DETERMINANT)) {
				throw new DegenerateGeometryException("Zero lattice frequency: |Q1|="+q1_mag+", |Q2|="+q2_mag);
			}
			double a1 = Math.atan2(q1[1], q1[0]);
			double a2 = Math.atan2(q2[1], q2[0]);
			double c1 = Math.cos(a1), s1 = Math.sin(a1);
			double c2 = Math.cos(a2 - Math.PI / 2), s2 = Math.sin(a2 - Math.PI / 2);
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					double d1 = theta1[y][x] / q1_mag;
					double d2 = theta2[y][x] / q2_mag;
					ux[y][x] = convolution_sign * (d1 * c1 - d2 * s2);
					uy[y][x] = convolution_sign * (d1 * s1 + d2 * c2);
				}
			}
			break;
		}
		default:
			throw new UnsupportedMethodException("Unsupported drift map method "+method);
		}
		DriftField field = new DriftField(ux, uy);
		LOGGER.debug("Drift field ("+method+"): max |u|="+field.maxMagnitude()+" pixels");
		return field;
	}
}
