/**
 **
 ** PhaseMaps.java - local lattice phase maps and their frequency vectors
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PhaseMaps.java is free software: you can redistribute it and/or modify
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

/**
 * Phase maps along the two lattice directions. Direction 1 corresponds to sorted peak 0,
 * direction 2 to sorted peak 1. Frequencies are in radians per pixel.
 */
public class PhaseMaps {
	public final double [][] theta1;
	public final double [][] theta2;
	public final double []   q1;
	public final double []   q2;
	public final double [][] amplitude1; // convolution method only, null otherwise
	public final double [][] amplitude2;
	public final CorrectionMethod method;

	public PhaseMaps(
			double [][]      theta1,
			double [][]      theta2,
			double []        q1,
			double []        q2,
			double [][]      amplitude1,
			double [][]      amplitude2,
			CorrectionMethod method) {
		this.theta1 =     theta1;
		this.theta2 =     theta2;
		this.q1 =         q1;
		this.q2 =         q2;
		this.amplitude1 = amplitude1;
		this.amplitude2 = amplitude2;
		this.method =     method;
	}

	/** Deep copy. */
	public PhaseMaps copy() {
		return new PhaseMaps(
				ImageArrays.copy(theta1),
				ImageArrays.copy(theta2),
				q1.clone(),
				q2.clone(),
				(amplitude1 == null) ? null : ImageArrays.copy(amplitude1),
				(amplitude2 == null) ? null : ImageArrays.copy(amplitude2),
				method);
	}

	/** Same frequencies and amplitudes, new (unwrapped) phases. */
	public PhaseMaps withPhases(double [][] theta1, double [][] theta2) {
		return new PhaseMaps(theta1, theta2, q1, q2, amplitude1, amplitude2, method);
	}
}
