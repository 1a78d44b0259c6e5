/**
 **
 ** CorrectionMethod.java - phase map / drift application method selector
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CorrectionMethod.java is free software: you can redistribute it and/or modify
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

import com.elphel.driftcorr.common.UnsupportedMethodException;

/**
 * The method selects phase map demodulation, the phase-to-drift inversion and the way the
 * drift field is applied.
 */
public enum CorrectionMethod {
	/** Spatial lock-in demodulation, 2x2 inversion, B-spline resampling. */
	LOCKIN("lockin"),
	/** Gaussian convolution demodulation, projection inversion, inverse Fourier reconstruction. */
	CONVOLUTION("convolution");

	private final String name;

	private CorrectionMethod(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	/**
	 * @param name "lockin" or "convolution", case insensitive
	 * @throws UnsupportedMethodException for other names
	 */
	public static CorrectionMethod fromName(String name) {
		if (name != null) {
			for (CorrectionMethod m : values()) {
				if (m.name.equalsIgnoreCase(name.trim()) || m.name().equalsIgnoreCase(name.trim())) {
					return m;
				}
			}
		}
		throw new UnsupportedMethodException("Unknown method \""+name+"\", only \"lockin\" and \"convolution\" are available");
	}

	@Override
	public String toString() {
		return name;
	}
}
