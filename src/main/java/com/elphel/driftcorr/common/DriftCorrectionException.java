/**
 **
 ** DriftCorrectionException.java - base of the drift correction runtime failures
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DriftCorrectionException.java is free software: you can redistribute it and/or modify
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

/**
 * Root of all failures raised by the drift correction pipeline. Unchecked, calibration and
 * replay calls either return a complete result or throw one of the subclasses.
 */
public class DriftCorrectionException extends RuntimeException {
	private static final long serialVersionUID = 3418850231735920981L;

	public DriftCorrectionException(String message) {
		super(message);
	}

	public DriftCorrectionException(String message, Throwable cause) {
		super(message, cause);
	}
}
