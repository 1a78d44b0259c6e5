/**
 **
 ** DegenerateGeometryException.java - singular peak geometry
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DegenerateGeometryException.java is free software: you can redistribute it and/or modify
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
 * Peak geometry can not be inverted: zero length frequency vectors, collinear
 * correspondence points or a singular frequency matrix.
 */
public class DegenerateGeometryException extends DriftCorrectionException {
	private static final long serialVersionUID = -6178035120474408863L;

	public DegenerateGeometryException(String message) {
		super(message);
	}

	public DegenerateGeometryException(String message, Throwable cause) {
		super(message, cause);
	}
}
