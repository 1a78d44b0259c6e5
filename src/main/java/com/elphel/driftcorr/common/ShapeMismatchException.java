/**
 **
 ** ShapeMismatchException.java - drift field does not match the image
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ShapeMismatchException.java is free software: you can redistribute it and/or modify
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

/** Drift field (or a stack layer) does not have the shape of the image it is applied to. */
public class ShapeMismatchException extends DriftCorrectionException {
	private static final long serialVersionUID = 1093485610048812396L;

	public ShapeMismatchException(String message) {
		super(message);
	}

	public ShapeMismatchException(String message, Throwable cause) {
		super(message, cause);
	}
}
