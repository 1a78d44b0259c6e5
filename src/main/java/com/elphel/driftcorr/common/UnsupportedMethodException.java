/**
 **
 ** UnsupportedMethodException.java - unknown correction method or interpolation order
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  UnsupportedMethodException.java is free software: you can redistribute it and/or modify
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

/** Unknown phase map / correction method name, or an unsupported interpolation order. */
public class UnsupportedMethodException extends DriftCorrectionException {
	private static final long serialVersionUID = 5537290166315046737L;

	public UnsupportedMethodException(String message) {
		super(message);
	}

	public UnsupportedMethodException(String message, Throwable cause) {
		super(message, cause);
	}
}
