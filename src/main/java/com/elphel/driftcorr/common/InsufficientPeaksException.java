/**
 **
 ** InsufficientPeaksException.java - fewer Bragg peaks than a lattice needs
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  InsufficientPeaksException.java is free software: you can redistribute it and/or modify
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

/** Fewer than four Bragg peaks passed the detection thresholds. */
public class InsufficientPeaksException extends DriftCorrectionException {
	private static final long serialVersionUID = -2264830717465120942L;

	public InsufficientPeaksException(String message) {
		super(message);
	}

	public InsufficientPeaksException(String message, Throwable cause) {
		super(message, cause);
	}
}
