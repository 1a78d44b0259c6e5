/**
 **
 ** Interpolation.java - spline order of the resampling steps
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Interpolation.java is free software: you can redistribute it and/or modify
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

public enum Interpolation {
	LINEAR(1),
	CUBIC(3);

	private final int order;

	private Interpolation(int order) {
		this.order = order;
	}

	public int getOrder() {
		return order;
	}

	/** @throws UnsupportedMethodException for orders other than 1 and 3 */
	public static Interpolation fromOrder(int order) {
		for (Interpolation i : values()) {
			if (i.order == order) return i;
		}
		throw new UnsupportedMethodException("Unsupported interpolation order "+order+", only 1 (linear) and 3 (cubic) are available");
	}

	/** @param name "linear", "cubic" or the order as a number */
	public static Interpolation fromName(String name) {
		if (name != null) {
			String s = name.trim();
			for (Interpolation i : values()) {
				if (i.name().equalsIgnoreCase(s)) return i;
			}
			try {
				return fromOrder(Integer.parseInt(s));
			} catch (NumberFormatException e) {
				throw new UnsupportedMethodException("Unknown interpolation \""+name+"\"", e);
			}
		}
		throw new UnsupportedMethodException("Interpolation is not specified");
	}
}
