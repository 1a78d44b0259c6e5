/**
 **
 ** DriftField.java - per-pixel displacement field
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DriftField.java is free software: you can redistribute it and/or modify
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
import com.elphel.driftcorr.common.ShapeMismatchException;

/**
 * Displacement maps in pixels, [y][x]. The corrected image is corrected(r) = image(r - u(r)),
 * for either application method.
 */
public class DriftField {
	public final double [][] ux;
	public final double [][] uy;

	public DriftField(double [][] ux, double [][] uy) {
		ImageArrays.checkSameShape(ux, uy, "Drift field uy");
		this.ux = ux;
		this.uy = uy;
	}

	public static DriftField zero(int width, int height) {
		return new DriftField(new double [height][width], new double [height][width]);
	}

	public int getWidth() {
		return ux[0].length;
	}

	public int getHeight() {
		return ux.length;
	}

	/**
	 * @throws ShapeMismatchException if the field does not match the image
	 */
	public void checkShape(int width, int height) {
		if ((width != getWidth()) || (height != getHeight())) {
			throw new ShapeMismatchException("Drift field is "+getWidth()+"x"+getHeight()+
					", image layer is "+width+"x"+height);
		}
	}

	public DriftField copy() {
		return new DriftField(ImageArrays.copy(ux), ImageArrays.copy(uy));
	}

	public double maxMagnitude() {
		double m = 0;
		for (int y = 0; y < ux.length; y++) {
			for (int x = 0; x < ux[y].length; x++) {
				m = Math.max(m, Math.hypot(ux[y][x], uy[y][x]));
			}
		}
		return m;
	}
}
