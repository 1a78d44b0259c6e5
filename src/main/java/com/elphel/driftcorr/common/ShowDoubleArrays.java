/**
 **
 ** ShowDoubleArrays.java - optional display of intermediate maps
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ShowDoubleArrays.java is free software: you can redistribute it and/or modify
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

import java.awt.GraphicsEnvironment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.ImagePlus;

/**
 * Shows intermediate maps as ImageJ stacks. Display is instrumentation only: any failure
 * is logged and the caller continues.
 */
public class ShowDoubleArrays {
	private static final Logger LOGGER = LoggerFactory.getLogger(ShowDoubleArrays.class);

	/**
	 * @param maps equal-size maps to show as stack slices
	 * @param title window title
	 * @param labels slice labels, may be null
	 * @return the shown (or, headless, just built) image, null if it could not be built
	 */
	public static ImagePlus showArrays(double [][][] maps, String title, String [] labels) {
		try {
			ImagePlus imp = ImageArrays.toImagePlus(maps, title, labels);
			if (GraphicsEnvironment.isHeadless()) {
				LOGGER.debug("Headless, not showing "+title);
			} else {
				imp.getProcessor().resetMinAndMax();
				imp.show();
			}
			return imp;
		} catch (RuntimeException e) {
			LOGGER.warn("Failed to show "+title+": "+e.getMessage());
			return null;
		}
	}

	public static ImagePlus showArrays(double [][] map, String title) {
		return showArrays(new double [][][] {map}, title, null);
	}
}
