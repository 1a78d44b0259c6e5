/**
 **
 ** Gaussian2dLMATest.java - tests of the 2D Gaussian fit
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Gaussian2dLMATest.java is free software: you can redistribute it and/or modify
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

package com.elphel.driftcorr.lattice;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.elphel.driftcorr.common.FourierTools;

public class Gaussian2dLMATest {

	@Test
	public void fitRecoversParameters() {
		double [][] data = FourierTools.gaussian2d(21, 17, 9.37, 8.21, 2.2, 1.7, 4.0);
		for (double [] row : data) {
			for (int x = 0; x < row.length; x++) row[x] += 0.5;
		}
		Gaussian2dLMA lma = new Gaussian2dLMA(data);
		assertTrue(lma.runLma(0.1, 0.5, 8.0, 100, 1e-6, 50));
		double [] v = lma.getVector();
		assertEquals(4.0,  v[Gaussian2dLMA.PAR_AMP],    1e-3);
		assertEquals(9.37, v[Gaussian2dLMA.PAR_X0],     1e-3);
		assertEquals(8.21, v[Gaussian2dLMA.PAR_Y0],     1e-3);
		assertEquals(2.2,  Math.abs(v[Gaussian2dLMA.PAR_SX]), 1e-3);
		assertEquals(1.7,  Math.abs(v[Gaussian2dLMA.PAR_SY]), 1e-3);
		assertEquals(0.5,  v[Gaussian2dLMA.PAR_OFFSET], 1e-3);
	}

	@Test
	public void initialVectorStartsAtMaximum() {
		double [][] data = FourierTools.gaussian2d(11, 11, 3, 7, 1.0, 1.0, 2.0);
		double [] v = new Gaussian2dLMA(data).initialVector();
		assertEquals(3.0, v[Gaussian2dLMA.PAR_X0], 0.0);
		assertEquals(7.0, v[Gaussian2dLMA.PAR_Y0], 0.0);
	}
}
