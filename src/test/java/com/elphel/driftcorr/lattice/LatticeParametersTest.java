/**
 **
 ** LatticeParametersTest.java - tests of the lattice description
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  LatticeParametersTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.junit.Test;

import com.elphel.driftcorr.common.ConfigurationException;

public class LatticeParametersTest {
	private static final double [][] BP = {{48, 48}, {48, 80}, {80, 80}, {80, 48}};

	@Test
	public void derivedQuantities() {
		LatticeParameters lp = new LatticeParameters(0.5, new double [] {20.0}, new int [] {128}, null, null, false, true);
		assertArrayEquals(new double [] {20, 20}, lp.size, 0.0);
		assertArrayEquals(new int [] {128, 128}, lp.pixels);
		assertArrayEquals(new double [] {40, 40}, lp.qmag, 1e-12);
		assertArrayEquals(new double [] {1.6, 1.6}, lp.qscale, 1e-12);
	}

	@Test
	public void unknownLatticeConstantDisablesUseA0() {
		LatticeParameters lp = new LatticeParameters(null, new double [] {10, 12}, new int [] {100, 120}, null, null, false, true);
		assertEquals(1.0, lp.a0, 0.0);
		assertFalse(lp.use_a0);
	}

	@Test
	public void headerScanRange() {
		Map<String, Object> header = new HashMap<>();
		header.put(LatticeParameters.HEADER_SCAN_RANGE, "0 0 25.0 30.0");
		header.put(LatticeParameters.HEADER_SCAN_PIXELS, new int [] {256, 200});
		LatticeParameters lp = LatticeParameters.fromHeader(header, null, null, null, null, null, false, false);
		assertArrayEquals(new double [] {25, 30}, lp.size, 0.0);
		assertArrayEquals(new int [] {256, 200}, lp.pixels);
	}

	@Test
	public void headerGridSettings() {
		Map<String, Object> header = new HashMap<>();
		header.put(LatticeParameters.HEADER_GRID_SETTINGS, "1.0;2.0;0;40;40");
		header.put(LatticeParameters.HEADER_GRID_DIM, "64 x 64\"");
		LatticeParameters lp = LatticeParameters.fromHeader(header, null, null, null, null, null, false, false);
		assertArrayEquals(new double [] {40, 40}, lp.size, 0.0);
		assertArrayEquals(new int [] {64, 64}, lp.pixels);
	}

	@Test(expected = ConfigurationException.class)
	public void missingHeaderSize() {
		LatticeParameters.fromHeader(new HashMap<String, Object>(), null, null, new int [] {64}, null, null, false, false);
	}

	@Test
	public void updateScalesSizeWithCrop() {
		LatticeParameters lp = new LatticeParameters(null, new double [] {20.0}, new int [] {160}, null, null, false, false);
		lp.update(BP, 128, 128);
		assertArrayEquals(new double [] {16, 16}, lp.size, 1e-12);
		assertArrayEquals(new int [] {128, 128}, lp.pixels);
		assertArrayEquals(new double [] {-16, -16}, lp.qx, 0.0);
		assertArrayEquals(new double [] {-16, 16}, lp.qy, 0.0);
		assertArrayEquals(new double [] {128.0 / (128 - 96), 128.0 / (128 - 96)}, lp.qscale, 1e-12);
	}

	@Test
	public void updateFromLatticeConstant() {
		LatticeParameters lp = new LatticeParameters(0.4, new double [] {20.0}, new int [] {128}, null, null, false, true);
		lp.update(BP, 128, 128);
		// |f| = 16 * sqrt(2) / 128 cycles per pixel
		double expected = 0.4 * Math.sqrt(2) * 16;
		assertArrayEquals(new double [] {expected, expected}, lp.size, 1e-9);
		assertArrayEquals(new double [] {expected / 0.4, expected / 0.4}, lp.qmag, 1e-9);
	}

	@Test
	public void propertiesRoundTrip() {
		LatticeParameters lp = new LatticeParameters(0.4, new double [] {20, 22}, new int [] {128, 140}, Math.PI / 2, null, true, true);
		Properties p = new Properties();
		lp.setProperties("lattice.", p);
		LatticeParameters back = new LatticeParameters();
		back.getProperties("lattice.", p);
		assertEquals(0.4, back.a0, 0.0);
		assertArrayEquals(lp.size, back.size, 0.0);
		assertArrayEquals(lp.pixels, back.pixels);
		assertEquals(Math.PI / 2, back.angle, 0.0);
		assertNull(back.orient);
		assertEquals(true, back.even_out);
	}
}
