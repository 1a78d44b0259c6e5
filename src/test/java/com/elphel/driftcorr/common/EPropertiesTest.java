/**
 **
 ** EPropertiesTest.java - tests of the properties array helpers
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  EPropertiesTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Properties;

import org.junit.Test;

public class EPropertiesTest {

	@Test
	public void matrixStringFormat() {
		double [][] m = {{1.0, 0.5, -2.0}, {0.0, 1.25, 3.0}};
		String s = EProperties.arr_to_str(m);
		assertEquals("1.0 0.5 -2.0;0.0 1.25 3.0", s);
		double [][] back = EProperties.str_to_darr2(s);
		assertArrayEquals(m[0], back[0], 0.0);
		assertArrayEquals(m[1], back[1], 0.0);
	}

	@Test
	public void commaOrSpaceSeparated() {
		assertArrayEquals(new double [] {10, 12.5}, EProperties.str_to_darr("10, 12.5"), 0.0);
		assertArrayEquals(new int [] {4, 4, 0, 8}, EProperties.str_to_iarr(" 4 4 0 8 "));
		assertNull(EProperties.str_to_darr("  "));
	}

	@Test
	public void typedGetters() {
		EProperties p = new EProperties();
		p.setProperty("n", "7");
		p.setProperty("on", "true");
		p.setProperty("s", "3 4");
		assertEquals(7, p.getProperty("n", 0));
		assertEquals(true, p.getProperty("on", false));
		assertEquals(1.5, p.getProperty("missing", 1.5), 0.0);
		assertArrayEquals(new double [] {3, 4}, p.getProperty("s", (double []) null), 0.0);
	}

	@Test(expected = ConfigurationException.class)
	public void invalidNumbersAreReported() {
		Properties p = new Properties();
		p.setProperty("sigma", "ten");
		EProperties.getDoubles(p, "sigma", null);
	}
}
