/**
 **
 ** DriftCorrectionParametersTest.java - tests of the calibration settings
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DriftCorrectionParametersTest.java is free software: you can redistribute it and/or modify
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

package com.elphel.driftcorr.pipeline;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.junit.Test;

import com.elphel.driftcorr.common.ConfigurationException;
import com.elphel.driftcorr.common.UnsupportedMethodException;
import com.elphel.driftcorr.correction.CorrectionMethod;
import com.elphel.driftcorr.correction.Interpolation;
import com.elphel.driftcorr.correction.PhaseUnwrapper;

public class DriftCorrectionParametersTest {

	@Test
	public void bundledDefaults() {
		DriftCorrectionParameters dcp = DriftCorrectionParameters.loadDefaults();
		assertEquals(CorrectionMethod.LOCKIN, dcp.method);
		assertEquals(Interpolation.CUBIC, dcp.interpolation);
		assertArrayEquals(new double [] {10}, dcp.sigma, 0.0);
		assertEquals(PhaseUnwrapper.Strategy.SWEEP, dcp.unwrap_strategy);
		assertEquals(PhaseUnwrapper.Traversal.REVERSE, dcp.unwrap_traversal);
		assertEquals(1.0, dcp.convolution_sign, 0.0);
		assertEquals(5, dcp.bpp.getMinDist());
		assertEquals(0.25, dcp.bpp.getThres(), 0.0);
		assertNull(dcp.cut1);
		assertNull(dcp.bp_angle);
	}

	@Test
	public void propertiesRoundTrip() {
		DriftCorrectionParameters dcp = new DriftCorrectionParameters();
		dcp.cut1 = new int [] {1, 2, 3, 4};
		dcp.cut2 = new int [] {5};
		dcp.method = CorrectionMethod.CONVOLUTION;
		dcp.interpolation = Interpolation.LINEAR;
		dcp.sigma = new double [] {3, 4};
		dcp.bp_angle = Math.PI / 3;
		dcp.bp_c = new double [][] {{1, 2}, {3, 4}, {5, 6}, {7, 8}};
		dcp.unwrap_strategy = PhaseUnwrapper.Strategy.SPIRAL;
		dcp.unwrap_clockwise = false;
		dcp.bpp = dcp.bpp.toBuilder().minDist(7).r(0.02).mask3(new double [] {6, 0.1, 2}).build();
		Properties p = new Properties();
		dcp.setProperties("drift.", p);
		DriftCorrectionParameters back = new DriftCorrectionParameters();
		back.getProperties("drift.", p);
		assertArrayEquals(dcp.cut1, back.cut1);
		assertArrayEquals(dcp.cut2, back.cut2);
		assertEquals(CorrectionMethod.CONVOLUTION, back.method);
		assertEquals(Interpolation.LINEAR, back.interpolation);
		assertArrayEquals(dcp.sigma, back.sigma, 0.0);
		assertEquals(Math.PI / 3, back.bp_angle, 0.0);
		assertNull(back.orient);
		assertArrayEquals(dcp.bp_c[3], back.bp_c[3], 0.0);
		assertEquals(PhaseUnwrapper.Strategy.SPIRAL, back.unwrap_strategy);
		assertEquals(false, back.unwrap_clockwise);
		assertEquals(7, back.bpp.getMinDist());
		assertEquals(0.02, back.bpp.getR(), 0.0);
		assertArrayEquals(new double [] {6, 0.1, 2}, back.bpp.getMask3(), 0.0);
	}

	@Test
	public void partialStreamKeepsOtherValues() throws IOException {
		String s = "method=convolution\nsigma=3\nbp_precise=true\n";
		DriftCorrectionParameters dcp = DriftCorrectionParameters.load(new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8)));
		assertEquals(CorrectionMethod.CONVOLUTION, dcp.method);
		assertArrayEquals(new double [] {3}, dcp.sigma, 0.0);
		assertEquals(true, dcp.bpp.isPrecise());
		assertEquals(Interpolation.CUBIC, dcp.interpolation);
	}

	@Test
	public void cloneIsIndependent() {
		DriftCorrectionParameters dcp = new DriftCorrectionParameters();
		dcp.cut1 = new int [] {3};
		DriftCorrectionParameters c = dcp.clone();
		c.cut1[0] = 9;
		c.sigma[0] = 1;
		assertEquals(3, dcp.cut1[0]);
		assertEquals(10.0, dcp.sigma[0], 0.0);
	}

	@Test(expected = ConfigurationException.class)
	public void invalidStrategy() {
		Properties p = new Properties();
		p.setProperty("unwrap_strategy", "zigzag");
		new DriftCorrectionParameters().getProperties("", p);
	}

	@Test(expected = ConfigurationException.class)
	public void invalidNumber() {
		Properties p = new Properties();
		p.setProperty("c1", "two");
		new DriftCorrectionParameters().getProperties("", p);
	}

	@Test(expected = UnsupportedMethodException.class)
	public void unknownMethod() {
		Properties p = new Properties();
		p.setProperty("method", "wavelet");
		new DriftCorrectionParameters().getProperties("", p);
	}
}
