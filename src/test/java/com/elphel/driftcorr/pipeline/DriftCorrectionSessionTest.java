/**
 **
 ** DriftCorrectionSessionTest.java - tests of the stateful drift correction session
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DriftCorrectionSessionTest.java is free software: you can redistribute it and/or modify
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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import com.elphel.driftcorr.SyntheticLattice;
import com.elphel.driftcorr.common.ConfigurationException;
import com.elphel.driftcorr.common.ImageArrays;
import com.elphel.driftcorr.common.ProgressMonitor;
import com.elphel.driftcorr.correction.CorrectionMethod;
import com.elphel.driftcorr.correction.Interpolation;
import com.elphel.driftcorr.lattice.LatticeParameters;

import ij.ImagePlus;

public class DriftCorrectionSessionTest {
	private static final int    N =   128;
	private static final double K =   16;
	private static final double EPS = 0.5;

	private static DriftCorrectionParameters parameters() {
		DriftCorrectionParameters dcp = new DriftCorrectionParameters();
		dcp.method = CorrectionMethod.LOCKIN;
		dcp.interpolation = Interpolation.CUBIC;
		dcp.sigma = new double [] {6};
		dcp.threads_max = 2;
		return dcp;
	}

	private static LatticeParameters lattice() {
		return new LatticeParameters(null, new double [] {20}, new int [] {N}, Math.PI / 2, null, false, false);
	}

	@Test(expected = ConfigurationException.class)
	public void bundleNeedsCalibration() {
		DriftCorrectionSession session = new DriftCorrectionSession(lattice(), parameters());
		assertFalse(session.isCalibrated());
		session.getBundle();
	}

	@Test(expected = ConfigurationException.class)
	public void correctNeedsCalibration() {
		new DriftCorrectionSession(lattice(), parameters()).correct(SyntheticLattice.square(N, K));
	}

	@Test
	public void findBraggsUpdatesLattice() {
		DriftCorrectionSession session = new DriftCorrectionSession(lattice(), parameters());
		double [][] bp = session.findBraggs(SyntheticLattice.square(N, K));
		assertEquals(4, bp.length);
		assertArrayEquals(new double [] {48, 48}, bp[0], 0.5);
		assertArrayEquals(new double [] {48, 80}, bp[1], 0.5);
		assertArrayEquals(new double [] {80, 80}, bp[2], 0.5);
		assertArrayEquals(new double [] {80, 48}, bp[3], 0.5);
		LatticeParameters lp = session.getLatticeParameters();
		assertArrayEquals(new double [] {-16, -16}, lp.qx, 0.5);
		assertArrayEquals(new double [] {-16, 16}, lp.qy, 0.5);
	}

	@Test
	public void calibrateKeepsResults() {
		DriftCorrectionSession session = new DriftCorrectionSession(lattice(), parameters());
		double [][] image = SyntheticLattice.distorted(N, K, EPS);
		double [][] corrected = session.calibrate(image);
		assertTrue(session.isCalibrated());
		assertEquals(Math.PI / 2, session.getBundle().getBpAngle(), 1e-12);
		assertNotNull(session.getPhases());
		assertNotNull(session.getDriftField());
		assertNotNull(session.getBp1());
		assertArrayEquals(new double [] {48, 48}, session.getBpIdeal()[0], 0.0);
		assertArrayEquals(session.getBpIdeal()[2], session.getBp()[2], 0.0);
		assertTrue(SyntheticLattice.rms(corrected, SyntheticLattice.square(N, K), 8) < 0.04);

		LatticeParameters lp = session.getLatticeParameters();
		assertArrayEquals(new int [] {N, N}, lp.pixels);
		assertArrayEquals(new double [] {20, 20}, lp.size, 1e-12);
		assertArrayEquals(new double [] {-16, -16}, lp.qx, 0.0);
		assertEquals(Math.PI / 2, lp.angle, 1e-12);
		assertNotNull(lp.orient);

		// replay on the reference gives the calibration result
		double [][] replay = session.correct(image);
		for (int y = 0; y < N; y++) {
			assertArrayEquals(corrected[y], replay[y], 0.0);
		}
	}

	@Test
	public void constructorCopiesArguments() {
		LatticeParameters lp = lattice();
		DriftCorrectionParameters dcp = parameters();
		DriftCorrectionSession session = new DriftCorrectionSession(lp, dcp);
		session.calibrate(SyntheticLattice.distorted(N, K, EPS));
		assertNull(lp.qx);
		assertNull(dcp.orient);
		assertArrayEquals(new int [] {N, N}, lp.pixels);
	}

	@Test
	public void stackMatchesReplayAndReportsProgress() {
		DriftCorrectionSession session = new DriftCorrectionSession(lattice(), parameters());
		session.calibrate(SyntheticLattice.distorted(N, K, EPS));
		final AtomicInteger calls = new AtomicInteger();
		session.setProgressMonitor(new ProgressMonitor() {
			@Override
			public void progress(int done, int total) {
				calls.incrementAndGet();
			}
		});
		double [][] layer = SyntheticLattice.distorted(N, K, EPS);
		double [][][] stack = new double [3][N][N];
		for (int n = 0; n < stack.length; n++) {
			for (int y = 0; y < N; y++) {
				for (int x = 0; x < N; x++) {
					stack[n][y][x] = (n + 1) * layer[y][x];
				}
			}
		}
		double [][][] corrected = session.correct(stack);
		double [][][] expected = DriftCorrection.applyDriftParameters(stack, session.getBundle(), 1, null);
		assertEquals(3, corrected.length);
		for (int n = 0; n < stack.length; n++) {
			for (int y = 0; y < N; y++) {
				assertArrayEquals(expected[n][y], corrected[n][y], 0.0);
			}
		}
		assertTrue(calls.get() > 0);
	}

	@Test
	public void imagePlusKeepsLabels() {
		DriftCorrectionSession session = new DriftCorrectionSession(lattice(), parameters());
		double [][] layer = SyntheticLattice.distorted(N, K, EPS);
		ImagePlus reference = ImageArrays.toImagePlus(new double [][][] {layer}, "scan", null);
		ImagePlus calibrated = session.calibrate(reference);
		assertEquals("scan-corrected", calibrated.getTitle());
		assertEquals(N, calibrated.getWidth());

		ImagePlus imp = ImageArrays.toImagePlus(new double [][][] {layer, layer}, "forward", new String [] {"z", "current"});
		ImagePlus corrected = session.correct(imp);
		assertEquals(2, corrected.getStackSize());
		assertEquals("z", corrected.getStack().getSliceLabel(1));
		assertEquals("current", corrected.getStack().getSliceLabel(2));
		assertEquals("forward-corrected", corrected.getTitle());
	}

	@Test
	public void finalCropRefreshesLattice() {
		DriftCorrectionParameters dcp = parameters();
		dcp.cut2 = new int [] {6};
		DriftCorrectionSession session = new DriftCorrectionSession(lattice(), dcp);
		double [][] corrected = session.calibrate(SyntheticLattice.distorted(N, K, EPS));
		// 116 pixels hold 14 whole periods of 8 source pixels
		assertEquals(116, corrected.length);
		assertEquals(116, corrected[0].length);
		assertArrayEquals(new double [] {48, 48}, session.getBp3()[0], 0.5);

		double [][] bp = session.getBp();
		assertArrayEquals(new double [] {44, 44}, bp[0], 0.5);
		assertArrayEquals(new double [] {72, 72}, bp[2], 0.5);
		LatticeParameters lp = session.getLatticeParameters();
		assertArrayEquals(new int [] {116, 116}, lp.pixels);
		assertArrayEquals(new double [] {bp[0][0] - 58, bp[0][1] - 58}, lp.qx, 0.0);
		assertArrayEquals(new double [] {-14, -14}, lp.qx, 0.5);
		assertArrayEquals(new double [] {-14, 14}, lp.qy, 0.5);
		assertArrayEquals(new double [] {20.0 * 116 / N, 20.0 * 116 / N}, lp.size, 1e-12);
	}

	@Test
	public void phasesAreCopied() {
		DriftCorrectionSession session = new DriftCorrectionSession(lattice(), parameters());
		session.calibrate(SyntheticLattice.distorted(N, K, EPS));
		double kept = session.getPhases().theta1[10][10];
		session.getPhases().theta1[10][10] = kept + 100;
		session.getPhases().q1[0] = 100;
		assertEquals(kept, session.getPhases().theta1[10][10], 0.0);
		assertTrue(session.getPhases().q1[0] != 100);
	}
}
