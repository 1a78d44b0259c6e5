/**
 **
 ** DriftCorrection.java - calibration and replay of lattice drift correction
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DriftCorrection.java is free software: you can redistribute it and/or modify
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.driftcorr.common.ImageArrays;
import com.elphel.driftcorr.common.ProgressMonitor;
import com.elphel.driftcorr.common.ShowDoubleArrays;
import com.elphel.driftcorr.correction.CorrectionMethod;
import com.elphel.driftcorr.correction.CropCommensurator;
import com.elphel.driftcorr.correction.DriftCorrectionApplier;
import com.elphel.driftcorr.correction.DriftField;
import com.elphel.driftcorr.correction.DriftFieldCalculator;
import com.elphel.driftcorr.correction.GlobalShearCorrector;
import com.elphel.driftcorr.correction.Interpolation;
import com.elphel.driftcorr.correction.PhaseMapEngine;
import com.elphel.driftcorr.correction.PhaseMaps;
import com.elphel.driftcorr.correction.PhaseUnwrapper;
import com.elphel.driftcorr.lattice.BraggPeakDetector;
import com.elphel.driftcorr.lattice.BraggPeakParameters;
import com.elphel.driftcorr.lattice.BraggPeaks;

/**
 * Stateless entry points. {@link #findDriftParameters(double[][], DriftCorrectionParameters)}
 * measures the drift of a reference image and records it in a {@link DriftParameterBundle},
 * {@link #applyDriftParameters(double[][][], DriftParameterBundle, int, ProgressMonitor)}
 * repeats exactly the recorded steps on co-registered data without detecting anything.
 */
public class DriftCorrection {
	private static final Logger LOGGER = LoggerFactory.getLogger(DriftCorrection.class);

	public static class Calibration {
		public final double [][]          corrected;
		public final DriftParameterBundle bundle;
		public final PhaseMaps            phases;   // unwrapped
		public final DriftField           drift;
		Calibration(double [][] corrected, DriftParameterBundle bundle, PhaseMaps phases, DriftField drift) {
			this.corrected = corrected;
			this.bundle =    bundle;
			this.phases =    phases;
			this.drift =     drift;
		}
	}

	public static class GlobalCorrection {
		public final double [][] image;  // shear corrected
		public final double [][] matrix; // spectrum affine, 2x3
		public final double [][] bp0;    // peaks before correction
		public final double [][] bp1;    // sorted peaks after correction
		GlobalCorrection(double [][] image, double [][] matrix, double [][] bp0, double [][] bp1) {
			this.image =  image;
			this.matrix = matrix;
			this.bp0 =    bp0;
			this.bp1 =    bp1;
		}
	}

	/**
	 * Calibrate on a 2D reference image: crop, detect, (shear), build ideal peaks, measure
	 * phases and drift, correct, and optionally crop to whole lattice periods.
	 * @param image reference image [y][x], not modified
	 * @param parameters settings, copied
	 * @return corrected image and the replayable bundle
	 */
	public static Calibration findDriftParameters(double [][] image, DriftCorrectionParameters parameters) {
		DriftCorrectionParameters dcp = parameters.clone();
		ImageArrays.shape(image);
		double [][] img = (dcp.cut1 != null) ? CropCommensurator.trim(image, dcp.cut1) : ImageArrays.copy(image);
		int width = img[0].length;
		int height = img.length;
		BraggPeakDetector detector = new BraggPeakDetector(dcp.bpp);

		double [][] matrix = null;
		double [][] bp1;
		if (dcp.shear_correct) {
			GlobalCorrection gc = globalCorrection(img, dcp.bpp, dcp.shear_angle, dcp.shear_orient);
			img =    gc.image;
			matrix = gc.matrix;
			bp1 =    gc.bp1;
		} else {
			bp1 = BraggPeaks.sortBraggs(detector.findBraggs(img), width, height);
		}
		double angle =  (dcp.bp_angle != null) ? dcp.bp_angle : BraggPeaks.detectAngle(bp1, width, height);
		double orient = (dcp.orient != null)   ? dcp.orient   : BraggPeaks.detectOrient(bp1, width, height);
		double [][] bp_c = (dcp.bp_c != null) ?
				BraggPeaks.sortBraggs(dcp.bp_c, width, height) :
				BraggPeaks.generateIdeal(bp1, width, height, angle, orient, dcp.bpp.isEvenOut());
		LOGGER.info("Lattice angle "+Math.toDegrees(angle)+" deg, orientation "+Math.toDegrees(orient)+
				" deg, ideal peaks "+BraggPeaks.toString(bp_c));

		PhaseMaps phases = unwrappedPhases(img, bp_c, dcp.sigma, dcp.method, dcp.getUnwrapper());
		DriftField drift = new DriftFieldCalculator(dcp.convolution_sign).driftMap(phases);
		double [][] corrected = new DriftCorrectionApplier(dcp.method, dcp.interpolation, dcp.threads_max).apply(img, drift);
		if (dcp.debug_level > 1) {
			ShowDoubleArrays.showArrays(
					new double [][][] {img, phases.theta1, phases.theta2, drift.ux, drift.uy, corrected},
					"drift-calibration",
					new String [] {"source", "phix", "phiy", "ux", "uy", "corrected"});
		}

		double [][] bp3 = null;
		if (dcp.cut2 != null) {
			bp3 = BraggPeaks.sortBraggs(detector.findBraggs(corrected), width, height);
			CropCommensurator.Result crop = new CropCommensurator(dcp.c1, null, null, dcp.threads_max).crop(
					new double [][][] {corrected}, dcp.cut2, bp3, dcp.force_commen, detector, null);
			corrected = crop.getImage();
		}
		DriftParameterBundle bundle = new DriftParameterBundle.Builder()
				.cut1(dcp.cut1)
				.cut2(dcp.cut2)
				.braggPeakParameters(dcp.bpp)
				.method(dcp.method)
				.interpolation(dcp.interpolation)
				.sigma(dcp.sigma)
				.bp1(bp1)
				.bpIdeal(bp_c)
				.bp3(bp3)
				.bpAngle(angle)
				.orient(orient)
				.shearMatrix(matrix)
				.phases(phases.theta1, phases.theta2, phases.q1, phases.q2)
				.driftField(drift)
				.forceCommen(dcp.force_commen)
				.c1(dcp.c1)
				.build();
		LOGGER.info("Drift calibration done: "+image[0].length+"x"+image.length+" -> "+corrected[0].length+"x"+corrected.length+
				", max drift "+String.format("%.3f", drift.maxMagnitude())+" pixels");
		return new Calibration(corrected, bundle, phases, drift);
	}

	/**
	 * Detect peaks, remove the global shear and detect again on the corrected image.
	 */
	public static GlobalCorrection globalCorrection(
			double [][]         image,
			BraggPeakParameters bpp,
			double              angle,
			double              orient) {
		int width = image[0].length;
		int height = image.length;
		BraggPeakDetector detector = new BraggPeakDetector(bpp);
		double [][] bp0 = detector.findBraggs(image);
		GlobalShearCorrector.Result shear = GlobalShearCorrector.correct(image, bp0, angle, orient, true);
		double [][] bp1 = BraggPeaks.sortBraggs(detector.findBraggs(shear.image), width, height);
		return new GlobalCorrection(shear.image, shear.matrix, bp0, bp1);
	}

	/**
	 * Phase maps against the given (ideal) peaks, both unwrapped.
	 */
	public static PhaseMaps unwrappedPhases(
			double [][]      image,
			double [][]      bp,
			double []        sigma,
			CorrectionMethod method,
			PhaseUnwrapper   unwrapper) {
		PhaseMaps raw = PhaseMapEngine.phaseMap(image, bp, sigma, method);
		return raw.withPhases(unwrapper.unwrap(raw.theta1), unwrapper.unwrap(raw.theta2));
	}

	/**
	 * Local (non-linear) correction of one image against given peaks.
	 */
	public static double [][] localCorrection(
			double [][]      image,
			double [][]      bp,
			double []        sigma,
			CorrectionMethod method,
			Interpolation    interpolation,
			int              threadsMax) {
		PhaseMaps phases = unwrappedPhases(image, bp, sigma, method, new PhaseUnwrapper());
		DriftField drift = new DriftFieldCalculator().driftMap(phases);
		return new DriftCorrectionApplier(method, interpolation, threadsMax).apply(image, drift);
	}

	/**
	 * Replay a calibration on one image.
	 */
	public static double [][] applyDriftParameters(double [][] image, DriftParameterBundle bundle) {
		return applyDriftParameters(new double [][][] {image}, bundle, 1, null)[0];
	}

	/**
	 * Replay a calibration on each layer of a stack: crop, shear with the recorded matrix,
	 * apply the recorded drift field, final crop with the recorded peaks.
	 * @throws com.elphel.driftcorr.common.ShapeMismatchException if the cropped layers do not
	 *         match the recorded drift field
	 * @throws java.util.concurrent.CancellationException if canceled by the monitor
	 */
	public static double [][][] applyDriftParameters(
			double [][][]        stack,
			DriftParameterBundle bundle,
			int                  threadsMax,
			ProgressMonitor      monitor) {
		ImageArrays.shape(stack);
		double [][][] layers = new double [stack.length][][];
		for (int i = 0; i < stack.length; i++) {
			layers[i] = (bundle.getCut1() != null) ? CropCommensurator.trim(stack[i], bundle.getCut1()) : stack[i];
		}
		DriftField drift = bundle.getDriftField();
		drift.checkShape(layers[0][0].length, layers[0].length);
		double [][] matrix = bundle.getShearMatrix();
		if (matrix != null) {
			layers = GlobalShearCorrector.apply(layers, matrix, true, threadsMax, monitor);
		}
		layers = new DriftCorrectionApplier(bundle.getMethod(), bundle.getInterpolation(), threadsMax).apply(layers, drift, monitor);
		if (bundle.getCut2() != null) {
			CropCommensurator.Result crop = new CropCommensurator(bundle.getC1(), null, null, threadsMax).crop(
					layers, bundle.getCut2(), bundle.getBp3(), bundle.isForceCommen(),
					new BraggPeakDetector(bundle.getBraggPeakParameters()), monitor);
			layers = crop.layers;
		}
		LOGGER.info("Replayed drift correction on "+stack.length+" layers, result "+layers[0][0].length+"x"+layers[0].length);
		return layers;
	}
}
