/**
 **
 ** DriftCorrectionSession.java - stateful drift correction of one dataset
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DriftCorrectionSession.java is free software: you can redistribute it and/or modify
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

import com.elphel.driftcorr.common.ConfigurationException;
import com.elphel.driftcorr.common.ImageArrays;
import com.elphel.driftcorr.common.ProgressMonitor;
import com.elphel.driftcorr.correction.DriftField;
import com.elphel.driftcorr.correction.PhaseMaps;
import com.elphel.driftcorr.lattice.BraggPeakDetector;
import com.elphel.driftcorr.lattice.BraggPeaks;
import com.elphel.driftcorr.lattice.LatticeParameters;

import ij.ImagePlus;

/**
 * Keeps the lattice parameters, peak history and drift field of one dataset between calls:
 * calibrate once on a reference image, then correct any number of co-registered images or
 * stacks. Not thread safe, use one session per dataset.
 */
public class DriftCorrectionSession {
	private static final Logger LOGGER = LoggerFactory.getLogger(DriftCorrectionSession.class);

	private final LatticeParameters         lattice;
	private final DriftCorrectionParameters parameters;
	private ProgressMonitor                 monitor =   null;
	private double [][]                     bp =        null; // peaks of the last output image
	private double [][]                     bp1 =       null;
	private double [][]                     bp_c =      null;
	private double [][]                     bp3 =       null;
	private PhaseMaps                       phases =    null;
	private DriftField                      drift =     null;
	private DriftParameterBundle            bundle =    null;

	/**
	 * @param lattice dataset description, copied. Its angle and orientation (when set) override
	 *        the ones in parameters
	 * @param parameters calibration settings, copied
	 */
	public DriftCorrectionSession(LatticeParameters lattice, DriftCorrectionParameters parameters) {
		this.lattice =    (lattice == null) ? new LatticeParameters() : lattice.clone();
		this.parameters = (parameters == null) ? new DriftCorrectionParameters() : parameters.clone();
		if (this.lattice.angle != null)  this.parameters.bp_angle = this.lattice.angle;
		if (this.lattice.orient != null) this.parameters.orient =   this.lattice.orient;
		if (this.lattice.even_out) {
			this.parameters.bpp = this.parameters.bpp.toBuilder().evenOut(true).build();
		}
	}

	public void setProgressMonitor(ProgressMonitor monitor) {
		this.monitor = monitor;
	}

	/**
	 * Detect the 4 Bragg peaks of an image and refresh the lattice parameters.
	 * @return sorted peaks
	 */
	public double [][] findBraggs(double [][] image) {
		int [] wh = ImageArrays.shape(image);
		bp = BraggPeaks.sortBraggs(new BraggPeakDetector(parameters.bpp).findBraggs(image), wh[0], wh[1]);
		lattice.update(bp, wh[0], wh[1]);
		return BraggPeaks.copy(bp);
	}

	/**
	 * Calibrate on a reference image, keep the results.
	 * @return corrected reference image
	 */
	public double [][] calibrate(double [][] image) {
		DriftCorrection.Calibration calibration = DriftCorrection.findDriftParameters(image, parameters);
		bundle = calibration.bundle;
		phases = calibration.phases;
		drift =  calibration.drift;
		bp1 =    bundle.getBp1();
		bp_c =   bundle.getBpIdeal();
		bp3 =    bundle.getBp3();
		lattice.angle =  bundle.getBpAngle();
		lattice.orient = bundle.getOrient();
		int [] wh = ImageArrays.shape(calibration.corrected);
		if (bp3 != null) {
			// bp3 belongs to the image before the final crop, peaks of the output are detected again
			bp = BraggPeaks.sortBraggs(
					new BraggPeakDetector(parameters.bpp).findBraggs(calibration.corrected), wh[0], wh[1]);
		} else {
			bp = bp_c;
		}
		lattice.update(bp, wh[0], wh[1]);
		LOGGER.info("Session calibrated, lattice size "+lattice.size[0]+" x "+lattice.size[1]+", pixels "+wh[0]+" x "+wh[1]);
		return calibration.corrected;
	}

	public double [][] correct(double [][] image) {
		return correct(new double [][][] {image})[0];
	}

	/**
	 * Replay the calibration on a stack of co-registered layers.
	 * @throws ConfigurationException if the session is not calibrated
	 */
	public double [][][] correct(double [][][] stack) {
		return DriftCorrection.applyDriftParameters(stack, getBundle(), parameters.threads_max, monitor);
	}

	/** Calibrate on the first slice of an ImageJ image. */
	public ImagePlus calibrate(ImagePlus imp) {
		double [][] corrected = calibrate(ImageArrays.fromImagePlus(imp)[0]);
		return ImageArrays.toImagePlus(new double [][][] {corrected}, imp.getTitle()+"-corrected", null);
	}

	/** Correct all slices of an ImageJ image, slice labels are kept. */
	public ImagePlus correct(ImagePlus imp) {
		double [][][] corrected = correct(ImageArrays.fromImagePlus(imp));
		String [] labels = new String [corrected.length];
		for (int i = 0; i < labels.length; i++) {
			labels[i] = imp.getStack().getSliceLabel(i + 1);
		}
		return ImageArrays.toImagePlus(corrected, imp.getTitle()+"-corrected", labels);
	}

	public DriftParameterBundle getBundle() {
		if (bundle == null) {
			throw new ConfigurationException("Drift correction session is not calibrated");
		}
		return bundle;
	}

	public boolean isCalibrated() {
		return bundle != null;
	}

	public LatticeParameters getLatticeParameters() {
		return lattice.clone();
	}

	public double [][] getBp()       {return BraggPeaks.copy(bp);}
	public double [][] getBp1()      {return BraggPeaks.copy(bp1);}
	public double [][] getBpIdeal()  {return BraggPeaks.copy(bp_c);}
	public double [][] getBp3()      {return BraggPeaks.copy(bp3);}
	public PhaseMaps   getPhases()   {return (phases == null) ? null : phases.copy();}
	public DriftField  getDriftField() {return (drift == null) ? null : drift.copy();}
}
