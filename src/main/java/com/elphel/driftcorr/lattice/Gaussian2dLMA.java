/**
 **
 ** Gaussian2dLMA.java - Levenberg-Marquardt fit of an axis-aligned 2D Gaussian
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Gaussian2dLMA.java is free software: you can redistribute it and/or modify
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import Jama.Matrix;

/**
 * Fits amp * exp(-((x-x0)^2/(2 sx^2) + (y-y0)^2/(2 sy^2))) + offset to a small window,
 * used to refine Bragg peak positions to sub-pixel accuracy.
 */
public class Gaussian2dLMA {
	private static final Logger LOGGER = LoggerFactory.getLogger(Gaussian2dLMA.class);

	public static final int PAR_AMP =    0;
	public static final int PAR_X0 =     1;
	public static final int PAR_Y0 =     2;
	public static final int PAR_SX =     3;
	public static final int PAR_SY =     4;
	public static final int PAR_OFFSET = 5;
	public static final int NUM_PARS =   6;

	private final double [][] data;   // [y][x]
	private final int         width;
	private final int         height;
	private double []         vector;
	private double []         last_ymfx = null;
	private double [][]       last_jt =   null;
	private double            last_rms =  Double.NaN;
	private double            initial_rms = Double.NaN;
	private int               iter = 0;

	/**
	 * @param data window to fit, [y][x]
	 */
	public Gaussian2dLMA(double [][] data) {
		this.data =   data;
		this.height = data.length;
		this.width =  data[0].length;
	}

	/**
	 * Initial parameters from the data: maximum position, peak-to-background amplitude, sigma 1.5 pixels.
	 */
	public double [] initialVector() {
		double mx = Double.NEGATIVE_INFINITY;
		double mn = Double.POSITIVE_INFINITY;
		int ix = width / 2, iy = height / 2;
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				if (data[y][x] > mx) {
					mx = data[y][x];
					ix = x;
					iy = y;
				}
				if (data[y][x] < mn) mn = data[y][x];
			}
		}
		return new double [] {mx - mn, ix, iy, 1.5, 1.5, mn};
	}

	public void setVector(double [] vector) {
		this.vector = vector.clone();
		this.last_ymfx = null;
	}

	public double [] getVector() {
		return vector.clone();
	}

	public double getRms() {
		return last_rms;
	}

	public int getIterations() {
		return iter;
	}

	/**
	 * @param vector parameters
	 * @param jt null or [NUM_PARS][num_samples] to receive the transposed Jacobian
	 * @return y - f(x) for each sample
	 */
	double [] getFxJt(double [] vector, double [][] jt) {
		double [] ymfx = new double [width * height];
		double isx2 = 1.0 / (vector[PAR_SX] * vector[PAR_SX]);
		double isy2 = 1.0 / (vector[PAR_SY] * vector[PAR_SY]);
		for (int y = 0; y < height; y++) {
			double dy = y - vector[PAR_Y0];
			for (int x = 0; x < width; x++) {
				double dx = x - vector[PAR_X0];
				double e = Math.exp(-0.5 * (dx * dx * isx2 + dy * dy * isy2));
				double g = vector[PAR_AMP] * e;
				int i = y * width + x;
				ymfx[i] = data[y][x] - (g + vector[PAR_OFFSET]);
				if (jt != null) {
					jt[PAR_AMP][i] =    e;
					jt[PAR_X0][i] =     g * dx * isx2;
					jt[PAR_Y0][i] =     g * dy * isy2;
					jt[PAR_SX][i] =     g * dx * dx * isx2 / vector[PAR_SX];
					jt[PAR_SY][i] =     g * dy * dy * isy2 / vector[PAR_SY];
					jt[PAR_OFFSET][i] = 1.0;
				}
			}
		}
		return ymfx;
	}

	static double getRms(double [] ymfx) {
		double s = 0;
		for (double d : ymfx) s += d * d;
		return Math.sqrt(s / ymfx.length);
	}

	double [][] getJtJlambda(double lambda, double [][] jt) {
		int num_pars = jt.length;
		double [][] jtj = new double [num_pars][num_pars];
		for (int i = 0; i < num_pars; i++) {
			for (int j = i; j < num_pars; j++) {
				double d = 0.0;
				for (int k = 0; k < jt[i].length; k++) {
					d += jt[i][k] * jt[j][k];
				}
				jtj[i][j] = d;
				if (i != j) {
					jtj[j][i] = d;
				}
			}
			jtj[i][i] += lambda * jtj[i][i];
		}
		return jtj;
	}

	public boolean runLma(
			double lambda,           // 0.1
			double lambda_scale_good,// 0.5
			double lambda_scale_bad, // 8.0
			double lambda_max,       // 100
			double rms_diff,         // 0.001
			int    num_iter)         // 20
	{
		if (vector == null) {
			setVector(initialVector());
		}
		boolean [] rslt = {false,false};
		for (iter = 0; iter < num_iter; iter++) {
			rslt = lmaStep(lambda, rms_diff);
			LOGGER.trace("LMA step "+iter+": {"+rslt[0]+","+rslt[1]+"} RMS="+last_rms+" ("+initial_rms+"), lambda="+lambda);
			if (rslt[1]) {
				break;
			}
			if (rslt[0]) { // good
				lambda *= lambda_scale_good;
			} else {
				lambda *= lambda_scale_bad;
				if (lambda > lambda_max) {
					break;
				}
			}
		}
		if (!rslt[0] && (last_rms < initial_rms)) {
			rslt[0] = true; // did not converge, but improved over initial
		}
		boolean sane = (vector[PAR_AMP] > 0) &&
				(vector[PAR_X0] >= 0) && (vector[PAR_X0] <= (width - 1)) &&
				(vector[PAR_Y0] >= 0) && (vector[PAR_Y0] <= (height - 1));
		LOGGER.debug("Gaussian fit: "+(rslt[0] ? "success" : "failed")+" after "+iter+" steps, RMS="+last_rms+
				" ("+initial_rms+"), x0="+vector[PAR_X0]+", y0="+vector[PAR_Y0]);
		return rslt[0] && sane;
	}

	// returns {success, done}
	public boolean [] lmaStep(
			double lambda,
			double rms_diff) {
		boolean [] rslt = {false,false};
		if (this.last_ymfx == null) {
			this.last_jt = new double [NUM_PARS][width * height];
			this.last_ymfx = getFxJt(this.vector, this.last_jt);
			this.last_rms = getRms(this.last_ymfx);
			this.initial_rms = this.last_rms;
		}
		Matrix y_minus_fx = new Matrix(this.last_ymfx, this.last_ymfx.length);
		Matrix jtjlambda = new Matrix(getJtJlambda(lambda, this.last_jt));
		Matrix jtjl_inv = null;
		try {
			jtjl_inv = jtjlambda.inverse();
		} catch (RuntimeException e) {
			LOGGER.debug("Singular matrix in Gaussian fit: "+e.getMessage());
			rslt[1] = true;
			return rslt;
		}
		Matrix jty = (new Matrix(this.last_jt)).times(y_minus_fx);
		double [] delta = jtjl_inv.times(jty).getColumnPackedCopy();
		double [] new_vector = this.vector.clone();
		for (int i = 0; i < NUM_PARS; i++) new_vector[i] += delta[i];
		double [][] new_jt = new double [NUM_PARS][width * height];
		double [] new_ymfx = getFxJt(new_vector, new_jt);
		double rms = getRms(new_ymfx);
		if (rms < this.last_rms) { // improved
			rslt[0] = true;
			rslt[1] = rms >= (this.last_rms * (1.0 - rms_diff));
			this.last_rms =  rms;
			this.vector =    new_vector;
			this.last_jt =   new_jt;
			this.last_ymfx = new_ymfx;
		}
		return rslt;
	}
}
