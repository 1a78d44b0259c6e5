/**
 **
 ** DriftCorrectionParameters.java - calibration settings of the drift correction pipeline
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DriftCorrectionParameters.java is free software: you can redistribute it and/or modify
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

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import com.elphel.driftcorr.common.ConfigurationException;
import com.elphel.driftcorr.common.EProperties;
import com.elphel.driftcorr.common.MultiThreading;
import com.elphel.driftcorr.correction.CorrectionMethod;
import com.elphel.driftcorr.correction.CropCommensurator;
import com.elphel.driftcorr.correction.GlobalShearCorrector;
import com.elphel.driftcorr.correction.Interpolation;
import com.elphel.driftcorr.correction.PhaseUnwrapper;
import com.elphel.driftcorr.lattice.BraggPeakParameters;

/**
 * Settings of one calibration run. Calibration works on a clone, so an instance may be
 * modified and reused between runs.
 */
public class DriftCorrectionParameters implements Cloneable {
	public static final String DEFAULTS_RESOURCE = "/driftcorr-defaults.properties";
	public static final String BP_PREFIX =         "bp_";

	public int []                    cut1 =             null;  // margins before calibration {n} or {left, right, down, up}
	public int []                    cut2 =             null;  // margins after correction, null - no final crop
	public CorrectionMethod          method =           CorrectionMethod.LOCKIN;
	public Interpolation             interpolation =    Interpolation.CUBIC;
	public double []                 sigma =            {10.0}; // {s} or {sx, sy}
	public Double                    bp_angle =         null;  // angle between neighbor peaks, null - detect
	public Double                    orient =           null;  // direction of the first ideal peak, null - detect
	public double [][]               bp_c =             null;  // explicit ideal peaks, null - generate
	public boolean                   shear_correct =    false; // global shear correction before the local one
	public double                    shear_angle =      GlobalShearCorrector.DEFAULT_ANGLE;
	public double                    shear_orient =     GlobalShearCorrector.DEFAULT_ORIENT;
	public double                    unwrap_thres =     PhaseUnwrapper.DEFAULT_THRES;
	public PhaseUnwrapper.Strategy   unwrap_strategy =  PhaseUnwrapper.Strategy.SWEEP;
	public PhaseUnwrapper.Traversal  unwrap_traversal = PhaseUnwrapper.Traversal.REVERSE;
	public boolean                   unwrap_clockwise = true;
	public double                    convolution_sign = 1.0;
	public boolean                   force_commen =     true;  // final crop resamples to whole periods
	public double                    c1 =               CropCommensurator.DEFAULT_C1;
	public int                       threads_max =      MultiThreading.THREADS_MAX;
	public int                       debug_level =      0;
	public BraggPeakParameters       bpp =              BraggPeakParameters.DEFAULT;

	/**
	 * Parameters initialized from the bundled defaults resource.
	 */
	public static DriftCorrectionParameters loadDefaults() {
		try (InputStream is = DriftCorrectionParameters.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (is == null) {
				throw new ConfigurationException("Missing resource "+DEFAULTS_RESOURCE);
			}
			return load(is);
		} catch (IOException e) {
			throw new ConfigurationException("Failed to read "+DEFAULTS_RESOURCE, e);
		}
	}

	/**
	 * @param is .properties stream, keys without prefix
	 * @throws IOException on read errors
	 */
	public static DriftCorrectionParameters load(InputStream is) throws IOException {
		Properties properties = new Properties();
		properties.load(is);
		DriftCorrectionParameters dcp = new DriftCorrectionParameters();
		dcp.getProperties("", properties);
		return dcp;
	}

	public void setProperties(String prefix, Properties properties) {
		if (cut1 != null) properties.setProperty(prefix+"cut1", EProperties.arr_to_str(this.cut1));
		if (cut2 != null) properties.setProperty(prefix+"cut2", EProperties.arr_to_str(this.cut2));
		properties.setProperty(prefix+"method",           this.method.getName());
		properties.setProperty(prefix+"interpolation",    this.interpolation.name().toLowerCase());
		properties.setProperty(prefix+"sigma",            EProperties.arr_to_str(this.sigma));
		if (bp_angle != null) properties.setProperty(prefix+"bp_angle", this.bp_angle+"");
		if (orient != null)   properties.setProperty(prefix+"orient",   this.orient+"");
		if (bp_c != null)     properties.setProperty(prefix+"bp_c",     EProperties.arr_to_str(this.bp_c));
		properties.setProperty(prefix+"shear_correct",    this.shear_correct+"");
		properties.setProperty(prefix+"shear_angle",      this.shear_angle+"");
		properties.setProperty(prefix+"shear_orient",     this.shear_orient+"");
		properties.setProperty(prefix+"unwrap_thres",     this.unwrap_thres+"");
		properties.setProperty(prefix+"unwrap_strategy",  this.unwrap_strategy.name());
		properties.setProperty(prefix+"unwrap_traversal", this.unwrap_traversal.name());
		properties.setProperty(prefix+"unwrap_clockwise", this.unwrap_clockwise+"");
		properties.setProperty(prefix+"convolution_sign", this.convolution_sign+"");
		properties.setProperty(prefix+"force_commen",     this.force_commen+"");
		properties.setProperty(prefix+"c1",               this.c1+"");
		properties.setProperty(prefix+"threads_max",      this.threads_max+"");
		properties.setProperty(prefix+"debug_level",      this.debug_level+"");
		bpp.setProperties(prefix+BP_PREFIX, properties);
	}

	/**
	 * Read values present in properties, keep the others.
	 * @throws ConfigurationException for malformed values
	 */
	public void getProperties(String prefix, Properties properties) {
		try {
			if (properties.getProperty(prefix+"cut1")!=null)             this.cut1=EProperties.str_to_iarr(properties.getProperty(prefix+"cut1"));
			if (properties.getProperty(prefix+"cut2")!=null)             this.cut2=EProperties.str_to_iarr(properties.getProperty(prefix+"cut2"));
			if (properties.getProperty(prefix+"method")!=null)           this.method=CorrectionMethod.fromName(properties.getProperty(prefix+"method"));
			if (properties.getProperty(prefix+"interpolation")!=null)    this.interpolation=Interpolation.fromName(properties.getProperty(prefix+"interpolation"));
			if (properties.getProperty(prefix+"sigma")!=null)            this.sigma=EProperties.str_to_darr(properties.getProperty(prefix+"sigma"));
			if (properties.getProperty(prefix+"bp_angle")!=null)         this.bp_angle=Double.parseDouble(properties.getProperty(prefix+"bp_angle"));
			if (properties.getProperty(prefix+"orient")!=null)           this.orient=Double.parseDouble(properties.getProperty(prefix+"orient"));
			if (properties.getProperty(prefix+"bp_c")!=null)             this.bp_c=EProperties.str_to_darr2(properties.getProperty(prefix+"bp_c"));
			if (properties.getProperty(prefix+"shear_correct")!=null)    this.shear_correct=Boolean.parseBoolean(properties.getProperty(prefix+"shear_correct"));
			if (properties.getProperty(prefix+"shear_angle")!=null)      this.shear_angle=Double.parseDouble(properties.getProperty(prefix+"shear_angle"));
			if (properties.getProperty(prefix+"shear_orient")!=null)     this.shear_orient=Double.parseDouble(properties.getProperty(prefix+"shear_orient"));
			if (properties.getProperty(prefix+"unwrap_thres")!=null)     this.unwrap_thres=Double.parseDouble(properties.getProperty(prefix+"unwrap_thres"));
			if (properties.getProperty(prefix+"unwrap_strategy")!=null)  this.unwrap_strategy=PhaseUnwrapper.Strategy.valueOf(properties.getProperty(prefix+"unwrap_strategy").trim().toUpperCase());
			if (properties.getProperty(prefix+"unwrap_traversal")!=null) this.unwrap_traversal=PhaseUnwrapper.Traversal.valueOf(properties.getProperty(prefix+"unwrap_traversal").trim().toUpperCase());
			if (properties.getProperty(prefix+"unwrap_clockwise")!=null) this.unwrap_clockwise=Boolean.parseBoolean(properties.getProperty(prefix+"unwrap_clockwise"));
			if (properties.getProperty(prefix+"convolution_sign")!=null) this.convolution_sign=Double.parseDouble(properties.getProperty(prefix+"convolution_sign"));
			if (properties.getProperty(prefix+"force_commen")!=null)     this.force_commen=Boolean.parseBoolean(properties.getProperty(prefix+"force_commen"));
			if (properties.getProperty(prefix+"c1")!=null)               this.c1=Double.parseDouble(properties.getProperty(prefix+"c1"));
			if (properties.getProperty(prefix+"threads_max")!=null)      this.threads_max=Integer.parseInt(properties.getProperty(prefix+"threads_max"));
			if (properties.getProperty(prefix+"debug_level")!=null)      this.debug_level=Integer.parseInt(properties.getProperty(prefix+"debug_level"));
		} catch (IllegalArgumentException e) { // includes NumberFormatException
			throw new ConfigurationException("Invalid drift correction parameter with prefix \""+prefix+"\": "+e.getMessage(), e);
		}
		this.bpp = this.bpp.getProperties(prefix+BP_PREFIX, properties);
	}

	public PhaseUnwrapper getUnwrapper() {
		return new PhaseUnwrapper(unwrap_thres, unwrap_strategy, unwrap_traversal, unwrap_clockwise);
	}

	@Override
	public DriftCorrectionParameters clone() {
		DriftCorrectionParameters dcp = new DriftCorrectionParameters();
		dcp.cut1 =             (this.cut1 == null) ? null : this.cut1.clone();
		dcp.cut2 =             (this.cut2 == null) ? null : this.cut2.clone();
		dcp.method =           this.method;
		dcp.interpolation =    this.interpolation;
		dcp.sigma =            this.sigma.clone();
		dcp.bp_angle =         this.bp_angle;
		dcp.orient =           this.orient;
		if (this.bp_c != null) {
			dcp.bp_c = new double [this.bp_c.length][];
			for (int i = 0; i < bp_c.length; i++) dcp.bp_c[i] = this.bp_c[i].clone();
		}
		dcp.shear_correct =    this.shear_correct;
		dcp.shear_angle =      this.shear_angle;
		dcp.shear_orient =     this.shear_orient;
		dcp.unwrap_thres =     this.unwrap_thres;
		dcp.unwrap_strategy =  this.unwrap_strategy;
		dcp.unwrap_traversal = this.unwrap_traversal;
		dcp.unwrap_clockwise = this.unwrap_clockwise;
		dcp.convolution_sign = this.convolution_sign;
		dcp.force_commen =     this.force_commen;
		dcp.c1 =               this.c1;
		dcp.threads_max =      this.threads_max;
		dcp.debug_level =      this.debug_level;
		dcp.bpp =              this.bpp; // immutable
		return dcp;
	}
}
