/**
 **
 ** DriftParameterBundle.java - immutable record of a calibration for replay
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DriftParameterBundle.java is free software: you can redistribute it and/or modify
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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

import com.elphel.driftcorr.common.ConfigurationException;
import com.elphel.driftcorr.common.EProperties;
import com.elphel.driftcorr.correction.CorrectionMethod;
import com.elphel.driftcorr.correction.DriftField;
import com.elphel.driftcorr.correction.Interpolation;
import com.elphel.driftcorr.lattice.BraggPeakParameters;

/**
 * Everything needed to repeat a calibrated correction on another dataset acquired on the same
 * grid: crops, detection settings, method, peaks, optional shear matrix, unwrapped phases and
 * the drift field. Arrays are copied in and out, instances never change.
 */
public final class DriftParameterBundle {
	static final String KEY_CUT1 =          "cut1";
	static final String KEY_CUT2 =          "cut2";
	static final String KEY_METHOD =        "method";
	static final String KEY_INTERPOLATION = "interpolation";
	static final String KEY_SIGMA =         "sigma";
	static final String KEY_BP1 =           "bp1";
	static final String KEY_BP_C =          "bp_c";
	static final String KEY_BP3 =           "bp3";
	static final String KEY_BP_ANGLE =      "bp_angle";
	static final String KEY_ORIENT =        "orient";
	static final String KEY_SHEAR =         "shear_matrix";
	static final String KEY_PHIX =          "phix";
	static final String KEY_PHIY =          "phiy";
	static final String KEY_Q1 =            "q1";
	static final String KEY_Q2 =            "q2";
	static final String KEY_UX =            "ux";
	static final String KEY_UY =            "uy";
	static final String KEY_FORCE_COMMEN =  "force_commen";
	static final String KEY_C1 =            "c1";
	static final String KEY_BP_PARAMETERS = "bp_parameters";

	private final int []              cut1;
	private final int []              cut2;
	private final BraggPeakParameters bpp;
	private final CorrectionMethod    method;
	private final Interpolation       interpolation;
	private final double []           sigma;
	private final double [][]         bp1;
	private final double [][]         bp_c;
	private final double [][]         bp3;
	private final double              bp_angle;
	private final double              orient;
	private final double [][]         shear_matrix;
	private final double [][]         phix;
	private final double [][]         phiy;
	private final double []           q1;
	private final double []           q2;
	private final double [][]         ux;
	private final double [][]         uy;
	private final boolean             force_commen;
	private final double              c1;

	private DriftParameterBundle(Builder b) {
		if ((b.method == null) || (b.interpolation == null) || (b.ux == null) || (b.uy == null) || (b.bp_c == null)) {
			throw new ConfigurationException("Incomplete drift parameters: method, interpolation, ideal peaks and drift field are required");
		}
		if ((b.cut2 != null) && b.force_commen && (b.bp3 == null)) {
			throw new ConfigurationException("Commensurate final crop needs the recorded post-correction peaks bp3");
		}
		this.cut1 =          copy(b.cut1);
		this.cut2 =          copy(b.cut2);
		this.bpp =           (b.bpp == null) ? BraggPeakParameters.DEFAULT : b.bpp;
		this.method =        b.method;
		this.interpolation = b.interpolation;
		this.sigma =         copy(b.sigma);
		this.bp1 =           copy(b.bp1);
		this.bp_c =          copy(b.bp_c);
		this.bp3 =           copy(b.bp3);
		this.bp_angle =      b.bp_angle;
		this.orient =        b.orient;
		this.shear_matrix =  copy(b.shear_matrix);
		this.phix =          copy(b.phix);
		this.phiy =          copy(b.phiy);
		this.q1 =            copy(b.q1);
		this.q2 =            copy(b.q2);
		this.ux =            copy(b.ux);
		this.uy =            copy(b.uy);
		this.force_commen =  b.force_commen;
		this.c1 =            b.c1;
	}

	public int []              getCut1()          {return copy(cut1);}
	public int []              getCut2()          {return copy(cut2);}
	public BraggPeakParameters getBraggPeakParameters() {return bpp;}
	public CorrectionMethod    getMethod()        {return method;}
	public Interpolation       getInterpolation() {return interpolation;}
	public double []           getSigma()         {return copy(sigma);}
	public double [][]         getBp1()           {return copy(bp1);}
	public double [][]         getBpIdeal()       {return copy(bp_c);}
	public double [][]         getBp3()           {return copy(bp3);}
	public double              getBpAngle()       {return bp_angle;}
	public double              getOrient()        {return orient;}
	public double [][]         getShearMatrix()   {return copy(shear_matrix);}
	public double [][]         getPhix()          {return copy(phix);}
	public double [][]         getPhiy()          {return copy(phiy);}
	public double []           getQ1()            {return copy(q1);}
	public double []           getQ2()            {return copy(q2);}
	public boolean             isForceCommen()    {return force_commen;}
	public double              getC1()            {return c1;}

	/** @return a fresh copy of the recorded drift field */
	public DriftField getDriftField() {
		return new DriftField(copy(ux), copy(uy));
	}

	public int getWidth() {
		return ux[0].length;
	}

	public int getHeight() {
		return ux.length;
	}

	public Builder toBuilder() {
		Builder b = new Builder();
		b.cut1 = cut1; b.cut2 = cut2; b.bpp = bpp; b.method = method; b.interpolation = interpolation;
		b.sigma = sigma; b.bp1 = bp1; b.bp_c = bp_c; b.bp3 = bp3; b.bp_angle = bp_angle; b.orient = orient;
		b.shear_matrix = shear_matrix; b.phix = phix; b.phiy = phiy; b.q1 = q1; b.q2 = q2;
		b.ux = ux; b.uy = uy; b.force_commen = force_commen; b.c1 = c1;
		return b; // build() copies all arrays
	}

	/**
	 * Plain nested map: numbers, arrays, strings and a nested map of detection settings.
	 * Arrays are copies.
	 */
	public Map<String, Object> toMap() {
		Map<String, Object> map = new LinkedHashMap<>();
		putIfNotNull(map, KEY_CUT1,  copy(cut1));
		putIfNotNull(map, KEY_CUT2,  copy(cut2));
		map.put(KEY_METHOD,          method.getName());
		map.put(KEY_INTERPOLATION,   interpolation.name().toLowerCase());
		putIfNotNull(map, KEY_SIGMA, copy(sigma));
		putIfNotNull(map, KEY_BP1,   copy(bp1));
		map.put(KEY_BP_C,            copy(bp_c));
		putIfNotNull(map, KEY_BP3,   copy(bp3));
		map.put(KEY_BP_ANGLE,        bp_angle);
		map.put(KEY_ORIENT,          orient);
		putIfNotNull(map, KEY_SHEAR, copy(shear_matrix));
		putIfNotNull(map, KEY_PHIX,  copy(phix));
		putIfNotNull(map, KEY_PHIY,  copy(phiy));
		putIfNotNull(map, KEY_Q1,    copy(q1));
		putIfNotNull(map, KEY_Q2,    copy(q2));
		map.put(KEY_UX,              copy(ux));
		map.put(KEY_UY,              copy(uy));
		map.put(KEY_FORCE_COMMEN,    force_commen);
		map.put(KEY_C1,              c1);
		Properties bp_properties = new Properties();
		bpp.setProperties("", bp_properties);
		Map<String, Object> bp_map = new LinkedHashMap<>();
		for (String key : bp_properties.stringPropertyNames()) {
			bp_map.put(key, bp_properties.getProperty(key));
		}
		map.put(KEY_BP_PARAMETERS, bp_map);
		return map;
	}

	/**
	 * Inverse of {@link #toMap()}.
	 * @throws ConfigurationException for missing required entries or wrong value types
	 */
	public static DriftParameterBundle fromMap(Map<String, ?> map) {
		Builder b = new Builder();
		try {
			b.cut1 =          (int []) map.get(KEY_CUT1);
			b.cut2 =          (int []) map.get(KEY_CUT2);
			b.method =        CorrectionMethod.fromName((String) map.get(KEY_METHOD));
			b.interpolation = Interpolation.fromName((String) map.get(KEY_INTERPOLATION));
			b.sigma =         (double []) map.get(KEY_SIGMA);
			b.bp1 =           (double [][]) map.get(KEY_BP1);
			b.bp_c =          (double [][]) map.get(KEY_BP_C);
			b.bp3 =           (double [][]) map.get(KEY_BP3);
			b.bp_angle =      number(map, KEY_BP_ANGLE, Double.NaN);
			b.orient =        number(map, KEY_ORIENT, Double.NaN);
			b.shear_matrix =  (double [][]) map.get(KEY_SHEAR);
			b.phix =          (double [][]) map.get(KEY_PHIX);
			b.phiy =          (double [][]) map.get(KEY_PHIY);
			b.q1 =            (double []) map.get(KEY_Q1);
			b.q2 =            (double []) map.get(KEY_Q2);
			b.ux =            (double [][]) map.get(KEY_UX);
			b.uy =            (double [][]) map.get(KEY_UY);
			b.force_commen =  (map.get(KEY_FORCE_COMMEN) == null) || Boolean.TRUE.equals(map.get(KEY_FORCE_COMMEN));
			b.c1 =            number(map, KEY_C1, 2.0);
			Object bp_map = map.get(KEY_BP_PARAMETERS);
			if (bp_map instanceof Map) {
				Properties bp_properties = new Properties();
				for (Map.Entry<?, ?> e : ((Map<?, ?>) bp_map).entrySet()) {
					bp_properties.setProperty(e.getKey().toString(), e.getValue().toString());
				}
				b.bpp = BraggPeakParameters.DEFAULT.getProperties("", bp_properties);
			}
		} catch (ClassCastException e) {
			throw new ConfigurationException("Wrong value type in drift parameters map: "+e.getMessage(), e);
		}
		return b.build();
	}

	public void setProperties(String prefix, Properties properties) {
		if (cut1 != null)         properties.setProperty(prefix+KEY_CUT1,  EProperties.arr_to_str(cut1));
		if (cut2 != null)         properties.setProperty(prefix+KEY_CUT2,  EProperties.arr_to_str(cut2));
		properties.setProperty(prefix+KEY_METHOD,                          method.getName());
		properties.setProperty(prefix+KEY_INTERPOLATION,                   interpolation.name().toLowerCase());
		if (sigma != null)        properties.setProperty(prefix+KEY_SIGMA, EProperties.arr_to_str(sigma));
		if (bp1 != null)          properties.setProperty(prefix+KEY_BP1,   EProperties.arr_to_str(bp1));
		properties.setProperty(prefix+KEY_BP_C,                            EProperties.arr_to_str(bp_c));
		if (bp3 != null)          properties.setProperty(prefix+KEY_BP3,   EProperties.arr_to_str(bp3));
		properties.setProperty(prefix+KEY_BP_ANGLE,                        bp_angle+"");
		properties.setProperty(prefix+KEY_ORIENT,                          orient+"");
		if (shear_matrix != null) properties.setProperty(prefix+KEY_SHEAR, EProperties.arr_to_str(shear_matrix));
		if (phix != null)         properties.setProperty(prefix+KEY_PHIX,  EProperties.arr_to_str(phix));
		if (phiy != null)         properties.setProperty(prefix+KEY_PHIY,  EProperties.arr_to_str(phiy));
		if (q1 != null)           properties.setProperty(prefix+KEY_Q1,    EProperties.arr_to_str(q1));
		if (q2 != null)           properties.setProperty(prefix+KEY_Q2,    EProperties.arr_to_str(q2));
		properties.setProperty(prefix+KEY_UX,                              EProperties.arr_to_str(ux));
		properties.setProperty(prefix+KEY_UY,                              EProperties.arr_to_str(uy));
		properties.setProperty(prefix+KEY_FORCE_COMMEN,                    force_commen+"");
		properties.setProperty(prefix+KEY_C1,                              c1+"");
		bpp.setProperties(prefix+DriftCorrectionParameters.BP_PREFIX, properties);
	}

	/**
	 * @throws ConfigurationException for missing or malformed entries
	 */
	public static DriftParameterBundle getProperties(String prefix, Properties properties) {
		Builder b = new Builder();
		try {
			if (properties.getProperty(prefix+KEY_CUT1)!=null)          b.cut1=EProperties.str_to_iarr(properties.getProperty(prefix+KEY_CUT1));
			if (properties.getProperty(prefix+KEY_CUT2)!=null)          b.cut2=EProperties.str_to_iarr(properties.getProperty(prefix+KEY_CUT2));
			if (properties.getProperty(prefix+KEY_METHOD)!=null)        b.method=CorrectionMethod.fromName(properties.getProperty(prefix+KEY_METHOD));
			if (properties.getProperty(prefix+KEY_INTERPOLATION)!=null) b.interpolation=Interpolation.fromName(properties.getProperty(prefix+KEY_INTERPOLATION));
			if (properties.getProperty(prefix+KEY_SIGMA)!=null)         b.sigma=EProperties.str_to_darr(properties.getProperty(prefix+KEY_SIGMA));
			if (properties.getProperty(prefix+KEY_BP1)!=null)           b.bp1=EProperties.str_to_darr2(properties.getProperty(prefix+KEY_BP1));
			if (properties.getProperty(prefix+KEY_BP_C)!=null)          b.bp_c=EProperties.str_to_darr2(properties.getProperty(prefix+KEY_BP_C));
			if (properties.getProperty(prefix+KEY_BP3)!=null)           b.bp3=EProperties.str_to_darr2(properties.getProperty(prefix+KEY_BP3));
			if (properties.getProperty(prefix+KEY_BP_ANGLE)!=null)      b.bp_angle=Double.parseDouble(properties.getProperty(prefix+KEY_BP_ANGLE));
			if (properties.getProperty(prefix+KEY_ORIENT)!=null)        b.orient=Double.parseDouble(properties.getProperty(prefix+KEY_ORIENT));
			if (properties.getProperty(prefix+KEY_SHEAR)!=null)         b.shear_matrix=EProperties.str_to_darr2(properties.getProperty(prefix+KEY_SHEAR));
			if (properties.getProperty(prefix+KEY_PHIX)!=null)          b.phix=EProperties.str_to_darr2(properties.getProperty(prefix+KEY_PHIX));
			if (properties.getProperty(prefix+KEY_PHIY)!=null)          b.phiy=EProperties.str_to_darr2(properties.getProperty(prefix+KEY_PHIY));
			if (properties.getProperty(prefix+KEY_Q1)!=null)            b.q1=EProperties.str_to_darr(properties.getProperty(prefix+KEY_Q1));
			if (properties.getProperty(prefix+KEY_Q2)!=null)            b.q2=EProperties.str_to_darr(properties.getProperty(prefix+KEY_Q2));
			if (properties.getProperty(prefix+KEY_UX)!=null)            b.ux=EProperties.str_to_darr2(properties.getProperty(prefix+KEY_UX));
			if (properties.getProperty(prefix+KEY_UY)!=null)            b.uy=EProperties.str_to_darr2(properties.getProperty(prefix+KEY_UY));
			if (properties.getProperty(prefix+KEY_FORCE_COMMEN)!=null)  b.force_commen=Boolean.parseBoolean(properties.getProperty(prefix+KEY_FORCE_COMMEN));
			if (properties.getProperty(prefix+KEY_C1)!=null)            b.c1=Double.parseDouble(properties.getProperty(prefix+KEY_C1));
		} catch (NumberFormatException e) {
			throw new ConfigurationException("Invalid drift parameter with prefix \""+prefix+"\"", e);
		}
		b.bpp = BraggPeakParameters.DEFAULT.getProperties(prefix+DriftCorrectionParameters.BP_PREFIX, properties);
		return b.build();
	}

	private static double number(Map<String, ?> map, String key, double dflt) {
		Object o = map.get(key);
		return (o == null) ? dflt : ((Number) o).doubleValue();
	}

	private static void putIfNotNull(Map<String, Object> map, String key, Object value) {
		if (value != null) map.put(key, value);
	}

	static int [] copy(int [] a) {
		return (a == null) ? null : a.clone();
	}

	static double [] copy(double [] a) {
		return (a == null) ? null : a.clone();
	}

	static double [][] copy(double [][] a) {
		if (a == null) return null;
		double [][] c = new double [a.length][];
		for (int i = 0; i < a.length; i++) c[i] = a[i].clone();
		return c;
	}

	public static class Builder {
		private int []              cut1;
		private int []              cut2;
		private BraggPeakParameters bpp;
		private CorrectionMethod    method;
		private Interpolation       interpolation = Interpolation.CUBIC;
		private double []           sigma;
		private double [][]         bp1;
		private double [][]         bp_c;
		private double [][]         bp3;
		private double              bp_angle = Double.NaN;
		private double              orient =   Double.NaN;
		private double [][]         shear_matrix;
		private double [][]         phix;
		private double [][]         phiy;
		private double []           q1;
		private double []           q2;
		private double [][]         ux;
		private double [][]         uy;
		private boolean             force_commen = true;
		private double              c1 = 2.0;

		public Builder cut1(int [] cut1)                        {this.cut1 = cut1;                 return this;}
		public Builder cut2(int [] cut2)                        {this.cut2 = cut2;                 return this;}
		public Builder braggPeakParameters(BraggPeakParameters bpp) {this.bpp = bpp;               return this;}
		public Builder method(CorrectionMethod method)          {this.method = method;             return this;}
		public Builder interpolation(Interpolation interp)      {this.interpolation = interp;      return this;}
		public Builder sigma(double [] sigma)                   {this.sigma = sigma;               return this;}
		public Builder bp1(double [][] bp1)                     {this.bp1 = bp1;                   return this;}
		public Builder bpIdeal(double [][] bp_c)                {this.bp_c = bp_c;                 return this;}
		public Builder bp3(double [][] bp3)                     {this.bp3 = bp3;                   return this;}
		public Builder bpAngle(double bp_angle)                 {this.bp_angle = bp_angle;         return this;}
		public Builder orient(double orient)                    {this.orient = orient;             return this;}
		public Builder shearMatrix(double [][] shear_matrix)    {this.shear_matrix = shear_matrix; return this;}
		public Builder forceCommen(boolean force_commen)        {this.force_commen = force_commen; return this;}
		public Builder c1(double c1)                            {this.c1 = c1;                     return this;}

		public Builder phases(double [][] phix, double [][] phiy, double [] q1, double [] q2) {
			this.phix = phix;
			this.phiy = phiy;
			this.q1 =   q1;
			this.q2 =   q2;
			return this;
		}

		public Builder driftField(DriftField field) {
			this.ux = field.ux;
			this.uy = field.uy;
			return this;
		}

		public DriftParameterBundle build() {
			return new DriftParameterBundle(this);
		}
	}
}
