/**
 **
 ** BraggPeakParameters.java - immutable Bragg peak detection settings
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  BraggPeakParameters.java is free software: you can redistribute it and/or modify
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

import java.util.Properties;

import com.elphel.driftcorr.common.ConfigurationException;
import com.elphel.driftcorr.common.EProperties;

/**
 * Detection thresholds and frequency-domain masks. Instances are immutable, use
 * {@link #builder()} or {@link #toBuilder()} to make modified copies.
 */
public final class BraggPeakParameters {
	public static final BraggPeakParameters DEFAULT = builder().build();

	private final boolean   rspace;    // input is a real space image, false - already a magnitude spectrum
	private final int       min_dist;  // minimal distance between peaks and from the border, pixels
	private final double    thres;     // threshold relative to the spectrum maximum
	private final Double    r;         // low-q Gaussian suppressor width / image size, null - off
	private final Double    w;         // axis line suppressor half-width / image size, null - off
	private final double [] mask3;     // n-fold angular mask {n, offset, width}, null - off
	private final boolean   even_out;  // round peak offsets to even integers
	private final boolean   precise;   // sub-pixel refinement by Gaussian fit
	private final int       fit_width; // half-size of the fit window

	private BraggPeakParameters(Builder b) {
		this.rspace =    b.rspace;
		this.min_dist =  b.min_dist;
		this.thres =     b.thres;
		this.r =         b.r;
		this.w =         b.w;
		this.mask3 =     (b.mask3 == null) ? null : b.mask3.clone();
		this.even_out =  b.even_out;
		this.precise =   b.precise;
		this.fit_width = b.fit_width;
	}

	public boolean   isRspace()   {return rspace;}
	public int       getMinDist() {return min_dist;}
	public double    getThres()   {return thres;}
	public Double    getR()       {return r;}
	public Double    getW()       {return w;}
	public double [] getMask3()   {return (mask3 == null) ? null : mask3.clone();}
	public boolean   isEvenOut()  {return even_out;}
	public boolean   isPrecise()  {return precise;}
	public int       getFitWidth(){return fit_width;}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		Builder b = new Builder();
		b.rspace =    rspace;
		b.min_dist =  min_dist;
		b.thres =     thres;
		b.r =         r;
		b.w =         w;
		b.mask3 =     getMask3();
		b.even_out =  even_out;
		b.precise =   precise;
		b.fit_width = fit_width;
		return b;
	}

	public void setProperties(String prefix, Properties properties) {
		properties.setProperty(prefix+"rspace",    this.rspace+"");
		properties.setProperty(prefix+"min_dist",  this.min_dist+"");
		properties.setProperty(prefix+"thres",     this.thres+"");
		if (r != null)     properties.setProperty(prefix+"r",     this.r+"");
		if (w != null)     properties.setProperty(prefix+"w",     this.w+"");
		if (mask3 != null) properties.setProperty(prefix+"mask3", EProperties.arr_to_str(this.mask3));
		properties.setProperty(prefix+"even_out",  this.even_out+"");
		properties.setProperty(prefix+"precise",   this.precise+"");
		properties.setProperty(prefix+"fit_width", this.fit_width+"");
	}

	/**
	 * @return new parameters, values missing from properties are taken from this instance
	 */
	public BraggPeakParameters getProperties(String prefix, Properties properties) {
		Builder b = toBuilder();
		try {
			if (properties.getProperty(prefix+"rspace")!=null)    b.rspace=Boolean.parseBoolean(properties.getProperty(prefix+"rspace"));
			if (properties.getProperty(prefix+"min_dist")!=null)  b.min_dist=Integer.parseInt(properties.getProperty(prefix+"min_dist"));
			if (properties.getProperty(prefix+"thres")!=null)     b.thres=Double.parseDouble(properties.getProperty(prefix+"thres"));
			if (properties.getProperty(prefix+"r")!=null)         b.r=Double.parseDouble(properties.getProperty(prefix+"r"));
			if (properties.getProperty(prefix+"w")!=null)         b.w=Double.parseDouble(properties.getProperty(prefix+"w"));
			if (properties.getProperty(prefix+"mask3")!=null)     b.mask3=EProperties.str_to_darr(properties.getProperty(prefix+"mask3"));
			if (properties.getProperty(prefix+"even_out")!=null)  b.even_out=Boolean.parseBoolean(properties.getProperty(prefix+"even_out"));
			if (properties.getProperty(prefix+"precise")!=null)   b.precise=Boolean.parseBoolean(properties.getProperty(prefix+"precise"));
			if (properties.getProperty(prefix+"fit_width")!=null) b.fit_width=Integer.parseInt(properties.getProperty(prefix+"fit_width"));
		} catch (NumberFormatException e) {
			throw new ConfigurationException("Invalid Bragg peak parameter with prefix \""+prefix+"\"", e);
		}
		return b.build();
	}

	@Override
	public String toString() {
		return "min_dist="+min_dist+", thres="+thres+", r="+r+", w="+w+
				", mask3="+((mask3 == null) ? "null" : EProperties.arr_to_str(mask3))+
				", even_out="+even_out+", precise="+precise+", fit_width="+fit_width+", rspace="+rspace;
	}

	public static class Builder {
		private boolean   rspace =    true;
		private int       min_dist =  5;
		private double    thres =     0.25;
		private Double    r =         null;
		private Double    w =         null;
		private double [] mask3 =     null;
		private boolean   even_out =  false;
		private boolean   precise =   false;
		private int       fit_width = 10;

		public Builder rspace(boolean rspace)     {this.rspace = rspace;       return this;}
		public Builder minDist(int min_dist)      {this.min_dist = min_dist;   return this;}
		public Builder thres(double thres)        {this.thres = thres;         return this;}
		public Builder r(Double r)                {this.r = r;                 return this;}
		public Builder w(Double w)                {this.w = w;                 return this;}
		public Builder evenOut(boolean even_out)  {this.even_out = even_out;   return this;}
		public Builder precise(boolean precise)   {this.precise = precise;     return this;}
		public Builder fitWidth(int fit_width)    {this.fit_width = fit_width; return this;}

		/**
		 * @param mask3 {n, offset, width}: n lines through the center at angles 2*pi*i/n + offset,
		 *        pixels closer than width to a line are masked. null disables the mask.
		 */
		public Builder mask3(double [] mask3) {
			this.mask3 = (mask3 == null) ? null : mask3.clone();
			return this;
		}

		public BraggPeakParameters build() {
			if (min_dist < 1) {
				throw new ConfigurationException("min_dist should be positive, got "+min_dist);
			}
			if ((thres < 0) || (thres >= 1)) {
				throw new ConfigurationException("Relative threshold should be in [0, 1), got "+thres);
			}
			if ((mask3 != null) && (mask3.length != 3)) {
				throw new ConfigurationException("mask3 needs 3 values {n, offset, width}, got "+mask3.length);
			}
			if (fit_width < 1) {
				throw new ConfigurationException("fit_width should be positive, got "+fit_width);
			}
			return new BraggPeakParameters(this);
		}
	}
}
