/**
 **
 ** LatticeParameters.java - lattice constant, scan size and q-space scale of a dataset
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  LatticeParameters.java is free software: you can redistribute it and/or modify
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

import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.driftcorr.common.ConfigurationException;
import com.elphel.driftcorr.common.EProperties;

/**
 * Physical description of one dataset: lattice constant, scan size and pixel dimensions, with
 * derived q-space scales and the lattice symmetry used to build the ideal peaks. Refreshed
 * with {@link #update(double[][], int, int)} after peaks are detected or the image is cropped.
 */
public class LatticeParameters implements Cloneable {
	private static final Logger LOGGER = LoggerFactory.getLogger(LatticeParameters.class);

	public static final String HEADER_SCAN_RANGE =    "scan_range";
	public static final String HEADER_GRID_SETTINGS = "Grid settings";
	public static final String HEADER_SCAN_PIXELS =   "scan_pixels";
	public static final String HEADER_GRID_DIM =      "Grid dim";

	public double    a0 =       1.0;   // lattice constant, nm (1.0 when unknown)
	public boolean   use_a0 =   false; // derive scan size from a0 and peak positions
	public double [] size =     {1.0, 1.0}; // scan size, nm {x, y}
	public int []    pixels =   {1, 1};     // {width, height}
	public double [] qmag =     {1.0, 1.0}; // size / a0: lattice periods across the scan
	public double [] qscale =   {1.0, 1.0};
	public Double    angle =    null;  // angle between neighbor peaks, 2*pi/n, null - auto
	public Double    orient =   null;  // angle of the first peak, null - auto
	public boolean   even_out = false;
	public double [] qx =       null;  // first lattice vector (peak 0 - center), pixels
	public double [] qy =       null;  // second lattice vector (peak 1 - center), pixels

	public LatticeParameters() {
	}

	/**
	 * @param a0 lattice constant in nm, null if unknown (use_a0 is then forced off)
	 * @param size scan size {sx, sy} (or {s}) in nm
	 * @param pixels pixel dimensions {px, py} (or {p})
	 * @param angle angle between neighbor peaks, null to detect
	 * @param orient orientation of the first peak, null to detect
	 * @param even_out round ideal peaks to even offsets
	 * @param use_a0 recompute size from a0 after each detection
	 */
	public LatticeParameters(
			Double    a0,
			double [] size,
			int []    pixels,
			Double    angle,
			Double    orient,
			boolean   even_out,
			boolean   use_a0) {
		if ((size == null) || (size.length == 0)) {
			throw new ConfigurationException("Scan size is not specified");
		}
		if ((pixels == null) || (pixels.length == 0)) {
			throw new ConfigurationException("Number of pixels is not specified");
		}
		this.size =   new double [] {size[0], size[(size.length > 1) ? 1 : 0]};
		this.pixels = new int []    {pixels[0], pixels[(pixels.length > 1) ? 1 : 0]};
		if ((this.size[0] <= 0) || (this.size[1] <= 0) || (this.pixels[0] <= 0) || (this.pixels[1] <= 0)) {
			throw new ConfigurationException("Invalid scan size "+EProperties.arr_to_str(this.size)+
					" or pixels "+EProperties.arr_to_str(this.pixels));
		}
		if (a0 == null) {
			this.a0 = 1.0;
			this.use_a0 = false;
		} else {
			if (a0 <= 0) {
				throw new ConfigurationException("Invalid lattice constant "+a0);
			}
			this.a0 = a0;
			this.use_a0 = use_a0;
		}
		this.angle =    angle;
		this.orient =   orient;
		this.even_out = even_out;
		for (int i = 0; i < 2; i++) {
			this.qmag[i] =   this.size[i] / this.a0;
			this.qscale[i] = this.pixels[i] / (2 * this.qmag[i]);
		}
	}

	/**
	 * Build parameters from an instrument header, explicit values take precedence.
	 * Size is read from "scan_range" (last two numbers) or "Grid settings" (last two
	 * ";"-separated numbers), pixels from "scan_pixels" (last two numbers) or "Grid dim"
	 * (last token without its trailing character).
	 * @throws ConfigurationException when neither an explicit value nor a header entry is available
	 */
	public static LatticeParameters fromHeader(
			Map<String, ?> header,
			Double    a0,
			double [] size,
			int []    pixels,
			Double    angle,
			Double    orient,
			boolean   even_out,
			boolean   use_a0) {
		if (size == null) {
			size = sizeFromHeader(header);
		}
		if (pixels == null) {
			pixels = pixelsFromHeader(header);
		}
		return new LatticeParameters(a0, size, pixels, angle, orient, even_out, use_a0);
	}

	static double [] sizeFromHeader(Map<String, ?> header) {
		if (header != null) {
			try {
				if (header.get(HEADER_SCAN_RANGE) != null) {
					return lastTwo(toDoubles(header.get(HEADER_SCAN_RANGE)));
				}
				if (header.get(HEADER_GRID_SETTINGS) != null) {
					String [] sa = header.get(HEADER_GRID_SETTINGS).toString().split(";");
					double [] d = new double [sa.length];
					for (int i = 0; i < sa.length; i++) {
						d[i] = (sa[i].trim().isEmpty()) ? Double.NaN : Double.parseDouble(sa[i].trim());
					}
					return lastTwo(d);
				}
			} catch (NumberFormatException e) {
				throw new ConfigurationException("Can not parse map size from header", e);
			}
		}
		throw new ConfigurationException("Cannot find map size from header, it has to be specified explicitly");
	}

	static int [] pixelsFromHeader(Map<String, ?> header) {
		if (header != null) {
			try {
				if (header.get(HEADER_SCAN_PIXELS) != null) {
					double [] d = lastTwo(toDoubles(header.get(HEADER_SCAN_PIXELS)));
					return new int [] {(int) d[0], (int) d[1]};
				}
				if (header.get(HEADER_GRID_DIM) != null) {
					String [] tokens = header.get(HEADER_GRID_DIM).toString().trim().split("\\s+");
					String last = tokens[tokens.length - 1];
					int p = Integer.parseInt(last.substring(0, last.length() - 1));
					return new int [] {p, p};
				}
			} catch (NumberFormatException | StringIndexOutOfBoundsException e) {
				throw new ConfigurationException("Can not parse number of pixels from header", e);
			}
		}
		throw new ConfigurationException("Cannot find number of pixels from header, it has to be specified explicitly");
	}

	private static double [] toDoubles(Object o) {
		if (o instanceof double []) return (double []) o;
		if (o instanceof float []) {
			float [] f = (float []) o;
			double [] d = new double [f.length];
			for (int i = 0; i < f.length; i++) d[i] = f[i];
			return d;
		}
		if (o instanceof int []) {
			int [] ia = (int []) o;
			double [] d = new double [ia.length];
			for (int i = 0; i < ia.length; i++) d[i] = ia[i];
			return d;
		}
		if (o instanceof Number) return new double [] {((Number) o).doubleValue()};
		if (o instanceof Number []) {
			Number [] na = (Number []) o;
			double [] d = new double [na.length];
			for (int i = 0; i < na.length; i++) d[i] = na[i].doubleValue();
			return d;
		}
		if (o instanceof List) {
			List<?> l = (List<?>) o;
			double [] d = new double [l.size()];
			for (int i = 0; i < d.length; i++) d[i] = Double.parseDouble(l.get(i).toString());
			return d;
		}
		double [] d = EProperties.str_to_darr(o.toString());
		if (d == null) {
			throw new ConfigurationException("Empty header value");
		}
		return d;
	}

	private static double [] lastTwo(double [] d) {
		if ((d.length == 0) || Double.isNaN(d[d.length - 1])) {
			throw new ConfigurationException("Header value has no numbers");
		}
		if (d.length == 1) {
			return new double [] {d[0], d[0]};
		}
		return new double [] {d[d.length - 2], d[d.length - 1]};
	}

	/**
	 * Refresh pixel dimensions, scan size, qscale and lattice vectors from a sorted peak set of
	 * a (possibly cropped) image.
	 * @param bp sorted peaks {x, y}
	 * @param width current image width
	 * @param height current image height
	 */
	public void update(double [][] bp, int width, int height) {
		double [] c = BraggPeaks.center(width, height);
		int [] new_pixels = {width, height};
		if (use_a0) {
			// pixel size = a0 * lattice spatial frequency (cycles per pixel)
			double f = 0.0;
			for (double [] p : bp) {
				double fx = (p[0] - c[0]) / width;
				double fy = (p[1] - c[1]) / height;
				f += Math.sqrt(fx * fx + fy * fy);
			}
			f /= bp.length;
			this.size = new double [] {a0 * f * width, a0 * f * height};
		} else {
			this.size = new double [] {
					size[0] * width / pixels[0],
					size[1] * height / pixels[1]};
		}
		double bp_x = Double.POSITIVE_INFINITY;
		double bp_y = Double.POSITIVE_INFINITY;
		for (double [] p : bp) {
			bp_x = Math.min(bp_x, p[0]);
			bp_y = Math.min(bp_y, p[1]);
		}
		this.qscale = new double [] {width / (width - 2 * bp_x), height / (height - 2 * bp_y)};
		this.pixels = new_pixels;
		this.qmag =   new double [] {size[0] / a0, size[1] / a0};
		this.qx =     new double [] {bp[0][0] - c[0], bp[0][1] - c[1]};
		this.qy =     new double [] {bp[1][0] - c[0], bp[1][1] - c[1]};
		LOGGER.debug("Lattice parameters updated: pixels="+EProperties.arr_to_str(pixels)+
				", size="+EProperties.arr_to_str(size)+", qscale="+EProperties.arr_to_str(qscale));
	}

	public void setProperties(String prefix, Properties properties) {
		properties.setProperty(prefix+"a0",       this.a0+"");
		properties.setProperty(prefix+"use_a0",   this.use_a0+"");
		properties.setProperty(prefix+"size",     EProperties.arr_to_str(this.size));
		properties.setProperty(prefix+"pixels",   EProperties.arr_to_str(this.pixels));
		properties.setProperty(prefix+"qmag",     EProperties.arr_to_str(this.qmag));
		properties.setProperty(prefix+"qscale",   EProperties.arr_to_str(this.qscale));
		properties.setProperty(prefix+"even_out", this.even_out+"");
		if (angle != null)  properties.setProperty(prefix+"angle",  this.angle+"");
		if (orient != null) properties.setProperty(prefix+"orient", this.orient+"");
	}

	public void getProperties(String prefix, Properties properties) {
		if (properties.getProperty(prefix+"a0")!=null)       this.a0=Double.parseDouble(properties.getProperty(prefix+"a0"));
		if (properties.getProperty(prefix+"use_a0")!=null)   this.use_a0=Boolean.parseBoolean(properties.getProperty(prefix+"use_a0"));
		if (properties.getProperty(prefix+"size")!=null)     this.size=EProperties.str_to_darr(properties.getProperty(prefix+"size"));
		if (properties.getProperty(prefix+"pixels")!=null)   this.pixels=EProperties.str_to_iarr(properties.getProperty(prefix+"pixels"));
		if (properties.getProperty(prefix+"qmag")!=null)     this.qmag=EProperties.str_to_darr(properties.getProperty(prefix+"qmag"));
		if (properties.getProperty(prefix+"qscale")!=null)   this.qscale=EProperties.str_to_darr(properties.getProperty(prefix+"qscale"));
		if (properties.getProperty(prefix+"even_out")!=null) this.even_out=Boolean.parseBoolean(properties.getProperty(prefix+"even_out"));
		if (properties.getProperty(prefix+"angle")!=null)    this.angle=Double.parseDouble(properties.getProperty(prefix+"angle"));
		if (properties.getProperty(prefix+"orient")!=null)   this.orient=Double.parseDouble(properties.getProperty(prefix+"orient"));
	}

	@Override
	public LatticeParameters clone() {
		LatticeParameters lp = new LatticeParameters();
		lp.a0 =       this.a0;
		lp.use_a0 =   this.use_a0;
		lp.size =     this.size.clone();
		lp.pixels =   this.pixels.clone();
		lp.qmag =     this.qmag.clone();
		lp.qscale =   this.qscale.clone();
		lp.angle =    this.angle;
		lp.orient =   this.orient;
		lp.even_out = this.even_out;
		lp.qx =       (this.qx == null) ? null : this.qx.clone();
		lp.qy =       (this.qy == null) ? null : this.qy.clone();
		return lp;
	}
}
