/**
 **
 ** ImageArrays.java - double array images, ImageJ stack conversion
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ImageArrays.java is free software: you can redistribute it and/or modify
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

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 * Images are double [y][x], stacks double [layer][y][x]. ImageJ processors are row-major
 * float pixels, converted without any scaling.
 */
public class ImageArrays {

	public static double [][] copy(double [][] image) {
		double [][] c = new double [image.length][];
		for (int y = 0; y < image.length; y++) {
			c[y] = image[y].clone();
		}
		return c;
	}

	public static double [][][] copy(double [][][] stack) {
		double [][][] c = new double [stack.length][][];
		for (int n = 0; n < stack.length; n++) {
			c[n] = copy(stack[n]);
		}
		return c;
	}

	public static double mean(double [][] image) {
		double s = 0.0;
		int num = 0;
		for (double [] row : image) {
			for (double d : row) {
				s += d;
			}
			num += row.length;
		}
		return (num > 0) ? (s / num) : 0.0;
	}

	public static double min(double [][] image) {
		double m = Double.POSITIVE_INFINITY;
		for (double [] row : image) {
			for (double d : row) {
				if (d < m) m = d;
			}
		}
		return m;
	}

	public static double max(double [][] image) {
		double m = Double.NEGATIVE_INFINITY;
		for (double [] row : image) {
			for (double d : row) {
				if (d > m) m = d;
			}
		}
		return m;
	}

	/**
	 * @param image rectangular image
	 * @return {width, height}
	 * @throws ShapeMismatchException for empty or ragged arrays
	 */
	public static int [] shape(double [][] image) {
		if ((image == null) || (image.length == 0) || (image[0] == null) || (image[0].length == 0)) {
			throw new ShapeMismatchException("Empty image");
		}
		int width = image[0].length;
		for (int y = 1; y < image.length; y++) {
			if (image[y].length != width) {
				throw new ShapeMismatchException("Ragged image: row "+y+" has "+image[y].length+" pixels, expected "+width);
			}
		}
		return new int [] {width, image.length};
	}

	/**
	 * @param stack stack of co-registered layers
	 * @return {width, height} shared by all layers
	 * @throws ShapeMismatchException if layers differ
	 */
	public static int [] shape(double [][][] stack) {
		if ((stack == null) || (stack.length == 0)) {
			throw new ShapeMismatchException("Empty stack");
		}
		int [] wh = shape(stack[0]);
		for (int n = 1; n < stack.length; n++) {
			int [] whn = shape(stack[n]);
			if ((whn[0] != wh[0]) || (whn[1] != wh[1])) {
				throw new ShapeMismatchException("Layer "+n+" is "+whn[0]+"x"+whn[1]+", layer 0 is "+wh[0]+"x"+wh[1]);
			}
		}
		return wh;
	}

	public static void checkSameShape(double [][] a, double [][] b, String what) {
		int [] wha = shape(a);
		int [] whb = shape(b);
		if ((wha[0] != whb[0]) || (wha[1] != whb[1])) {
			throw new ShapeMismatchException(what+": "+whb[0]+"x"+whb[1]+" does not match image "+wha[0]+"x"+wha[1]);
		}
	}

	/**
	 * Hard rectangular trim.
	 * @param image source image
	 * @param left columns removed from the start of each row
	 * @param right columns removed from the end of each row
	 * @param down rows removed from the start
	 * @param up rows removed from the end
	 * @return trimmed copy
	 */
	public static double [][] trim(double [][] image, int left, int right, int down, int up) {
		int [] wh = shape(image);
		int width = wh[0] - left - right;
		int height = wh[1] - down - up;
		if ((left < 0) || (right < 0) || (down < 0) || (up < 0) || (width <= 0) || (height <= 0)) {
			throw new ConfigurationException("Can not trim "+wh[0]+"x"+wh[1]+" image by ["+
					left+", "+right+", "+down+", "+up+"]");
		}
		double [][] r = new double [height][];
		for (int y = 0; y < height; y++) {
			r[y] = new double [width];
			System.arraycopy(image[y + down], left, r[y], 0, width);
		}
		return r;
	}

	public static double [][] fromProcessor(ImageProcessor ip) {
		int width = ip.getWidth();
		int height = ip.getHeight();
		float [] pixels = (float []) ip.convertToFloatProcessor().getPixels();
		double [][] image = new double [height][width];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				image[y][x] = pixels[y * width + x];
			}
		}
		return image;
	}

	public static FloatProcessor toProcessor(double [][] image) {
		int [] wh = shape(image);
		float [] pixels = new float [wh[0] * wh[1]];
		for (int y = 0; y < wh[1]; y++) {
			for (int x = 0; x < wh[0]; x++) {
				pixels[y * wh[0] + x] = (float) image[y][x];
			}
		}
		return new FloatProcessor(wh[0], wh[1], pixels);
	}

	public static double [][][] fromImagePlus(ImagePlus imp) {
		ImageStack stack = imp.getStack();
		double [][][] layers = new double [stack.getSize()][][];
		for (int n = 0; n < layers.length; n++) {
			layers[n] = fromProcessor(stack.getProcessor(n + 1));
		}
		return layers;
	}

	public static ImagePlus toImagePlus(double [][][] layers, String title, String [] labels) {
		int [] wh = shape(layers);
		ImageStack stack = new ImageStack(wh[0], wh[1]);
		for (int n = 0; n < layers.length; n++) {
			String label = ((labels != null) && (n < labels.length)) ? labels[n] : ("layer-"+n);
			stack.addSlice(label, toProcessor(layers[n]));
		}
		return new ImagePlus(title, stack);
	}
}
