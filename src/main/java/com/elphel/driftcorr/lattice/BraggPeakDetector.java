/**
 **
 ** BraggPeakDetector.java - lattice frequency peaks in the magnitude spectrum
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  BraggPeakDetector.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.driftcorr.common.FourierTools;
import com.elphel.driftcorr.common.ImageArrays;

/**
 * Finds Bragg peaks as local maxima of the DC-suppressed, masked magnitude spectrum.
 * Coordinates are {x, y} of the shifted spectrum, same size as the image.
 */
public class BraggPeakDetector {
	private static final Logger LOGGER = LoggerFactory.getLogger(BraggPeakDetector.class);

	private final BraggPeakParameters bpp;

	public BraggPeakDetector(BraggPeakParameters bpp) {
		this.bpp = (bpp == null) ? BraggPeakParameters.DEFAULT : bpp;
	}

	public BraggPeakParameters getParameters() {
		return bpp;
	}

	/**
	 * @param image real space image, or a magnitude spectrum if the parameters say so
	 * @return masked magnitude spectrum, DC at (width/2, height/2) is zero
	 */
	public double [][] getSpectrum(double [][] image) {
		ImageArrays.shape(image);
		double [][] spectrum = bpp.isRspace() ? FourierTools.magnitudeSpectrum(image) : ImageArrays.copy(image);
		FourierMasks.apply(spectrum, bpp);
		return spectrum;
	}

	/**
	 * All peaks passing the thresholds, strongest first, optionally evened out and refined.
	 * @param image source image
	 * @return peaks {x, y}, may be empty
	 */
	public double [][] findPeaks(double [][] image) {
		double [][] spectrum = getSpectrum(image);
		int height = spectrum.length;
		int width = spectrum[0].length;
		double [][] peaks = localMaxima(spectrum, bpp.getMinDist(), bpp.getThres());
		if (bpp.isEvenOut()) {
			peaks = BraggPeaks.evenOut(peaks, width, height);
		}
		if (bpp.isPrecise()) {
			double sum = 0;
			for (double [] row : spectrum) for (double d : row) sum += d;
			for (int i = 0; i < peaks.length; i++) {
				peaks[i] = refine(spectrum, sum, peaks[i], bpp.getFitWidth());
			}
		}
		LOGGER.debug("Found "+peaks.length+" peaks: "+BraggPeaks.toString(peaks));
		return peaks;
	}

	/**
	 * The 4 peaks nearest to the spectrum center, in no particular order.
	 * @throws com.elphel.driftcorr.common.InsufficientPeaksException if fewer than 4 are found
	 */
	public double [][] findBraggs(double [][] image) {
		double [][] peaks = findPeaks(image);
		double [][] bp = BraggPeaks.selectNearest(peaks, BraggPeaks.NUM_PEAKS, image[0].length, image.length);
		LOGGER.info("Bragg peaks ("+image[0].length+"x"+image.length+"): "+BraggPeaks.toString(bp));
		return bp;
	}

	/**
	 * Local maxima at least min_dist apart (Chebyshev distance) and from the border, strictly
	 * above max(min, thres * max) of the data. Stronger peaks win.
	 * @return peaks {x, y}, strongest first
	 */
	public static double [][] localMaxima(double [][] data, int min_dist, double thres) {
		int height = data.length;
		int width = data[0].length;
		double threshold = Math.max(ImageArrays.min(data), thres * ImageArrays.max(data));
		List<int []> candidates = new ArrayList<>();
		for (int y = min_dist; y < height - min_dist; y++) {
			for (int x = min_dist; x < width - min_dist; x++) {
				double d = data[y][x];
				if (!(d > threshold)) continue;
				boolean is_max = true;
				scan:
				for (int yy = y - min_dist; yy <= y + min_dist; yy++) {
					for (int xx = x - min_dist; xx <= x + min_dist; xx++) {
						if (data[yy][xx] > d) {
							is_max = false;
							break scan;
						}
					}
				}
				if (is_max) {
					candidates.add(new int [] {x, y});
				}
			}
		}
		// strongest first, ties in scan order
		Collections.sort(candidates, (c1, c2) -> Double.compare(data[c2[1]][c2[0]], data[c1[1]][c1[0]]));
		List<int []> accepted = new ArrayList<>();
		for (int [] c : candidates) {
			boolean far = true;
			for (int [] a : accepted) {
				if (Math.max(Math.abs(a[0] - c[0]), Math.abs(a[1] - c[1])) <= min_dist) {
					far = false;
					break;
				}
			}
			if (far) {
				accepted.add(c);
			}
		}
		double [][] peaks = new double [accepted.size()][];
		for (int i = 0; i < peaks.length; i++) {
			peaks[i] = new double [] {accepted.get(i)[0], accepted.get(i)[1]};
		}
		return peaks;
	}

	/**
	 * Sub-pixel peak position from a Gaussian fit of the normalized spectrum around it.
	 * Keeps the original position if the fit fails.
	 */
	static double [] refine(double [][] spectrum, double sum, double [] peak, int fit_width) {
		int height = spectrum.length;
		int width = spectrum[0].length;
		int px = (int) Math.round(peak[0]);
		int py = (int) Math.round(peak[1]);
		int x0 = Math.max(0, px - fit_width);
		int y0 = Math.max(0, py - fit_width);
		int x1 = Math.min(width,  px + fit_width);
		int y1 = Math.min(height, py + fit_width);
		if ((x1 - x0 < 3) || (y1 - y0 < 3) || !(sum > 0)) {
			LOGGER.warn("Window around peak ("+px+", "+py+") is too small to refine");
			return peak.clone();
		}
		double [][] window = new double [y1 - y0][x1 - x0];
		for (int y = y0; y < y1; y++) {
			for (int x = x0; x < x1; x++) {
				window[y - y0][x - x0] = spectrum[y][x] / sum;
			}
		}
		Gaussian2dLMA lma = new Gaussian2dLMA(window);
		double [] v = lma.initialVector();
		v[Gaussian2dLMA.PAR_X0] = px - x0;
		v[Gaussian2dLMA.PAR_Y0] = py - y0;
		lma.setVector(v);
		if (!lma.runLma(0.1, 0.5, 8.0, 100, 0.001, 20)) {
			LOGGER.warn("Gaussian fit failed for peak ("+px+", "+py+"), keeping integer position");
			return peak.clone();
		}
		double [] fit = lma.getVector();
		return new double [] {x0 + fit[Gaussian2dLMA.PAR_X0], y0 + fit[Gaussian2dLMA.PAR_Y0]};
	}
}
