/*-
 * #%L
 * This file is part of BlotQuant.
 * %%
 * Copyright (C) 2025 - 2026 BlotQuant developers
 * %%
 * BlotQuant is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * BlotQuant is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with BlotQuant.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package blotquant.lib.analysis.densitometry;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import blotquant.lib.images.PixelBuffer;
import blotquant.lib.measurements.BandIntensity;
import blotquant.lib.regions.BandROI;

/**
 * Measure the integrated intensity of bands, with a local background correction.
 * <p>
 * The background of each band is estimated as the mean of the pixels on the border of its rectangle, 
 * and subtracted from every pixel of the rectangle.
 */
public class IntensityMeasurer {
	
	private static final Logger logger = LoggerFactory.getLogger(IntensityMeasurer.class);
	
	private IntensityMeasurer() {
		throw new AssertionError();
	}
	
	/**
	 * Measure every band.
	 * <p>
	 * Band indices are assigned per lane, counting up from 0 in the order that the bands of each lane 
	 * appear in the input. The output contains one measurement per band, in input order.
	 * 
	 * @param buffer the (background-corrected) image
	 * @param rois the band regions
	 * @return
	 * @throws IllegalArgumentException if any region extends beyond the image
	 */
	public static List<BandIntensity> measureBands(PixelBuffer buffer, List<BandROI> rois) throws IllegalArgumentException {
		int[] bandIndices = new int[rois.size()];
		Map<Integer, Integer> laneCounts = new HashMap<>();
		for (int i = 0; i < rois.size(); i++) {
			var roi = rois.get(i);
			checkInside(buffer, roi);
			bandIndices[i] = laneCounts.merge(roi.laneIndex(), 1, Integer::sum) - 1;
		}
		var measurements = IntStream.range(0, rois.size())
				.parallel()
				.mapToObj(i -> measureBand(buffer, rois.get(i), bandIndices[i]))
				.collect(Collectors.toUnmodifiableList());
		logger.debug("Measured {} band(s) in {} lane(s)", measurements.size(), laneCounts.size());
		return measurements;
	}
	
	private static BandIntensity measureBand(PixelBuffer buffer, BandROI roi, int bandIndex) {
		double raw = integratedIntensity(buffer, roi);
		double background = borderBackground(buffer, roi);
		double corrected = Math.max(0, raw - background * roi.getArea());
		return new BandIntensity(roi.laneIndex(), bandIndex, raw, background, corrected);
	}
	
	/**
	 * Sum all pixel values within a region.
	 * @param buffer
	 * @param roi
	 * @return
	 */
	public static double integratedIntensity(PixelBuffer buffer, BandROI roi) {
		checkInside(buffer, roi);
		int width = buffer.getWidth();
		double[] values = buffer.getValues(true);
		double sum = 0;
		for (int y = roi.y0(); y < roi.y1(); y++) {
			for (int x = roi.x0(); x < roi.x1(); x++)
				sum += values[y * width + x];
		}
		return sum;
	}
	
	/**
	 * Compute the mean value of the pixels on the border of a region.
	 * <p>
	 * The border consists of the top and bottom rows, plus the left and right columns of the rows in between.
	 * Every border pixel is counted once, including the corners and regions that are only one pixel high or wide.
	 * 
	 * @param buffer
	 * @param roi
	 * @return
	 */
	public static double borderBackground(PixelBuffer buffer, BandROI roi) {
		checkInside(buffer, roi);
		int width = buffer.getWidth();
		double[] values = buffer.getValues(true);
		int top = roi.y0();
		int bottom = roi.y1() - 1;
		int left = roi.x0();
		int right = roi.x1() - 1;
		double sum = 0;
		int count = 0;
		for (int x = left; x <= right; x++) {
			sum += values[top * width + x];
			count++;
			if (bottom > top) {
				sum += values[bottom * width + x];
				count++;
			}
		}
		for (int y = top + 1; y < bottom; y++) {
			sum += values[y * width + left];
			count++;
			if (right > left) {
				sum += values[y * width + right];
				count++;
			}
		}
		return count > 0 ? sum / count : 0;
	}
	
	private static void checkInside(PixelBuffer buffer, BandROI roi) {
		if (roi.x1() > buffer.getWidth() || roi.y1() > buffer.getHeight())
			throw new IllegalArgumentException(roi + " extends beyond image of size " + buffer.getWidth() + "x" + buffer.getHeight());
	}

}
