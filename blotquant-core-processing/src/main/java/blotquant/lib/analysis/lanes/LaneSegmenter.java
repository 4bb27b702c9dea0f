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

package blotquant.lib.analysis.lanes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import blotquant.lib.analysis.profiles.ProfileTools;
import blotquant.lib.analysis.stats.RunningStatistics;
import blotquant.lib.images.PixelBuffer;
import blotquant.lib.regions.Lane;

/**
 * Detect lanes in a (background-corrected) blot image from its vertical intensity projection.
 * <p>
 * Columns are summed, the resulting projection is smoothed with a moving average, and every maximal 
 * run of columns with a smoothed value strictly above the mean of the smoothed projection becomes a lane.
 * <p>
 * If the detection fails to match an expected lane count (or finds nothing), the image is instead divided 
 * into equal-width lanes. This is a recovery policy rather than an error: a warning is logged, but no exception is thrown.
 */
public class LaneSegmenter {
	
	private static final Logger logger = LoggerFactory.getLogger(LaneSegmenter.class);
	
	/**
	 * Number of equal-width lanes created when no lanes are found and no lane count is expected.
	 */
	public static final int DEFAULT_FALLBACK_LANE_COUNT = 4;
	
	/**
	 * Default half-width of the moving average applied to the projection (giving a window of 5 columns).
	 */
	public static final int DEFAULT_SMOOTHING_HALF_WIDTH = 2;
	
	private LaneSegmenter() {
		throw new AssertionError();
	}
	
	/**
	 * Detect lanes automatically, without any expected lane count.
	 * @param buffer
	 * @return lanes ordered from left to right
	 * @see #detectLanes(PixelBuffer, Integer)
	 */
	public static List<Lane> detectLanes(PixelBuffer buffer) {
		return detectLanes(buffer, null);
	}

	/**
	 * Detect lanes, falling back to equal-width lanes if the detection does not give the expected number.
	 * @param buffer
	 * @param expectedCount the expected number of lanes, or null if unknown
	 * @return lanes ordered from left to right
	 * @throws IllegalArgumentException if expectedCount is not null and &lt; 1
	 */
	public static List<Lane> detectLanes(PixelBuffer buffer, Integer expectedCount) throws IllegalArgumentException {
		return detectLanes(buffer, expectedCount, DEFAULT_SMOOTHING_HALF_WIDTH);
	}
	
	/**
	 * Detect lanes using a specified amount of smoothing for the projection.
	 * <ul>
	 *   <li>If expectedCount is given and the number of detected lanes differs from it, the detected lanes are 
	 *   discarded and expectedCount equal-width lanes are returned. If expectedCount exceeds the image width, 
	 *   one lane is returned per column instead.</li>
	 *   <li>If expectedCount is null and no lanes are detected, {@link #DEFAULT_FALLBACK_LANE_COUNT} equal-width lanes are returned.</li>
	 * </ul>
	 * 
	 * @param buffer
	 * @param expectedCount the expected number of lanes, or null if unknown
	 * @param smoothingHalfWidth half-width of the moving average applied to the projection
	 * @return lanes ordered from left to right
	 * @throws IllegalArgumentException if expectedCount is not null and &lt; 1
	 * @see #splitIntoEqualLanes(int, int)
	 */
	public static List<Lane> detectLanes(PixelBuffer buffer, Integer expectedCount, int smoothingHalfWidth) throws IllegalArgumentException {
		if (expectedCount != null && expectedCount < 1)
			throw new IllegalArgumentException("Expected lane count must be >= 1, but was " + expectedCount);
		
		double[] smoothed = ProfileTools.smooth(verticalProjection(buffer), smoothingHalfWidth);
		double threshold = RunningStatistics.of(smoothed).getMean();
		
		List<Lane> lanes = new ArrayList<>();
		for (var run : ProfileTools.findRunsAbove(smoothed, threshold, 1))
			lanes.add(new Lane(run.start(), run.end()));
		logger.debug("Lane threshold {}, {} lane(s) detected", threshold, lanes.size());
		
		if (expectedCount != null && lanes.size() != expectedCount) {
			// Lanes must be at least one column wide
			int count = Math.min(expectedCount, buffer.getWidth());
			logger.warn("Detected {} lane(s) but expected {} - using {} equal-width lanes instead", lanes.size(), expectedCount, count);
			return splitIntoEqualLanes(buffer.getWidth(), count);
		}
		if (lanes.isEmpty()) {
			// Very narrow images can't hold the default number of lanes
			int count = Math.min(DEFAULT_FALLBACK_LANE_COUNT, buffer.getWidth());
			logger.warn("No lanes detected - using {} equal-width lanes instead", count);
			return splitIntoEqualLanes(buffer.getWidth(), count);
		}
		return Collections.unmodifiableList(lanes);
	}
	
	/**
	 * Compute the vertical projection of an image, i.e. the sum of the pixels in each column.
	 * @param buffer
	 * @return an array of length buffer.getWidth()
	 */
	public static double[] verticalProjection(PixelBuffer buffer) {
		int width = buffer.getWidth();
		int height = buffer.getHeight();
		double[] values = buffer.getValues(true);
		double[] projection = new double[width];
		for (int x = 0; x < width; x++) {
			double sum = 0;
			for (int y = 0; y < height; y++)
				sum += values[y * width + x];
			projection[x] = sum;
		}
		return projection;
	}
	
	/**
	 * Divide an image into lanes of equal width.
	 * <p>
	 * Lane widths are computed using integer division; the last lane absorbs any remainder so that 
	 * the full width is always covered.
	 * 
	 * @param width the image width
	 * @param count number of lanes
	 * @return lanes ordered from left to right
	 * @throws IllegalArgumentException if count &lt; 1 or count &gt; width
	 */
	public static List<Lane> splitIntoEqualLanes(int width, int count) throws IllegalArgumentException {
		if (count < 1 || count > width)
			throw new IllegalArgumentException("Cannot split width " + width + " into " + count + " lanes");
		int laneWidth = width / count;
		List<Lane> lanes = new ArrayList<>(count);
		for (int i = 0; i < count - 1; i++)
			lanes.add(new Lane(i * laneWidth, (i + 1) * laneWidth));
		lanes.add(new Lane((count - 1) * laneWidth, width));
		return Collections.unmodifiableList(lanes);
	}

}
