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

package blotquant.lib.analysis.bands;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import blotquant.lib.analysis.profiles.ProfileTools;
import blotquant.lib.analysis.stats.RunningStatistics;
import blotquant.lib.images.PixelBuffer;
import blotquant.lib.regions.BandROI;
import blotquant.lib.regions.Lane;

/**
 * Detect bands within lanes from the horizontal intensity profile of each lane.
 * <p>
 * For each lane, the pixels in every row are summed (using only the columns of the lane). 
 * Rows with a sum strictly above {@code mean + fraction * (max - mean)} of the lane profile are candidates, 
 * and every maximal run of candidate rows that is at least a minimum height becomes a band.
 * <p>
 * Note that this threshold is deliberately stricter than the one used for lanes, which is simply the mean.
 */
public class BandSegmenter {
	
	private static final Logger logger = LoggerFactory.getLogger(BandSegmenter.class);
	
	/**
	 * Default minimum band height, in pixels.
	 */
	public static final int DEFAULT_MIN_BAND_HEIGHT = 5;
	
	/**
	 * Default fraction of the distance between the profile mean and maximum used as the threshold.
	 */
	public static final double DEFAULT_THRESHOLD_FRACTION = 0.5;
	
	private BandSegmenter() {
		throw new AssertionError();
	}
	
	/**
	 * Detect bands using the default minimum height.
	 * @param buffer
	 * @param lanes
	 * @return
	 * @see #detectBands(PixelBuffer, List, int, double)
	 */
	public static List<BandROI> detectBands(PixelBuffer buffer, List<Lane> lanes) {
		return detectBands(buffer, lanes, DEFAULT_MIN_BAND_HEIGHT);
	}
	
	/**
	 * Detect bands with a specified minimum height.
	 * @param buffer
	 * @param lanes
	 * @param minBandHeight
	 * @return
	 * @see #detectBands(PixelBuffer, List, int, double)
	 */
	public static List<BandROI> detectBands(PixelBuffer buffer, List<Lane> lanes, int minBandHeight) {
		return detectBands(buffer, lanes, minBandHeight, DEFAULT_THRESHOLD_FRACTION);
	}

	/**
	 * Detect bands in every lane.
	 * <p>
	 * Lanes are processed in parallel, but the output is always grouped by lane (in lane order) with the 
	 * bands of each lane ordered from top to bottom.
	 * 
	 * @param buffer the (background-corrected) image
	 * @param lanes lanes, ordered from left to right
	 * @param minBandHeight minimum number of rows in a band
	 * @param thresholdFraction position of the threshold between the profile mean (0) and maximum (1)
	 * @return the detected bands
	 * @throws IllegalArgumentException if minBandHeight &lt; 1, or a lane extends beyond the image
	 */
	public static List<BandROI> detectBands(PixelBuffer buffer, List<Lane> lanes, int minBandHeight, double thresholdFraction) throws IllegalArgumentException {
		if (minBandHeight < 1)
			throw new IllegalArgumentException("Minimum band height must be >= 1, but was " + minBandHeight);
		for (var lane : lanes) {
			if (lane.x1() > buffer.getWidth())
				throw new IllegalArgumentException(lane + " extends beyond image width " + buffer.getWidth());
		}
		var bands = IntStream.range(0, lanes.size())
				.parallel()
				.mapToObj(i -> detectBandsInLane(buffer, i, lanes.get(i), minBandHeight, thresholdFraction))
				.flatMap(List::stream)
				.collect(Collectors.toUnmodifiableList());
		logger.debug("{} band(s) detected in {} lane(s)", bands.size(), lanes.size());
		return bands;
	}
	
	private static List<BandROI> detectBandsInLane(PixelBuffer buffer, int laneIndex, Lane lane, int minBandHeight, double thresholdFraction) {
		double[] profile = horizontalProfile(buffer, lane);
		double threshold = profileThreshold(profile, thresholdFraction);
		List<BandROI> bands = new ArrayList<>();
		for (var run : ProfileTools.findRunsAbove(profile, threshold, minBandHeight))
			bands.add(BandROI.createInstance(laneIndex, lane, run.start(), run.end()));
		logger.trace("Lane {}: threshold {}, {} band(s)", laneIndex, threshold, bands.size());
		return bands;
	}
	
	/**
	 * Compute the horizontal profile of a lane, i.e. the sum of the pixels in each row, 
	 * using only columns within the lane.
	 * @param buffer
	 * @param lane
	 * @return an array of length buffer.getHeight()
	 */
	public static double[] horizontalProfile(PixelBuffer buffer, Lane lane) {
		int width = buffer.getWidth();
		double[] values = buffer.getValues(true);
		double[] profile = new double[buffer.getHeight()];
		for (int y = 0; y < profile.length; y++) {
			double sum = 0;
			for (int x = lane.x0(); x < lane.x1(); x++)
				sum += values[y * width + x];
			profile[y] = sum;
		}
		return profile;
	}
	
	/**
	 * Compute the band detection threshold for a profile: mean + fraction * (max - mean).
	 * @param profile
	 * @param fraction
	 * @return
	 */
	static double profileThreshold(double[] profile, double fraction) {
		var stats = RunningStatistics.of(profile);
		double mean = stats.getMean();
		return mean + fraction * (stats.getMax() - mean);
	}

}
