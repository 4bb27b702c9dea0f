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

package blotquant.lib.analysis;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import blotquant.lib.analysis.background.BackgroundEstimator;
import blotquant.lib.analysis.bands.BandSegmenter;
import blotquant.lib.analysis.densitometry.IntensityMeasurer;
import blotquant.lib.analysis.lanes.LaneSegmenter;
import blotquant.lib.analysis.normalization.Normalizer;
import blotquant.lib.common.Timeit;
import blotquant.lib.images.PixelBuffer;
import blotquant.lib.io.ResultsExport;
import blotquant.lib.measurements.BandIntensity;
import blotquant.lib.plugins.parameters.ParameterList;
import blotquant.lib.regions.BandROI;
import blotquant.lib.regions.Lane;

/**
 * Run the complete densitometry workflow for a grayscale blot image:
 * <ol>
 *   <li>rolling ball background subtraction</li>
 *   <li>lane detection</li>
 *   <li>band detection within each lane</li>
 *   <li>band intensity measurement</li>
 *   <li>normalization to a loading control band</li>
 * </ol>
 * Parameters are provided as a {@link ParameterList}, which can be created with {@link #createParameterList()} 
 * and updated from a JSON argument string, e.g.
 * <pre>{@code 
 * var analysis = BlotAnalysis.create("{\"ballRadius\": 25, \"controlBand\": 1}");
 * var result = analysis.analyze(image);
 * String csv = result.toCSV();
 * }
 * </pre>
 */
public class BlotAnalysis {
	
	private static final Logger logger = LoggerFactory.getLogger(BlotAnalysis.class);
	
	/**
	 * Key for the rolling ball radius, in pixels.
	 */
	public static final String KEY_BALL_RADIUS = "ballRadius";
	
	/**
	 * Key for the expected number of lanes; 0 means the number of lanes is determined automatically.
	 */
	public static final String KEY_EXPECTED_LANES = "expectedLanes";
	
	/**
	 * Key for the half-width of the moving average applied to the lane projection.
	 */
	public static final String KEY_SMOOTHING_HALF_WIDTH = "smoothingHalfWidth";
	
	/**
	 * Key for the minimum band height, in pixels.
	 */
	public static final String KEY_MIN_BAND_HEIGHT = "minBandHeight";
	
	/**
	 * Key for the band threshold position between the profile mean and maximum.
	 */
	public static final String KEY_BAND_THRESHOLD_FRACTION = "bandThresholdFraction";
	
	/**
	 * Key for the band index of the loading control.
	 */
	public static final String KEY_CONTROL_BAND = "controlBand";
	
	/**
	 * Key for the lane used as the reference for fold changes.
	 */
	public static final String KEY_CONTROL_LANE = "controlLane";
	
	private final ParameterList params;
	
	private BlotAnalysis(ParameterList params) {
		this.params = params;
	}
	
	/**
	 * Create the default parameters for an analysis.
	 * @return a new parameter list
	 */
	public static ParameterList createParameterList() {
		return new ParameterList()
				.addIntParameter(KEY_BALL_RADIUS, "Rolling ball radius", BackgroundEstimator.DEFAULT_RADIUS, "px", 0, Integer.MAX_VALUE,
						"Radius of the ball used to estimate the background; should be larger than the largest band")
				.addIntParameter(KEY_EXPECTED_LANES, "Expected lanes", 0, null, 0, Integer.MAX_VALUE,
						"Number of lanes in the image, or 0 to detect lanes automatically. "
						+ "If the detected number differs, the image is divided into this many equal lanes")
				.addIntParameter(KEY_SMOOTHING_HALF_WIDTH, "Lane smoothing half-width", LaneSegmenter.DEFAULT_SMOOTHING_HALF_WIDTH, "px", 0, Integer.MAX_VALUE,
						"Half-width of the moving average applied to the column sums before detecting lanes")
				.addIntParameter(KEY_MIN_BAND_HEIGHT, "Minimum band height", BandSegmenter.DEFAULT_MIN_BAND_HEIGHT, "px", 1, Integer.MAX_VALUE,
						"Minimum number of rows in a band")
				.addDoubleParameter(KEY_BAND_THRESHOLD_FRACTION, "Band threshold", BandSegmenter.DEFAULT_THRESHOLD_FRACTION, null, 0, 1,
						"Position of the band threshold between the mean (0) and maximum (1) of each lane profile")
				.addIntParameter(KEY_CONTROL_BAND, "Loading control band", 0, null, 0, Integer.MAX_VALUE,
						"Index of the loading control band in each lane, counting from the top")
				.addIntParameter(KEY_CONTROL_LANE, "Reference lane", 0, null, 0, Integer.MAX_VALUE,
						"Index of the lane used as the reference for fold changes");
	}
	
	/**
	 * Create an analysis with default parameters.
	 * @return
	 */
	public static BlotAnalysis create() {
		return new BlotAnalysis(createParameterList());
	}
	
	/**
	 * Create an analysis with the specified parameters. The parameters are copied.
	 * @param params
	 * @return
	 */
	public static BlotAnalysis create(ParameterList params) {
		return new BlotAnalysis(params.duplicate());
	}
	
	/**
	 * Create an analysis from a JSON argument string, using defaults for any parameter that is not specified.
	 * @param args e.g. {@code {"ballRadius": 25, "expectedLanes": 6}}
	 * @return
	 * @throws com.google.gson.JsonSyntaxException if the argument string is not valid JSON
	 */
	public static BlotAnalysis create(String args) {
		var params = createParameterList();
		ParameterList.updateParameterList(params, args);
		return new BlotAnalysis(params);
	}
	
	/**
	 * Get a copy of the parameters used by this analysis.
	 * @return
	 */
	public ParameterList getParameters() {
		return params.duplicate();
	}
	
	/**
	 * Run every stage of the analysis.
	 * @param image the grayscale input image
	 * @return
	 */
	public BlotAnalysisResult analyze(PixelBuffer image) {
		int radius = params.getIntParameterValue(KEY_BALL_RADIUS);
		int expectedLanes = params.getIntParameterValue(KEY_EXPECTED_LANES);
		int smoothing = params.getIntParameterValue(KEY_SMOOTHING_HALF_WIDTH);
		int minBandHeight = params.getIntParameterValue(KEY_MIN_BAND_HEIGHT);
		double bandThreshold = params.getDoubleParameterValue(KEY_BAND_THRESHOLD_FRACTION);
		int controlBand = params.getIntParameterValue(KEY_CONTROL_BAND);
		int controlLane = params.getIntParameterValue(KEY_CONTROL_LANE);
		
		logger.info("Analyzing {} with {}", image, params);
		var timeit = new Timeit();
		
		timeit.checkpoint("Background subtraction");
		var corrected = BackgroundEstimator.subtractBackground(image, radius);
		
		timeit.checkpoint("Lane detection");
		var lanes = LaneSegmenter.detectLanes(corrected, expectedLanes > 0 ? expectedLanes : null, smoothing);
		
		timeit.checkpoint("Band detection");
		var bands = BandSegmenter.detectBands(corrected, lanes, minBandHeight, bandThreshold);
		
		timeit.checkpoint("Measurement");
		var intensities = IntensityMeasurer.measureBands(corrected, bands);
		
		timeit.checkpoint("Normalization");
		var result = normalize(corrected, lanes, bands, intensities, controlBand, controlLane);
		
		timeit.stop();
		logger.info("Found {} lane(s) and {} band(s)", lanes.size(), bands.size());
		logger.debug("Analysis timing:\n{}", timeit);
		return result;
	}
	
	/**
	 * Recompute the normalization of a previous result with a different loading control or reference lane.
	 * <p>
	 * Lanes, bands and intensities are reused unchanged.
	 * 
	 * @param previous
	 * @param controlBand
	 * @param controlLane
	 * @return
	 */
	public static BlotAnalysisResult renormalize(BlotAnalysisResult previous, int controlBand, int controlLane) {
		logger.debug("Renormalizing with control band {} and reference lane {}", controlBand, controlLane);
		return normalize(previous.corrected(), previous.lanes(), previous.bands(), previous.intensities(), controlBand, controlLane);
	}
	
	private static BlotAnalysisResult normalize(PixelBuffer corrected, List<Lane> lanes, List<BandROI> bands, 
			List<BandIntensity> intensities, int controlBand, int controlLane) {
		var results = Normalizer.normalize(intensities, controlBand, controlLane);
		var rows = ResultsExport.toExportRows(results);
		return new BlotAnalysisResult(corrected, lanes, bands, intensities, results, rows, controlBand, controlLane);
	}

}
