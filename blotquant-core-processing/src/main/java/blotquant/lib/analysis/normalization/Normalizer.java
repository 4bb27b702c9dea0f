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

package blotquant.lib.analysis.normalization;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import blotquant.lib.common.LogTools;
import blotquant.lib.measurements.BandIntensity;
import blotquant.lib.measurements.NormalizedResult;

/**
 * Normalize band intensities to a loading control, and compute fold changes relative to a reference lane.
 * <p>
 * The loading control is identified by its band index, which is assumed to refer to the same protein in every lane.
 * Division by zero is never an error:
 * <ul>
 *   <li>if a lane has no control band, its intensities are divided by 1 (i.e. passed through unchanged);</li>
 *   <li>if a lane's control band has an intensity of 0, all normalized intensities for the lane are 0;</li>
 *   <li>if the reference lane has no band with a given index, fold changes for that band are computed relative to 1;</li>
 *   <li>if the reference value is 0, the fold change is 0.</li>
 * </ul>
 */
public class Normalizer {
	
	private static final Logger logger = LoggerFactory.getLogger(Normalizer.class);
	
	private static final Comparator<NormalizedResult> RESULT_ORDER = 
			Comparator.comparingInt(NormalizedResult::lane).thenComparingInt(NormalizedResult::bandIndex);
	
	private Normalizer() {
		throw new AssertionError();
	}
	
	/**
	 * Normalize intensities, using lane 0 as the reference for fold changes.
	 * @param intensities
	 * @param controlBandIndex
	 * @return
	 * @see #normalize(List, int, int)
	 */
	public static List<NormalizedResult> normalize(List<BandIntensity> intensities, int controlBandIndex) {
		return normalize(intensities, controlBandIndex, 0);
	}
	
	/**
	 * Normalize intensities to a loading control band, and compute fold changes relative to a reference lane.
	 * 
	 * @param intensities measured band intensities
	 * @param controlBandIndex band index of the loading control
	 * @param controlLane lane used as the reference for fold changes
	 * @return one result per input measurement, sorted by lane and then band index
	 * @throws IllegalArgumentException if controlBandIndex or controlLane is negative
	 */
	public static List<NormalizedResult> normalize(List<BandIntensity> intensities, int controlBandIndex, int controlLane) throws IllegalArgumentException {
		if (controlBandIndex < 0)
			throw new IllegalArgumentException("Control band index must be >= 0, but was " + controlBandIndex);
		if (controlLane < 0)
			throw new IllegalArgumentException("Control lane must be >= 0, but was " + controlLane);
		
		checkBandCounts(intensities);
		
		Map<Integer, Double> controlIntensities = new HashMap<>();
		for (var b : intensities) {
			if (b.bandIndex() == controlBandIndex)
				controlIntensities.put(b.lane(), b.correctedIntensity());
		}
		
		double[] normalized = new double[intensities.size()];
		Map<Integer, Double> reference = new HashMap<>();
		for (int i = 0; i < intensities.size(); i++) {
			var b = intensities.get(i);
			Double control = controlIntensities.get(b.lane());
			if (control == null) {
				logger.debug("No control band {} in lane {} - intensities will not be normalized", controlBandIndex, b.lane());
				control = 1.0;
			} else if (!(control > 0) && b.bandIndex() == controlBandIndex) {
				logger.warn("Control band {} in lane {} has intensity {} - normalized values for the lane will be 0", controlBandIndex, b.lane(), control);
			}
			double value = control > 0 ? b.correctedIntensity() / control : 0;
			normalized[i] = value;
			if (b.lane() == controlLane)
				reference.put(b.bandIndex(), value);
		}
		
		List<NormalizedResult> results = new ArrayList<>(intensities.size());
		for (int i = 0; i < intensities.size(); i++) {
			var b = intensities.get(i);
			double value = normalized[i];
			double ref = reference.getOrDefault(b.bandIndex(), 1.0);
			double foldChange = ref > 0 ? value / ref : 0;
			results.add(new NormalizedResult(b.lane(), b.bandIndex(), b.rawIntensity(), b.correctedIntensity(), value, foldChange));
		}
		// Sort is stable, so duplicate lane/band pairs keep their input order
		results.sort(RESULT_ORDER);
		return List.copyOf(results);
	}
	
	private static void checkBandCounts(List<BandIntensity> intensities) {
		var counts = intensities.stream()
				.collect(Collectors.groupingBy(BandIntensity::lane, Collectors.counting()));
		if (counts.values().stream().distinct().count() > 1)
			LogTools.warnOnce(logger, "Lanes contain different numbers of bands " + counts + " - band indices may not refer to the same protein in every lane");
	}

}
