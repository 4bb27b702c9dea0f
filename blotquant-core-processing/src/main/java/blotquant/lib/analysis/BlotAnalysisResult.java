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

import blotquant.lib.images.PixelBuffer;
import blotquant.lib.io.ChartPoint;
import blotquant.lib.io.ExportRow;
import blotquant.lib.io.ResultsExport;
import blotquant.lib.measurements.BandIntensity;
import blotquant.lib.measurements.NormalizedResult;
import blotquant.lib.regions.BandROI;
import blotquant.lib.regions.Lane;

/**
 * The output of every stage of a blot analysis.
 * <p>
 * The geometry (lanes and bands) refers to the corrected image, and can be used to draw overlays.
 *
 * @param corrected the background-corrected image
 * @param lanes detected lanes, from left to right
 * @param bands detected bands, grouped by lane and ordered from top to bottom
 * @param intensities one measurement per band, in the same order as the bands
 * @param results normalized results, sorted by lane and then band index
 * @param exportRows rounded results, in the same order as the results
 * @param controlBand band index used as the loading control
 * @param controlLane lane used as the reference for fold changes
 */
public record BlotAnalysisResult(
		PixelBuffer corrected,
		List<Lane> lanes,
		List<BandROI> bands,
		List<BandIntensity> intensities,
		List<NormalizedResult> results,
		List<ExportRow> exportRows,
		int controlBand,
		int controlLane) {
	
	/**
	 * Constructor. Lists are copied, so that the result cannot be modified.
	 */
	public BlotAnalysisResult {
		lanes = List.copyOf(lanes);
		bands = List.copyOf(bands);
		intensities = List.copyOf(intensities);
		results = List.copyOf(results);
		exportRows = List.copyOf(exportRows);
	}
	
	/**
	 * Get the export rows as CSV.
	 * @return
	 * @see ResultsExport#toCSV(List)
	 */
	public String toCSV() {
		return ResultsExport.toCSV(exportRows);
	}
	
	/**
	 * Get the normalized intensity of a band in every lane.
	 * @param bandIndex
	 * @return
	 * @see ResultsExport#toChartData(List, int)
	 */
	public List<ChartPoint> getChartData(int bandIndex) {
		return ResultsExport.toChartData(results, bandIndex);
	}

}
