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

package blotquant.lib.io;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import blotquant.lib.common.GeneralTools;
import blotquant.lib.measurements.NormalizedResult;

/**
 * Convert normalized results into rows, CSV, JSON and chart data for export.
 * <p>
 * Numbers in CSV output are written in plain decimal notation without trailing zeros, 
 * e.g. {@code 1000}, {@code 2.5} or {@code 0.0001}, and always use '.' as the decimal separator.
 */
public class ResultsExport {
	
	/**
	 * Header line used for CSV export.
	 */
	public static final String CSV_HEADER = "Lane,Band,RawIntensity,CorrectedIntensity,NormalizedIntensity,FoldChange";
	
	/**
	 * Decimal places used for raw and corrected intensities.
	 */
	public static final int INTENSITY_DECIMAL_PLACES = 2;
	
	/**
	 * Decimal places used for normalized intensities and fold changes.
	 */
	public static final int RATIO_DECIMAL_PLACES = 4;
	
	private static final String DELIMITER = ",";
	
	private ResultsExport() {
		throw new AssertionError();
	}
	
	/**
	 * Convert results to export rows, rounding values for display.
	 * @param results
	 * @return rows in the same order as the results
	 */
	public static List<ExportRow> toExportRows(List<NormalizedResult> results) {
		List<ExportRow> rows = new ArrayList<>(results.size());
		for (var r : results) {
			rows.add(new ExportRow(
					r.lane(),
					r.bandIndex(),
					GeneralTools.roundToDecimalPlaces(r.rawIntensity(), INTENSITY_DECIMAL_PLACES),
					GeneralTools.roundToDecimalPlaces(r.correctedIntensity(), INTENSITY_DECIMAL_PLACES),
					GeneralTools.roundToDecimalPlaces(r.normalizedIntensity(), RATIO_DECIMAL_PLACES),
					GeneralTools.roundToDecimalPlaces(r.foldChange(), RATIO_DECIMAL_PLACES)));
		}
		return List.copyOf(rows);
	}
	
	/**
	 * Create a CSV String from export rows.
	 * <p>
	 * The output begins with {@link #CSV_HEADER} and contains one line per row. 
	 * Lines are separated by '\n', with no trailing newline.
	 * 
	 * @param rows
	 * @return
	 */
	public static String toCSV(List<ExportRow> rows) {
		List<String> lines = new ArrayList<>(rows.size() + 1);
		lines.add(CSV_HEADER);
		for (var row : rows) {
			lines.add(String.join(DELIMITER,
					Integer.toString(row.lane()),
					Integer.toString(row.band()),
					GeneralTools.toPlainString(row.rawIntensity()),
					GeneralTools.toPlainString(row.correctedIntensity()),
					GeneralTools.toPlainString(row.normalizedIntensity()),
					GeneralTools.toPlainString(row.foldChange())));
		}
		return String.join("\n", lines);
	}
	
	/**
	 * Create a JSON array from export rows.
	 * @param rows
	 * @param pretty if true, use pretty printing
	 * @return
	 */
	public static String toJson(List<ExportRow> rows, boolean pretty) {
		return GsonTools.getInstance(pretty).toJson(rows);
	}
	
	/**
	 * Extract the normalized intensity of one band in every lane, e.g. to plot as a bar chart.
	 * @param results
	 * @param bandIndex
	 * @return one point per result with the specified band index, in result order
	 */
	public static List<ChartPoint> toChartData(List<NormalizedResult> results, int bandIndex) {
		return results.stream()
				.filter(r -> r.bandIndex() == bandIndex)
				.map(r -> new ChartPoint(r.lane(), r.normalizedIntensity()))
				.collect(Collectors.toUnmodifiableList());
	}

}
