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

/**
 * A single row of exported results, with values rounded for display.
 *
 * @param lane lane index
 * @param band band index within the lane
 * @param rawIntensity raw intensity, rounded to 2 decimal places
 * @param correctedIntensity corrected intensity, rounded to 2 decimal places
 * @param normalizedIntensity normalized intensity, rounded to 4 decimal places
 * @param foldChange fold change, rounded to 4 decimal places
 */
public record ExportRow(int lane, int band, double rawIntensity, double correctedIntensity, double normalizedIntensity, double foldChange) {

}
