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

package blotquant.lib.measurements;

/**
 * Band intensity after normalization to a loading control.
 *
 * @param lane lane index
 * @param bandIndex position of the band within its lane, counting from the top
 * @param rawIntensity sum of all pixel values inside the band
 * @param correctedIntensity background-corrected intensity
 * @param normalizedIntensity corrected intensity divided by the loading control of the same lane
 * @param foldChange normalized intensity relative to the same band in the reference lane
 */
public record NormalizedResult(int lane, int bandIndex, double rawIntensity, double correctedIntensity,
		double normalizedIntensity, double foldChange) {

}
