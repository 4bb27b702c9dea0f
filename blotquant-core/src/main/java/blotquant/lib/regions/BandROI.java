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

package blotquant.lib.regions;

/**
 * Rectangular region bounding a single band within a lane.
 * <p>
 * Bounds are half-open, i.e. the region includes rows y0 to y1-1 and columns x0 to x1-1.
 * The horizontal extent is always that of the owning lane.
 *
 * @param laneIndex index of the lane containing the band
 * @param y0 first row of the band
 * @param y1 first row after the band (exclusive)
 * @param x0 first column, copied from the lane
 * @param x1 first column after the band (exclusive), copied from the lane
 */
public record BandROI(int laneIndex, int y0, int y1, int x0, int x1) {

	/**
	 * Constructor.
	 * @throws IllegalArgumentException if the lane index or bounds are invalid
	 */
	public BandROI {
		if (laneIndex < 0)
			throw new IllegalArgumentException("Lane index must be >= 0! Requested " + laneIndex);
		if (y0 < 0 || y1 <= y0)
			throw new IllegalArgumentException("Invalid band rows [" + y0 + ", " + y1 + ")");
		if (x0 < 0 || x1 <= x0)
			throw new IllegalArgumentException("Invalid band columns [" + x0 + ", " + x1 + ")");
	}

	/**
	 * Create a band spanning rows [y0, y1) of a lane.
	 * @param laneIndex
	 * @param lane
	 * @param y0
	 * @param y1
	 * @return
	 */
	public static BandROI createInstance(int laneIndex, Lane lane, int y0, int y1) {
		return new BandROI(laneIndex, y0, y1, lane.x0(), lane.x1());
	}

	/**
	 * Width of the rectangle, in pixels.
	 * @return
	 */
	public int getWidth() {
		return x1 - x0;
	}

	/**
	 * Height of the rectangle, in pixels.
	 * @return
	 */
	public int getHeight() {
		return y1 - y0;
	}

	/**
	 * Number of pixels inside the rectangle.
	 * @return
	 */
	public long getArea() {
		return (long)getWidth() * getHeight();
	}

}
