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
 * A vertical sample track in a blot image, defined by a half-open column range [x0, x1).
 * <p>
 * Lanes are ordered from left to right, and the position of a lane in that ordering is its identity
 * for all later processing.
 *
 * @param x0 first column inside the lane
 * @param x1 first column after the lane (exclusive)
 */
public record Lane(int x0, int x1) {

	/**
	 * Constructor.
	 * @throws IllegalArgumentException if x0 &lt; 0 or x1 &lt;= x0
	 */
	public Lane {
		if (x0 < 0)
			throw new IllegalArgumentException("Lane must start at x >= 0! Requested x0 = " + x0);
		if (x1 <= x0)
			throw new IllegalArgumentException("Lane must have x1 > x0! Requested [" + x0 + ", " + x1 + ")");
	}

	/**
	 * Number of columns in the lane.
	 * @return
	 */
	public int getWidth() {
		return x1 - x0;
	}

}
