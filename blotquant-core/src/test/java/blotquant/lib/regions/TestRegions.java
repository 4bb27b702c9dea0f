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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class TestRegions {

	@Test
	void testLane() {
		var lane = new Lane(25, 50);
		assertEquals(25, lane.getWidth());
		assertEquals(new Lane(25, 50), lane);
		
		assertThrows(IllegalArgumentException.class, () -> new Lane(-1, 5));
		assertThrows(IllegalArgumentException.class, () -> new Lane(5, 5));
		assertThrows(IllegalArgumentException.class, () -> new Lane(6, 5));
	}
	
	@Test
	void testBandROI() {
		var lane = new Lane(10, 20);
		var roi = BandROI.createInstance(2, lane, 5, 12);
		assertEquals(2, roi.laneIndex());
		assertEquals(10, roi.x0());
		assertEquals(20, roi.x1());
		assertEquals(10, roi.getWidth());
		assertEquals(7, roi.getHeight());
		assertEquals(70L, roi.getArea());
		
		assertThrows(IllegalArgumentException.class, () -> new BandROI(-1, 0, 1, 0, 1));
		assertThrows(IllegalArgumentException.class, () -> new BandROI(0, 3, 3, 0, 1));
		assertThrows(IllegalArgumentException.class, () -> new BandROI(0, -1, 3, 0, 1));
		assertThrows(IllegalArgumentException.class, () -> new BandROI(0, 0, 3, 4, 2));
	}
	
	@Test
	void testAreaOverflow() {
		var roi = new BandROI(0, 0, 100_000, 0, 100_000);
		assertEquals(10_000_000_000L, roi.getArea());
	}

}
