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

package blotquant.lib.analysis.lanes;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import blotquant.lib.images.PixelBuffer;
import blotquant.lib.images.PixelBuffers;
import blotquant.lib.regions.Lane;

@SuppressWarnings("javadoc")
public class TestLaneSegmenter {
	
	/**
	 * 40x10 image with value 10, and columns 2-8, 12-18, 22-28 and 32-38 (inclusive) set to 200.
	 */
	private static PixelBuffer createSyntheticBlot() {
		int width = 40;
		int height = 10;
		double[] values = new double[width * height];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				boolean bright = x % 10 >= 2 && x % 10 <= 8;
				values[y * width + x] = bright ? 200 : 10;
			}
		}
		return PixelBuffer.wrap(values, width, height);
	}
	
	@Test
	public void test_verticalProjection() {
		var buffer = PixelBuffer.create(new double[] {1, 2, 3, 4, 5, 6}, 3, 2);
		assertArrayEquals(new double[] {5, 7, 9}, LaneSegmenter.verticalProjection(buffer));
	}
	
	@Test
	public void test_splitIntoEqualLanes() {
		assertEquals(
				List.of(new Lane(0, 25), new Lane(25, 50), new Lane(50, 75), new Lane(75, 100)),
				LaneSegmenter.splitIntoEqualLanes(100, 4));
		
		// Last lane absorbs the remainder
		assertEquals(
				List.of(new Lane(0, 3), new Lane(3, 6), new Lane(6, 10)),
				LaneSegmenter.splitIntoEqualLanes(10, 3));
		
		assertEquals(List.of(new Lane(0, 7)), LaneSegmenter.splitIntoEqualLanes(7, 1));
		
		assertThrows(IllegalArgumentException.class, () -> LaneSegmenter.splitIntoEqualLanes(10, 0));
		assertThrows(IllegalArgumentException.class, () -> LaneSegmenter.splitIntoEqualLanes(10, 11));
	}
	
	@Test
	public void test_detectLanes() {
		var buffer = createSyntheticBlot();
		
		// Smoothing narrows the lanes, since the edges are averaged with the dark gaps
		var expected = List.of(new Lane(3, 8), new Lane(13, 18), new Lane(23, 28), new Lane(33, 39));
		assertEquals(expected, LaneSegmenter.detectLanes(buffer));
		assertEquals(expected, LaneSegmenter.detectLanes(buffer, 4));
		
		// Without smoothing, the lanes should match the bright columns exactly
		assertEquals(
				List.of(new Lane(2, 9), new Lane(12, 19), new Lane(22, 29), new Lane(32, 39)),
				LaneSegmenter.detectLanes(buffer, null, 0));
	}
	
	@Test
	public void test_expectedCountMismatch() {
		var buffer = createSyntheticBlot();
		var lanes = LaneSegmenter.detectLanes(buffer, 5);
		assertEquals(LaneSegmenter.splitIntoEqualLanes(40, 5), lanes);
		
		// Uniform images contain no lanes
		var uniform = PixelBuffers.createFilled(100, 10, 128);
		assertEquals(5, LaneSegmenter.detectLanes(uniform, 5).size());
		assertEquals(new Lane(80, 100), LaneSegmenter.detectLanes(uniform, 5).get(4));
	}
	
	@Test
	public void test_noLanesFound() {
		var uniform = PixelBuffers.createFilled(100, 10, 128);
		assertEquals(LaneSegmenter.splitIntoEqualLanes(100, LaneSegmenter.DEFAULT_FALLBACK_LANE_COUNT), LaneSegmenter.detectLanes(uniform));
		
		// Narrow images can't hold 4 lanes
		var narrow = PixelBuffers.createFilled(3, 5, 1);
		assertEquals(List.of(new Lane(0, 1), new Lane(1, 2), new Lane(2, 3)), LaneSegmenter.detectLanes(narrow));
	}
	
	@Test
	public void test_expectedCountExceedsWidth() {
		// Too many lanes for the image: one lane per column rather than an exception
		var narrow = PixelBuffer.create(new double[] {1, 5, 1, 1, 5, 1}, 3, 2);
		assertEquals(List.of(new Lane(0, 1), new Lane(1, 2), new Lane(2, 3)), LaneSegmenter.detectLanes(narrow, 5));
		assertEquals(40, LaneSegmenter.detectLanes(createSyntheticBlot(), 41).size());
	}
	
	@Test
	public void test_invalidExpectedCount() {
		var buffer = createSyntheticBlot();
		assertThrows(IllegalArgumentException.class, () -> LaneSegmenter.detectLanes(buffer, 0));
		assertThrows(UnsupportedOperationException.class, () -> LaneSegmenter.detectLanes(buffer).clear());
	}

}
