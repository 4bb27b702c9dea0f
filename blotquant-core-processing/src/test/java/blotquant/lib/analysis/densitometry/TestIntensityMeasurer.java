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

package blotquant.lib.analysis.densitometry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Random;

import org.apache.commons.math3.stat.StatUtils;
import org.junit.jupiter.api.Test;

import blotquant.lib.images.PixelBuffer;
import blotquant.lib.measurements.BandIntensity;
import blotquant.lib.regions.BandROI;

class TestIntensityMeasurer {
	
	/**
	 * 3x3 image with a constant border and a different center value.
	 */
	private static PixelBuffer createCentered(double border, double center) {
		return PixelBuffer.create(new double[] {
				border, border, border,
				border, center, border,
				border, border, border
		}, 3, 3);
	}

	@Test
	void testIntegratedIntensity() {
		var buffer = PixelBuffer.create(new double[] {1, 2, 3, 4, 5, 6, 7, 8, 9}, 3, 3);
		assertEquals(12, IntensityMeasurer.integratedIntensity(buffer, new BandROI(0, 0, 2, 0, 2)));
		assertEquals(45, IntensityMeasurer.integratedIntensity(buffer, new BandROI(0, 0, 3, 0, 3)));
		assertEquals(6, IntensityMeasurer.integratedIntensity(buffer, new BandROI(0, 1, 2, 2, 3)));
	}
	
	@Test
	void testIntegratedIntensityRandom() {
		var random = new Random(7);
		int width = 25;
		int height = 18;
		double[] values = new double[width * height];
		for (int i = 0; i < values.length; i++)
			values[i] = random.nextDouble() * 1000;
		var buffer = PixelBuffer.wrap(values, width, height);
		var roi = new BandROI(0, 4, 15, 3, 21);
		
		double[] inside = new double[(int)roi.getArea()];
		int ind = 0;
		for (int y = roi.y0(); y < roi.y1(); y++) {
			for (int x = roi.x0(); x < roi.x1(); x++)
				inside[ind++] = values[y * width + x];
		}
		assertEquals(StatUtils.sum(inside), IntensityMeasurer.integratedIntensity(buffer, roi), 1e-6);
	}
	
	@Test
	void testBorderBackground() {
		var buffer = createCentered(10, 100);
		assertEquals(10, IntensityMeasurer.borderBackground(buffer, new BandROI(0, 0, 3, 0, 3)));
		
		// Single row or column: every pixel is on the border, and counted once
		var row = PixelBuffer.create(new double[] {1, 2, 3, 4, 5, 6}, 3, 2);
		assertEquals(2, IntensityMeasurer.borderBackground(row, new BandROI(0, 0, 1, 0, 3)));
		assertEquals(2.5, IntensityMeasurer.borderBackground(row, new BandROI(0, 0, 2, 0, 1)));
		assertEquals(5, IntensityMeasurer.borderBackground(row, new BandROI(0, 1, 2, 1, 2)));
		
		// 2x2: all four pixels once each
		assertEquals(3, IntensityMeasurer.borderBackground(row, new BandROI(0, 0, 2, 0, 2)));
	}
	
	@Test
	void testMeasureBands() {
		var buffer = createCentered(5, 50);
		var measurements = IntensityMeasurer.measureBands(buffer, List.of(new BandROI(0, 0, 3, 0, 3)));
		assertEquals(List.of(new BandIntensity(0, 0, 90, 5, 45)), measurements);
	}
	
	@Test
	void testCorrectedNeverNegative() {
		// Center darker than the border
		var buffer = createCentered(100, 0);
		var measurement = IntensityMeasurer.measureBands(buffer, List.of(new BandROI(0, 0, 3, 0, 3))).get(0);
		assertEquals(800, measurement.rawIntensity());
		assertEquals(100, measurement.backgroundPerPixel());
		assertEquals(0, measurement.correctedIntensity());
	}
	
	@Test
	void testBandIndices() {
		var buffer = PixelBuffer.create(new double[40 * 20], 40, 20);
		var rois = List.of(
				new BandROI(0, 2, 5, 0, 10),
				new BandROI(1, 2, 5, 10, 20),
				new BandROI(0, 8, 12, 0, 10),
				new BandROI(2, 1, 3, 20, 30),
				new BandROI(0, 15, 18, 0, 10));
		var measurements = IntensityMeasurer.measureBands(buffer, rois);
		assertEquals(5, measurements.size());
		int[] expectedLanes = {0, 1, 0, 2, 0};
		int[] expectedIndices = {0, 0, 1, 0, 2};
		for (int i = 0; i < measurements.size(); i++) {
			assertEquals(expectedLanes[i], measurements.get(i).lane());
			assertEquals(expectedIndices[i], measurements.get(i).bandIndex());
		}
		assertEquals(List.of(), IntensityMeasurer.measureBands(buffer, List.of()));
	}
	
	@Test
	void testOutsideImage() {
		var buffer = createCentered(1, 1);
		assertThrows(IllegalArgumentException.class, () -> IntensityMeasurer.measureBands(buffer, List.of(new BandROI(0, 0, 4, 0, 3))));
		assertThrows(IllegalArgumentException.class, () -> IntensityMeasurer.integratedIntensity(buffer, new BandROI(0, 0, 3, 1, 4)));
	}

}
