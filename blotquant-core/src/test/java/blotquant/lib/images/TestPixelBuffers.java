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

package blotquant.lib.images;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestPixelBuffers {
	
	@Test
	public void test_createFilled() {
		var buffer = PixelBuffers.createFilled(4, 3, 128);
		assertEquals(12, buffer.size());
		for (double v : buffer.getValues(true))
			assertEquals(128, v);
		
		for (double v : PixelBuffers.createFilled(2, 2, 0).getValues(true))
			assertEquals(0, v);
		
		assertThrows(ShapeException.class, () -> PixelBuffers.createFilled(0, 3, 1));
	}
	
	@Test
	public void test_fromFloatArray() {
		var buffer = PixelBuffers.fromArray(new float[] {0.5f, 1.5f, 2.5f, 3.5f}, 2, 2);
		assertEquals(0.5, buffer.getValue(0, 0));
		assertEquals(3.5, buffer.getValue(1, 1));
		assertThrows(ShapeException.class, () -> PixelBuffers.fromArray(new float[3], 2, 2));
	}
	
	@Test
	public void test_fromPackedRGB() {
		int[] rgb = {
				0xFF0000, 0x00FF00, 
				0x0000FF, 0xFFFFFF
		};
		var buffer = PixelBuffers.fromPackedRGB(rgb, 2, 2);
		assertEquals(0.299 * 255, buffer.getValue(0, 0), 1e-9);
		assertEquals(0.587 * 255, buffer.getValue(1, 0), 1e-9);
		assertEquals(0.114 * 255, buffer.getValue(0, 1), 1e-9);
		assertEquals(255, buffer.getValue(1, 1), 1e-9);
		
		// Alpha is ignored
		var withAlpha = PixelBuffers.fromPackedRGB(new int[] {0x80FF0000}, 1, 1);
		assertEquals(buffer.getValue(0, 0), withAlpha.getValue(0, 0));
		
		assertThrows(ShapeException.class, () -> PixelBuffers.fromPackedRGB(rgb, 3, 1));
	}

}
