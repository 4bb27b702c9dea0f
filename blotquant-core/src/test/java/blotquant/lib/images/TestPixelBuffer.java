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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestPixelBuffer {
	
	// 3x2, row-major
	private static final double[] VALUES = {1, 2, 3, 4, 5, 6};
	
	@Test
	public void test_shape() {
		var buffer = PixelBuffer.create(VALUES, 3, 2);
		assertEquals(3, buffer.getWidth());
		assertEquals(2, buffer.getHeight());
		assertEquals(6, buffer.size());
		assertEquals(2, buffer.getValue(1, 0));
		assertEquals(4, buffer.getValue(0, 1));
		assertEquals(6, buffer.getValue(5));
		assertArrayEquals(VALUES, buffer.getValues(false));
	}
	
	@Test
	public void test_invalidShape() {
		assertThrows(ShapeException.class, () -> PixelBuffer.create(VALUES, 2, 2));
		assertThrows(ShapeException.class, () -> PixelBuffer.create(VALUES, 6, 0));
		assertThrows(ShapeException.class, () -> PixelBuffer.create(new double[0], 0, 0));
		assertThrows(ShapeException.class, () -> PixelBuffer.wrap(null, 1, 1));
		// ShapeException should be usable anywhere an IllegalArgumentException is expected
		assertThrows(IllegalArgumentException.class, () -> PixelBuffer.wrap(VALUES, -3, -2));
	}
	
	@Test
	public void test_createCopies() {
		double[] values = VALUES.clone();
		var copied = PixelBuffer.create(values, 3, 2);
		var wrapped = PixelBuffer.wrap(values, 3, 2);
		values[0] = 100;
		assertEquals(1, copied.getValue(0, 0));
		assertEquals(100, wrapped.getValue(0, 0));
		
		assertSame(values, wrapped.getValues(true));
		assertNotSame(values, wrapped.getValues(false));
	}
	
	@Test
	public void test_outOfBounds() {
		var buffer = PixelBuffer.create(VALUES, 3, 2);
		assertThrows(IndexOutOfBoundsException.class, () -> buffer.getValue(3, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> buffer.getValue(0, 2));
		assertThrows(IndexOutOfBoundsException.class, () -> buffer.getValue(-1, 0));
	}
	
	@Test
	public void test_clampedValues() {
		var buffer = PixelBuffer.create(VALUES, 3, 2);
		// Inside
		assertEquals(5, buffer.getClampedValue(1, 1));
		// Outside, nearest edge pixel
		assertEquals(1, buffer.getClampedValue(-5, -5));
		assertEquals(3, buffer.getClampedValue(10, 0));
		assertEquals(4, buffer.getClampedValue(-1, 1));
		assertEquals(6, buffer.getClampedValue(3, 2));
		assertEquals(2, buffer.getClampedValue(1, -100));
	}
	
	@Test
	public void test_equality() {
		var buffer = PixelBuffer.create(VALUES, 3, 2);
		assertEquals(buffer, PixelBuffer.create(VALUES, 3, 2));
		assertEquals(buffer.hashCode(), PixelBuffer.create(VALUES, 3, 2).hashCode());
		assertNotEquals(buffer, PixelBuffer.create(VALUES, 2, 3));
		assertNotEquals(buffer, PixelBuffer.create(new double[] {1, 2, 3, 4, 5, 7}, 3, 2));
	}

}
