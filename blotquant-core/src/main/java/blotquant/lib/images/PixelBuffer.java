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

import java.util.Arrays;

/**
 * A dense, single-channel 2D image with pixels stored as doubles in row-major order.
 * <p>
 * Values are not restricted to any particular range: intermediate results (e.g. after morphological erosion)
 * may be negative or exceed the range of the original image.
 * <p>
 * Instances are never modified after creation; processing steps create new buffers.
 *
 * @see PixelBuffers
 */
public final class PixelBuffer {

	private final int width;
	private final int height;
	private final double[] values;

	private PixelBuffer(final int width, final int height, final double[] values) {
		this.width = width;
		this.height = height;
		this.values = values;
	}

	/**
	 * Create a buffer from a copy of the specified row-major values.
	 * @param values
	 * @param width
	 * @param height
	 * @return
	 * @throws ShapeException if the dimensions are not positive, or the array length is not width * height
	 */
	public static PixelBuffer create(final double[] values, final int width, final int height) throws ShapeException {
		checkShape(values, width, height);
		return new PixelBuffer(width, height, values.clone());
	}

	/**
	 * Create a buffer that uses the specified array directly, without copying.
	 * <p>
	 * The caller must not modify the array after this method is called.
	 * @param values
	 * @param width
	 * @param height
	 * @return
	 * @throws ShapeException if the dimensions are not positive, or the array length is not width * height
	 */
	public static PixelBuffer wrap(final double[] values, final int width, final int height) throws ShapeException {
		checkShape(values, width, height);
		return new PixelBuffer(width, height, values);
	}

	private static void checkShape(final double[] values, final int width, final int height) {
		if (width <= 0 || height <= 0)
			throw new ShapeException("Width and height must be > 0! Requested " + width + "x" + height);
		if (values == null)
			throw new ShapeException("Pixel array must not be null");
		if ((long)width * height != values.length)
			throw new ShapeException("Array length " + values.length + " does not match " + width + "x" + height);
	}

	/**
	 * Image width, in pixels.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Image height, in pixels.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Total number of pixels (width * height).
	 * @return
	 */
	public int size() {
		return values.length;
	}

	/**
	 * Get the value of a pixel inside the image.
	 * @param x
	 * @param y
	 * @return
	 * @throws IndexOutOfBoundsException if x or y fall outside the image
	 */
	public double getValue(final int x, final int y) throws IndexOutOfBoundsException {
		if (x < 0 || x >= width || y < 0 || y >= height)
			throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") is outside image of size " + width + "x" + height);
		return values[y * width + x];
	}

	/**
	 * Get a pixel value, using the nearest pixel inside the image for coordinates that fall outside it.
	 * <p>
	 * This is the only border policy used for neighborhood operations: outside pixels are never treated as zero.
	 * @param x
	 * @param y
	 * @return
	 */
	public double getClampedValue(final int x, final int y) {
		int cx = x < 0 ? 0 : (x >= width ? width - 1 : x);
		int cy = y < 0 ? 0 : (y >= height ? height - 1 : y);
		return values[cy * width + cx];
	}

	/**
	 * Get the value at a row-major index.
	 * @param index
	 * @return
	 */
	public double getValue(final int index) {
		return values[index];
	}

	/**
	 * Request the row-major pixel array.
	 * @param direct if true, return the internal array. The caller should <i>not</i> modify this.
	 * @return
	 */
	public double[] getValues(final boolean direct) {
		return direct ? values : values.clone();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof PixelBuffer))
			return false;
		PixelBuffer other = (PixelBuffer)obj;
		return width == other.width && height == other.height && Arrays.equals(values, other.values);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * width + height) + Arrays.hashCode(values);
	}

	@Override
	public String toString() {
		return "PixelBuffer: w=" + width + ", h=" + height;
	}

}
