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
 * Create {@link PixelBuffer} instances from common inputs.
 */
public class PixelBuffers {

	private PixelBuffers() {
		throw new AssertionError();
	}

	/**
	 * Create a buffer with every pixel set to the same value.
	 * @param width
	 * @param height
	 * @param fill
	 * @return
	 */
	public static PixelBuffer createFilled(int width, int height, double fill) {
		if (width <= 0 || height <= 0)
			throw new ShapeException("Width and height must be > 0! Requested " + width + "x" + height);
		double[] values = new double[width * height];
		if (fill != 0)
			Arrays.fill(values, fill);
		return PixelBuffer.wrap(values, width, height);
	}

	/**
	 * Create a buffer from grayscale values stored in row-major order.
	 * @param values
	 * @param width
	 * @param height
	 * @return
	 * @throws ShapeException if values.length != width * height
	 */
	public static PixelBuffer fromArray(double[] values, int width, int height) throws ShapeException {
		return PixelBuffer.create(values, width, height);
	}

	/**
	 * Create a buffer from float grayscale values stored in row-major order.
	 * @param values
	 * @param width
	 * @param height
	 * @return
	 * @throws ShapeException if values.length != width * height
	 */
	public static PixelBuffer fromArray(float[] values, int width, int height) throws ShapeException {
		if (values == null)
			throw new ShapeException("Pixel array must not be null");
		double[] converted = new double[values.length];
		for (int i = 0; i < values.length; i++)
			converted[i] = values[i];
		return PixelBuffer.wrap(converted, width, height);
	}

	/**
	 * Convert packed (A)RGB pixels into a grayscale buffer using luminance weights
	 * 0.299*R + 0.587*G + 0.114*B. Any alpha component is ignored.
	 * @param rgb packed pixels, as returned by {@code BufferedImage.getRGB}
	 * @param width
	 * @param height
	 * @return
	 * @throws ShapeException if rgb.length != width * height
	 */
	public static PixelBuffer fromPackedRGB(int[] rgb, int width, int height) throws ShapeException {
		if (rgb == null)
			throw new ShapeException("Pixel array must not be null");
		double[] values = new double[rgb.length];
		for (int i = 0; i < rgb.length; i++) {
			int v = rgb[i];
			int r = (v >> 16) & 0xff;
			int g = (v >> 8) & 0xff;
			int b = v & 0xff;
			values[i] = 0.299 * r + 0.587 * g + 0.114 * b;
		}
		return PixelBuffer.wrap(values, width, height);
	}

}
