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

package blotquant.lib.analysis.background;

import java.util.Arrays;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import blotquant.lib.images.PixelBuffer;

/**
 * Rolling ball background estimation and subtraction.
 * <p>
 * The background is estimated by a grayscale morphological opening (erosion followed by dilation) 
 * using a spherical structuring element, i.e. the surface traced by the top of a ball rolled beneath the 
 * intensity landscape. Structures narrower than the ball cannot be reached by it, and are removed from the 
 * background.
 * <p>
 * Pixels outside the image are handled by reusing the nearest pixel inside it 
 * (see {@link PixelBuffer#getClampedValue(int, int)}), so any radius can be used regardless of the image size.
 * <p>
 * The computation requires O(width * height * radius<sup>2</sup>) operations. 
 * Rows are processed in parallel; the result does not depend on the number of threads.
 */
public class BackgroundEstimator {
	
	private static final Logger logger = LoggerFactory.getLogger(BackgroundEstimator.class);
	
	/**
	 * Default ball radius, in pixels.
	 */
	public static final int DEFAULT_RADIUS = 50;
	
	private BackgroundEstimator() {
		throw new AssertionError();
	}
	
	/**
	 * Estimate the background of an image by rolling a ball of the specified radius beneath it.
	 * <p>
	 * A radius of 0 gives a background identical to the input.
	 * 
	 * @param buffer the input image
	 * @param radius ball radius, in pixels
	 * @return a new buffer containing the background
	 * @throws IllegalArgumentException if the radius is negative
	 */
	public static PixelBuffer estimateBackground(PixelBuffer buffer, int radius) throws IllegalArgumentException {
		var ball = Ball.create(radius);
		logger.debug("Estimating background for {} with ball radius {} ({} kernel offsets)", buffer, radius, ball.size());
		var eroded = PixelBuffer.wrap(filter(buffer, ball, true), buffer.getWidth(), buffer.getHeight());
		return PixelBuffer.wrap(filter(eroded, ball, false), buffer.getWidth(), buffer.getHeight());
	}
	
	/**
	 * Subtract the rolling ball background from an image.
	 * <p>
	 * Values in the result are clipped so that they are never negative.
	 * 
	 * @param buffer the input image
	 * @param radius ball radius, in pixels
	 * @return a new buffer containing max(0, original - background) for every pixel
	 * @throws IllegalArgumentException if the radius is negative
	 * @see #estimateBackground(PixelBuffer, int)
	 */
	public static PixelBuffer subtractBackground(PixelBuffer buffer, int radius) throws IllegalArgumentException {
		var background = estimateBackground(buffer, radius);
		double[] original = buffer.getValues(true);
		double[] bg = background.getValues(true);
		double[] result = new double[original.length];
		for (int i = 0; i < result.length; i++)
			result[i] = Math.max(0, original[i] - bg[i]);
		return PixelBuffer.wrap(result, buffer.getWidth(), buffer.getHeight());
	}
	
	/**
	 * Apply an erosion (minimum of pixel minus ball height) or dilation (maximum of pixel plus ball height).
	 */
	private static double[] filter(PixelBuffer buffer, Ball ball, boolean erode) {
		int width = buffer.getWidth();
		int height = buffer.getHeight();
		int n = ball.size();
		int[] dx = ball.dx;
		int[] dy = ball.dy;
		double[] heights = ball.heights;
		double[] output = new double[width * height];
		IntStream.range(0, height).parallel().forEach(y -> {
			int offset = y * width;
			for (int x = 0; x < width; x++) {
				double val;
				if (erode) {
					val = Double.POSITIVE_INFINITY;
					for (int k = 0; k < n; k++)
						val = Math.min(val, buffer.getClampedValue(x + dx[k], y + dy[k]) - heights[k]);
				} else {
					val = Double.NEGATIVE_INFINITY;
					for (int k = 0; k < n; k++)
						val = Math.max(val, buffer.getClampedValue(x + dx[k], y + dy[k]) + heights[k]);
				}
				output[offset + x] = val;
			}
		});
		return output;
	}
	
	
	/**
	 * Spherical structuring element, stored as a list of the offsets within the radius and their heights.
	 * <p>
	 * Offsets with dx<sup>2</sup> + dy<sup>2</sup> &gt; r<sup>2</sup> are excluded; offsets exactly on the 
	 * radius are included with a height of 0.
	 */
	static class Ball {
		
		private final int[] dx;
		private final int[] dy;
		private final double[] heights;
		
		private Ball(int[] dx, int[] dy, double[] heights) {
			this.dx = dx;
			this.dy = dy;
			this.heights = heights;
		}
		
		static Ball create(int radius) {
			if (radius < 0)
				throw new IllegalArgumentException("Ball radius must be >= 0, but was " + radius);
			int size = 2 * radius + 1;
			int[] dx = new int[size * size];
			int[] dy = new int[size * size];
			double[] heights = new double[size * size];
			int r2 = radius * radius;
			int n = 0;
			for (int y = -radius; y <= radius; y++) {
				for (int x = -radius; x <= radius; x++) {
					int d2 = x * x + y * y;
					if (d2 > r2)
						continue;
					dx[n] = x;
					dy[n] = y;
					heights[n] = Math.sqrt(r2 - d2);
					n++;
				}
			}
			return new Ball(
					Arrays.copyOf(dx, n), 
					Arrays.copyOf(dy, n), 
					Arrays.copyOf(heights, n));
		}
		
		int size() {
			return heights.length;
		}
		
	}

}
