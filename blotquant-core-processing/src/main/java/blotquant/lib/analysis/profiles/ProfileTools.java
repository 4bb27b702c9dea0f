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

package blotquant.lib.analysis.profiles;

import java.util.ArrayList;
import java.util.List;

/**
 * Static methods for working with 1D intensity profiles (projections of an image onto a single axis).
 */
public class ProfileTools {
	
	private ProfileTools() {
		throw new AssertionError();
	}
	
	/**
	 * A contiguous range [start, end) of profile indices.
	 * @param start first index in the run
	 * @param end first index after the run (exclusive)
	 */
	public static record Run(int start, int end) {
		
		/**
		 * Number of indices in the run.
		 * @return
		 */
		public int length() {
			return end - start;
		}
		
	}
	
	/**
	 * Smooth a profile with a moving average.
	 * <p>
	 * Near the ends of the profile the window shrinks, and only the values that are available are averaged 
	 * (i.e. there is no zero-padding).
	 * 
	 * @param values the input profile
	 * @param halfWidth number of values to include on each side; the full window is 2*halfWidth+1
	 * @return a new array containing the smoothed profile
	 */
	public static double[] smooth(double[] values, int halfWidth) {
		if (halfWidth < 0)
			throw new IllegalArgumentException("Smoothing half-width must be >= 0, but was " + halfWidth);
		int n = values.length;
		double[] output = new double[n];
		for (int i = 0; i < n; i++) {
			double sum = 0;
			int count = 0;
			for (int j = Math.max(0, i - halfWidth); j <= Math.min(n - 1, i + halfWidth); j++) {
				sum += values[j];
				count++;
			}
			output[i] = sum / count;
		}
		return output;
	}
	
	/**
	 * Find maximal runs of values strictly above a threshold.
	 * <p>
	 * A run that is still open at the end of the profile ends at {@code values.length}.
	 * 
	 * @param values the profile
	 * @param threshold values must be &gt; threshold to be included
	 * @param minLength minimum number of values in a run; shorter runs are discarded
	 * @return runs in order of increasing index
	 */
	public static List<Run> findRunsAbove(double[] values, double threshold, int minLength) {
		List<Run> runs = new ArrayList<>();
		boolean inRun = false;
		int start = 0;
		for (int i = 0; i < values.length; i++) {
			if (!inRun && values[i] > threshold) {
				inRun = true;
				start = i;
			} else if (inRun && values[i] <= threshold) {
				inRun = false;
				if (i - start >= minLength)
					runs.add(new Run(start, i));
			}
		}
		if (inRun && values.length - start >= minLength)
			runs.add(new Run(start, values.length));
		return runs;
	}

}
