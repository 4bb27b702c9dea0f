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

package blotquant.lib.analysis.stats;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helper class for computing basic statistics from values as they are added.
 * <p>
 * This is used for intensity profiles, where thresholds are derived from the mean and maximum of the profile.
 * Values are summed in the order they are added, so the mean matches a straightforward sum divided by the count.
 * <p>
 * NaN values are counted separately and do not contribute to the statistics.
 */
public class RunningStatistics {
	
	private static final Logger logger = LoggerFactory.getLogger(RunningStatistics.class);
	
	private static final double LARGE_DOUBLE_THRESHOLD = Math.pow(2, 53) - 1;
	
	private long numNaNs = 0;
	private long size = 0;
	private double sum = 0;
	private double min = Double.POSITIVE_INFINITY;
	private double max = Double.NEGATIVE_INFINITY;
	
	/**
	 * Create statistics for all values in an array.
	 * @param values
	 * @return
	 */
	public static RunningStatistics of(double... values) {
		var stats = new RunningStatistics();
		for (double v : values)
			stats.addValue(v);
		return stats;
	}
	
	/**
	 * Add another value.
	 * @param val
	 */
	public void addValue(double val) {
		if (Double.isNaN(val)) {
			numNaNs++;
			return;
		}
		size++;
		sum += val;
		if (val < min)
			min = val;
		if (val > max)
			max = val;
	}
	
	/**
	 * Number of non-NaN values added.
	 * @return
	 */
	public long size() {
		return size;
	}
	
	/**
	 * Number of NaN values added.
	 * @return
	 */
	public long getNumNaNs() {
		return numNaNs;
	}
	
	/**
	 * Sum of all non-NaN values.
	 * @return
	 */
	public double getSum() {
		if (Math.abs(sum) > LARGE_DOUBLE_THRESHOLD)
			logger.warn("Sum in {} is particularly large ({}), beware imprecision!", getClass().getSimpleName(), sum);
		return sum;
	}
	
	/**
	 * Mean of all non-NaN values.
	 * @return the mean, or NaN if no values are available
	 */
	public double getMean() {
		return size == 0 ? Double.NaN : getSum() / size;
	}
	
	/**
	 * Minimum non-NaN value.
	 * @return the minimum, or NaN if no values are available
	 */
	public double getMin() {
		return size == 0 ? Double.NaN : min;
	}
	
	/**
	 * Maximum non-NaN value.
	 * @return the maximum, or NaN if no values are available
	 */
	public double getMax() {
		return size == 0 ? Double.NaN : max;
	}
	
	/**
	 * Difference between the maximum and minimum values.
	 * @return
	 */
	public double getRange() {
		return size == 0 ? Double.NaN : max - min;
	}
	
	@Override
	public String toString() {
		return String.format("%s Mean: %.2f, Min: %.2f, Max: %.2f (n=%d)", RunningStatistics.class.getSimpleName(), getMean(), getMin(), getMax(), size);
	}

}
