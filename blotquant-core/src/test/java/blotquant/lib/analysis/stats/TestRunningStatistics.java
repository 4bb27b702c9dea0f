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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.apache.commons.math3.stat.StatUtils;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestRunningStatistics {
	
	private static final RunningStatistics stats = new RunningStatistics();
	private static final List<Double> list = new ArrayList<>();
	
	@BeforeAll
	public static void test_addValues() {
		Random random = new Random(42);
		int size = 1 + random.nextInt(10_000);
		
		for (int i = 0; i < size; i++)
			list.add(random.nextDouble() * 1000);
		
		// Insert NaN in the middle
		list.add(Double.NaN);
		
		for (int i = 0; i < size; i++)
			list.add(random.nextDouble() * 1000);
		
		list.add(Double.NaN);
		
		for (double d : list)
			stats.addValue(d);
		
		// Check size does not count NaN values
		assertEquals(list.size() - 2, stats.size());
	}
	
	@Test
	public void test_numNaNs() {
		assertEquals(2, stats.getNumNaNs());
	}
	
	@Test
	public void test_metrics() {
		double[] array = list.stream().filter(e -> !e.isNaN()).mapToDouble(e -> e).toArray();
		
		assertEquals(StatUtils.sum(array), stats.getSum(), 1e-6);
		assertEquals(StatUtils.mean(array), stats.getMean(), 1e-6);
		assertEquals(StatUtils.min(array), stats.getMin());
		assertEquals(StatUtils.max(array), stats.getMax());
		assertEquals(StatUtils.max(array) - StatUtils.min(array), stats.getRange());
	}
	
	@Test
	public void test_empty() {
		var empty = new RunningStatistics();
		assertEquals(0, empty.size());
		assertEquals(0, empty.getSum());
		assertTrue(Double.isNaN(empty.getMean()));
		assertTrue(Double.isNaN(empty.getMin()));
		assertTrue(Double.isNaN(empty.getMax()));
		assertTrue(Double.isNaN(RunningStatistics.of(Double.NaN).getMean()));
	}
	
	@Test
	public void test_of() {
		var s = RunningStatistics.of(30, 70, 110);
		assertEquals(3, s.size());
		assertEquals(210, s.getSum());
		assertEquals(70, s.getMean());
		assertEquals(30, s.getMin());
		assertEquals(110, s.getMax());
	}

}
