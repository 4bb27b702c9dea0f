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

package blotquant.lib.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Helper class to time the stages of an analysis.
 * <p>
 * Each checkpoint marks the start of a stage, which ends at the next checkpoint (or when the Timeit is stopped).
 * The report is implemented as {@code timeit.toString()} so that it can easily be logged:
 * <pre>{@code 
 * var timeit = new Timeit();
 * timeit.checkpoint("Background");
 * // Do something
 * timeit.checkpoint("Lanes");
 * // Do something else
 * timeit.stop();
 * logger.debug("{}", timeit);
 * }
 * </pre>
 */
public class Timeit {
	
	private static final String END = "END";
	
	private final List<Checkpoint> checkpoints = Collections.synchronizedList(new ArrayList<>());
	
	private boolean isStopped = false;
	
	/**
	 * Create a checkpoint with the given name, starting a new stage.
	 * @param name
	 * @return this instance
	 * @throws UnsupportedOperationException if the Timeit has already been stopped
	 */
	public Timeit checkpoint(String name) throws UnsupportedOperationException {
		if (isStopped)
			throw new UnsupportedOperationException("Timeit has already been stopped!");
		checkpoints.add(new Checkpoint(name == null ? "Checkpoint-" + (checkpoints.size() + 1) : name, System.nanoTime()));
		return this;
	}
	
	/**
	 * Stop timing. This ends the current stage.
	 * @return this instance
	 * @throws UnsupportedOperationException if the Timeit has not been started, or has already been stopped
	 */
	public Timeit stop() throws UnsupportedOperationException {
		if (checkpoints.isEmpty())
			throw new UnsupportedOperationException("Timeit has not been started!");
		checkpoint(END);
		isStopped = true;
		return this;
	}
	
	/**
	 * Query whether {@link #stop()} has been called.
	 * @return
	 */
	public boolean isStopped() {
		return isStopped;
	}
	
	/**
	 * Get the duration of every completed stage, in the order the stages started.
	 * @param unit the unit of the returned durations
	 * @return an unmodifiable map of stage names to durations
	 */
	public Map<String, Long> getStageDurations(TimeUnit unit) {
		Map<String, Long> map = new LinkedHashMap<>();
		synchronized (checkpoints) {
			for (int i = 0; i < checkpoints.size() - 1; i++) {
				var current = checkpoints.get(i);
				var next = checkpoints.get(i + 1);
				map.put(current.name, unit.convert(next.timestamp - current.timestamp, TimeUnit.NANOSECONDS));
			}
		}
		return Collections.unmodifiableMap(map);
	}
	
	@Override
	public String toString() {
		var durations = getStageDurations(TimeUnit.MICROSECONDS);
		if (durations.isEmpty())
			return "Timeit (no completed stages)";
		StringBuilder sb = new StringBuilder();
		long total = 0;
		for (var entry : durations.entrySet()) {
			sb.append(entry.getKey()).append(": ").append(String.format("%.3f ms", entry.getValue() / 1000.0)).append(System.lineSeparator());
			total += entry.getValue();
		}
		sb.append("Total: ").append(String.format("%.3f ms", total / 1000.0));
		return sb.toString();
	}
	
	private static class Checkpoint {
		
		private final String name;
		private final long timestamp;
		
		private Checkpoint(String name, long timestamp) {
			this.name = name;
			this.timestamp = timestamp;
		}
		
	}

}
