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

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Helper class for logging.
 */
public class LogTools {
	
	private static Map<Logger, Map<Level, Set<String>>> alreadyLogged = new ConcurrentHashMap<>();
	
	private LogTools() {
		throw new AssertionError();
	}

	/**
	 * Log a message once at the specified level.
	 * <p>
	 * Analyses are often run repeatedly on similar images; this avoids repeating the same 
	 * warning about e.g. inconsistent band counts every time.
	 * 
	 * @param logger
	 * @param level
	 * @param message
	 * @return true if the message was logged, false if it had been logged before
	 */
	public static boolean logOnce(Logger logger, Level level, String message) {
		var map = alreadyLogged.computeIfAbsent(logger, l -> new ConcurrentHashMap<>());
		var set = map.computeIfAbsent(level, l -> ConcurrentHashMap.newKeySet());
		if (set.add(message)) {
			logger.atLevel(level).log(message);
			return true;
		}
		return false;
	}

	/**
	 * Log a message once at the WARN level.
	 * 
	 * @param logger
	 * @param message
	 * @return true if the message was logged, false if it had been logged before
	 */
	public static boolean warnOnce(Logger logger, String message) {
		return logOnce(logger, Level.WARN, message);
	}

}
