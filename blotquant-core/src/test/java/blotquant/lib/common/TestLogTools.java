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

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

class TestLogTools {

	@Test
	void testLogOnce() {
		var logger = LoggerFactory.getLogger(TestLogTools.class);
		assertTrue(LogTools.warnOnce(logger, "Lanes differ"));
		assertFalse(LogTools.warnOnce(logger, "Lanes differ"));
		assertFalse(LogTools.logOnce(logger, Level.WARN, "Lanes differ"));
		
		// Same message at a different level is logged separately
		assertTrue(LogTools.logOnce(logger, Level.INFO, "Lanes differ"));
		assertTrue(LogTools.warnOnce(logger, "Something else"));
		
		// Same message with a different logger is logged separately
		assertTrue(LogTools.warnOnce(LoggerFactory.getLogger("blotquant.other"), "Lanes differ"));
	}

}
