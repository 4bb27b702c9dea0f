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

package blotquant.lib.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Helper class providing Gson instances configured for BlotQuant classes.
 * <p>
 * Records (lanes, band regions and measurements) are handled by Gson directly. 
 * Non-finite values are written as NaN or Infinity, rather than causing serialization to fail.
 */
public class GsonTools {
	
	private static GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient();
	
	private GsonTools() {
		throw new AssertionError();
	}
	
	/**
	 * Get a default Gson instance that can serialize BlotQuant objects.
	 * @return
	 */
	public static Gson getInstance() {
		return builder.create();
	}
	
	/**
	 * Get a Gson instance that can serialize BlotQuant objects, optionally with pretty printing.
	 * @param pretty
	 * @return
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}

}
