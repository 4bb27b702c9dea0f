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

import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;

/**
 * Collection of generally useful static methods.
 */
public final class GeneralTools {
	
	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}
	
	/**
	 * Round a value to a fixed number of decimal places.
	 * <p>
	 * The value is scaled, rounded with halves going towards positive infinity, and scaled back.
	 * Rounding is done in double precision, so large values are not limited to the range of a long.
	 * <p>
	 * Note that e.g. 1.005 rounds to 1.0 at 2 decimal places, because 1.005 * 100 is 
	 * slightly less than 100.5 in double precision.
	 * 
	 * @param value
	 * @param nDecimalPlaces
	 * @return the rounded value, or the input unchanged if it is NaN or infinite
	 */
	public static double roundToDecimalPlaces(final double value, final int nDecimalPlaces) {
		if (!Double.isFinite(value))
			return value;
		if (nDecimalPlaces < 0)
			throw new IllegalArgumentException("Number of decimal places must be >= 0, but was " + nDecimalPlaces);
		double factor = Math.pow(10, nDecimalPlaces);
		return Math.floor(value * factor + 0.5) / factor;
	}
	
	/**
	 * Convert a double to a String in plain decimal notation, without trailing zeros or exponent.
	 * <p>
	 * Integer values are written without a decimal point, e.g. "1000" rather than "1000.0", 
	 * and small values are written in full, e.g. "0.0001" rather than "1.0E-4".
	 * NaN and infinite values use {@link Double#toString(double)}.
	 * 
	 * @param value
	 * @return
	 */
	public static String toPlainString(final double value) {
		if (!Double.isFinite(value))
			return Double.toString(value);
		if (value == 0)
			return "0";
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
	}
	
	/**
	 * Parse the contents of a JSON String.
	 * <p>
	 * Note that this doesn't handle nested maps; values are returned as Strings for later parsing.
	 * @param s
	 * @return
	 * @throws com.google.gson.JsonSyntaxException if the String is not valid JSON
	 */
	public static Map<String, String> parseArgStringValues(String s) {
		if (s == null || s.isBlank())
			return Collections.emptyMap();
		Type type = new TypeToken<Map<String, String>>() {}.getType();
		Map<String, String> map = new Gson().fromJson(s, type);
		return map == null ? Collections.emptyMap() : map;
	}

}
