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

package blotquant.lib.plugins.parameters;

import java.text.NumberFormat;
import java.text.ParseException;
import java.util.Locale;
import java.util.Locale.Category;

/**
 * Abstract parameter to represent a numeric value, optionally with a unit and bounds.
 * <p>
 * Values outside the bounds are rejected.
 * 
 * @see DoubleParameter
 * @see IntParameter
 *
 * @param <S>
 */
public abstract class NumericParameter<S extends Number> extends AbstractParameter<S> {
	
	private final String unit;
	private final double lowerBound;
	private final double upperBound;
	
	NumericParameter(String prompt, S defaultValue, String unit, double lowerBound, double upperBound, S lastValue, String helpText) {
		super(prompt, defaultValue, lastValue, helpText);
		if (Double.isNaN(lowerBound))
			lowerBound = Double.NEGATIVE_INFINITY;
		if (Double.isNaN(upperBound))
			upperBound = Double.POSITIVE_INFINITY;
		if (lowerBound > upperBound)
			throw new IllegalArgumentException("Invalid range " + lowerBound + "-" + upperBound + ": lower bound must be <= upper bound");
		this.unit = unit;
		this.lowerBound = lowerBound;
		this.upperBound = upperBound;
	}
	
	/**
	 * Lower bound, or Double.NEGATIVE_INFINITY if the parameter has no lower bound.
	 * @return
	 */
	public double getLowerBound() {
		return lowerBound;
	}

	/**
	 * Upper bound, or Double.POSITIVE_INFINITY if the parameter has no upper bound.
	 * @return
	 */
	public double getUpperBound() {
		return upperBound;
	}
	
	/**
	 * Unit to display for this parameter (may be null).
	 * @return
	 */
	public String getUnit() {
		return unit;
	}
	
	/**
	 * Set the value from a double, converting it to the parameter type if necessary.
	 * @param val
	 * @return true if the value was accepted
	 */
	public abstract boolean setDoubleValue(double val);
	
	/**
	 * Numbers are considered valid if they are not NaN and fall within any bounds.
	 */
	@Override
	public boolean isValidInput(S value) {
		if (value == null)
			return false;
		double d = value.doubleValue();
		return !Double.isNaN(d) && d >= lowerBound && d <= upperBound;
	}
	
	@Override
	public boolean setStringValue(Locale locale, String value) {
		if (value == null)
			return false;
		String s = value.strip();
		try {
			return setDoubleValue(Double.parseDouble(s));
		} catch (NumberFormatException e) {
			// Try again below using the locale, e.g. for a decimal comma
		}
		try {
			Number number = NumberFormat.getInstance(locale == null ? Locale.getDefault(Category.FORMAT) : locale).parse(s);
			return setDoubleValue(number.doubleValue());
		} catch (ParseException e) {
			return false;
		}
	}
	
}
