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

/**
 * Parameter to represent an integer value.
 */
public class IntParameter extends NumericParameter<Integer> {
	
	IntParameter(String prompt, Integer defaultValue, String unit, double lowerBound, double upperBound, Integer lastValue, String helpText) {
		super(prompt, defaultValue, unit, lowerBound, upperBound, lastValue, helpText);
	}

	/**
	 * Non-integer values are rejected rather than rounded.
	 */
	@Override
	public boolean setDoubleValue(double val) {
		if (Double.isNaN(val) || val != Math.rint(val) || Math.abs(val) > Integer.MAX_VALUE)
			return false;
		return setValue((int)val);
	}

	@Override
	public Parameter<Integer> duplicate() {
		return new IntParameter(getPrompt(), getDefaultValue(), getUnit(), getLowerBound(), getUpperBound(), lastValue, getHelpText());
	}

}
