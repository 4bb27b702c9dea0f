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
 * Parameter to represent a floating point value.
 */
public class DoubleParameter extends NumericParameter<Double> {
	
	DoubleParameter(String prompt, Double defaultValue, String unit, double lowerBound, double upperBound, Double lastValue, String helpText) {
		super(prompt, defaultValue, unit, lowerBound, upperBound, lastValue, helpText);
	}

	@Override
	public boolean setDoubleValue(double val) {
		return setValue(val);
	}

	@Override
	public Parameter<Double> duplicate() {
		return new DoubleParameter(getPrompt(), getDefaultValue(), getUnit(), getLowerBound(), getUpperBound(), lastValue, getHelpText());
	}
	
}
