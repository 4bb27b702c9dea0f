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

abstract class AbstractParameter<S> implements Parameter<S> {

	private final String prompt;
	private final S defaultValue;
	private final String helpText;
	
	protected S lastValue;
	
	AbstractParameter(String prompt, S defaultValue, S value, String helpText) {
		this.prompt = prompt;
		this.defaultValue = defaultValue;
		this.lastValue = value;
		this.helpText = helpText;
	}
	
	@Override
	public S getDefaultValue() {
		return defaultValue;
	}
	
	@Override
	public S getValue() {
		return lastValue;
	}
	
	@Override
	public void resetValue() {
		lastValue = null;
	}

	@Override
	public S getValueOrDefault() {
		return lastValue == null ? defaultValue : lastValue;
	}
	
	@Override
	public String getPrompt() {
		return prompt;
	}
	
	@Override
	public String getHelpText() {
		return helpText;
	}
	
	@Override
	public boolean setValue(S value) {
		if (value == null || !isValidInput(value))
			return false;
		this.lastValue = value;
		return true;
	}
	
	@Override
	public String toString() {
		return getPrompt() + ": " + getValueOrDefault();
	}
	
}
