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

import java.util.Locale;

/**
 * Interface defining an analysis parameter, with a default value and an optional user-provided value.
 *
 * @param <S> the type of the value
 */
public interface Parameter<S> {
	
	/**
	 * Get the value to use if no other value has been set.
	 * @return
	 */
	public S getDefaultValue();

	/**
	 * Set the parameter value.
	 * @param value
	 * @return true if the value was accepted, false if it was invalid (in which case the previous value is retained)
	 */
	public boolean setValue(S value);

	/**
	 * Set the value by parsing a String.
	 * @param locale locale used for parsing numbers; if null, the default locale is used
	 * @param value
	 * @return true if the value could be parsed and was accepted
	 */
	public boolean setStringValue(Locale locale, String value);

	/**
	 * Remove any value that has been set, so that the default is used.
	 */
	public void resetValue();

	/**
	 * Get the value that has been set, which may be null.
	 * @return
	 * @see #getValueOrDefault()
	 */
	public S getValue();

	/**
	 * Get the value that has been set, or the default if no value has been set.
	 * @return
	 */
	public S getValueOrDefault();
	
	/**
	 * Short text describing the parameter.
	 * @return
	 */
	public String getPrompt();
	
	/**
	 * Longer description of the parameter, which may be null.
	 * @return
	 */
	public String getHelpText();
	
	/**
	 * Query whether a value would be accepted by {@link #setValue(Object)}.
	 * @param value
	 * @return
	 */
	public boolean isValidInput(S value);
	
	/**
	 * Create a copy of this parameter, including any value that has been set.
	 * @return
	 */
	public Parameter<S> duplicate();

}
