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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import blotquant.lib.common.GeneralTools;
import blotquant.lib.io.GsonTools;

/**
 * An ordered collection of parameters, each identified by a key.
 * <p>
 * Parameter lists are used to configure an analysis, and can be updated from a JSON argument string 
 * such as {@code {"ballRadius": 25, "controlBand": 1}}.
 */
public class ParameterList {
	
	private static final Logger logger = LoggerFactory.getLogger(ParameterList.class);
	
	private final Map<String, Parameter<?>> params = new LinkedHashMap<>();
	
	/**
	 * Create a deep copy of this parameter list, including any values that have been set.
	 * @return
	 */
	public ParameterList duplicate() {
		ParameterList copy = new ParameterList();
		for (Entry<String, Parameter<?>> entry : params.entrySet())
			copy.params.put(entry.getKey(), entry.getValue().duplicate());
		return copy;
	}
	
	/**
	 * Add an unbounded double parameter.
	 * @param key
	 * @param prompt
	 * @param defaultValue
	 * @return this list
	 */
	public ParameterList addDoubleParameter(String key, String prompt, double defaultValue) {
		return addDoubleParameter(key, prompt, defaultValue, null, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, null);
	}

	/**
	 * Add a bounded double parameter, with optional unit and help text.
	 * @param key
	 * @param prompt
	 * @param defaultValue
	 * @param unit
	 * @param lowerBound
	 * @param upperBound
	 * @param helpText
	 * @return this list
	 */
	public ParameterList addDoubleParameter(String key, String prompt, double defaultValue, String unit, double lowerBound, double upperBound, String helpText) {
		params.put(key, new DoubleParameter(prompt, defaultValue, unit, lowerBound, upperBound, null, helpText));
		return this;
	}
	
	/**
	 * Add an unbounded int parameter.
	 * @param key
	 * @param prompt
	 * @param defaultValue
	 * @return this list
	 */
	public ParameterList addIntParameter(String key, String prompt, int defaultValue) {
		return addIntParameter(key, prompt, defaultValue, null, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, null);
	}

	/**
	 * Add a bounded int parameter, with optional unit and help text.
	 * @param key
	 * @param prompt
	 * @param defaultValue
	 * @param unit
	 * @param lowerBound
	 * @param upperBound
	 * @param helpText
	 * @return this list
	 */
	public ParameterList addIntParameter(String key, String prompt, int defaultValue, String unit, double lowerBound, double upperBound, String helpText) {
		params.put(key, new IntParameter(prompt, defaultValue, unit, lowerBound, upperBound, null, helpText));
		return this;
	}
	
	/**
	 * Returns an unmodifiable map of keys and their corresponding parameters.
	 * @return
	 */
	public Map<String, Parameter<?>> getParameters() {
		return Collections.unmodifiableMap(params);
	}
	
	/**
	 * Returns a map of keys and the values (or defaults) of their corresponding parameters.
	 * @return
	 */
	public Map<String, Object> getKeyValueParameters() {
		Map<String, Object> map = new LinkedHashMap<>();
		for (Entry<String, Parameter<?>> entry : params.entrySet())
			map.put(entry.getKey(), entry.getValue().getValueOrDefault());
		return map;
	}
	
	/**
	 * Returns true if a parameter exists in this list with a specified key.
	 * @param key
	 * @return
	 */
	public boolean containsKey(String key) {
		return params.containsKey(key);
	}
	
	/**
	 * Get an integer parameter value (or its default) for the specified key.
	 * @param key
	 * @return
	 * @throws IllegalArgumentException if no integer parameter exists for the specified key
	 */
	public int getIntParameterValue(String key) throws IllegalArgumentException {
		Parameter<?> p = params.get(key);
		if (p instanceof IntParameter)
			return ((IntParameter)p).getValueOrDefault();
		throw new IllegalArgumentException("No int parameter with key '" + key + "'");
	}
	
	/**
	 * Get a double parameter value (or its default) for the specified key.
	 * @param key
	 * @return
	 * @throws IllegalArgumentException if no double parameter exists for the specified key
	 */
	public double getDoubleParameterValue(String key) throws IllegalArgumentException {
		Parameter<?> p = params.get(key);
		if (p instanceof DoubleParameter)
			return ((DoubleParameter)p).getValueOrDefault();
		throw new IllegalArgumentException("No double parameter with key '" + key + "'");
	}
	
	/**
	 * Set the value of an integer parameter.
	 * @param key
	 * @param value
	 * @return this list
	 * @throws IllegalArgumentException if no integer parameter exists for the key, or the value is out of range
	 */
	public ParameterList setIntParameterValue(String key, int value) throws IllegalArgumentException {
		Parameter<?> p = params.get(key);
		if (!(p instanceof IntParameter))
			throw new IllegalArgumentException("No int parameter with key '" + key + "'");
		if (!((IntParameter)p).setValue(value))
			throw new IllegalArgumentException("Invalid value " + value + " for parameter '" + key + "'");
		return this;
	}
	
	/**
	 * Set the value of a double parameter.
	 * @param key
	 * @param value
	 * @return this list
	 * @throws IllegalArgumentException if no double parameter exists for the key, or the value is out of range
	 */
	public ParameterList setDoubleParameterValue(String key, double value) throws IllegalArgumentException {
		Parameter<?> p = params.get(key);
		if (!(p instanceof DoubleParameter))
			throw new IllegalArgumentException("No double parameter with key '" + key + "'");
		if (!((DoubleParameter)p).setValue(value))
			throw new IllegalArgumentException("Invalid value " + value + " for parameter '" + key + "'");
		return this;
	}
	
	/**
	 * Update a ParameterList with the values specified in a map.
	 * <p>
	 * Keys that are not found, or values that cannot be parsed, are logged and skipped.
	 * 
	 * @param params
	 * @param mapNew
	 * @param locale locale to use for any parsing required
	 * @return the number of parameters that were updated
	 */
	public static int updateParameterList(ParameterList params, Map<String, String> mapNew, Locale locale) {
		int count = 0;
		for (Entry<String, String> entry : mapNew.entrySet()) {
			Parameter<?> parameter = params.params.get(entry.getKey());
			if (parameter == null)
				logger.warn("Unknown parameter {} (value {}) will be ignored", entry.getKey(), entry.getValue());
			else if (!parameter.setStringValue(locale, entry.getValue()))
				logger.warn("Unable to set parameter {} with value {}", entry.getKey(), entry.getValue());
			else
				count++;
		}
		return count;
	}
	
	/**
	 * Update a ParameterList from a JSON argument string, e.g. {@code {"ballRadius": 25}}.
	 * Numbers are parsed using {@link Locale#US}.
	 * 
	 * @param params
	 * @param json
	 * @return the number of parameters that were updated
	 * @throws com.google.gson.JsonSyntaxException if the argument string is not valid JSON
	 */
	public static int updateParameterList(ParameterList params, String json) {
		return updateParameterList(params, GeneralTools.parseArgStringValues(json), Locale.US);
	}
	
	/**
	 * Get a JSON representation of a ParameterList's current values (or defaults).
	 * @param params
	 * @return
	 */
	public static String convertToJson(ParameterList params) {
		return GsonTools.getInstance().toJson(params.getKeyValueParameters());
	}
	
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (Parameter<?> p : params.values()) {
			if (sb.length() > 0)
				sb.append(", ");
			sb.append(p);
		}
		return "ParameterList[" + sb + "]";
	}

}
