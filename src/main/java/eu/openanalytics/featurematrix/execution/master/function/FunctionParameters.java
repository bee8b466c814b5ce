/**
 * Phaedra II
 *
 * Copyright (C) 2016-2025 Open Analytics
 *
 * ===========================================================================
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the Apache License as published by
 * The Apache Software Foundation, either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Apache License for more details.
 *
 * You should have received a copy of the Apache License
 * along with this program.  If not, see <http://www.apache.org/licenses/>
 */
package eu.openanalytics.featurematrix.execution.master.function;

import java.util.Map;
import java.util.function.IntSupplier;

import org.apache.commons.lang3.StringUtils;

/**
 * Reads typed values from the string parameters of a master operation.
 */
public final class FunctionParameters {

	private FunctionParameters() {
	}

	public static String getString(Map<String, String> parameters, String name, String defaultValue) {
		if (parameters == null || StringUtils.isBlank(parameters.get(name))) return defaultValue;
		return parameters.get(name).trim();
	}

	/**
	 * @return the parsed value, or null when the parameter is absent
	 * @throws IllegalArgumentException when the parameter is present but not a positive integer
	 */
	public static Integer getPositiveInt(Map<String, String> parameters, String name) {
		String raw = getString(parameters, name, null);
		if (raw == null) return null;
		int value;
		try {
			value = Integer.parseInt(raw);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(String.format("Parameter '%s' must be an integer, got '%s'", name, raw), e);
		}
		if (value < 1) {
			throw new IllegalArgumentException(String.format("Parameter '%s' must be positive, got %d", name, value));
		}
		return value;
	}

	public static int getPositiveInt(Map<String, String> parameters, String name, IntSupplier defaultValue) {
		Integer value = getPositiveInt(parameters, name);
		return value == null ? defaultValue.getAsInt() : value;
	}
}
