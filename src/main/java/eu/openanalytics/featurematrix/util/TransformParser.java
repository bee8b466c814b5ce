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
package eu.openanalytics.featurematrix.util;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import eu.openanalytics.featurematrix.model.transform.FieldTransform;
import eu.openanalytics.featurematrix.model.transform.ScalarFunction;
import eu.openanalytics.featurematrix.model.transform.SelectField;
import eu.openanalytics.featurematrix.model.transform.SelectFieldThenApply;
import eu.openanalytics.featurematrix.model.transform.UnresolvableTransform;

/**
 * Parses pointer operation code of the form {@code field} or {@code fn(field)}.
 * Never throws: code that cannot be parsed becomes an {@link UnresolvableTransform}.
 */
public class TransformParser {

	private static final String FIELD = "[A-Za-z_][A-Za-z0-9_]*";
	private static final Pattern FIELD_PATTERN = Pattern.compile(FIELD);
	private static final Pattern APPLY_PATTERN = Pattern.compile("(\\w+)\\s*\\(\\s*(" + FIELD + ")\\s*\\)");

	public FieldTransform parse(String code) {
		if (StringUtils.isBlank(code)) {
			return new UnresolvableTransform("Empty transform code");
		}

		String trimmed = code.trim();
		if (FIELD_PATTERN.matcher(trimmed).matches()) {
			return new SelectField(trimmed);
		}

		Matcher matcher = APPLY_PATTERN.matcher(trimmed);
		if (matcher.matches()) {
			Optional<ScalarFunction> function = ScalarFunction.fromName(matcher.group(1));
			if (function.isEmpty()) {
				return new UnresolvableTransform(String.format("Unknown scalar function '%s' in '%s'", matcher.group(1), trimmed));
			}
			return new SelectFieldThenApply(matcher.group(2), function.get());
		}

		return new UnresolvableTransform(String.format("Cannot parse transform code '%s'", trimmed));
	}

}
