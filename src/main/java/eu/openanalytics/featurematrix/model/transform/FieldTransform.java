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
package eu.openanalytics.featurematrix.model.transform;

import java.util.Map;

import eu.openanalytics.featurematrix.exception.TransformException;

/**
 * Extracts a scalar from the named fields of a successful result bundle.
 */
public interface FieldTransform {

    double apply(Map<String, Object> fields) throws TransformException;

    static double selectScalar(Map<String, Object> fields, String field) throws TransformException {
        if (fields == null || !fields.containsKey(field)) {
            throw new TransformException("Field '%s' is not present in the result bundle", field);
        }
        Object value = fields.get(field);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new TransformException("Field '%s' is not a scalar (%s)", field,
                value == null ? "null" : value.getClass().getSimpleName());
    }
}
