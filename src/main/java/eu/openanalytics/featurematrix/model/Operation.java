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
package eu.openanalytics.featurematrix.model;

import java.util.List;

import eu.openanalytics.featurematrix.model.transform.FieldTransform;
import eu.openanalytics.featurematrix.util.TransformParser;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * A pointer operation: one column of the feature matrix, extracting a scalar from the
 * result bundle of its master operation.
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class Operation {

    long id;

    String name;

    List<String> keywords;

    long masterId;

    String code;

    FieldTransform transform;

    /**
     * Creates an operation whose transform is parsed from the given code.
     * Malformed code yields an operation that always resolves to an error.
     */
    public static Operation create(long id, String name, List<String> keywords, long masterId, String code) {
        return new Operation(id, name, keywords, masterId, code, new TransformParser().parse(code));
    }
}
