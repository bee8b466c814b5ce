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
package eu.openanalytics.featurematrix.execution.master;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import eu.openanalytics.featurematrix.enumeration.BundleStatus;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * The outcome of evaluating one master operation on one time series.
 * Successful bundles carry named fields, each a {@link Double} or a {@code double[]}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ResultBundle {

    private static final ResultBundle NOT_APPLICABLE = new ResultBundle(BundleStatus.NOT_APPLICABLE, Collections.emptyMap(), null);

    BundleStatus status;

    Map<String, Object> fields;

    String message;

    public static ResultBundle success(Map<String, ?> fields) {
        return new ResultBundle(BundleStatus.SUCCESS, Collections.unmodifiableMap(new LinkedHashMap<String, Object>(fields)), null);
    }

    public static ResultBundle notApplicable() {
        return NOT_APPLICABLE;
    }

    public static ResultBundle failed(String message) {
        return new ResultBundle(BundleStatus.FAILED, Collections.emptyMap(), message);
    }

    public boolean isSuccess() {
        return status == BundleStatus.SUCCESS;
    }

    public boolean isFailed() {
        return status == BundleStatus.FAILED;
    }
}
