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
package eu.openanalytics.featurematrix.enumeration;

import java.util.Arrays;

/**
 * Per-cell quality flag stored alongside every value of a feature matrix.
 * Only {@link #GOOD} cells carry a trustworthy value; all other codes imply a NaN value.
 */
public enum QualityCode {

    NOT_COMPUTED(-1),
    GOOD(0),
    ERROR(1),
    NOT_APPLICABLE(2);

    private final int code;

    QualityCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isGood() {
        return this == GOOD;
    }

    public static QualityCode fromCode(int code) {
        return Arrays.stream(values())
                .filter(q -> q.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(String.format("Unknown quality code: %d", code)));
    }
}
