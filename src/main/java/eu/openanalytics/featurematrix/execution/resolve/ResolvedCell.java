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
package eu.openanalytics.featurematrix.execution.resolve;

import eu.openanalytics.featurematrix.enumeration.QualityCode;
import lombok.Value;

@Value
public class ResolvedCell {

    double value;

    QualityCode quality;

    /** Why the cell is not good, null for good cells. */
    String message;

    public static ResolvedCell good(double value) {
        return new ResolvedCell(value, QualityCode.GOOD, null);
    }

    public static ResolvedCell error(String message) {
        return new ResolvedCell(Double.NaN, QualityCode.ERROR, message);
    }

    public static ResolvedCell notApplicable() {
        return new ResolvedCell(Double.NaN, QualityCode.NOT_APPLICABLE, null);
    }
}
