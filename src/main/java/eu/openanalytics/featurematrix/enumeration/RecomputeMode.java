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

/**
 * Selects which cells of a feature matrix a batch run (re)computes.
 */
public enum RecomputeMode {

    /** Every cell is computed, overwriting previous results. */
    ALL,
    /** Only cells that were never computed. */
    MISSING,
    /** Cells that were never computed, and cells whose previous computation failed. */
    MISSING_AND_ERRORS;

    public boolean requiresCalculation(QualityCode quality) {
        return switch (this) {
            case ALL -> true;
            case MISSING -> quality == QualityCode.NOT_COMPUTED;
            case MISSING_AND_ERRORS -> quality == QualityCode.NOT_COMPUTED || quality == QualityCode.ERROR;
        };
    }
}
