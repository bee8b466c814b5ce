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
package eu.openanalytics.featurematrix.service.curation;

import java.util.Collections;
import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class CurationOptions {

    @Builder.Default
    String normFunction = NormalizationFunction.DEFAULT.getName();

    /** Rows with a good-value fraction below this are dropped; 0 disables row filtering. */
    @Builder.Default
    double rowThreshold = 0.8;

    /** Columns with a good-value fraction below this are dropped; 0 disables column filtering. */
    @Builder.Default
    double colThreshold = 1.0;

    /** Row indices to restrict to before any filtering; empty keeps all rows. */
    @Builder.Default
    List<Integer> rowSubset = Collections.emptyList();

    /** Column indices to restrict to before any filtering; empty keeps all columns. */
    @Builder.Default
    List<Integer> columnSubset = Collections.emptyList();

    /** Time series ids whose rows train the normalization; empty trains on all rows. */
    @Builder.Default
    List<Long> trainingTimeSeriesIds = Collections.emptyList();

    @Builder.Default
    boolean pruneOrphanedMasters = false;

    public static CurationOptions defaults() {
        return CurationOptions.builder().build();
    }
}
