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

import eu.openanalytics.featurematrix.enumeration.CurationStage;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Value;

/**
 * Records how a curated feature matrix was produced, so the curation can be reproduced.
 */
@Value
@Builder
@AllArgsConstructor
@NoArgsConstructor(force = true, access = AccessLevel.PRIVATE) // Jackson deserialize compatibility
public class NormalizationInfo {

    String normFunction;

    double rowThreshold;

    double colThreshold;

    List<Long> trainingTimeSeriesIds;

    boolean pruneOrphanedMasters;

    /** Human readable description of the curation call that produced the matrix. */
    String codeToRun;

    List<StageReport> stages;

    @Value
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor(force = true, access = AccessLevel.PRIVATE) // Jackson deserialize compatibility
    public static class StageReport {
        CurationStage stage;
        int rowsBefore;
        int rowsAfter;
        int columnsBefore;
        int columnsAfter;
        boolean skipped;
    }
}
