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
package eu.openanalytics.featurematrix.execution;

import java.util.List;

import eu.openanalytics.featurematrix.dto.ErrorDTO;
import eu.openanalytics.featurematrix.model.ValueStore;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BatchResult {

    ValueStore store;

    int masterEvaluations;
    int masterFailures;

    int goodCells;
    int errorCells;
    int notApplicableCells;
    int skippedCells;

    double totalCalcTime;

    List<ErrorDTO> errors;
}
