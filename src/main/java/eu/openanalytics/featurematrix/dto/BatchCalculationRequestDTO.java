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
package eu.openanalytics.featurematrix.dto;

import javax.validation.Valid;
import javax.validation.constraints.Min;

import eu.openanalytics.featurematrix.enumeration.RecomputeMode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Value;

/**
 * Requests a batch calculation over a stored snapshot ({@code snapshotName}) or over a new, inline
 * dataset. The populated matrix is saved as {@code targetName}, which defaults to the source name.
 */
@Value
@Builder
@AllArgsConstructor
@NoArgsConstructor(force = true, access = AccessLevel.PRIVATE) // Jackson deserialize compatibility
public class BatchCalculationRequestDTO {

    String snapshotName;

    @Valid
    DatasetDTO dataset;

    String targetName;

    RecomputeMode recomputeMode;

    @Min(value = 1, message = "Parallelism must be at least 1")
    Integer parallelism;
}
