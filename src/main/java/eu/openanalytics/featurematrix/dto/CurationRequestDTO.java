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

import java.util.List;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotBlank;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Value;

/**
 * Requests the curation of snapshot {@code sourceName} into {@code targetName}.
 * Unset options take the configured defaults.
 */
@Value
@Builder
@AllArgsConstructor
@NoArgsConstructor(force = true, access = AccessLevel.PRIVATE) // Jackson deserialize compatibility
public class CurationRequestDTO {

    @NotBlank(message = "Source snapshot name is mandatory")
    String sourceName;

    String targetName;

    String normFunction;

    @DecimalMin(value = "0.0", message = "Row threshold must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Row threshold must be between 0 and 1")
    Double rowThreshold;

    @DecimalMin(value = "0.0", message = "Column threshold must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Column threshold must be between 0 and 1")
    Double colThreshold;

    List<Integer> rowSubset;

    List<Integer> columnSubset;

    List<Long> trainingTimeSeriesIds;

    Boolean pruneOrphanedMasters;
}
