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

import java.time.LocalDateTime;
import java.util.List;

import eu.openanalytics.featurematrix.model.NormalizationInfo;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Value;

/**
 * Serialized form of a snapshot. Unset and invalid cells are written as {@code null} in the
 * value and calculation time matrices.
 */
@Value
@Builder
@AllArgsConstructor
@NoArgsConstructor(force = true, access = AccessLevel.PRIVATE) // Jackson deserialize compatibility
public class SnapshotDTO {

    String name;

    LocalDateTime createdOn;

    List<TimeSeriesDTO> timeSeries;

    List<OperationDTO> operations;

    List<MasterOperationDTO> masterOperations;

    Double[][] values;

    int[][] quality;

    Double[][] calcTimes;

    NormalizationInfo normalizationInfo;
}
