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

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
@NoArgsConstructor(force = true, access = AccessLevel.PRIVATE) // Jackson deserialize compatibility
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorDTO {

    LocalDateTime timestamp;
    String description;

    Long timeSeriesId;
    String timeSeriesName;

    Long masterOperationId;
    String masterOperationLabel;

    Long operationId;
    String operationName;

    String exceptionClassName;
    String exceptionMessage;

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(" - Timestamp: [%s], Description: [%s]", timestamp, description));
        if (timeSeriesId != null) sb.append(String.format(", Time series: [%s (%d)]", timeSeriesName, timeSeriesId));
        if (masterOperationId != null) sb.append(String.format(", Master operation: [%s (%d)]", masterOperationLabel, masterOperationId));
        if (operationId != null) sb.append(String.format(", Operation: [%s (%d)]", operationName, operationId));
        if (exceptionClassName != null) sb.append(String.format(", Exception: [%s: %s]", exceptionClassName, exceptionMessage));
        return sb.toString();
    }
}
