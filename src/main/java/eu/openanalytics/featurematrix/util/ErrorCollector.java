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
package eu.openanalytics.featurematrix.util;

import static eu.openanalytics.featurematrix.util.LoggerHelper.log;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.openanalytics.featurematrix.dto.ErrorDTO;
import eu.openanalytics.featurematrix.model.MasterOperation;
import eu.openanalytics.featurematrix.model.Operation;
import eu.openanalytics.featurematrix.model.TimeSeries;
import eu.openanalytics.featurematrix.util.LoggerHelper.LogContext;

public class ErrorCollector {

    private final List<ErrorDTO> errors = Collections.synchronizedList(new ArrayList<>());
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final LogContext ctx;
    private final Clock clock;

    public ErrorCollector(LogContext ctx) {
        this(ctx, Clock.systemDefaultZone());
    }

    public ErrorCollector(LogContext ctx, Clock clock) {
        this.ctx = ctx;
        this.clock = clock;
    }

    public List<ErrorDTO> getErrors() {
        synchronized (errors) {
            return List.copyOf(errors);
        }
    }

    public String getErrorDescription() {
        StringBuilder description = new StringBuilder();
        for (var error : getErrors()) {
            description.append(error);
            description.append("\n");
        }
        return description.toString();
    }

    public boolean hasError() {
        return !errors.isEmpty();
    }

    public void addError(String description, Object... ctxObjects) {
        var errorBuilder = ErrorDTO.builder()
                .timestamp(LocalDateTime.now(clock))
                .description(description);

        Optional<Throwable> exception = Optional.empty();

        for (Object ctxObject : ctxObjects) {
            if (ctxObject instanceof TimeSeries timeSeries) {
                errorBuilder
                        .timeSeriesId(timeSeries.getId())
                        .timeSeriesName(timeSeries.getName());
            } else if (ctxObject instanceof MasterOperation master) {
                errorBuilder
                        .masterOperationId(master.getId())
                        .masterOperationLabel(master.getLabel());
            } else if (ctxObject instanceof Operation operation) {
                errorBuilder
                        .operationId(operation.getId())
                        .operationName(operation.getName());
            } else if (ctxObject instanceof Throwable e) {
                errorBuilder
                        .exceptionClassName(e.getClass().getSimpleName())
                        .exceptionMessage(e.getMessage());
                if (exception.isPresent()) {
                    log(logger, ctx, "Multiple exceptions provided to errorCollector:addError");
                }
                exception = Optional.of(e);
            } else {
                log(logger, ctx, "Unrecognized contextObject passed to errorCollector:addError");
            }
        }

        var error = errorBuilder.build();
        errors.add(error);

        if (exception.isPresent()) {
            log(logger, ctx, "Error added to ErrorCollector" + error, exception.get());
        } else {
            log(logger, ctx, "Error added to ErrorCollector" + error);
        }
    }

}
