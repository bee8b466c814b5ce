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
package eu.openanalytics.featurematrix.api;

import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import eu.openanalytics.featurematrix.dto.BatchCalculationRequestDTO;
import eu.openanalytics.featurematrix.dto.BatchResultDTO;
import eu.openanalytics.featurematrix.exception.SnapshotNotFoundException;
import eu.openanalytics.featurematrix.service.BatchCalculationService;

@RestController
@RequestMapping("/calculations")
@Validated
public class BatchCalculationController {

    private final BatchCalculationService batchCalculationService;

    public BatchCalculationController(BatchCalculationService batchCalculationService) {
        this.batchCalculationService = batchCalculationService;
    }

    @PostMapping
    public BatchResultDTO calculate(@Validated @RequestBody BatchCalculationRequestDTO request) throws SnapshotNotFoundException {
        return batchCalculationService.calculate(request);
    }
}
