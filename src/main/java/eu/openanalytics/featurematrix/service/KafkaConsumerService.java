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
package eu.openanalytics.featurematrix.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

import eu.openanalytics.featurematrix.config.KafkaConfig;
import eu.openanalytics.featurematrix.dto.BatchCalculationRequestDTO;
import eu.openanalytics.featurematrix.dto.CurationRequestDTO;
import eu.openanalytics.featurematrix.exception.SnapshotNotFoundException;
import eu.openanalytics.featurematrix.service.curation.CurationService;

@Service
public class KafkaConsumerService {

    private final BatchCalculationService batchCalculationService;
    private final CurationService curationService;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    public KafkaConsumerService(BatchCalculationService batchCalculationService, CurationService curationService) {
        this.batchCalculationService = batchCalculationService;
        this.curationService = curationService;
    }

    @KafkaListener(topics = KafkaConfig.TOPIC_FEATUREMATRIX, groupId = KafkaConfig.GROUP_ID + "_reqBatchCalc", filter = "requestBatchCalculationFilter")
    public void onRequestBatchCalculation(BatchCalculationRequestDTO request) throws SnapshotNotFoundException {
        logger.info(KafkaConfig.GROUP_ID + ": received a batch calculation event");
        batchCalculationService.calculate(request);
    }

    @KafkaListener(topics = KafkaConfig.TOPIC_FEATUREMATRIX, groupId = KafkaConfig.GROUP_ID + "_reqCuration", filter = "requestCurationFilter")
    public void onRequestCuration(CurationRequestDTO request) throws SnapshotNotFoundException {
        logger.info(KafkaConfig.GROUP_ID + ": received a curation event");
        curationService.curate(request);
    }
}
