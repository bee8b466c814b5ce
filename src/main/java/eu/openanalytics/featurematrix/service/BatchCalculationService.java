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

import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import eu.openanalytics.featurematrix.config.FeatureMatrixProperties;
import eu.openanalytics.featurematrix.dto.BatchCalculationRequestDTO;
import eu.openanalytics.featurematrix.dto.BatchResultDTO;
import eu.openanalytics.featurematrix.dto.event.FeatureMatrixEvent;
import eu.openanalytics.featurematrix.enumeration.EventStatus;
import eu.openanalytics.featurematrix.enumeration.EventType;
import eu.openanalytics.featurematrix.enumeration.RecomputeMode;
import eu.openanalytics.featurematrix.exception.CalculationException;
import eu.openanalytics.featurematrix.exception.SnapshotNotFoundException;
import eu.openanalytics.featurematrix.execution.BatchOptions;
import eu.openanalytics.featurematrix.execution.BatchResult;
import eu.openanalytics.featurematrix.model.ModelMapper;
import eu.openanalytics.featurematrix.model.ValueStore;

/**
 * Runs a batch calculation end to end: loads or creates the feature matrix, fills it, and saves it as a snapshot.
 */
@Service
public class BatchCalculationService {

    private final SnapshotService snapshotService;
    private final BatchExecutorService batchExecutorService;
    private final KafkaProducerService kafkaProducerService;
    private final ModelMapper modelMapper;
    private final FeatureMatrixProperties properties;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    public BatchCalculationService(SnapshotService snapshotService, BatchExecutorService batchExecutorService,
                                   KafkaProducerService kafkaProducerService, ModelMapper modelMapper, FeatureMatrixProperties properties) {
        this.snapshotService = snapshotService;
        this.batchExecutorService = batchExecutorService;
        this.kafkaProducerService = kafkaProducerService;
        this.modelMapper = modelMapper;
        this.properties = properties;
    }

    public BatchResultDTO calculate(BatchCalculationRequestDTO request) throws SnapshotNotFoundException {
        String sourceName = request.getDataset() != null ? request.getDataset().getName() : request.getSnapshotName();
        String targetName = StringUtils.defaultIfBlank(request.getTargetName(), sourceName);

        try {
            ValueStore store;
            if (request.getDataset() != null) {
                store = modelMapper.map(request.getDataset());
            } else if (StringUtils.isNotBlank(request.getSnapshotName())) {
                store = snapshotService.loadSnapshot(request.getSnapshotName()).getStore();
            } else {
                throw new CalculationException("Either a snapshot name or a dataset must be provided");
            }

            BatchOptions options = BatchOptions.builder()
                    .name(targetName)
                    .recomputeMode(Optional.ofNullable(request.getRecomputeMode()).orElse(RecomputeMode.ALL))
                    .parallelism(Optional.ofNullable(request.getParallelism()).orElse(properties.getParallelism()))
                    .build();

            BatchResult result = batchExecutorService.execute(store, options);
            snapshotService.saveSnapshot(targetName, result.getStore(), null);

            kafkaProducerService.notifyFeatureMatrixEvent(event(sourceName, targetName, EventStatus.COMPLETED,
                    String.format("%d good, %d error, %d not applicable cells", result.getGoodCells(), result.getErrorCells(), result.getNotApplicableCells())));
            return modelMapper.map(targetName, result);
        } catch (SnapshotNotFoundException | RuntimeException e) {
            logger.warn(String.format("Batch calculation of '%s' failed: %s", targetName, e.getMessage()));
            kafkaProducerService.notifyFeatureMatrixEvent(event(sourceName, targetName, EventStatus.FAILED, e.getMessage()));
            throw e;
        }
    }

    private FeatureMatrixEvent event(String sourceName, String targetName, EventStatus status, String message) {
        return FeatureMatrixEvent.builder()
                .type(EventType.BATCH_CALCULATION)
                .status(status)
                .sourceName(sourceName)
                .targetName(targetName)
                .message(message)
                .build();
    }
}
