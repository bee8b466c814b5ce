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
package eu.openanalytics.featurematrix.service.curation;

import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import eu.openanalytics.featurematrix.config.FeatureMatrixProperties;
import eu.openanalytics.featurematrix.dto.CurationRequestDTO;
import eu.openanalytics.featurematrix.dto.CurationResultDTO;
import eu.openanalytics.featurematrix.dto.event.FeatureMatrixEvent;
import eu.openanalytics.featurematrix.enumeration.EventStatus;
import eu.openanalytics.featurematrix.enumeration.EventType;
import eu.openanalytics.featurematrix.exception.CurationException;
import eu.openanalytics.featurematrix.exception.SnapshotNotFoundException;
import eu.openanalytics.featurematrix.model.ModelMapper;
import eu.openanalytics.featurematrix.model.Snapshot;
import eu.openanalytics.featurematrix.service.KafkaProducerService;
import eu.openanalytics.featurematrix.service.SnapshotService;

/**
 * Curates a stored snapshot into a new one. The target snapshot is only written when every stage succeeded.
 */
@Service
public class CurationService {

    /** Appended to the source name when no target name is given. */
    public static final String NORMALIZED_SUFFIX = "_N";

    private final SnapshotService snapshotService;
    private final MatrixCurator matrixCurator;
    private final KafkaProducerService kafkaProducerService;
    private final ModelMapper modelMapper;
    private final FeatureMatrixProperties properties;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    public CurationService(SnapshotService snapshotService, MatrixCurator matrixCurator, KafkaProducerService kafkaProducerService,
                           ModelMapper modelMapper, FeatureMatrixProperties properties) {
        this.snapshotService = snapshotService;
        this.matrixCurator = matrixCurator;
        this.kafkaProducerService = kafkaProducerService;
        this.modelMapper = modelMapper;
        this.properties = properties;
    }

    public CurationResultDTO curate(CurationRequestDTO request) throws SnapshotNotFoundException {
        String sourceName = request.getSourceName();
        String targetName = StringUtils.defaultIfBlank(request.getTargetName(), sourceName + NORMALIZED_SUFFIX);

        CurationResult result;
        try {
            Snapshot source = snapshotService.loadSnapshot(sourceName);
            result = matrixCurator.curate(source.getStore(), toOptions(request));
        } catch (SnapshotNotFoundException | CurationException e) {
            logger.warn(String.format("Curation of '%s' into '%s' failed: %s", sourceName, targetName, e.getMessage()));
            kafkaProducerService.notifyFeatureMatrixEvent(event(sourceName, targetName, EventStatus.FAILED, e.getMessage()));
            throw e;
        }

        snapshotService.saveSnapshot(targetName, result.getStore(), result.getNormalizationInfo());
        kafkaProducerService.notifyFeatureMatrixEvent(event(sourceName, targetName, EventStatus.COMPLETED,
                String.format("%d x %d matrix", result.getStore().getRowCount(), result.getStore().getColumnCount())));
        return modelMapper.map(sourceName, targetName, result);
    }

    public CurationOptions toOptions(CurationRequestDTO request) {
        CurationOptions.CurationOptionsBuilder builder = CurationOptions.builder()
                .normFunction(StringUtils.defaultIfBlank(request.getNormFunction(), properties.getDefaultNormFunction()))
                .rowThreshold(Optional.ofNullable(request.getRowThreshold()).orElse(properties.getDefaultRowThreshold()))
                .colThreshold(Optional.ofNullable(request.getColThreshold()).orElse(properties.getDefaultColThreshold()))
                .pruneOrphanedMasters(Optional.ofNullable(request.getPruneOrphanedMasters()).orElse(properties.isPruneOrphanedMasters()));
        if (request.getRowSubset() != null) builder.rowSubset(request.getRowSubset());
        if (request.getColumnSubset() != null) builder.columnSubset(request.getColumnSubset());
        if (request.getTrainingTimeSeriesIds() != null) builder.trainingTimeSeriesIds(request.getTrainingTimeSeriesIds());
        return builder.build();
    }

    private FeatureMatrixEvent event(String sourceName, String targetName, EventStatus status, String message) {
        return FeatureMatrixEvent.builder()
                .type(EventType.CURATION)
                .status(status)
                .sourceName(sourceName)
                .targetName(targetName)
                .message(message)
                .build();
    }
}
