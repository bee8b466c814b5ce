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
package eu.openanalytics.featurematrix.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.modelmapper.Conditions;
import org.modelmapper.config.Configuration;
import org.modelmapper.convention.NameTransformers;
import org.modelmapper.convention.NamingConventions;
import org.springframework.stereotype.Service;

import eu.openanalytics.featurematrix.dto.BatchResultDTO;
import eu.openanalytics.featurematrix.dto.CurationResultDTO;
import eu.openanalytics.featurematrix.dto.DatasetDTO;
import eu.openanalytics.featurematrix.dto.MasterOperationDTO;
import eu.openanalytics.featurematrix.dto.OperationDTO;
import eu.openanalytics.featurematrix.dto.SnapshotDTO;
import eu.openanalytics.featurematrix.dto.SnapshotSummaryDTO;
import eu.openanalytics.featurematrix.dto.TimeSeriesDTO;
import eu.openanalytics.featurematrix.execution.BatchResult;
import eu.openanalytics.featurematrix.repository.SnapshotRecord;
import eu.openanalytics.featurematrix.service.curation.CurationResult;

@Service
public class ModelMapper {

    private final org.modelmapper.ModelMapper modelMapper = new org.modelmapper.ModelMapper();

    public ModelMapper() {
        Configuration builderConfiguration = modelMapper.getConfiguration().copy()
                .setDestinationNameTransformer(NameTransformers.builder())
                .setDestinationNamingConvention(NamingConventions.builder());

        modelMapper.createTypeMap(TimeSeriesDTO.class, TimeSeries.TimeSeriesBuilder.class, builderConfiguration)
                .setPropertyCondition(Conditions.isNotNull());

        modelMapper.createTypeMap(TimeSeries.class, TimeSeriesDTO.TimeSeriesDTOBuilder.class, builderConfiguration)
                .setPropertyCondition(Conditions.isNotNull());

        modelMapper.createTypeMap(MasterOperationDTO.class, MasterOperation.MasterOperationBuilder.class, builderConfiguration)
                .setPropertyCondition(Conditions.isNotNull());

        modelMapper.createTypeMap(MasterOperation.class, MasterOperationDTO.MasterOperationDTOBuilder.class, builderConfiguration)
                .setPropertyCondition(Conditions.isNotNull());

        modelMapper.validate(); // ensure that objects can be mapped
    }

    /**
     * Maps a {@link TimeSeriesDTO} to a {@link TimeSeries.TimeSeriesBuilder}.
     * The return value can be further customized by calling the builder methods.
     */
    public TimeSeries.TimeSeriesBuilder map(TimeSeriesDTO timeSeriesDTO) {
        TimeSeries.TimeSeriesBuilder builder = TimeSeries.builder();
        modelMapper.map(timeSeriesDTO, builder);
        return builder;
    }

    public TimeSeriesDTO.TimeSeriesDTOBuilder map(TimeSeries timeSeries) {
        TimeSeriesDTO.TimeSeriesDTOBuilder builder = TimeSeriesDTO.builder();
        modelMapper.map(timeSeries, builder);
        return builder;
    }

    public MasterOperation.MasterOperationBuilder map(MasterOperationDTO masterOperationDTO) {
        MasterOperation.MasterOperationBuilder builder = MasterOperation.builder();
        modelMapper.map(masterOperationDTO, builder);
        return builder;
    }

    public MasterOperationDTO.MasterOperationDTOBuilder map(MasterOperation masterOperation) {
        MasterOperationDTO.MasterOperationDTOBuilder builder = MasterOperationDTO.builder();
        modelMapper.map(masterOperation, builder);
        return builder;
    }

    /**
     * Maps an {@link OperationDTO} to an {@link Operation}, parsing its transform code.
     */
    public Operation map(OperationDTO operationDTO) {
        return Operation.create(operationDTO.getId(), operationDTO.getName(), operationDTO.getKeywords(),
                operationDTO.getMasterId(), operationDTO.getCode());
    }

    public OperationDTO map(Operation operation) {
        return OperationDTO.builder()
                .id(operation.getId())
                .name(operation.getName())
                .keywords(operation.getKeywords())
                .masterId(operation.getMasterId())
                .code(operation.getCode())
                .build();
    }

    /**
     * Creates an empty feature matrix for the time series and operations of a dataset.
     */
    public ValueStore map(DatasetDTO datasetDTO) {
        return ValueStore.create(
                datasetDTO.getTimeSeries().stream().map(ts -> map(ts).build()).toList(),
                datasetDTO.getOperations().stream().map(this::map).toList(),
                datasetDTO.getMasterOperations().stream().map(m -> map(m).build()).toList());
    }

    public SnapshotDTO map(Snapshot snapshot) {
        ValueStore store = snapshot.getStore();
        return SnapshotDTO.builder()
                .name(snapshot.getName())
                .createdOn(snapshot.getCreatedOn())
                .timeSeries(store.getTimeSeries().stream().map(ts -> map(ts).build()).toList())
                .operations(store.getOperations().stream().map(this::map).toList())
                .masterOperations(store.getMasterOperations().stream().map(m -> map(m).build()).toList())
                .values(toNullable(store.getValues()))
                .quality(store.getQualityCodes())
                .calcTimes(toNullable(store.getCalcTimes()))
                .normalizationInfo(snapshot.getNormalizationInfo())
                .build();
    }

    /**
     * Maps a {@link SnapshotDTO} back to a {@link Snapshot}. The resulting store is validated.
     */
    public Snapshot map(SnapshotDTO snapshotDTO) {
        ValueStore store = new ValueStore(
                nullToEmpty(snapshotDTO.getTimeSeries()).stream().map(ts -> map(ts).build()).toList(),
                nullToEmpty(snapshotDTO.getOperations()).stream().map(this::map).toList(),
                nullToEmpty(snapshotDTO.getMasterOperations()).stream().map(m -> map(m).build()).toList(),
                toPrimitive(snapshotDTO.getValues()),
                snapshotDTO.getQuality(),
                toPrimitive(snapshotDTO.getCalcTimes()));
        return Snapshot.builder()
                .name(snapshotDTO.getName())
                .createdOn(snapshotDTO.getCreatedOn())
                .normalizationInfo(snapshotDTO.getNormalizationInfo())
                .store(store)
                .build();
    }

    public SnapshotSummaryDTO map(SnapshotRecord snapshotRecord) {
        return SnapshotSummaryDTO.builder()
                .name(snapshotRecord.getName())
                .timeSeriesCount(snapshotRecord.getRowCount())
                .operationCount(snapshotRecord.getColumnCount())
                .normalized(snapshotRecord.isNormalized())
                .createdOn(snapshotRecord.getCreatedOn())
                .build();
    }

    public BatchResultDTO map(String snapshotName, BatchResult batchResult) {
        return BatchResultDTO.builder()
                .snapshotName(snapshotName)
                .timeSeriesCount(batchResult.getStore().getRowCount())
                .operationCount(batchResult.getStore().getColumnCount())
                .masterEvaluations(batchResult.getMasterEvaluations())
                .masterFailures(batchResult.getMasterFailures())
                .goodCells(batchResult.getGoodCells())
                .errorCells(batchResult.getErrorCells())
                .notApplicableCells(batchResult.getNotApplicableCells())
                .skippedCells(batchResult.getSkippedCells())
                .totalCalcTime(batchResult.getTotalCalcTime())
                .errors(batchResult.getErrors())
                .build();
    }

    public CurationResultDTO map(String sourceName, String targetName, CurationResult curationResult) {
        return CurationResultDTO.builder()
                .sourceName(sourceName)
                .targetName(targetName)
                .timeSeriesCount(curationResult.getStore().getRowCount())
                .operationCount(curationResult.getStore().getColumnCount())
                .normalizationInfo(curationResult.getNormalizationInfo())
                .build();
    }

    private static Double[][] toNullable(double[][] matrix) {
        return Arrays.stream(matrix)
                .map(row -> Arrays.stream(row).mapToObj(v -> Double.isNaN(v) ? null : v).toArray(Double[]::new))
                .toArray(Double[][]::new);
    }

    private static double[][] toPrimitive(Double[][] matrix) {
        if (matrix == null) return null;
        return Arrays.stream(matrix)
                .map(row -> row == null ? null : Arrays.stream(row).mapToDouble(v -> v == null ? Double.NaN : v).toArray())
                .toArray(double[][]::new);
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return Objects.requireNonNullElse(list, List.of());
    }
}
