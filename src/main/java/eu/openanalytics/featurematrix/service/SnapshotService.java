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

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import eu.openanalytics.featurematrix.dto.SnapshotDTO;
import eu.openanalytics.featurematrix.dto.SnapshotSummaryDTO;
import eu.openanalytics.featurematrix.exception.InvalidSnapshotException;
import eu.openanalytics.featurematrix.exception.SnapshotNotFoundException;
import eu.openanalytics.featurematrix.model.ModelMapper;
import eu.openanalytics.featurematrix.model.NormalizationInfo;
import eu.openanalytics.featurematrix.model.Snapshot;
import eu.openanalytics.featurematrix.model.ValueStore;
import eu.openanalytics.featurematrix.repository.SnapshotRecord;
import eu.openanalytics.featurematrix.repository.SnapshotRepository;

/**
 * Stores feature matrices as named snapshots. A snapshot is written as a single JSON document,
 * so a save either stores the complete matrix with its metadata or nothing.
 */
@Service
public class SnapshotService {

    private final SnapshotRepository snapshotRepository;
    private final ObjectMapper objectMapper;
    private final ModelMapper modelMapper;
    private final Clock clock;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    public SnapshotService(SnapshotRepository snapshotRepository, ObjectMapper objectMapper, ModelMapper modelMapper, Clock clock) {
        this.snapshotRepository = snapshotRepository;
        this.objectMapper = objectMapper;
        this.modelMapper = modelMapper;
        this.clock = clock;
    }

    public Snapshot loadSnapshot(String name) throws SnapshotNotFoundException {
        SnapshotRecord record = snapshotRepository.findByName(name)
                .orElseThrow(() -> new SnapshotNotFoundException(name));
        return deserialize(record);
    }

    public SnapshotDTO getSnapshot(String name) throws SnapshotNotFoundException {
        return modelMapper.map(loadSnapshot(name));
    }

    public boolean exists(String name) {
        return snapshotRepository.findByName(name).isPresent();
    }

    /**
     * Saves the store under the given name, replacing any snapshot with that name.
     */
    public Snapshot saveSnapshot(String name, ValueStore store, NormalizationInfo normalizationInfo) {
        Snapshot snapshot = Snapshot.builder()
                .name(name)
                .store(store)
                .normalizationInfo(normalizationInfo)
                .createdOn(LocalDateTime.now(clock))
                .build();

        Optional<SnapshotRecord> existing = snapshotRepository.findByName(name);
        SnapshotRecord record = SnapshotRecord.builder()
                .id(existing.map(SnapshotRecord::getId).orElse(null))
                .name(name)
                .rowCount(store.getRowCount())
                .columnCount(store.getColumnCount())
                .normalized(normalizationInfo != null)
                .payload(serialize(snapshot))
                .createdOn(snapshot.getCreatedOn())
                .build();
        snapshotRepository.save(record);

        logger.info(String.format("Saved snapshot '%s' (%d time series x %d operations)%s", name,
                store.getRowCount(), store.getColumnCount(), existing.isPresent() ? ", replacing the previous version" : ""));
        return snapshot;
    }

    public List<SnapshotSummaryDTO> listSnapshots() {
        return snapshotRepository.findAllByOrderByNameAsc().stream()
                .map(modelMapper::map)
                .toList();
    }

    public void deleteSnapshot(String name) throws SnapshotNotFoundException {
        SnapshotRecord record = snapshotRepository.findByName(name)
                .orElseThrow(() -> new SnapshotNotFoundException(name));
        snapshotRepository.delete(record);
        logger.info(String.format("Deleted snapshot '%s'", name));
    }

    private String serialize(Snapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(modelMapper.map(snapshot));
        } catch (JsonProcessingException e) {
            throw new InvalidSnapshotException("Snapshot '%s' cannot be serialized: %s", snapshot.getName(), e.getMessage());
        }
    }

    private Snapshot deserialize(SnapshotRecord record) {
        try {
            SnapshotDTO snapshotDTO = objectMapper.readValue(record.getPayload(), SnapshotDTO.class);
            return modelMapper.map(snapshotDTO).withName(record.getName());
        } catch (JsonProcessingException e) {
            throw new InvalidSnapshotException("Stored snapshot '%s' cannot be read: %s", record.getName(), e.getMessage());
        }
    }
}
