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

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import eu.openanalytics.featurematrix.dto.DatasetDTO;
import eu.openanalytics.featurematrix.dto.SnapshotDTO;
import eu.openanalytics.featurematrix.dto.SnapshotSummaryDTO;
import eu.openanalytics.featurematrix.exception.SnapshotNotFoundException;
import eu.openanalytics.featurematrix.model.ModelMapper;
import eu.openanalytics.featurematrix.service.SnapshotService;

@RestController
@RequestMapping("/snapshots")
@Validated
public class SnapshotController {

    private final SnapshotService snapshotService;
    private final ModelMapper modelMapper;

    public SnapshotController(SnapshotService snapshotService, ModelMapper modelMapper) {
        this.snapshotService = snapshotService;
        this.modelMapper = modelMapper;
    }

    /**
     * Registers a new, not yet computed feature matrix.
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SnapshotDTO createSnapshot(@Validated @RequestBody DatasetDTO datasetDTO) {
        return modelMapper.map(snapshotService.saveSnapshot(datasetDTO.getName(), modelMapper.map(datasetDTO), null));
    }

    @GetMapping
    public List<SnapshotSummaryDTO> getAllSnapshots() {
        return snapshotService.listSnapshots();
    }

    @GetMapping("/{name}")
    public SnapshotDTO getSnapshot(@PathVariable String name) throws SnapshotNotFoundException {
        return snapshotService.getSnapshot(name);
    }

    @DeleteMapping("/{name}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteSnapshot(@PathVariable String name) throws SnapshotNotFoundException {
        snapshotService.deleteSnapshot(name);
    }
}
