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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import eu.openanalytics.featurematrix.dto.CurationRequestDTO;
import eu.openanalytics.featurematrix.dto.SnapshotSummaryDTO;
import eu.openanalytics.featurematrix.enumeration.CurationErrorType;
import eu.openanalytics.featurematrix.exception.CurationException;
import eu.openanalytics.featurematrix.exception.SnapshotNotFoundException;
import eu.openanalytics.featurematrix.model.ModelMapper;
import eu.openanalytics.featurematrix.service.SnapshotService;
import eu.openanalytics.featurematrix.service.curation.CurationService;

@MockitoSettings(strictness = Strictness.STRICT_STUBS)
@ExtendWith(MockitoExtension.class)
public class ApiExceptionHandlerTest {

    private <T> T mockUnimplemented(Class<T> clazz) {
        return mock(clazz, invocation -> {
            throw new IllegalStateException(String.format("[%s:%s] must be stubbed with arguments [%s]!", invocation.getMock().getClass().getSimpleName(), invocation.getMethod().getName(), Arrays.toString(invocation.getArguments())));
        });
    }

    private SnapshotService snapshotService;
    private CurationService curationService;
    private MockMvc mockMvc;

    @BeforeEach
    public void before() {
        snapshotService = mockUnimplemented(SnapshotService.class);
        curationService = mockUnimplemented(CurationService.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new SnapshotController(snapshotService, new ModelMapper()), new CurationController(curationService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    public void listsSnapshots() throws Exception {
        doReturn(List.of(SnapshotSummaryDTO.builder().name("screen1").timeSeriesCount(3).operationCount(4).build()))
                .when(snapshotService).listSnapshots();

        mockMvc.perform(get("/snapshots"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("screen1"))
                .andExpect(jsonPath("$[0].operationCount").value(4));
    }

    @Test
    public void unknownSnapshotIsNotFound() throws Exception {
        doThrow(new SnapshotNotFoundException("screen9")).when(snapshotService).getSnapshot("screen9");

        mockMvc.perform(get("/snapshots/screen9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Snapshot with name 'screen9' not found"))
                .andExpect(jsonPath("$.path").value("/snapshots/screen9"));
    }

    @Test
    public void deletedSnapshotGivesNoContent() throws Exception {
        doNothing().when(snapshotService).deleteSnapshot("screen1");

        mockMvc.perform(delete("/snapshots/screen1"))
                .andExpect(status().isNoContent());
    }

    @Test
    public void curationFailureIsUnprocessable() throws Exception {
        doThrow(new CurationException(CurationErrorType.ALL_ROWS_FILTERED, "All 3 time series have a fraction of good values below the row threshold 0.80"))
                .when(curationService).curate(any(CurationRequestDTO.class));

        mockMvc.perform(post("/curations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceName\": \"screen1\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorType").value("ALL_ROWS_FILTERED"));
    }

    @Test
    public void invalidRequestIsBadRequest() throws Exception {
        mockMvc.perform(post("/curations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceName\": \"screen1\", \"rowThreshold\": 1.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors[0]").value("rowThreshold: Row threshold must be between 0 and 1"));

        mockMvc.perform(post("/curations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceName\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid JSON request body"));
    }
}
