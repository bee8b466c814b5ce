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

import static eu.openanalytics.featurematrix.support.FeatureMatrixTestData.master;
import static eu.openanalytics.featurematrix.support.FeatureMatrixTestData.operation;
import static eu.openanalytics.featurematrix.support.FeatureMatrixTestData.timeSeries;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import com.fasterxml.jackson.databind.ObjectMapper;

import eu.openanalytics.featurematrix.dto.SnapshotDTO;
import eu.openanalytics.featurematrix.dto.SnapshotSummaryDTO;
import eu.openanalytics.featurematrix.enumeration.CurationStage;
import eu.openanalytics.featurematrix.enumeration.QualityCode;
import eu.openanalytics.featurematrix.exception.InvalidSnapshotException;
import eu.openanalytics.featurematrix.exception.SnapshotNotFoundException;
import eu.openanalytics.featurematrix.model.ModelMapper;
import eu.openanalytics.featurematrix.model.NormalizationInfo;
import eu.openanalytics.featurematrix.model.Snapshot;
import eu.openanalytics.featurematrix.model.ValueStore;
import eu.openanalytics.featurematrix.repository.SnapshotRecord;
import eu.openanalytics.featurematrix.repository.SnapshotRepository;

@MockitoSettings(strictness = Strictness.STRICT_STUBS)
@ExtendWith(MockitoExtension.class)
public class SnapshotServiceTest {

    private <T> T mockUnimplemented(Class<T> clazz) {
        return mock(clazz, invocation -> {
            throw new IllegalStateException(String.format("[%s:%s] must be stubbed with arguments [%s]!", invocation.getMock().getClass().getSimpleName(), invocation.getMethod().getName(), Arrays.toString(invocation.getArguments())));
        });
    }

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 12, 30);

    private SnapshotRepository snapshotRepository;
    private SnapshotService snapshotService;

    @BeforeEach
    public void before() {
        snapshotRepository = mockUnimplemented(SnapshotRepository.class);
        Clock clock = Clock.fixed(Instant.from(NOW.atOffset(ZoneOffset.UTC)), ZoneOffset.UTC);
        snapshotService = new SnapshotService(snapshotRepository, new ObjectMapper().findAndRegisterModules(), new ModelMapper(), clock);
    }

    private ValueStore store() {
        ValueStore store = ValueStore.create(
                List.of(timeSeries(1, 1, 2, 3, 4), timeSeries(2, 4, 3, 2, 1)),
                List.of(operation(10, 1, "mean"), operation(11, 1, "abs(skewness)"), operation(12, 2, "firstMin")),
                List.of(master(1, "DistributionStats"), master(2, "FirstMin")));
        store.setCell(0, 0, 2.5, QualityCode.GOOD, 0.125);
        store.setCell(0, 1, 0.0, QualityCode.GOOD, 0.0);
        store.setCell(0, 2, Double.NaN, QualityCode.NOT_APPLICABLE, 0.01);
        store.setCell(1, 0, 2.5, QualityCode.GOOD, 0.25);
        store.setCell(1, 1, Double.NaN, QualityCode.ERROR, 0.0);
        return store;
    }

    private SnapshotRecord saveAndCapture(String name, ValueStore store, NormalizationInfo info) {
        doReturn(Optional.empty()).when(snapshotRepository).findByName(name);
        doReturn(null).when(snapshotRepository).save(any(SnapshotRecord.class));

        snapshotService.saveSnapshot(name, store, info);

        ArgumentCaptor<SnapshotRecord> captor = ArgumentCaptor.forClass(SnapshotRecord.class);
        verify(snapshotRepository).save(captor.capture());
        return captor.getValue();
    }

    @Test
    public void snapshotSurvivesARoundTrip() throws SnapshotNotFoundException {
        NormalizationInfo info = NormalizationInfo.builder()
                .normFunction("zscore")
                .rowThreshold(0.8)
                .colThreshold(1.0)
                .trainingTimeSeriesIds(List.of(2L))
                .codeToRun("curate('zscore', [0.800000, 1.000000])")
                .stages(List.of(NormalizationInfo.StageReport.builder().stage(CurationStage.ROW_FILTER).rowsBefore(3).rowsAfter(2).columnsBefore(3).columnsAfter(3).build()))
                .build();
        ValueStore original = store();

        SnapshotRecord record = saveAndCapture("screen1", original, info);
        Assertions.assertNull(record.getId());
        Assertions.assertEquals(2, record.getRowCount());
        Assertions.assertEquals(3, record.getColumnCount());
        Assertions.assertTrue(record.isNormalized());
        Assertions.assertEquals(NOW, record.getCreatedOn());

        doReturn(Optional.of(record)).when(snapshotRepository).findByName("screen1");
        Snapshot loaded = snapshotService.loadSnapshot("screen1");

        ValueStore store = loaded.getStore();
        Assertions.assertEquals("screen1", loaded.getName());
        Assertions.assertEquals(NOW, loaded.getCreatedOn());
        Assertions.assertEquals(info, loaded.getNormalizationInfo());
        Assertions.assertEquals(original.getTimeSeries(), store.getTimeSeries());
        Assertions.assertEquals(original.getMasterOperations(), store.getMasterOperations());
        Assertions.assertEquals(original.getOperations(), store.getOperations());
        Assertions.assertArrayEquals(original.getQualityCodes(), store.getQualityCodes());
        for (int r = 0; r < original.getRowCount(); r++) {
            Assertions.assertArrayEquals(original.getValues()[r], store.getValues()[r]);
            Assertions.assertArrayEquals(original.getCalcTimes()[r], store.getCalcTimes()[r]);
        }
        Assertions.assertTrue(Double.isNaN(store.getValue(1, 1)));
        Assertions.assertTrue(Double.isNaN(store.getCalcTime(1, 2)));
    }

    @Test
    public void missingValuesAreWrittenAsNull() throws SnapshotNotFoundException {
        SnapshotRecord record = saveAndCapture("screen1", store(), null);
        doReturn(Optional.of(record)).when(snapshotRepository).findByName("screen1");

        SnapshotDTO snapshotDTO = snapshotService.getSnapshot("screen1");

        Assertions.assertEquals(2.5, snapshotDTO.getValues()[0][0]);
        Assertions.assertNull(snapshotDTO.getValues()[0][2]);
        Assertions.assertNull(snapshotDTO.getCalcTimes()[1][2]);
        Assertions.assertEquals(QualityCode.NOT_APPLICABLE.getCode(), snapshotDTO.getQuality()[0][2]);
        Assertions.assertFalse(record.getPayload().contains("NaN"));
        Assertions.assertFalse(record.isNormalized());
        Assertions.assertNull(snapshotDTO.getNormalizationInfo());
    }

    @Test
    public void savingUnderAnExistingNameReplacesIt() {
        SnapshotRecord existing = SnapshotRecord.builder().id(7L).name("screen1").payload("{}").build();
        doReturn(Optional.of(existing)).when(snapshotRepository).findByName("screen1");
        doReturn(null).when(snapshotRepository).save(any(SnapshotRecord.class));

        snapshotService.saveSnapshot("screen1", store(), null);

        ArgumentCaptor<SnapshotRecord> captor = ArgumentCaptor.forClass(SnapshotRecord.class);
        verify(snapshotRepository).save(captor.capture());
        Assertions.assertEquals(7L, captor.getValue().getId());
    }

    @Test
    public void unknownSnapshot() {
        doReturn(Optional.empty()).when(snapshotRepository).findByName("nope");

        SnapshotNotFoundException ex = Assertions.assertThrows(SnapshotNotFoundException.class, () -> snapshotService.loadSnapshot("nope"));
        Assertions.assertEquals("Snapshot with name 'nope' not found", ex.getMessage());
        Assertions.assertThrows(SnapshotNotFoundException.class, () -> snapshotService.deleteSnapshot("nope"));
    }

    @Test
    public void corruptPayloadIsRejected() {
        SnapshotRecord broken = SnapshotRecord.builder().id(1L).name("broken").payload("{\"values\": [[1.0, 2.0]]").build();
        doReturn(Optional.of(broken)).when(snapshotRepository).findByName("broken");

        Assertions.assertThrows(InvalidSnapshotException.class, () -> snapshotService.loadSnapshot("broken"));
    }

    @Test
    public void deleteAndList() throws SnapshotNotFoundException {
        SnapshotRecord record = SnapshotRecord.builder().id(3L).name("a").rowCount(4).columnCount(5).normalized(true).createdOn(NOW).payload("{}").build();
        doReturn(Optional.of(record)).when(snapshotRepository).findByName("a");
        doNothing().when(snapshotRepository).delete(record);
        doReturn(List.of(record)).when(snapshotRepository).findAllByOrderByNameAsc();

        List<SnapshotSummaryDTO> summaries = snapshotService.listSnapshots();
        snapshotService.deleteSnapshot("a");

        Assertions.assertEquals(1, summaries.size());
        Assertions.assertEquals("a", summaries.get(0).getName());
        Assertions.assertEquals(4, summaries.get(0).getTimeSeriesCount());
        Assertions.assertTrue(summaries.get(0).isNormalized());
        verify(snapshotRepository).delete(record);
    }
}
