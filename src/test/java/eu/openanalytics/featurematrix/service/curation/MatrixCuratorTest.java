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

import static eu.openanalytics.featurematrix.support.FeatureMatrixTestData.computedStore;
import static eu.openanalytics.featurematrix.support.FeatureMatrixTestData.master;
import static eu.openanalytics.featurematrix.support.FeatureMatrixTestData.operation;
import static eu.openanalytics.featurematrix.support.FeatureMatrixTestData.timeSeries;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import eu.openanalytics.featurematrix.enumeration.CurationErrorType;
import eu.openanalytics.featurematrix.enumeration.CurationStage;
import eu.openanalytics.featurematrix.enumeration.QualityCode;
import eu.openanalytics.featurematrix.exception.CurationException;
import eu.openanalytics.featurematrix.model.NormalizationInfo;
import eu.openanalytics.featurematrix.model.NormalizationInfo.StageReport;
import eu.openanalytics.featurematrix.model.ValueStore;

public class MatrixCuratorTest {

    private static final double NaN = Double.NaN;

    private final MatrixCurator matrixCurator = new MatrixCurator(new MatrixNormalizer());

    private static CurationOptions options(String normFunction, double rowThreshold, double colThreshold) {
        return CurationOptions.builder()
                .normFunction(normFunction)
                .rowThreshold(rowThreshold)
                .colThreshold(colThreshold)
                .build();
    }

    private static StageReport stage(NormalizationInfo info, CurationStage stage) {
        return info.getStages().stream().filter(s -> s.getStage() == stage).findFirst().orElseThrow();
    }

    @Test
    public void constantColumnIsDropped() {
        ValueStore input = computedStore(new double[][] {
                {1, 5, 4},
                {2, 5, 7},
                {3, 5, 9}});

        CurationResult result = matrixCurator.curate(input, CurationOptions.defaults());

        ValueStore store = result.getStore();
        Assertions.assertEquals(3, store.getRowCount());
        Assertions.assertEquals(2, store.getColumnCount());
        Assertions.assertEquals(List.of(1L, 3L), store.getOperations().stream().map(o -> o.getId()).toList());
        StageReport degenerate = stage(result.getNormalizationInfo(), CurationStage.DEGENERATE_COLUMNS);
        Assertions.assertEquals(3, degenerate.getColumnsBefore());
        Assertions.assertEquals(2, degenerate.getColumnsAfter());
        // scaled robust sigmoid maps the training values onto [0, 1]
        Assertions.assertEquals(0.0, store.getValue(0, 0), 1e-12);
        Assertions.assertEquals(1.0, store.getValue(2, 0), 1e-12);
        // the input is never modified
        Assertions.assertEquals(3, input.getColumnCount());
        Assertions.assertEquals(5.0, input.getValue(0, 1));
    }

    @Test
    public void rowWithoutGoodValuesIsDropped() {
        double[][] values = new double[10][1];
        for (int r = 0; r < 10; r++) {
            values[r][0] = r == 4 ? NaN : r * r;
        }

        CurationResult result = matrixCurator.curate(computedStore(values), options("zscore", 0.8, 1.0));

        ValueStore store = result.getStore();
        Assertions.assertEquals(9, store.getRowCount());
        Assertions.assertEquals(1, store.getColumnCount());
        Assertions.assertFalse(store.getTimeSeries().stream().anyMatch(ts -> ts.getId() == 5L));
        Assertions.assertEquals(9, store.countCells(QualityCode.GOOD));
        Assertions.assertTrue(stage(result.getNormalizationInfo(), CurationStage.DEGENERATE_ROWS).isSkipped());
    }

    @Test
    public void noneLeavesValuesUntouched() {
        ValueStore input = computedStore(new double[][] {
                {0.1, 1e10, -3.25},
                {0.7, 2e10, 42.0},
                {Math.PI, -1e-9, 7.5}});

        CurationResult result = matrixCurator.curate(input, options("none", 0.8, 1.0));

        double[][] expected = input.getValues();
        double[][] actual = result.getStore().getValues();
        for (int r = 0; r < expected.length; r++) {
            for (int c = 0; c < expected[r].length; c++) {
                Assertions.assertEquals(Double.doubleToRawLongBits(expected[r][c]), Double.doubleToRawLongBits(actual[r][c]));
            }
        }
        Assertions.assertTrue(stage(result.getNormalizationInfo(), CurationStage.NORMALIZATION).isSkipped());
        Assertions.assertEquals("none", result.getNormalizationInfo().getNormFunction());
    }

    @Test
    public void nothingIsAnAliasOfNone() {
        ValueStore input = computedStore(new double[][] {{1, 2}, {3, 5}});

        CurationResult result = matrixCurator.curate(input, options("nothing", 0.8, 1.0));

        Assertions.assertEquals(5.0, result.getStore().getValue(1, 1));
    }

    @Test
    public void canonicalizationTurnsNonFiniteGoodValuesIntoErrors() {
        ValueStore input = computedStore(new double[][] {
                {1, Double.POSITIVE_INFINITY, 5},
                {2, 4, 1},
                {3, 9, 7}});

        CurationResult result = matrixCurator.curate(input, options("none", 0, 0));

        ValueStore store = result.getStore();
        Assertions.assertEquals(QualityCode.ERROR, store.getQuality(0, 1));
        Assertions.assertTrue(Double.isNaN(store.getValue(0, 1)));
        Assertions.assertEquals(QualityCode.GOOD, input.getQuality(0, 1));
    }

    @Test
    public void zeroThresholdsDisableFiltering() {
        ValueStore input = computedStore(new double[][] {
                {1, 5, NaN},
                {2, 3, NaN},
                {4, 1, 6}});

        CurationResult result = matrixCurator.curate(input, options("none", 0, 0));

        Assertions.assertEquals(3, result.getStore().getRowCount());
        Assertions.assertEquals(2, result.getStore().getColumnCount());
        Assertions.assertTrue(stage(result.getNormalizationInfo(), CurationStage.ROW_FILTER).isSkipped());
        Assertions.assertTrue(stage(result.getNormalizationInfo(), CurationStage.COLUMN_FILTER).isSkipped());
    }

    @Test
    public void fullThresholdsKeepOnlyCompleteRowsAndColumns() {
        ValueStore input = computedStore(new double[][] {
                {1, 2, 3},
                {2, NaN, 5},
                {4, 1, 7},
                {8, 3, 2}});

        CurationResult result = matrixCurator.curate(input, options("none", 1.0, 1.0));

        Assertions.assertEquals(3, result.getStore().getRowCount());
        Assertions.assertEquals(3, result.getStore().getColumnCount());
        Assertions.assertEquals(0, result.getStore().countCells(QualityCode.ERROR));
    }

    @Test
    public void thresholdsAreInclusive() {
        ValueStore input = computedStore(new double[][] {
                {1, NaN, 3},
                {2, 4, NaN},
                {4, 1, 7},
                {8, 3, 2}});

        CurationResult result = matrixCurator.curate(input, options("none", 0.6, 0.75));

        Assertions.assertEquals(4, result.getStore().getRowCount());
        Assertions.assertEquals(3, result.getStore().getColumnCount());

        CurationResult strict = matrixCurator.curate(input, options("none", 0.6, 0.8));
        Assertions.assertEquals(1, strict.getStore().getColumnCount());
    }

    @Test
    public void constantRowsAreDropped() {
        ValueStore input = computedStore(new double[][] {
                {1, 2, 3},
                {6, 6, 6},
                {4, 1, 7}});

        CurationResult result = matrixCurator.curate(input, options("none", 0.8, 1.0));

        Assertions.assertEquals(2, result.getStore().getRowCount());
        Assertions.assertEquals(List.of(1L, 3L), result.getStore().getTimeSeries().stream().map(ts -> ts.getId()).toList());
    }

    @Test
    public void curationIsIdempotent() {
        ValueStore input = computedStore(new double[][] {
                {1, 5, 4, NaN},
                {2, 5, 7, 1},
                {3, 5, 9, 2},
                {7, 5, 1, 8}});

        ValueStore once = matrixCurator.curate(input, CurationOptions.defaults()).getStore();
        ValueStore twice = matrixCurator.curate(once, CurationOptions.defaults()).getStore();

        Assertions.assertEquals(once.getRowCount(), twice.getRowCount());
        Assertions.assertEquals(once.getColumnCount(), twice.getColumnCount());
        Assertions.assertEquals(once.getTimeSeries(), twice.getTimeSeries());
        Assertions.assertEquals(once.getOperations(), twice.getOperations());
    }

    @Test
    public void trainingSetDrivesTheNormalization() {
        ValueStore input = computedStore(new double[][] {
                {0, 10},
                {10, 0},
                {20, 40}});

        CurationOptions options = options("maxmin", 0.8, 1.0).toBuilder()
                .trainingTimeSeriesIds(List.of(1L, 2L))
                .build();
        CurationResult result = matrixCurator.curate(input, options);

        ValueStore store = result.getStore();
        Assertions.assertEquals(0.0, store.getValue(0, 0), 1e-12);
        Assertions.assertEquals(1.0, store.getValue(1, 0), 1e-12);
        Assertions.assertEquals(2.0, store.getValue(2, 0), 1e-12);
        Assertions.assertEquals(4.0, store.getValue(2, 1), 1e-12);
        Assertions.assertEquals(List.of(1L, 2L), result.getNormalizationInfo().getTrainingTimeSeriesIds());
    }

    @Test
    public void trainingSetWithoutRemainingRowsFails() {
        ValueStore input = computedStore(new double[][] {{0, 10}, {10, 0}});
        CurationOptions options = options("maxmin", 0.8, 1.0).toBuilder()
                .trainingTimeSeriesIds(List.of(42L))
                .build();

        CurationException ex = Assertions.assertThrows(CurationException.class, () -> matrixCurator.curate(input, options));
        Assertions.assertEquals(CurationErrorType.INVALID_TRAINING_SET, ex.getErrorType());
    }

    @Test
    public void columnLeftWithoutValuesByNormalizationIsDropped() {
        // the training rows are constant in the first column, so maxmin divides by zero there
        ValueStore input = computedStore(new double[][] {
                {0, 1},
                {0, 2},
                {5, 7}});
        CurationOptions options = options("maxmin", 0.8, 1.0).toBuilder()
                .trainingTimeSeriesIds(List.of(1L, 2L))
                .build();

        CurationResult result = matrixCurator.curate(input, options);

        ValueStore store = result.getStore();
        Assertions.assertEquals(3, store.getRowCount());
        Assertions.assertEquals(List.of(2L), store.getOperations().stream().map(o -> o.getId()).toList());
        Assertions.assertEquals(0.0, store.getValue(0, 0), 1e-12);
        Assertions.assertEquals(1.0, store.getValue(1, 0), 1e-12);
        Assertions.assertEquals(6.0, store.getValue(2, 0), 1e-12);
        Assertions.assertEquals(3, store.countCells(QualityCode.GOOD));

        StageReport revalidation = stage(result.getNormalizationInfo(), CurationStage.REVALIDATION);
        Assertions.assertFalse(revalidation.isSkipped());
        Assertions.assertEquals(3, revalidation.getRowsBefore());
        Assertions.assertEquals(3, revalidation.getRowsAfter());
        Assertions.assertEquals(2, revalidation.getColumnsBefore());
        Assertions.assertEquals(1, revalidation.getColumnsAfter());
    }

    @Test
    public void normalizationLeavingNoValuesFails() {
        ValueStore input = computedStore(new double[][] {
                {0, 1},
                {0, 1},
                {5, 7}});
        CurationOptions options = options("maxmin", 0.8, 1.0).toBuilder()
                .trainingTimeSeriesIds(List.of(1L, 2L))
                .build();

        CurationException ex = Assertions.assertThrows(CurationException.class, () -> matrixCurator.curate(input, options));
        Assertions.assertEquals(CurationErrorType.NO_GOOD_VALUES_AFTER_NORMALIZATION, ex.getErrorType());
        Assertions.assertTrue(ex.getMessage().contains("maxmin"));
    }

    @Test
    public void everythingFilteredFails() {
        ValueStore input = computedStore(new double[][] {
                {NaN, NaN},
                {1, NaN}});

        CurationException rows = Assertions.assertThrows(CurationException.class, () -> matrixCurator.curate(input, options("none", 0.8, 1.0)));
        Assertions.assertEquals(CurationErrorType.ALL_ROWS_FILTERED, rows.getErrorType());

        ValueStore constant = computedStore(new double[][] {{1, 2}, {1, 2}});
        CurationException cols = Assertions.assertThrows(CurationException.class, () -> matrixCurator.curate(constant, CurationOptions.defaults()));
        Assertions.assertEquals(CurationErrorType.ALL_COLUMNS_FILTERED, cols.getErrorType());
    }

    @Test
    public void invalidOptionsAreRejected() {
        ValueStore input = computedStore(new double[][] {{1, 2}, {3, 4}});

        CurationException unknown = Assertions.assertThrows(CurationException.class, () -> matrixCurator.curate(input, options("quantile", 0.8, 1.0)));
        Assertions.assertEquals(CurationErrorType.UNKNOWN_NORMALIZATION_FUNCTION, unknown.getErrorType());

        CurationException threshold = Assertions.assertThrows(CurationException.class, () -> matrixCurator.curate(input, options("none", 1.2, 1.0)));
        Assertions.assertEquals(CurationErrorType.INVALID_OPTIONS, threshold.getErrorType());

        CurationException subset = Assertions.assertThrows(CurationException.class, () -> matrixCurator.curate(input,
                CurationOptions.builder().rowSubset(List.of(0, 5)).build()));
        Assertions.assertEquals(CurationErrorType.INVALID_OPTIONS, subset.getErrorType());
    }

    @Test
    public void subsetIsAppliedBeforeFiltering() {
        ValueStore input = computedStore(new double[][] {
                {1, 2, 3},
                {NaN, NaN, NaN},
                {4, 1, 7},
                {8, 3, 2}});

        CurationOptions options = options("none", 0.8, 1.0).toBuilder()
                .rowSubset(List.of(3, 0, 2))
                .columnSubset(List.of(0, 2))
                .build();
        CurationResult result = matrixCurator.curate(input, options);

        ValueStore store = result.getStore();
        Assertions.assertEquals(List.of(4L, 1L, 3L), store.getTimeSeries().stream().map(ts -> ts.getId()).toList());
        Assertions.assertEquals(List.of(1L, 3L), store.getOperations().stream().map(o -> o.getId()).toList());
        Assertions.assertEquals(2.0, store.getValue(0, 1));
    }

    @Test
    public void orphanedMastersArePrunedOnlyOnRequest() {
        ValueStore input = new ValueStore(
                List.of(timeSeries(1, 1, 2, 3, 4), timeSeries(2, 3, 1, 4, 1), timeSeries(3, 9, 8, 1, 2)),
                List.of(operation(1, 10, "mean"), operation(2, 20, "ac1")),
                List.of(master(10, "DistributionStats"), master(20, "AutoCorrStats"), master(30, "FirstMin")),
                new double[][] {{1, 5}, {2, 5}, {3, 5}},
                new int[][] {{0, 0}, {0, 0}, {0, 0}},
                new double[][] {{0, 0}, {0, 0}, {0, 0}});

        CurationResult retained = matrixCurator.curate(input, options("none", 0.8, 1.0));
        Assertions.assertEquals(3, retained.getStore().getMasterOperations().size());

        CurationResult pruned = matrixCurator.curate(input, options("none", 0.8, 1.0).toBuilder()
                .pruneOrphanedMasters(true)
                .build());
        Assertions.assertEquals(List.of(10L), pruned.getStore().getMasterOperations().stream().map(m -> m.getId()).toList());
        Assertions.assertFalse(stage(pruned.getNormalizationInfo(), CurationStage.ORPHANED_MASTERS).isSkipped());
    }

    @Test
    public void normalizationInfoDescribesTheRun() {
        ValueStore input = computedStore(new double[][] {{1, 2}, {3, 5}, {4, 1}});

        NormalizationInfo info = matrixCurator.curate(input, options("SQzscore", 0.5, 0.75)).getNormalizationInfo();

        Assertions.assertEquals("robustZscore", info.getNormFunction());
        Assertions.assertEquals(0.5, info.getRowThreshold());
        Assertions.assertEquals(0.75, info.getColThreshold());
        Assertions.assertEquals("curate('robustZscore', [0.500000, 0.750000])", info.getCodeToRun());
        Assertions.assertEquals(CurationStage.values().length, info.getStages().size());
    }

    @Test
    public void degeneracyHelpers() {
        Assertions.assertTrue(MatrixCurator.isDegenerate(new double[] {2, NaN, 2}));
        Assertions.assertTrue(MatrixCurator.isDegenerate(new double[] {NaN, NaN}));
        Assertions.assertFalse(MatrixCurator.isDegenerate(new double[] {2, NaN, 2.5}));
        Assertions.assertEquals(0.5, MatrixCurator.goodFraction(new double[] {1, NaN}));
    }
}
