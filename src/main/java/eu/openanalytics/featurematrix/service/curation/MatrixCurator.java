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

import static eu.openanalytics.featurematrix.util.LoggerHelper.log;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.apache.commons.collections4.CollectionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.stereotype.Service;

import eu.openanalytics.featurematrix.enumeration.CurationErrorType;
import eu.openanalytics.featurematrix.enumeration.CurationStage;
import eu.openanalytics.featurematrix.enumeration.QualityCode;
import eu.openanalytics.featurematrix.exception.CurationException;
import eu.openanalytics.featurematrix.model.MasterOperation;
import eu.openanalytics.featurematrix.model.NormalizationInfo;
import eu.openanalytics.featurematrix.model.Operation;
import eu.openanalytics.featurematrix.model.ValueStore;

/**
 * Trims and normalizes a feature matrix. The stages run in a fixed order, each on the output of the previous:
 * <ol>
 *     <li>restriction to an explicit row/column subset</li>
 *     <li>canonicalization of bad values to NaN</li>
 *     <li>row filtering on the fraction of good values</li>
 *     <li>column filtering on the fraction of good values, over the remaining rows</li>
 *     <li>removal of constant columns</li>
 *     <li>removal of constant rows</li>
 *     <li>normalization, optionally trained on a subset of the time series</li>
 *     <li>re-validation of the normalized matrix</li>
 *     <li>optional pruning of master operations that no operation references anymore</li>
 * </ol>
 * The input store is never modified. A stage that would remove every row or column aborts the run with a
 * {@link CurationException}.
 */
@Service
public class MatrixCurator {

    /** Smallest range a column or row needs to not be considered constant. */
    public static final double EPS = Math.ulp(1.0);

    private final MatrixNormalizer normalizer;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    public MatrixCurator(MatrixNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public CurationResult curate(ValueStore input, CurationOptions options) {
        validateOptions(options);
        NormalizationFunction function = NormalizationFunction.fromName(options.getNormFunction())
                .orElseThrow(() -> new CurationException(CurationErrorType.UNKNOWN_NORMALIZATION_FUNCTION,
                        "Unknown normalization function '%s'", options.getNormFunction()));
        CurationContext ctx = new CurationContext(options, function);

        log(logger, ctx, "Curating a %d x %d feature matrix", input.getRowCount(), input.getColumnCount());

        ValueStore store = subset(ctx, input);
        store = canonicalize(ctx, store);
        store = filterRows(ctx, store);
        store = filterColumns(ctx, store);
        store = removeDegenerateColumns(ctx, store);
        store = removeDegenerateRows(ctx, store);
        store = normalize(ctx, store);
        store = revalidate(ctx, store);
        store = handleOrphanedMasters(ctx, store);

        long badCells = countNaN(store.getValues());
        log(logger, ctx, "Curation finished: %d x %d matrix with %d bad entries (%.2f%%)",
                store.getRowCount(), store.getColumnCount(), badCells,
                100.0 * badCells / ((long) store.getRowCount() * store.getColumnCount()));

        NormalizationInfo info = NormalizationInfo.builder()
                .normFunction(function.getName())
                .rowThreshold(options.getRowThreshold())
                .colThreshold(options.getColThreshold())
                .trainingTimeSeriesIds(List.copyOf(options.getTrainingTimeSeriesIds()))
                .pruneOrphanedMasters(options.isPruneOrphanedMasters())
                .codeToRun(String.format(Locale.ROOT, "curate('%s', [%f, %f])",
                        function.getName(), options.getRowThreshold(), options.getColThreshold()))
                .stages(ctx.getStages())
                .build();
        return new CurationResult(store, info);
    }

    private void validateOptions(CurationOptions options) {
        checkThreshold("row", options.getRowThreshold());
        checkThreshold("column", options.getColThreshold());
        if (options.getRowSubset() == null || options.getColumnSubset() == null || options.getTrainingTimeSeriesIds() == null) {
            throw new CurationException(CurationErrorType.INVALID_OPTIONS, "Subsets and training ids must not be null, use an empty list instead");
        }
    }

    private void checkThreshold(String dimension, double threshold) {
        if (!(threshold >= 0 && threshold <= 1)) {
            throw new CurationException(CurationErrorType.INVALID_OPTIONS,
                    "The %s threshold must lie in [0, 1], got %s", dimension, threshold);
        }
    }

    // Stage 1
    private ValueStore subset(CurationContext ctx, ValueStore store) {
        List<Integer> rowSubset = ctx.getOptions().getRowSubset();
        List<Integer> columnSubset = ctx.getOptions().getColumnSubset();

        ValueStore result = store;
        if (rowSubset.isEmpty() && columnSubset.isEmpty()) {
            ctx.skip(CurationStage.SUBSET, store);
        } else {
            int[] rows = rowSubset.isEmpty() ? IntStream.range(0, store.getRowCount()).toArray() : toIndices(rowSubset, store.getRowCount(), "row");
            int[] cols = columnSubset.isEmpty() ? IntStream.range(0, store.getColumnCount()).toArray() : toIndices(columnSubset, store.getColumnCount(), "column");
            result = store.subset(rows, cols);
            ctx.record(CurationStage.SUBSET, store, result);
            log(logger, ctx, "Restricted to a subset of %d time series and %d operations", result.getRowCount(), result.getColumnCount());
        }

        if (result.getRowCount() == 0) {
            throw new CurationException(CurationErrorType.ALL_ROWS_FILTERED, "The feature matrix contains no time series");
        }
        if (result.getColumnCount() == 0) {
            throw new CurationException(CurationErrorType.ALL_COLUMNS_FILTERED, "The feature matrix contains no operations");
        }
        return result;
    }

    private int[] toIndices(List<Integer> subset, int size, String dimension) {
        for (Integer index : subset) {
            if (index == null || index < 0 || index >= size) {
                throw new CurationException(CurationErrorType.INVALID_OPTIONS,
                        "The %s subset contains index %s, outside of [0, %d)", dimension, index, size);
            }
        }
        return subset.stream().mapToInt(Integer::intValue).toArray();
    }

    // Stage 2
    private ValueStore canonicalize(CurationContext ctx, ValueStore store) {
        double[][] values = store.getValues();
        int[][] quality = store.getQualityCodes();
        int changed = 0;
        for (int r = 0; r < values.length; r++) {
            for (int c = 0; c < values[r].length; c++) {
                boolean good = quality[r][c] == QualityCode.GOOD.getCode();
                if (good && !Double.isFinite(values[r][c])) {
                    quality[r][c] = QualityCode.ERROR.getCode();
                    good = false;
                }
                if (!good && !Double.isNaN(values[r][c])) changed++;
                if (!good) values[r][c] = Double.NaN;
            }
        }
        ValueStore result = store.withValues(values, quality);
        ctx.record(CurationStage.CANONICALIZE, store, result);
        long badCells = countNaN(values);
        log(logger, ctx, "%d bad entries (%.2f%%) in the %d x %d matrix, %d canonicalized to NaN",
                badCells, 100.0 * badCells / ((long) store.getRowCount() * store.getColumnCount()),
                store.getRowCount(), store.getColumnCount(), changed);
        return result;
    }

    // Stage 3
    private ValueStore filterRows(CurationContext ctx, ValueStore store) {
        double threshold = ctx.getOptions().getRowThreshold();
        if (threshold == 0) {
            ctx.skip(CurationStage.ROW_FILTER, store);
            return store;
        }
        double[][] values = store.getValues();
        int[] keep = IntStream.range(0, store.getRowCount())
                .filter(r -> goodFraction(values[r]) >= threshold)
                .toArray();
        if (keep.length == 0) {
            throw new CurationException(CurationErrorType.ALL_ROWS_FILTERED,
                    "All %d time series have a fraction of good values below the row threshold %.2f", store.getRowCount(), threshold);
        }
        ValueStore result = store.selectRows(keep);
        ctx.record(CurationStage.ROW_FILTER, store, result);
        log(logger, ctx, "Row filtering (threshold %.2f) kept %d of %d time series", threshold, result.getRowCount(), store.getRowCount());
        return result;
    }

    // Stage 4
    private ValueStore filterColumns(CurationContext ctx, ValueStore store) {
        double threshold = ctx.getOptions().getColThreshold();
        if (threshold == 0) {
            ctx.skip(CurationStage.COLUMN_FILTER, store);
            return store;
        }
        double[][] values = store.getValues();
        int[] keep = IntStream.range(0, store.getColumnCount())
                .filter(c -> goodFraction(column(values, c)) >= threshold)
                .toArray();
        if (keep.length == 0) {
            throw new CurationException(CurationErrorType.ALL_COLUMNS_FILTERED,
                    "All %d operations have a fraction of good values below the column threshold %.2f", store.getColumnCount(), threshold);
        }
        ValueStore result = store.selectColumns(keep);
        ctx.record(CurationStage.COLUMN_FILTER, store, result);
        log(logger, ctx, "Column filtering (threshold %.2f) kept %d of %d operations", threshold, result.getColumnCount(), store.getColumnCount());
        return result;
    }

    // Stage 5
    private ValueStore removeDegenerateColumns(CurationContext ctx, ValueStore store) {
        if (store.getRowCount() < 2) {
            ctx.skip(CurationStage.DEGENERATE_COLUMNS, store);
            return store;
        }
        int[] keep = nonDegenerateColumns(store.getValues(), store.getColumnCount());
        if (keep.length == 0) {
            throw new CurationException(CurationErrorType.ALL_COLUMNS_FILTERED,
                    "All %d operations have constant outputs over the %d remaining time series", store.getColumnCount(), store.getRowCount());
        }
        ValueStore result = store.selectColumns(keep);
        ctx.record(CurationStage.DEGENERATE_COLUMNS, store, result);
        if (result.getColumnCount() < store.getColumnCount()) {
            log(logger, ctx, "Removed %d operations with constant outputs: from %d to %d",
                    store.getColumnCount() - result.getColumnCount(), store.getColumnCount(), result.getColumnCount());
        }
        return result;
    }

    // Stage 6
    private ValueStore removeDegenerateRows(CurationContext ctx, ValueStore store) {
        if (store.getRowCount() < 2 || store.getColumnCount() < 2) {
            ctx.skip(CurationStage.DEGENERATE_ROWS, store);
            return store;
        }
        double[][] values = store.getValues();
        int[] keep = IntStream.range(0, store.getRowCount())
                .filter(r -> !isDegenerate(values[r]))
                .toArray();
        if (keep.length == 0) {
            throw new CurationException(CurationErrorType.ALL_ROWS_FILTERED,
                    "All %d time series have constant feature vectors over the %d remaining operations", store.getRowCount(), store.getColumnCount());
        }
        ValueStore result = store.selectRows(keep);
        ctx.record(CurationStage.DEGENERATE_ROWS, store, result);
        if (result.getRowCount() < store.getRowCount()) {
            log(logger, ctx, "Removed %d time series with constant feature vectors: from %d to %d",
                    store.getRowCount() - result.getRowCount(), store.getRowCount(), result.getRowCount());
        }
        return result;
    }

    // Stage 7
    private ValueStore normalize(CurationContext ctx, ValueStore store) {
        NormalizationFunction function = ctx.getFunction();
        if (function.isIdentity()) {
            log(logger, Level.WARN, ctx, "Normalization function '%s' selected, the matrix is NOT normalized", ctx.getOptions().getNormFunction());
            ctx.skip(CurationStage.NORMALIZATION, store);
            return store;
        }

        int[] trainingRows = resolveTrainingRows(ctx, store);
        if (trainingRows.length == store.getRowCount()) {
            log(logger, ctx, "Normalizing a %d x %d matrix", store.getRowCount(), store.getColumnCount());
        } else {
            log(logger, ctx, "Normalizing a %d x %d matrix using %d training time series", store.getRowCount(), store.getColumnCount(), trainingRows.length);
        }

        double[][] normalized = normalizer.normalize(store.getValues(), function, trainingRows);
        ValueStore result = store.withValues(normalized, store.getQualityCodes());
        ctx.record(CurationStage.NORMALIZATION, store, result);
        log(logger, ctx, "Normalized, the matrix contains %d special-valued elements", countNonFinite(normalized));
        return result;
    }

    private int[] resolveTrainingRows(CurationContext ctx, ValueStore store) {
        List<Long> trainingIds = ctx.getOptions().getTrainingTimeSeriesIds();
        if (CollectionUtils.isEmpty(trainingIds)) {
            return IntStream.range(0, store.getRowCount()).toArray();
        }
        Set<Long> ids = new HashSet<>(trainingIds);
        int[] rows = IntStream.range(0, store.getRowCount())
                .filter(r -> ids.contains(store.getTimeSeries().get(r).getId()))
                .toArray();
        if (rows.length == 0) {
            throw new CurationException(CurationErrorType.INVALID_TRAINING_SET,
                    "None of the %d training time series remain after filtering", ids.size());
        }
        return rows;
    }

    // Stage 8
    private ValueStore revalidate(CurationContext ctx, ValueStore store) {
        double[][] values = store.getValues();
        int[][] quality = store.getQualityCodes();
        for (int r = 0; r < values.length; r++) {
            for (int c = 0; c < values[r].length; c++) {
                if (!Double.isFinite(values[r][c])) {
                    values[r][c] = Double.NaN;
                    if (quality[r][c] == QualityCode.GOOD.getCode()) quality[r][c] = QualityCode.ERROR.getCode();
                }
            }
        }
        ValueStore validated = store.withValues(values, quality);

        int[] withValues = IntStream.range(0, validated.getColumnCount())
                .filter(c -> goodFraction(column(values, c)) > 0)
                .toArray();
        if (withValues.length == 0) {
            throw new CurationException(CurationErrorType.NO_GOOD_VALUES_AFTER_NORMALIZATION,
                    "After normalization with '%s', all %d columns are bad values", ctx.getFunction().getName(), validated.getColumnCount());
        }
        ValueStore result = validated.selectColumns(withValues);
        if (result.getColumnCount() < validated.getColumnCount()) {
            log(logger, ctx, "Removed %d all-NaN columns after normalization", validated.getColumnCount() - result.getColumnCount());
        }

        if (result.getRowCount() >= 2) {
            int[] keep = nonDegenerateColumns(result.getValues(), result.getColumnCount());
            if (keep.length == 0) {
                throw new CurationException(CurationErrorType.ALL_COLUMNS_FILTERED,
                        "After normalization with '%s', all %d operations have constant outputs", ctx.getFunction().getName(), result.getColumnCount());
            }
            if (keep.length < result.getColumnCount()) {
                log(logger, ctx, "Post-normalization filtering of %d operations with constant outputs: from %d to %d",
                        result.getColumnCount() - keep.length, result.getColumnCount(), keep.length);
                result = result.selectColumns(keep);
            }
        }

        ctx.record(CurationStage.REVALIDATION, store, result);
        return result;
    }

    // Stage 9
    private ValueStore handleOrphanedMasters(CurationContext ctx, ValueStore store) {
        Set<Long> referenced = store.getOperations().stream().map(Operation::getMasterId).collect(Collectors.toSet());
        List<MasterOperation> orphaned = store.getMasterOperations().stream()
                .filter(m -> !referenced.contains(m.getId()))
                .toList();

        if (!ctx.getOptions().isPruneOrphanedMasters() || orphaned.isEmpty()) {
            if (!orphaned.isEmpty()) {
                log(logger, ctx, "Retaining %d master operations no longer referenced by any operation", orphaned.size());
            }
            ctx.skip(CurationStage.ORPHANED_MASTERS, store);
            return store;
        }

        ValueStore result = store.withMasterOperations(store.getMasterOperations().stream()
                .filter(m -> referenced.contains(m.getId()))
                .toList());
        ctx.record(CurationStage.ORPHANED_MASTERS, store, result);
        log(logger, ctx, "Pruned %d orphaned master operations: %s", orphaned.size(),
                orphaned.stream().map(MasterOperation::getLabel).filter(Objects::nonNull).collect(Collectors.joining(", ")));
        return result;
    }

    private static int[] nonDegenerateColumns(double[][] values, int columnCount) {
        return IntStream.range(0, columnCount)
                .filter(c -> !isDegenerate(column(values, c)))
                .toArray();
    }

    /**
     * A vector is degenerate when its NaN-ignoring range is below {@link #EPS}, or when it has no values at all.
     */
    static boolean isDegenerate(double[] vector) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        boolean any = false;
        for (double v : vector) {
            if (Double.isNaN(v)) continue;
            any = true;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return !any || max - min < EPS;
    }

    static double goodFraction(double[] vector) {
        if (vector.length == 0) return 0;
        long good = Arrays.stream(vector).filter(v -> !Double.isNaN(v)).count();
        return (double) good / vector.length;
    }

    private static double[] column(double[][] values, int col) {
        double[] column = new double[values.length];
        for (int r = 0; r < values.length; r++) {
            column[r] = values[r][col];
        }
        return column;
    }

    private static long countNaN(double[][] values) {
        return Arrays.stream(values).flatMapToDouble(Arrays::stream).filter(Double::isNaN).count();
    }

    private static long countNonFinite(double[][] values) {
        return Arrays.stream(values).flatMapToDouble(Arrays::stream).filter(v -> !Double.isFinite(v)).count();
    }
}
