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

import static eu.openanalytics.featurematrix.util.LoggerHelper.log;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.stereotype.Service;

import eu.openanalytics.featurematrix.enumeration.QualityCode;
import eu.openanalytics.featurematrix.exception.CalculationException;
import eu.openanalytics.featurematrix.execution.BatchContext;
import eu.openanalytics.featurematrix.execution.BatchOptions;
import eu.openanalytics.featurematrix.execution.BatchResult;
import eu.openanalytics.featurematrix.execution.master.MasterEvaluation;
import eu.openanalytics.featurematrix.execution.master.MasterEvaluator;
import eu.openanalytics.featurematrix.execution.master.ResultBundle;
import eu.openanalytics.featurematrix.execution.progress.BatchProgress;
import eu.openanalytics.featurematrix.execution.resolve.OperationResolver;
import eu.openanalytics.featurematrix.execution.resolve.ResolvedCell;
import eu.openanalytics.featurematrix.model.MasterOperation;
import eu.openanalytics.featurematrix.model.Operation;
import eu.openanalytics.featurematrix.model.TimeSeries;
import eu.openanalytics.featurematrix.model.ValueStore;

/**
 * Fills a {@link ValueStore} by evaluating, for every time series, each master operation once and
 * resolving all of its dependent pointer operations against the resulting bundle.
 * <p>
 * The full cost of a master evaluation is attributed to its first dependent column (in column order)
 * and the other dependents of that master get zero, so that summing the calculation times of a row
 * counts every master evaluation exactly once. Cells of a failed master get zero.
 */
@Service
public class BatchExecutorService {

    private final MasterEvaluator masterEvaluator;
    private final OperationResolver operationResolver;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    public BatchExecutorService(MasterEvaluator masterEvaluator, OperationResolver operationResolver) {
        this.masterEvaluator = masterEvaluator;
        this.operationResolver = operationResolver;
    }

    /**
     * Computes the cells selected by the recompute mode, in place, and returns the populated store
     * with aggregate statistics. Failures of individual masters or operations never abort the batch.
     */
    public BatchResult execute(ValueStore store, BatchOptions options) {
        BatchContext ctx = BatchContext.create(store, options);
        Map<Long, List<Integer>> columnsByMaster = store.getColumnsByMaster();

        log(logger, ctx, "Starting batch: %d master operations, %d pointer operations, %d time series (mode %s, parallelism %d)",
                columnsByMaster.size(), store.getColumnCount(), store.getRowCount(), options.getRecomputeMode(), options.getParallelism());

        if (options.getParallelism() <= 1 || store.getRowCount() <= 1) {
            for (int row = 0; row < store.getRowCount(); row++) {
                executeRow(ctx, row, columnsByMaster);
            }
        } else {
            executeParallel(ctx, columnsByMaster);
        }

        BatchProgress progress = ctx.getProgress();
        log(logger, ctx, "Batch finished: %d master evaluations (%d failed), %d good, %d error, %d not applicable, %d skipped cells",
                progress.getMasterEvaluations(), progress.getMasterFailures(), progress.getGoodCells(),
                progress.getErrorCells(), progress.getNotApplicableCells(), progress.getSkippedCells());

        return BatchResult.builder()
                .store(store)
                .masterEvaluations(progress.getMasterEvaluations())
                .masterFailures(progress.getMasterFailures())
                .goodCells(progress.getGoodCells())
                .errorCells(progress.getErrorCells())
                .notApplicableCells(progress.getNotApplicableCells())
                .skippedCells(progress.getSkippedCells())
                .totalCalcTime(progress.getTotalCalcTime())
                .errors(ctx.getErrorCollector().getErrors())
                .build();
    }

    private void executeParallel(BatchContext ctx, Map<Long, List<Integer>> columnsByMaster) {
        int threads = Math.min(ctx.getOptions().getParallelism(), ctx.getStore().getRowCount());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int row = 0; row < ctx.getStore().getRowCount(); row++) {
                int currentRow = row;
                futures.add(executor.submit(() -> executeRow(ctx, currentRow, columnsByMaster)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CalculationException("Batch %s was interrupted", ctx.getOptions().getName());
        } catch (ExecutionException e) {
            throw new CalculationException("Batch %s failed: %s", ctx.getOptions().getName(), e.getCause().getMessage());
        } finally {
            executor.shutdownNow();
        }
    }

    private void executeRow(BatchContext ctx, int row, Map<Long, List<Integer>> columnsByMaster) {
        ValueStore store = ctx.getStore();
        TimeSeries timeSeries = store.getTimeSeries().get(row);

        for (Map.Entry<Long, List<Integer>> entry : columnsByMaster.entrySet()) {
            List<Integer> columns = entry.getValue().stream()
                    .filter(col -> ctx.getOptions().getRecomputeMode().requiresCalculation(store.getQuality(row, col)))
                    .toList();
            ctx.getProgress().cellsSkipped(entry.getValue().size() - columns.size());
            if (columns.isEmpty()) continue;

            MasterOperation master = store.getMasterOperation(entry.getKey());
            MasterEvaluation evaluation = masterEvaluator.evaluate(timeSeries, master);
            ctx.getProgress().masterEvaluated(evaluation);

            ResultBundle bundle = evaluation.getBundle();
            if (bundle.isFailed()) {
                ctx.getErrorCollector().addError(String.format("Master evaluation failed: %s", bundle.getMessage()), timeSeries, master);
            }

            boolean first = true;
            for (int col : columns) {
                Operation operation = store.getOperations().get(col);
                ResolvedCell cell = operationResolver.resolve(bundle, operation);
                double calcTime = first ? evaluation.getElapsedSeconds() : 0.0;
                first = false;

                store.setCell(row, col, cell.getValue(), cell.getQuality(), calcTime);
                ctx.getProgress().cellResolved(cell.getQuality());

                if (cell.getQuality() == QualityCode.ERROR && bundle.isSuccess()) {
                    ctx.getErrorCollector().addError(String.format("Operation could not be resolved: %s", cell.getMessage()), timeSeries, operation);
                }
            }
        }

        int completed = ctx.getProgress().rowCompleted();
        log(logger, Level.DEBUG, ctx, "Time series %s (%d) done, %d/%d", timeSeries.getName(), timeSeries.getId(), completed, store.getRowCount());
    }
}
