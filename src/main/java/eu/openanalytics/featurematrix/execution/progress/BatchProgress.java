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
package eu.openanalytics.featurematrix.execution.progress;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.DoubleAdder;

import eu.openanalytics.featurematrix.enumeration.BundleStatus;
import eu.openanalytics.featurematrix.enumeration.QualityCode;
import eu.openanalytics.featurematrix.execution.master.MasterEvaluation;

/**
 * Aggregate counters of a running batch. Safe to update from several worker threads.
 */
public class BatchProgress {

	private final int totalRows;
	private final AtomicInteger completedRows = new AtomicInteger();

	private final AtomicInteger masterEvaluations = new AtomicInteger();
	private final AtomicInteger masterFailures = new AtomicInteger();
	private final AtomicInteger masterNotApplicable = new AtomicInteger();

	private final AtomicInteger goodCells = new AtomicInteger();
	private final AtomicInteger errorCells = new AtomicInteger();
	private final AtomicInteger notApplicableCells = new AtomicInteger();
	private final AtomicInteger skippedCells = new AtomicInteger();

	private final DoubleAdder totalCalcTime = new DoubleAdder();

	public BatchProgress(int totalRows) {
		this.totalRows = totalRows;
	}

	public void masterEvaluated(MasterEvaluation evaluation) {
		masterEvaluations.incrementAndGet();
		if (evaluation.getBundle().getStatus() == BundleStatus.FAILED) masterFailures.incrementAndGet();
		if (evaluation.getBundle().getStatus() == BundleStatus.NOT_APPLICABLE) masterNotApplicable.incrementAndGet();
		totalCalcTime.add(evaluation.getElapsedSeconds());
	}

	public void cellResolved(QualityCode quality) {
		switch (quality) {
			case GOOD -> goodCells.incrementAndGet();
			case ERROR -> errorCells.incrementAndGet();
			case NOT_APPLICABLE -> notApplicableCells.incrementAndGet();
			case NOT_COMPUTED -> skippedCells.incrementAndGet();
		}
	}

	public void cellsSkipped(int count) {
		skippedCells.addAndGet(count);
	}

	public int rowCompleted() {
		return completedRows.incrementAndGet();
	}

	public float getCompletedFraction() {
		return totalRows == 0 ? 1.0f : (float) completedRows.get() / totalRows;
	}

	public int getMasterEvaluations() {
		return masterEvaluations.get();
	}

	public int getMasterFailures() {
		return masterFailures.get();
	}

	public int getMasterNotApplicable() {
		return masterNotApplicable.get();
	}

	public int getGoodCells() {
		return goodCells.get();
	}

	public int getErrorCells() {
		return errorCells.get();
	}

	public int getNotApplicableCells() {
		return notApplicableCells.get();
	}

	public int getSkippedCells() {
		return skippedCells.get();
	}

	public double getTotalCalcTime() {
		return totalCalcTime.sum();
	}
}
