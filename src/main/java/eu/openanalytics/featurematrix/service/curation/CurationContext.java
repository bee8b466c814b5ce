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

import java.util.ArrayList;
import java.util.List;

import eu.openanalytics.featurematrix.enumeration.CurationStage;
import eu.openanalytics.featurematrix.model.NormalizationInfo.StageReport;
import eu.openanalytics.featurematrix.model.ValueStore;
import eu.openanalytics.featurematrix.util.LoggerHelper.LogContext;

/**
 * State of one curation run: its options and the row/column counts recorded by each stage.
 */
public class CurationContext implements LogContext {

	private final CurationOptions options;
	private final NormalizationFunction function;
	private final List<StageReport> stages = new ArrayList<>();

	public CurationContext(CurationOptions options, NormalizationFunction function) {
		this.options = options;
		this.function = function;
	}

	public CurationOptions getOptions() {
		return options;
	}

	public NormalizationFunction getFunction() {
		return function;
	}

	public List<StageReport> getStages() {
		return List.copyOf(stages);
	}

	public void record(CurationStage stage, ValueStore before, ValueStore after) {
		stages.add(StageReport.builder()
				.stage(stage)
				.rowsBefore(before.getRowCount())
				.rowsAfter(after.getRowCount())
				.columnsBefore(before.getColumnCount())
				.columnsAfter(after.getColumnCount())
				.skipped(false)
				.build());
	}

	public void skip(CurationStage stage, ValueStore store) {
		stages.add(StageReport.builder()
				.stage(stage)
				.rowsBefore(store.getRowCount())
				.rowsAfter(store.getRowCount())
				.columnsBefore(store.getColumnCount())
				.columnsAfter(store.getColumnCount())
				.skipped(true)
				.build());
	}

	@Override
	public String getLogPrefix() {
		return String.format("[Curation %s, rows>=%.2f, cols>=%.2f]", function.getName(), options.getRowThreshold(), options.getColThreshold());
	}
}
