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
package eu.openanalytics.featurematrix.execution;

import eu.openanalytics.featurematrix.execution.progress.BatchProgress;
import eu.openanalytics.featurematrix.model.ValueStore;
import eu.openanalytics.featurematrix.util.ErrorCollector;
import eu.openanalytics.featurematrix.util.LoggerHelper.LogContext;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Setter;

@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Setter(AccessLevel.PRIVATE)
public class BatchContext implements LogContext {

	ValueStore store;
	BatchOptions options;

	ErrorCollector errorCollector;
	BatchProgress progress;

	public static BatchContext create(ValueStore store, BatchOptions options) {
		BatchContext ctx = new BatchContext(store, options, null, null);
		ctx.errorCollector = new ErrorCollector(ctx);
		ctx.progress = new BatchProgress(store.getRowCount());
		return ctx;
	}

	@Override
	public String getLogPrefix() {
		return String.format("[Batch %s, T=%d, O=%d]", options.getName(), store.getRowCount(), store.getColumnCount());
	}
}
