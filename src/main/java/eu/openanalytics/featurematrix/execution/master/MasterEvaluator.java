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
package eu.openanalytics.featurematrix.execution.master;

import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import eu.openanalytics.featurematrix.model.MasterOperation;
import eu.openanalytics.featurematrix.model.TimeSeries;

/**
 * Runs one master operation on one time series, isolating every failure of the
 * underlying function into a {@link ResultBundle#failed(String) failed} bundle.
 */
@Service
public class MasterEvaluator {

    private final MasterFunctionRegistry functionRegistry;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    public MasterEvaluator(MasterFunctionRegistry functionRegistry) {
        this.functionRegistry = functionRegistry;
    }

    public MasterEvaluation evaluate(TimeSeries timeSeries, MasterOperation master) {
        logger.debug(String.format("[ts_id = %d, mop_id = %d] Evaluating master %s", timeSeries.getId(), master.getId(), master.getLabel()));

        if (timeSeries.getLength() == 0) {
            return failure(timeSeries, master, "Time series has no data");
        }

        long start = System.nanoTime();
        ResultBundle bundle;
        try {
            MasterFunction function = functionRegistry.resolve(master);
            // masters may work on their input in place
            bundle = function.evaluate(timeSeries.getData().clone());
        } catch (Throwable t) {
            logger.warn(String.format("[ts_id = %d, mop_id = %d] Master %s failed", timeSeries.getId(), master.getId(), master.getLabel()), t);
            return new MasterEvaluation(ResultBundle.failed(ExceptionUtils.getMessage(t)), 0.0);
        }
        double elapsedSeconds = (System.nanoTime() - start) / 1e9;

        if (bundle == null) {
            return failure(timeSeries, master, "Master function returned no result");
        }
        if (bundle.isFailed()) {
            return failure(timeSeries, master, bundle.getMessage());
        }

        logger.debug(String.format("[ts_id = %d, mop_id = %d] %s evaluated in %.4f s (%s)",
                timeSeries.getId(), master.getId(), master.getLabel(), elapsedSeconds, bundle.getStatus()));
        return new MasterEvaluation(bundle, elapsedSeconds);
    }

    private MasterEvaluation failure(TimeSeries timeSeries, MasterOperation master, String message) {
        logger.warn(String.format("[ts_id = %d, mop_id = %d] Master %s failed: %s", timeSeries.getId(), master.getId(), master.getLabel(), message));
        return new MasterEvaluation(ResultBundle.failed(message), 0.0);
    }
}
