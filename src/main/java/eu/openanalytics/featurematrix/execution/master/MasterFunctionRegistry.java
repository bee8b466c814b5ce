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

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import eu.openanalytics.featurematrix.exception.CalculationException;
import eu.openanalytics.featurematrix.execution.master.function.AutoCorrelationStats;
import eu.openanalytics.featurematrix.execution.master.function.AutoMutualInfoStats;
import eu.openanalytics.featurematrix.execution.master.function.DistributionStats;
import eu.openanalytics.featurematrix.execution.master.function.FirstMinimum;
import eu.openanalytics.featurematrix.model.MasterOperation;

/**
 * Catalog of master functions, looked up by the {@code function} name of a master operation.
 */
@Component
public class MasterFunctionRegistry {

    private final Map<String, MasterFunctionFactory> factories = new ConcurrentHashMap<>();

    public MasterFunctionRegistry() {
        register(DistributionStats.NAME, parameters -> new DistributionStats());
        register(AutoCorrelationStats.NAME, AutoCorrelationStats::fromParameters);
        register(AutoMutualInfoStats.NAME, AutoMutualInfoStats::fromParameters);
        register(FirstMinimum.NAME, FirstMinimum::fromParameters);
    }

    public void register(String name, MasterFunctionFactory factory) {
        factories.put(name, factory);
    }

    public Set<String> getFunctionNames() {
        return new TreeSet<>(factories.keySet());
    }

    public boolean isRegistered(String name) {
        return name != null && factories.containsKey(name);
    }

    /**
     * Instantiates the function of the given master with its parameters.
     *
     * @throws CalculationException when the function name is unknown
     */
    public MasterFunction resolve(MasterOperation master) {
        MasterFunctionFactory factory = master.getFunction() == null ? null : factories.get(master.getFunction());
        if (factory == null) {
            CalculationException.doThrow(String.format("Unknown master function '%s'", master.getFunction()), master);
        }
        return factory.create(master.getParameters());
    }
}
