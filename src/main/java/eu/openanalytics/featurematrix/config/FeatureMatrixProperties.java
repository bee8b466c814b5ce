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
package eu.openanalytics.featurematrix.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Defaults applied to requests that leave an option unset.
 */
@Data
@ConfigurationProperties(prefix = "featurematrix")
public class FeatureMatrixProperties {

    private String defaultNormFunction = "scaledRobustSigmoid";

    private double defaultRowThreshold = 0.8;

    private double defaultColThreshold = 1.0;

    private boolean pruneOrphanedMasters = false;

    private int parallelism = 1;
}
