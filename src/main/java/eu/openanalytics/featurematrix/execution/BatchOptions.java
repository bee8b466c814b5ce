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

import eu.openanalytics.featurematrix.enumeration.RecomputeMode;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class BatchOptions {

    /** Identifies the batch in log lines and events. */
    @Builder.Default
    String name = "batch";

    @Builder.Default
    RecomputeMode recomputeMode = RecomputeMode.ALL;

    /** Number of worker threads; 1 runs the batch on the calling thread. */
    @Builder.Default
    int parallelism = 1;

    public static BatchOptions defaults() {
        return BatchOptions.builder().build();
    }
}
