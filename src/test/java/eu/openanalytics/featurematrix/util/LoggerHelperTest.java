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
package eu.openanalytics.featurematrix.util;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.event.Level;

public class LoggerHelperTest {

    private final Logger logger = mock(Logger.class);

    private final LoggerHelper.LogContext ctx = () -> "[batch 7]";

    @Test
    public void messageIsPrefixedAndLoggedAtInfo() {
        LoggerHelper.log(logger, ctx, "Processed %d of %d", 3, 4);

        verify(logger).info(eq("[batch 7] Processed 3 of 4"), (Throwable) isNull());
        verifyNoMoreInteractions(logger);
    }

    @Test
    public void trailingThrowableIsLoggedAtWarn() {
        IllegalStateException error = new IllegalStateException("boom");

        LoggerHelper.log(logger, ctx, "Master %s failed", "m1", error);

        verify(logger).warn("[batch 7] Master m1 failed", error);
        verifyNoMoreInteractions(logger);
    }

    @Test
    public void explicitLevelIsHonoured() {
        LoggerHelper.log(logger, Level.DEBUG, ctx, "Time series %s done", "ts1");
        LoggerHelper.log(logger, Level.WARN, null, "No context");

        verify(logger).debug(eq("[batch 7] Time series ts1 done"), (Throwable) isNull());
        verify(logger).warn(eq("No context"), (Throwable) isNull());
        verifyNoMoreInteractions(logger);
    }
}
