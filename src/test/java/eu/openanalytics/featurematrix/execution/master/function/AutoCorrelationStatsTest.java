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
package eu.openanalytics.featurematrix.execution.master.function;

import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import eu.openanalytics.featurematrix.enumeration.BundleStatus;
import eu.openanalytics.featurematrix.execution.master.ResultBundle;

public class AutoCorrelationStatsTest {

    @Test
    public void alternatingSeries() {
        AutoCorrelationStats stats = AutoCorrelationStats.fromParameters(Map.of("maxTau", "2"));

        ResultBundle bundle = stats.evaluate(new double[] {1, -1, 1, -1});

        Assertions.assertEquals(BundleStatus.SUCCESS, bundle.getStatus());
        Assertions.assertEquals(-0.75, (Double) bundle.getFields().get("ac1"), 1e-12);
        Assertions.assertEquals(0.5, (Double) bundle.getFields().get("ac2"), 1e-12);
        Assertions.assertEquals(1.0, (Double) bundle.getFields().get("firstZero"), 1e-12);
        Assertions.assertArrayEquals(new double[] {-0.75, 0.5}, (double[]) bundle.getFields().get("acf"), 1e-12);
        Assertions.assertFalse(bundle.getFields().containsKey("ac3"));
    }

    @Test
    public void defaultMaxTau() {
        ResultBundle bundle = AutoCorrelationStats.fromParameters(Map.of()).evaluate(new double[] {1, 2, 3, 4, 5, 4, 3, 2, 1, 2, 3, 4});

        Assertions.assertTrue(bundle.getFields().containsKey("ac10"));
        Assertions.assertFalse(bundle.getFields().containsKey("ac11"));
    }

    @Test
    public void constantSeriesIsNotApplicable() {
        Assertions.assertEquals(BundleStatus.NOT_APPLICABLE, new AutoCorrelationStats(3).evaluate(new double[] {2, 2, 2, 2}).getStatus());
    }

    @Test
    public void invalidMaxTauIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> AutoCorrelationStats.fromParameters(Map.of("maxTau", "abc")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> AutoCorrelationStats.fromParameters(Map.of("maxTau", "0")));
    }
}
