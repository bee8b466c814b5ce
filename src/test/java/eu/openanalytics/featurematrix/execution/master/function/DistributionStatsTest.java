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

public class DistributionStatsTest {

    private final DistributionStats distributionStats = new DistributionStats();

    @Test
    public void computesLocationAndSpread() {
        ResultBundle bundle = distributionStats.evaluate(new double[] {5, 1, 4, 2, 3});

        Map<String, Object> fields = bundle.getFields();
        Assertions.assertEquals(BundleStatus.SUCCESS, bundle.getStatus());
        Assertions.assertEquals(3.0, (Double) fields.get("mean"), 1e-12);
        Assertions.assertEquals(Math.sqrt(2.5), (Double) fields.get("std"), 1e-12);
        Assertions.assertEquals(3.0, (Double) fields.get("median"), 1e-12);
        Assertions.assertEquals(3.0, (Double) fields.get("iqr"), 1e-12);
        Assertions.assertEquals(4.0, (Double) fields.get("range"), 1e-12);
        Assertions.assertEquals(0.0, (Double) fields.get("skewness"), 1e-12);
        Assertions.assertArrayEquals(new double[] {1.5, 3.0, 4.5}, (double[]) fields.get("quartiles"), 1e-12);
    }

    @Test
    public void tooShortSeriesIsNotApplicable() {
        Assertions.assertEquals(BundleStatus.NOT_APPLICABLE, distributionStats.evaluate(new double[] {1, 2, 3}).getStatus());
    }
}
