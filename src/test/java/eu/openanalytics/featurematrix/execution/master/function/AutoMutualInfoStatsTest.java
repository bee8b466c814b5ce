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

public class AutoMutualInfoStatsTest {

    private static double[] noisySine(int length) {
        double[] data = new double[length];
        for (int i = 0; i < length; i++) {
            data[i] = Math.sin(i * 0.7) + 0.1 * ((i * 13) % 7) / 7.0;
        }
        return data;
    }

    @Test
    public void defaultLagRange() {
        ResultBundle bundle = AutoMutualInfoStats.fromParameters(Map.of()).evaluate(noisySine(20));

        Assertions.assertEquals(BundleStatus.SUCCESS, bundle.getStatus());
        for (int lag = 1; lag <= 5; lag++) {
            double ami = (Double) bundle.getFields().get("ami" + lag);
            Assertions.assertTrue(Double.isFinite(ami) && ami >= 0, "ami" + lag);
        }
        Assertions.assertFalse(bundle.getFields().containsKey("ami6"));
        Assertions.assertEquals(5, ((double[]) bundle.getFields().get("ami")).length);
        Assertions.assertTrue(bundle.getFields().containsKey("mami"));
        Assertions.assertTrue(bundle.getFields().containsKey("pcrossmedian"));
        Assertions.assertTrue(bundle.getFields().containsKey("amiac1"));
    }

    @Test
    public void lagsBeyondHalfTheSeriesAreNaN() {
        ResultBundle bundle = AutoMutualInfoStats.fromParameters(Map.of("maxTau", "15")).evaluate(noisySine(20));

        Assertions.assertTrue(Double.isFinite((Double) bundle.getFields().get("ami10")));
        Assertions.assertTrue(Double.isNaN((Double) bundle.getFields().get("ami11")));
        Assertions.assertTrue(Double.isNaN((Double) bundle.getFields().get("ami15")));
        Assertions.assertEquals(10, ((double[]) bundle.getFields().get("ami")).length);
    }

    @Test
    public void shortOrConstantSeriesIsNotApplicable() {
        AutoMutualInfoStats stats = AutoMutualInfoStats.fromParameters(Map.of());

        Assertions.assertEquals(BundleStatus.NOT_APPLICABLE, stats.evaluate(noisySine(4)).getStatus());
        Assertions.assertEquals(BundleStatus.NOT_APPLICABLE, stats.evaluate(new double[] {3, 3, 3, 3, 3, 3, 3, 3, 3, 3, 3, 3}).getStatus());
    }

    @Test
    public void onlyTheGaussianEstimatorIsSupported() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> AutoMutualInfoStats.fromParameters(Map.of("estimator", "kraskov1")));
    }
}
