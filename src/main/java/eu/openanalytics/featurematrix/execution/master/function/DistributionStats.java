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

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import eu.openanalytics.featurematrix.execution.master.MasterFunction;
import eu.openanalytics.featurematrix.execution.master.ResultBundle;

/**
 * Location, spread and shape of the distribution of values, ignoring temporal order.
 */
public class DistributionStats implements MasterFunction {

	public static final String NAME = "DistributionStats";

	private static final int MIN_LENGTH = 4;

	@Override
	public ResultBundle evaluate(double[] data) {
		if (data.length < MIN_LENGTH) return ResultBundle.notApplicable();

		DescriptiveStatistics stats = new DescriptiveStatistics(data);
		double q1 = stats.getPercentile(25);
		double median = stats.getPercentile(50);
		double q3 = stats.getPercentile(75);

		Map<String, Object> fields = new LinkedHashMap<>();
		fields.put("mean", stats.getMean());
		fields.put("std", stats.getStandardDeviation());
		fields.put("median", median);
		fields.put("iqr", q3 - q1);
		fields.put("min", stats.getMin());
		fields.put("max", stats.getMax());
		fields.put("range", stats.getMax() - stats.getMin());
		fields.put("skewness", stats.getSkewness());
		fields.put("kurtosis", stats.getKurtosis());
		fields.put("quartiles", new double[] { q1, median, q3 });
		return ResultBundle.success(fields);
	}
}
