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

import eu.openanalytics.featurematrix.execution.master.MasterFunction;
import eu.openanalytics.featurematrix.execution.master.ResultBundle;

/**
 * Autocorrelation at lags 1..maxTau ({@code ac1}, {@code ac2}, ...) and the first zero crossing
 * of the autocorrelation function. Lags the series is too short for are reported as NaN.
 */
public class AutoCorrelationStats implements MasterFunction {

	public static final String NAME = "AutoCorrStats";

	private static final int DEFAULT_MAX_TAU = 10;

	private final int maxTau;

	public AutoCorrelationStats(int maxTau) {
		this.maxTau = maxTau;
	}

	public static AutoCorrelationStats fromParameters(Map<String, String> parameters) {
		return new AutoCorrelationStats(FunctionParameters.getPositiveInt(parameters, "maxTau", () -> DEFAULT_MAX_TAU));
	}

	@Override
	public ResultBundle evaluate(double[] data) {
		if (data.length < 3 || SeriesStatistics.isConstant(data)) return ResultBundle.notApplicable();

		Map<String, Object> fields = new LinkedHashMap<>();
		double[] acf = new double[maxTau];
		for (int tau = 1; tau <= maxTau; tau++) {
			acf[tau - 1] = SeriesStatistics.autoCorrelation(data, tau);
			fields.put("ac" + tau, acf[tau - 1]);
		}
		fields.put("acf", acf);

		int firstZero = data.length;
		for (int tau = 1; tau < data.length; tau++) {
			if (SeriesStatistics.autoCorrelation(data, tau) <= 0) {
				firstZero = tau;
				break;
			}
		}
		fields.put("firstZero", (double) firstZero);
		return ResultBundle.success(fields);
	}
}
