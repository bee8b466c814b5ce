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
import java.util.Set;
import java.util.function.IntToDoubleFunction;

import eu.openanalytics.featurematrix.execution.master.MasterFunction;
import eu.openanalytics.featurematrix.execution.master.ResultBundle;

/**
 * Lag of the first local minimum of a correlation function of the series, either the
 * Gaussian automutual information ({@code mi}, {@code mi-gaussian}) or the autocorrelation
 * ({@code ac}, {@code corr}). A series whose correlation function has no minimum is not applicable.
 */
public class FirstMinimum implements MasterFunction {

	public static final String NAME = "FirstMin";

	private static final Set<String> SUPPORTED = Set.of("mi", "mi-gaussian", "ac", "corr");

	private final String minWhat;

	public FirstMinimum(String minWhat) {
		if (!SUPPORTED.contains(minWhat)) {
			throw new IllegalArgumentException(String.format("Unknown correlation type '%s'", minWhat));
		}
		this.minWhat = minWhat;
	}

	public static FirstMinimum fromParameters(Map<String, String> parameters) {
		return new FirstMinimum(FunctionParameters.getString(parameters, "minWhat", "mi-gaussian"));
	}

	@Override
	public ResultBundle evaluate(double[] data) {
		IntToDoubleFunction correlation = switch (minWhat) {
			case "ac", "corr" -> lag -> SeriesStatistics.autoCorrelation(data, lag);
			default -> lag -> SeriesStatistics.gaussianAutoMutualInfo(data, lag);
		};

		double[] corr = new double[data.length];
		for (int i = 1; i < data.length; i++) {
			corr[i] = correlation.applyAsDouble(i);
			if (i == 2 && corr[2] > corr[1]) {
				return ResultBundle.success(Map.of("firstMin", 1.0));
			}
			if (i > 2 && corr[i - 2] > corr[i - 1] && corr[i - 1] < corr[i]) {
				return ResultBundle.success(Map.of("firstMin", (double) (i - 1)));
			}
		}
		return ResultBundle.notApplicable();
	}
}
