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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import eu.openanalytics.featurematrix.execution.master.MasterFunction;
import eu.openanalytics.featurematrix.execution.master.ResultBundle;

/**
 * Statistics of the automutual information function over lags 1..maxTau.
 * <p>
 * {@code maxTau} defaults to ceil(N/4) and is capped at ceil(N/2); the {@code amiK} fields for lags
 * beyond the cap are reported as NaN. The remaining fields summarise the shape of the function:
 * its mean and spread, the proportion and position of extrema, the periodicity of its maxima and
 * minima, level crossings and its own lag-1 autocorrelation.
 */
public class AutoMutualInfoStats implements MasterFunction {

	public static final String NAME = "AutoMutualInfoStats";

	private static final String GAUSSIAN = "gaussian";

	private final Integer maxTau;

	public AutoMutualInfoStats(Integer maxTau, String estimator) {
		if (!GAUSSIAN.equals(estimator)) {
			throw new IllegalArgumentException(String.format("Unsupported automutual information estimator '%s'", estimator));
		}
		this.maxTau = maxTau;
	}

	public static AutoMutualInfoStats fromParameters(Map<String, String> parameters) {
		return new AutoMutualInfoStats(
				FunctionParameters.getPositiveInt(parameters, "maxTau"),
				FunctionParameters.getString(parameters, "estimator", GAUSSIAN));
	}

	@Override
	public ResultBundle evaluate(double[] data) {
		int n = data.length;
		int requestedTau = maxTau == null ? (int) Math.ceil(n / 4.0) : maxTau;
		int tau = Math.min(requestedTau, (int) Math.ceil(n / 2.0));
		if (tau < 3 || SeriesStatistics.isConstant(data)) return ResultBundle.notApplicable();

		double[] ami = new double[tau];
		for (int lag = 1; lag <= tau; lag++) {
			ami[lag - 1] = SeriesStatistics.gaussianAutoMutualInfo(data, lag);
		}

		Map<String, Object> fields = new LinkedHashMap<>();
		for (int lag = 1; lag <= requestedTau; lag++) {
			fields.put("ami" + lag, lag <= tau ? ami[lag - 1] : Double.NaN);
		}

		int lami = ami.length;
		double mean = StatUtils.mean(ami);
		fields.put("mami", mean);
		fields.put("stdami", Math.sqrt(StatUtils.variance(ami)));

		double[] dami = SeriesStatistics.diff(ami);
		List<Integer> extrema = turningPoints(dami, (a, b) -> a * b < 0);
		fields.put("pextrema", extrema.size() / (double) (lami - 1));
		// lag of the first extremum; diff shifts indices by one
		fields.put("fmmi", extrema.isEmpty() ? (double) lami : (double) extrema.get(0));

		double[] maxima = toArray(turningPoints(dami, (a, b) -> a > 0 && b < 0));
		putPeriodicity(fields, "max", SeriesStatistics.diff(maxima), lami);
		double[] minima = toArray(turningPoints(dami, (a, b) -> a < 0 && b > 0));
		putPeriodicity(fields, "min", SeriesStatistics.diff(minima), lami);

		Percentile percentile = new Percentile();
		fields.put("pcrossmean", crossings(ami, mean));
		fields.put("pcrossmedian", crossings(ami, percentile.evaluate(ami, 50)));
		fields.put("pcrossq10", crossings(ami, percentile.evaluate(ami, 10)));
		fields.put("pcrossq90", crossings(ami, percentile.evaluate(ami, 90)));

		fields.put("amiac1", SeriesStatistics.autoCorrelation(ami, 1));
		fields.put("ami", ami);
		return ResultBundle.success(fields);
	}

	private static void putPeriodicity(Map<String, Object> fields, String suffix, double[] periods, int lami) {
		fields.put("p" + suffix + "ima", periods.length / Math.floor(lami / 2.0));
		if (periods.length == 0) {
			fields.put("modeperiod" + suffix, Double.NaN);
			fields.put("pmodeperiod" + suffix, Double.NaN);
			return;
		}
		double mode = StatUtils.mode(periods)[0];
		long count = Arrays.stream(periods).filter(p -> p == mode).count();
		fields.put("modeperiod" + suffix, mode);
		fields.put("pmodeperiod" + suffix, count / (double) periods.length);
	}

	private static double crossings(double[] ami, double level) {
		return SeriesStatistics.signChanges(SeriesStatistics.subtract(ami, level)) / (double) (ami.length - 1);
	}

	/**
	 * 1-based positions i (into the lag axis) where consecutive differences dami[i-1], dami[i] satisfy the predicate.
	 */
	private static List<Integer> turningPoints(double[] dami, PairPredicate predicate) {
		List<Integer> points = new ArrayList<>();
		for (int i = 0; i + 1 < dami.length; i++) {
			if (predicate.test(dami[i], dami[i + 1])) points.add(i + 1);
		}
		return points;
	}

	private static double[] toArray(List<Integer> values) {
		return values.stream().mapToDouble(Integer::doubleValue).toArray();
	}

	@FunctionalInterface
	private interface PairPredicate {
		boolean test(double a, double b);
	}
}
