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

import java.util.Arrays;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

/**
 * Small numeric helpers shared by the built-in master functions.
 */
public final class SeriesStatistics {

	private SeriesStatistics() {
	}

	/**
	 * Biased autocorrelation estimate at the given lag, normalised by the lag-0 sum of squares.
	 * Returns NaN for lags outside [0, N) or for a constant series.
	 */
	public static double autoCorrelation(double[] y, int lag) {
		int n = y.length;
		if (lag < 0 || lag >= n) return Double.NaN;
		double mean = StatUtils.mean(y);
		double denominator = 0;
		for (double v : y) {
			denominator += (v - mean) * (v - mean);
		}
		if (denominator == 0) return Double.NaN;
		double numerator = 0;
		for (int t = 0; t < n - lag; t++) {
			numerator += (y[t] - mean) * (y[t + lag] - mean);
		}
		return numerator / denominator;
	}

	/**
	 * Automutual information in nats at the given lag, assuming a bivariate Gaussian
	 * relationship between the series and its lagged copy: {@code -0.5 * ln(1 - r^2)}.
	 */
	public static double gaussianAutoMutualInfo(double[] y, int lag) {
		int n = y.length;
		if (lag < 1 || n - lag < 2) return Double.NaN;
		double[] head = Arrays.copyOfRange(y, 0, n - lag);
		double[] tail = Arrays.copyOfRange(y, lag, n);
		double r = new PearsonsCorrelation().correlation(head, tail);
		return -0.5 * Math.log(1 - r * r);
	}

	/**
	 * Number of positions i where {@code x[i] * x[i+1] < 0}.
	 */
	public static int signChanges(double[] x) {
		int count = 0;
		for (int i = 0; i + 1 < x.length; i++) {
			if (x[i] * x[i + 1] < 0) count++;
		}
		return count;
	}

	public static double[] diff(double[] x) {
		if (x.length < 2) return new double[0];
		double[] d = new double[x.length - 1];
		for (int i = 0; i < d.length; i++) {
			d[i] = x[i + 1] - x[i];
		}
		return d;
	}

	public static double[] subtract(double[] x, double offset) {
		return Arrays.stream(x).map(v -> v - offset).toArray();
	}

	public static boolean isConstant(double[] y) {
		return StatUtils.variance(y) == 0;
	}
}
