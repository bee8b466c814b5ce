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
package eu.openanalytics.featurematrix.service.curation;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Column transforms available to the curator. Each function is fitted on the finite training
 * values of one column and the fitted transform is then applied to every value of that column.
 */
public enum NormalizationFunction {

	NONE(List.of("none", "nothing")) {
		@Override
		public DoubleUnaryOperator fit(double[] training) {
			return DoubleUnaryOperator.identity();
		}
	},
	MAX_MIN(List.of("maxmin", "minmax")) {
		@Override
		public DoubleUnaryOperator fit(double[] training) {
			double min = StatUtils.min(training);
			double max = StatUtils.max(training);
			return x -> (x - min) / (max - min);
		}
	},
	ZSCORE(List.of("zscore")) {
		@Override
		public DoubleUnaryOperator fit(double[] training) {
			double mean = StatUtils.mean(training);
			double std = Math.sqrt(StatUtils.variance(training));
			return x -> (x - mean) / std;
		}
	},
	ROBUST_ZSCORE(List.of("robustZscore", "SQzscore")) {
		@Override
		public DoubleUnaryOperator fit(double[] training) {
			double median = percentile(training, 50);
			double scale = robustScale(training);
			return x -> (x - median) / scale;
		}
	},
	SIGMOID(List.of("sigmoid")) {
		@Override
		public DoubleUnaryOperator fit(double[] training) {
			return ZSCORE.fit(training).andThen(NormalizationFunction::logistic);
		}
	},
	SCALED_SIGMOID(List.of("scaledSigmoid")) {
		@Override
		public DoubleUnaryOperator fit(double[] training) {
			return rescaled(SIGMOID.fit(training), training);
		}
	},
	ROBUST_SIGMOID(List.of("robustSigmoid")) {
		@Override
		public DoubleUnaryOperator fit(double[] training) {
			return ROBUST_ZSCORE.fit(training).andThen(NormalizationFunction::logistic);
		}
	},
	SCALED_ROBUST_SIGMOID(List.of("scaledRobustSigmoid", "scaledSQzscore")) {
		@Override
		public DoubleUnaryOperator fit(double[] training) {
			return rescaled(ROBUST_SIGMOID.fit(training), training);
		}
	},
	MIXED_SIGMOID(List.of("mixedSigmoid")) {
		@Override
		public DoubleUnaryOperator fit(double[] training) {
			// the robust sigmoid degenerates when the interquartile range is zero
			DoubleUnaryOperator sigmoid = robustScale(training) == 0 ? SIGMOID.fit(training) : ROBUST_SIGMOID.fit(training);
			return rescaled(sigmoid, training);
		}
	},
	LOGARITHMIC(List.of("logarithmic")) {
		@Override
		public DoubleUnaryOperator fit(double[] training) {
			double min = StatUtils.min(training);
			return rescaled(x -> Math.log(x - min + 1), training);
		}
	};

	public static final NormalizationFunction DEFAULT = SCALED_ROBUST_SIGMOID;

	private static final double IQR_TO_SIGMA = 1.35;

	private final List<String> names;

	NormalizationFunction(List<String> names) {
		this.names = names;
	}

	/**
	 * Fits the transform on a non-empty array of finite values.
	 */
	public abstract DoubleUnaryOperator fit(double[] training);

	public String getName() {
		return names.get(0);
	}

	public boolean isIdentity() {
		return this == NONE;
	}

	public static Optional<NormalizationFunction> fromName(String name) {
		if (name == null) return Optional.empty();
		return Arrays.stream(values())
				.filter(f -> f.names.stream().anyMatch(n -> n.equalsIgnoreCase(name.trim())))
				.findFirst();
	}

	private static double logistic(double z) {
		return 1.0 / (1.0 + Math.exp(-z));
	}

	private static double percentile(double[] values, double p) {
		return new Percentile().evaluate(values, p);
	}

	private static double robustScale(double[] values) {
		return (percentile(values, 75) - percentile(values, 25)) / IQR_TO_SIGMA;
	}

	/**
	 * Follows the transform with a linear map of its image of the training values onto [0, 1].
	 */
	private static DoubleUnaryOperator rescaled(DoubleUnaryOperator transform, double[] training) {
		double[] transformed = Arrays.stream(training).map(transform).toArray();
		double min = StatUtils.min(transformed);
		double max = StatUtils.max(transformed);
		return transform.andThen(x -> (x - min) / (max - min));
	}
}
