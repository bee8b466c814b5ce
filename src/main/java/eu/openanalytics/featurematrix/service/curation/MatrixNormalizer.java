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
import java.util.function.DoubleUnaryOperator;

import org.springframework.stereotype.Component;

/**
 * Applies a {@link NormalizationFunction} column by column. Transform parameters are learned from
 * the finite values of the training rows only and then applied to all rows; NaN cells stay NaN.
 */
@Component
public class MatrixNormalizer {

	public double[][] normalize(double[][] values, NormalizationFunction function, int[] trainingRows) {
		int rows = values.length;
		int cols = rows == 0 ? 0 : values[0].length;
		double[][] result = new double[rows][cols];

		for (int c = 0; c < cols; c++) {
			int col = c;
			double[] training = Arrays.stream(trainingRows)
					.mapToDouble(r -> values[r][col])
					.filter(Double::isFinite)
					.toArray();

			DoubleUnaryOperator transform = training.length == 0 ? x -> Double.NaN : function.fit(training);
			for (int r = 0; r < rows; r++) {
				double v = values[r][c];
				result[r][c] = Double.isNaN(v) ? Double.NaN : transform.applyAsDouble(v);
			}
		}
		return result;
	}
}
