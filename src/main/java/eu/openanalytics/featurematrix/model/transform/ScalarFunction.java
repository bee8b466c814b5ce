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
package eu.openanalytics.featurematrix.model.transform;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

public enum ScalarFunction {

    ABS("abs", Math::abs),
    LOG("log", Math::log),
    LOG10("log10", Math::log10),
    SQRT("sqrt", Math::sqrt),
    EXP("exp", Math::exp),
    NEG("neg", x -> -x),
    SQUARE("square", x -> x * x),
    INV("inv", x -> 1.0 / x);

    private final String name;
    private final DoubleUnaryOperator operator;

    ScalarFunction(String name, DoubleUnaryOperator operator) {
        this.name = name;
        this.operator = operator;
    }

    public String getName() {
        return name;
    }

    public double apply(double value) {
        return operator.applyAsDouble(value);
    }

    public static Optional<ScalarFunction> fromName(String name) {
        return Arrays.stream(values()).filter(f -> f.name.equals(name)).findFirst();
    }
}
