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
package eu.openanalytics.featurematrix.exception;

import eu.openanalytics.featurematrix.model.MasterOperation;
import eu.openanalytics.featurematrix.model.Operation;
import eu.openanalytics.featurematrix.model.TimeSeries;

public class CalculationException extends RuntimeException {

	private static final long serialVersionUID = -7023496120838541184L;

	public CalculationException(String msg) {
		super(msg);
	}

	public CalculationException(String msg, Object... args) {
		super(String.format(msg, args));
	}

	public static void doThrow(String msg, Object... args) {
		StringBuilder errorMessage = new StringBuilder();
		errorMessage.append(msg);

		for (Object arg : args) {
			if (arg instanceof TimeSeries ts) errorMessage.append(String.format(" [time series %s (%d)]", ts.getName(), ts.getId()));
			if (arg instanceof MasterOperation master) errorMessage.append(String.format(" [master %s (%d)]", master.getLabel(), master.getId()));
			if (arg instanceof Operation op) errorMessage.append(String.format(" [operation %s (%d)]", op.getName(), op.getId()));
		}

		throw new CalculationException(errorMessage.toString());
	}
}
