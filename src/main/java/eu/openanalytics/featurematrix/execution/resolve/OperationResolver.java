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
package eu.openanalytics.featurematrix.execution.resolve;

import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.stereotype.Service;

import eu.openanalytics.featurematrix.exception.TransformException;
import eu.openanalytics.featurematrix.execution.master.ResultBundle;
import eu.openanalytics.featurematrix.model.Operation;

/**
 * Extracts the value of a pointer operation from the result bundle of its master.
 * Every combination of bundle and operation maps to exactly one of GOOD, ERROR or NOT_APPLICABLE.
 */
@Service
public class OperationResolver {

    public ResolvedCell resolve(ResultBundle bundle, Operation operation) {
        if (bundle == null || bundle.isFailed()) {
            return ResolvedCell.error(bundle == null ? "No result bundle" : bundle.getMessage());
        }
        if (!bundle.isSuccess()) {
            return ResolvedCell.notApplicable();
        }
        if (operation.getTransform() == null) {
            return ResolvedCell.error(String.format("Operation %s has no transform", operation.getName()));
        }

        double value;
        try {
            value = operation.getTransform().apply(bundle.getFields());
        } catch (TransformException e) {
            return ResolvedCell.error(e.getMessage());
        } catch (RuntimeException e) {
            return ResolvedCell.error(ExceptionUtils.getMessage(e));
        }

        if (!Double.isFinite(value)) {
            return ResolvedCell.error(String.format("Operation %s produced a non-finite value (%s)", operation.getName(), value));
        }
        return ResolvedCell.good(value);
    }
}
