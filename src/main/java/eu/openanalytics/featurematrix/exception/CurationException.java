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

import eu.openanalytics.featurematrix.enumeration.CurationErrorType;

/**
 * Aborts a curation run. No curated snapshot is written when this is thrown.
 */
public class CurationException extends RuntimeException {

    private static final long serialVersionUID = 5829138027551243876L;

    private final CurationErrorType errorType;

    public CurationException(CurationErrorType errorType, String msg) {
        super(msg);
        this.errorType = errorType;
    }

    public CurationException(CurationErrorType errorType, String msg, Object... args) {
        super(String.format(msg, args));
        this.errorType = errorType;
    }

    public CurationErrorType getErrorType() {
        return errorType;
    }
}
