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
package eu.openanalytics.featurematrix.api;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import javax.servlet.http.HttpServletRequest;
import javax.validation.ConstraintViolationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import eu.openanalytics.featurematrix.exception.CalculationException;
import eu.openanalytics.featurematrix.exception.CurationException;
import eu.openanalytics.featurematrix.exception.InvalidSnapshotException;
import eu.openanalytics.featurematrix.exception.SnapshotNotFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    @ExceptionHandler(SnapshotNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(SnapshotNotFoundException ex, HttpServletRequest request) {
        return buildResponse(HttpStatus.NOT_FOUND, ex.getMessage(), ex, request);
    }

    @ExceptionHandler(CurationException.class)
    public ResponseEntity<Map<String, Object>> handleCurationError(CurationException ex, HttpServletRequest request) {
        ResponseEntity<Map<String, Object>> response = buildResponse(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), ex, request);
        response.getBody().put("errorType", ex.getErrorType().name());
        return response;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationError(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<String> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.toList());
        ResponseEntity<Map<String, Object>> response = buildResponse(HttpStatus.BAD_REQUEST, "Validation error", ex, request);
        response.getBody().put("fieldErrors", fieldErrors);
        return response;
    }

    @ExceptionHandler({InvalidSnapshotException.class, CalculationException.class, ConstraintViolationException.class,
            IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException ex, HttpServletRequest request) {
        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), ex, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableMessage(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildResponse(HttpStatus.BAD_REQUEST, "Invalid JSON request body", ex, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleServerError(Exception ex, HttpServletRequest request) {
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", ex, request);
    }

    private ResponseEntity<Map<String, Object>> buildResponse(HttpStatus status, String error, Exception ex, HttpServletRequest request) {
        if (status.is5xxServerError()) {
            logger.error(String.format("Request %s %s failed with status %d", request.getMethod(), request.getRequestURI(), status.value()), ex);
        } else {
            logger.warn(String.format("Request %s %s returned status %d: %s", request.getMethod(), request.getRequestURI(), status.value(), ex.getMessage()));
        }
        Map<String, Object> body = new HashMap<>();
        body.put("status", "error");
        body.put("error", error);
        body.put("path", request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
