package com.rebootearth.burnrisk.presentation.exception;

import com.rebootearth.burnrisk.application.exception.AllSourcesFailedException;
import com.rebootearth.burnrisk.application.exception.InvalidRequestException;
import com.rebootearth.burnrisk.application.exception.ResolutionTimeoutException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler providing consistent JSON error responses of the form
 * {@code {"error": <message>, "code": <CODE>}}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(ConstraintViolationException ex) {
        logger.debug("Validation error", ex);

        String message = ex.getConstraintViolations().stream()
            .map(violation -> violation.getMessage())
            .sorted()
            .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<Map<String, Object>> handleMethodValidation(HandlerMethodValidationException ex) {
        logger.debug("Validation error", ex);

        String message = ex.getAllValidationResults().stream()
            .flatMap(result -> result.getResolvableErrors().stream())
            .map(error -> error.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException ex) {
        logger.debug("Missing parameter", ex);
        return error(HttpStatus.BAD_REQUEST, "MISSING_PARAMETER",
            "Missing required parameter: " + ex.getParameterName());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatchException(MethodArgumentTypeMismatchException ex) {
        logger.debug("Type mismatch error", ex);
        return error(HttpStatus.BAD_REQUEST, "INVALID_PARAMETER", "Invalid parameter type: " + ex.getName());
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(InvalidRequestException ex) {
        logger.debug("Invalid request", ex);
        return error(HttpStatus.BAD_REQUEST, "INVALID_INPUT", ex.getMessage());
    }

    @ExceptionHandler(AllSourcesFailedException.class)
    public ResponseEntity<Map<String, Object>> handleAllSourcesFailed(AllSourcesFailedException ex) {
        logger.error("No upstream source available for {}", ex.getCacheKey());
        return error(HttpStatus.BAD_GATEWAY, "ALL_SOURCES_FAILED", ex.getMessage());
    }

    @ExceptionHandler(ResolutionTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleResolutionTimeout(ResolutionTimeoutException ex) {
        logger.error("Resolution timed out", ex);
        return error(HttpStatus.GATEWAY_TIMEOUT, "RESOLUTION_TIMEOUT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        logger.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        return ResponseEntity.status(status).body(body);
    }
}
