package com.rebootearth.burnrisk.application.exception;

/**
 * The caller's overall deadline passed before the burn area was resolved. The shared
 * computation keeps running and is cached when it completes.
 */
public class ResolutionTimeoutException extends RuntimeException {

    public ResolutionTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
