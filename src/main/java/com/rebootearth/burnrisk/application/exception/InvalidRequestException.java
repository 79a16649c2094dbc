package com.rebootearth.burnrisk.application.exception;

/**
 * A request parameter passed the binding checks but is not a value the service accepts.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
