package com.rebootearth.burnrisk.application.exception;

/**
 * A persisted cache entry could not be parsed. Readers treat the entry as absent.
 */
public class CacheCorruptionException extends RuntimeException {

    public CacheCorruptionException(String message) {
        super(message);
    }

    public CacheCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
