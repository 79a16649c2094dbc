package com.rebootearth.burnrisk.application.exception;

import com.rebootearth.burnrisk.domain.model.UpstreamSource;

/**
 * The source did not answer in time.
 */
public class UpstreamTimeoutException extends UpstreamException {

    public UpstreamTimeoutException(UpstreamSource source, String message) {
        super(source, message);
    }

    public UpstreamTimeoutException(UpstreamSource source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
