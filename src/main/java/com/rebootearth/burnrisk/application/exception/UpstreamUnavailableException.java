package com.rebootearth.burnrisk.application.exception;

import com.rebootearth.burnrisk.domain.model.UpstreamSource;

/**
 * The source could not be reached or refused the credentials.
 */
public class UpstreamUnavailableException extends UpstreamException {

    public UpstreamUnavailableException(UpstreamSource source, String message) {
        super(source, message);
    }

    public UpstreamUnavailableException(UpstreamSource source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
