package com.rebootearth.burnrisk.application.exception;

import com.rebootearth.burnrisk.domain.model.UpstreamSource;

/**
 * The source rejected the call with a rate limit.
 */
public class UpstreamRateLimitedException extends UpstreamException {

    public UpstreamRateLimitedException(UpstreamSource source, String message) {
        super(source, message);
    }

    public UpstreamRateLimitedException(UpstreamSource source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
