package com.rebootearth.burnrisk.application.exception;

import com.rebootearth.burnrisk.domain.model.UpstreamSource;

/**
 * Base class for failures of an external data source. The orchestrator recovers
 * from these per source; they only surface to callers when every source failed.
 */
public abstract class UpstreamException extends RuntimeException {

    private final UpstreamSource source;

    protected UpstreamException(UpstreamSource source, String message) {
        super(message);
        this.source = source;
    }

    protected UpstreamException(UpstreamSource source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public UpstreamSource getSource() {
        return source;
    }
}
