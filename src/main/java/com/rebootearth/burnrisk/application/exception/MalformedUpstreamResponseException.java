package com.rebootearth.burnrisk.application.exception;

import com.rebootearth.burnrisk.domain.model.UpstreamSource;

/**
 * The source answered with a payload that failed validation.
 */
public class MalformedUpstreamResponseException extends UpstreamException {

    public MalformedUpstreamResponseException(UpstreamSource source, String message) {
        super(source, message);
    }

    public MalformedUpstreamResponseException(UpstreamSource source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
