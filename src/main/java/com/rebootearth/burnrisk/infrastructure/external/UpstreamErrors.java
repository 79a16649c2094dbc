package com.rebootearth.burnrisk.infrastructure.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.rebootearth.burnrisk.application.exception.MalformedUpstreamResponseException;
import com.rebootearth.burnrisk.application.exception.UpstreamException;
import com.rebootearth.burnrisk.application.exception.UpstreamRateLimitedException;
import com.rebootearth.burnrisk.application.exception.UpstreamTimeoutException;
import com.rebootearth.burnrisk.application.exception.UpstreamUnavailableException;
import com.rebootearth.burnrisk.domain.model.UpstreamSource;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Maps WebClient and Reactor failures onto the upstream error taxonomy.
 */
final class UpstreamErrors {

    private UpstreamErrors() {
    }

    static UpstreamException translate(UpstreamSource source, Throwable error) {
        if (error instanceof UpstreamException upstream) {
            return upstream;
        }
        if (error instanceof WebClientResponseException response) {
            if (response.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return new UpstreamRateLimitedException(source,
                    source.getId() + " rate limited the request", error);
            }
            return new UpstreamUnavailableException(source,
                source.getId() + " returned " + response.getStatusCode(), error);
        }
        if (hasCause(error, TimeoutException.class)) {
            return new UpstreamTimeoutException(source, source.getId() + " timed out", error);
        }
        if (error instanceof WebClientRequestException) {
            return new UpstreamUnavailableException(source, "Failed to connect to " + source.getId(), error);
        }
        if (hasCause(error, JsonProcessingException.class)) {
            return new MalformedUpstreamResponseException(source,
                source.getId() + " returned unparseable JSON", error);
        }
        return new UpstreamUnavailableException(source, "Unexpected error calling " + source.getId(), error);
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
