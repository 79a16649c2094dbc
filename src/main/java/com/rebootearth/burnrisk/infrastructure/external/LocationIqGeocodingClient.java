package com.rebootearth.burnrisk.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebootearth.burnrisk.application.exception.MalformedUpstreamResponseException;
import com.rebootearth.burnrisk.application.exception.UpstreamException;
import com.rebootearth.burnrisk.application.port.out.GeocodingAdapter;
import com.rebootearth.burnrisk.domain.model.UpstreamSource;
import com.rebootearth.burnrisk.infrastructure.config.BurnRiskProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Reverse geocoding through LocationIQ.
 * Single attempt: geocoding failures must not dominate request latency.
 */
@Service
public class LocationIqGeocodingClient implements GeocodingAdapter {

    private static final Logger logger = LoggerFactory.getLogger(LocationIqGeocodingClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final Duration timeout;

    public LocationIqGeocodingClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        BurnRiskProperties properties
    ) {
        BurnRiskProperties.Geocoding config = properties.getGeocoding();
        this.objectMapper = objectMapper;
        this.apiKey = config.getApiKey();
        this.timeout = config.getTimeout();
        this.webClient = webClientBuilder.clone()
            .baseUrl(config.getBaseUrl())
            .build();
    }

    @Override
    public String reverseGeocode(BigDecimal lat, BigDecimal lng) {
        logger.debug("Reverse geocoding {}, {}", lat, lng);

        String responseBody;
        try {
            responseBody = webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/v1/reverse.php")
                    .queryParam("key", apiKey)
                    .queryParam("lat", lat.toPlainString())
                    .queryParam("lon", lng.toPlainString())
                    .queryParam("format", "json")
                    .build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
        } catch (WebClientResponseException e) {
            logger.warn("LocationIQ returned error: {}", e.getStatusCode());
            throw UpstreamErrors.translate(UpstreamSource.GEOCODING, e);
        } catch (Exception e) {
            UpstreamException translated = UpstreamErrors.translate(UpstreamSource.GEOCODING, e);
            logger.warn("LocationIQ call failed: {}", translated.getMessage());
            throw translated;
        }

        return parseDisplayName(responseBody);
    }

    private String parseDisplayName(String responseBody) {
        try {
            JsonNode root = objectMapper.readTree(responseBody == null ? "" : responseBody);
            JsonNode displayName = root == null ? null : root.get("display_name");
            if (displayName == null || displayName.asText().isBlank()) {
                throw new MalformedUpstreamResponseException(UpstreamSource.GEOCODING,
                    "LocationIQ response has no display_name");
            }
            return displayName.asText();
        } catch (MalformedUpstreamResponseException e) {
            throw e;
        } catch (Exception e) {
            throw new MalformedUpstreamResponseException(UpstreamSource.GEOCODING,
                "Failed to parse LocationIQ response", e);
        }
    }
}
