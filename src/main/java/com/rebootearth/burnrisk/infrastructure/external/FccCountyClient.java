package com.rebootearth.burnrisk.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebootearth.burnrisk.application.exception.MalformedUpstreamResponseException;
import com.rebootearth.burnrisk.application.service.CacheNames;
import com.rebootearth.burnrisk.domain.model.UpstreamSource;
import com.rebootearth.burnrisk.infrastructure.config.BurnRiskProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

/**
 * County lookup through the FCC census block API. County boundaries do not move, so
 * results are cached for the life of the process.
 */
@Service
public class FccCountyClient {

    private static final Logger logger = LoggerFactory.getLogger(FccCountyClient.class);

    private static final String COUNTY_SUFFIX = " County";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public FccCountyClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        BurnRiskProperties properties
    ) {
        this.objectMapper = objectMapper;
        this.timeout = properties.getNearbyTowns().getTimeout();
        this.webClient = webClientBuilder.clone()
            .baseUrl(properties.getNearbyTowns().getCountyUrl())
            .build();
    }

    /**
     * @return county name without the " County" suffix, empty outside the US
     * @throws com.rebootearth.burnrisk.application.exception.UpstreamException if the lookup fails
     */
    @Cacheable(CacheNames.COUNTIES)
    public Optional<String> findCounty(BigDecimal lat, BigDecimal lng) {
        logger.debug("Looking up county for {}, {}", lat, lng);

        String responseBody;
        try {
            responseBody = webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/api/census/block/find")
                    .queryParam("latitude", lat.toPlainString())
                    .queryParam("longitude", lng.toPlainString())
                    .queryParam("format", "json")
                    .build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
        } catch (Exception e) {
            throw UpstreamErrors.translate(UpstreamSource.NEARBY_TOWNS, e);
        }

        JsonNode county;
        try {
            JsonNode root = objectMapper.readTree(responseBody == null ? "" : responseBody);
            county = root == null ? null : root.path("County").get("name");
        } catch (Exception e) {
            throw new MalformedUpstreamResponseException(UpstreamSource.NEARBY_TOWNS,
                "Failed to parse FCC census response", e);
        }
        if (county == null || county.isNull() || county.asText().isBlank()) {
            return Optional.empty();
        }
        String name = county.asText().trim();
        if (name.endsWith(COUNTY_SUFFIX)) {
            name = name.substring(0, name.length() - COUNTY_SUFFIX.length()).trim();
        }
        return Optional.of(name);
    }
}
