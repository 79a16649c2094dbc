package com.rebootearth.burnrisk.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebootearth.burnrisk.application.exception.MalformedUpstreamResponseException;
import com.rebootearth.burnrisk.application.exception.UpstreamException;
import com.rebootearth.burnrisk.application.port.out.RiskOracle;
import com.rebootearth.burnrisk.domain.model.ScoreScale;
import com.rebootearth.burnrisk.domain.model.UpstreamSource;
import com.rebootearth.burnrisk.infrastructure.config.BurnRiskProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Client for the fire probability model served over HTTP. The model may report on
 * either scale; the value is normalized here and nowhere else.
 */
@Service
public class HttpRiskOracleClient implements RiskOracle {

    private static final Logger logger = LoggerFactory.getLogger(HttpRiskOracleClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ScoreScale scale;
    private final Duration timeout;

    public HttpRiskOracleClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        BurnRiskProperties properties
    ) {
        BurnRiskProperties.RiskOracle config = properties.getRiskOracle();
        this.objectMapper = objectMapper;
        this.scale = config.getScale();
        this.timeout = config.getTimeout();
        this.webClient = webClientBuilder.clone()
            .baseUrl(config.getBaseUrl())
            .build();
    }

    @Override
    public double probability(BigDecimal lat, BigDecimal lng) {
        String responseBody;
        try {
            responseBody = webClient.post()
                .uri("/predict")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("lat", lat, "lng", lng))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
        } catch (Exception e) {
            UpstreamException translated = UpstreamErrors.translate(UpstreamSource.RISK_ORACLE, e);
            logger.warn("Risk oracle call failed: {}", translated.getMessage());
            throw translated;
        }

        double raw = parseProbability(responseBody);
        try {
            double normalized = scale.normalize(raw);
            logger.debug("Risk oracle probability for {}, {}: {} ({} scale)", lat, lng, normalized, scale);
            return normalized;
        } catch (IllegalArgumentException e) {
            throw new MalformedUpstreamResponseException(UpstreamSource.RISK_ORACLE, e.getMessage(), e);
        }
    }

    private double parseProbability(String responseBody) {
        JsonNode probability;
        try {
            JsonNode root = objectMapper.readTree(responseBody == null ? "" : responseBody);
            probability = root == null ? null : root.get("probability");
        } catch (Exception e) {
            throw new MalformedUpstreamResponseException(UpstreamSource.RISK_ORACLE,
                "Failed to parse risk oracle response", e);
        }
        if (probability == null || !probability.isNumber()) {
            throw new MalformedUpstreamResponseException(UpstreamSource.RISK_ORACLE,
                "Risk oracle response has no numeric probability");
        }
        return probability.asDouble();
    }
}
