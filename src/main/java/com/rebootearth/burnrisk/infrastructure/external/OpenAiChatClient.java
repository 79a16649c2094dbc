package com.rebootearth.burnrisk.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rebootearth.burnrisk.application.exception.MalformedUpstreamResponseException;
import com.rebootearth.burnrisk.application.exception.UpstreamException;
import com.rebootearth.burnrisk.domain.model.UpstreamSource;
import com.rebootearth.burnrisk.infrastructure.config.BurnRiskProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Thin client for the OpenAI chat completions endpoint. Returns the text content of
 * the first choice.
 */
@Component
public class OpenAiChatClient {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiChatClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public OpenAiChatClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        BurnRiskProperties properties
    ) {
        BurnRiskProperties.StatisticsBackend config = properties.getStatistics();
        this.objectMapper = objectMapper;
        this.timeout = config.getTimeout();
        this.webClient = webClientBuilder.clone()
            .baseUrl(config.getBaseUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
            .build();
    }

    /**
     * @param temperature sampling temperature, or null for models that reject the parameter
     * @param responseFormat {@code response_format} object, or null for free text
     * @throws UpstreamException on transport failure or an unusable response
     */
    public String complete(String model, String systemPrompt, String userPrompt,
                           Double temperature, JsonNode responseFormat) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt);
        if (temperature != null) {
            body.put("temperature", temperature);
        }
        if (responseFormat != null) {
            body.set("response_format", responseFormat);
        }

        logger.debug("Requesting chat completion from model {}", model);
        String responseBody;
        try {
            responseBody = webClient.post()
                .uri("/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body.toString())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
        } catch (WebClientResponseException e) {
            logger.warn("OpenAI returned error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw UpstreamErrors.translate(UpstreamSource.STATISTICS, e);
        } catch (Exception e) {
            UpstreamException translated = UpstreamErrors.translate(UpstreamSource.STATISTICS, e);
            logger.warn("OpenAI call failed: {}", translated.getMessage());
            throw translated;
        }

        return extractContent(responseBody);
    }

    private String extractContent(String responseBody) {
        JsonNode content;
        try {
            JsonNode root = objectMapper.readTree(responseBody == null ? "" : responseBody);
            content = root == null ? null : root.path("choices").path(0).path("message").get("content");
        } catch (Exception e) {
            throw new MalformedUpstreamResponseException(UpstreamSource.STATISTICS,
                "Failed to parse chat completion response", e);
        }
        if (content == null || content.isNull()) {
            throw new MalformedUpstreamResponseException(UpstreamSource.STATISTICS,
                "Chat completion response has no message content");
        }
        return content.asText();
    }
}
