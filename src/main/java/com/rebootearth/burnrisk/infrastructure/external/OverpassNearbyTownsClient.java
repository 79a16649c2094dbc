package com.rebootearth.burnrisk.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebootearth.burnrisk.application.exception.MalformedUpstreamResponseException;
import com.rebootearth.burnrisk.application.exception.UpstreamException;
import com.rebootearth.burnrisk.application.port.out.NearbyTownsAdapter;
import com.rebootearth.burnrisk.domain.model.NearbyTown;
import com.rebootearth.burnrisk.domain.model.UpstreamSource;
import com.rebootearth.burnrisk.infrastructure.config.BurnRiskProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Towns and cities around a location from the Overpass API, valued by their share of
 * the surrounding county's GDP.
 */
@Service
public class OverpassNearbyTownsClient implements NearbyTownsAdapter {

    private static final Logger logger = LoggerFactory.getLogger(OverpassNearbyTownsClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final FccCountyClient countyClient;
    private final CountyEconomicsTable economicsTable;
    private final int radiusMeters;
    private final Duration timeout;

    public OverpassNearbyTownsClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        FccCountyClient countyClient,
        CountyEconomicsTable economicsTable,
        BurnRiskProperties properties
    ) {
        BurnRiskProperties.NearbyTowns config = properties.getNearbyTowns();
        this.objectMapper = objectMapper;
        this.countyClient = countyClient;
        this.economicsTable = economicsTable;
        this.radiusMeters = config.getRadiusMeters();
        this.timeout = config.getTimeout();
        this.webClient = webClientBuilder.clone()
            .baseUrl(config.getOverpassUrl())
            .build();
    }

    /**
     * Query Overpass for town and city nodes within the configured radius.
     *
     * @return towns by descending population, then name
     * @throws UpstreamException if Overpass or the county lookup fails
     */
    @Override
    public List<NearbyTown> findNearbyTowns(BigDecimal lat, BigDecimal lng) {
        String query = buildQuery(lat, lng, radiusMeters);
        logger.debug("Executing Overpass query: {}", query);

        String responseBody;
        try {
            responseBody = webClient.post()
                .uri("/interpreter")
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue(query)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .retryWhen(Retry.fixedDelay(2, Duration.ofSeconds(1))
                    .filter(OverpassNearbyTownsClient::isTransient)
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .block();
        } catch (WebClientResponseException e) {
            logger.warn("Overpass API returned error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw UpstreamErrors.translate(UpstreamSource.NEARBY_TOWNS, e);
        } catch (Exception e) {
            UpstreamException translated = UpstreamErrors.translate(UpstreamSource.NEARBY_TOWNS, e);
            logger.warn("Overpass call failed: {}", translated.getMessage());
            throw translated;
        }

        List<TownNode> nodes = parseResponse(responseBody);
        if (nodes.isEmpty()) {
            return List.of();
        }

        // All towns share the county of the queried location
        Optional<String> county = countyClient.findCounty(lat, lng);
        if (county.isEmpty() || economicsTable.find(county.get()).isEmpty()) {
            logger.info("No economics for county {} at {}, {}; value estimates are 0",
                county.orElse("<none>"), lat, lng);
        }

        List<NearbyTown> towns = new ArrayList<>(nodes.size());
        for (TownNode node : nodes) {
            double value = county.map(name -> economicsTable.valueEstimate(name, node.population)).orElse(0.0);
            towns.add(new NearbyTown(node.name, node.lat, node.lng, node.population, value));
        }
        towns.sort(Comparator.comparingInt(NearbyTown::getPopulation).reversed()
            .thenComparing(NearbyTown::getName, Comparator.nullsLast(Comparator.naturalOrder())));
        return List.copyOf(towns);
    }

    /**
     * Build Overpass QL query string.
     */
    static String buildQuery(BigDecimal lat, BigDecimal lng, int radiusMeters) {
        return String.format(Locale.ROOT,
            "[out:json];node[\"place\"~\"town|city\"](around:%d,%.6f,%.6f);out;",
            radiusMeters, lat.doubleValue(), lng.doubleValue());
    }

    private static boolean isTransient(Throwable throwable) {
        if (throwable instanceof WebClientResponseException response) {
            return response.getStatusCode().is5xxServerError();
        }
        return throwable instanceof WebClientRequestException;
    }

    /**
     * Parse Overpass JSON response into town nodes.
     */
    private List<TownNode> parseResponse(String responseBody) {
        JsonNode elements;
        try {
            JsonNode root = objectMapper.readTree(responseBody == null ? "" : responseBody);
            elements = root == null ? null : root.get("elements");
        } catch (Exception e) {
            throw new MalformedUpstreamResponseException(UpstreamSource.NEARBY_TOWNS,
                "Failed to parse Overpass response", e);
        }
        if (elements == null || !elements.isArray()) {
            throw new MalformedUpstreamResponseException(UpstreamSource.NEARBY_TOWNS,
                "Overpass response missing elements array");
        }

        List<TownNode> nodes = new ArrayList<>();
        for (JsonNode element : elements) {
            TownNode node = parseElement(element);
            if (node != null) {
                nodes.add(node);
            }
        }
        logger.debug("Parsed {} towns from Overpass response", nodes.size());
        return nodes;
    }

    private TownNode parseElement(JsonNode element) {
        JsonNode tags = element.get("tags");
        if (tags == null || !tags.hasNonNull("name") || !element.has("lat") || !element.has("lon")) {
            logger.debug("Skipping unnamed or unplaced element: {}", element.path("id").asText());
            return null;
        }
        return new TownNode(
            tags.get("name").asText(),
            BigDecimal.valueOf(element.get("lat").asDouble()),
            BigDecimal.valueOf(element.get("lon").asDouble()),
            parsePopulation(tags.get("population")));
    }

    /**
     * OSM population tags are free text ("12,345", "approx. 900"). Anything without
     * digits counts as 0.
     */
    static int parsePopulation(JsonNode tag) {
        if (tag == null || tag.isNull()) {
            return 0;
        }
        if (tag.isNumber()) {
            return Math.max(0, tag.asInt());
        }
        String digits = tag.asText().replaceAll("[^0-9]", "");
        if (digits.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static final class TownNode {
        private final String name;
        private final BigDecimal lat;
        private final BigDecimal lng;
        private final int population;

        private TownNode(String name, BigDecimal lat, BigDecimal lng, int population) {
            this.name = name;
            this.lat = lat;
            this.lng = lng;
            this.population = population;
        }
    }
}
