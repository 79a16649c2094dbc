package com.rebootearth.burnrisk.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebootearth.burnrisk.application.exception.MalformedUpstreamResponseException;
import com.rebootearth.burnrisk.application.exception.UpstreamException;
import com.rebootearth.burnrisk.application.port.out.WeatherAdapter;
import com.rebootearth.burnrisk.domain.model.DailyWeather;
import com.rebootearth.burnrisk.domain.model.DateRange;
import com.rebootearth.burnrisk.domain.model.UpstreamSource;
import com.rebootearth.burnrisk.domain.model.WeatherSnapshot;
import com.rebootearth.burnrisk.infrastructure.config.BurnRiskProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Daily weather aggregates from the Open-Meteo forecast API, which also serves
 * recent past days.
 */
@Service
public class OpenMeteoWeatherClient implements WeatherAdapter {

    private static final Logger logger = LoggerFactory.getLogger(OpenMeteoWeatherClient.class);

    static final String TEMPERATURE = "temperature_2m_mean";
    static final String WIND_SPEED = "wind_speed_10m_mean";
    static final String PRECIPITATION = "precipitation_sum";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public OpenMeteoWeatherClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        BurnRiskProperties properties
    ) {
        this.objectMapper = objectMapper;
        this.timeout = properties.getWeather().getTimeout();
        this.webClient = webClientBuilder.clone()
            .baseUrl(properties.getWeather().getBaseUrl())
            .build();
    }

    @Override
    public WeatherSnapshot fetchWeather(BigDecimal lat, BigDecimal lng, DateRange dateRange) {
        logger.debug("Fetching weather for {}, {} over {}", lat, lng, dateRange);

        String responseBody;
        try {
            responseBody = webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/v1/forecast")
                    .queryParam("latitude", lat.toPlainString())
                    .queryParam("longitude", lng.toPlainString())
                    .queryParam("daily", String.join(",", TEMPERATURE, WIND_SPEED, PRECIPITATION))
                    .queryParam("temperature_unit", "fahrenheit")
                    .queryParam("timezone", "auto")
                    .queryParam("start_date", dateRange.getStart().toString())
                    .queryParam("end_date", dateRange.getEnd().toString())
                    .build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
        } catch (Exception e) {
            UpstreamException translated = UpstreamErrors.translate(UpstreamSource.WEATHER, e);
            logger.warn("Open-Meteo call failed: {}", translated.getMessage());
            throw translated;
        }

        return parseResponse(responseBody);
    }

    /**
     * Parse the column-oriented {@code daily} block into one entry per date.
     */
    private WeatherSnapshot parseResponse(String responseBody) {
        JsonNode daily;
        try {
            JsonNode root = objectMapper.readTree(responseBody == null ? "" : responseBody);
            daily = root == null ? null : root.get("daily");
        } catch (Exception e) {
            throw new MalformedUpstreamResponseException(UpstreamSource.WEATHER, "Failed to parse Open-Meteo response", e);
        }
        if (daily == null || !daily.has("time") || !daily.get("time").isArray()) {
            throw new MalformedUpstreamResponseException(UpstreamSource.WEATHER, "Open-Meteo response missing daily.time");
        }

        JsonNode times = daily.get("time");
        Map<LocalDate, DailyWeather> days = new LinkedHashMap<>();
        for (int i = 0; i < times.size(); i++) {
            try {
                LocalDate date = LocalDate.parse(times.get(i).asText());
                days.put(date, new DailyWeather(
                    valueAt(daily, TEMPERATURE, i),
                    valueAt(daily, WIND_SPEED, i),
                    valueAt(daily, PRECIPITATION, i)));
            } catch (DateTimeParseException e) {
                throw new MalformedUpstreamResponseException(UpstreamSource.WEATHER,
                    "Open-Meteo returned invalid date: " + times.get(i), e);
            }
        }

        if (days.isEmpty()) {
            throw new MalformedUpstreamResponseException(UpstreamSource.WEATHER, "Open-Meteo returned no days");
        }
        logger.debug("Parsed {} weather days", days.size());
        return WeatherSnapshot.of(days);
    }

    private static Double valueAt(JsonNode daily, String column, int index) {
        JsonNode values = daily.get(column);
        if (values == null || !values.isArray() || index >= values.size()) {
            return null;
        }
        JsonNode value = values.get(index);
        return value == null || value.isNull() ? null : value.asDouble();
    }
}
