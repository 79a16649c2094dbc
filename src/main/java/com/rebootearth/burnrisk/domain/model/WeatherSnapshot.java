package com.rebootearth.burnrisk.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Daily weather keyed by date, or the explicit {@code unavailable} sentinel when the
 * weather source could not be reached. An unavailable snapshot is never represented
 * as zero readings.
 */
@EqualsAndHashCode
@ToString
public class WeatherSnapshot {

    public static final String UNAVAILABLE_MARKER = "unavailable";

    private static final WeatherSnapshot UNAVAILABLE = new WeatherSnapshot(null);

    private final SortedMap<LocalDate, DailyWeather> days;

    private WeatherSnapshot(SortedMap<LocalDate, DailyWeather> days) {
        this.days = days == null ? null : Collections.unmodifiableSortedMap(days);
    }

    public static WeatherSnapshot of(Map<LocalDate, DailyWeather> days) {
        return new WeatherSnapshot(new TreeMap<>(days));
    }

    public static WeatherSnapshot unavailable() {
        return UNAVAILABLE;
    }

    public boolean isAvailable() {
        return days != null;
    }

    /**
     * @throws IllegalStateException if the snapshot is unavailable
     */
    public SortedMap<LocalDate, DailyWeather> getDays() {
        if (days == null) {
            throw new IllegalStateException("Weather snapshot is unavailable");
        }
        return days;
    }

    @JsonValue
    public Object toJson() {
        if (days == null) {
            return UNAVAILABLE_MARKER;
        }
        Map<String, DailyWeather> json = new LinkedHashMap<>();
        days.forEach((date, daily) -> json.put(date.toString(), daily));
        return json;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static WeatherSnapshot fromJson(JsonNode node) {
        if (node == null || node.isNull() || (node.isTextual() && UNAVAILABLE_MARKER.equals(node.asText()))) {
            return UNAVAILABLE;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Weather must be an object or \"" + UNAVAILABLE_MARKER + "\"");
        }
        SortedMap<LocalDate, DailyWeather> parsed = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode daily = field.getValue();
            parsed.put(LocalDate.parse(field.getKey()), new DailyWeather(
                    doubleOrNull(daily.get("temperature-mean")),
                    doubleOrNull(daily.get("wind-speed-mean")),
                    doubleOrNull(daily.get("precipitation-sum"))));
        }
        return new WeatherSnapshot(parsed);
    }

    private static Double doubleOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asDouble();
    }
}
