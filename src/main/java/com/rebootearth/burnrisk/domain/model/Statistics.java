package com.rebootearth.burnrisk.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Complete set of the eleven {@link StatisticsFactor} values, each in [0,1].
 * Serialized as a flat object keyed by the factor's kebab-case name.
 */
@EqualsAndHashCode
@ToString
public class Statistics {

    public static final double NEUTRAL_VALUE = 0.5;

    private final Map<StatisticsFactor, Double> values;

    private Statistics(Map<StatisticsFactor, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Builds statistics from a complete factor map.
     *
     * @throws IllegalArgumentException if a factor is missing or outside [0,1]
     */
    public static Statistics of(Map<StatisticsFactor, Double> values) {
        EnumMap<StatisticsFactor, Double> copy = new EnumMap<>(StatisticsFactor.class);
        for (StatisticsFactor factor : StatisticsFactor.values()) {
            Double value = values.get(factor);
            if (value == null) {
                throw new IllegalArgumentException("Missing statistics factor: " + factor.getKey());
            }
            if (value.isNaN() || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(
                        "Statistics factor " + factor.getKey() + " out of range [0,1]: " + value);
            }
            copy.put(factor, value);
        }
        return new Statistics(copy);
    }

    /**
     * Builds statistics from a partial map, filling absent factors with {@link #NEUTRAL_VALUE}.
     */
    public static Statistics withNeutralDefaults(Map<StatisticsFactor, Double> partial) {
        EnumMap<StatisticsFactor, Double> filled = new EnumMap<>(StatisticsFactor.class);
        for (StatisticsFactor factor : StatisticsFactor.values()) {
            filled.put(factor, partial.getOrDefault(factor, NEUTRAL_VALUE));
        }
        return of(filled);
    }

    public static Statistics neutral() {
        return withNeutralDefaults(Map.of());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static Statistics fromJson(Map<String, Double> json) {
        EnumMap<StatisticsFactor, Double> parsed = new EnumMap<>(StatisticsFactor.class);
        json.forEach((key, value) -> StatisticsFactor.fromKey(key).ifPresent(factor -> parsed.put(factor, value)));
        return withNeutralDefaults(parsed);
    }

    public double get(StatisticsFactor factor) {
        return values.get(factor);
    }

    public Map<StatisticsFactor, Double> asMap() {
        return values;
    }

    public double mean() {
        return values.values().stream().mapToDouble(Double::doubleValue).average().orElse(NEUTRAL_VALUE);
    }

    @JsonValue
    public Map<String, Double> toJson() {
        Map<String, Double> json = new LinkedHashMap<>();
        values.forEach((factor, value) -> json.put(factor.getKey(), value));
        return json;
    }
}
