package com.rebootearth.burnrisk.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebootearth.burnrisk.domain.model.Statistics;
import com.rebootearth.burnrisk.domain.model.StatisticsFactor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Schema check for generated statistics. Accepts either {@code {"statistics": {...}}}
 * or the bare factor object. Values are never clamped: an out-of-range number is a
 * validation problem like a missing key or a non-numeric value. Unknown keys are ignored.
 */
public class StatisticsValidator {

    private final ObjectMapper objectMapper;

    public StatisticsValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Validation validate(String content) {
        if (content == null || content.isBlank()) {
            return Validation.invalid(List.of("empty response"), Map.of(), false);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(content));
        } catch (JsonProcessingException e) {
            return Validation.invalid(List.of("response is not valid JSON: " + e.getOriginalMessage()), Map.of(), false);
        }
        JsonNode factors = root != null && root.has("statistics") ? root.get("statistics") : root;
        if (factors == null || !factors.isObject()) {
            return Validation.invalid(List.of("statistics object is missing"), Map.of(), false);
        }

        Map<StatisticsFactor, Double> accepted = new EnumMap<>(StatisticsFactor.class);
        List<String> problems = new ArrayList<>();
        boolean onlyMissing = true;
        for (StatisticsFactor factor : StatisticsFactor.values()) {
            JsonNode value = factors.get(factor.getKey());
            if (value == null || value.isNull()) {
                problems.add("missing key '" + factor.getKey() + "'");
            } else if (!value.isNumber()) {
                problems.add("'" + factor.getKey() + "' is not a number: " + value);
                onlyMissing = false;
            } else if (value.asDouble() < 0.0 || value.asDouble() > 1.0) {
                problems.add("'" + factor.getKey() + "' out of range [0,1]: " + value.asDouble());
                onlyMissing = false;
            } else {
                accepted.put(factor, value.asDouble());
            }
        }

        if (problems.isEmpty()) {
            return Validation.valid(Statistics.of(accepted));
        }
        return Validation.invalid(problems, accepted, onlyMissing);
    }

    /**
     * Models sometimes wrap JSON in a markdown fence despite instructions.
     */
    private static String stripCodeFence(String content) {
        String trimmed = content.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }

    /**
     * Outcome of a validation pass.
     */
    @Getter
    public static class Validation {
        private final Statistics statistics;
        private final List<String> problems;
        private final Map<StatisticsFactor, Double> acceptedFactors;
        private final boolean onlyMissingKeys;

        private Validation(Statistics statistics, List<String> problems,
                           Map<StatisticsFactor, Double> acceptedFactors, boolean onlyMissingKeys) {
            this.statistics = statistics;
            this.problems = Collections.unmodifiableList(problems);
            this.acceptedFactors = Collections.unmodifiableMap(acceptedFactors);
            this.onlyMissingKeys = onlyMissingKeys;
        }

        static Validation valid(Statistics statistics) {
            return new Validation(statistics, List.of(), statistics.asMap(), false);
        }

        static Validation invalid(List<String> problems, Map<StatisticsFactor, Double> accepted,
                                  boolean onlyMissingKeys) {
            return new Validation(null, problems, accepted, onlyMissingKeys);
        }

        public boolean isValid() {
            return statistics != null;
        }
    }
}
