package com.rebootearth.burnrisk.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatisticsTest {

    @Test
    void testOf_RequiresEveryFactor() {
        Map<StatisticsFactor, Double> partial = new EnumMap<>(StatisticsFactor.class);
        partial.put(StatisticsFactor.SAFETY, 0.3);

        assertThatThrownBy(() -> Statistics.of(partial))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fire-behavior");
    }

    @Test
    void testWithNeutralDefaults_FillsAbsentFactors() {
        Map<StatisticsFactor, Double> partial = new EnumMap<>(StatisticsFactor.class);
        partial.put(StatisticsFactor.SAFETY, 0.9);

        Statistics statistics = Statistics.withNeutralDefaults(partial);

        assertThat(statistics.get(StatisticsFactor.SAFETY)).isEqualTo(0.9);
        assertThat(statistics.get(StatisticsFactor.CONSTRAINTS)).isEqualTo(Statistics.NEUTRAL_VALUE);
    }

    @Test
    void testJson_UsesHyphenatedKeys() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();

        String json = objectMapper.writeValueAsString(Statistics.neutral());
        Statistics parsed = objectMapper.readValue(json, Statistics.class);

        assertThat(json).contains("\"ignition-procedures-and-methods\":0.5");
        assertThat(parsed).isEqualTo(Statistics.neutral());
    }
}
