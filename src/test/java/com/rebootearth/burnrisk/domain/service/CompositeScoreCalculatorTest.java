package com.rebootearth.burnrisk.domain.service;

import com.rebootearth.burnrisk.domain.model.CompositeScore;
import com.rebootearth.burnrisk.domain.model.ScoringPolicy;
import com.rebootearth.burnrisk.domain.model.Statistics;
import com.rebootearth.burnrisk.domain.model.StatisticsFactor;
import com.rebootearth.burnrisk.domain.model.WeatherSnapshot;
import com.rebootearth.burnrisk.module.test.support.TestFixtures;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CompositeScoreCalculatorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 7, 1);

    private final CompositeScoreCalculator calculator = new CompositeScoreCalculator(ScoringPolicy.defaults());

    @Test
    void testCompute_HighRiskHotDryPopulated_RatesHigh() {
        CompositeScore score = calculator.compute(TestFixtures.uniformStatistics(0.7),
                TestFixtures.hotDryWeather(DAY), 0.82, 10_000, 3.78e8);

        assertThat(score.getCalculatedThreatRating()).isGreaterThanOrEqualTo(0.7);
        assertThat(score.getCalculatedThreatRating()).isLessThanOrEqualTo(1.0);
    }

    @Test
    void testCompute_NonDecreasingInRiskProbability() {
        Statistics statistics = TestFixtures.uniformStatistics(0.4);
        WeatherSnapshot weather = TestFixtures.coolWetWeather(DAY);

        double previous = -1.0;
        for (int i = 0; i <= 10; i++) {
            double rating = calculator.compute(statistics, weather, i / 10.0, 500, 1.0e6).getCalculatedThreatRating();
            assertThat(rating).isGreaterThanOrEqualTo(previous);
            previous = rating;
        }
    }

    @Test
    void testCompute_NonDecreasingInEachFactor() {
        for (StatisticsFactor factor : StatisticsFactor.values()) {
            Map<StatisticsFactor, Double> low = new EnumMap<>(TestFixtures.uniformStatistics(0.3).asMap());
            Map<StatisticsFactor, Double> high = new EnumMap<>(low);
            high.put(factor, 0.9);

            double lowRating = calculator.compute(Statistics.of(low), WeatherSnapshot.unavailable(), 0.5, 0, 0)
                    .getCalculatedThreatRating();
            double highRating = calculator.compute(Statistics.of(high), WeatherSnapshot.unavailable(), 0.5, 0, 0)
                    .getCalculatedThreatRating();

            assertThat(highRating).as(factor.getKey()).isGreaterThanOrEqualTo(lowRating);
        }
    }

    @Test
    void testCompute_ExtremesStayWithinUnitInterval() {
        CompositeScore max = calculator.compute(TestFixtures.uniformStatistics(1.0),
                TestFixtures.hotDryWeather(DAY), 1.0, Integer.MAX_VALUE, Double.MAX_VALUE);
        CompositeScore min = calculator.compute(TestFixtures.uniformStatistics(0.0),
                TestFixtures.coolWetWeather(DAY), 0.0, 0, 0);

        assertThat(max.getCalculatedThreatRating()).isBetween(0.0, 1.0);
        assertThat(max.getPreliminaryFeasibilityScore()).isBetween(0.0, 1.0);
        assertThat(min.getCalculatedThreatRating()).isBetween(0.0, 1.0);
        assertThat(min.getPreliminaryFeasibilityScore()).isBetween(0.0, 1.0);
    }

    @Test
    void testCompute_FeasibilityIgnoresThreatInputs() {
        Statistics statistics = TestFixtures.uniformStatistics(0.6);

        CompositeScore calm = calculator.compute(statistics, TestFixtures.coolWetWeather(DAY), 0.05, 0, 0);
        CompositeScore severe = calculator.compute(statistics, TestFixtures.hotDryWeather(DAY), 0.95, 50_000, 1.0e9);

        assertThat(calm.getPreliminaryFeasibilityScore()).isEqualTo(severe.getPreliminaryFeasibilityScore());
        assertThat(calm.getPreliminaryFeasibilityScore()).isCloseTo(0.4, within(1e-9));
    }

    @Test
    void testCompute_HarderLogisticsLowerFeasibility() {
        Map<StatisticsFactor, Double> easy = new EnumMap<>(TestFixtures.uniformStatistics(0.5).asMap());
        Map<StatisticsFactor, Double> hard = new EnumMap<>(easy);
        hard.put(StatisticsFactor.PROJECT_LOGISTICS, 0.95);

        double easyScore = calculator.feasibility(Statistics.of(easy));
        double hardScore = calculator.feasibility(Statistics.of(hard));

        assertThat(hardScore).isLessThan(easyScore);
    }

    @Test
    void testWeatherSeverity_UnavailableIsNeutral() {
        assertThat(calculator.weatherSeverity(WeatherSnapshot.unavailable()))
                .isEqualTo(CompositeScoreCalculator.NEUTRAL_WEATHER_SEVERITY);
    }

    @Test
    void testWeatherSeverity_HotDryExceedsCoolWet() {
        assertThat(calculator.weatherSeverity(TestFixtures.hotDryWeather(DAY)))
                .isGreaterThan(calculator.weatherSeverity(TestFixtures.coolWetWeather(DAY)));
    }

    @Test
    void testExposure_ZeroWhenNothingNearby() {
        assertThat(calculator.exposure(0, 0.0)).isEqualTo(0.0);
        assertThat(calculator.exposure(100_000, 1.0e10)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void testCompute_RejectsProbabilityOutsideUnitInterval() {
        Statistics statistics = Statistics.neutral();

        assertThatThrownBy(() -> calculator.compute(statistics, WeatherSnapshot.unavailable(), 1.2, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> calculator.compute(statistics, WeatherSnapshot.unavailable(), -0.1, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
