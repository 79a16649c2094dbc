package com.rebootearth.burnrisk.domain.service;

import com.rebootearth.burnrisk.domain.model.CompositeScore;
import com.rebootearth.burnrisk.domain.model.DailyWeather;
import com.rebootearth.burnrisk.domain.model.ScoringPolicy;
import com.rebootearth.burnrisk.domain.model.Statistics;
import com.rebootearth.burnrisk.domain.model.StatisticsFactor;
import com.rebootearth.burnrisk.domain.model.WeatherSnapshot;

/**
 * Pure scoring function combining the gathered inputs into a threat rating and a
 * feasibility score.
 *
 * <p>Threat rating = clamp01(risk·p + statistics·mean(factors) + weather·severity + exposure·exposure).
 * All weights are non-negative, so the rating never decreases when the risk probability
 * or any statistics factor increases.
 *
 * <p>Feasibility = 1 − weighted mean of the logistics factors (management organizations,
 * project logistics, constraints). It does not depend on the threat rating.
 *
 * <p>Inputs must already be on the [0,1] scale; see
 * {@link com.rebootearth.burnrisk.domain.model.ScoreScale}.
 */
public class CompositeScoreCalculator {

    static final double NEUTRAL_WEATHER_SEVERITY = 0.5;

    private static final double TEMPERATURE_FLOOR_F = 50.0;
    private static final double TEMPERATURE_SPAN_F = 50.0;
    private static final double WIND_SATURATION_KMH = 40.0;
    private static final double PRECIPITATION_SATURATION_MM = 10.0;

    private final ScoringPolicy policy;

    public CompositeScoreCalculator(ScoringPolicy policy) {
        this.policy = policy;
    }

    public CompositeScore compute(Statistics statistics, WeatherSnapshot weather, double riskProbability,
                                  int population, double valueEstimate) {
        requireUnit("riskProbability", riskProbability);
        if (population < 0 || valueEstimate < 0 || Double.isNaN(valueEstimate)) {
            throw new IllegalArgumentException("Population and value estimate must be non-negative");
        }

        double rating = policy.getRiskWeight() * riskProbability
                + policy.getStatisticsWeight() * statistics.mean()
                + policy.getWeatherWeight() * weatherSeverity(weather)
                + policy.getExposureWeight() * exposure(population, valueEstimate);

        return new CompositeScore(clamp01(rating), feasibility(statistics));
    }

    double feasibility(Statistics statistics) {
        double weightSum = policy.getManagementOrganizationsWeight()
                + policy.getProjectLogisticsWeight()
                + policy.getConstraintsWeight();
        double difficulty = (policy.getManagementOrganizationsWeight() * statistics.get(StatisticsFactor.MANAGEMENT_ORGANIZATIONS)
                + policy.getProjectLogisticsWeight() * statistics.get(StatisticsFactor.PROJECT_LOGISTICS)
                + policy.getConstraintsWeight() * statistics.get(StatisticsFactor.CONSTRAINTS)) / weightSum;
        return clamp01(1.0 - difficulty);
    }

    /**
     * Mean over days of hot, windy and dry conditions; neutral when no reading exists.
     */
    double weatherSeverity(WeatherSnapshot weather) {
        if (weather == null || !weather.isAvailable()) {
            return NEUTRAL_WEATHER_SEVERITY;
        }
        double total = 0.0;
        int days = 0;
        for (DailyWeather daily : weather.getDays().values()) {
            double sum = 0.0;
            int components = 0;
            if (daily.getTemperatureMean() != null) {
                sum += clamp01((daily.getTemperatureMean() - TEMPERATURE_FLOOR_F) / TEMPERATURE_SPAN_F);
                components++;
            }
            if (daily.getWindSpeedMean() != null) {
                sum += clamp01(daily.getWindSpeedMean() / WIND_SATURATION_KMH);
                components++;
            }
            if (daily.getPrecipitationSum() != null) {
                sum += 1.0 - clamp01(daily.getPrecipitationSum() / PRECIPITATION_SATURATION_MM);
                components++;
            }
            if (components > 0) {
                total += sum / components;
                days++;
            }
        }
        return days == 0 ? NEUTRAL_WEATHER_SEVERITY : total / days;
    }

    double exposure(int population, double valueEstimate) {
        double populationExposure = clamp01(Math.log10(1.0 + population) / Math.log10(1.0 + policy.getPopulationSaturation()));
        double valueExposure = clamp01(Math.log10(1.0 + valueEstimate) / Math.log10(1.0 + policy.getValueSaturation()));
        return (populationExposure + valueExposure) / 2.0;
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0,1] but was " + value);
        }
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
