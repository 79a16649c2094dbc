package com.rebootearth.burnrisk.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Tunable weights for the composite threat rating and feasibility score.
 *
 * Defaults: risk 0.70, statistics 0.15, weather 0.05, exposure 0.10. Exposure
 * saturates at 100,000 residents and a $10B value estimate. Feasibility
 * weighs management organizations, project logistics and constraints equally.
 */
@Getter
@ToString
public class ScoringPolicy {

    private final double riskWeight;
    private final double statisticsWeight;
    private final double weatherWeight;
    private final double exposureWeight;
    private final int populationSaturation;
    private final double valueSaturation;
    private final double managementOrganizationsWeight;
    private final double projectLogisticsWeight;
    private final double constraintsWeight;

    @Builder
    public ScoringPolicy(double riskWeight, double statisticsWeight, double weatherWeight, double exposureWeight,
                         int populationSaturation, double valueSaturation, double managementOrganizationsWeight,
                         double projectLogisticsWeight, double constraintsWeight) {
        requireNonNegative("riskWeight", riskWeight);
        requireNonNegative("statisticsWeight", statisticsWeight);
        requireNonNegative("weatherWeight", weatherWeight);
        requireNonNegative("exposureWeight", exposureWeight);
        requireNonNegative("managementOrganizationsWeight", managementOrganizationsWeight);
        requireNonNegative("projectLogisticsWeight", projectLogisticsWeight);
        requireNonNegative("constraintsWeight", constraintsWeight);
        if (managementOrganizationsWeight + projectLogisticsWeight + constraintsWeight <= 0.0) {
            throw new IllegalArgumentException("At least one feasibility weight must be positive");
        }
        if (populationSaturation < 1) {
            throw new IllegalArgumentException("populationSaturation must be at least 1");
        }
        if (Double.isNaN(valueSaturation) || valueSaturation < 1.0) {
            throw new IllegalArgumentException("valueSaturation must be at least 1");
        }
        this.riskWeight = riskWeight;
        this.statisticsWeight = statisticsWeight;
        this.weatherWeight = weatherWeight;
        this.exposureWeight = exposureWeight;
        this.populationSaturation = populationSaturation;
        this.valueSaturation = valueSaturation;
        this.managementOrganizationsWeight = managementOrganizationsWeight;
        this.projectLogisticsWeight = projectLogisticsWeight;
        this.constraintsWeight = constraintsWeight;
    }

    public static ScoringPolicy defaults() {
        return new ScoringPolicy(0.70, 0.15, 0.05, 0.10, 100_000, 1.0e10, 1.0, 1.0, 1.0);
    }

    private static void requireNonNegative(String name, double value) {
        if (Double.isNaN(value) || value < 0.0) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }
}
