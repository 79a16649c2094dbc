package com.rebootearth.burnrisk.domain.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * The eleven qualitative dimensions of a prescribed fire complexity assessment.
 * Higher values mean higher risk or difficulty.
 */
@Getter
public enum StatisticsFactor {
    SAFETY("safety"),
    FIRE_BEHAVIOR("fire-behavior"),
    RESISTANCE_TO_CONTAINMENT("resistance-to-containment"),
    IGNITION_PROCEDURES_AND_METHODS("ignition-procedures-and-methods"),
    PRESCRIBED_FIRE_DURATION("prescribed-fire-duration"),
    SMOKE_MANAGEMENT("smoke-management"),
    NUMBER_AND_DEPENDENCE_OF_ACTIVITIES("number-and-dependence-of-activities"),
    MANAGEMENT_ORGANIZATIONS("management-organizations"),
    TREATMENT_RESOURCE_OBJECTIVES("treatment-resource-objectives"),
    CONSTRAINTS("constraints"),
    PROJECT_LOGISTICS("project-logistics");

    private final String key;

    StatisticsFactor(String key) {
        this.key = key;
    }

    public static Optional<StatisticsFactor> fromKey(String key) {
        return Arrays.stream(values())
                .filter(factor -> factor.key.equals(key))
                .findFirst();
    }
}
