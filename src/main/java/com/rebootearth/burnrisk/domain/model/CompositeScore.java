package com.rebootearth.burnrisk.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class CompositeScore {
    private final double calculatedThreatRating;
    private final double preliminaryFeasibilityScore;
}
