package com.rebootearth.burnrisk.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * A town or city near a burn area, with its share of the county's economic output.
 */
@Getter
@EqualsAndHashCode
@ToString
public class NearbyTown {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("lat")
    private final BigDecimal lat;

    @JsonProperty("lng")
    private final BigDecimal lng;

    @JsonProperty("population")
    private final int population;

    @JsonProperty("value-estimate")
    private final double valueEstimate;

    @JsonCreator
    public NearbyTown(
            @JsonProperty("name") String name,
            @JsonProperty("lat") BigDecimal lat,
            @JsonProperty("lng") BigDecimal lng,
            @JsonProperty("population") int population,
            @JsonProperty("value-estimate") double valueEstimate) {
        this.name = name;
        this.lat = lat;
        this.lng = lng;
        this.population = population;
        this.valueEstimate = valueEstimate;
    }
}
