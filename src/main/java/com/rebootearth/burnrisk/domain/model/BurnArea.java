package com.rebootearth.burnrisk.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.List;

/**
 * Composite threat assessment for one grid cell. This is the unit that is cached,
 * persisted and served. Every score is on the canonical [0,1] scale.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"id", "name", "coordinates", "statistics", "threat-rating", "calculated-threat-rating",
        "preliminary-feasibility-score", "total-population", "total-value-estimate", "last-burn-date",
        "weather", "nearby-towns"})
public class BurnArea {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("coordinates")
    private final QuantizedLocation coordinates;

    @JsonProperty("statistics")
    private final Statistics statistics;

    /** Risk oracle probability, normalized. */
    @JsonProperty("threat-rating")
    private final double threatRating;

    @JsonProperty("calculated-threat-rating")
    private final double calculatedThreatRating;

    @JsonProperty("preliminary-feasibility-score")
    private final double preliminaryFeasibilityScore;

    @JsonProperty("total-population")
    private final int totalPopulation;

    @JsonProperty("total-value-estimate")
    private final double totalValueEstimate;

    /** Null when no burn history is known for the area. */
    @JsonProperty("last-burn-date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private final LocalDate lastBurnDate;

    @JsonProperty("weather")
    private final WeatherSnapshot weather;

    @JsonProperty("nearby-towns")
    private final List<NearbyTown> nearbyTowns;

    @Builder(toBuilder = true)
    @JsonCreator
    public BurnArea(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("coordinates") QuantizedLocation coordinates,
            @JsonProperty("statistics") Statistics statistics,
            @JsonProperty("threat-rating") double threatRating,
            @JsonProperty("calculated-threat-rating") double calculatedThreatRating,
            @JsonProperty("preliminary-feasibility-score") double preliminaryFeasibilityScore,
            @JsonProperty("total-population") int totalPopulation,
            @JsonProperty("total-value-estimate") double totalValueEstimate,
            @JsonProperty("last-burn-date") LocalDate lastBurnDate,
            @JsonProperty("weather") WeatherSnapshot weather,
            @JsonProperty("nearby-towns") List<NearbyTown> nearbyTowns) {
        if (id == null || name == null || coordinates == null || statistics == null) {
            throw new IllegalArgumentException("Burn area id, name, coordinates and statistics are required");
        }
        requireUnit("threat-rating", threatRating);
        requireUnit("calculated-threat-rating", calculatedThreatRating);
        requireUnit("preliminary-feasibility-score", preliminaryFeasibilityScore);
        this.id = id;
        this.name = name;
        this.coordinates = coordinates;
        this.statistics = statistics;
        this.threatRating = threatRating;
        this.calculatedThreatRating = calculatedThreatRating;
        this.preliminaryFeasibilityScore = preliminaryFeasibilityScore;
        this.totalPopulation = totalPopulation;
        this.totalValueEstimate = totalValueEstimate;
        this.lastBurnDate = lastBurnDate;
        this.weather = weather == null ? WeatherSnapshot.unavailable() : weather;
        this.nearbyTowns = nearbyTowns == null ? List.of() : List.copyOf(nearbyTowns);
    }

    private static void requireUnit(String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(field + " must be within [0,1] but was " + value);
        }
    }
}
