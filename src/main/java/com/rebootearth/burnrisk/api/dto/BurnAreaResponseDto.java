package com.rebootearth.burnrisk.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.rebootearth.burnrisk.domain.model.NearbyTown;
import com.rebootearth.burnrisk.domain.model.QuantizedLocation;
import com.rebootearth.burnrisk.domain.model.WeatherSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Burn area as served over HTTP. Score fields are on the requested presentation scale.
 * Resolution details are only present on single-location responses.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "name", "coordinates", "statistics", "threat-rating", "calculated-threat-rating",
    "preliminary-feasibility-score", "threat-level", "total-population", "total-value-estimate",
    "last-burn-date", "weather", "nearby-towns", "degraded", "degraded-sources", "source"})
public class BurnAreaResponseDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("coordinates")
    private QuantizedLocation coordinates;

    @JsonProperty("statistics")
    private Map<String, Double> statistics;

    @JsonProperty("threat-rating")
    private Double threatRating;

    @JsonProperty("calculated-threat-rating")
    private Double calculatedThreatRating;

    @JsonProperty("preliminary-feasibility-score")
    private Double preliminaryFeasibilityScore;

    /** 1 (lowest) to 5 (highest), derived from the calculated threat rating. */
    @JsonProperty("threat-level")
    private Integer threatLevel;

    @JsonProperty("total-population")
    private Integer totalPopulation;

    @JsonProperty("total-value-estimate")
    private Double totalValueEstimate;

    @JsonProperty("last-burn-date")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate lastBurnDate;

    @JsonProperty("weather")
    private WeatherSnapshot weather;

    @JsonProperty("nearby-towns")
    private List<NearbyTown> nearbyTowns;

    @JsonProperty("degraded")
    private Boolean degraded;

    @JsonProperty("degraded-sources")
    private List<String> degradedSources;

    @JsonProperty("source")
    private String source;
}
