package com.rebootearth.burnrisk.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Coordinates snapped to the cache grid. Nearby queries that round to the same
 * grid point share one cache entry and one {@link BurnArea}.
 */
@Getter
@EqualsAndHashCode
@ToString
public class QuantizedLocation {

    @JsonProperty("lat")
    private final BigDecimal lat;

    @JsonProperty("lng")
    private final BigDecimal lng;

    @JsonCreator
    public QuantizedLocation(@JsonProperty("lat") BigDecimal lat, @JsonProperty("lng") BigDecimal lng) {
        if (lat == null || lng == null) {
            throw new IllegalArgumentException("Quantized latitude and longitude must not be null");
        }
        this.lat = lat;
        this.lng = lng;
    }

    /**
     * Cache key in the form {@code lat:lng}, e.g. {@code 34.05:-118.24}.
     */
    @JsonIgnore
    public String asKey() {
        return lat.toPlainString() + ":" + lng.toPlainString();
    }

    /**
     * Identifier that stays the same across recomputations of this grid cell.
     */
    @JsonIgnore
    public String stableId() {
        return UUID.nameUUIDFromBytes(asKey().getBytes(StandardCharsets.UTF_8)).toString();
    }
}
