package com.rebootearth.burnrisk.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Value object representing a requested geographic point.
 */
@Getter
@EqualsAndHashCode
@ToString
public class LocationQuery {

    private static final BigDecimal MAX_LAT = new BigDecimal("90");
    private static final BigDecimal MAX_LNG = new BigDecimal("180");

    private final BigDecimal lat;
    private final BigDecimal lng;

    public LocationQuery(BigDecimal lat, BigDecimal lng) {
        if (lat == null || lng == null) {
            throw new IllegalArgumentException("Latitude and longitude must not be null");
        }
        if (lat.compareTo(MAX_LAT.negate()) < 0 || lat.compareTo(MAX_LAT) > 0) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90");
        }
        if (lng.compareTo(MAX_LNG.negate()) < 0 || lng.compareTo(MAX_LNG) > 0) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180");
        }
        this.lat = lat;
        this.lng = lng;
    }

    public static LocationQuery of(double lat, double lng) {
        return new LocationQuery(BigDecimal.valueOf(lat), BigDecimal.valueOf(lng));
    }
}
