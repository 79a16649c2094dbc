package com.rebootearth.burnrisk.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * External data sources a burn area is assembled from. The id is the name reported
 * in {@code degraded-sources}.
 */
public enum UpstreamSource {
    GEOCODING("geocoding"),
    WEATHER("weather"),
    NEARBY_TOWNS("nearby-towns"),
    STATISTICS("statistics"),
    RISK_ORACLE("risk-oracle");

    private final String id;

    UpstreamSource(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }
}
