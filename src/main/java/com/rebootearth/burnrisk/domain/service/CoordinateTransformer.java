package com.rebootearth.burnrisk.domain.service;

import com.rebootearth.burnrisk.domain.model.LocationQuery;
import com.rebootearth.burnrisk.domain.model.QuantizedLocation;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Domain service for snapping requested coordinates onto the cache grid.
 *
 * Transformation Rule: round HALF_UP to {@code app.cache.grid-decimal-places}
 * (default 2, roughly 1.1 km of latitude).
 *
 * The resolution bounds the spatial precision of every cached burn area: all
 * queries inside one grid cell are answered by the same record.
 */
@Service
public class CoordinateTransformer {

    private final int decimalPlaces;

    public CoordinateTransformer(@Value("${app.cache.grid-decimal-places:2}") int decimalPlaces) {
        if (decimalPlaces < 0 || decimalPlaces > 6) {
            throw new IllegalArgumentException("Grid decimal places must be between 0 and 6");
        }
        this.decimalPlaces = decimalPlaces;
    }

    /**
     * @param query requested coordinates
     * @return coordinates rounded to the grid resolution
     */
    public QuantizedLocation quantize(LocationQuery query) {
        BigDecimal lat = query.getLat().setScale(decimalPlaces, RoundingMode.HALF_UP);
        BigDecimal lng = query.getLng().setScale(decimalPlaces, RoundingMode.HALF_UP);
        return new QuantizedLocation(lat, lng);
    }

    public QuantizedLocation quantize(BigDecimal lat, BigDecimal lng) {
        return quantize(new LocationQuery(lat, lng));
    }

    public int getDecimalPlaces() {
        return decimalPlaces;
    }
}
