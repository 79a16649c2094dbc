package com.rebootearth.burnrisk.application.port.out;

import java.math.BigDecimal;

/**
 * Output port for reverse geocoding.
 */
public interface GeocodingAdapter {

  /**
   * @return human-readable place name for the coordinates
   * @throws com.rebootearth.burnrisk.application.exception.UpstreamException on any failure
   */
  String reverseGeocode(BigDecimal lat, BigDecimal lng);
}
