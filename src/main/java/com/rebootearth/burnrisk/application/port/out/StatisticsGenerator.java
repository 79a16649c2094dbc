package com.rebootearth.burnrisk.application.port.out;

import com.rebootearth.burnrisk.domain.model.StatisticsResult;

import java.math.BigDecimal;

/**
 * Output port for the generative fire-management statistics source.
 *
 * Output is advisory: two calls for the same input may differ. Schema failures are
 * reported as a fallback result, transport failures as an exception.
 */
public interface StatisticsGenerator {

  /**
   * @param placeName resolved place name, or null when geocoding failed
   * @throws com.rebootearth.burnrisk.application.exception.UpstreamException if the backend is unreachable
   */
  StatisticsResult generateStatistics(BigDecimal lat, BigDecimal lng, String placeName);
}
