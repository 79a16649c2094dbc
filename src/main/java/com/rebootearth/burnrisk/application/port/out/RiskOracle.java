package com.rebootearth.burnrisk.application.port.out;

import java.math.BigDecimal;

/**
 * Output port for the externally trained fire probability classifier.
 */
public interface RiskOracle {

  /**
   * @return calibrated fire probability, already normalized to [0,1]
   * @throws com.rebootearth.burnrisk.application.exception.UpstreamException on any failure
   */
  double probability(BigDecimal lat, BigDecimal lng);
}
