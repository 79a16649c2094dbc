package com.rebootearth.burnrisk.application.port.out;

import com.rebootearth.burnrisk.domain.model.NearbyTown;

import java.math.BigDecimal;
import java.util.List;

/**
 * Output port for towns and cities around a location, with population and value estimate.
 */
public interface NearbyTownsAdapter {

  /**
   * @return towns ordered by descending population, possibly empty
   * @throws com.rebootearth.burnrisk.application.exception.UpstreamException on any failure
   */
  List<NearbyTown> findNearbyTowns(BigDecimal lat, BigDecimal lng);
}
