package com.rebootearth.burnrisk.application.port.out;

import com.rebootearth.burnrisk.domain.model.DateRange;
import com.rebootearth.burnrisk.domain.model.WeatherSnapshot;

import java.math.BigDecimal;

/**
 * Output port for daily weather aggregates.
 */
public interface WeatherAdapter {

  /**
   * @return available snapshot covering the range
   * @throws com.rebootearth.burnrisk.application.exception.UpstreamException on any failure
   */
  WeatherSnapshot fetchWeather(BigDecimal lat, BigDecimal lng, DateRange dateRange);
}
