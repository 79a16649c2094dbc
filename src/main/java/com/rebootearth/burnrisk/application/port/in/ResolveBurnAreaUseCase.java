package com.rebootearth.burnrisk.application.port.in;

import com.rebootearth.burnrisk.domain.model.BurnArea;
import com.rebootearth.burnrisk.domain.model.LocationQuery;
import com.rebootearth.burnrisk.domain.model.Resolution;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Input port for resolving a single location into a burn area.
 */
public interface ResolveBurnAreaUseCase {

  /**
   * Resolve a location.
   * Strategy: Cache-first → single-flight computation → write-through cache
   *
   * @param query requested coordinates
   * @return burn area with degradation details and how it was obtained
   * @throws com.rebootearth.burnrisk.application.exception.AllSourcesFailedException
   *         if every source failed and nothing is cached for the grid cell
   */
  Resolution resolve(LocationQuery query);

  /**
   * Drop the cached burn area for the grid cell containing the query.
   *
   * @return true if an entry was removed
   */
  boolean invalidate(LocationQuery query);

  /**
   * Attach a known burn date to the cached burn area for the grid cell. The date is kept
   * across later recomputations of the cell.
   *
   * @return the updated burn area, or empty if nothing is cached for the cell
   */
  Optional<BurnArea> recordLastBurnDate(LocationQuery query, LocalDate lastBurnDate);
}
