package com.rebootearth.burnrisk.application.port.in;

import com.rebootearth.burnrisk.domain.model.BurnArea;

import java.util.List;

/**
 * Input port for reading the precomputed collection. Never triggers computation.
 */
public interface QueryBurnAreasUseCase {

  List<BurnArea> listBurnAreas();
}
