package com.rebootearth.burnrisk.application.service;

/**
 * Names of the in-process caches holding derived lookups.
 */
public final class CacheNames {

    /** FCC county lookups per quantized location. */
    public static final String COUNTIES = "counties";

    /** The sorted collection served by GET /v0. */
    public static final String BURN_AREAS = "burnAreas";

    private CacheNames() {
    }
}
