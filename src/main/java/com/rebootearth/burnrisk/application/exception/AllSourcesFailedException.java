package com.rebootearth.burnrisk.application.exception;

/**
 * Every upstream source failed and nothing is cached for the key.
 */
public class AllSourcesFailedException extends RuntimeException {

    private final String cacheKey;

    public AllSourcesFailedException(String cacheKey) {
        super("All upstream sources failed for location " + cacheKey + " and no cached value exists");
        this.cacheKey = cacheKey;
    }

    public String getCacheKey() {
        return cacheKey;
    }
}
