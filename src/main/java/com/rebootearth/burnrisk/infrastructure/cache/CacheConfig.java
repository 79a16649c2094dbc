package com.rebootearth.burnrisk.infrastructure.cache;

import com.rebootearth.burnrisk.application.service.CacheNames;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-process cache configuration.
 *
 * Burn areas themselves live in the durable {@link JsonFileCacheStore}; the caches here
 * hold the derived lookups named in {@link CacheNames}.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    @Bean
    public CacheManager cacheManager() {
        // Null values stay allowed: a location outside any county is cached as absent
        return new ConcurrentMapCacheManager(CacheNames.COUNTIES, CacheNames.BURN_AREAS);
    }
}
