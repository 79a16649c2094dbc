package com.rebootearth.burnrisk.application.service;

import com.rebootearth.burnrisk.application.port.in.QueryBurnAreasUseCase;
import com.rebootearth.burnrisk.application.port.out.CacheStore;
import com.rebootearth.burnrisk.domain.model.BurnArea;
import com.rebootearth.burnrisk.domain.model.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Application service for reading the precomputed collection.
 * Serves whatever the store holds, expired entries included; never triggers computation.
 */
@Service
public class BurnAreaQueryService implements QueryBurnAreasUseCase {

    private static final Logger logger = LoggerFactory.getLogger(BurnAreaQueryService.class);

    private final CacheStore cacheStore;

    public BurnAreaQueryService(CacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    /**
     * Keyed by the store version read before loading, so a list loaded while a write
     * lands is never cached under the post-write version.
     *
     * @return all stored burn areas, highest calculated threat first
     */
    @Override
    @Cacheable(cacheNames = CacheNames.BURN_AREAS, key = "#root.target.storeVersion()")
    public List<BurnArea> listBurnAreas() {
        List<BurnArea> burnAreas = cacheStore.all().stream()
                .map(CacheEntry::getPayload)
                .sorted(Comparator.comparingDouble(BurnArea::getCalculatedThreatRating).reversed()
                        .thenComparing(BurnArea::getId))
                .toList();
        logger.debug("Listing {} burn areas", burnAreas.size());
        return burnAreas;
    }

    public long storeVersion() {
        return cacheStore.version();
    }
}
