package com.rebootearth.burnrisk.infrastructure.persistence;

import com.rebootearth.burnrisk.application.port.in.ResolveBurnAreaUseCase;
import com.rebootearth.burnrisk.domain.model.LocationQuery;
import com.rebootearth.burnrisk.domain.model.Resolution;
import com.rebootearth.burnrisk.infrastructure.config.BurnRiskProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Bulk precomputation of the configured seed locations at startup.
 * Runs when app.precompute.enabled=true so that GET /v0 has content before the first
 * single-location request. Locations already fresh in the cache are served from it.
 */
@Configuration
public class BulkPrecomputeRunner {

    private static final Logger logger = LoggerFactory.getLogger(BulkPrecomputeRunner.class);

    @Bean
    @ConditionalOnProperty(name = "app.precompute.enabled", havingValue = "true", matchIfMissing = false)
    public CommandLineRunner precomputeBurnAreas(
        ResolveBurnAreaUseCase resolveBurnAreaUseCase,
        BurnRiskProperties properties
    ) {
        return args -> {
            List<BurnRiskProperties.Precompute.Location> locations = properties.getPrecompute().getLocations();
            if (locations.isEmpty()) {
                logger.info("No precompute locations configured, skipping...");
                return;
            }

            logger.info("Precomputing {} burn areas...", locations.size());
            int computed = 0;
            int failed = 0;
            for (BurnRiskProperties.Precompute.Location location : locations) {
                LocationQuery query = new LocationQuery(location.getLat(), location.getLng());
                try {
                    Resolution resolution = resolveBurnAreaUseCase.resolve(query);
                    if (location.getLastBurnDate() != null) {
                        resolveBurnAreaUseCase.recordLastBurnDate(query, location.getLastBurnDate());
                    }
                    computed++;
                    logger.info("Precomputed {} ({}): source={}, degraded={}",
                        resolution.getBurnArea().getName(), resolution.getBurnArea().getCoordinates(),
                        resolution.getSource().id(), resolution.getDegradedSources());
                } catch (RuntimeException e) {
                    // One unreachable location must not stop the batch
                    failed++;
                    logger.error("Failed to precompute burn area at {}, {}: {}",
                        location.getLat(), location.getLng(), e.getMessage());
                }
            }

            logger.info("Precompute complete: {} resolved, {} failed", computed, failed);
        };
    }
}
