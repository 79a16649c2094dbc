package com.rebootearth.burnrisk.application.service;

import com.rebootearth.burnrisk.application.exception.AllSourcesFailedException;
import com.rebootearth.burnrisk.application.exception.ResolutionTimeoutException;
import com.rebootearth.burnrisk.application.port.in.ResolveBurnAreaUseCase;
import com.rebootearth.burnrisk.application.port.out.CacheStore;
import com.rebootearth.burnrisk.application.port.out.GeocodingAdapter;
import com.rebootearth.burnrisk.application.port.out.NearbyTownsAdapter;
import com.rebootearth.burnrisk.application.port.out.RiskOracle;
import com.rebootearth.burnrisk.application.port.out.StatisticsGenerator;
import com.rebootearth.burnrisk.application.port.out.WeatherAdapter;
import com.rebootearth.burnrisk.domain.model.BurnArea;
import com.rebootearth.burnrisk.domain.model.CacheEntry;
import com.rebootearth.burnrisk.domain.model.CompositeScore;
import com.rebootearth.burnrisk.domain.model.DateRange;
import com.rebootearth.burnrisk.domain.model.LocationQuery;
import com.rebootearth.burnrisk.domain.model.NearbyTown;
import com.rebootearth.burnrisk.domain.model.QuantizedLocation;
import com.rebootearth.burnrisk.domain.model.Resolution;
import com.rebootearth.burnrisk.domain.model.Statistics;
import com.rebootearth.burnrisk.domain.model.StatisticsResult;
import com.rebootearth.burnrisk.domain.model.UpstreamSource;
import com.rebootearth.burnrisk.domain.model.WeatherSnapshot;
import com.rebootearth.burnrisk.domain.service.CompositeScoreCalculator;
import com.rebootearth.burnrisk.domain.service.CoordinateTransformer;
import com.rebootearth.burnrisk.infrastructure.config.BurnRiskProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Application service resolving a location into a burn area.
 *
 * Strategy: Cache-first → single-flight computation → write-through cache
 *
 * A computation fans out to all five sources concurrently, each under its own timeout.
 * A failed source never fails the request: its output is replaced by a neutral default
 * and the source is reported as degraded. Only when every source fails does the request
 * fail, and even then an expired entry is served if one exists.
 */
@Service
public class BurnAreaOrchestrator implements ResolveBurnAreaUseCase {

    private static final Logger logger = LoggerFactory.getLogger(BurnAreaOrchestrator.class);

    static final String UNKNOWN_LOCATION = "Unknown location";
    static final double NEUTRAL_RISK_PROBABILITY = 0.5;

    private final CoordinateTransformer coordinateTransformer;
    private final CacheStore cacheStore;
    private final GeocodingAdapter geocodingAdapter;
    private final WeatherAdapter weatherAdapter;
    private final NearbyTownsAdapter nearbyTownsAdapter;
    private final StatisticsGenerator statisticsGenerator;
    private final RiskOracle riskOracle;
    private final CompositeScoreCalculator scoreCalculator;
    private final CacheManager cacheManager;
    private final Executor upstreamExecutor;
    private final BurnRiskProperties properties;
    private final Clock clock;
    private final SingleFlight<String, Resolution> singleFlight = new SingleFlight<>();

    public BurnAreaOrchestrator(
            CoordinateTransformer coordinateTransformer,
            CacheStore cacheStore,
            GeocodingAdapter geocodingAdapter,
            WeatherAdapter weatherAdapter,
            NearbyTownsAdapter nearbyTownsAdapter,
            StatisticsGenerator statisticsGenerator,
            RiskOracle riskOracle,
            CompositeScoreCalculator scoreCalculator,
            CacheManager cacheManager,
            @Qualifier("upstreamExecutor") Executor upstreamExecutor,
            BurnRiskProperties properties,
            Clock clock) {
        this.coordinateTransformer = coordinateTransformer;
        this.cacheStore = cacheStore;
        this.geocodingAdapter = geocodingAdapter;
        this.weatherAdapter = weatherAdapter;
        this.nearbyTownsAdapter = nearbyTownsAdapter;
        this.statisticsGenerator = statisticsGenerator;
        this.riskOracle = riskOracle;
        this.scoreCalculator = scoreCalculator;
        this.cacheManager = cacheManager;
        this.upstreamExecutor = upstreamExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Resolution resolve(LocationQuery query) {
        // Step 1: Quantize coordinates onto the cache grid
        QuantizedLocation location = coordinateTransformer.quantize(query);
        String cacheKey = location.asKey();

        // Step 2: Serve a fresh cache entry without touching any upstream
        Optional<Resolution> cached = fromFreshCache(cacheKey);
        if (cached.isPresent()) {
            logger.debug("Cache hit for key: {}", cacheKey);
            return cached.get();
        }
        logger.debug("Cache miss for key: {}", cacheKey);

        // Step 3: Join or lead the computation for this key
        CompletableFuture<Resolution> view = singleFlight.execute(cacheKey, () -> computeAndStore(location));
        return await(view, cacheKey);
    }

    @Override
    public boolean invalidate(LocationQuery query) {
        String cacheKey = coordinateTransformer.quantize(query).asKey();
        boolean removed = cacheStore.invalidate(cacheKey);
        if (removed) {
            evictCollectionView();
        }
        return removed;
    }

    @Override
    public Optional<BurnArea> recordLastBurnDate(LocationQuery query, LocalDate lastBurnDate) {
        String cacheKey = coordinateTransformer.quantize(query).asKey();
        Optional<CacheEntry> existing = cacheStore.get(cacheKey);
        if (existing.isEmpty()) {
            logger.warn("Cannot record burn date {} for {}: nothing cached", lastBurnDate, cacheKey);
            return Optional.empty();
        }
        CacheEntry entry = existing.get();
        BurnArea updated = entry.getPayload().toBuilder().lastBurnDate(lastBurnDate).build();
        // Superseding entry keeps the original computation time and TTL
        cacheStore.put(cacheKey, new CacheEntry(cacheKey, updated, entry.getComputedAt(), entry.getTtl(),
                entry.getDegradedSources()));
        evictCollectionView();
        return Optional.of(updated);
    }

    private Optional<Resolution> fromFreshCache(String cacheKey) {
        return cacheStore.get(cacheKey)
                .filter(entry -> !entry.isExpired(clock.instant()))
                .map(entry -> Resolution.fromCache(entry.getPayload()));
    }

    private Resolution await(CompletableFuture<Resolution> view, String cacheKey) {
        Duration deadline = overallDeadline();
        try {
            return view.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Resolution failed for " + cacheKey, cause);
        } catch (TimeoutException e) {
            view.cancel(false);
            throw new ResolutionTimeoutException("Resolution of " + cacheKey + " exceeded " + deadline, e);
        } catch (InterruptedException e) {
            view.cancel(false);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while resolving " + cacheKey, e);
        }
    }

    /**
     * Runs on the single-flight leader's thread.
     */
    private Resolution computeAndStore(QuantizedLocation location) {
        String cacheKey = location.asKey();

        // Another leader may have finished between our cache check and taking the lead
        Optional<Resolution> cached = fromFreshCache(cacheKey);
        if (cached.isPresent()) {
            logger.debug("Cache populated concurrently for key: {}", cacheKey);
            return cached.get();
        }

        logger.info("Computing burn area for {}", cacheKey);
        Instant started = clock.instant();
        Inputs inputs = gather(location);
        List<UpstreamSource> degraded = inputs.degradedSources();
        Optional<CacheEntry> previous = cacheStore.get(cacheKey);

        if (degraded.size() == UpstreamSource.values().length) {
            if (previous.isPresent()) {
                logger.warn("All sources failed for {}; serving stale entry computed at {}",
                        cacheKey, previous.get().getComputedAt());
                return Resolution.stale(previous.get().getPayload(), degraded);
            }
            logger.error("All sources failed for {} and nothing is cached", cacheKey);
            throw new AllSourcesFailedException(cacheKey);
        }

        LocalDate lastBurnDate = previous.map(entry -> entry.getPayload().getLastBurnDate()).orElse(null);
        BurnArea burnArea = assemble(location, inputs, lastBurnDate);

        Duration ttl = degraded.isEmpty()
                ? properties.getCache().getTtl()
                : properties.getCache().getDegradedTtl();
        store(cacheKey, new CacheEntry(cacheKey, burnArea, clock.instant(), ttl, degraded));

        logger.info("Computed burn area {} for {} in {} ms (threat {}, degraded {})",
                burnArea.getId(), cacheKey, Duration.between(started, clock.instant()).toMillis(),
                burnArea.getCalculatedThreatRating(), degraded);
        return Resolution.computed(burnArea, degraded);
    }

    /**
     * Fan out to every source and wait until each has settled.
     */
    private Inputs gather(QuantizedLocation location) {
        BigDecimal lat = location.getLat();
        BigDecimal lng = location.getLng();
        BurnRiskProperties.Orchestrator config = properties.getOrchestrator();
        DateRange dateRange = DateRange.around(LocalDate.now(clock), config.getWeatherPastDays(),
                config.getWeatherForecastDays());

        CompletableFuture<SourceOutcome<String>> name = call(UpstreamSource.GEOCODING,
                () -> geocodingAdapter.reverseGeocode(lat, lng), properties.getGeocoding().getTimeout());
        CompletableFuture<SourceOutcome<WeatherSnapshot>> weather = call(UpstreamSource.WEATHER,
                () -> weatherAdapter.fetchWeather(lat, lng, dateRange), properties.getWeather().getTimeout());
        CompletableFuture<SourceOutcome<List<NearbyTown>>> towns = call(UpstreamSource.NEARBY_TOWNS,
                () -> nearbyTownsAdapter.findNearbyTowns(lat, lng), properties.getNearbyTowns().getTimeout());
        CompletableFuture<SourceOutcome<Double>> risk = call(UpstreamSource.RISK_ORACLE,
                () -> riskOracle.probability(lat, lng), properties.getRiskOracle().getTimeout());

        // Statistics need the place name; the timeout still counts from the start of the fan-out
        CompletableFuture<StatisticsResult> statisticsCall = name.thenCompose(placeName -> submit(
                () -> statisticsGenerator.generateStatistics(lat, lng, placeName.getValue())));
        CompletableFuture<SourceOutcome<StatisticsResult>> statistics = settle(UpstreamSource.STATISTICS,
                statisticsCall, properties.getStatistics().getTimeout());

        CompletableFuture.allOf(name, weather, towns, risk, statistics).join();
        return new Inputs(name.join(), weather.join(), towns.join(), risk.join(), statistics.join());
    }

    private <T> CompletableFuture<SourceOutcome<T>> call(UpstreamSource source, Supplier<T> supplier,
                                                         Duration timeout) {
        return settle(source, submit(supplier), timeout);
    }

    private <T> CompletableFuture<T> submit(Supplier<T> supplier) {
        try {
            return CompletableFuture.supplyAsync(supplier, upstreamExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> CompletableFuture<SourceOutcome<T>> settle(UpstreamSource source, CompletableFuture<T> call,
                                                           Duration timeout) {
        return call.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((value, error) -> {
                    if (error == null && value != null) {
                        return SourceOutcome.success(value);
                    }
                    if (error == null) {
                        logger.warn("{} returned no value", source.getId());
                        return SourceOutcome.failure();
                    }
                    Throwable cause = unwrap(error);
                    if (cause instanceof TimeoutException) {
                        logger.warn("{} timed out after {}", source.getId(), timeout);
                    } else {
                        logger.warn("{} failed: {}", source.getId(), cause.toString());
                    }
                    return SourceOutcome.failure();
                });
    }

    private BurnArea assemble(QuantizedLocation location, Inputs inputs, LocalDate lastBurnDate) {
        String name = inputs.name.getValueOrDefault(UNKNOWN_LOCATION);
        WeatherSnapshot weather = inputs.weather.getValueOrDefault(WeatherSnapshot.unavailable());
        List<NearbyTown> towns = inputs.towns.getValueOrDefault(Collections.emptyList());
        double riskProbability = inputs.risk.getValueOrDefault(NEUTRAL_RISK_PROBABILITY);
        Statistics statistics = inputs.statistics.isSuccess()
                ? inputs.statistics.getValue().getStatistics()
                : Statistics.neutral();

        long populationSum = towns.stream().mapToLong(NearbyTown::getPopulation).sum();
        int totalPopulation = (int) Math.min(Integer.MAX_VALUE, populationSum);
        double totalValueEstimate = towns.stream().mapToDouble(NearbyTown::getValueEstimate).sum();

        CompositeScore score = scoreCalculator.compute(statistics, weather, riskProbability,
                totalPopulation, totalValueEstimate);

        return BurnArea.builder()
                .id(location.stableId())
                .name(name)
                .coordinates(location)
                .statistics(statistics)
                .threatRating(riskProbability)
                .calculatedThreatRating(score.getCalculatedThreatRating())
                .preliminaryFeasibilityScore(score.getPreliminaryFeasibilityScore())
                .totalPopulation(totalPopulation)
                .totalValueEstimate(totalValueEstimate)
                .lastBurnDate(lastBurnDate)
                .weather(weather)
                .nearbyTowns(towns)
                .build();
    }

    /**
     * Write-through on compute.
     * Gracefully handles store failures: the computed burn area is still returned.
     */
    private void store(String cacheKey, CacheEntry entry) {
        try {
            cacheStore.put(cacheKey, entry);
            evictCollectionView();
        } catch (RuntimeException e) {
            logger.warn("Failed to store burn area for {}, continuing without cache: {}", cacheKey, e.getMessage());
        }
    }

    private void evictCollectionView() {
        try {
            Cache cache = cacheManager.getCache(CacheNames.BURN_AREAS);
            if (cache != null) {
                cache.clear();
            }
        } catch (Exception e) {
            logger.warn("Failed to evict burn area collection cache: {}", e.getMessage());
        }
    }

    private Duration overallDeadline() {
        Duration longest = Stream.of(
                        properties.getGeocoding().getTimeout(),
                        properties.getWeather().getTimeout(),
                        properties.getNearbyTowns().getTimeout(),
                        properties.getRiskOracle().getTimeout(),
                        properties.getStatistics().getTimeout())
                .max(Duration::compareTo)
                .orElse(Duration.ZERO);
        return longest.plus(properties.getOrchestrator().getDeadlineMargin());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Settled result of one source call.
     */
    private static final class SourceOutcome<T> {
        private final T value;
        private final boolean success;

        private SourceOutcome(T value, boolean success) {
            this.value = value;
            this.success = success;
        }

        static <T> SourceOutcome<T> success(T value) {
            return new SourceOutcome<>(value, true);
        }

        static <T> SourceOutcome<T> failure() {
            return new SourceOutcome<>(null, false);
        }

        boolean isSuccess() {
            return success;
        }

        T getValue() {
            return value;
        }

        T getValueOrDefault(T fallback) {
            return success ? value : fallback;
        }
    }

    /**
     * Everything gathered for one computation.
     */
    private static final class Inputs {
        private final SourceOutcome<String> name;
        private final SourceOutcome<WeatherSnapshot> weather;
        private final SourceOutcome<List<NearbyTown>> towns;
        private final SourceOutcome<Double> risk;
        private final SourceOutcome<StatisticsResult> statistics;

        private Inputs(SourceOutcome<String> name, SourceOutcome<WeatherSnapshot> weather,
                       SourceOutcome<List<NearbyTown>> towns, SourceOutcome<Double> risk,
                       SourceOutcome<StatisticsResult> statistics) {
            this.name = name;
            this.weather = weather;
            this.towns = towns;
            this.risk = risk;
            this.statistics = statistics;
        }

        /**
         * Failed sources in declaration order. A statistics fallback counts as degraded.
         */
        List<UpstreamSource> degradedSources() {
            List<UpstreamSource> degraded = new ArrayList<>();
            if (!name.isSuccess()) {
                degraded.add(UpstreamSource.GEOCODING);
            }
            if (!weather.isSuccess()) {
                degraded.add(UpstreamSource.WEATHER);
            }
            if (!towns.isSuccess()) {
                degraded.add(UpstreamSource.NEARBY_TOWNS);
            }
            if (!statistics.isSuccess() || statistics.getValue().isFallback()) {
                degraded.add(UpstreamSource.STATISTICS);
            }
            if (!risk.isSuccess()) {
                degraded.add(UpstreamSource.RISK_ORACLE);
            }
            return degraded;
        }
    }
}
