package com.rebootearth.burnrisk.module.test.support;

import com.rebootearth.burnrisk.application.exception.UpstreamUnavailableException;
import com.rebootearth.burnrisk.application.port.out.GeocodingAdapter;
import com.rebootearth.burnrisk.application.port.out.NearbyTownsAdapter;
import com.rebootearth.burnrisk.application.port.out.RiskOracle;
import com.rebootearth.burnrisk.application.port.out.StatisticsGenerator;
import com.rebootearth.burnrisk.application.port.out.WeatherAdapter;
import com.rebootearth.burnrisk.domain.model.DateRange;
import com.rebootearth.burnrisk.domain.model.NearbyTown;
import com.rebootearth.burnrisk.domain.model.StatisticsResult;
import com.rebootearth.burnrisk.domain.model.UpstreamSource;
import com.rebootearth.burnrisk.domain.model.WeatherSnapshot;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable stand-in for all five upstream sources.
 *
 * Every call is counted per source. A source can be made to fail, to sleep, or to
 * block on a shared gate so tests can pile concurrent callers onto one computation.
 */
public class FakeUpstreams implements GeocodingAdapter, WeatherAdapter, NearbyTownsAdapter,
        StatisticsGenerator, RiskOracle {

    public static final String PLACE_NAME = "Los Angeles, Los Angeles County, California, United States";
    public static final double DEFAULT_PROBABILITY = 0.82;

    private final Map<UpstreamSource, AtomicInteger> calls = new EnumMap<>(UpstreamSource.class);
    private final Set<UpstreamSource> failing = EnumSet.noneOf(UpstreamSource.class);
    private final Map<UpstreamSource, Duration> delays = new EnumMap<>(UpstreamSource.class);
    private volatile boolean statisticsFallback;
    private volatile double riskProbability = DEFAULT_PROBABILITY;
    private volatile CountDownLatch gate;
    private volatile String lastPlaceName;

    public FakeUpstreams() {
        reset();
    }

    public synchronized void reset() {
        for (UpstreamSource source : UpstreamSource.values()) {
            calls.put(source, new AtomicInteger());
        }
        failing.clear();
        delays.clear();
        statisticsFallback = false;
        riskProbability = DEFAULT_PROBABILITY;
        gate = null;
        lastPlaceName = null;
    }

    public synchronized void fail(UpstreamSource source) {
        failing.add(source);
    }

    public synchronized void failAll() {
        failing.addAll(EnumSet.allOf(UpstreamSource.class));
    }

    public synchronized void delay(UpstreamSource source, Duration delay) {
        delays.put(source, delay);
    }

    public void setStatisticsFallback(boolean statisticsFallback) {
        this.statisticsFallback = statisticsFallback;
    }

    public void setRiskProbability(double riskProbability) {
        this.riskProbability = riskProbability;
    }

    /**
     * Hold every upstream call until {@link CountDownLatch#countDown()} is called on the returned gate.
     */
    public CountDownLatch hold() {
        CountDownLatch latch = new CountDownLatch(1);
        gate = latch;
        return latch;
    }

    public int calls(UpstreamSource source) {
        return calls.get(source).get();
    }

    public int totalCalls() {
        return calls.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    public String getLastPlaceName() {
        return lastPlaceName;
    }

    @Override
    public String reverseGeocode(BigDecimal lat, BigDecimal lng) {
        enter(UpstreamSource.GEOCODING);
        return PLACE_NAME;
    }

    @Override
    public WeatherSnapshot fetchWeather(BigDecimal lat, BigDecimal lng, DateRange dateRange) {
        enter(UpstreamSource.WEATHER);
        return TestFixtures.hotDryWeather(dateRange.getStart());
    }

    @Override
    public List<NearbyTown> findNearbyTowns(BigDecimal lat, BigDecimal lng) {
        enter(UpstreamSource.NEARBY_TOWNS);
        return TestFixtures.towns();
    }

    @Override
    public StatisticsResult generateStatistics(BigDecimal lat, BigDecimal lng, String placeName) {
        enter(UpstreamSource.STATISTICS);
        lastPlaceName = placeName;
        if (statisticsFallback) {
            return StatisticsResult.neutralFallback("simulated schema failure");
        }
        return StatisticsResult.generated(TestFixtures.uniformStatistics(0.7));
    }

    @Override
    public double probability(BigDecimal lat, BigDecimal lng) {
        enter(UpstreamSource.RISK_ORACLE);
        return riskProbability;
    }

    private void enter(UpstreamSource source) {
        calls.get(source).incrementAndGet();
        CountDownLatch latch = gate;
        Duration delay;
        boolean fails;
        synchronized (this) {
            delay = delays.get(source);
            fails = failing.contains(source);
        }
        try {
            if (latch != null) {
                latch.await(10, TimeUnit.SECONDS);
            }
            if (delay != null) {
                Thread.sleep(delay.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException(source, "interrupted");
        }
        if (fails) {
            throw new UpstreamUnavailableException(source, "simulated");
        }
    }
}
