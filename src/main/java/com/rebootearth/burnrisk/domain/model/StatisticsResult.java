package com.rebootearth.burnrisk.domain.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Output of the statistics generator: either validated generated statistics or a
 * fallback with the reason generation was rejected. Callers must check
 * {@link #isFallback()} before trusting the values.
 */
@Getter
@ToString
public class StatisticsResult {

    private final Statistics statistics;
    private final boolean fallback;
    private final String reason;

    private StatisticsResult(Statistics statistics, boolean fallback, String reason) {
        this.statistics = statistics;
        this.fallback = fallback;
        this.reason = reason;
    }

    public static StatisticsResult generated(Statistics statistics) {
        return new StatisticsResult(statistics, false, null);
    }

    public static StatisticsResult fallback(Statistics statistics, String reason) {
        return new StatisticsResult(statistics, true, reason);
    }

    public static StatisticsResult neutralFallback(String reason) {
        return fallback(Statistics.neutral(), reason);
    }
}
