package com.rebootearth.burnrisk.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One committed computation for a quantized key. Entries are replaced, never mutated.
 */
@Getter
@EqualsAndHashCode
@ToString
public class CacheEntry {

    private final String key;
    private final BurnArea payload;
    private final Instant computedAt;
    private final Duration ttl;
    private final List<UpstreamSource> degradedSources;

    public CacheEntry(String key, BurnArea payload, Instant computedAt, Duration ttl,
                      List<UpstreamSource> degradedSources) {
        if (key == null || payload == null || computedAt == null || ttl == null) {
            throw new IllegalArgumentException("Cache entry key, payload, computedAt and ttl are required");
        }
        this.key = key;
        this.payload = payload;
        this.computedAt = computedAt;
        this.ttl = ttl;
        this.degradedSources = degradedSources == null ? List.of() : List.copyOf(degradedSources);
    }

    public Instant expiresAt() {
        return computedAt.plus(ttl);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }
}
