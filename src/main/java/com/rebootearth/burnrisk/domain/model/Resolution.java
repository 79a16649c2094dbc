package com.rebootearth.burnrisk.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Result of resolving a location: the burn area plus how it was obtained.
 */
@Getter
@ToString
public class Resolution {

    public enum Source {
        CACHE, COMPUTED, STALE;

        public String id() {
            return name().toLowerCase();
        }
    }

    private final BurnArea burnArea;
    private final List<UpstreamSource> degradedSources;
    private final Source source;

    private Resolution(BurnArea burnArea, List<UpstreamSource> degradedSources, Source source) {
        this.burnArea = burnArea;
        this.degradedSources = List.copyOf(degradedSources);
        this.source = source;
    }

    public static Resolution fromCache(BurnArea burnArea) {
        return new Resolution(burnArea, List.of(), Source.CACHE);
    }

    public static Resolution computed(BurnArea burnArea, List<UpstreamSource> degradedSources) {
        return new Resolution(burnArea, degradedSources, Source.COMPUTED);
    }

    /**
     * An expired entry served because every source failed on recomputation.
     */
    public static Resolution stale(BurnArea burnArea, List<UpstreamSource> degradedSources) {
        return new Resolution(burnArea, degradedSources, Source.STALE);
    }

    public boolean isDegraded() {
        return !degradedSources.isEmpty();
    }
}
