package com.rebootearth.burnrisk.application.service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Collapses concurrent computations for the same key into one.
 *
 * The first caller for a key becomes the leader and runs the computation on its own
 * thread; later callers attach to the leader's future until it completes. Every caller
 * receives its own dependent copy, so cancelling one view never cancels the shared
 * computation.
 *
 * @param <K> key type
 * @param <V> result type
 */
public class SingleFlight<K, V> {

    private final Map<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    /**
     * Join the in-flight computation for {@code key} or start one.
     * When this caller is the leader the returned future is already complete.
     */
    public CompletableFuture<V> execute(K key, Supplier<V> computation) {
        CompletableFuture<V> promise = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, promise);
        if (existing != null) {
            return existing.copy();
        }

        try {
            promise.complete(computation.get());
        } catch (RuntimeException | Error e) {
            promise.completeExceptionally(e);
        } finally {
            inFlight.remove(key, promise);
        }
        return promise.copy();
    }

    /**
     * Number of keys currently being computed.
     */
    public int inFlightCount() {
        return inFlight.size();
    }
}
