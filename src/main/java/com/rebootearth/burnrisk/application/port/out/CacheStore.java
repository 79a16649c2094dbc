package com.rebootearth.burnrisk.application.port.out;

import com.rebootearth.burnrisk.domain.model.CacheEntry;

import java.util.Collection;
import java.util.Optional;

/**
 * Output port for durable burn area persistence keyed by quantized location.
 * Returns entries regardless of age; callers apply the TTL policy.
 */
public interface CacheStore {

  /**
   * Find the entry for a key. A corrupt entry is reported as absent.
   */
  Optional<CacheEntry> get(String key);

  /**
   * Replace the entry for a key. Either the whole entry is committed or nothing is.
   */
  void put(String key, CacheEntry entry);

  /**
   * Remove the entry for a key.
   *
   * @return true if an entry existed
   */
  boolean invalidate(String key);

  /**
   * All committed entries, fresh or expired.
   */
  Collection<CacheEntry> all();

  /**
   * Number of committed writes so far. Advances only after a write is visible to
   * {@link #get} and {@link #all}.
   */
  long version();
}
