package com.hotskills.infrastructure.cache;

import com.hotskills.domain.exception.CacheUnavailableException;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store holding serialized aggregates with optional per-key expiry.
 *
 * Implementations report every failure as {@link CacheUnavailableException}.
 */
public interface CacheStore {

    /**
     * @return the stored JSON payload, or empty if the key is absent or expired
     */
    Optional<String> get(String key);

    /**
     * Store a payload, overwriting any existing entry.
     *
     * @param ttl expiry of the entry; {@code null} stores it without expiry
     */
    void set(String key, String payload, Duration ttl);
}
