/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store with per-entry time-to-live, shared by steps and across runs.
 *
 * <p>An entry is readable only while {@code now < expiresAt}; reads past expiry are misses and evict
 * the entry. Concurrent writes to one key are last-write-wins.</p>
 */
public interface CacheProvider extends AutoCloseable {

    Optional<Object> get(String key);

    /**
     * Typed read; a value of another type is treated as a miss.
     */
    default <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    /**
     * Stores with the provider's default TTL.
     */
    void set(String key, Object value);

    /**
     * Stores with an explicit TTL. {@code null} selects the provider's default; zero or negative means
     * the entry never expires.
     */
    void set(String key, Object value, Duration ttl);

    void delete(String key);

    void clear();

    @Override
    default void close() {
        // no-op by default
    }
}
