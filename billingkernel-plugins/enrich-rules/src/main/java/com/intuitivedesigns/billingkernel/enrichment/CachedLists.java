/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment;

import com.intuitivedesigns.billingkernel.cache.CacheProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-through helper for rule lists kept in the run's {@link CacheProvider}.
 */
public final class CachedLists {

    private static final Logger log = LoggerFactory.getLogger(CachedLists.class);

    private CachedLists() {}

    /**
     * Cached list under {@code key} when every element has {@code type}; a value of any other shape
     * is treated as a miss.
     */
    public static <T> Optional<List<T>> read(CacheProvider cache, String key, Class<T> type) {
        final Optional<Object> hit = cache.get(key);
        if (hit.isEmpty()) return Optional.empty();

        if (!(hit.get() instanceof List<?> list)) {
            log.warn("Ignoring cached value under '{}': expected a list, got {}", key, hit.get().getClass().getName());
            return Optional.empty();
        }
        final List<T> out = new ArrayList<>(list.size());
        for (Object o : list) {
            if (!type.isInstance(o)) {
                log.warn("Ignoring cached value under '{}': element of type {}", key,
                        o == null ? "null" : o.getClass().getName());
                return Optional.empty();
            }
            out.add(type.cast(o));
        }
        return Optional.of(List.copyOf(out));
    }

    public static <T> void write(CacheProvider cache, String key, List<T> items, Duration ttl) {
        cache.set(key, new ArrayList<>(items), ttl);
    }
}
