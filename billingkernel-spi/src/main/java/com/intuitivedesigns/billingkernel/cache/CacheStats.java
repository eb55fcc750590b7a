/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.cache;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of a categorized cache. {@code totalSizeBytes} is approximate (encoded payload length).
 */
public record CacheStats(
        long totalEntries,
        long totalSizeBytes,
        Map<String, Long> entriesByCategory,
        Optional<Instant> oldestEntry,
        Optional<Instant> newestEntry
) {
    public CacheStats {
        entriesByCategory = (entriesByCategory == null) ? Map.of() : Map.copyOf(entriesByCategory);
        oldestEntry = (oldestEntry == null) ? Optional.empty() : oldestEntry;
        newestEntry = (newestEntry == null) ? Optional.empty() : newestEntry;
    }

    public static CacheStats empty() {
        return new CacheStats(0L, 0L, Map.of(), Optional.empty(), Optional.empty());
    }
}
