/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.cache;

import java.time.Duration;

/**
 * Cache whose entries carry a category ("type") for bulk invalidation.
 */
public interface CategorizedCacheProvider extends CacheProvider {

    String DEFAULT_CATEGORY = "general";

    /**
     * Stores under a category; a null or blank category selects {@link #DEFAULT_CATEGORY}.
     */
    void set(String key, Object value, Duration ttl, String category);

    @Override
    default void set(String key, Object value, Duration ttl) {
        set(key, value, ttl, DEFAULT_CATEGORY);
    }

    /**
     * Removes every entry stored under the category.
     */
    void clearByType(String category);

    /**
     * Removes expired entries.
     *
     * @return number of entries removed
     */
    int cleanup();

    CacheStats stats();
}
