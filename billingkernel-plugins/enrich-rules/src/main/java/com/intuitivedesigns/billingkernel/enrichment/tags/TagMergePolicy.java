/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.tags;

import java.util.Locale;
import java.util.Map;

/**
 * How tags of a later rule combine with tags already assigned to the same resource in one run.
 * Rules are processed from highest to lowest priority.
 */
public enum TagMergePolicy {

    /**
     * A key set by a higher-priority rule is never overwritten.
     */
    HIGHEST_PRIORITY_WINS {
        @Override
        void merge(Map<String, String> existing, Map<String, String> incoming) {
            incoming.forEach(existing::putIfAbsent);
        }
    },

    /**
     * The last rule processed overwrites colliding keys, so a lower-priority rule wins conflicts.
     */
    LAST_PROCESSED_WINS {
        @Override
        void merge(Map<String, String> existing, Map<String, String> incoming) {
            existing.putAll(incoming);
        }
    };

    abstract void merge(Map<String, String> existing, Map<String, String> incoming);

    public static TagMergePolicy parse(String value) {
        if (value == null || value.isBlank()) return HIGHEST_PRIORITY_WINS;
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
