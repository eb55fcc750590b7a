/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.metrics;

import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Selects the metrics runtime from {@code metrics.provider}.
 *
 * <ul>
 *   <li>{@code MICROMETER}: in-process Micrometer registry, tagged with every {@code metrics.tag.*} key.</li>
 *   <li>anything else (default {@code NONE}): shared NOOP runtime.</li>
 * </ul>
 */
public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private static final String KEY_PROVIDER = "metrics.provider";
    private static final String KEY_TAG_PREFIX = "metrics.tag.";
    private static final String DEFAULT_PROVIDER = "NONE";

    private static final MetricsRuntime NOOP = new NoopMetricsRuntime();

    private MetricsFactory() {}

    public static MetricsRuntime init(PipelineConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = config.getString(KEY_PROVIDER, DEFAULT_PROVIDER).trim().toUpperCase(Locale.ROOT);
        if ("MICROMETER".equals(provider)) {
            MicrometerMetricsRuntime rt = new MicrometerMetricsRuntime(commonTags(config));
            log.info("Metrics runtime initialized: {}", rt.type());
            return rt;
        }

        log.info("Metrics disabled (provider={}); NOOP active", provider);
        return NOOP;
    }

    public static MetricsRuntime noop() {
        return NOOP;
    }

    private static Map<String, String> commonTags(PipelineConfig config) {
        final Map<String, String> tags = new HashMap<>();
        for (Map.Entry<String, Object> entry : config.asMap().entrySet()) {
            final String k = entry.getKey();
            if (k == null || !k.startsWith(KEY_TAG_PREFIX)) continue;

            final String tagKey = k.substring(KEY_TAG_PREFIX.length()).trim();
            final String val = String.valueOf(entry.getValue()).trim();
            if (tagKey.isEmpty() || val.isEmpty()) continue;

            tags.put(tagKey, val);
        }
        return Collections.unmodifiableMap(tags);
    }

    private static final class NoopMetricsRuntime implements MetricsRuntime {
        // Sentinel object instead of null to avoid NPEs in "instanceof" checks downstream
        private final Object sentinelRegistry = new Object();

        @Override
        public Object registry() {
            return sentinelRegistry;
        }
    }
}
