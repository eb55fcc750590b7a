/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment;

import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.enrichment.tags.TagMergePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables shared by the rule-based steps.
 *
 * <ul>
 *   <li>{@code enrichment.max.rows}: rows materialized per step (default 10000)</li>
 *   <li>{@code enrichment.tags.cache.ttl.ms}: cached tag rules (default 10 min)</li>
 *   <li>{@code enrichment.tags.merge.policy}: {@link TagMergePolicy} (default HIGHEST_PRIORITY_WINS)</li>
 *   <li>{@code enrichment.co2.cache.ttl.ms}: cached coefficients (default 24 h)</li>
 *   <li>{@code enrichment.co2.default.rate}: fallback kg CO2 per dollar (default 0.5)</li>
 *   <li>{@code enrichment.co2.fallback.confidence}: confidence of fallback estimates (default 0.3)</li>
 * </ul>
 */
public record EnrichmentSettings(
        int maxRows,
        Duration tagRulesTtl,
        TagMergePolicy tagMergePolicy,
        Duration coefficientsTtl,
        double co2DefaultRate,
        double co2FallbackConfidence
) {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentSettings.class);

    public static final String KEY_MAX_ROWS = "enrichment.max.rows";
    public static final String KEY_TAGS_TTL_MS = "enrichment.tags.cache.ttl.ms";
    public static final String KEY_TAGS_MERGE_POLICY = "enrichment.tags.merge.policy";
    public static final String KEY_CO2_TTL_MS = "enrichment.co2.cache.ttl.ms";
    public static final String KEY_CO2_DEFAULT_RATE = "enrichment.co2.default.rate";
    public static final String KEY_CO2_FALLBACK_CONFIDENCE = "enrichment.co2.fallback.confidence";

    public static final int DEFAULT_MAX_ROWS = 10_000;
    public static final Duration DEFAULT_TAGS_TTL = Duration.ofMinutes(10);
    public static final Duration DEFAULT_CO2_TTL = Duration.ofHours(24);
    public static final double DEFAULT_CO2_RATE = 0.5;
    public static final double DEFAULT_FALLBACK_CONFIDENCE = 0.3;

    public EnrichmentSettings {
        if (maxRows <= 0) throw new IllegalArgumentException("maxRows must be > 0");
        Objects.requireNonNull(tagRulesTtl, "tagRulesTtl");
        Objects.requireNonNull(tagMergePolicy, "tagMergePolicy");
        Objects.requireNonNull(coefficientsTtl, "coefficientsTtl");
    }

    public static EnrichmentSettings defaults() {
        return new EnrichmentSettings(DEFAULT_MAX_ROWS, DEFAULT_TAGS_TTL, TagMergePolicy.HIGHEST_PRIORITY_WINS,
                DEFAULT_CO2_TTL, DEFAULT_CO2_RATE, DEFAULT_FALLBACK_CONFIDENCE);
    }

    public static EnrichmentSettings fromConfig(PipelineConfig config) {
        Objects.requireNonNull(config, "config");

        int maxRows = config.getInt(KEY_MAX_ROWS, DEFAULT_MAX_ROWS);
        if (maxRows <= 0) {
            log.warn("Invalid {}={}, using {}", KEY_MAX_ROWS, maxRows, DEFAULT_MAX_ROWS);
            maxRows = DEFAULT_MAX_ROWS;
        }

        TagMergePolicy policy;
        final String rawPolicy = config.getString(KEY_TAGS_MERGE_POLICY, null);
        try {
            policy = TagMergePolicy.parse(rawPolicy);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown {}='{}', using {}", KEY_TAGS_MERGE_POLICY, rawPolicy, TagMergePolicy.HIGHEST_PRIORITY_WINS);
            policy = TagMergePolicy.HIGHEST_PRIORITY_WINS;
        }

        return new EnrichmentSettings(
                maxRows,
                config.getDurationMs(KEY_TAGS_TTL_MS, DEFAULT_TAGS_TTL),
                policy,
                config.getDurationMs(KEY_CO2_TTL_MS, DEFAULT_CO2_TTL),
                config.getDouble(KEY_CO2_DEFAULT_RATE, DEFAULT_CO2_RATE),
                config.getDouble(KEY_CO2_FALLBACK_CONFIDENCE, DEFAULT_FALLBACK_CONFIDENCE));
    }

    public EnrichmentSettings withMaxRows(int rows) {
        return new EnrichmentSettings(rows, tagRulesTtl, tagMergePolicy, coefficientsTtl, co2DefaultRate, co2FallbackConfidence);
    }

    public EnrichmentSettings withTagMergePolicy(TagMergePolicy policy) {
        return new EnrichmentSettings(maxRows, tagRulesTtl, policy, coefficientsTtl, co2DefaultRate, co2FallbackConfidence);
    }
}
