/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.classification;

import com.intuitivedesigns.billingkernel.enrichment.rules.PatternCache;
import com.intuitivedesigns.billingkernel.model.SpendCategory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Scans rules by descending priority and returns the first one whose share of matching pattern
 * groups reaches {@link #MATCH_THRESHOLD}. That is the highest-priority qualifying rule, not the
 * best-scoring one.
 */
public final class ResourceClassifier {

    public static final double MATCH_THRESHOLD = 0.7;

    // USD per 1K tokens
    static final BigDecimal INFERENCE_PRICE_PER_1K = new BigDecimal("0.002");
    static final BigDecimal AI_SERVICE_PRICE_PER_1K = new BigDecimal("0.003");

    private final List<ClassificationRule> rules;
    private final PatternCache patterns;

    public ResourceClassifier(List<ClassificationRule> rules, PatternCache patterns) {
        final List<ClassificationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(ClassificationRule::priority).reversed());
        this.rules = List.copyOf(sorted);
        this.patterns = Objects.requireNonNull(patterns, "patterns");
    }

    public record Match(ClassificationRule rule, double ratio) {
        public double confidence() {
            return rule.confidence() * ratio;
        }
    }

    public Optional<Match> classify(String serviceName, String resourceName, String instanceType) {
        final String service = lower(serviceName);
        final String resource = lower(resourceName);
        final String instance = lower(instanceType);

        for (ClassificationRule rule : rules) {
            int matched = 0;
            if (anyMatch(rule.serviceNamePatterns(), service)) matched++;
            if (anyMatch(rule.resourceNamePatterns(), resource)) matched++;
            if (anyMatch(rule.instanceTypePatterns(), instance)) matched++;

            final double ratio = (double) matched / rule.declaredGroups();
            if (ratio >= MATCH_THRESHOLD) {
                return Optional.of(new Match(rule, ratio));
            }
        }
        return Optional.empty();
    }

    /**
     * Approximate tokens bought with {@code cost}, for categories priced per token; floored and never
     * negative.
     */
    public static OptionalLong estimateTokens(SpendCategory category, double cost) {
        final BigDecimal pricePer1k;
        switch (category) {
            case ML_INFERENCE:
                pricePer1k = INFERENCE_PRICE_PER_1K;
                break;
            case AI_SERVICE:
                pricePer1k = AI_SERVICE_PRICE_PER_1K;
                break;
            default:
                return OptionalLong.empty();
        }
        if (!(cost > 0.0) || Double.isInfinite(cost)) {
            return OptionalLong.of(0L);
        }
        final BigDecimal tokens = BigDecimal.valueOf(cost)
                .multiply(BigDecimal.valueOf(1000))
                .divide(pricePer1k, 0, RoundingMode.FLOOR);
        return OptionalLong.of(tokens.longValue());
    }

    private boolean anyMatch(List<String> group, String value) {
        for (String regex : group) {
            if (patterns.find(regex, value)) return true;
        }
        return false;
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
