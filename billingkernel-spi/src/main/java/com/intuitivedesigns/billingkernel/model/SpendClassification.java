/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.model;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * AI/ML classification of one resource. {@code estimatedTokens} is only present for categories
 * priced per token.
 */
public record SpendClassification(
        String resourceId,
        boolean aiRelated,
        double confidence,
        SpendCategory category,
        String ruleId,
        OptionalLong estimatedTokens
) {
    public SpendClassification {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(ruleId, "ruleId");
        estimatedTokens = (estimatedTokens == null) ? OptionalLong.empty() : estimatedTokens;
    }
}
