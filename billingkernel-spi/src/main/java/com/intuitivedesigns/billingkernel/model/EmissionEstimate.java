/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.model;

import java.util.Objects;

public record EmissionEstimate(
        String resourceId,
        double estimatedKgCo2,
        double confidence,
        String coefficientSource,
        String region,
        MatchTier matchTier
) {
    public EmissionEstimate {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(coefficientSource, "coefficientSource");
        Objects.requireNonNull(matchTier, "matchTier");
    }
}
