/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.aggregation;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

public record CachedKpis(
        double totalCost,
        double costTrend,
        String topService,
        double topServiceCost,
        long resourceCount,
        long anomalyCount,
        Instant lastUpdated
) implements Serializable {
    public CachedKpis {
        Objects.requireNonNull(lastUpdated, "lastUpdated");
    }
}
