/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.aggregation;

import java.io.Serializable;
import java.util.Objects;

public record CachedServiceBreakdown(
        String serviceName,
        String serviceCategory,
        double cost,
        double percentage,
        Trend trend,
        double trendPercent
) implements Serializable {

    public enum Trend {
        UP,
        DOWN,
        STABLE
    }

    public CachedServiceBreakdown {
        Objects.requireNonNull(serviceName, "serviceName");
        trend = (trend == null) ? Trend.STABLE : trend;
    }
}
