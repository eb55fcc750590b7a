/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.aggregation;

import java.time.Duration;

/**
 * Cached aggregation kinds, each with its cache category and time-to-live.
 */
public enum AggregationType {
    DAILY_COSTS("daily_costs", Duration.ofHours(4)),
    MONTHLY_COSTS("monthly_costs", Duration.ofHours(24)),
    SERVICE_BREAKDOWN("service_breakdown", Duration.ofHours(4)),
    RESOURCE_COSTS("resource_costs", Duration.ofHours(4)),
    ANOMALIES("anomalies", Duration.ofHours(1)),
    KPI("kpi", Duration.ofMinutes(15));

    private final String category;
    private final Duration ttl;

    AggregationType(String category, Duration ttl) {
        this.category = category;
        this.ttl = ttl;
    }

    public String category() {
        return category;
    }

    public Duration ttl() {
        return ttl;
    }
}
