/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.aggregation;

import java.io.Serializable;
import java.time.YearMonth;
import java.util.List;
import java.util.Objects;

/**
 * One month of spend compared with the month before.
 */
public record CachedMonthlySummary(
        YearMonth month,
        double total,
        double previousTotal,
        double change,
        double changePercent,
        List<ServiceCost> topServices
) implements Serializable {

    public CachedMonthlySummary {
        Objects.requireNonNull(month, "month");
        topServices = (topServices == null) ? List.of() : List.copyOf(topServices);
    }

    public record ServiceCost(String name, double cost) implements Serializable {
        public ServiceCost {
            Objects.requireNonNull(name, "name");
        }
    }
}
