/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.aggregation;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

public record CachedDailyCosts(
        LocalDate date,
        double total,
        double billedCost,
        double effectiveCost,
        double usageQuantity
) implements Serializable {
    public CachedDailyCosts {
        Objects.requireNonNull(date, "date");
    }
}
