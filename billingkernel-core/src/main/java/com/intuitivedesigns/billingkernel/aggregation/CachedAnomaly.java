/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.aggregation;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A detected cost anomaly. {@code affectedService} and {@code affectedResource} may be null.
 */
public record CachedAnomaly(
        String id,
        String type,
        String severity,
        LocalDate date,
        String metric,
        double value,
        double expectedValue,
        double deviation,
        String description,
        String affectedService,
        String affectedResource
) implements Serializable {
    public CachedAnomaly {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(date, "date");
    }
}
