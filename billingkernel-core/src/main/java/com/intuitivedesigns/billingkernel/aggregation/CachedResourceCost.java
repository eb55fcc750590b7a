/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.aggregation;

import java.io.Serializable;
import java.util.Objects;

public record CachedResourceCost(
        String resourceId,
        String resourceName,
        String resourceType,
        String serviceName,
        double cost,
        String region
) implements Serializable {
    public CachedResourceCost {
        Objects.requireNonNull(resourceId, "resourceId");
    }
}
