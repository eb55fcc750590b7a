/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.classification;

import com.intuitivedesigns.billingkernel.model.SpendCategory;

import java.util.List;
import java.util.Objects;

/**
 * Pattern groups over service name, resource name and instance type. An empty group is not declared
 * and does not count toward the match ratio.
 */
public record ClassificationRule(
        String id,
        String name,
        SpendCategory category,
        List<String> serviceNamePatterns,
        List<String> resourceNamePatterns,
        List<String> instanceTypePatterns,
        double confidence,
        int priority
) {
    public ClassificationRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        serviceNamePatterns = copy(serviceNamePatterns);
        resourceNamePatterns = copy(resourceNamePatterns);
        instanceTypePatterns = copy(instanceTypePatterns);
        if (declaredGroups(serviceNamePatterns, resourceNamePatterns, instanceTypePatterns) == 0) {
            throw new IllegalArgumentException("Rule '" + id + "' declares no pattern group");
        }
    }

    public int declaredGroups() {
        return declaredGroups(serviceNamePatterns, resourceNamePatterns, instanceTypePatterns);
    }

    private static int declaredGroups(List<?> a, List<?> b, List<?> c) {
        return (a.isEmpty() ? 0 : 1) + (b.isEmpty() ? 0 : 1) + (c.isEmpty() ? 0 : 1);
    }

    private static List<String> copy(List<String> patterns) {
        return patterns == null ? List.of() : List.copyOf(patterns);
    }
}
