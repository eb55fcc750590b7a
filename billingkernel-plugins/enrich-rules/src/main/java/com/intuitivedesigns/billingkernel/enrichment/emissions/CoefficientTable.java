/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.emissions;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coefficients keyed by (service, region); a later entry for the same pair replaces the earlier one
 * so the emission join never fans out.
 */
final class CoefficientTable {

    private final List<Co2Coefficient> entries;

    private CoefficientTable(List<Co2Coefficient> entries) {
        this.entries = entries;
    }

    static CoefficientTable of(List<Co2Coefficient> coefficients) {
        final Map<String, Co2Coefficient> byKey = new LinkedHashMap<>();
        for (Co2Coefficient c : coefficients) {
            byKey.put(c.serviceName() + '\u0000' + c.region(), c);
        }
        return new CoefficientTable(List.copyOf(byKey.values()));
    }

    List<Co2Coefficient> entries() {
        return entries;
    }

    int size() {
        return entries.size();
    }
}
