/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.core;

import java.util.Optional;

/**
 * Typed per-run metadata. Steps declare the fields they need through
 * {@link EnrichmentStep#requiredMetadata()}.
 */
public record RunMetadata(String dataSourceId, String fileName, String billingPeriod) {

    public enum Field {
        DATA_SOURCE_ID,
        FILE_NAME,
        BILLING_PERIOD
    }

    public static RunMetadata empty() {
        return new RunMetadata(null, null, null);
    }

    public Optional<String> value(Field field) {
        final String v = switch (field) {
            case DATA_SOURCE_ID -> dataSourceId;
            case FILE_NAME -> fileName;
            case BILLING_PERIOD -> billingPeriod;
        };
        return (v == null || v.isBlank()) ? Optional.empty() : Optional.of(v);
    }

    public boolean has(Field field) {
        return value(field).isPresent();
    }
}
