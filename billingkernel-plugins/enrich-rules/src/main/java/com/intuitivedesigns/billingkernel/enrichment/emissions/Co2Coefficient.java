/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.emissions;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Emission factor of one service in one region ({@code global} applies to every region).
 * {@code kgCo2PerUnit} of 0 means no usage-based factor is known.
 */
public record Co2Coefficient(
        String id,
        String provider,
        String serviceName,
        String serviceCategory,
        String region,
        double kgCo2PerDollar,
        double kgCo2PerUnit,
        String unitType,
        double confidence,
        String source,
        LocalDate updatedAt
) implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String GLOBAL_REGION = "global";

    public Co2Coefficient {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(serviceName, "serviceName");
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(source, "source");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        unitType = (unitType == null) ? "dollar" : unitType;
    }

    /**
     * Cost-based factor only.
     */
    public static Co2Coefficient perDollar(String id, String provider, String serviceName, String serviceCategory,
                                           String region, double kgCo2PerDollar, double confidence, String source) {
        return new Co2Coefficient(id, provider, serviceName, serviceCategory, region, kgCo2PerDollar, 0.0,
                null, confidence, source, LocalDate.of(2024, 1, 1));
    }
}
