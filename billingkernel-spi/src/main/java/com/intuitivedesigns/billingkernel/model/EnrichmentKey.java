/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.model;

import java.util.Objects;

/**
 * Typed name of an enrichment collection attached to an {@link EnrichedDataset}.
 *
 * @param <T> element type of the collection
 */
public final class EnrichmentKey<T> {

    public static final EnrichmentKey<VirtualTag> VIRTUAL_TAGS = new EnrichmentKey<>("virtualTags", VirtualTag.class);
    public static final EnrichmentKey<EmissionEstimate> CO2_ESTIMATES = new EnrichmentKey<>("co2Estimates", EmissionEstimate.class);
    public static final EnrichmentKey<SpendClassification> AI_CLASSIFICATIONS = new EnrichmentKey<>("aiClassifications", SpendClassification.class);

    private final String name;
    private final Class<T> type;

    private EnrichmentKey(String name, Class<T> type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public static <T> EnrichmentKey<T> of(String name, Class<T> type) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Enrichment key name is blank");
        return new EnrichmentKey<>(name.trim(), type);
    }

    public String name() {
        return name;
    }

    public Class<T> type() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnrichmentKey<?> other)) return false;
        return name.equals(other.name) && type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name;
    }
}
