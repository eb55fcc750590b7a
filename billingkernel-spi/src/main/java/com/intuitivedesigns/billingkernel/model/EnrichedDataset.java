/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A {@link RawDataset} plus named enrichment collections.
 *
 * <p>A key that is absent has not been computed; a key mapped to an empty list was computed as empty.
 * Instances are immutable: {@link #attach} returns a new dataset and appends to an existing collection
 * rather than replacing it.</p>
 */
public final class EnrichedDataset {

    private final RawDataset raw;
    private final Map<EnrichmentKey<?>, List<?>> enrichments;

    private EnrichedDataset(RawDataset raw, Map<EnrichmentKey<?>, List<?>> enrichments) {
        this.raw = raw;
        this.enrichments = enrichments;
    }

    public static EnrichedDataset from(RawDataset raw) {
        return new EnrichedDataset(Objects.requireNonNull(raw, "raw"), Map.of());
    }

    public RawDataset raw() {
        return raw;
    }

    public List<Map<String, Object>> rows() {
        return raw.rows();
    }

    public SourceInfo source() {
        return raw.source();
    }

    public SchemaSummary schema() {
        return raw.schema();
    }

    public <T> EnrichedDataset attach(EnrichmentKey<T> key, List<? extends T> items) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(items, "items");

        final Map<EnrichmentKey<?>, List<?>> next = new LinkedHashMap<>(enrichments);
        final List<Object> merged = new ArrayList<>();
        final List<?> existing = enrichments.get(key);
        if (existing != null) merged.addAll(existing);
        for (T item : items) {
            merged.add(Objects.requireNonNull(item, "enrichment item"));
        }
        next.put(key, Collections.unmodifiableList(merged));
        return new EnrichedDataset(raw, Collections.unmodifiableMap(next));
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<List<T>> get(EnrichmentKey<T> key) {
        return Optional.ofNullable((List<T>) enrichments.get(key));
    }

    public boolean has(EnrichmentKey<?> key) {
        return enrichments.containsKey(key);
    }

    public Set<EnrichmentKey<?>> keys() {
        return enrichments.keySet();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnrichedDataset other)) return false;
        return raw.equals(other.raw) && enrichments.equals(other.enrichments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(raw, enrichments);
    }

    @Override
    public String toString() {
        return "EnrichedDataset{rows=" + raw.size() + ", enrichments=" + enrichments.keySet() + '}';
    }
}
