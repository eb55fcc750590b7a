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

/**
 * Ingested billing rows plus their source metadata. Immutable: rows are copied on construction and
 * exposed read-only. Row values may be null.
 */
public record RawDataset(List<Map<String, Object>> rows, SourceInfo source, SchemaSummary schema) {

    public RawDataset {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(schema, "schema");
        rows = copyRows(rows);
    }

    public static RawDataset of(List<Map<String, Object>> rows, SourceInfo source) {
        return new RawDataset(rows, source, SchemaSummary.infer(rows));
    }

    public int size() {
        return rows.size();
    }

    private static List<Map<String, Object>> copyRows(List<Map<String, Object>> rows) {
        final List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            // LinkedHashMap keeps column order and tolerates null values (Map.copyOf does not)
            out.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        return Collections.unmodifiableList(out);
    }
}
