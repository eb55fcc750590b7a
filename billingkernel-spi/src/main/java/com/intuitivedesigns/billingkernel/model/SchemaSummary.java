/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.model;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column list, row count and a rough size estimate of a dataset.
 */
public record SchemaSummary(List<String> columns, int rowCount, long estimatedSizeBytes) {

    public SchemaSummary {
        columns = (columns == null) ? List.of() : List.copyOf(columns);
        if (rowCount < 0) throw new IllegalArgumentException("rowCount must be >= 0");
    }

    /**
     * Derives the summary from the rows: columns in first-seen order, size from the textual form of
     * every key and value.
     */
    public static SchemaSummary infer(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return new SchemaSummary(List.of(), 0, 0L);
        }
        final Set<String> cols = new LinkedHashSet<>();
        long size = 0L;
        for (Map<String, Object> row : rows) {
            for (Map.Entry<String, Object> e : row.entrySet()) {
                cols.add(e.getKey());
                size += e.getKey().getBytes(StandardCharsets.UTF_8).length;
                if (e.getValue() != null) {
                    size += String.valueOf(e.getValue()).getBytes(StandardCharsets.UTF_8).length;
                }
            }
        }
        return new SchemaSummary(List.copyOf(cols), rows.size(), size);
    }

    public boolean hasColumn(String name) {
        return columns.contains(name);
    }
}
