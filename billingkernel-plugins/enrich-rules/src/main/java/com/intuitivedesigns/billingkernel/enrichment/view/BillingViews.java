/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.view;

import com.intuitivedesigns.billingkernel.query.QueryEngine;
import com.intuitivedesigns.billingkernel.query.SqlLiterals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Materializes rows into a run-scoped temporary view over inlined literals.
 *
 * <p>Every value is inlined as a string literal (or {@code NULL}) and cast to its column type in
 * the view's select list, so rows with mixed value types never trip the engine's type inference.
 * The view also carries {@link #ROW_INDEX}, the zero-based position of the source row, for stable
 * ordering of query results.</p>
 */
public final class BillingViews {

    private static final Logger log = LoggerFactory.getLogger(BillingViews.class);

    public static final String ROW_INDEX = "_row";

    private BillingViews() {}

    /**
     * Creates (or replaces) the view {@code <baseName>_<runId>} holding at most {@code maxRows} rows.
     */
    public static <R> BillingView create(QueryEngine engine,
                                         String baseName,
                                         String runId,
                                         List<ViewColumn<R>> columns,
                                         List<? extends R> rows,
                                         int maxRows) {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(rows, "rows");
        if (columns.isEmpty()) throw new IllegalArgumentException("view needs at least one column");
        if (maxRows <= 0) throw new IllegalArgumentException("maxRows must be > 0");

        final String name = viewName(baseName, runId);
        final List<? extends R> capped = rows.size() > maxRows ? rows.subList(0, maxRows) : rows;
        if (capped.size() < rows.size()) {
            log.info("View {}: row cap {} applied ({} rows dropped)", name, maxRows, rows.size() - maxRows);
        }

        engine.query("CREATE OR REPLACE TEMPORARY VIEW " + SqlLiterals.identifier(name) + " AS "
                + select(columns) + " FROM " + values(columns, capped));
        return new BillingView(engine, name, capped.size());
    }

    /**
     * View name made of the base name and the run id, reduced to {@code [a-z0-9_]}.
     */
    public static String viewName(String baseName, String runId) {
        Objects.requireNonNull(baseName, "baseName");
        Objects.requireNonNull(runId, "runId");
        return sanitize(baseName) + "_" + sanitize(runId);
    }

    /**
     * Numeric reading of a cell: numbers as-is, numeric strings parsed, anything else 0.
     */
    public static double toDouble(Object value) {
        if (value instanceof Number n) {
            final double d = n.doubleValue();
            return Double.isFinite(d) ? d : 0.0;
        }
        if (value instanceof CharSequence s) {
            try {
                final double d = Double.parseDouble(s.toString().trim());
                return Double.isFinite(d) ? d : 0.0;
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }

    private static <R> String select(List<ViewColumn<R>> columns) {
        final StringJoiner select = new StringJoiner(", ", "SELECT ", "");
        for (ViewColumn<R> c : columns) {
            final String id = SqlLiterals.identifier(c.name());
            select.add("CAST(" + id + " AS " + c.type().sqlType() + ") AS " + id);
        }
        final String row = SqlLiterals.identifier(ROW_INDEX);
        select.add("CAST(" + row + " AS INTEGER) AS " + row);
        return select.toString();
    }

    private static <R> String values(List<ViewColumn<R>> columns, List<? extends R> rows) {
        final StringJoiner alias = new StringJoiner(", ", "t(", ")");
        for (ViewColumn<R> c : columns) {
            alias.add(SqlLiterals.identifier(c.name()));
        }
        alias.add(SqlLiterals.identifier(ROW_INDEX));

        if (rows.isEmpty()) {
            final StringJoiner nulls = new StringJoiner(", ", "(", ")");
            for (int i = 0; i <= columns.size(); i++) {
                nulls.add("NULL");
            }
            return "(VALUES " + nulls + ") AS " + alias + " WHERE FALSE";
        }

        final StringJoiner values = new StringJoiner(",\n", "(VALUES ", ") AS " + alias);
        for (int i = 0; i < rows.size(); i++) {
            final R row = rows.get(i);
            final StringJoiner tuple = new StringJoiner(", ", "(", ")");
            for (ViewColumn<R> c : columns) {
                tuple.add(cell(c, row));
            }
            tuple.add(Integer.toString(i));
            values.add(tuple.toString());
        }
        return values.toString();
    }

    private static <R> String cell(ViewColumn<R> column, R row) {
        final Object raw = column.extractor().apply(row);
        if (column.type() == ViewColumn.ColumnType.NUMBER) {
            return SqlLiterals.quote(SqlLiterals.literal(toDouble(raw)));
        }
        return raw == null ? "NULL" : SqlLiterals.quote(String.valueOf(raw));
    }

    private static String sanitize(String s) {
        final String lower = s.toLowerCase(Locale.ROOT);
        final StringBuilder sb = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            final char c = lower.charAt(i);
            sb.append((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' ? c : '_');
        }
        return sb.toString();
    }
}
