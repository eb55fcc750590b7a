/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.query;

import java.math.BigDecimal;

/**
 * Value-to-literal encoding for query text built from data.
 *
 * <ul>
 *   <li>null: {@code NULL}</li>
 *   <li>numbers: plain text; NaN and infinities become {@code NULL}</li>
 *   <li>booleans: {@code TRUE} / {@code FALSE}</li>
 *   <li>anything else: its string form in single quotes, embedded quotes doubled</li>
 * </ul>
 */
public final class SqlLiterals {

    private SqlLiterals() {}

    public static String literal(Object value) {
        if (value == null) return "NULL";
        if (value instanceof Boolean b) return b ? "TRUE" : "FALSE";
        if (value instanceof Double d) return finite(d) ? BigDecimal.valueOf(d).stripTrailingZeros().toPlainString() : "NULL";
        if (value instanceof Float f) return finite(f) ? new BigDecimal(Float.toString(f)).stripTrailingZeros().toPlainString() : "NULL";
        if (value instanceof BigDecimal bd) return bd.toPlainString();
        if (value instanceof Number n) return n.toString();
        return quote(value.toString());
    }

    public static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    /**
     * Double-quoted identifier, embedded double quotes doubled.
     */
    public static String identifier(String name) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("identifier is empty");
        return '"' + name.replace("\"", "\"\"") + '"';
    }

    private static boolean finite(double d) {
        return !Double.isNaN(d) && !Double.isInfinite(d);
    }
}
