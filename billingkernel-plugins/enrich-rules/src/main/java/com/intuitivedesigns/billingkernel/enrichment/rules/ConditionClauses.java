/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.rules;

import com.intuitivedesigns.billingkernel.query.SqlLiterals;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Translates a {@link RuleCondition} into a SQL predicate.
 *
 * <ul>
 *   <li>{@code EQUALS}: {@code "col" = 'v'}</li>
 *   <li>{@code CONTAINS}: {@code contains("col", 'v')}</li>
 *   <li>{@code STARTS_WITH}: {@code starts_with("col", 'v')}</li>
 *   <li>{@code IN}: {@code "col" IN ('a', 'b')}</li>
 *   <li>{@code REGEX}: {@code regexp_matches("col", 'p')}, the pattern is checked against the
 *       engine's regex dialect first</li>
 * </ul>
 *
 * Substring operators use string functions rather than {@code LIKE} so {@code %} and {@code _} in
 * values are matched literally.
 */
public final class ConditionClauses {

    private final PatternCache patterns;

    public ConditionClauses(PatternCache patterns) {
        this.patterns = Objects.requireNonNull(patterns, "patterns");
    }

    public String where(RuleCondition condition) {
        Objects.requireNonNull(condition, "condition");
        final String column = SqlLiterals.identifier(condition.column());
        final List<String> values = condition.values();

        if (condition.operator() == ConditionOperator.IN) {
            final StringJoiner in = new StringJoiner(", ", column + " IN (", ")");
            for (String v : values) {
                in.add(SqlLiterals.quote(v));
            }
            return in.toString();
        }

        final StringJoiner any = new StringJoiner(" OR ", values.size() > 1 ? "(" : "", values.size() > 1 ? ")" : "");
        for (String v : values) {
            any.add(single(condition.operator(), column, v));
        }
        return any.toString();
    }

    private String single(ConditionOperator operator, String column, String value) {
        final String literal = SqlLiterals.quote(value);
        switch (operator) {
            case EQUALS:
                return column + " = " + literal;
            case CONTAINS:
                return "contains(" + column + ", " + literal + ")";
            case STARTS_WITH:
                return "starts_with(" + column + ", " + literal + ")";
            case REGEX:
                patterns.compileForEngine(value);
                return "regexp_matches(" + column + ", " + literal + ")";
            default:
                throw new IllegalArgumentException("Unsupported operator: " + operator);
        }
    }
}
