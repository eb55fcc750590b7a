/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.view;

import java.util.Objects;
import java.util.function.Function;

/**
 * One column of a materialized view: its name, SQL type and how to read it from a source row.
 */
public record ViewColumn<R>(String name, ColumnType type, Function<? super R, ?> extractor) {

    public enum ColumnType {
        TEXT("VARCHAR"),
        NUMBER("DOUBLE");

        private final String sqlType;

        ColumnType(String sqlType) {
            this.sqlType = sqlType;
        }

        public String sqlType() {
            return sqlType;
        }
    }

    public ViewColumn {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(extractor, "extractor");
    }

    public static <R> ViewColumn<R> text(String name, Function<? super R, ?> extractor) {
        return new ViewColumn<>(name, ColumnType.TEXT, extractor);
    }

    public static <R> ViewColumn<R> number(String name, Function<? super R, ?> extractor) {
        return new ViewColumn<>(name, ColumnType.NUMBER, extractor);
    }
}
