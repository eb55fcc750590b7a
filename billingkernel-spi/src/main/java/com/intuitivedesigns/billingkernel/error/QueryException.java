/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.error;

/**
 * Failure reported by the query engine adapter.
 */
public class QueryException extends PipelineException {

    private final String sql;

    public QueryException(String message, String sql, Throwable cause) {
        super(message, cause);
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }
}
