/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.query;

import java.util.List;
import java.util.Map;

/**
 * Handle to the embedded analytical query engine.
 *
 * <p>Must support temporary views over inlined literal rows and aggregate queries against them.
 * Failures surface as {@link com.intuitivedesigns.billingkernel.error.QueryException}.</p>
 */
public interface QueryEngine extends AutoCloseable {

    /**
     * Runs one statement. Rows are returned in engine order; each maps column label to value.
     * Statements without a result set return an empty list.
     */
    List<Map<String, Object>> query(String sql);

    @Override
    default void close() {
        // no-op by default
    }
}
