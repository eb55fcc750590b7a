/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.view;

import com.intuitivedesigns.billingkernel.error.QueryException;
import com.intuitivedesigns.billingkernel.query.QueryEngine;
import com.intuitivedesigns.billingkernel.query.SqlLiterals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Handle on a temporary view created by {@link BillingViews}. Closing drops the view.
 */
public final class BillingView implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BillingView.class);

    private final QueryEngine engine;
    private final String name;
    private final int rowCount;

    BillingView(QueryEngine engine, String name, int rowCount) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.name = Objects.requireNonNull(name, "name");
        this.rowCount = rowCount;
    }

    public String name() {
        return name;
    }

    /**
     * Quoted name, ready to be used in a FROM clause.
     */
    public String ref() {
        return SqlLiterals.identifier(name);
    }

    /**
     * Rows materialized, after the row cap.
     */
    public int rowCount() {
        return rowCount;
    }

    @Override
    public void close() {
        try {
            engine.query("DROP VIEW IF EXISTS " + ref());
        } catch (QueryException e) {
            log.warn("Failed to drop view {}: {}", name, e.getMessage());
        }
    }
}
