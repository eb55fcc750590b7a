/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.plugins;

import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.billingkernel.query.DuckDbQueryEngine;
import com.intuitivedesigns.billingkernel.query.QueryEngine;
import com.intuitivedesigns.billingkernel.spi.QueryEnginePlugin;

/**
 * ID: DUCKDB
 */
public final class DuckDbQueryEnginePlugin implements QueryEnginePlugin {

    public static final String ID = "DUCKDB";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public QueryEngine create(PipelineConfig config, MetricsRuntime metrics) {
        return DuckDbQueryEngine.fromConfig(config, metrics);
    }
}
