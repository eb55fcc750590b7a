/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.spi;

import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.billingkernel.query.QueryEngine;

public interface QueryEnginePlugin extends PipelinePlugin<QueryEngine> {

    @Override
    default PluginKind kind() {
        return PluginKind.QUERY_ENGINE;
    }

    @Override
    QueryEngine create(PipelineConfig config, MetricsRuntime metrics);
}
