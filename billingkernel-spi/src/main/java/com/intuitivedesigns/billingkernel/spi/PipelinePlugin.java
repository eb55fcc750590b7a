/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.spi;

import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;

/**
 * Base contract of every ServiceLoader-discovered component.
 *
 * @param <T> the component this plugin creates
 */
public interface PipelinePlugin<T> {

    /**
     * @return The unique ID of this plugin implementation (e.g., 'MEMORY', 'DUCKDB').
     */
    String id();

    PluginKind kind();

    T create(PipelineConfig config, MetricsRuntime metrics);
}
