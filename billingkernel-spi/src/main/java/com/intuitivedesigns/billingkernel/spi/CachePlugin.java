/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.spi;

import com.intuitivedesigns.billingkernel.cache.CacheProvider;
import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;

/**
 * SPI Factory for creating cache providers. The caller owns (and closes) the returned instance.
 */
public interface CachePlugin extends PipelinePlugin<CacheProvider> {

    @Override
    default PluginKind kind() {
        return PluginKind.CACHE;
    }

    @Override
    CacheProvider create(PipelineConfig config, MetricsRuntime metrics);
}
