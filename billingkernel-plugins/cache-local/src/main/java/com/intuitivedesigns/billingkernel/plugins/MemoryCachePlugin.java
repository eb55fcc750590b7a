/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.plugins;

import com.intuitivedesigns.billingkernel.cache.CacheProvider;
import com.intuitivedesigns.billingkernel.cache.InMemoryCacheProvider;
import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.billingkernel.spi.CachePlugin;

/**
 * Volatile in-process cache.
 * <p>
 * ID: MEMORY
 */
public final class MemoryCachePlugin implements CachePlugin {

    public static final String ID = "MEMORY";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public CacheProvider create(PipelineConfig config, MetricsRuntime metrics) {
        return InMemoryCacheProvider.fromConfig(config, metrics);
    }
}
