/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.plugins;

import com.intuitivedesigns.billingkernel.cache.CacheProvider;
import com.intuitivedesigns.billingkernel.cache.RedisCacheProvider;
import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.billingkernel.spi.CachePlugin;

/**
 * Durable categorized cache backed by Redis (redis.* keys).
 * <p>
 * ID: REDIS
 */
public final class RedisCachePlugin implements CachePlugin {

    public static final String ID = "REDIS";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public CacheProvider create(PipelineConfig config, MetricsRuntime metrics) {
        return RedisCacheProvider.fromConfig(config, metrics);
    }
}
