/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.plugins;

import com.intuitivedesigns.billingkernel.cache.CacheProvider;
import com.intuitivedesigns.billingkernel.cache.InMemoryCacheProvider;
import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.metrics.MetricsFactory;
import com.intuitivedesigns.billingkernel.spi.CachePlugin;
import com.intuitivedesigns.billingkernel.spi.ServicePluginRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryCachePluginTest {

    @Test
    void serviceLoader_shouldDiscoverMemoryPlugin() {
        ServicePluginRegistry<CachePlugin> registry = new ServicePluginRegistry<>(CachePlugin.class);

        assertTrue(registry.availableIds().contains(MemoryCachePlugin.ID));
    }

    @Test
    void create_shouldApplyConfiguredCapacity() {
        PipelineConfig config = PipelineConfig.fromMap(Map.of(
                InMemoryCacheProvider.KEY_MAX_SIZE, "2",
                InMemoryCacheProvider.KEY_SWEEP_INTERVAL_MS, "0"));

        try (CacheProvider cache = new MemoryCachePlugin().create(config, MetricsFactory.noop())) {
            InMemoryCacheProvider memory = assertInstanceOf(InMemoryCacheProvider.class, cache);
            assertEquals(2, memory.stats().maxSize());
        }
    }
}
