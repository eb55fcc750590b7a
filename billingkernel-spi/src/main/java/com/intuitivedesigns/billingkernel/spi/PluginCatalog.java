/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.spi;

/**
 * One registry per plugin kind, all scanned from the same ClassLoader.
 */
public final class PluginCatalog {

    private final ServicePluginRegistry<StepPlugin> steps;
    private final ServicePluginRegistry<CachePlugin> caches;
    private final ServicePluginRegistry<QueryEnginePlugin> queryEngines;

    public PluginCatalog(ClassLoader cl) {
        this.steps = new ServicePluginRegistry<>(StepPlugin.class, cl);
        this.caches = new ServicePluginRegistry<>(CachePlugin.class, cl);
        this.queryEngines = new ServicePluginRegistry<>(QueryEnginePlugin.class, cl);
    }

    public ServicePluginRegistry<StepPlugin> steps() {
        return steps;
    }

    public ServicePluginRegistry<CachePlugin> caches() {
        return caches;
    }

    public ServicePluginRegistry<QueryEnginePlugin> queryEngines() {
        return queryEngines;
    }
}
