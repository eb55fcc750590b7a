/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.config;

import com.intuitivedesigns.billingkernel.cache.CacheProvider;
import com.intuitivedesigns.billingkernel.core.EnrichmentStep;
import com.intuitivedesigns.billingkernel.core.PipelineOrchestrator;
import com.intuitivedesigns.billingkernel.core.PipelineSettings;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.billingkernel.query.QueryEngine;
import com.intuitivedesigns.billingkernel.spi.CachePlugin;
import com.intuitivedesigns.billingkernel.spi.PipelinePlugin;
import com.intuitivedesigns.billingkernel.spi.PluginCatalog;
import com.intuitivedesigns.billingkernel.spi.QueryEnginePlugin;
import com.intuitivedesigns.billingkernel.spi.StepPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Assembles pipelines from configuration through the ServiceLoader plugin catalog.
 *
 * <ul>
 *   <li>{@code pipeline.steps}: comma separated step plugin ids, e.g. {@code virtual-tags, green-ops-co2}</li>
 *   <li>{@code cache.type}: cache plugin id (default {@code MEMORY})</li>
 *   <li>{@code query.engine.type}: query engine plugin id (default {@code DUCKDB})</li>
 * </ul>
 *
 * The caller owns every created component and closes it.
 */
public final class PipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    // Config keys
    public static final String KEY_STEPS = "pipeline.steps";
    public static final String KEY_CACHE_TYPE = "cache.type";
    public static final String KEY_QUERY_ENGINE_TYPE = "query.engine.type";

    // Defaults
    private static final String DEFAULT_CACHE = "MEMORY";
    private static final String DEFAULT_QUERY_ENGINE = "DUCKDB";

    private static final PluginCatalog CATALOG = new PluginCatalog(resolveClassLoader());

    private PipelineFactory() {}

    // --- FACTORY METHODS ---

    public static PipelineOrchestrator createOrchestrator(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final PipelineOrchestrator orchestrator = new PipelineOrchestrator(PipelineSettings.fromConfig(config), metrics);
        final List<String> ids = config.getList(KEY_STEPS);
        if (ids.isEmpty()) {
            log.warn("No steps configured ({} is empty)", KEY_STEPS);
        }
        for (String id : ids) {
            orchestrator.register(createStep(id, config, metrics));
        }
        return orchestrator;
    }

    public static EnrichmentStep createStep(String id, PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final StepPlugin plugin = CATALOG.steps().require(id, KEY_STEPS);
        return createSafe(plugin, config, metrics, "Step");
    }

    public static CacheProvider createCache(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = normalizeId(config.getString(KEY_CACHE_TYPE, DEFAULT_CACHE), DEFAULT_CACHE);
        final CachePlugin plugin = CATALOG.caches().require(id, KEY_CACHE_TYPE);
        return createSafe(plugin, config, metrics, "Cache");
    }

    public static QueryEngine createQueryEngine(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = normalizeId(config.getString(KEY_QUERY_ENGINE_TYPE, DEFAULT_QUERY_ENGINE), DEFAULT_QUERY_ENGINE);
        final QueryEnginePlugin plugin = CATALOG.queryEngines().require(id, KEY_QUERY_ENGINE_TYPE);
        return createSafe(plugin, config, metrics, "Query Engine");
    }

    // --- UTILITIES ---

    public static void logAvailablePlugins() {
        log.info("Plugin Catalog Loaded:");
        log.info("  Steps:          {}", CATALOG.steps().availableIds());
        log.info("  Caches:         {}", CATALOG.caches().availableIds());
        log.info("  Query Engines:  {}", CATALOG.queryEngines().availableIds());
    }

    public static PluginCatalog catalog() {
        return CATALOG;
    }

    private static String normalizeId(String raw, String fallback) {
        if (raw == null) return fallback;
        final String s = raw.trim();
        return s.isEmpty() ? fallback : s;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : PipelineFactory.class.getClassLoader();
    }

    private static <T> T createSafe(PipelinePlugin<T> plugin,
                                    PipelineConfig config,
                                    MetricsRuntime metrics,
                                    String typeName) {
        Objects.requireNonNull(plugin, "plugin");
        try {
            return plugin.create(config, metrics);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Failed creating " + typeName + " [" + plugin.id() + "]", e);
        }
    }
}
