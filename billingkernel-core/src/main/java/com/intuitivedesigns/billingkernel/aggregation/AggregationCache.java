/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.aggregation;

import com.intuitivedesigns.billingkernel.cache.CacheStats;
import com.intuitivedesigns.billingkernel.cache.CategorizedCacheProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Typed facade over a categorized cache for dashboard aggregations.
 *
 * <p>Keys are {@code <category>:<k1>=<v1>&<k2>=<v2>} with parameters sorted by name, so the same
 * query always maps to the same entry. Each aggregation kind is stored under its own category and
 * TTL (see {@link AggregationType}). Constructed and owned by the caller.</p>
 */
public final class AggregationCache {

    private static final Logger log = LoggerFactory.getLogger(AggregationCache.class);

    public static final String KPI_KEY = "kpi:latest";
    public static final String CUSTOM_CATEGORY = "custom";
    public static final int DEFAULT_RESOURCE_LIMIT = 100;

    private final CategorizedCacheProvider cache;

    public AggregationCache(CategorizedCacheProvider cache) {
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    static String cacheKey(String type, Map<String, ?> params) {
        if (params == null || params.isEmpty()) return type;
        final StringJoiner joiner = new StringJoiner("&");
        new TreeMap<>(params).forEach((k, v) -> joiner.add(k + "=" + v));
        return type + ":" + joiner;
    }

    private static String rangeKey(AggregationType type, LocalDate start, LocalDate end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        return cacheKey(type.category(), Map.of("start", start, "end", end));
    }

    // --- Daily costs ---

    public Optional<List<CachedDailyCosts>> getDailyCosts(LocalDate start, LocalDate end) {
        return getList(rangeKey(AggregationType.DAILY_COSTS, start, end));
    }

    public void setDailyCosts(LocalDate start, LocalDate end, List<CachedDailyCosts> data) {
        putList(rangeKey(AggregationType.DAILY_COSTS, start, end), data, AggregationType.DAILY_COSTS);
    }

    // --- Monthly summary ---

    public Optional<List<CachedMonthlySummary>> getMonthlySummary(int year) {
        return getList(cacheKey(AggregationType.MONTHLY_COSTS.category(), Map.of("year", year)));
    }

    public void setMonthlySummary(int year, List<CachedMonthlySummary> data) {
        putList(cacheKey(AggregationType.MONTHLY_COSTS.category(), Map.of("year", year)), data,
                AggregationType.MONTHLY_COSTS);
    }

    // --- Service breakdown ---

    public Optional<List<CachedServiceBreakdown>> getServiceBreakdown(LocalDate start, LocalDate end) {
        return getList(rangeKey(AggregationType.SERVICE_BREAKDOWN, start, end));
    }

    public void setServiceBreakdown(LocalDate start, LocalDate end, List<CachedServiceBreakdown> data) {
        putList(rangeKey(AggregationType.SERVICE_BREAKDOWN, start, end), data, AggregationType.SERVICE_BREAKDOWN);
    }

    // --- Resource costs ---

    public Optional<List<CachedResourceCost>> getResourceCosts() {
        return getResourceCosts(DEFAULT_RESOURCE_LIMIT);
    }

    public Optional<List<CachedResourceCost>> getResourceCosts(int limit) {
        return getList(cacheKey(AggregationType.RESOURCE_COSTS.category(), Map.of("limit", limit)));
    }

    public void setResourceCosts(List<CachedResourceCost> data) {
        setResourceCosts(data, DEFAULT_RESOURCE_LIMIT);
    }

    public void setResourceCosts(List<CachedResourceCost> data, int limit) {
        putList(cacheKey(AggregationType.RESOURCE_COSTS.category(), Map.of("limit", limit)), data,
                AggregationType.RESOURCE_COSTS);
    }

    // --- Anomalies ---

    public Optional<List<CachedAnomaly>> getAnomalies(LocalDate start, LocalDate end) {
        return getList(rangeKey(AggregationType.ANOMALIES, start, end));
    }

    public void setAnomalies(LocalDate start, LocalDate end, List<CachedAnomaly> data) {
        putList(rangeKey(AggregationType.ANOMALIES, start, end), data, AggregationType.ANOMALIES);
    }

    // --- KPIs ---

    public Optional<CachedKpis> getKpis() {
        return cache.get(KPI_KEY, CachedKpis.class);
    }

    public void setKpis(CachedKpis data) {
        Objects.requireNonNull(data, "data");
        cache.set(KPI_KEY, data, AggregationType.KPI.ttl(), AggregationType.KPI.category());
        log.debug("Cached KPIs");
    }

    // --- Custom entries ---

    public <T> Optional<T> getCustom(String key, Class<T> type) {
        return cache.get(key, type);
    }

    /**
     * Stores under category {@code custom} with the provider's default TTL.
     */
    public void setCustom(String key, Object value) {
        setCustom(key, value, null, CUSTOM_CATEGORY);
    }

    public void setCustom(String key, Object value, Duration ttl) {
        setCustom(key, value, ttl, CUSTOM_CATEGORY);
    }

    public void setCustom(String key, Object value, Duration ttl, String category) {
        cache.set(key, value, ttl, category);
    }

    // --- Management ---

    public void invalidateType(AggregationType type) {
        cache.clearByType(type.category());
        log.info("Invalidated all '{}' cache entries", type.category());
    }

    /**
     * Drops every aggregation category and the default custom category. Entries other components
     * keep in the same cache, and custom entries stored under their own category, are left alone.
     */
    public void invalidateAll() {
        for (AggregationType type : AggregationType.values()) {
            cache.clearByType(type.category());
        }
        cache.clearByType(CUSTOM_CATEGORY);
        log.info("Aggregation cache cleared");
    }

    public int cleanup() {
        return cache.cleanup();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    @SuppressWarnings("unchecked")
    private <T> Optional<List<T>> getList(String key) {
        return cache.get(key, List.class).map(list -> (List<T>) list);
    }

    private void putList(String key, List<?> data, AggregationType type) {
        Objects.requireNonNull(data, "data");
        cache.set(key, List.copyOf(data), type.ttl(), type.category());
        log.debug("Cached {} {} entries under {}", data.size(), type.category(), key);
    }
}
