/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.cache;

import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.metrics.MetricsFactory;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Volatile, size-bounded cache.
 *
 * Characteristics:
 * - Insertion-ordered map guarded by a single lock
 * - Bounded: inserting a new key at capacity evicts the oldest-inserted entry
 * - Expiry checked on every read (lazy eviction) plus a background sweep on a fixed interval
 */
public final class InMemoryCacheProvider implements CacheProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheProvider.class);

    public static final String KEY_DEFAULT_TTL_MS = "cache.memory.default.ttl.ms";
    public static final String KEY_MAX_SIZE = "cache.memory.max.size";
    public static final String KEY_SWEEP_INTERVAL_MS = "cache.memory.sweep.interval.ms";

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_SIZE = 1000;
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(60);

    private static final long NEVER = Long.MAX_VALUE;

    private record Entry(Object value, long expiresAtMs) {
        boolean expired(long nowMs) {
            return nowMs >= expiresAtMs;
        }
    }

    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Duration defaultTtl;
    private final int maxSize;
    private final Clock clock;
    private final MetricsRuntime metrics;
    private final ScheduledExecutorService sweeper;

    public InMemoryCacheProvider() {
        this(DEFAULT_TTL, DEFAULT_MAX_SIZE, DEFAULT_SWEEP_INTERVAL, MetricsFactory.noop());
    }

    /**
     * @param sweepInterval zero disables the background sweep (reads still expire lazily)
     */
    public InMemoryCacheProvider(Duration defaultTtl, int maxSize, Duration sweepInterval, MetricsRuntime metrics) {
        this(defaultTtl, maxSize, sweepInterval, metrics, Clock.systemUTC());
    }

    InMemoryCacheProvider(Duration defaultTtl, int maxSize, Duration sweepInterval, MetricsRuntime metrics, Clock clock) {
        if (maxSize <= 0) throw new IllegalArgumentException("maxSize must be > 0");
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
        this.maxSize = maxSize;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");

        final long sweepMs = sweepInterval == null ? 0L : sweepInterval.toMillis();
        if (sweepMs > 0) {
            this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "memory-cache-sweeper");
                t.setDaemon(true);
                return t;
            });
            this.sweeper.scheduleAtFixedRate(this::sweepQuietly, sweepMs, sweepMs, TimeUnit.MILLISECONDS);
        } else {
            this.sweeper = null;
        }
    }

    public static InMemoryCacheProvider fromConfig(PipelineConfig config, MetricsRuntime metrics) {
        final Duration ttl = config.getDurationMs(KEY_DEFAULT_TTL_MS, DEFAULT_TTL);
        final int max = config.getInt(KEY_MAX_SIZE, DEFAULT_MAX_SIZE);
        final Duration sweep = config.getDurationMs(KEY_SWEEP_INTERVAL_MS, DEFAULT_SWEEP_INTERVAL);

        log.info("Memory cache active: maxSize={} defaultTtl={}ms sweep={}ms", max, ttl.toMillis(), sweep.toMillis());
        return new InMemoryCacheProvider(ttl, max, sweep, metrics);
    }

    @Override
    public Optional<Object> get(String key) {
        if (key == null) return Optional.empty();

        lock.lock();
        try {
            final Entry e = entries.get(key);
            if (e == null) {
                metrics.counter("cache.misses");
                return Optional.empty();
            }
            if (e.expired(clock.millis())) {
                entries.remove(key);
                metrics.counter("cache.misses");
                return Optional.empty();
            }
            metrics.counter("cache.hits");
            return Optional.of(e.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, Object value) {
        set(key, value, null);
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        final Duration effective = (ttl == null) ? defaultTtl : ttl;
        final long expiresAt = (effective.isZero() || effective.isNegative())
                ? NEVER
                : expiryFor(effective);

        lock.lock();
        try {
            if (!entries.containsKey(key) && entries.size() >= maxSize) {
                final Iterator<String> oldest = entries.keySet().iterator();
                final String evicted = oldest.next();
                oldest.remove();
                metrics.counter("cache.evictions");
                log.debug("Capacity {} reached; evicted oldest key '{}'", maxSize, evicted);
            }
            entries.put(key, new Entry(value, expiresAt));
        } finally {
            lock.unlock();
        }
    }

    // Saturates at NEVER so huge TTLs do not wrap into the past.
    private long expiryFor(Duration ttl) {
        try {
            return Math.addExact(clock.millis(), ttl.toMillis());
        } catch (ArithmeticException e) {
            return NEVER;
        }
    }

    @Override
    public void delete(String key) {
        if (key == null) return;
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
        log.debug("Memory cache cleared.");
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int sweep() {
        final long now = clock.millis();
        int removed = 0;
        lock.lock();
        try {
            final Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue().expired(now)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.debug("Sweep removed {} expired entries", removed);
        }
        return removed;
    }

    private void sweepQuietly() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // an escaping exception would cancel the scheduled task
            log.warn("Memory cache sweep failed", e);
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Counts entries and pushes {@code cache.entries} / {@code cache.entries.expired} gauges.
     */
    public LocalCacheStats stats() {
        final long now = clock.millis();
        lock.lock();
        try {
            int expired = 0;
            for (Entry e : entries.values()) {
                if (e.expired(now)) expired++;
            }
            final LocalCacheStats stats = new LocalCacheStats(entries.size(), entries.size() - expired, expired, maxSize);
            metrics.gauge("cache.entries", stats.totalEntries());
            metrics.gauge("cache.entries.expired", stats.expiredEntries());
            return stats;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
        clear();
    }

    /**
     * Entry counts at one instant; expired entries not yet swept are counted separately.
     */
    public record LocalCacheStats(int totalEntries, int activeEntries, int expiredEntries, int maxSize) {}
}
