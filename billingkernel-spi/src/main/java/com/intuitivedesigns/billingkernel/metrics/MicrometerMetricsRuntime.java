/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer bridge for run, step, query and cache meters.
 *
 * <p>Backed by a composite registry holding a {@link SimpleMeterRegistry}, so counters, timers and
 * pushed cache gauges can be read back in-process after a run.</p>
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry = new CompositeMeterRegistry();

    // Gauge name -> raw bits of the last pushed double. Micrometer polls the holder.
    private final Map<String, AtomicLong> pushedGauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime() {
        this(Map.of());
    }

    public MicrometerMetricsRuntime(Map<String, String> commonTags) {
        registry.add(new SimpleMeterRegistry());
        if (commonTags == null || commonTags.isEmpty()) return;

        final List<Tag> tags = new ArrayList<>(commonTags.size());
        for (Map.Entry<String, String> tag : commonTags.entrySet()) {
            tags.add(Tag.of(tag.getKey(), tag.getValue()));
        }
        registry.config().commonTags(tags);
    }

    @Override
    public Object registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return "MICROMETER";
    }

    @Override
    public void counter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void counter(String name, double increment) {
        if (increment <= 0) return;
        registry.counter(name).increment(increment);
    }

    @Override
    public void timer(String name, long durationMillis) {
        registry.timer(name).record(Math.max(0L, durationMillis), TimeUnit.MILLISECONDS);
    }

    /**
     * Sets the current value of a gauge such as a cache entry count. The gauge is registered on the
     * first push; later pushes only replace the value.
     */
    @Override
    public void gauge(String name, double value) {
        final long bits = Double.doubleToLongBits(value);
        pushedGauges.computeIfAbsent(name, key -> {
            final AtomicLong holder = new AtomicLong(bits);
            Gauge.builder(key, holder, h -> Double.longBitsToDouble(h.get())).register(registry);
            return holder;
        }).set(bits);
    }

    // --- Read-back ---

    /**
     * Current count of a counter, 0 when it was never incremented.
     */
    public double count(String name) {
        final Counter c = registry.find(name).counter();
        return (c == null) ? 0.0 : c.count();
    }

    /**
     * Number of recordings of a timer, 0 when it was never recorded.
     */
    public long timerCount(String name) {
        final Timer t = registry.find(name).timer();
        return (t == null) ? 0L : t.count();
    }

    /**
     * Last pushed value of a gauge, {@code NaN} when nothing was pushed.
     */
    public double gaugeValue(String name) {
        final Gauge g = registry.find(name).gauge();
        return (g == null) ? Double.NaN : g.value();
    }

    @Override
    public void close() {
        registry.close();
        log.info("Metrics runtime closed");
    }
}
