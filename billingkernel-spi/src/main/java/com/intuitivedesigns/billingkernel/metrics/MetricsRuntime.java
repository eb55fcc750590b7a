/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.metrics;

/**
 * The vendor-agnostic contract for pipeline observability.
 *
 * <p>Steps and cache providers record through this interface so the kernel runs unchanged
 * whether Micrometer is wired in or the NOOP fallback is active.</p>
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * Returns the underlying registry (e.g. a Micrometer MeterRegistry) for advanced usage.
     */
    Object registry();

    default boolean enabled() { return false; }

    default String type() { return "NOOP"; }

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void timer(String name, long durationMillis) {}

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // no-op by default
    }
}
