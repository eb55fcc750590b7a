/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.core;

import com.intuitivedesigns.billingkernel.config.PipelineConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Orchestrator tuning.
 *
 * @param continueOnError  skip failing steps instead of aborting the run
 * @param maxDuration      hard deadline for one run; {@link Duration#ZERO} means unbounded
 * @param profilingEnabled log per-step durations at INFO instead of DEBUG
 */
public record PipelineSettings(boolean continueOnError, Duration maxDuration, boolean profilingEnabled) {

    public static final String KEY_CONTINUE_ON_ERROR = "pipeline.continue.on.error";
    public static final String KEY_MAX_DURATION_MS = "pipeline.max.duration.ms";
    public static final String KEY_PROFILING = "pipeline.profiling.enabled";

    public PipelineSettings {
        Objects.requireNonNull(maxDuration, "maxDuration");
        if (maxDuration.isNegative()) {
            throw new IllegalArgumentException("maxDuration must be >= 0");
        }
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(false, Duration.ZERO, false);
    }

    public static PipelineSettings fromConfig(PipelineConfig config) {
        Objects.requireNonNull(config, "config");
        final long maxMs = Math.max(0L, config.getLong(KEY_MAX_DURATION_MS, 0L));
        return new PipelineSettings(
                config.getBoolean(KEY_CONTINUE_ON_ERROR, false),
                Duration.ofMillis(maxMs),
                config.getBoolean(KEY_PROFILING, false));
    }

    public boolean bounded() {
        return !maxDuration.isZero();
    }

    public PipelineSettings withContinueOnError(boolean value) {
        return new PipelineSettings(value, maxDuration, profilingEnabled);
    }

    public PipelineSettings withMaxDuration(Duration value) {
        return new PipelineSettings(continueOnError, value, profilingEnabled);
    }

    public PipelineSettings withProfiling(boolean value) {
        return new PipelineSettings(continueOnError, maxDuration, value);
    }
}
