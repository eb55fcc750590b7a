/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.core;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Run metadata returned with every result. {@code stepsExecuted} and {@code stepsSkipped} partition
 * the built execution order.
 */
public record ExecutionSummary(
        String runId,
        Duration duration,
        List<String> stepsExecuted,
        List<String> stepsSkipped,
        List<String> warnings
) {
    public ExecutionSummary {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(duration, "duration");
        stepsExecuted = List.copyOf(stepsExecuted);
        stepsSkipped = List.copyOf(stepsSkipped);
        warnings = List.copyOf(warnings);
    }

    public long durationMs() {
        return duration.toMillis();
    }
}
