/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.core;

import com.intuitivedesigns.billingkernel.model.EnrichedDataset;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one run. Under continue-on-error a run with skipped steps still reports success;
 * callers check {@link ExecutionSummary#stepsSkipped()}.
 */
public record PipelineResult(boolean success, EnrichedDataset data, String error, ExecutionSummary summary) {

    public PipelineResult {
        Objects.requireNonNull(summary, "summary");
    }

    public static PipelineResult succeeded(EnrichedDataset data, ExecutionSummary summary) {
        return new PipelineResult(true, Objects.requireNonNull(data, "data"), null, summary);
    }

    public static PipelineResult failed(String error, ExecutionSummary summary) {
        return new PipelineResult(false, null, Objects.requireNonNull(error, "error"), summary);
    }

    public Optional<EnrichedDataset> dataOpt() {
        return Optional.ofNullable(data);
    }

    public Optional<String> errorOpt() {
        return Optional.ofNullable(error);
    }
}
