/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.core;

import com.intuitivedesigns.billingkernel.error.PipelineException;
import com.intuitivedesigns.billingkernel.model.EnrichedDataset;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of running a single step: either its output ({@link Completed}) or the failure it produced
 * ({@link Failed}). These are the only two implementations.
 */
public interface StepOutcome {

    String stepName();

    Duration elapsed();

    static StepOutcome completed(String stepName, EnrichedDataset output, Duration elapsed) {
        return new Completed(stepName, output, elapsed);
    }

    static StepOutcome failed(String stepName, PipelineException error, Duration elapsed) {
        return new Failed(stepName, error, elapsed);
    }

    record Completed(String stepName, EnrichedDataset output, Duration elapsed) implements StepOutcome {
        public Completed {
            Objects.requireNonNull(stepName, "stepName");
            Objects.requireNonNull(output, "output");
            Objects.requireNonNull(elapsed, "elapsed");
        }
    }

    record Failed(String stepName, PipelineException error, Duration elapsed) implements StepOutcome {
        public Failed {
            Objects.requireNonNull(stepName, "stepName");
            Objects.requireNonNull(error, "error");
            Objects.requireNonNull(elapsed, "elapsed");
        }
    }
}
