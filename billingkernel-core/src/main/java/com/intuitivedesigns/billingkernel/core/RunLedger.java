/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.core;

import com.intuitivedesigns.billingkernel.error.PipelineTimeoutException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Folds the step outcomes of one run into executed/skipped/warnings.
 *
 * <p>Every step of the order ends up in exactly one of the two lists once the run has either
 * completed or been closed with {@link #skipRemaining(int)}. One instance per run.</p>
 */
final class RunLedger {

    private final List<String> order;
    private final List<String> executed = new ArrayList<>();
    private final List<String> skipped = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    RunLedger(List<String> order) {
        this.order = order;
    }

    /**
     * @return true if the run may proceed to the next step
     */
    boolean record(StepOutcome outcome, boolean continueOnError) {
        if (outcome instanceof StepOutcome.Completed) {
            executed.add(outcome.stepName());
            return true;
        }

        final StepOutcome.Failed failed = (StepOutcome.Failed) outcome;
        skipped.add(failed.stepName());

        if (continueOnError && !(failed.error() instanceof PipelineTimeoutException)) {
            warnings.add(failed.error().getMessage() + " (step skipped)");
            return true;
        }
        return false;
    }

    /**
     * Marks every step from {@code fromIndex} on as skipped.
     */
    void skipRemaining(int fromIndex) {
        for (int i = fromIndex; i < order.size(); i++) {
            skipped.add(order.get(i));
        }
    }

    ExecutionSummary summary(String runId, Duration elapsed) {
        return new ExecutionSummary(runId, elapsed, executed, skipped, warnings);
    }
}
