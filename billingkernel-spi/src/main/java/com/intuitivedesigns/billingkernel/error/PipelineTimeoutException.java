/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.error;

import java.time.Duration;

/**
 * The run exceeded its configured maximum duration. Aborts regardless of the failure policy.
 */
public class PipelineTimeoutException extends PipelineException {

    private final Duration limit;

    public PipelineTimeoutException(String stepName, Duration limit) {
        super("Pipeline exceeded max duration of " + limit.toMillis() + " ms during step '" + stepName + "'",
                stepName, null);
        this.limit = limit;
    }

    public Duration limit() {
        return limit;
    }
}
