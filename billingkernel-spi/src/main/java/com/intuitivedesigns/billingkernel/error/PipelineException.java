/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.error;

import java.util.Optional;

/**
 * Root of the pipeline error taxonomy. Unchecked; optionally names the step it originated from.
 */
public class PipelineException extends RuntimeException {

    private final String stepName;

    public PipelineException(String message) {
        this(message, null, null);
    }

    public PipelineException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public PipelineException(String message, String stepName, Throwable cause) {
        super(message, cause);
        this.stepName = stepName;
    }

    public Optional<String> stepName() {
        return Optional.ofNullable(stepName);
    }
}
