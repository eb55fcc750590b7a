/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.error;

/**
 * A step's own validation rejected its output.
 */
public class ValidationException extends PipelineException {

    public ValidationException(String stepName) {
        super("Step '" + stepName + "' failed output validation", stepName, null);
    }
}
