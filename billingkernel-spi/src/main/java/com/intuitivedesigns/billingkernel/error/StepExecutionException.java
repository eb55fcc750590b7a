/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.error;

/**
 * Any other failure raised inside a step, captured with the step's name and the original cause.
 */
public class StepExecutionException extends PipelineException {

    public StepExecutionException(String stepName, String message, Throwable cause) {
        super("Step '" + stepName + "' failed: " + message, stepName, cause);
    }

    public static StepExecutionException wrap(String stepName, Throwable cause) {
        String msg = cause.getMessage();
        if (msg == null || msg.isBlank()) {
            msg = cause.getClass().getSimpleName();
        }
        return new StepExecutionException(stepName, msg, cause);
    }
}
