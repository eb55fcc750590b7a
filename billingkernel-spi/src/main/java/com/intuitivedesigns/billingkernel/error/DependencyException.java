/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.error;

import java.util.List;

/**
 * Raised while building the execution order: a dependency is not registered, or the graph has a cycle.
 * Always fatal to the run.
 */
public class DependencyException extends PipelineException {

    private final List<String> missing;

    public DependencyException(String message, String stepName, List<String> missing) {
        super(message, stepName, null);
        this.missing = (missing == null) ? List.of() : List.copyOf(missing);
    }

    public static DependencyException missing(String stepName, List<String> missing) {
        return new DependencyException(
                "Step '" + stepName + "' depends on unregistered step(s): " + String.join(", ", missing),
                stepName, missing);
    }

    public static DependencyException cycle(String stepName) {
        return new DependencyException("Circular dependency detected at step '" + stepName + "'", stepName, List.of());
    }

    /**
     * Names of unregistered dependencies; empty for a cycle.
     */
    public List<String> missingDependencies() {
        return missing;
    }
}
