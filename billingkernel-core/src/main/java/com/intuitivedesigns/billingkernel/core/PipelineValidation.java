/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.core;

import java.util.List;

/**
 * Administrative check of a registry. Never thrown; {@code errors} holds human-readable problems.
 */
public record PipelineValidation(boolean valid, List<String> errors) {

    public PipelineValidation {
        errors = List.copyOf(errors);
    }

    static PipelineValidation of(List<String> errors) {
        return new PipelineValidation(errors.isEmpty(), errors);
    }
}
