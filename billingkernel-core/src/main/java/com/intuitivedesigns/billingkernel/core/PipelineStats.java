/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.core;

import java.util.List;

public record PipelineStats(int totalSteps, List<String> executionOrder, List<StepInfo> steps) {

    public PipelineStats {
        executionOrder = List.copyOf(executionOrder);
        steps = List.copyOf(steps);
    }

    public record StepInfo(String name, String description, List<String> dependencies) {
        public StepInfo {
            dependencies = List.copyOf(dependencies);
        }
    }
}
