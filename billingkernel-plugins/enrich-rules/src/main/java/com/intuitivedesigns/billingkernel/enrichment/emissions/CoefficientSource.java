/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.emissions;

import com.intuitivedesigns.billingkernel.core.PipelineContext;

import java.util.List;

@FunctionalInterface
public interface CoefficientSource {

    List<Co2Coefficient> load(PipelineContext context) throws Exception;
}
