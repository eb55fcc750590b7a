/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.tags;

import com.intuitivedesigns.billingkernel.core.PipelineContext;

import java.util.List;

/**
 * Where tag rules come from when they are not cached. Failures fail the step.
 */
@FunctionalInterface
public interface TagRuleSource {

    List<VirtualTagRule> load(PipelineContext context) throws Exception;
}
