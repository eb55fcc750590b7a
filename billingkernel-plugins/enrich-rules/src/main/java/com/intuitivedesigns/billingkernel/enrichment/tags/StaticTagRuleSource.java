/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.tags;

import com.intuitivedesigns.billingkernel.core.PipelineContext;

import java.util.List;

/**
 * Fixed rule list, independent of the run.
 */
public final class StaticTagRuleSource implements TagRuleSource {

    private final List<VirtualTagRule> rules;

    public StaticTagRuleSource(List<VirtualTagRule> rules) {
        this.rules = List.copyOf(rules);
    }

    @Override
    public List<VirtualTagRule> load(PipelineContext context) {
        return rules;
    }
}
