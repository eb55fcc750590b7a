/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.plugins;

import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.core.EnrichmentStep;
import com.intuitivedesigns.billingkernel.enrichment.EnrichmentSettings;
import com.intuitivedesigns.billingkernel.enrichment.tags.VirtualTagsStep;
import com.intuitivedesigns.billingkernel.enrichment.tags.DefaultTagRules;
import com.intuitivedesigns.billingkernel.enrichment.rules.PatternCache;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.billingkernel.spi.StepPlugin;

/**
 * ID: VIRTUAL_TAGS
 */
public final class VirtualTagsStepPlugin implements StepPlugin {

    public static final String ID = "VIRTUAL_TAGS";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public EnrichmentStep create(PipelineConfig config, MetricsRuntime metrics) {
        return new VirtualTagsStep(EnrichmentSettings.fromConfig(config), DefaultTagRules.source(), new PatternCache(), metrics);
    }
}
