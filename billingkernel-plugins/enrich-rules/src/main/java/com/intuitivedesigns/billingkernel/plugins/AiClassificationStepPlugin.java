/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.plugins;

import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.core.EnrichmentStep;
import com.intuitivedesigns.billingkernel.enrichment.EnrichmentSettings;
import com.intuitivedesigns.billingkernel.enrichment.classification.AiClassificationStep;
import com.intuitivedesigns.billingkernel.enrichment.classification.DefaultClassificationRules;
import com.intuitivedesigns.billingkernel.enrichment.rules.PatternCache;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.billingkernel.spi.StepPlugin;

/**
 * ID: AI_CLASSIFICATION
 */
public final class AiClassificationStepPlugin implements StepPlugin {

    public static final String ID = "AI_CLASSIFICATION";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public EnrichmentStep create(PipelineConfig config, MetricsRuntime metrics) {
        return new AiClassificationStep(EnrichmentSettings.fromConfig(config), DefaultClassificationRules.all(), new PatternCache(), metrics);
    }
}
