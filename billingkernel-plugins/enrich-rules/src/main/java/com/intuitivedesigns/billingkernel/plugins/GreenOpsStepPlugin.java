/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.plugins;

import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.core.EnrichmentStep;
import com.intuitivedesigns.billingkernel.enrichment.EnrichmentSettings;
import com.intuitivedesigns.billingkernel.enrichment.emissions.GreenOpsStep;
import com.intuitivedesigns.billingkernel.enrichment.emissions.DefaultCoefficients;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.billingkernel.spi.StepPlugin;

/**
 * ID: GREEN_OPS_CO2
 */
public final class GreenOpsStepPlugin implements StepPlugin {

    public static final String ID = "GREEN_OPS_CO2";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public EnrichmentStep create(PipelineConfig config, MetricsRuntime metrics) {
        return new GreenOpsStep(EnrichmentSettings.fromConfig(config), DefaultCoefficients.source(), metrics);
    }
}
