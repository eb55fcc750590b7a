/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.spi;

import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.core.EnrichmentStep;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;

/**
 * SPI Factory for enrichment steps. Third-party steps register here under
 * {@code META-INF/services/com.intuitivedesigns.billingkernel.spi.StepPlugin}.
 */
public interface StepPlugin extends PipelinePlugin<EnrichmentStep> {

    @Override
    default PluginKind kind() {
        return PluginKind.STEP;
    }

    @Override
    EnrichmentStep create(PipelineConfig config, MetricsRuntime metrics);
}
