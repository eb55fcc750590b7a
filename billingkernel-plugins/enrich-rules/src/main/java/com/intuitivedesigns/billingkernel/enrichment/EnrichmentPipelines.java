/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment;

import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.core.PipelineOrchestrator;
import com.intuitivedesigns.billingkernel.core.PipelineSettings;
import com.intuitivedesigns.billingkernel.enrichment.classification.AiClassificationStep;
import com.intuitivedesigns.billingkernel.enrichment.classification.DefaultClassificationRules;
import com.intuitivedesigns.billingkernel.enrichment.emissions.DefaultCoefficients;
import com.intuitivedesigns.billingkernel.enrichment.emissions.GreenOpsStep;
import com.intuitivedesigns.billingkernel.enrichment.rules.PatternCache;
import com.intuitivedesigns.billingkernel.enrichment.tags.DefaultTagRules;
import com.intuitivedesigns.billingkernel.enrichment.tags.VirtualTagsStep;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Ready-made orchestrators over the standard steps.
 */
public final class EnrichmentPipelines {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentPipelines.class);

    private EnrichmentPipelines() {}

    /**
     * Virtual tags, CO2 estimation and AI classification with the built-in rule sets. A failing step
     * is skipped rather than aborting the run.
     */
    public static PipelineOrchestrator full(PipelineSettings settings, PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final EnrichmentSettings enrichment = EnrichmentSettings.fromConfig(config);
        final PatternCache patterns = new PatternCache();

        final PipelineOrchestrator orchestrator = new PipelineOrchestrator(settings.withContinueOnError(true), metrics)
                .register(new VirtualTagsStep(enrichment, DefaultTagRules.source(), patterns, metrics))
                .register(new GreenOpsStep(enrichment, DefaultCoefficients.source(), metrics))
                .register(new AiClassificationStep(enrichment, DefaultClassificationRules.all(), patterns, metrics));

        log.info("Full enrichment pipeline assembled: {}", orchestrator.build());
        return orchestrator;
    }

    public static PipelineOrchestrator full(PipelineConfig config, MetricsRuntime metrics) {
        return full(PipelineSettings.fromConfig(config), config, metrics);
    }
}
