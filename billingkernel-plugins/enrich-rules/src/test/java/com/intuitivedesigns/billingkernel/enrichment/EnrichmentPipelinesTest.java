/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment;

import com.intuitivedesigns.billingkernel.cache.CacheProvider;
import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.config.PipelineFactory;
import com.intuitivedesigns.billingkernel.core.PipelineContext;
import com.intuitivedesigns.billingkernel.core.PipelineOrchestrator;
import com.intuitivedesigns.billingkernel.core.PipelineResult;
import com.intuitivedesigns.billingkernel.core.PipelineSettings;
import com.intuitivedesigns.billingkernel.enrichment.classification.AiClassificationStep;
import com.intuitivedesigns.billingkernel.enrichment.classification.DefaultClassificationRules;
import com.intuitivedesigns.billingkernel.enrichment.emissions.DefaultCoefficients;
import com.intuitivedesigns.billingkernel.enrichment.emissions.GreenOpsStep;
import com.intuitivedesigns.billingkernel.enrichment.rules.PatternCache;
import com.intuitivedesigns.billingkernel.enrichment.tags.VirtualTagsStep;
import com.intuitivedesigns.billingkernel.metrics.MetricsFactory;
import com.intuitivedesigns.billingkernel.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.billingkernel.model.EnrichedDataset;
import com.intuitivedesigns.billingkernel.model.EnrichmentKey;
import com.intuitivedesigns.billingkernel.query.QueryEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.intuitivedesigns.billingkernel.enrichment.EnrichmentFixtures.billing;
import static com.intuitivedesigns.billingkernel.enrichment.EnrichmentFixtures.context;
import static com.intuitivedesigns.billingkernel.enrichment.EnrichmentFixtures.dataset;
import static org.junit.jupiter.api.Assertions.*;

class EnrichmentPipelinesTest {

    private static final PipelineConfig CONFIG = PipelineConfig.fromMap(Map.of(
            "pipeline.steps", "ai-classification, green-ops-co2, virtual-tags",
            "cache.type", "memory",
            "query.engine.type", "duckdb",
            "enrichment.max.rows", "500"));

    private QueryEngine engine;
    private CacheProvider cache;
    private PipelineContext context;

    @BeforeEach
    void setUp() {
        engine = PipelineFactory.createQueryEngine(CONFIG, MetricsFactory.noop());
        cache = PipelineFactory.createCache(CONFIG, MetricsFactory.noop());
        context = context(engine, cache);
    }

    @AfterEach
    void tearDown() throws Exception {
        cache.close();
        engine.close();
    }

    private static EnrichedDataset sample() {
        return dataset(
                billing("i-dev", "dev-sandbox", "us-east-1", 12.0),
                billing("i-ec2", "Amazon Elastic Compute Cloud", "us-east-1", 100.0),
                billing("llm", "Amazon Bedrock", "us-east-1", 30.0));
    }

    @Test
    void full_shouldRunAllStandardStepsInDependencyOrder() {
        MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime();
        try (PipelineOrchestrator orchestrator = EnrichmentPipelines.full(PipelineSettings.defaults(), CONFIG, metrics)) {
            assertTrue(orchestrator.settings().continueOnError());

            PipelineResult result = orchestrator.execute(sample().raw(), context);

            assertTrue(result.success(), () -> result.error());
            assertEquals(List.of(VirtualTagsStep.NAME, GreenOpsStep.NAME, AiClassificationStep.NAME),
                    result.summary().stepsExecuted());
            assertTrue(result.summary().stepsSkipped().isEmpty());

            EnrichedDataset data = result.data();
            assertEquals(1, data.get(EnrichmentKey.VIRTUAL_TAGS).orElseThrow().size());
            assertEquals(3, data.get(EnrichmentKey.CO2_ESTIMATES).orElseThrow().size());
            assertEquals("llm", data.get(EnrichmentKey.AI_CLASSIFICATIONS).orElseThrow().get(0).resourceId());
            assertEquals(3.0, metrics.count("bk.step.completed"), 1e-9);
        }
    }

    @Test
    void failingTagStep_shouldBeSkippedWhileOthersStillRun() {
        EnrichmentSettings settings = EnrichmentSettings.defaults();
        PatternCache patterns = new PatternCache();
        try (PipelineOrchestrator orchestrator = new PipelineOrchestrator(
                PipelineSettings.defaults().withContinueOnError(true), MetricsFactory.noop())) {
            orchestrator
                    .register(new VirtualTagsStep(settings, ctx -> {
                        throw new IllegalStateException("rule store unavailable");
                    }, patterns, MetricsFactory.noop()))
                    .register(new GreenOpsStep(settings, DefaultCoefficients.source(), MetricsFactory.noop()))
                    .register(new AiClassificationStep(settings, DefaultClassificationRules.all(), patterns, MetricsFactory.noop()));

            PipelineResult result = orchestrator.execute(sample().raw(), context);

            assertTrue(result.success());
            assertEquals(List.of(VirtualTagsStep.NAME), result.summary().stepsSkipped());
            assertEquals(List.of(GreenOpsStep.NAME, AiClassificationStep.NAME), result.summary().stepsExecuted());
            assertEquals(1, result.summary().warnings().size());
            assertTrue(result.summary().warnings().get(0).contains("rule store unavailable"));
            assertFalse(result.data().has(EnrichmentKey.VIRTUAL_TAGS));
            assertTrue(result.data().has(EnrichmentKey.CO2_ESTIMATES));
        }
    }

    @Test
    void factory_shouldAssembleStepsFromConfiguredPluginIds() {
        try (PipelineOrchestrator orchestrator = PipelineFactory.createOrchestrator(CONFIG, MetricsFactory.noop())) {
            // dependencies first, then registration order
            assertEquals(List.of(VirtualTagsStep.NAME, AiClassificationStep.NAME, GreenOpsStep.NAME),
                    orchestrator.build());
            assertTrue(orchestrator.validate().valid());

            PipelineResult result = orchestrator.execute(sample().raw(), context);

            assertTrue(result.success(), () -> result.error());
            assertEquals(3, result.summary().stepsExecuted().size());
            assertTrue(result.data().has(EnrichmentKey.AI_CLASSIFICATIONS));
        }
    }

    @Test
    void catalog_shouldExposeStandardStepIds() {
        assertTrue(PipelineFactory.catalog().steps().availableIds()
                .containsAll(List.of("VIRTUAL_TAGS", "GREEN_OPS_CO2", "AI_CLASSIFICATION")));
    }
}
