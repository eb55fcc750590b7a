/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.testing;

import com.intuitivedesigns.billingkernel.core.EnrichmentStep;
import com.intuitivedesigns.billingkernel.core.PipelineContext;
import com.intuitivedesigns.billingkernel.core.RunMetadata;
import com.intuitivedesigns.billingkernel.model.CloudProvider;
import com.intuitivedesigns.billingkernel.model.DataFormat;
import com.intuitivedesigns.billingkernel.model.EnrichedDataset;
import com.intuitivedesigns.billingkernel.model.EnrichmentKey;
import com.intuitivedesigns.billingkernel.model.RawDataset;
import com.intuitivedesigns.billingkernel.model.SourceInfo;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable steps for orchestrator tests. Each successful step appends its name to {@link #TRAIL}.
 */
public final class TestSteps {

    public static final EnrichmentKey<String> TRAIL = EnrichmentKey.of("trail", String.class);

    private TestSteps() {}

    public static RawDataset dataset() {
        return RawDataset.of(
                List.of(Map.of("ResourceId", "i-1", "BilledCost", 1.0)),
                SourceInfo.of(CloudProvider.AWS, DataFormat.FOCUS));
    }

    public static PipelineContext context() {
        return context(RunMetadata.empty());
    }

    public static PipelineContext context(RunMetadata metadata) {
        return context(metadata, "run-test");
    }

    public static PipelineContext context(String runId) {
        return context(RunMetadata.empty(), runId);
    }

    private static PipelineContext context(RunMetadata metadata, String runId) {
        return PipelineContext.builder()
                .queryEngine(sql -> List.of())
                .cache(new MapCategorizedCache())
                .metadata(metadata)
                .userId("user-1")
                .orgId("org-1")
                .runId(runId)
                .build();
    }

    public static ScriptedStep ok(String name, String... deps) {
        return new ScriptedStep(name, List.of(deps), Behavior.OK, Set.of());
    }

    public static ScriptedStep failing(String name, String... deps) {
        return new ScriptedStep(name, List.of(deps), Behavior.THROW, Set.of());
    }

    public static ScriptedStep invalid(String name, String... deps) {
        return new ScriptedStep(name, List.of(deps), Behavior.INVALID, Set.of());
    }

    public static ScriptedStep slow(String name, Duration delay, String... deps) {
        ScriptedStep step = new ScriptedStep(name, List.of(deps), Behavior.SLOW, Set.of());
        step.delay = delay;
        return step;
    }

    public static ScriptedStep requiring(String name, RunMetadata.Field... fields) {
        return new ScriptedStep(name, List.of(), Behavior.OK, Set.of(fields));
    }

    enum Behavior { OK, THROW, INVALID, SLOW }

    public static final class ScriptedStep implements EnrichmentStep {
        private final String name;
        private final List<String> dependencies;
        private final Behavior behavior;
        private final Set<RunMetadata.Field> required;
        private final AtomicInteger invocations = new AtomicInteger();
        private volatile Duration delay = Duration.ZERO;
        private volatile boolean interrupted;

        ScriptedStep(String name, List<String> dependencies, Behavior behavior, Set<RunMetadata.Field> required) {
            this.name = name;
            this.dependencies = dependencies;
            this.behavior = behavior;
            this.required = required;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String description() {
            return "scripted " + behavior.name().toLowerCase() + " step";
        }

        @Override
        public List<String> dependencies() {
            return dependencies;
        }

        @Override
        public Set<RunMetadata.Field> requiredMetadata() {
            return required;
        }

        @Override
        public EnrichedDataset execute(EnrichedDataset input, PipelineContext context) throws Exception {
            invocations.incrementAndGet();
            switch (behavior) {
                case THROW:
                    throw new IllegalStateException(name + " exploded");
                case SLOW:
                    try {
                        Thread.sleep(delay.toMillis());
                    } catch (InterruptedException e) {
                        interrupted = true;
                        throw e;
                    }
                    break;
                default:
                    break;
            }
            return input.attach(TRAIL, List.of(name));
        }

        @Override
        public boolean validate(EnrichedDataset output) {
            return behavior != Behavior.INVALID;
        }

        public int invocations() {
            return invocations.get();
        }

        public boolean wasInterrupted() {
            return interrupted;
        }
    }
}
