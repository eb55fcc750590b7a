/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.core;

import com.intuitivedesigns.billingkernel.error.DependencyException;
import com.intuitivedesigns.billingkernel.error.PipelineException;
import com.intuitivedesigns.billingkernel.error.PipelineTimeoutException;
import com.intuitivedesigns.billingkernel.error.StepExecutionException;
import com.intuitivedesigns.billingkernel.error.ValidationException;
import com.intuitivedesigns.billingkernel.metrics.MetricsFactory;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.billingkernel.model.EnrichedDataset;
import com.intuitivedesigns.billingkernel.model.RawDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Registers enrichment steps, orders them by dependency and runs them one at a time.
 *
 * <p>Each run threads a single {@link EnrichedDataset} through the execution order. A failing step
 * either aborts the run (default) or, with {@code continueOnError}, is recorded as skipped and the
 * previous dataset is passed on unchanged. A configured max duration is enforced as a hard deadline:
 * steps then run on a worker thread owned by that run and are cancelled when the budget is spent.</p>
 *
 * <p>Registration and building are synchronized; a run works on a snapshot of the registry taken when
 * it starts. Concurrent runs never share a worker, so one run's steps do not queue behind another's.</p>
 */
public final class PipelineOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private static final long NO_DEADLINE = Long.MIN_VALUE;

    private final PipelineSettings settings;
    private final MetricsRuntime metrics;

    private final Map<String, EnrichmentStep> steps = new LinkedHashMap<>();
    private List<String> executionOrder; // null until built, reset on register

    // Workers of in-flight bounded runs, shut down by close().
    private final Set<ExecutorService> activeWorkers = ConcurrentHashMap.newKeySet();

    public PipelineOrchestrator() {
        this(PipelineSettings.defaults(), MetricsFactory.noop());
    }

    public PipelineOrchestrator(PipelineSettings settings) {
        this(settings, MetricsFactory.noop());
    }

    public PipelineOrchestrator(PipelineSettings settings, MetricsRuntime metrics) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public PipelineSettings settings() {
        return settings;
    }

    // --- Registry ---

    /**
     * Adds a step keyed by name. Re-registering a name replaces the earlier step and invalidates the
     * computed order.
     */
    public synchronized PipelineOrchestrator register(EnrichmentStep step) {
        Objects.requireNonNull(step, "step");
        final String name = step.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Step name must not be blank: " + step.getClass().getName());
        }

        final EnrichmentStep previous = steps.put(name, step);
        if (previous != null && previous != step) {
            log.warn("Step '{}' re-registered; replacing {} with {}",
                    name, previous.getClass().getName(), step.getClass().getName());
        }
        executionOrder = null;
        return this;
    }

    public synchronized boolean isRegistered(String name) {
        return steps.containsKey(name);
    }

    /**
     * Computes (or returns the cached) execution order.
     *
     * @throws DependencyException on an unregistered dependency or a cycle
     */
    public synchronized List<String> build() {
        if (executionOrder == null) {
            executionOrder = ExecutionPlanner.plan(steps);
            log.debug("Execution order built: {}", executionOrder);
        }
        return executionOrder;
    }

    // --- Execution ---

    public PipelineResult execute(RawDataset raw, PipelineContext context) {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(context, "context");

        final long startNanos = System.nanoTime();
        final String runId = context.runId();
        metrics.counter("bk.pipeline.runs");

        final List<String> order;
        final Map<String, EnrichmentStep> snapshot;
        synchronized (this) {
            snapshot = new LinkedHashMap<>(steps);
            try {
                order = build();
            } catch (DependencyException e) {
                log.error("Run {} aborted before any step ran: {}", runId, e.getMessage());
                metrics.counter("bk.pipeline.failures");
                final RunLedger ledger = new RunLedger(List.copyOf(snapshot.keySet()));
                ledger.skipRemaining(0);
                return PipelineResult.failed(e.getMessage(), ledger.summary(runId, elapsedSince(startNanos)));
            }
        }

        final long deadline = settings.bounded()
                ? startNanos + settings.maxDuration().toNanos()
                : NO_DEADLINE;

        log.info("Run {} started: {} step(s) {}", runId, order.size(), order);

        final ExecutorService worker = (deadline == NO_DEADLINE) ? null : openWorker(runId);
        try {
            return run(order, snapshot, raw, context, deadline, worker, startNanos);
        } finally {
            if (worker != null) closeWorker(worker);
        }
    }

    private PipelineResult run(List<String> order,
                               Map<String, EnrichmentStep> snapshot,
                               RawDataset raw,
                               PipelineContext context,
                               long deadline,
                               ExecutorService worker,
                               long startNanos) {
        final String runId = context.runId();
        final RunLedger ledger = new RunLedger(order);
        EnrichedDataset current = EnrichedDataset.from(raw);

        for (int i = 0; i < order.size(); i++) {
            final EnrichmentStep step = snapshot.get(order.get(i));
            final StepOutcome outcome = runStep(step, current, context, deadline, worker);
            record(outcome);

            final boolean proceed = ledger.record(outcome, settings.continueOnError());
            if (outcome instanceof StepOutcome.Completed completed) {
                current = completed.output();
                continue;
            }

            final PipelineException error = ((StepOutcome.Failed) outcome).error();
            if (proceed) {
                log.warn("Run {}: step '{}' failed, continuing: {}", runId, step.name(), error.getMessage(), error);
                continue;
            }

            ledger.skipRemaining(i + 1);
            final Duration elapsed = elapsedSince(startNanos);
            metrics.counter("bk.pipeline.failures");
            metrics.timer("bk.pipeline.duration", elapsed.toMillis());
            log.error("Run {} aborted at step '{}' after {} ms: {}", runId, step.name(), elapsed.toMillis(),
                    error.getMessage(), error);
            return PipelineResult.failed(error.getMessage(), ledger.summary(runId, elapsed));
        }

        final Duration elapsed = elapsedSince(startNanos);
        final ExecutionSummary summary = ledger.summary(runId, elapsed);
        metrics.timer("bk.pipeline.duration", elapsed.toMillis());
        log.info("Run {} completed in {} ms: executed={} skipped={}",
                runId, elapsed.toMillis(), summary.stepsExecuted(), summary.stepsSkipped());
        return PipelineResult.succeeded(current, summary);
    }

    private StepOutcome runStep(EnrichmentStep step,
                                EnrichedDataset input,
                                PipelineContext context,
                                long deadline,
                                ExecutorService worker) {
        final String name = step.name();
        final long t0 = System.nanoTime();
        try {
            final List<RunMetadata.Field> missing = new ArrayList<>();
            for (RunMetadata.Field field : step.requiredMetadata()) {
                if (!context.metadata().has(field)) missing.add(field);
            }
            if (!missing.isEmpty()) {
                throw new StepExecutionException(name, "missing required run metadata " + missing, null);
            }

            final EnrichedDataset output = invoke(step, input, context, deadline, worker);
            if (output == null) {
                throw new StepExecutionException(name, "returned no dataset", null);
            }
            if (!step.validate(output)) {
                throw new ValidationException(name);
            }
            return StepOutcome.completed(name, output, elapsedSince(t0));
        } catch (ValidationException | StepExecutionException | PipelineTimeoutException e) {
            return StepOutcome.failed(name, e, elapsedSince(t0));
        } catch (Exception e) {
            return StepOutcome.failed(name, StepExecutionException.wrap(name, e), elapsedSince(t0));
        }
    }

    private EnrichedDataset invoke(EnrichmentStep step,
                                   EnrichedDataset input,
                                   PipelineContext context,
                                   long deadline,
                                   ExecutorService worker) throws Exception {
        if (worker == null) {
            return step.execute(input, context);
        }

        final long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            throw new PipelineTimeoutException(step.name(), settings.maxDuration());
        }

        final Future<EnrichedDataset> future = worker.submit(() -> step.execute(input, context));
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new PipelineTimeoutException(step.name(), settings.maxDuration());
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw new StepExecutionException(step.name(), String.valueOf(cause), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StepExecutionException(step.name(), "interrupted while waiting for step", e);
        }
    }

    private void record(StepOutcome outcome) {
        final long ms = outcome.elapsed().toMillis();
        metrics.timer("bk.step.duration", ms);
        if (outcome instanceof StepOutcome.Completed) {
            metrics.counter("bk.step.completed");
            if (settings.profilingEnabled()) {
                log.info("Step '{}' completed in {} ms", outcome.stepName(), ms);
            } else {
                log.debug("Step '{}' completed in {} ms", outcome.stepName(), ms);
            }
        } else {
            metrics.counter("bk.step.failed");
        }
    }

    // --- Administration ---

    /**
     * Reports cycles and every dependency on an unregistered step. Never throws.
     */
    public synchronized PipelineValidation validate() {
        final List<String> errors = new ArrayList<>();
        try {
            build();
        } catch (DependencyException e) {
            // missing dependencies are reported one by one below
            if (e.missingDependencies().isEmpty()) {
                errors.add(e.getMessage());
            }
        }

        for (EnrichmentStep step : steps.values()) {
            for (String dep : step.dependencies()) {
                if (!steps.containsKey(dep)) {
                    errors.add("Step '" + step.name() + "' depends on unregistered step '" + dep + "'");
                }
            }
        }
        return PipelineValidation.of(errors);
    }

    public synchronized PipelineStats stats() {
        List<String> order;
        try {
            order = build();
        } catch (DependencyException e) {
            order = List.of();
        }

        final List<PipelineStats.StepInfo> infos = new ArrayList<>(steps.size());
        for (EnrichmentStep step : steps.values()) {
            infos.add(new PipelineStats.StepInfo(step.name(), step.description(), step.dependencies()));
        }
        return new PipelineStats(steps.size(), order, infos);
    }

    // --- Lifecycle ---

    private ExecutorService openWorker(String runId) {
        final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, "pipeline-step-worker-" + runId);
            t.setDaemon(true);
            return t;
        });
        activeWorkers.add(worker);
        return worker;
    }

    // A timed-out step may ignore interruption; its thread is abandoned with the run.
    private void closeWorker(ExecutorService worker) {
        activeWorkers.remove(worker);
        worker.shutdownNow();
    }

    /**
     * Interrupts the steps of bounded runs still in flight.
     */
    @Override
    public void close() {
        for (ExecutorService worker : List.copyOf(activeWorkers)) {
            worker.shutdownNow();
            try {
                if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Step worker did not terminate within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
