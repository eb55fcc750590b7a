/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.core;

import com.intuitivedesigns.billingkernel.model.EnrichedDataset;

import java.util.List;
import java.util.Set;

/**
 * Unit of enrichment work run by the orchestrator.
 *
 * <p>Identity is by {@link #name()}. A step receives the dataset produced by its predecessors and
 * returns a new dataset; it may only add to collections attached by earlier steps. Implementations
 * must not keep a reference to the dataset after {@link #execute} returns.</p>
 */
public interface EnrichmentStep {

    String name();

    default String description() {
        return name();
    }

    /**
     * Names of steps that must run before this one.
     */
    default List<String> dependencies() {
        return List.of();
    }

    /**
     * Run metadata fields that must be present; the orchestrator fails the step without invoking it
     * when one is missing.
     */
    default Set<RunMetadata.Field> requiredMetadata() {
        return Set.of();
    }

    EnrichedDataset execute(EnrichedDataset input, PipelineContext context) throws Exception;

    /**
     * Checks this step's own output. Returning false is handled like a thrown failure.
     */
    default boolean validate(EnrichedDataset output) {
        return true;
    }
}
