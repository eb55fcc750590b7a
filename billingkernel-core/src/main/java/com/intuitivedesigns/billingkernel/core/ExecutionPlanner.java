/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.core;

import com.intuitivedesigns.billingkernel.error.DependencyException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Depth-first topological ordering of registered steps.
 *
 * <p>Traversal starts from every step in registration order, so the result is deterministic for a
 * given registry. Dependencies always precede their dependents.</p>
 */
final class ExecutionPlanner {

    private ExecutionPlanner() {}

    static List<String> plan(Map<String, EnrichmentStep> steps) {
        final List<String> ordered = new ArrayList<>(steps.size());
        final Set<String> done = new HashSet<>();
        final Set<String> visiting = new HashSet<>();

        for (String name : steps.keySet()) {
            visit(name, steps, visiting, done, ordered);
        }
        return List.copyOf(ordered);
    }

    private static void visit(String name,
                              Map<String, EnrichmentStep> steps,
                              Set<String> visiting,
                              Set<String> done,
                              List<String> ordered) {
        if (done.contains(name)) return;
        if (visiting.contains(name)) {
            throw DependencyException.cycle(name);
        }

        final EnrichmentStep step = steps.get(name);
        final List<String> missing = new ArrayList<>();
        for (String dep : step.dependencies()) {
            if (!steps.containsKey(dep)) missing.add(dep);
        }
        if (!missing.isEmpty()) {
            throw DependencyException.missing(name, missing);
        }

        visiting.add(name);
        for (String dep : step.dependencies()) {
            visit(dep, steps, visiting, done, ordered);
        }
        visiting.remove(name);

        done.add(name);
        ordered.add(name);
    }
}
