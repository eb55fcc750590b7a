/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.tags;

import com.intuitivedesigns.billingkernel.model.VirtualTag;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tag sets accumulated per resource during one run, in first-match order.
 */
final class TagAssignments {

    private final TagMergePolicy policy;
    private final Instant appliedAt;
    private final Map<String, Assignment> byResource = new LinkedHashMap<>();

    TagAssignments(TagMergePolicy policy, Instant appliedAt) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.appliedAt = Objects.requireNonNull(appliedAt, "appliedAt");
    }

    void apply(String resourceId, VirtualTagRule rule) {
        final Assignment existing = byResource.get(resourceId);
        if (existing == null) {
            byResource.put(resourceId, new Assignment(rule.id(), new LinkedHashMap<>(rule.tags())));
        } else {
            policy.merge(existing.tags, rule.tags());
        }
    }

    List<VirtualTag> toTags() {
        final List<VirtualTag> out = new ArrayList<>(byResource.size());
        byResource.forEach((id, a) -> out.add(new VirtualTag(id, a.tags, appliedAt, a.firstRuleId)));
        return out;
    }

    private static final class Assignment {
        private final String firstRuleId;
        private final Map<String, String> tags;

        private Assignment(String firstRuleId, Map<String, String> tags) {
            this.firstRuleId = firstRuleId;
            this.tags = tags;
        }
    }
}
