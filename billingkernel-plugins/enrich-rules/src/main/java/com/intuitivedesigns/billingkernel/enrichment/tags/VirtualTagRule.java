/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.tags;

import com.intuitivedesigns.billingkernel.enrichment.rules.RuleCondition;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * User-defined rule attaching {@code tags} to every resource matching {@code condition}.
 * Higher {@code priority} is processed first.
 */
public record VirtualTagRule(
        String id,
        String name,
        String description,
        RuleCondition condition,
        Map<String, String> tags,
        int priority,
        boolean active,
        String createdBy,
        Instant createdAt,
        Instant updatedAt
) implements Serializable {

    private static final long serialVersionUID = 1L;

    public VirtualTagRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(condition, "condition");
        name = (name == null) ? id : name;
        tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags == null ? Map.of() : tags));
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String description;
        private RuleCondition condition;
        private final Map<String, String> tags = new LinkedHashMap<>();
        private int priority;
        private boolean active = true;
        private String createdBy;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder condition(RuleCondition condition) { this.condition = condition; return this; }
        public Builder tag(String key, String value) { this.tags.put(key, value); return this; }
        public Builder priority(int priority) { this.priority = priority; return this; }
        public Builder active(boolean active) { this.active = active; return this; }
        public Builder createdBy(String createdBy) { this.createdBy = createdBy; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }

        public VirtualTagRule build() {
            final Instant created = (createdAt == null) ? Instant.now() : createdAt;
            return new VirtualTagRule(id, name, description, condition, tags, priority, active,
                    createdBy, created, updatedAt == null ? created : updatedAt);
        }
    }
}
