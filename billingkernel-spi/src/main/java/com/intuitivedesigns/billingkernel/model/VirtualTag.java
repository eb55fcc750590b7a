/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tags applied to one resource by rule evaluation. {@code appliedBy} is the id of the rule that
 * first matched the resource.
 */
public record VirtualTag(String resourceId, Map<String, String> tags, Instant appliedAt, String appliedBy) {

    public VirtualTag {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(appliedAt, "appliedAt");
        Objects.requireNonNull(appliedBy, "appliedBy");
        tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags == null ? Map.of() : tags));
    }
}
