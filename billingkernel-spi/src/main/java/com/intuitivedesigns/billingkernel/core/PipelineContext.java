/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.core;

import com.intuitivedesigns.billingkernel.cache.CacheProvider;
import com.intuitivedesigns.billingkernel.query.QueryEngine;

import java.util.Objects;

/**
 * Collaborators handed to every step of one run. Read-only; supplied fresh by the caller per run.
 */
public record PipelineContext(
        QueryEngine queryEngine,
        CacheProvider cache,
        RunMetadata metadata,
        String userId,
        String orgId,
        String runId
) {
    public PipelineContext {
        Objects.requireNonNull(queryEngine, "queryEngine");
        Objects.requireNonNull(cache, "cache");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(orgId, "orgId");
        Objects.requireNonNull(runId, "runId");
        metadata = (metadata == null) ? RunMetadata.empty() : metadata;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private QueryEngine queryEngine;
        private CacheProvider cache;
        private RunMetadata metadata = RunMetadata.empty();
        private String userId;
        private String orgId;
        private String runId;

        private Builder() {}

        public Builder queryEngine(QueryEngine queryEngine) { this.queryEngine = queryEngine; return this; }
        public Builder cache(CacheProvider cache) { this.cache = cache; return this; }
        public Builder metadata(RunMetadata metadata) { this.metadata = metadata; return this; }
        public Builder userId(String userId) { this.userId = userId; return this; }
        public Builder orgId(String orgId) { this.orgId = orgId; return this; }
        public Builder runId(String runId) { this.runId = runId; return this; }

        public PipelineContext build() {
            return new PipelineContext(queryEngine, cache, metadata, userId, orgId, runId);
        }
    }
}
