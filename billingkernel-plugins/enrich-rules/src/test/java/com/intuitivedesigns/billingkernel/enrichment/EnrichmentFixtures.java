/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment;

import com.intuitivedesigns.billingkernel.cache.CacheProvider;
import com.intuitivedesigns.billingkernel.core.PipelineContext;
import com.intuitivedesigns.billingkernel.model.CloudProvider;
import com.intuitivedesigns.billingkernel.model.DataFormat;
import com.intuitivedesigns.billingkernel.model.EnrichedDataset;
import com.intuitivedesigns.billingkernel.model.RawDataset;
import com.intuitivedesigns.billingkernel.model.SourceInfo;
import com.intuitivedesigns.billingkernel.query.QueryEngine;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Billing rows and run contexts for step tests.
 */
public final class EnrichmentFixtures {

    public static final String ORG = "org-1";
    public static final String USER = "user-1";
    public static final String RUN = "exec_1700000000000_abc1234";

    private EnrichmentFixtures() {}

    /**
     * Row from alternating column/value arguments; values may be null.
     */
    public static Map<String, Object> row(Object... columnsAndValues) {
        if (columnsAndValues.length % 2 != 0) throw new IllegalArgumentException("odd argument count");
        final Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            row.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
        }
        return row;
    }

    /**
     * FOCUS-style row with the columns every step reads.
     */
    public static Map<String, Object> billing(String resourceId, String service, String region, double cost) {
        return row("ResourceId", resourceId, "ServiceName", service, "RegionName", region,
                "AccountId", "111122223333", "BilledCost", cost, "UsageQuantity", 1.0);
    }

    @SafeVarargs
    public static EnrichedDataset dataset(Map<String, Object>... rows) {
        return EnrichedDataset.from(RawDataset.of(Arrays.asList(rows), SourceInfo.of(CloudProvider.AWS, DataFormat.FOCUS)));
    }

    public static EnrichedDataset dataset(List<Map<String, Object>> rows) {
        return EnrichedDataset.from(RawDataset.of(rows, SourceInfo.of(CloudProvider.AWS, DataFormat.FOCUS)));
    }

    public static PipelineContext context(QueryEngine engine, CacheProvider cache) {
        return PipelineContext.builder()
                .queryEngine(engine)
                .cache(cache)
                .userId(USER)
                .orgId(ORG)
                .runId(RUN)
                .build();
    }
}
