/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnrichedDatasetTest {

    private static RawDataset raw() {
        Map<String, Object> row = new HashMap<>();
        row.put("ResourceId", "i-1");
        row.put("BilledCost", 10.0);
        row.put("Region", null);
        return RawDataset.of(List.of(row), SourceInfo.of(CloudProvider.AWS, DataFormat.FOCUS));
    }

    @Test
    void from_shouldStartWithoutEnrichments() {
        EnrichedDataset ds = EnrichedDataset.from(raw());

        assertFalse(ds.has(EnrichmentKey.VIRTUAL_TAGS));
        assertTrue(ds.get(EnrichmentKey.VIRTUAL_TAGS).isEmpty());
        assertEquals(1, ds.rows().size());
        assertNull(ds.rows().get(0).get("Region"));
    }

    @Test
    void attach_emptyList_shouldMarkKeyAsComputed() {
        EnrichedDataset ds = EnrichedDataset.from(raw()).attach(EnrichmentKey.VIRTUAL_TAGS, List.of());

        assertTrue(ds.has(EnrichmentKey.VIRTUAL_TAGS));
        assertEquals(List.of(), ds.get(EnrichmentKey.VIRTUAL_TAGS).orElseThrow());
    }

    @Test
    void attach_shouldAppendAndLeavePreviousInstanceUntouched() {
        Instant now = Instant.now();
        VirtualTag a = new VirtualTag("i-1", Map.of("Env", "Dev"), now, "rule-1");
        VirtualTag b = new VirtualTag("i-2", Map.of("Env", "Prod"), now, "rule-2");

        EnrichedDataset first = EnrichedDataset.from(raw()).attach(EnrichmentKey.VIRTUAL_TAGS, List.of(a));
        EnrichedDataset second = first.attach(EnrichmentKey.VIRTUAL_TAGS, List.of(b));

        assertEquals(List.of(a), first.get(EnrichmentKey.VIRTUAL_TAGS).orElseThrow());
        assertEquals(List.of(a, b), second.get(EnrichmentKey.VIRTUAL_TAGS).orElseThrow());
        assertThrows(UnsupportedOperationException.class,
                () -> second.get(EnrichmentKey.VIRTUAL_TAGS).orElseThrow().clear());
    }

    @Test
    void rawDataset_shouldBeDefensivelyCopied() {
        Map<String, Object> row = new HashMap<>();
        row.put("ResourceId", "i-1");
        List<Map<String, Object>> rows = new java.util.ArrayList<>(List.of(row));

        RawDataset ds = RawDataset.of(rows, SourceInfo.of(CloudProvider.GCP, DataFormat.CSV));
        row.put("ResourceId", "changed");
        rows.clear();

        assertEquals(1, ds.size());
        assertEquals("i-1", ds.rows().get(0).get("ResourceId"));
        assertThrows(UnsupportedOperationException.class, () -> ds.rows().get(0).put("x", 1));
    }

    @Test
    void schemaInfer_shouldCollectColumnsInFirstSeenOrder() {
        SchemaSummary schema = SchemaSummary.infer(List.of(
                Map.of("A", 1),
                Map.of("A", 2, "B", "x")));

        assertEquals(2, schema.rowCount());
        assertTrue(schema.hasColumn("A"));
        assertTrue(schema.hasColumn("B"));
        assertEquals("A", schema.columns().get(0));
        assertTrue(schema.estimatedSizeBytes() > 0);
    }
}
