/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.core;

import com.intuitivedesigns.billingkernel.error.StepExecutionException;
import com.intuitivedesigns.billingkernel.model.CloudProvider;
import com.intuitivedesigns.billingkernel.model.DataFormat;
import com.intuitivedesigns.billingkernel.model.EnrichedDataset;
import com.intuitivedesigns.billingkernel.model.RawDataset;
import com.intuitivedesigns.billingkernel.model.SourceInfo;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StepOutcomeTest {

    private static EnrichedDataset dataset() {
        return EnrichedDataset.from(RawDataset.of(
                List.of(Map.of("ResourceId", "i-1")),
                SourceInfo.of(CloudProvider.AWS, DataFormat.FOCUS)));
    }

    @Test
    void completed_shouldCarryOutput() {
        EnrichedDataset output = dataset();

        StepOutcome outcome = StepOutcome.completed("virtual-tags", output, Duration.ofMillis(12));

        assertTrue(outcome instanceof StepOutcome.Completed);
        assertEquals("virtual-tags", outcome.stepName());
        assertEquals(Duration.ofMillis(12), outcome.elapsed());
        assertSame(output, ((StepOutcome.Completed) outcome).output());
    }

    @Test
    void failed_shouldCarryError() {
        StepExecutionException error = new StepExecutionException("green-ops-co2", "boom", null);

        StepOutcome outcome = StepOutcome.failed("green-ops-co2", error, Duration.ZERO);

        assertTrue(outcome instanceof StepOutcome.Failed);
        assertSame(error, ((StepOutcome.Failed) outcome).error());
    }

    @Test
    void outcomes_shouldRejectMissingParts() {
        assertThrows(NullPointerException.class, () -> StepOutcome.completed("s", null, Duration.ZERO));
        assertThrows(NullPointerException.class, () -> StepOutcome.failed("s", null, Duration.ZERO));
        assertThrows(NullPointerException.class, () -> StepOutcome.completed(null, dataset(), Duration.ZERO));
    }
}
