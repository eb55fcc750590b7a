/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.classification;

import com.intuitivedesigns.billingkernel.enrichment.rules.PatternCache;
import com.intuitivedesigns.billingkernel.model.SpendCategory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class ResourceClassifierTest {

    private static final ClassificationRule THREE_GROUPS = new ClassificationRule("full-stack", "Full stack",
            SpendCategory.GPU_COMPUTE, List.of("compute"), List.of("trainer"), List.of("^p\\d"), 0.9, 50);

    @Test
    void threeGroupRule_matchingTwo_shouldNotQualify() {
        ResourceClassifier classifier = new ResourceClassifier(List.of(THREE_GROUPS), new PatternCache());

        assertTrue(classifier.classify("Compute", "trainer-01", "m5.large").isEmpty());
    }

    @Test
    void threeGroupRule_matchingAll_shouldQualify() {
        ResourceClassifier classifier = new ResourceClassifier(List.of(THREE_GROUPS), new PatternCache());

        Optional<ResourceClassifier.Match> match = classifier.classify("Compute", "Trainer-01", "p4d.24xlarge");

        assertTrue(match.isPresent());
        assertEquals(1.0, match.get().ratio(), 1e-9);
        assertEquals(0.9, match.get().confidence(), 1e-9);
    }

    @Test
    void firstQualifyingRule_shouldWinOverBetterScoringLowerPriority() {
        ClassificationRule partial = new ClassificationRule("partial", "Partial", SpendCategory.DATA_PROCESSING,
                List.of("glue"), List.of("etl"), List.of("never-matches"), 0.6, 90);
        ClassificationRule broad = new ClassificationRule("broad", "Broad", SpendCategory.AI_SERVICE,
                List.of("glue"), List.of(), List.of(), 0.5, 100);
        ClassificationRule exact = new ClassificationRule("exact", "Exact", SpendCategory.ML_TRAINING,
                List.of("glue"), List.of("etl"), List.of(), 0.99, 10);

        ResourceClassifier classifier = new ResourceClassifier(List.of(exact, partial, broad), new PatternCache());
        ResourceClassifier.Match match = classifier.classify("AWS Glue", "nightly-etl", "unknown").orElseThrow();

        assertEquals("broad", match.rule().id());
        assertEquals(0.5, match.confidence(), 1e-9);
    }

    @Test
    void twoGroupRule_shouldNeedBothGroups() {
        ClassificationRule two = new ClassificationRule("two", "Two", SpendCategory.DATA_PROCESSING,
                List.of("kinesis"), List.of("pipeline"), List.of(), 0.6, 1);
        ResourceClassifier classifier = new ResourceClassifier(List.of(two), new PatternCache());

        assertTrue(classifier.classify("Amazon Kinesis", "ingest", null).isEmpty());
        assertEquals(0.6, classifier.classify("Amazon Kinesis", "ingest-pipeline", null).orElseThrow().confidence(), 1e-9);
    }

    @Test
    void defaultRules_shouldRecognizeGpuInstances() {
        ResourceClassifier classifier = new ResourceClassifier(DefaultClassificationRules.all(), new PatternCache());

        ResourceClassifier.Match match = classifier.classify("Amazon EC2", "web-1", "p3.2xlarge").orElseThrow();

        assertEquals("gpu-instances", match.rule().id());
        assertEquals(SpendCategory.ML_TRAINING, match.rule().category());
        assertTrue(classifier.classify("Amazon EC2", "web-1", "m5.large").isEmpty());
    }

    @Test
    void estimateTokens_shouldUsePerCategoryPrice() {
        assertEquals(OptionalLong.of(1_000_000L), ResourceClassifier.estimateTokens(SpendCategory.ML_INFERENCE, 2.0));
        assertEquals(OptionalLong.of(1_000_000L), ResourceClassifier.estimateTokens(SpendCategory.AI_SERVICE, 3.0));
        assertEquals(OptionalLong.of(333L), ResourceClassifier.estimateTokens(SpendCategory.AI_SERVICE, 0.001));
        assertEquals(OptionalLong.of(0L), ResourceClassifier.estimateTokens(SpendCategory.ML_INFERENCE, -1.0));
        assertEquals(OptionalLong.empty(), ResourceClassifier.estimateTokens(SpendCategory.ML_TRAINING, 50.0));
        assertEquals(OptionalLong.empty(), ResourceClassifier.estimateTokens(SpendCategory.GPU_COMPUTE, 50.0));
    }

    @Test
    void ruleWithoutGroups_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ClassificationRule("none", "None",
                SpendCategory.AI_SERVICE, List.of(), null, List.of(), 0.5, 1));
    }
}
