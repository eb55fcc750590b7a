/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.tags;

import com.intuitivedesigns.billingkernel.cache.InMemoryCacheProvider;
import com.intuitivedesigns.billingkernel.core.PipelineContext;
import com.intuitivedesigns.billingkernel.enrichment.EnrichmentSettings;
import com.intuitivedesigns.billingkernel.enrichment.rules.ConditionField;
import com.intuitivedesigns.billingkernel.enrichment.rules.ConditionOperator;
import com.intuitivedesigns.billingkernel.enrichment.rules.PatternCache;
import com.intuitivedesigns.billingkernel.enrichment.rules.RuleCondition;
import com.intuitivedesigns.billingkernel.metrics.MetricsFactory;
import com.intuitivedesigns.billingkernel.model.EnrichedDataset;
import com.intuitivedesigns.billingkernel.model.EnrichmentKey;
import com.intuitivedesigns.billingkernel.model.VirtualTag;
import com.intuitivedesigns.billingkernel.query.DuckDbQueryEngine;
import com.intuitivedesigns.billingkernel.query.QueryEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static com.intuitivedesigns.billingkernel.enrichment.EnrichmentFixtures.billing;
import static com.intuitivedesigns.billingkernel.enrichment.EnrichmentFixtures.context;
import static com.intuitivedesigns.billingkernel.enrichment.EnrichmentFixtures.dataset;
import static org.junit.jupiter.api.Assertions.*;

class VirtualTagsStepTest {

    private QueryEngine engine;
    private InMemoryCacheProvider cache;
    private PipelineContext context;

    @BeforeEach
    void setUp() {
        engine = DuckDbQueryEngine.open("jdbc:duckdb:", MetricsFactory.noop());
        cache = new InMemoryCacheProvider();
        context = context(engine, cache);
    }

    @AfterEach
    void tearDown() {
        cache.close();
        engine.close();
    }

    private static VirtualTagsStep step(TagMergePolicy policy, VirtualTagRule... rules) {
        return step(policy, new StaticTagRuleSource(List.of(rules)));
    }

    private static VirtualTagsStep step(TagMergePolicy policy, TagRuleSource source) {
        return new VirtualTagsStep(EnrichmentSettings.defaults().withTagMergePolicy(policy), source,
                new PatternCache(), MetricsFactory.noop());
    }

    private static VirtualTagRule rule(String id, int priority, RuleCondition condition, String key, String value) {
        return VirtualTagRule.builder(id).priority(priority).condition(condition).tag(key, value).build();
    }

    private static Map<String, VirtualTag> byResource(EnrichedDataset out) {
        return out.get(EnrichmentKey.VIRTUAL_TAGS).orElseThrow().stream()
                .collect(Collectors.toMap(VirtualTag::resourceId, t -> t));
    }

    @Test
    void disjointRules_shouldUnionTagsOnSharedResource() throws Exception {
        VirtualTagRule r1 = rule("r1", 200,
                RuleCondition.of(ConditionField.RESOURCE_ID, ConditionOperator.EQUALS, "X"), "Environment", "Prod");
        VirtualTagRule r2 = rule("r2", 100,
                RuleCondition.of(ConditionField.RESOURCE_ID, ConditionOperator.EQUALS, "X"), "CostCenter", "Ops");

        EnrichedDataset out = step(TagMergePolicy.HIGHEST_PRIORITY_WINS, r2, r1)
                .execute(dataset(billing("X", "Amazon EC2", "us-east-1", 1.0)), context);

        VirtualTag x = byResource(out).get("X");
        assertEquals(Map.of("Environment", "Prod", "CostCenter", "Ops"), x.tags());
        assertEquals("r1", x.appliedBy());
    }

    @Test
    void conflictingKey_highestPriorityWins_shouldKeepHigherPriorityValue() throws Exception {
        RuleCondition onX = RuleCondition.of(ConditionField.RESOURCE_ID, ConditionOperator.EQUALS, "X");
        VirtualTagRule high = rule("high", 200, onX, "Environment", "Production");
        VirtualTagRule low = rule("low", 100, onX, "Environment", "Development");

        EnrichedDataset out = step(TagMergePolicy.HIGHEST_PRIORITY_WINS, low, high)
                .execute(dataset(billing("X", "svc", "us-east-1", 1.0)), context);

        assertEquals("Production", byResource(out).get("X").tags().get("Environment"));
    }

    @Test
    void conflictingKey_lastProcessedWins_shouldKeepLowerPriorityValue() throws Exception {
        RuleCondition onX = RuleCondition.of(ConditionField.RESOURCE_ID, ConditionOperator.EQUALS, "X");
        VirtualTagRule high = rule("high", 200, onX, "Environment", "Production");
        VirtualTagRule low = rule("low", 100, onX, "Environment", "Development");

        EnrichedDataset out = step(TagMergePolicy.LAST_PROCESSED_WINS, high, low)
                .execute(dataset(billing("X", "svc", "us-east-1", 1.0)), context);

        assertEquals("Development", byResource(out).get("X").tags().get("Environment"));
    }

    @Test
    void defaultRules_shouldTagDevAndProdServices() throws Exception {
        EnrichedDataset input = dataset(
                billing("i-dev", "my-dev-service", "us-east-1", 3.0),
                billing("i-dev", "my-dev-service", "us-east-1", 4.0),
                billing("i-prod", "prod-api", "us-east-1", 5.0),
                billing("i-other", "Amazon S3", "us-east-1", 6.0));

        EnrichedDataset out = step(TagMergePolicy.HIGHEST_PRIORITY_WINS, DefaultTagRules.source()).execute(input, context);

        List<VirtualTag> tags = out.get(EnrichmentKey.VIRTUAL_TAGS).orElseThrow();
        assertEquals(2, tags.size());
        // priority 200 (prod) is evaluated first
        assertEquals("i-prod", tags.get(0).resourceId());
        assertEquals("rule-2", tags.get(0).appliedBy());
        assertEquals(Map.of("Environment", "Development", "CostCenter", "Engineering"), byResource(out).get("i-dev").tags());
    }

    @Test
    void operators_shouldFilterRowsInTheEngine() throws Exception {
        EnrichedDataset input = dataset(
                billing("i-1", "Amazon EC2", "us-east-1", 1.0),
                billing("i-2", "Amazon EC2", "eu-west-1", 1.0),
                billing("i-3", "O'Reilly Cloud", "ap-south-1", 1.0),
                billing("vol-4", "100% Storage", "us-east-1", 1.0));

        VirtualTagRule in = rule("in", 50,
                RuleCondition.of(ConditionField.REGION, ConditionOperator.IN, "eu-west-1", "ap-south-1"), "Geo", "NonUS");
        VirtualTagRule quoted = rule("quoted", 40,
                RuleCondition.of(ConditionField.SERVICE_NAME, ConditionOperator.EQUALS, "O'Reilly Cloud"), "Vendor", "Partner");
        VirtualTagRule regex = rule("regex", 30,
                RuleCondition.of(ConditionField.RESOURCE_ID, ConditionOperator.REGEX, "^i-[12]$"), "Kind", "Instance");
        VirtualTagRule literalPercent = rule("pct", 20,
                RuleCondition.of(ConditionField.SERVICE_NAME, ConditionOperator.CONTAINS, "0% S"), "Kind", "Storage");

        Map<String, VirtualTag> tags = byResource(step(TagMergePolicy.HIGHEST_PRIORITY_WINS, in, quoted, regex, literalPercent)
                .execute(input, context));

        assertEquals(Map.of("Kind", "Instance"), tags.get("i-1").tags());
        assertEquals(Map.of("Geo", "NonUS", "Kind", "Instance"), tags.get("i-2").tags());
        assertEquals(Map.of("Geo", "NonUS", "Vendor", "Partner"), tags.get("i-3").tags());
        assertEquals(Map.of("Kind", "Storage"), tags.get("vol-4").tags());
    }

    @Test
    void ruleOnMissingColumn_shouldBeSkipped() throws Exception {
        VirtualTagRule team = rule("team", 300,
                RuleCondition.custom("Team", ConditionOperator.EQUALS, "core"), "Owner", "Core");
        VirtualTagRule region = rule("region", 100,
                RuleCondition.of(ConditionField.REGION, ConditionOperator.EQUALS, "us-east-1"), "Geo", "US");

        EnrichedDataset out = step(TagMergePolicy.HIGHEST_PRIORITY_WINS, team, region)
                .execute(dataset(billing("i-1", "svc", "us-east-1", 1.0)), context);

        assertEquals(Map.of("Geo", "US"), byResource(out).get("i-1").tags());
    }

    @Test
    void inactiveRules_shouldBeIgnored() throws Exception {
        VirtualTagRule off = VirtualTagRule.builder("off")
                .priority(1)
                .active(false)
                .condition(RuleCondition.of(ConditionField.RESOURCE_ID, ConditionOperator.EQUALS, "i-1"))
                .tag("k", "v")
                .build();

        EnrichedDataset out = step(TagMergePolicy.HIGHEST_PRIORITY_WINS, off)
                .execute(dataset(billing("i-1", "svc", "us-east-1", 1.0)), context);

        assertEquals(List.of(), out.get(EnrichmentKey.VIRTUAL_TAGS).orElseThrow());
    }

    @Test
    void noRules_shouldAttachEmptyCollection() throws Exception {
        VirtualTagsStep step = step(TagMergePolicy.HIGHEST_PRIORITY_WINS);

        EnrichedDataset out = step.execute(dataset(billing("i-1", "svc", "us-east-1", 1.0)), context);

        assertTrue(out.has(EnrichmentKey.VIRTUAL_TAGS));
        assertTrue(out.get(EnrichmentKey.VIRTUAL_TAGS).orElseThrow().isEmpty());
        assertTrue(step.validate(out));
        assertFalse(step.validate(dataset(billing("i-1", "svc", "us-east-1", 1.0))));
    }

    @Test
    void rules_shouldBeServedFromCacheOnSecondRun() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        TagRuleSource counting = ctx -> {
            loads.incrementAndGet();
            return DefaultTagRules.forUser(ctx.userId());
        };
        VirtualTagsStep step = step(TagMergePolicy.HIGHEST_PRIORITY_WINS, counting);
        EnrichedDataset input = dataset(billing("i-1", "dev-box", "us-east-1", 1.0));

        step.execute(input, context);
        EnrichedDataset second = step.execute(input, context);

        assertEquals(1, loads.get());
        assertTrue(cache.get(VirtualTagsStep.cacheKey("org-1", "user-1")).isPresent());
        assertEquals(1, second.get(EnrichmentKey.VIRTUAL_TAGS).orElseThrow().size());
    }

    @Test
    void failingRuleSource_shouldPropagate() {
        VirtualTagsStep step = step(TagMergePolicy.HIGHEST_PRIORITY_WINS, ctx -> {
            throw new IllegalStateException("rule store down");
        });

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> step.execute(dataset(billing("i-1", "svc", "us-east-1", 1.0)), context));
        assertEquals("rule store down", e.getMessage());
    }

    @Test
    void view_shouldBeDroppedAfterExecution() throws Exception {
        step(TagMergePolicy.HIGHEST_PRIORITY_WINS, DefaultTagRules.source())
                .execute(dataset(billing("i-1", "dev", "us-east-1", 1.0)), context);

        assertTrue(engine.query("SELECT view_name FROM duckdb_views() WHERE view_name LIKE 'raw_billing%'").isEmpty());
    }
}
