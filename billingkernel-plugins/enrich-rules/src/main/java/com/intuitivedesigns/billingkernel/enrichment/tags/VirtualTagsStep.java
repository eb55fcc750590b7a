/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.tags;

import com.intuitivedesigns.billingkernel.core.EnrichmentStep;
import com.intuitivedesigns.billingkernel.core.PipelineContext;
import com.intuitivedesigns.billingkernel.enrichment.CachedLists;
import com.intuitivedesigns.billingkernel.enrichment.EnrichmentSettings;
import com.intuitivedesigns.billingkernel.enrichment.rules.ConditionClauses;
import com.intuitivedesigns.billingkernel.enrichment.rules.PatternCache;
import com.intuitivedesigns.billingkernel.enrichment.view.BillingView;
import com.intuitivedesigns.billingkernel.enrichment.view.BillingViews;
import com.intuitivedesigns.billingkernel.enrichment.view.ViewColumn;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.billingkernel.model.EnrichedDataset;
import com.intuitivedesigns.billingkernel.model.EnrichmentKey;
import com.intuitivedesigns.billingkernel.model.VirtualTag;
import com.intuitivedesigns.billingkernel.query.SqlLiterals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Overlays user-defined tags on resources without touching the source rows.
 *
 * <p>Rules are read from the run cache ({@code virtual-tags:<orgId>:<userId>}) or loaded from the
 * {@link TagRuleSource} and cached. Active rules are evaluated against a temporary view of the
 * dataset from highest to lowest priority; each matching {@code ResourceId} collects the rule's tags,
 * combined per {@link TagMergePolicy}.</p>
 */
public final class VirtualTagsStep implements EnrichmentStep {

    private static final Logger log = LoggerFactory.getLogger(VirtualTagsStep.class);

    public static final String NAME = "virtual-tags";
    public static final String RESOURCE_ID = "ResourceId";
    static final String UNKNOWN_RESOURCE = "unknown";

    private static final String VIEW_BASE = "raw_billing";

    private final TagRuleSource source;
    private final TagMergePolicy policy;
    private final int maxRows;
    private final Duration rulesTtl;
    private final ConditionClauses clauses;
    private final MetricsRuntime metrics;

    public VirtualTagsStep(EnrichmentSettings settings, TagRuleSource source, PatternCache patterns, MetricsRuntime metrics) {
        Objects.requireNonNull(settings, "settings");
        this.source = Objects.requireNonNull(source, "source");
        this.policy = settings.tagMergePolicy();
        this.maxRows = settings.maxRows();
        this.rulesTtl = settings.tagRulesTtl();
        this.clauses = new ConditionClauses(patterns);
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public static String cacheKey(String orgId, String userId) {
        return "virtual-tags:" + orgId + ":" + userId;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Apply user-defined virtual tags to resources";
    }

    @Override
    public EnrichedDataset execute(EnrichedDataset input, PipelineContext context) throws Exception {
        final List<VirtualTagRule> active = activeByPriority(loadRules(context));
        if (active.isEmpty()) {
            log.info("No active tag rules for org={} user={}, nothing to apply", context.orgId(), context.userId());
            return input.attach(EnrichmentKey.VIRTUAL_TAGS, List.of());
        }
        if (input.rows().isEmpty() || !input.schema().hasColumn(RESOURCE_ID)) {
            log.warn("Dataset has no {} rows to tag ({} rows)", RESOURCE_ID, input.rows().size());
            return input.attach(EnrichmentKey.VIRTUAL_TAGS, List.of());
        }

        final List<String> columns = input.schema().columns();
        final List<ViewColumn<Map<String, Object>>> viewColumns = new ArrayList<>(columns.size());
        for (String column : columns) {
            viewColumns.add(ViewColumn.text(column, row -> row.get(column)));
        }

        final TagAssignments assignments = new TagAssignments(policy, Instant.now());
        try (BillingView view = BillingViews.create(context.queryEngine(), VIEW_BASE, context.runId(),
                viewColumns, input.rows(), maxRows)) {
            for (VirtualTagRule rule : active) {
                final String column = rule.condition().column();
                if (!columns.contains(column)) {
                    log.warn("Rule '{}' skipped: column {} not in dataset", rule.id(), column);
                    continue;
                }

                final List<Map<String, Object>> matches = context.queryEngine().query(matchQuery(view, rule));
                for (Map<String, Object> match : matches) {
                    final Object id = match.get(RESOURCE_ID);
                    assignments.apply(id == null ? UNKNOWN_RESOURCE : String.valueOf(id), rule);
                }
                log.debug("Rule '{}' matched {} resource(s)", rule.name(), matches.size());
            }
        }

        final List<VirtualTag> tags = assignments.toTags();
        metrics.counter("enrichment.tags.applied", tags.size());
        log.info("Applied virtual tags to {} resource(s) from {} rule(s)", tags.size(), active.size());
        return input.attach(EnrichmentKey.VIRTUAL_TAGS, tags);
    }

    @Override
    public boolean validate(EnrichedDataset output) {
        return output.has(EnrichmentKey.VIRTUAL_TAGS);
    }

    // --- Rules ---

    private List<VirtualTagRule> loadRules(PipelineContext context) throws Exception {
        final String key = cacheKey(context.orgId(), context.userId());
        final Optional<List<VirtualTagRule>> cached = CachedLists.read(context.cache(), key, VirtualTagRule.class);
        if (cached.isPresent()) {
            metrics.counter("enrichment.tags.rules.cached");
            return cached.get();
        }

        final List<VirtualTagRule> loaded = source.load(context);
        final List<VirtualTagRule> rules = (loaded == null) ? List.of() : loaded;
        CachedLists.write(context.cache(), key, rules, rulesTtl);
        return rules;
    }

    static List<VirtualTagRule> activeByPriority(List<VirtualTagRule> rules) {
        final List<VirtualTagRule> active = new ArrayList<>();
        for (VirtualTagRule rule : rules) {
            if (rule.active()) active.add(rule);
        }
        active.sort(Comparator.comparingInt(VirtualTagRule::priority).reversed());
        return active;
    }

    private String matchQuery(BillingView view, VirtualTagRule rule) {
        final String id = SqlLiterals.identifier(RESOURCE_ID);
        return "SELECT " + id + " FROM " + view.ref()
                + " WHERE " + clauses.where(rule.condition())
                + " GROUP BY " + id
                + " ORDER BY MIN(" + SqlLiterals.identifier(BillingViews.ROW_INDEX) + ")";
    }
}
