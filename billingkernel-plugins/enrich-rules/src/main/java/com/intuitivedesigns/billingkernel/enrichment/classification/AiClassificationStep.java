/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.classification;

import com.intuitivedesigns.billingkernel.core.EnrichmentStep;
import com.intuitivedesigns.billingkernel.core.PipelineContext;
import com.intuitivedesigns.billingkernel.enrichment.EnrichmentSettings;
import com.intuitivedesigns.billingkernel.enrichment.rules.PatternCache;
import com.intuitivedesigns.billingkernel.enrichment.tags.VirtualTagsStep;
import com.intuitivedesigns.billingkernel.enrichment.view.BillingView;
import com.intuitivedesigns.billingkernel.enrichment.view.BillingViews;
import com.intuitivedesigns.billingkernel.enrichment.view.ViewColumn;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.billingkernel.model.EnrichedDataset;
import com.intuitivedesigns.billingkernel.model.EnrichmentKey;
import com.intuitivedesigns.billingkernel.model.SpendCategory;
import com.intuitivedesigns.billingkernel.model.SpendClassification;
import com.intuitivedesigns.billingkernel.query.SqlLiterals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Flags AI/ML related spend. Rows are grouped per (resource id, service, resource name, instance
 * type) with summed cost; each group is classified by {@link ResourceClassifier}.
 */
public final class AiClassificationStep implements EnrichmentStep {

    private static final Logger log = LoggerFactory.getLogger(AiClassificationStep.class);

    public static final String NAME = "ai-classification";

    private static final String VIEW_BASE = "billing_ai_classification";
    private static final String UNKNOWN_INSTANCE = "unknown";

    private static final List<ViewColumn<Map<String, Object>>> COLUMNS = List.of(
            ViewColumn.text("ResourceId", row -> row.get("ResourceId")),
            ViewColumn.text("ServiceName", row -> row.get("ServiceName")),
            ViewColumn.text("ResourceName", row -> firstPresent(row.get("ResourceName"), row.get("ResourceId"))),
            ViewColumn.text("InstanceType", row -> firstPresent(row.get("InstanceType"), UNKNOWN_INSTANCE)),
            ViewColumn.number("BilledCost", row -> row.get("BilledCost")));

    private final ResourceClassifier classifier;
    private final int maxRows;
    private final MetricsRuntime metrics;

    public AiClassificationStep(EnrichmentSettings settings,
                                List<ClassificationRule> rules,
                                PatternCache patterns,
                                MetricsRuntime metrics) {
        Objects.requireNonNull(settings, "settings");
        this.classifier = new ResourceClassifier(rules, patterns);
        this.maxRows = settings.maxRows();
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Classify AI/ML related cloud spending";
    }

    @Override
    public List<String> dependencies() {
        return List.of(VirtualTagsStep.NAME);
    }

    @Override
    public EnrichedDataset execute(EnrichedDataset input, PipelineContext context) {
        if (input.rows().isEmpty()) {
            return input.attach(EnrichmentKey.AI_CLASSIFICATIONS, List.of());
        }

        final List<Map<String, Object>> resources;
        try (BillingView view = BillingViews.create(context.queryEngine(), VIEW_BASE, context.runId(),
                COLUMNS, input.rows(), maxRows)) {
            resources = context.queryEngine().query(groupQuery(view));
        }

        final List<SpendClassification> out = new ArrayList<>();
        final Map<SpendCategory, Integer> byCategory = new EnumMap<>(SpendCategory.class);
        for (Map<String, Object> r : resources) {
            final Optional<ResourceClassifier.Match> match = classifier.classify(
                    text(r.get("ServiceName")), text(r.get("ResourceName")), text(r.get("InstanceType")));
            if (match.isEmpty()) continue;

            final ResourceClassifier.Match m = match.get();
            final SpendCategory category = m.rule().category();
            final Object id = r.get("ResourceId");
            out.add(new SpendClassification(
                    id == null ? "unknown" : String.valueOf(id),
                    true,
                    m.confidence(),
                    category,
                    m.rule().id(),
                    ResourceClassifier.estimateTokens(category, BillingViews.toDouble(r.get("BilledCost")))));
            byCategory.merge(category, 1, Integer::sum);
        }

        metrics.counter("enrichment.ai.classified", out.size());
        log.info("Classified {} AI-related resource(s) out of {}: {}", out.size(), resources.size(), byCategory);
        return input.attach(EnrichmentKey.AI_CLASSIFICATIONS, out);
    }

    @Override
    public boolean validate(EnrichedDataset output) {
        return output.has(EnrichmentKey.AI_CLASSIFICATIONS);
    }

    private static String groupQuery(BillingView view) {
        return "SELECT \"ResourceId\", \"ServiceName\", \"ResourceName\", \"InstanceType\","
                + " SUM(\"BilledCost\") AS \"BilledCost\""
                + " FROM " + view.ref()
                + " GROUP BY \"ResourceId\", \"ServiceName\", \"ResourceName\", \"InstanceType\""
                + " ORDER BY MIN(" + SqlLiterals.identifier(BillingViews.ROW_INDEX) + ")";
    }

    private static Object firstPresent(Object value, Object fallback) {
        if (value == null || String.valueOf(value).isBlank()) return fallback;
        return value;
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
