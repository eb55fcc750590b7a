/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.emissions;

import com.intuitivedesigns.billingkernel.core.EnrichmentStep;
import com.intuitivedesigns.billingkernel.core.PipelineContext;
import com.intuitivedesigns.billingkernel.enrichment.CachedLists;
import com.intuitivedesigns.billingkernel.enrichment.EnrichmentSettings;
import com.intuitivedesigns.billingkernel.enrichment.tags.VirtualTagsStep;
import com.intuitivedesigns.billingkernel.enrichment.view.BillingView;
import com.intuitivedesigns.billingkernel.enrichment.view.BillingViews;
import com.intuitivedesigns.billingkernel.enrichment.view.ViewColumn;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.billingkernel.model.EmissionEstimate;
import com.intuitivedesigns.billingkernel.model.EnrichedDataset;
import com.intuitivedesigns.billingkernel.model.EnrichmentKey;
import com.intuitivedesigns.billingkernel.model.MatchTier;
import com.intuitivedesigns.billingkernel.query.QueryEngine;
import com.intuitivedesigns.billingkernel.query.SqlLiterals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Estimates CO2 emissions per billing row by joining (service, region) against a coefficient table.
 *
 * <p>Match cascade: exact (service, region), then (service, {@code global}), then the flat fallback
 * rate. The estimate is {@code cost × kgPerDollar} when a cost factor exists, else
 * {@code usage × kgPerUnit}, else {@code cost × fallbackRate}. Rows with no positive estimate are
 * dropped.</p>
 */
public final class GreenOpsStep implements EnrichmentStep {

    private static final Logger log = LoggerFactory.getLogger(GreenOpsStep.class);

    public static final String NAME = "green-ops-co2";
    public static final String CACHE_KEY = "co2-coefficients:latest";
    public static final String FALLBACK_SOURCE = "estimated";

    private static final String BILLING_VIEW = "billing_with_co2";
    private static final String COEFFICIENT_VIEW = "co2_coefficients";

    private static final List<ViewColumn<Map<String, Object>>> BILLING_COLUMNS = List.of(
            ViewColumn.text("ResourceId", row -> row.get("ResourceId")),
            ViewColumn.text("ServiceName", row -> row.get("ServiceName")),
            ViewColumn.text("RegionName", row -> row.get("RegionName")),
            ViewColumn.number("BilledCost", row -> row.get("BilledCost")),
            ViewColumn.number("UsageQuantity", row -> row.get("UsageQuantity")));

    private static final List<ViewColumn<Co2Coefficient>> COEFFICIENT_COLUMNS = List.of(
            ViewColumn.text("ServiceName", Co2Coefficient::serviceName),
            ViewColumn.text("Region", Co2Coefficient::region),
            ViewColumn.number("KgCo2PerDollar", Co2Coefficient::kgCo2PerDollar),
            ViewColumn.number("KgCo2PerUnit", Co2Coefficient::kgCo2PerUnit),
            ViewColumn.text("UnitType", Co2Coefficient::unitType),
            ViewColumn.number("Confidence", Co2Coefficient::confidence),
            ViewColumn.text("Source", Co2Coefficient::source));

    private final CoefficientSource source;
    private final int maxRows;
    private final Duration coefficientsTtl;
    private final double defaultRate;
    private final double fallbackConfidence;
    private final MetricsRuntime metrics;

    public GreenOpsStep(EnrichmentSettings settings, CoefficientSource source, MetricsRuntime metrics) {
        Objects.requireNonNull(settings, "settings");
        this.source = Objects.requireNonNull(source, "source");
        this.maxRows = settings.maxRows();
        this.coefficientsTtl = settings.coefficientsTtl();
        this.defaultRate = settings.co2DefaultRate();
        this.fallbackConfidence = settings.co2FallbackConfidence();
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Calculate CO2 emissions for cloud resources";
    }

    @Override
    public List<String> dependencies() {
        return List.of(VirtualTagsStep.NAME);
    }

    @Override
    public EnrichedDataset execute(EnrichedDataset input, PipelineContext context) throws Exception {
        final CoefficientTable table = CoefficientTable.of(loadCoefficients(context));

        if (input.rows().isEmpty()) {
            log.info("No billing rows, no emissions to estimate");
            return input.attach(EnrichmentKey.CO2_ESTIMATES, List.of());
        }

        final QueryEngine engine = context.queryEngine();
        final List<EmissionEstimate> estimates;
        try (BillingView billing = BillingViews.create(engine, BILLING_VIEW, context.runId(),
                BILLING_COLUMNS, input.rows(), maxRows);
             BillingView coefficients = BillingViews.create(engine, COEFFICIENT_VIEW, context.runId(),
                     COEFFICIENT_COLUMNS, table.entries(), Math.max(1, table.size()))) {
            estimates = toEstimates(engine.query(estimateQuery(billing, coefficients)));
        }

        final Map<MatchTier, Integer> byTier = new EnumMap<>(MatchTier.class);
        for (EmissionEstimate e : estimates) {
            byTier.merge(e.matchTier(), 1, Integer::sum);
        }
        metrics.counter("enrichment.co2.estimates", estimates.size());
        log.info("Calculated CO2 for {} row(s) {}", estimates.size(), byTier);
        return input.attach(EnrichmentKey.CO2_ESTIMATES, estimates);
    }

    @Override
    public boolean validate(EnrichedDataset output) {
        return output.has(EnrichmentKey.CO2_ESTIMATES);
    }

    private List<Co2Coefficient> loadCoefficients(PipelineContext context) throws Exception {
        final Optional<List<Co2Coefficient>> cached = CachedLists.read(context.cache(), CACHE_KEY, Co2Coefficient.class);
        if (cached.isPresent()) {
            return cached.get();
        }
        final List<Co2Coefficient> loaded = source.load(context);
        final List<Co2Coefficient> coefficients = (loaded == null) ? List.of() : loaded;
        CachedLists.write(context.cache(), CACHE_KEY, coefficients, coefficientsTtl);
        return coefficients;
    }

    String estimateQuery(BillingView billing, BillingView coefficients) {
        final String row = SqlLiterals.identifier(BillingViews.ROW_INDEX);
        return "WITH matched AS ("
                + " SELECT b.\"ResourceId\", b.\"RegionName\", b.\"BilledCost\", b.\"UsageQuantity\", b." + row + ","
                + " CASE WHEN e.\"ServiceName\" IS NOT NULL THEN 'EXACT'"
                + " WHEN g.\"ServiceName\" IS NOT NULL THEN 'GLOBAL'"
                + " ELSE 'FALLBACK' END AS \"MatchTier\","
                + " COALESCE(e.\"KgCo2PerDollar\", g.\"KgCo2PerDollar\") AS \"PerDollar\","
                + " COALESCE(e.\"KgCo2PerUnit\", g.\"KgCo2PerUnit\") AS \"PerUnit\","
                + " COALESCE(e.\"Confidence\", g.\"Confidence\") AS \"Confidence\","
                + " COALESCE(e.\"Source\", g.\"Source\") AS \"Source\""
                + " FROM " + billing.ref() + " b"
                + " LEFT JOIN " + coefficients.ref() + " e"
                + " ON b.\"ServiceName\" = e.\"ServiceName\" AND b.\"RegionName\" = e.\"Region\""
                + " LEFT JOIN " + coefficients.ref() + " g"
                + " ON b.\"ServiceName\" = g.\"ServiceName\" AND g.\"Region\" = "
                + SqlLiterals.quote(Co2Coefficient.GLOBAL_REGION)
                + "), estimated AS ("
                + " SELECT \"ResourceId\", \"RegionName\", \"MatchTier\", " + row + ","
                + " CASE WHEN \"PerDollar\" > 0 THEN \"BilledCost\" * \"PerDollar\""
                + " WHEN \"PerUnit\" > 0 THEN \"UsageQuantity\" * \"PerUnit\""
                + " ELSE \"BilledCost\" * " + SqlLiterals.literal(defaultRate) + " END AS \"EstimatedKgCo2\","
                + " COALESCE(\"Confidence\", " + SqlLiterals.literal(fallbackConfidence) + ") AS \"Confidence\","
                + " COALESCE(\"Source\", " + SqlLiterals.quote(FALLBACK_SOURCE) + ") AS \"CoefficientSource\""
                + " FROM matched)"
                + " SELECT \"ResourceId\", \"RegionName\", \"MatchTier\", \"EstimatedKgCo2\", \"Confidence\", \"CoefficientSource\""
                + " FROM estimated WHERE \"EstimatedKgCo2\" > 0 ORDER BY " + row;
    }

    private static List<EmissionEstimate> toEstimates(List<Map<String, Object>> rows) {
        final List<EmissionEstimate> out = new ArrayList<>(rows.size());
        for (Map<String, Object> r : rows) {
            final Object id = r.get("ResourceId");
            final Object region = r.get("RegionName");
            out.add(new EmissionEstimate(
                    id == null ? "unknown" : String.valueOf(id),
                    BillingViews.toDouble(r.get("EstimatedKgCo2")),
                    BillingViews.toDouble(r.get("Confidence")),
                    String.valueOf(r.get("CoefficientSource")),
                    region == null ? null : String.valueOf(region),
                    MatchTier.valueOf(String.valueOf(r.get("MatchTier")))));
        }
        return out;
    }
}
