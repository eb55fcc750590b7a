/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.tags;

import com.intuitivedesigns.billingkernel.enrichment.rules.ConditionField;
import com.intuitivedesigns.billingkernel.enrichment.rules.ConditionOperator;
import com.intuitivedesigns.billingkernel.enrichment.rules.RuleCondition;

import java.time.Instant;
import java.util.List;

/**
 * Built-in rules used until a rule store is wired in: tag services named like dev and prod.
 */
public final class DefaultTagRules {

    private DefaultTagRules() {}

    public static List<VirtualTagRule> forUser(String userId) {
        final Instant now = Instant.now();
        return List.of(
                VirtualTagRule.builder("rule-1")
                        .name("Tag development resources")
                        .description("Tag all resources with \"dev\" in the service name as development")
                        .condition(RuleCondition.of(ConditionField.SERVICE_NAME, ConditionOperator.CONTAINS, "dev"))
                        .tag("Environment", "Development")
                        .tag("CostCenter", "Engineering")
                        .priority(100)
                        .createdBy(userId)
                        .createdAt(now)
                        .build(),
                VirtualTagRule.builder("rule-2")
                        .name("Tag production resources")
                        .description("Tag all resources with \"prod\" in the service name as production")
                        .condition(RuleCondition.of(ConditionField.SERVICE_NAME, ConditionOperator.CONTAINS, "prod"))
                        .tag("Environment", "Production")
                        .tag("CostCenter", "Operations")
                        .priority(200)
                        .createdBy(userId)
                        .createdAt(now)
                        .build());
    }

    public static TagRuleSource source() {
        return context -> forUser(context.userId());
    }
}
