/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.rules;

/**
 * Billing column a {@link RuleCondition} inspects. {@link #CUSTOM} names the column explicitly.
 */
public enum ConditionField {
    RESOURCE_ID("ResourceId"),
    SERVICE_NAME("ServiceName"),
    ACCOUNT_ID("AccountId"),
    REGION("RegionName"),
    CUSTOM(null);

    private final String column;

    ConditionField(String column) {
        this.column = column;
    }

    /**
     * Fixed column name, null for {@link #CUSTOM}.
     */
    public String column() {
        return column;
    }
}
