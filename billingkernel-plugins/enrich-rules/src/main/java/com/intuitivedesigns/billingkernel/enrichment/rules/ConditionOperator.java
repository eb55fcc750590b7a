/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.rules;

public enum ConditionOperator {
    EQUALS,
    CONTAINS,
    STARTS_WITH,
    IN,
    REGEX
}
