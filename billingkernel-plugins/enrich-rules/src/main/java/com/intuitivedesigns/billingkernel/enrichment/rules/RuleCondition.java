/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.rules;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Row filter of a rule: {@code operator} applied to one column against {@code values}.
 *
 * <p>For every operator except {@link ConditionOperator#IN} a row matches when any of the values
 * matches. A {@link ConditionField#CUSTOM} condition without a column falls back to
 * {@code ServiceName}.</p>
 */
public record RuleCondition(
        ConditionField field,
        String customField,
        ConditionOperator operator,
        List<String> values
) implements Serializable {

    private static final long serialVersionUID = 1L;

    public RuleCondition {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Condition on " + field + " needs at least one value");
        }
        values = List.copyOf(values);
    }

    public static RuleCondition of(ConditionField field, ConditionOperator operator, String... values) {
        return new RuleCondition(field, null, operator, Arrays.asList(values));
    }

    public static RuleCondition custom(String column, ConditionOperator operator, String... values) {
        return new RuleCondition(ConditionField.CUSTOM, column, operator, Arrays.asList(values));
    }

    /**
     * Column this condition filters on.
     */
    public String column() {
        if (field != ConditionField.CUSTOM) {
            return field.column();
        }
        return (customField == null || customField.isBlank())
                ? ConditionField.SERVICE_NAME.column()
                : customField;
    }
}
