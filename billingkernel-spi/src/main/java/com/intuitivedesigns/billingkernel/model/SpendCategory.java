/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.model;

import java.util.Locale;

public enum SpendCategory {
    ML_TRAINING,
    ML_INFERENCE,
    DATA_PROCESSING,
    GPU_COMPUTE,
    AI_SERVICE;

    /**
     * Lower-case hyphenated label, e.g. {@code ml-inference}.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
