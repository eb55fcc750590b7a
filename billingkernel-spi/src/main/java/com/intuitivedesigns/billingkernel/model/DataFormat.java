/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.model;

public enum DataFormat {
    FOCUS,
    CUR,
    CSV,
    PARQUET
}
