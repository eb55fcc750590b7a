/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.spi;

public enum PluginKind {
    STEP,
    CACHE,
    QUERY_ENGINE
}
