/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.spi;

import java.util.Locale;

public final class PluginIds {
    private PluginIds() {}

    /**
     * Trims and upper-cases; hyphens become underscores so {@code green-ops-co2} selects {@code GREEN_OPS_CO2}.
     */
    public static String normalize(String s) {
        return s == null ? "" : s.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    }
}
