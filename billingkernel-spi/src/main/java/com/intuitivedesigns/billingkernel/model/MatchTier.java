/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.model;

/**
 * Which stage of the coefficient cascade produced an estimate.
 */
public enum MatchTier {
    /** (service, region) matched exactly. */
    EXACT,
    /** (service, "global") matched. */
    GLOBAL,
    /** flat default rate. */
    FALLBACK
}
