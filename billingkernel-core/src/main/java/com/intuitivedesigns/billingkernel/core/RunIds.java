/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.core;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Run identifiers of the form {@code exec_<epochMillis>_<7 base36 chars>}.
 */
public final class RunIds {

    private static final char[] BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int SUFFIX_LENGTH = 7;

    private RunIds() {}

    public static String next() {
        final ThreadLocalRandom rnd = ThreadLocalRandom.current();
        final StringBuilder sb = new StringBuilder("exec_").append(System.currentTimeMillis()).append('_');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(BASE36[rnd.nextInt(BASE36.length)]);
        }
        return sb.toString();
    }
}
