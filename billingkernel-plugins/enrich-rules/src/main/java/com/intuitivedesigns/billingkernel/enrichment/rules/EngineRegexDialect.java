/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.rules;

import java.util.regex.PatternSyntaxException;

/**
 * Constructs {@link java.util.regex} accepts but the query engine's RE2 matcher does not:
 * backreferences, lookaround, atomic groups and possessive quantifiers.
 */
final class EngineRegexDialect {

    private EngineRegexDialect() {}

    /**
     * @throws PatternSyntaxException naming the first unsupported construct and its index
     */
    static void requireSupported(String regex) {
        final int n = regex.length();
        int classDepth = 0;
        int i = 0;
        while (i < n) {
            final char c = regex.charAt(i);

            if (c == '\\') {
                if (i + 1 >= n) return;
                final char d = regex.charAt(i + 1);
                if (d == 'Q') {
                    final int end = regex.indexOf("\\E", i + 2);
                    i = (end < 0) ? n : end + 2;
                    continue;
                }
                if (classDepth == 0 && d >= '1' && d <= '9') {
                    throw unsupported("backreference", regex, i);
                }
                if (classDepth == 0 && d == 'k' && i + 2 < n && regex.charAt(i + 2) == '<') {
                    throw unsupported("named backreference", regex, i);
                }
                i += 2;
                continue;
            }

            if (classDepth > 0) {
                if (c == '[') classDepth++;
                else if (c == ']') classDepth--;
                i++;
                continue;
            }

            if (c == '[') {
                classDepth++;
            } else if (c == '(' && startsWith(regex, i + 1, "?")) {
                if (startsWith(regex, i + 2, "=") || startsWith(regex, i + 2, "!")) {
                    throw unsupported("lookahead", regex, i);
                }
                if (startsWith(regex, i + 2, "<=") || startsWith(regex, i + 2, "<!")) {
                    throw unsupported("lookbehind", regex, i);
                }
                if (startsWith(regex, i + 2, ">")) {
                    throw unsupported("atomic group", regex, i);
                }
                // skip the '?' so it is not read as a quantifier
                i += 2;
                continue;
            } else if ((c == '*' || c == '+' || c == '?' || c == '}') && startsWith(regex, i + 1, "+")) {
                throw unsupported("possessive quantifier", regex, i + 1);
            }
            i++;
        }
    }

    private static boolean startsWith(String s, int from, String prefix) {
        return from < s.length() && s.startsWith(prefix, from);
    }

    private static PatternSyntaxException unsupported(String construct, String regex, int index) {
        return new PatternSyntaxException(construct + " is not supported by the query engine", regex, index);
    }
}
