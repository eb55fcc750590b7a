/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.enrichment.rules;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Bounded cache of compiled regular expressions shared by the rule steps.
 */
public final class PatternCache {

    public static final long DEFAULT_MAX_SIZE = 512;

    private final Cache<String, Pattern> compiled;

    public PatternCache() {
        this(DEFAULT_MAX_SIZE);
    }

    public PatternCache(long maxSize) {
        this.compiled = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .build();
    }

    /**
     * @throws PatternSyntaxException when {@code regex} does not compile
     */
    public Pattern compile(String regex) {
        Objects.requireNonNull(regex, "regex");
        return compiled.get(regex, Pattern::compile);
    }

    /**
     * Compiles a pattern that will be evaluated by the query engine rather than in the JVM.
     *
     * @throws PatternSyntaxException when {@code regex} does not compile or uses a construct the
     *         engine cannot evaluate (backreferences, lookaround, atomic groups, possessive quantifiers)
     */
    public Pattern compileForEngine(String regex) {
        final Pattern pattern = compile(regex);
        EngineRegexDialect.requireSupported(regex);
        return pattern;
    }

    /**
     * Partial match, like {@link java.util.regex.Matcher#find()}.
     */
    public boolean find(String regex, CharSequence input) {
        return input != null && compile(regex).matcher(input).find();
    }

    public long size() {
        compiled.cleanUp();
        return compiled.estimatedSize();
    }
}
