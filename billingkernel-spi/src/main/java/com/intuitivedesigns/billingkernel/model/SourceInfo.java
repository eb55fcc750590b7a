/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Where a dataset came from.
 */
public record SourceInfo(CloudProvider provider, DataFormat format, Instant receivedAt, String fileName) {

    public SourceInfo {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(receivedAt, "receivedAt");
    }

    public static SourceInfo of(CloudProvider provider, DataFormat format) {
        return new SourceInfo(provider, format, Instant.now(), null);
    }

    public Optional<String> fileNameOpt() {
        return Optional.ofNullable(fileName);
    }
}
