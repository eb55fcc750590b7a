/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.cache;

/**
 * Converts cached values to and from the string stored in Redis.
 */
public interface CacheValueCodec {

    /**
     * @throws IllegalArgumentException if the value cannot be encoded
     */
    String encode(Object value);

    /**
     * @throws IllegalArgumentException if the payload is corrupt or of an unknown version
     */
    Object decode(String payload);
}
