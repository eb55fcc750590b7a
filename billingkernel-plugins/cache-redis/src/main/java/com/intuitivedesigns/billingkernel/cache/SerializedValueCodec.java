/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.cache;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.Base64;

/**
 * Default codec: Java serialization wrapped in a versioned Base64 envelope.
 *
 * <p>Format: {@code V1:<Base64(serialized bytes)>}. Values must be {@link Serializable}; records,
 * immutable JDK collections and boxed scalars all qualify.</p>
 */
public final class SerializedValueCodec implements CacheValueCodec {

    private static final String PROTOCOL_V1 = "V1";
    private static final String PREFIX = PROTOCOL_V1 + ":";

    private static final ObjectInputFilter LIMITS =
            ObjectInputFilter.Config.createFilter("maxdepth=32;maxrefs=1000000;maxbytes=67108864");

    @Override
    public String encode(Object value) {
        if (!(value instanceof Serializable)) {
            throw new IllegalArgumentException("Cache value is not Serializable: "
                    + (value == null ? "null" : value.getClass().getName()));
        }
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(value);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to serialize " + value.getClass().getName(), e);
        }
        return PREFIX + Base64.getEncoder().encodeToString(bytes.toByteArray());
    }

    @Override
    public Object decode(String payload) {
        if (payload == null || !payload.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Unknown cache payload version");
        }
        final byte[] raw;
        try {
            raw = Base64.getDecoder().decode(payload.substring(PREFIX.length()));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Corrupt cache payload (Base64)", e);
        }
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(raw))) {
            in.setObjectInputFilter(LIMITS);
            return in.readObject();
        } catch (IOException | ClassNotFoundException e) {
            throw new IllegalArgumentException("Corrupt cache payload", e);
        }
    }
}
