/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Flat key/value configuration backed by {@link Properties}.
 *
 * <p>Instances are created explicitly by the caller (no process-wide singleton) so that
 * independent pipelines and tests never share state. Resolution order for {@link #load()}:
 * {@code -Dbk.config.path}, then ENV {@code BK_CONFIG_PATH}, then an empty config.</p>
 */
public final class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String SYS_CONFIG_PATH = "bk.config.path";
    public static final String ENV_CONFIG_PATH = "BK_CONFIG_PATH";

    private final Properties props;

    private PipelineConfig(Properties props) {
        this.props = props;
    }

    // --- Factories ---

    public static PipelineConfig load() {
        String path = System.getProperty(SYS_CONFIG_PATH);
        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_CONFIG_PATH);
        }

        if (path == null || path.isBlank()) {
            log.warn("No configuration file specified (-D{} or {}); using defaults", SYS_CONFIG_PATH, ENV_CONFIG_PATH);
            return empty();
        }
        return fromFile(path);
    }

    public static PipelineConfig fromFile(String path) {
        Objects.requireNonNull(path, "path");
        Properties p = new Properties();
        try (InputStream is = new FileInputStream(path)) {
            p.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config file: " + path, e);
        }
        log.info("Loaded {} properties from {}", p.size(), path);
        return new PipelineConfig(p);
    }

    public static PipelineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource");
        Properties p = new Properties();
        try (InputStream is = PipelineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalArgumentException("Resource not found on classpath: " + resource);
            }
            p.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config resource: " + resource, e);
        }
        return new PipelineConfig(p);
    }

    public static PipelineConfig fromMap(Map<String, ?> values) {
        Properties p = new Properties();
        if (values != null) {
            values.forEach((k, v) -> {
                if (k != null && v != null) p.setProperty(k, String.valueOf(v));
            });
        }
        return new PipelineConfig(p);
    }

    public static PipelineConfig empty() {
        return new PipelineConfig(new Properties());
    }

    // --- Typed getters ---

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid int for '{}': '{}' (using {})", key, val, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for '{}': '{}' (using {})", key, val, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Double.parseDouble(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid double for '{}': '{}' (using {})", key, val, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    /**
     * Reads a millisecond value as a {@link Duration}.
     */
    public Duration getDurationMs(String key, Duration defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Duration.ofMillis(Long.parseLong(val.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid duration (ms) for '{}': '{}' (using {})", key, val, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Comma separated list; blank items are dropped.
     */
    public List<String> getList(String key) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String part : val.split(",")) {
            String t = part.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return Collections.unmodifiableList(out);
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }
}
