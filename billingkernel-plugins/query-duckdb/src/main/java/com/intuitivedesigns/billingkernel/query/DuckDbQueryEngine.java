/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.query;

import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.error.QueryException;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Embedded DuckDB over JDBC.
 *
 * <p>Holds a single connection: temporary views live per connection, so every statement of a run
 * must go through the same one. Statements are serialized with a lock.</p>
 */
public final class DuckDbQueryEngine implements QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(DuckDbQueryEngine.class);

    public static final String KEY_URL = "duckdb.url";
    public static final String DEFAULT_URL = "jdbc:duckdb:";

    private final Connection connection;
    private final MetricsRuntime metrics;
    private final ReentrantLock lock = new ReentrantLock();

    public DuckDbQueryEngine(Connection connection, MetricsRuntime metrics) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public static DuckDbQueryEngine open(String url, MetricsRuntime metrics) {
        try {
            final Connection conn = DriverManager.getConnection(url);
            log.info("DuckDB query engine active: {}", url);
            return new DuckDbQueryEngine(conn, metrics);
        } catch (SQLException e) {
            throw new QueryException("Failed to open DuckDB at " + url, null, e);
        }
    }

    public static DuckDbQueryEngine fromConfig(PipelineConfig config, MetricsRuntime metrics) {
        return open(config.getString(KEY_URL, DEFAULT_URL), metrics);
    }

    @Override
    public List<Map<String, Object>> query(String sql) {
        Objects.requireNonNull(sql, "sql");
        final long start = System.nanoTime();

        lock.lock();
        try (Statement stmt = connection.createStatement()) {
            if (!stmt.execute(sql)) {
                return List.of();
            }
            try (ResultSet rs = stmt.getResultSet()) {
                return readRows(rs);
            }
        } catch (SQLException e) {
            metrics.counter("query.errors");
            throw new QueryException("Query failed: " + e.getMessage(), sql, e);
        } finally {
            lock.unlock();
            metrics.timer("query.latency", (System.nanoTime() - start) / 1_000_000);
        }
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        final ResultSetMetaData meta = rs.getMetaData();
        final int cols = meta.getColumnCount();
        final String[] labels = new String[cols];
        for (int i = 0; i < cols; i++) {
            labels[i] = meta.getColumnLabel(i + 1);
        }

        final List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            final Map<String, Object> row = new LinkedHashMap<>(cols * 2);
            for (int i = 0; i < cols; i++) {
                row.put(labels[i], rs.getObject(i + 1));
            }
            rows.add(Collections.unmodifiableMap(row));
        }
        return Collections.unmodifiableList(rows);
    }

    @Override
    public void close() {
        lock.lock();
        try {
            connection.close();
            log.info("DuckDB query engine closed.");
        } catch (SQLException e) {
            log.warn("Error closing DuckDB connection", e);
        } finally {
            lock.unlock();
        }
    }
}
