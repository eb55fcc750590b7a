/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.cache;

import com.intuitivedesigns.billingkernel.config.PipelineConfig;
import com.intuitivedesigns.billingkernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Durable, categorized cache on Redis.
 *
 * <p>Layout under a namespace {@code ns}:</p>
 * <ul>
 *   <li>{@code ns:entry:<key>}: hash {@code {value, createdAt, expiresAt?, type}} (primary)</li>
 *   <li>{@code ns:keys}: set of every cached key</li>
 *   <li>{@code ns:type:<category>}: set of keys per category</li>
 *   <li>{@code ns:expiry}: sorted set of key scored by expiresAt (epoch ms)</li>
 * </ul>
 *
 * <p>Expiry is enforced by reads (lazy eviction) and {@link #cleanup()}. When Redis cannot be reached
 * every operation degrades to a miss / no-op / zero and logs a rate-limited warning.</p>
 */
public final class RedisCacheProvider implements CategorizedCacheProvider {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheProvider.class);

    public static final String KEY_HOST = "redis.host";
    public static final String KEY_PORT = "redis.port";
    public static final String KEY_PASSWORD = "redis.password";
    public static final String KEY_TIMEOUT_MS = "redis.timeout.ms";
    public static final String KEY_NAMESPACE = "redis.namespace";
    public static final String KEY_DEFAULT_TTL_MS = "redis.default.ttl.ms";

    public static final String DEFAULT_NAMESPACE = "billingkernel:cache";
    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    static final String F_VALUE = "value";
    static final String F_CREATED_AT = "createdAt";
    static final String F_EXPIRES_AT = "expiresAt";
    static final String F_TYPE = "type";

    private static final long ERROR_LOG_INTERVAL_MS = 5_000L;

    private final JedisPool pool;
    private final String namespace;
    private final Duration defaultTtl;
    private final CacheValueCodec codec;
    private final MetricsRuntime metrics;
    private final Clock clock;

    private volatile long lastErrorLogAtMs = 0L;

    public RedisCacheProvider(JedisPool pool, String namespace, Duration defaultTtl, CacheValueCodec codec, MetricsRuntime metrics) {
        this(pool, namespace, defaultTtl, codec, metrics, Clock.systemUTC());
    }

    RedisCacheProvider(JedisPool pool, String namespace, Duration defaultTtl, CacheValueCodec codec,
                       MetricsRuntime metrics, Clock clock) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.namespace = (namespace == null || namespace.isBlank()) ? DEFAULT_NAMESPACE : namespace.trim();
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static RedisCacheProvider fromConfig(PipelineConfig config, MetricsRuntime metrics) {
        final String host = config.getString(KEY_HOST, "localhost");
        final int port = config.getInt(KEY_PORT, 6379);
        final String password = config.getString(KEY_PASSWORD, null);
        final int timeout = config.getInt(KEY_TIMEOUT_MS, 2000);
        final String ns = config.getString(KEY_NAMESPACE, DEFAULT_NAMESPACE);
        final Duration ttl = config.getDurationMs(KEY_DEFAULT_TTL_MS, DEFAULT_TTL);

        final JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(config.getInt("redis.pool.max", 32));
        poolConfig.setMaxIdle(config.getInt("redis.pool.idle", 8));
        poolConfig.setMinIdle(config.getInt("redis.pool.min", 0));
        poolConfig.setTestOnBorrow(false); // fast borrow
        poolConfig.setTestWhileIdle(true); // health check in background

        final JedisPool pool = (password != null && !password.isBlank())
                ? new JedisPool(poolConfig, host, port, timeout, password)
                : new JedisPool(poolConfig, host, port, timeout);

        log.info("Redis cache active: {}:{} namespace='{}' defaultTtl={}ms", host, port, ns, ttl.toMillis());
        return new RedisCacheProvider(pool, ns, ttl, new SerializedValueCodec(), metrics);
    }

    // --- Key layout ---

    String entryKey(String key) {
        return namespace + ":entry:" + key;
    }

    String keysKey() {
        return namespace + ":keys";
    }

    String typeKey(String category) {
        return namespace + ":type:" + category;
    }

    String expiryKey() {
        return namespace + ":expiry";
    }

    // --- CacheProvider ---

    @Override
    public Optional<Object> get(String key) {
        if (key == null) return Optional.empty();
        final long start = System.nanoTime();

        try (Jedis jedis = pool.getResource()) {
            final Map<String, String> fields = jedis.hgetAll(entryKey(key));
            if (fields == null || fields.isEmpty()) {
                metrics.counter("cache.misses");
                return Optional.empty();
            }

            if (isExpired(fields, clock.millis())) {
                removeIndexed(jedis, key, fields.get(F_TYPE));
                metrics.counter("cache.misses");
                return Optional.empty();
            }

            final Object value;
            try {
                value = codec.decode(fields.get(F_VALUE));
            } catch (IllegalArgumentException e) {
                log.warn("Dropping undecodable cache entry key={}: {}", key, e.getMessage());
                removeIndexed(jedis, key, fields.get(F_TYPE));
                metrics.counter("cache.misses");
                return Optional.empty();
            }

            metrics.counter("cache.hits");
            return Optional.of(value);
        } catch (JedisException e) {
            degrade("GET", key, e);
            return Optional.empty();
        } finally {
            recordLatency(start);
        }
    }

    @Override
    public void set(String key, Object value) {
        set(key, value, null, DEFAULT_CATEGORY);
    }

    @Override
    public void set(String key, Object value, Duration ttl, String category) {
        Objects.requireNonNull(key, "key");
        final String type = (category == null || category.isBlank()) ? DEFAULT_CATEGORY : category;
        final String payload = codec.encode(value);

        final Duration effective = (ttl == null) ? defaultTtl : ttl;
        final long now = clock.millis();
        final Long expiresAt = (effective.isZero() || effective.isNegative()) ? null : now + effective.toMillis();

        final Map<String, String> fields = new LinkedHashMap<>();
        fields.put(F_VALUE, payload);
        fields.put(F_CREATED_AT, Long.toString(now));
        fields.put(F_TYPE, type);
        if (expiresAt != null) {
            fields.put(F_EXPIRES_AT, Long.toString(expiresAt));
        }

        try (Jedis jedis = pool.getResource()) {
            final String previousType = jedis.hget(entryKey(key), F_TYPE);

            final Transaction tx = jedis.multi();
            tx.del(entryKey(key));
            tx.hset(entryKey(key), fields);
            tx.sadd(keysKey(), key);
            tx.sadd(typeKey(type), key);
            if (previousType != null && !previousType.equals(type)) {
                tx.srem(typeKey(previousType), key);
            }
            if (expiresAt != null) {
                tx.zadd(expiryKey(), expiresAt, key);
            } else {
                tx.zrem(expiryKey(), key);
            }
            tx.exec();

            metrics.counter("cache.writes");
        } catch (JedisException e) {
            degrade("SET", key, e);
        }
    }

    @Override
    public void delete(String key) {
        if (key == null) return;
        try (Jedis jedis = pool.getResource()) {
            removeIndexed(jedis, key, jedis.hget(entryKey(key), F_TYPE));
        } catch (JedisException e) {
            degrade("DEL", key, e);
        }
    }

    @Override
    public void clear() {
        try (Jedis jedis = pool.getResource()) {
            final Set<String> keys = jedis.smembers(keysKey());
            final List<String> doomed = new ArrayList<>(keys.size() + 2);
            for (String key : keys) {
                doomed.add(entryKey(key));
            }
            doomed.addAll(scanTypeKeys(jedis));
            doomed.add(keysKey());
            doomed.add(expiryKey());

            jedis.del(doomed.toArray(new String[0]));
            log.info("Redis cache namespace '{}' cleared ({} entries)", namespace, keys.size());
        } catch (JedisException e) {
            degrade("CLEAR", namespace, e);
        }
    }

    // --- CategorizedCacheProvider ---

    @Override
    public void clearByType(String category) {
        if (category == null) return;
        try (Jedis jedis = pool.getResource()) {
            final Set<String> keys = jedis.smembers(typeKey(category));

            final Transaction tx = jedis.multi();
            for (String key : keys) {
                tx.del(entryKey(key));
                tx.srem(keysKey(), key);
                tx.zrem(expiryKey(), key);
            }
            tx.del(typeKey(category));
            tx.exec();

            log.debug("Cleared {} entries of category '{}'", keys.size(), category);
        } catch (JedisException e) {
            degrade("CLEAR_TYPE", category, e);
        }
    }

    @Override
    public int cleanup() {
        try (Jedis jedis = pool.getResource()) {
            final List<String> expired = jedis.zrangeByScore(expiryKey(), Double.NEGATIVE_INFINITY, clock.millis());
            for (String key : expired) {
                removeIndexed(jedis, key, jedis.hget(entryKey(key), F_TYPE));
            }
            if (!expired.isEmpty()) {
                log.info("Cleanup removed {} expired cache entries", expired.size());
            }
            return expired.size();
        } catch (JedisException e) {
            degrade("CLEANUP", namespace, e);
            return 0;
        }
    }

    /**
     * Walks every indexed entry. Entries past expiry that were not cleaned up yet are still counted.
     * Pushes the {@code cache.entries} and {@code cache.size.bytes} gauges.
     */
    @Override
    public CacheStats stats() {
        try (Jedis jedis = pool.getResource()) {
            long total = 0L;
            long size = 0L;
            Long oldest = null;
            Long newest = null;
            final Map<String, Long> byCategory = new HashMap<>();

            for (String key : jedis.smembers(keysKey())) {
                final Map<String, String> fields = jedis.hgetAll(entryKey(key));
                if (fields == null || fields.isEmpty()) continue;

                total++;
                final String value = fields.get(F_VALUE);
                size += (value == null) ? 0 : value.length();
                byCategory.merge(fields.getOrDefault(F_TYPE, DEFAULT_CATEGORY), 1L, Long::sum);

                final Long created = parseLong(fields.get(F_CREATED_AT));
                if (created != null) {
                    if (oldest == null || created < oldest) oldest = created;
                    if (newest == null || created > newest) newest = created;
                }
            }

            metrics.gauge("cache.entries", total);
            metrics.gauge("cache.size.bytes", size);
            return new CacheStats(total, size, byCategory,
                    Optional.ofNullable(oldest).map(Instant::ofEpochMilli),
                    Optional.ofNullable(newest).map(Instant::ofEpochMilli));
        } catch (JedisException e) {
            degrade("STATS", namespace, e);
            return CacheStats.empty();
        }
    }

    @Override
    public void close() {
        if (!pool.isClosed()) {
            pool.close();
        }
    }

    // --- Helpers ---

    private void removeIndexed(Jedis jedis, String key, String type) {
        final Transaction tx = jedis.multi();
        tx.del(entryKey(key));
        tx.srem(keysKey(), key);
        tx.zrem(expiryKey(), key);
        if (type != null) {
            tx.srem(typeKey(type), key);
        }
        tx.exec();
    }

    private Set<String> scanTypeKeys(Jedis jedis) {
        final Set<String> out = new HashSet<>();
        final ScanParams params = new ScanParams().match(typeKey("*")).count(100);
        String cursor = ScanParams.SCAN_POINTER_START;
        do {
            final ScanResult<String> page = jedis.scan(cursor, params);
            out.addAll(page.getResult());
            cursor = page.getCursor();
        } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
        return out;
    }

    private static boolean isExpired(Map<String, String> fields, long nowMs) {
        final Long expiresAt = parseLong(fields.get(F_EXPIRES_AT));
        return expiresAt != null && nowMs >= expiresAt;
    }

    private static Long parseLong(String s) {
        if (s == null || s.isEmpty()) return null;
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void degrade(String op, String key, JedisException e) {
        metrics.counter("cache.errors");
        final long nowMs = System.currentTimeMillis();
        if (nowMs - lastErrorLogAtMs > ERROR_LOG_INTERVAL_MS) {
            lastErrorLogAtMs = nowMs;
            log.warn("Redis {} failed key={} (cache degraded to no-op): {}", op, key, e.getMessage());
        } else {
            log.debug("Redis {} failed key={}: {}", op, key, e.getMessage());
        }
    }

    private void recordLatency(long startNs) {
        metrics.timer("cache.latency", (System.nanoTime() - startNs) / 1_000_000);
    }
}
