/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.billingkernel.cache;

import com.intuitivedesigns.billingkernel.metrics.MetricsFactory;
import com.intuitivedesigns.billingkernel.metrics.MicrometerMetricsRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Transaction;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisCacheProviderTest {

    private static final long NOW = 1_700_000_000_000L;
    private static final String NS = "test";

    @Mock
    private JedisPool pool;

    @Mock
    private Jedis jedis;

    @Mock
    private Transaction tx;

    private final SerializedValueCodec codec = new SerializedValueCodec();
    private RedisCacheProvider cache;

    @BeforeEach
    void setUp() {
        lenient().when(pool.getResource()).thenReturn(jedis);
        cache = new RedisCacheProvider(pool, NS, Duration.ofHours(24), codec, MetricsFactory.noop(),
                Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
    }

    @Test
    void get_freshEntry_shouldDecodeValue() {
        when(jedis.hgetAll("test:entry:k")).thenReturn(Map.of(
                "value", codec.encode("hello"),
                "createdAt", Long.toString(NOW - 10),
                "expiresAt", Long.toString(NOW + 1_000),
                "type", "general"));

        assertEquals("hello", cache.get("k").orElseThrow());
        verify(jedis, never()).multi();
    }

    @Test
    void get_expiredEntry_shouldMissAndEvictFromEveryIndex() {
        when(jedis.hgetAll("test:entry:k")).thenReturn(Map.of(
                "value", codec.encode("stale"),
                "createdAt", Long.toString(NOW - 10_000),
                "expiresAt", Long.toString(NOW),
                "type", "kpi"));
        when(jedis.multi()).thenReturn(tx);

        assertTrue(cache.get("k").isEmpty());

        verify(tx).del("test:entry:k");
        verify(tx).srem("test:keys", "k");
        verify(tx).zrem("test:expiry", "k");
        verify(tx).srem("test:type:kpi", "k");
        verify(tx).exec();
    }

    @Test
    void get_missingEntry_shouldMiss() {
        when(jedis.hgetAll("test:entry:nope")).thenReturn(Map.of());

        assertTrue(cache.get("nope").isEmpty());
    }

    @Test
    void set_shouldWriteEntryAndAllIndexes() {
        when(jedis.multi()).thenReturn(tx);

        cache.set("daily", List.of(1, 2, 3), Duration.ofHours(4), "daily_costs");

        long expiresAt = NOW + Duration.ofHours(4).toMillis();
        verify(tx).hset(eq("test:entry:daily"), argThat((Map<String, String> m) ->
                "daily_costs".equals(m.get("type"))
                        && Long.toString(expiresAt).equals(m.get("expiresAt"))
                        && Long.toString(NOW).equals(m.get("createdAt"))
                        && List.of(1, 2, 3).equals(codec.decode(m.get("value")))));
        verify(tx).sadd("test:keys", "daily");
        verify(tx).sadd("test:type:daily_costs", "daily");
        verify(tx).zadd("test:expiry", (double) expiresAt, "daily");
        verify(tx).exec();
    }

    @Test
    void set_withoutTtl_shouldOmitExpiryAndUnindexIt() {
        when(jedis.multi()).thenReturn(tx);

        cache.set("forever", "v", Duration.ZERO, null);

        verify(tx).hset(eq("test:entry:forever"), argThat((Map<String, String> m) ->
                !m.containsKey("expiresAt") && "general".equals(m.get("type"))));
        verify(tx).zrem("test:expiry", "forever");
        verify(tx, never()).zadd(anyString(), anyDouble(), anyString());
    }

    @Test
    void set_categoryChange_shouldMoveKeyBetweenTypeSets() {
        when(jedis.hget("test:entry:k", "type")).thenReturn("old");
        when(jedis.multi()).thenReturn(tx);

        cache.set("k", "v", Duration.ofMinutes(1), "new");

        verify(tx).srem("test:type:old", "k");
        verify(tx).sadd("test:type:new", "k");
    }

    @Test
    void set_nonSerializableValue_shouldRejectBeforeTouchingRedis() {
        Object notSerializable = new Object();

        assertThrows(IllegalArgumentException.class, () -> cache.set("k", notSerializable));
        verify(jedis, never()).multi();
        verify(tx, never()).hset(anyString(), anyMap());
    }

    @Test
    void clearByType_shouldRemoveOnlyThatCategory() {
        when(jedis.smembers("test:type:anomalies")).thenReturn(Set.of("a1"));
        when(jedis.multi()).thenReturn(tx);

        cache.clearByType("anomalies");

        verify(tx).del("test:entry:a1");
        verify(tx).srem("test:keys", "a1");
        verify(tx).zrem("test:expiry", "a1");
        verify(tx).del("test:type:anomalies");
    }

    @Test
    void cleanup_shouldRemoveEveryExpiredKeyAndReturnCount() {
        when(jedis.zrangeByScore(eq("test:expiry"), eq(Double.NEGATIVE_INFINITY), eq((double) NOW)))
                .thenReturn(List.of("a", "b"));
        when(jedis.hget(anyString(), eq("type"))).thenReturn("general");
        when(jedis.multi()).thenReturn(tx);

        assertEquals(2, cache.cleanup());

        verify(tx).del("test:entry:a");
        verify(tx).del("test:entry:b");
    }

    @Test
    void stats_shouldAggregateSizeCategoriesAndCreationRange() {
        when(jedis.smembers("test:keys")).thenReturn(Set.of("a", "b", "gone"));
        when(jedis.hgetAll("test:entry:a")).thenReturn(Map.of(
                "value", "12345", "createdAt", "100", "type", "kpi"));
        when(jedis.hgetAll("test:entry:b")).thenReturn(Map.of(
                "value", "123", "createdAt", "300", "type", "custom"));
        when(jedis.hgetAll("test:entry:gone")).thenReturn(Map.of());

        CacheStats stats = cache.stats();

        assertEquals(2, stats.totalEntries());
        assertEquals(8, stats.totalSizeBytes());
        assertEquals(Map.of("kpi", 1L, "custom", 1L), stats.entriesByCategory());
        assertEquals(Instant.ofEpochMilli(100), stats.oldestEntry().orElseThrow());
        assertEquals(Instant.ofEpochMilli(300), stats.newestEntry().orElseThrow());
    }

    @Test
    void stats_shouldPushEntryAndSizeGauges() {
        MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime();
        RedisCacheProvider measured = new RedisCacheProvider(pool, NS, Duration.ofHours(24), codec, metrics,
                Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
        when(jedis.smembers("test:keys")).thenReturn(Set.of("a", "b"));
        when(jedis.hgetAll("test:entry:a")).thenReturn(Map.of("value", "1234", "createdAt", "100"));
        when(jedis.hgetAll("test:entry:b")).thenReturn(Map.of("value", "12", "createdAt", "200"));

        measured.stats();

        assertEquals(2.0, metrics.gaugeValue("cache.entries"));
        assertEquals(6.0, metrics.gaugeValue("cache.size.bytes"));
    }
}
