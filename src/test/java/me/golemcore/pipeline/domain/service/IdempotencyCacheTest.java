package me.golemcore.pipeline.domain.service;

import me.golemcore.pipeline.domain.model.CacheStats;
import me.golemcore.pipeline.domain.model.OutputLevel;
import me.golemcore.pipeline.domain.model.ToolCachePolicy;
import me.golemcore.pipeline.domain.model.ToolExecutionResult;
import me.golemcore.pipeline.domain.model.ToolFailureKind;
import me.golemcore.pipeline.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdempotencyCacheTest {

    private static final Instant START = Instant.parse("2026-01-01T12:00:00Z");

    private MutableClock clock;
    private IdempotencyCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        cache = new IdempotencyCache(3, clock);
    }

    private ToolExecutionResult success(String toolName, String observation) {
        return ToolExecutionResult.success("call_1", toolName, observation, OutputLevel.BRIEF, clock.millis());
    }

    @Test
    void shouldRejectNonPositiveMaxSize() {
        assertThrows(IllegalArgumentException.class, () -> new IdempotencyCache(0, clock));
    }

    @Test
    void shouldReturnEmptyForMissingKey() {
        assertTrue(cache.get("missing").isEmpty());
    }

    @Test
    void shouldStoreAndCountHits() {
        cache.set("k1", success("web_search", "ok"));

        assertTrue(cache.get("k1").isPresent());
        assertTrue(cache.get("k1").isPresent());

        assertEquals(2, cache.getStats().getTotalHits());
    }

    @Test
    void shouldExpireEntriesAfterTtl() {
        cache.set("k1", success("web_search", "ok"), 10);

        clock.advance(Duration.ofSeconds(10));
        assertTrue(cache.get("k1").isPresent());

        clock.advance(Duration.ofMillis(1));
        assertTrue(cache.get("k1").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldKeepZeroTtlEntriesForever() {
        cache.set("k1", success("file_reader", "ok"), 0);

        clock.advance(Duration.ofDays(365));

        assertTrue(cache.get("k1").isPresent());
    }

    @Test
    void shouldEvictOldestEntryWhenFull() {
        cache.set("a", success("t", "a"));
        clock.advanceMillis(10);
        cache.set("b", success("t", "b"));
        clock.advanceMillis(10);
        cache.set("c", success("t", "c"));
        clock.advanceMillis(10);

        cache.set("d", success("t", "d"));

        assertEquals(3, cache.size());
        assertTrue(cache.get("a").isEmpty());
        assertTrue(cache.get("b").isPresent());
        assertTrue(cache.get("d").isPresent());
    }

    @Test
    void shouldUpdateExistingKeyWithoutEvicting() {
        cache.set("a", success("t", "a"));
        clock.advanceMillis(10);
        cache.set("b", success("t", "b"));
        clock.advanceMillis(10);
        cache.set("c", success("t", "c"));
        cache.get("a");

        clock.advanceMillis(10);
        cache.set("a", success("t", "a2"));

        assertEquals(3, cache.size());
        assertEquals("a2", cache.get("a").orElseThrow().getObservation());
        assertTrue(cache.get("b").isPresent());
        CacheStats.EntrySummary entryA = cache.getStats().getNewestEntries().stream()
                .filter(e -> e.getKey().equals("a"))
                .findFirst()
                .orElseThrow();
        assertEquals(START, entryA.getCreatedAt());
        assertEquals(2, entryA.getHitCount());
    }

    @Test
    void shouldCleanupExpiredEntries() {
        cache.set("short", success("t", "s"), 1);
        cache.set("long", success("t", "l"), 100);

        clock.advance(Duration.ofSeconds(2));

        assertEquals(1, cache.cleanupExpired());
        assertEquals(1, cache.size());
    }

    @Test
    void shouldComputeOnceAndServeHitsAfterwards() {
        AtomicInteger executions = new AtomicInteger();

        ToolExecutionResult first = cache.getOrCompute("key", ToolCachePolicy.TTL_SHORT, () -> {
            executions.incrementAndGet();
            return success("query_database", "rows");
        });
        clock.advanceMillis(250);
        ToolExecutionResult second = cache.getOrCompute("key", ToolCachePolicy.TTL_SHORT, () -> {
            executions.incrementAndGet();
            return success("query_database", "other rows");
        });

        assertEquals(1, executions.get());
        assertFalse(first.isCacheHit());
        assertEquals(Boolean.FALSE, first.getMetadata().get(ToolExecutionResult.METADATA_CACHE_HIT));
        assertEquals("key", first.getIdempotencyKey());
        assertEquals(ToolCachePolicy.TTL_SHORT, first.getCachePolicy());
        assertEquals(START.toEpochMilli() + 300_000L, first.getExpiresAt());

        assertTrue(second.isCacheHit());
        assertEquals("rows", second.getObservation());
        assertEquals(START.toEpochMilli() + 250, second.getMetadata().get(ToolExecutionResult.METADATA_CACHED_AT));
    }

    @Test
    void shouldNotMutateStoredEntryOnHit() {
        cache.getOrCompute("key", ToolCachePolicy.CACHEABLE, () -> success("file_reader", "content"));
        cache.getOrCompute("key", ToolCachePolicy.CACHEABLE, () -> success("file_reader", "content"));

        Optional<ToolExecutionResult> stored = cache.get("key");

        assertTrue(stored.isPresent());
        assertFalse(stored.get().isCacheHit());
    }

    @Test
    void shouldBypassCacheForNoCachePolicy() {
        AtomicInteger executions = new AtomicInteger();

        for (int i = 0; i < 3; i++) {
            cache.getOrCompute("key", ToolCachePolicy.NO_CACHE, () -> {
                executions.incrementAndGet();
                return success("file_write", "written");
            });
        }

        assertEquals(3, executions.get());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldNeverCacheFailures() {
        AtomicInteger executions = new AtomicInteger();

        for (int i = 0; i < 2; i++) {
            ToolExecutionResult result = cache.getOrCompute("key", ToolCachePolicy.TTL_MEDIUM, () -> {
                executions.incrementAndGet();
                return ToolExecutionResult.error("call_1", "web_search", ToolFailureKind.EXECUTION_FAILED,
                        "IOException", null, "offline", clock.millis());
            });
            assertFalse(result.isSuccess());
        }

        assertEquals(2, executions.get());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldBuildSemanticKeyFromToolAndParameters() {
        AtomicInteger executions = new AtomicInteger();
        Map<String, Object> params = Map.of("query", "weather");

        cache.getOrCompute("web_search", "1.0.0", params, () -> {
            executions.incrementAndGet();
            return success("web_search", "sunny");
        }, ToolCachePolicy.TTL_MEDIUM, "agent", "default");
        ToolExecutionResult hit = cache.getOrCompute("web_search", "1.0.0", params, () -> {
            executions.incrementAndGet();
            return success("web_search", "rainy");
        }, ToolCachePolicy.TTL_MEDIUM, "agent", "default");

        assertEquals(1, executions.get());
        assertTrue(hit.isCacheHit());
        assertTrue(cache.invalidate("web_search", "1.0.0", params, "agent", "default"));
        assertEquals(0, cache.size());
    }

    @Test
    void shouldComputeDirectlyWhenKeyCannotBeBuilt() {
        AtomicInteger executions = new AtomicInteger();
        Map<String, Object> params = Map.of("bean", new ExplodingBean());

        for (int i = 0; i < 2; i++) {
            ToolExecutionResult result = cache.getOrCompute("web_search", "1.0.0", params, () -> {
                executions.incrementAndGet();
                return success("web_search", "ok");
            }, ToolCachePolicy.TTL_MEDIUM, "agent", "default");
            assertTrue(result.isSuccess());
        }

        assertEquals(2, executions.get());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldInvalidateByTool() {
        cache.set("a", success("web_search", "a"));
        cache.set("b", success("web_search", "b"));
        cache.set("c", success("file_reader", "c"));

        assertEquals(2, cache.invalidateByTool("web_search"));
        assertEquals(1, cache.size());
        assertTrue(cache.get("c").isPresent());
    }

    @Test
    void shouldTruncateLongKeysInStats() {
        String longKey = "k".repeat(80);
        cache.set(longKey, success("web_search", "ok"));

        CacheStats stats = cache.getStats();

        assertEquals(1, stats.getSize());
        assertEquals(3, stats.getMaxSize());
        assertEquals("k".repeat(50) + "...", stats.getNewestEntries().get(0).getKey());
        assertEquals("web_search", stats.getNewestEntries().get(0).getToolName());
    }

    @Test
    void shouldDeleteAndClear() {
        cache.set("a", success("t", "a"));
        cache.set("b", success("t", "b"));

        assertTrue(cache.delete("a"));
        assertFalse(cache.delete("a"));
        cache.clear();

        assertEquals(0, cache.size());
    }

    static class ExplodingBean {
        public String getValue() {
            throw new IllegalStateException("not serializable");
        }
    }
}
