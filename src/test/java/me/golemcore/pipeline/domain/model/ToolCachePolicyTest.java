package me.golemcore.pipeline.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolCachePolicyTest {

    @Test
    void shouldExposeTtls() {
        assertEquals(0, ToolCachePolicy.NO_CACHE.getTtlSeconds());
        assertEquals(0, ToolCachePolicy.CACHEABLE.getTtlSeconds());
        assertEquals(300, ToolCachePolicy.TTL_SHORT.getTtlSeconds());
        assertEquals(3600, ToolCachePolicy.TTL_MEDIUM.getTtlSeconds());
        assertEquals(86_400, ToolCachePolicy.TTL_LONG.getTtlSeconds());
    }

    @Test
    void shouldComputeExpiry() {
        assertEquals(0L, ToolCachePolicy.CACHEABLE.expiresAt(1_000L));
        assertEquals(301_000L, ToolCachePolicy.TTL_SHORT.expiresAt(1_000L));

        assertFalse(ToolCachePolicy.TTL_SHORT.isExpired(1_000L, 301_000L));
        assertTrue(ToolCachePolicy.TTL_SHORT.isExpired(1_000L, 301_001L));
        assertFalse(ToolCachePolicy.CACHEABLE.isExpired(0L, Long.MAX_VALUE));
    }

    @Test
    void shouldOnlyCacheNonNoCachePolicies() {
        assertFalse(ToolCachePolicy.NO_CACHE.isCacheable());
        assertTrue(ToolCachePolicy.CACHEABLE.isCacheable());
        assertTrue(ToolCachePolicy.TTL_LONG.isCacheable());
    }

    @Test
    void shouldResolvePresets() {
        assertEquals(ToolCachePolicy.TTL_MEDIUM, ToolCachePolicy.presetFor("web_search"));
        assertEquals(ToolCachePolicy.CACHEABLE, ToolCachePolicy.presetFor("file_reader"));
        assertEquals(ToolCachePolicy.NO_CACHE, ToolCachePolicy.presetFor("execute_command"));
        assertEquals(ToolCachePolicy.NO_CACHE, ToolCachePolicy.presetFor("unknown_tool"));
        assertEquals(ToolCachePolicy.NO_CACHE, ToolCachePolicy.presetFor(null));
    }
}
