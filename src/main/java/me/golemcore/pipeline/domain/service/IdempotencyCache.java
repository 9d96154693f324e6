package me.golemcore.pipeline.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pipeline.domain.model.CacheEntry;
import me.golemcore.pipeline.domain.model.CacheStats;
import me.golemcore.pipeline.domain.model.ToolCachePolicy;
import me.golemcore.pipeline.domain.model.ToolExecutionResult;
import me.golemcore.pipeline.domain.model.ToolInvocationRequest;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-wide cache of successful tool results keyed by semantic identity.
 *
 * <p>
 * The key is the MD5 of {@code tool:version:canonicalParams:caller:permission}.
 * The LLM-generated {@code toolCallId} is deliberately not part of it, so the
 * same query issued in a later round is served from the cache.
 *
 * <p>
 * Capacity is bounded; when full, the entry with the oldest creation time is
 * evicted before a new key is inserted. Expired entries are dropped lazily on
 * read and in bulk by {@link #cleanupExpired()}. One lock guards all state.
 */
@Service
@Slf4j
public class IdempotencyCache {

    private static final String LOG_PREFIX = "[Cache]";
    private static final long DEFAULT_TTL_SECONDS = 3600;
    private static final int STATS_ENTRY_LIMIT = 10;
    private static final int STATS_KEY_LENGTH = 50;

    private final int maxSize;
    private final Clock clock;
    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public IdempotencyCache(PipelineProperties properties, Clock clock) {
        this(properties.getCache().getMaxSize(), clock);
    }

    public IdempotencyCache(int maxSize, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Cache max size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.clock = clock;
    }

    /**
     * Returns the cached value and counts the hit. An expired entry is removed
     * and reported as absent.
     */
    public Optional<ToolExecutionResult> get(String key) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(clock.millis())) {
                entries.remove(key);
                return Optional.empty();
            }
            entry.setHitCount(entry.getHitCount() + 1);
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    public void set(String key, ToolExecutionResult value) {
        set(key, value, DEFAULT_TTL_SECONDS);
    }

    /**
     * Stores a value. A TTL of zero means the entry never expires. Updating an
     * existing key keeps its creation time and hit count.
     */
    public void set(String key, ToolExecutionResult value, long ttlSeconds) {
        lock.lock();
        try {
            long now = clock.millis();
            long expiresAt = ttlSeconds > 0 ? now + ttlSeconds * 1000L : 0L;

            CacheEntry existing = entries.get(key);
            if (existing != null) {
                existing.setValue(value);
                existing.setExpiresAt(expiresAt);
                return;
            }

            if (entries.size() >= maxSize) {
                evictOldest();
            }
            entries.put(key, CacheEntry.builder()
                    .key(key)
                    .value(value)
                    .createdAt(now)
                    .expiresAt(expiresAt)
                    .hitCount(0)
                    .build());
        } finally {
            lock.unlock();
        }
    }

    public boolean delete(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of removed entries
     */
    public int cleanupExpired() {
        lock.lock();
        try {
            long now = clock.millis();
            int before = entries.size();
            entries.values().removeIf(entry -> entry.isExpired(now));
            int removed = before - entries.size();
            if (removed > 0) {
                log.debug("{} Removed {} expired entries", LOG_PREFIX, removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Serves a cached result or computes, caches and annotates a fresh one.
     *
     * <p>
     * {@code NO_CACHE} bypasses the cache entirely. Only successful results are
     * stored, with the policy's TTL. Hits are returned as annotated copies
     * ({@code cacheHit=true}, {@code cachedAt}); fresh results carry
     * {@code cacheHit=false}. If the key cannot be built the value is computed
     * without caching.
     */
    public ToolExecutionResult getOrCompute(String toolName, String toolVersion, Map<String, ?> parameters,
            Supplier<ToolExecutionResult> computeFn, ToolCachePolicy cachePolicy, String callerId,
            String permissionLevel) {
        if (!cachePolicy.isCacheable()) {
            return computeFn.get();
        }
        String key;
        try {
            key = ToolInvocationRequest.semanticKey(toolName, toolVersion, parameters, callerId, permissionLevel);
        } catch (RuntimeException e) {
            log.warn("{} Cannot build key for {}, executing uncached: {}", LOG_PREFIX, toolName, e.getMessage());
            return computeFn.get();
        }
        return getOrCompute(key, cachePolicy, computeFn);
    }

    public ToolExecutionResult getOrCompute(String key, ToolCachePolicy cachePolicy,
            Supplier<ToolExecutionResult> computeFn) {
        if (!cachePolicy.isCacheable()) {
            return computeFn.get();
        }

        Optional<ToolExecutionResult> cached = get(key);
        if (cached.isPresent()) {
            log.debug("{} Hit for key {}", LOG_PREFIX, key);
            return cached.get().asCacheHit(clock.millis());
        }

        ToolExecutionResult result = computeFn.get();
        if (result == null || !result.isSuccess()) {
            return result;
        }

        ToolExecutionResult stored = result.toBuilder()
                .cachePolicy(cachePolicy)
                .idempotencyKey(key)
                .expiresAt(cachePolicy.expiresAt(result.getCreatedAt()))
                .build();
        set(key, stored, cachePolicy.getTtlSeconds());
        return stored.withMetadata(ToolExecutionResult.METADATA_CACHE_HIT, false);
    }

    public boolean invalidate(String toolName, String toolVersion, Map<String, ?> parameters, String callerId,
            String permissionLevel) {
        return delete(ToolInvocationRequest.semanticKey(toolName, toolVersion, parameters, callerId,
                permissionLevel));
    }

    /**
     * Drops every entry produced by {@code toolName}.
     *
     * @return number of removed entries
     */
    public int invalidateByTool(String toolName) {
        lock.lock();
        try {
            int before = entries.size();
            entries.values().removeIf(entry -> entry.getValue() != null
                    && toolName.equals(entry.getValue().getToolName()));
            int removed = before - entries.size();
            log.debug("{} Invalidated {} entries for tool {}", LOG_PREFIX, removed, toolName);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public CacheStats getStats() {
        lock.lock();
        try {
            long now = clock.millis();
            List<CacheStats.EntrySummary> newest = entries.values().stream()
                    .sorted(Comparator.comparingLong(CacheEntry::getCreatedAt).reversed())
                    .limit(STATS_ENTRY_LIMIT)
                    .map(entry -> CacheStats.EntrySummary.builder()
                            .key(truncateKey(entry.getKey()))
                            .toolName(entry.getValue() != null ? entry.getValue().getToolName() : null)
                            .createdAt(Instant.ofEpochMilli(entry.getCreatedAt()))
                            .ageSeconds(entry.ageMillis(now) / 1000L)
                            .hitCount(entry.getHitCount())
                            .build())
                    .toList();
            return CacheStats.builder()
                    .size(entries.size())
                    .maxSize(maxSize)
                    .totalHits(entries.values().stream().mapToLong(CacheEntry::getHitCount).sum())
                    .expiredCount((int) entries.values().stream().filter(entry -> entry.isExpired(now)).count())
                    .newestEntries(newest)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    private void evictOldest() {
        entries.values().stream()
                .min(Comparator.comparingLong(CacheEntry::getCreatedAt))
                .map(CacheEntry::getKey)
                .ifPresent(oldest -> {
                    entries.remove(oldest);
                    log.debug("{} Evicted oldest entry {}", LOG_PREFIX, oldest);
                });
    }

    private static String truncateKey(String key) {
        return key.length() > STATS_KEY_LENGTH ? key.substring(0, STATS_KEY_LENGTH) + "..." : key;
    }
}
