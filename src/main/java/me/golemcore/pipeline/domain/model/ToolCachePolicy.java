package me.golemcore.pipeline.domain.model;

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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;

/**
 * Per-tool declaration of whether and for how long a result may be reused.
 *
 * <p>
 * {@link #NO_CACHE} is the safe default and must be used by every tool with
 * side effects. A TTL of zero means "never expires" for {@link #CACHEABLE}.
 */
public enum ToolCachePolicy {

    NO_CACHE("no_cache", 0), CACHEABLE("cacheable", 0), TTL_SHORT("ttl_short", 300), TTL_MEDIUM("ttl_medium",
            3600), TTL_LONG("ttl_long", 86_400);

    private static final Map<String, ToolCachePolicy> PRESETS = Map.ofEntries(
            Map.entry("web_search", TTL_MEDIUM),
            Map.entry("query_database", TTL_SHORT),
            Map.entry("file_reader", CACHEABLE),
            Map.entry("vector_search", TTL_SHORT),
            Map.entry("api_get", TTL_MEDIUM),
            Map.entry("file_write", NO_CACHE),
            Map.entry("execute_command", NO_CACHE),
            Map.entry("database_write", NO_CACHE),
            Map.entry("api_post", NO_CACHE),
            Map.entry("api_delete", NO_CACHE),
            Map.entry("analyze_data", TTL_SHORT),
            Map.entry("generate_report", TTL_SHORT));

    private final String code;
    private final long ttlSeconds;

    ToolCachePolicy(String code, long ttlSeconds) {
        this.code = code;
        this.ttlSeconds = ttlSeconds;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public boolean isCacheable() {
        return this != NO_CACHE;
    }

    /**
     * Expiration timestamp in epoch millis for an entry created at
     * {@code createdAtMillis}, or 0 when the entry never expires.
     */
    public long expiresAt(long createdAtMillis) {
        if (ttlSeconds == 0) {
            return 0L;
        }
        return createdAtMillis + ttlSeconds * 1000L;
    }

    public boolean isExpired(long createdAtMillis, long nowMillis) {
        long expiresAt = expiresAt(createdAtMillis);
        return expiresAt != 0 && nowMillis > expiresAt;
    }

    /**
     * Built-in policy for well-known tool names, {@link #NO_CACHE} otherwise.
     */
    public static ToolCachePolicy presetFor(String toolName) {
        if (toolName == null) {
            return NO_CACHE;
        }
        return PRESETS.getOrDefault(toolName, NO_CACHE);
    }

    public static Map<String, ToolCachePolicy> presets() {
        return PRESETS;
    }
}
