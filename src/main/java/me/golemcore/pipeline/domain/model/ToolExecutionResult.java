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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a tool invocation, successful or not. Only {@code observation} is
 * ever shown to the LLM; it is correlated with the original call through
 * {@code toolCallId}.
 *
 * <p>
 * Instances are immutable. The {@code with*} helpers and
 * {@link #asCacheHit(long)} return annotated copies, so a result stored in the
 * idempotency cache is never mutated by its readers.
 */
@Value
@Builder(toBuilder = true)
public class ToolExecutionResult {

    public static final String METADATA_CACHE_HIT = "cacheHit";
    public static final String METADATA_CACHED_AT = "cachedAt";
    public static final String ERROR_PREFIX = "Error: ";

    String toolCallId;
    String toolName;
    String observation;
    OutputLevel outputLevel;

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    boolean success;
    ToolFailureKind failureKind;
    String errorType;
    String errorCode;
    String errorMessage;

    String artifactId;
    @JsonIgnore
    String dataFile;
    long dataSizeBytes;
    String dataHash;
    String dataSummary;

    long durationMs;
    int retryCount;
    ToolCachePolicy cachePolicy;
    String idempotencyKey;
    long createdAt;
    long expiresAt;

    @Builder.Default
    Map<String, Object> metadata = Collections.emptyMap();

    /**
     * Successful result whose observation was already rendered.
     */
    public static ToolExecutionResult success(String toolCallId, String toolName, String observation,
            OutputLevel outputLevel, long createdAt) {
        return ToolExecutionResult.builder()
                .toolCallId(toolCallId)
                .toolName(toolName)
                .observation(observation)
                .outputLevel(outputLevel)
                .success(true)
                .createdAt(createdAt)
                .build();
    }

    /**
     * Failed result. The observation the LLM sees is {@code "Error: <message>"}.
     */
    public static ToolExecutionResult error(String toolCallId, String toolName, ToolFailureKind failureKind,
            String errorType, String errorCode, String errorMessage, long createdAt) {
        return ToolExecutionResult.builder()
                .toolCallId(toolCallId)
                .toolName(toolName)
                .observation(ERROR_PREFIX + errorMessage)
                .outputLevel(OutputLevel.BRIEF)
                .success(false)
                .failureKind(failureKind)
                .errorType(errorType)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .createdAt(createdAt)
                .build();
    }

    public static ToolExecutionResult timeout(String toolCallId, String toolName, long timeoutMs, long createdAt) {
        return error(toolCallId, toolName, ToolFailureKind.TIMEOUT, ToolInvocationRequest.TIMEOUT_ERROR_TYPE,
                "TIMEOUT", "Tool execution timed out after " + timeoutMs + "ms", createdAt);
    }

    public boolean isExpired(long nowMillis) {
        return expiresAt != 0 && nowMillis > expiresAt;
    }

    public long cacheAgeMillis(long nowMillis) {
        return nowMillis - createdAt;
    }

    public boolean isCacheHit() {
        return Boolean.TRUE.equals(metadata.get(METADATA_CACHE_HIT));
    }

    public ToolExecutionResult withDuration(long newDurationMs) {
        return toBuilder().durationMs(newDurationMs).build();
    }

    public ToolExecutionResult withRetry(int newRetryCount) {
        return toBuilder().retryCount(newRetryCount).build();
    }

    public ToolExecutionResult withToolCallId(String newToolCallId) {
        return toBuilder().toolCallId(newToolCallId).build();
    }

    public ToolExecutionResult withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return toBuilder().metadata(Collections.unmodifiableMap(copy)).build();
    }

    /**
     * Copy flagged as served from the cache at {@code cachedAtMillis}.
     */
    public ToolExecutionResult asCacheHit(long cachedAtMillis) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(METADATA_CACHE_HIT, true);
        copy.put(METADATA_CACHED_AT, cachedAtMillis);
        return toBuilder().metadata(Collections.unmodifiableMap(copy)).build();
    }
}
