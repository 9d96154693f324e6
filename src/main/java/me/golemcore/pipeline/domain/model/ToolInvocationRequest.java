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

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single "call tool X with parameters P" request.
 *
 * <p>
 * {@code toolCallId} must be the identifier from the LLM's tool-call event and
 * is never generated locally. It is not part of the idempotency key, so the
 * same call issued in a later round can reuse a cached result.
 *
 * <p>
 * Instances are immutable and validated on construction; an invalid request
 * raises {@link ToolRequestValidationException}.
 */
@Value
public class ToolInvocationRequest {

    public static final String DEFAULT_TOOL_VERSION = "1.0.0";
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;
    public static final long MIN_TIMEOUT_MS = 100L;
    public static final long MAX_TIMEOUT_MS = 600_000L;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final String DEFAULT_CALLER_ID = "agent";
    public static final String DEFAULT_PERMISSION_LEVEL = "default";
    public static final String TIMEOUT_ERROR_TYPE = "timeout";

    String toolCallId;
    String toolName;
    String toolVersion;
    Map<String, Object> parameters;
    OutputLevel outputLevel;
    long timeoutMs;
    boolean retryOnTimeout;
    int maxRetries;
    ToolCachePolicy cachePolicy;
    String callerId;
    String permissionLevel;
    String explicitIdempotencyKey;

    @Builder(toBuilder = true)
    private ToolInvocationRequest(String toolCallId, String toolName, String toolVersion,
            Map<String, Object> parameters, OutputLevel outputLevel, Long timeoutMs, Boolean retryOnTimeout,
            Integer maxRetries, ToolCachePolicy cachePolicy, String callerId, String permissionLevel,
            String explicitIdempotencyKey) {
        if (toolCallId == null || toolCallId.isBlank()) {
            throw new ToolRequestValidationException("toolCallId cannot be empty - must come from the LLM");
        }
        if (toolName == null || toolName.isBlank()) {
            throw new ToolRequestValidationException("toolName cannot be empty");
        }
        long effectiveTimeout = timeoutMs != null ? timeoutMs : DEFAULT_TIMEOUT_MS;
        if (effectiveTimeout < MIN_TIMEOUT_MS) {
            throw new ToolRequestValidationException("timeoutMs must be at least " + MIN_TIMEOUT_MS + "ms");
        }
        if (effectiveTimeout > MAX_TIMEOUT_MS) {
            throw new ToolRequestValidationException("timeoutMs cannot exceed " + MAX_TIMEOUT_MS + "ms");
        }
        int effectiveRetries = maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES;
        if (effectiveRetries < 0) {
            throw new ToolRequestValidationException("maxRetries cannot be negative");
        }

        this.toolCallId = toolCallId;
        this.toolName = toolName;
        this.toolVersion = toolVersion == null || toolVersion.isBlank() ? DEFAULT_TOOL_VERSION : toolVersion;
        this.parameters = parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.outputLevel = outputLevel;
        this.timeoutMs = effectiveTimeout;
        this.retryOnTimeout = retryOnTimeout == null || retryOnTimeout;
        this.maxRetries = effectiveRetries;
        this.cachePolicy = cachePolicy;
        this.callerId = callerId == null || callerId.isBlank() ? DEFAULT_CALLER_ID : callerId;
        this.permissionLevel = permissionLevel == null || permissionLevel.isBlank()
                ? DEFAULT_PERMISSION_LEVEL
                : permissionLevel;
        this.explicitIdempotencyKey = explicitIdempotencyKey;
    }

    /**
     * Explicitly requested cache policy, or the built-in preset for the tool
     * name when none was given.
     */
    public ToolCachePolicy effectiveCachePolicy() {
        return cachePolicy != null ? cachePolicy : ToolCachePolicy.presetFor(toolName);
    }

    /**
     * Explicit key if one was supplied, otherwise the semantic key derived from
     * tool, version, parameters, caller and permission level.
     */
    public String idempotencyKey() {
        if (explicitIdempotencyKey != null && !explicitIdempotencyKey.isBlank()) {
            return explicitIdempotencyKey;
        }
        return semanticKey(toolName, toolVersion, parameters, callerId, permissionLevel);
    }

    public OutputLevel resolveOutputLevel(long dataSizeBytes) {
        return outputLevel != null ? outputLevel : OutputLevel.fromSize(dataSizeBytes);
    }

    public boolean shouldRetry(int currentRetry, String errorType) {
        if (currentRetry >= maxRetries) {
            return false;
        }
        return TIMEOUT_ERROR_TYPE.equals(errorType) && retryOnTimeout;
    }

    /**
     * Fresh request for a retry round. The new call id comes from the LLM; the
     * idempotency key is pinned so the retry resolves to the same cache entry.
     */
    public ToolInvocationRequest forRetry(String newToolCallId) {
        return toBuilder()
                .toolCallId(newToolCallId)
                .explicitIdempotencyKey(idempotencyKey())
                .build();
    }

    /**
     * MD5 of {@code toolName:toolVersion:canonicalParams:callerId:permissionLevel}
     * where the parameters are serialized as JSON with keys sorted recursively.
     */
    public static String semanticKey(String toolName, String toolVersion, Map<String, ?> parameters,
            String callerId, String permissionLevel) {
        String canonicalParams;
        try {
            canonicalParams = ContentHashSupport.canonicalJson(parameters != null ? parameters : Map.of());
        } catch (JsonProcessingException e) {
            throw new ToolRequestValidationException("Parameters of " + toolName + " are not serializable", e);
        }
        String keySource = String.join(":", toolName, toolVersion, canonicalParams, callerId, permissionLevel);
        return ContentHashSupport.md5Hex(keySource);
    }
}
