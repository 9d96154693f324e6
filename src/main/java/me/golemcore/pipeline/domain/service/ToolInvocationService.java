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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pipeline.domain.component.ToolComponent;
import me.golemcore.pipeline.domain.component.ToolFunction;
import me.golemcore.pipeline.domain.model.ExecutionOutcome;
import me.golemcore.pipeline.domain.model.Span;
import me.golemcore.pipeline.domain.model.SpanStatus;
import me.golemcore.pipeline.domain.model.SpanType;
import me.golemcore.pipeline.domain.model.ToolCachePolicy;
import me.golemcore.pipeline.domain.model.ToolExecutionResult;
import me.golemcore.pipeline.domain.model.ToolFailureKind;
import me.golemcore.pipeline.domain.model.ToolInvocationRequest;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Single entry point for executing a tool call on behalf of the LLM.
 *
 * <p>
 * Each invocation:
 * <ol>
 * <li>opens a {@code tool_call} span when a turn context is given</li>
 * <li>consults the idempotency cache under the tool's cache policy</li>
 * <li>on a miss, runs the tool under the timeout isolator, retrying timeouts
 * while the request allows it, and shapes the raw output</li>
 * <li>records a {@code cache_hit} or {@code cache_miss} event, ends the span
 * and feeds the turn's metrics</li>
 * </ol>
 *
 * A cache hit reports the lookup time as its duration; the duration of the
 * execution that produced it is kept under {@code originalDurationMs}.
 *
 * Tool failures and timeouts come back as error results; nothing thrown by a
 * tool escapes {@link #invoke}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolInvocationService {

    private static final String LOG_PREFIX = "[Tool]";
    public static final String EVENT_CACHE_HIT = "cache_hit";
    public static final String EVENT_CACHE_MISS = "cache_miss";
    public static final String EVENT_RETRY = "retry";
    public static final String DISABLED_ERROR_TYPE = "disabled";
    public static final String METADATA_ORIGINAL_DURATION_MS = "originalDurationMs";

    private final IdempotencyCache idempotencyCache;
    private final ToolTimeoutIsolator timeoutIsolator;
    private final ToolResultShaper resultShaper;
    private final ToolCachePolicyRegistry cachePolicyRegistry;
    private final PipelineProperties properties;
    private final Clock clock;

    /**
     * Builds a request for {@code tool} with the resolved cache policy and the
     * configured default timeout.
     */
    public ToolInvocationRequest requestFor(ToolComponent tool, String toolCallId, Map<String, Object> parameters) {
        return ToolInvocationRequest.builder()
                .toolCallId(toolCallId)
                .toolName(tool.getToolName())
                .toolVersion(tool.getToolVersion())
                .parameters(parameters)
                .timeoutMs(properties.getTimeout().getDefaultMs())
                .cachePolicy(cachePolicyRegistry.policyFor(tool))
                .build();
    }

    public ToolExecutionResult invoke(ToolInvocationRequest request, ToolComponent tool, TurnContext context) {
        if (!tool.isEnabled()) {
            ToolExecutionResult disabled = ToolExecutionResult.error(request.getToolCallId(), request.getToolName(),
                    ToolFailureKind.VALIDATION, DISABLED_ERROR_TYPE, "TOOL_DISABLED",
                    "Tool " + request.getToolName() + " is disabled", clock.millis());
            recordMetrics(context, disabled);
            return disabled;
        }
        ToolCachePolicy policy = request.getCachePolicy() != null
                ? request.getCachePolicy()
                : cachePolicyRegistry.policyFor(tool);
        return invoke(request, tool::execute, policy, context);
    }

    public ToolExecutionResult invoke(ToolInvocationRequest request, ToolFunction function, TurnContext context) {
        ToolCachePolicy policy = request.getCachePolicy() != null
                ? request.getCachePolicy()
                : cachePolicyRegistry.policyFor(request.getToolName());
        return invoke(request, function, policy, context);
    }

    private ToolExecutionResult invoke(ToolInvocationRequest request, ToolFunction function, ToolCachePolicy policy,
            TurnContext context) {
        Span span = openSpan(request, policy, context);

        long startNanos = System.nanoTime();
        ToolExecutionResult result = lookupOrExecute(request, function, policy, span, context)
                .withToolCallId(request.getToolCallId());
        if (result.isCacheHit()) {
            result = result.withMetadata(METADATA_ORIGINAL_DURATION_MS, result.getDurationMs())
                    .withDuration(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        }

        if (span != null) {
            Map<String, Object> eventAttributes = new LinkedHashMap<>();
            eventAttributes.put("cachePolicy", policy.getCode());
            context.getTracer().addEvent(result.isCacheHit() ? EVENT_CACHE_HIT : EVENT_CACHE_MISS,
                    eventAttributes, span);
            span.getAttributes().put("success", result.isSuccess());
            span.getAttributes().put("retryCount", result.getRetryCount());
            if (result.getArtifactId() != null) {
                span.getAttributes().put("artifactId", result.getArtifactId());
            }
            if (!result.isSuccess()) {
                span.getAttributes().put("errorType", result.getErrorType());
            }
            context.getTracer().endSpan(span, result.isSuccess() ? SpanStatus.SUCCESS : SpanStatus.ERROR);
        }
        recordMetrics(context, result);

        log.debug("{} {} ({}) finished: success={}, cacheHit={}, {}ms", LOG_PREFIX, request.getToolName(),
                request.getToolCallId(), result.isSuccess(), result.isCacheHit(), result.getDurationMs());
        return result;
    }

    private ToolExecutionResult lookupOrExecute(ToolInvocationRequest request, ToolFunction function,
            ToolCachePolicy policy, Span span, TurnContext context) {
        if (!policy.isCacheable()) {
            return execute(request, function, span, context);
        }
        String key;
        try {
            key = request.idempotencyKey();
        } catch (RuntimeException e) {
            log.warn("[Cache] Cannot build key for {}, executing uncached: {}", request.getToolName(),
                    e.getMessage());
            return execute(request, function, span, context);
        }
        return idempotencyCache.getOrCompute(key, policy, () -> execute(request, function, span, context));
    }

    /**
     * Runs the tool, retrying timeouts while {@link ToolInvocationRequest#shouldRetry}
     * allows. The reported duration covers every attempt.
     */
    private ToolExecutionResult execute(ToolInvocationRequest request, ToolFunction function, Span span,
            TurnContext context) {
        Map<String, Object> parameters = request.getParameters();
        long totalDuration = 0;
        int retry = 0;
        while (true) {
            ExecutionOutcome<Object> outcome = timeoutIsolator.run(() -> function.apply(parameters),
                    request.getTimeoutMs());
            totalDuration += outcome.durationMs();

            if (outcome instanceof ExecutionOutcome.Completed<Object> completed) {
                return resultShaper.shape(request.getToolCallId(), request.getToolName(), completed.value(),
                        request.getOutputLevel())
                        .toBuilder()
                        .durationMs(totalDuration)
                        .retryCount(retry)
                        .build();
            }
            if (outcome instanceof ExecutionOutcome.Failed<Object> failed) {
                Throwable error = failed.error();
                log.warn("{} {} failed: {}", LOG_PREFIX, request.getToolName(), ToolTimeoutIsolator.messageOf(error));
                return ToolExecutionResult.error(request.getToolCallId(), request.getToolName(), failureKindOf(error),
                        error.getClass().getSimpleName(), null, ToolTimeoutIsolator.messageOf(error), clock.millis())
                        .toBuilder()
                        .durationMs(totalDuration)
                        .retryCount(retry)
                        .build();
            }

            if (request.shouldRetry(retry, ToolInvocationRequest.TIMEOUT_ERROR_TYPE)) {
                retry++;
                log.warn("{} {} timed out after {}ms, retry {}/{}", LOG_PREFIX, request.getToolName(),
                        request.getTimeoutMs(), retry, request.getMaxRetries());
                if (span != null) {
                    Map<String, Object> attributes = new LinkedHashMap<>();
                    attributes.put("attempt", retry);
                    attributes.put("timeoutMs", request.getTimeoutMs());
                    context.getTracer().addEvent(EVENT_RETRY, attributes, span);
                }
                continue;
            }
            log.warn("{} {} timed out after {}ms, giving up after {} retries", LOG_PREFIX, request.getToolName(),
                    request.getTimeoutMs(), retry);
            return ToolExecutionResult.timeout(request.getToolCallId(), request.getToolName(),
                    request.getTimeoutMs(), clock.millis())
                    .toBuilder()
                    .durationMs(totalDuration)
                    .retryCount(retry)
                    .build();
        }
    }

    private Span openSpan(ToolInvocationRequest request, ToolCachePolicy policy, TurnContext context) {
        if (context == null) {
            return null;
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("toolName", request.getToolName());
        attributes.put("toolCallId", request.getToolCallId());
        attributes.put("cachePolicy", policy.getCode());
        return context.getTracer().createSpan(request.getToolName(), SpanType.TOOL_CALL, attributes);
    }

    private void recordMetrics(TurnContext context, ToolExecutionResult result) {
        if (context == null) {
            return;
        }
        context.getCollector().recordToolCall(result.getToolName(), result.getDurationMs(), result.isSuccess());
        if (!result.isSuccess()) {
            Map<String, Object> errorContext = new LinkedHashMap<>();
            errorContext.put("toolName", result.getToolName());
            errorContext.put("toolCallId", result.getToolCallId());
            context.getCollector().recordError(result.getErrorType(), result.getErrorMessage(), errorContext);
        }
    }

    private static ToolFailureKind failureKindOf(Throwable error) {
        if (error instanceof SecurityException) {
            return ToolFailureKind.SECURITY;
        }
        if (error instanceof IllegalArgumentException) {
            return ToolFailureKind.VALIDATION;
        }
        return ToolFailureKind.EXECUTION_FAILED;
    }
}
