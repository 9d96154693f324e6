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

import me.golemcore.pipeline.domain.model.AgentMetrics;
import me.golemcore.pipeline.domain.model.ModelTokenUsage;
import me.golemcore.pipeline.domain.model.ToolCallStats;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates token, timing and cost figures for one agent turn.
 *
 * <p>
 * Cached LLM calls count towards the turn totals but not towards the per-model
 * usage that drives cost. {@link #finalizeMetrics()} fixes the wall-clock duration,
 * derives the unaccounted "other" time and prices the turn. A collector belongs
 * to a single turn and is not thread-safe; a disabled collector ignores every
 * call.
 */
public class MetricsCollector {

    private final boolean enabled;
    private final Clock clock;
    private final long startTime;
    private final AgentMetrics metrics;

    public MetricsCollector(String conversationId, String sessionId, boolean enabled, Clock clock) {
        this.enabled = enabled;
        this.clock = clock;
        this.startTime = clock.millis();
        this.metrics = AgentMetrics.builder()
                .conversationId(conversationId)
                .sessionId(sessionId != null ? sessionId : "default")
                .timestamp(startTime)
                .build();
    }

    public boolean isActive() {
        return enabled;
    }

    public long getStartTime() {
        return startTime;
    }

    public void recordLlmCall(String model, long inputTokens, long outputTokens, long durationMs, boolean cached) {
        if (!enabled) {
            return;
        }
        metrics.setTotalInputTokens(metrics.getTotalInputTokens() + inputTokens);
        metrics.setTotalOutputTokens(metrics.getTotalOutputTokens() + outputTokens);
        metrics.setTotalTokens(metrics.getTotalTokens() + inputTokens + outputTokens);

        ModelTokenUsage usage = metrics.getTokensByModel().get(model);
        if (usage == null) {
            usage = new ModelTokenUsage();
            metrics.getTokensByModel().put(model, usage);
            metrics.getModelsUsed().add(model);
        }
        if (!cached) {
            usage.setInput(usage.getInput() + inputTokens);
            usage.setOutput(usage.getOutput() + outputTokens);
        }
        usage.setCalls(usage.getCalls() + 1);

        metrics.setLlmDurationMs(metrics.getLlmDurationMs() + durationMs);
        if (metrics.getPrimaryModel() == null) {
            metrics.setPrimaryModel(model);
        }
    }

    public void recordToolCall(String toolName, long durationMs, boolean success) {
        recordToolCall(toolName, durationMs, success, 0, 0);
    }

    public void recordToolCall(String toolName, long durationMs, boolean success, long inputTokens,
            long outputTokens) {
        if (!enabled) {
            return;
        }
        metrics.setToolCallsCount(metrics.getToolCallsCount() + 1);
        if (!success) {
            metrics.setToolErrors(metrics.getToolErrors() + 1);
        }

        ToolCallStats stats = metrics.getToolCallsByName()
                .computeIfAbsent(toolName, name -> ToolCallStats.builder().toolName(name).build());
        stats.setCallCount(stats.getCallCount() + 1);
        if (success) {
            stats.setSuccessCount(stats.getSuccessCount() + 1);
        } else {
            stats.setErrorCount(stats.getErrorCount() + 1);
        }
        stats.setTotalDurationMs(stats.getTotalDurationMs() + durationMs);
        stats.setTotalInputTokens(stats.getTotalInputTokens() + inputTokens);
        stats.setTotalOutputTokens(stats.getTotalOutputTokens() + outputTokens);

        metrics.setToolDurationMs(metrics.getToolDurationMs() + durationMs);
    }

    public void recordMemoryFlush(long tokensBefore, long tokensAfter, long durationMs) {
        if (!enabled) {
            return;
        }
        metrics.setOtherDurationMs(metrics.getOtherDurationMs() + durationMs);

        Map<String, Object> flush = new LinkedHashMap<>();
        flush.put("tokensBefore", tokensBefore);
        flush.put("tokensAfter", tokensAfter);
        flush.put("tokensSaved", tokensBefore - tokensAfter);
        flush.put("durationMs", durationMs);
        flush.put("timestamp", clock.millis());
        metadataList(AgentMetrics.METADATA_MEMORY_FLUSHES).add(flush);
    }

    public void recordError(String errorType, String errorMessage, Map<String, Object> context) {
        if (!enabled) {
            return;
        }
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("type", errorType);
        error.put("message", errorMessage);
        error.put("context", context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>());
        error.put("timestamp", clock.millis());
        metadataList(AgentMetrics.METADATA_ERRORS).add(error);
    }

    /**
     * Fixes the turn duration and cost. Calling it again recomputes both from
     * the current clock.
     */
    public AgentMetrics finalizeMetrics() {
        if (!enabled) {
            return metrics;
        }
        long total = clock.millis() - startTime;
        metrics.setTotalDurationMs(total);
        metrics.setOtherDurationMs(Math.max(0, total - metrics.getLlmDurationMs() - metrics.getToolDurationMs()));
        metrics.setEstimatedCostUsd(calculateCost());
        return metrics;
    }

    /**
     * Current figures without finalizing.
     */
    public AgentMetrics getMetrics() {
        return metrics;
    }

    double calculateCost() {
        double total = 0.0;
        for (Map.Entry<String, ModelTokenUsage> entry : metrics.getTokensByModel().entrySet()) {
            total += ModelPricingTable.cost(entry.getKey(), entry.getValue().getInput(),
                    entry.getValue().getOutput());
        }
        return total;
    }

    @SuppressWarnings("unchecked")
    private List<Object> metadataList(String key) {
        return (List<Object>) metrics.getMetadata().computeIfAbsent(key, k -> new ArrayList<>());
    }
}
