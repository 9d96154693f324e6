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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate numbers for one conversation turn: tokens per model, time split
 * between LLM, tools and everything else, per-tool statistics and estimated
 * cost.
 *
 * <p>
 * Mutated incrementally by the metrics collector, finalized once, then
 * persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentMetrics {

    public static final String METADATA_MEMORY_FLUSHES = "memoryFlushes";
    public static final String METADATA_ERRORS = "errors";

    private String conversationId;
    private String sessionId;
    private long timestamp;

    private long totalInputTokens;
    private long totalOutputTokens;
    private long totalTokens;
    @Builder.Default
    private Map<String, ModelTokenUsage> tokensByModel = new LinkedHashMap<>();

    private long totalDurationMs;
    private long llmDurationMs;
    private long toolDurationMs;
    private long otherDurationMs;

    private int toolCallsCount;
    private int toolErrors;
    @Builder.Default
    private Map<String, ToolCallStats> toolCallsByName = new LinkedHashMap<>();

    private double estimatedCostUsd;

    private String primaryModel;
    @Builder.Default
    private List<String> modelsUsed = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
