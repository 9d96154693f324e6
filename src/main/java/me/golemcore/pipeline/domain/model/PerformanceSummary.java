package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where the time of a conversation turn went, with cost and token totals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceSummary {

    private String conversationId;
    private long totalDurationMs;
    private long llmDurationMs;
    private long toolDurationMs;
    private long otherDurationMs;
    private double llmPercentage;
    private double toolPercentage;
    private double otherPercentage;
    private long totalTokens;
    private int toolCallsCount;
    private double estimatedCostUsd;
}
