package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metrics aggregated across conversations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSummary {

    private int totalConversations;
    private long totalTokens;
    private long totalDurationMs;
    private long totalToolCalls;
    private double totalCostUsd;
    private double avgTokensPerConversation;
    private double avgDurationMsPerConversation;
}
