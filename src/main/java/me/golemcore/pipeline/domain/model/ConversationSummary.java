package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * All traces of one conversation folded into a single dashboard row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSummary {

    private String conversationId;
    private String sessionId;
    private long startTime;
    private long totalDurationMs;
    private int traceCount;
    private long totalTokens;
    private int toolCalls;
}
