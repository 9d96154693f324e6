package me.golemcore.pipeline.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.pipeline.domain.model.AgentMetrics;
import me.golemcore.pipeline.domain.model.MetricsSummary;

import java.util.List;

/**
 * Per-turn metrics when a conversation is named, otherwise the aggregate over
 * the selected session and window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MetricsResponse {
    private String conversationId;
    private List<AgentMetrics> turns;
    private MetricsSummary summary;
}
