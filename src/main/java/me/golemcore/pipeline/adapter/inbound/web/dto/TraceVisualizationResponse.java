package me.golemcore.pipeline.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.pipeline.domain.model.Span;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TraceVisualizationResponse {
    private String conversationId;
    private String format;
    private String diagram;
    private Span rootSpan;
}
