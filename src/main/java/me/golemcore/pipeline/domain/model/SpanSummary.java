package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Flattened view of a span with its depth in the tree.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpanSummary {

    private String spanId;
    private String parentSpanId;
    private String name;
    private SpanType spanType;
    private int depth;
    private Long durationMs;
    private SpanStatus status;
    private Map<String, Object> attributes;
    private int eventCount;
}
