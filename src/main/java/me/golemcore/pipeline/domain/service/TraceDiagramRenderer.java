package me.golemcore.pipeline.domain.service;

import me.golemcore.pipeline.domain.model.Span;
import me.golemcore.pipeline.domain.model.SpanStatus;
import me.golemcore.pipeline.domain.model.SpanType;
import me.golemcore.pipeline.domain.model.Trace;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a span tree as a Mermaid {@code graph TD} flowchart.
 */
@Component
public class TraceDiagramRenderer {

    private static final String HEADER = "graph TD";
    private static final String INDENT = "    ";

    public String render(Trace trace) {
        return trace == null ? null : render(trace.getRootSpan());
    }

    /**
     * @return the diagram, or {@code null} when there is no root span
     */
    public String render(Span rootSpan) {
        if (rootSpan == null) {
            return null;
        }
        List<String> lines = new ArrayList<>();
        lines.add(HEADER);
        for (Span span : ExecutionTracer.breadthFirst(rootSpan)) {
            String nodeId = nodeId(span.getSpanId());
            lines.add(INDENT + nodeId + "[\"" + label(span) + "\"]");
            if (span.getParentSpanId() != null) {
                lines.add(INDENT + nodeId(span.getParentSpanId()) + " --> " + nodeId);
            }
        }
        return String.join("\n", lines);
    }

    static String nodeId(String spanId) {
        return spanId.replace('-', '_').replace(':', '_');
    }

    static String label(Span span) {
        String duration = span.getDurationMs() != null ? span.getDurationMs() + "ms" : "running";
        String label = span.getName() + "\\n" + duration + " " + statusIcon(span.getStatus());
        if (span.getSpanType() != SpanType.AGENT_INVOKE && span.getSpanType() != null) {
            label = span.getSpanType().getCode() + ": " + label;
        }
        return label;
    }

    private static String statusIcon(SpanStatus status) {
        if (status == SpanStatus.SUCCESS) {
            return "✓";
        }
        if (status == SpanStatus.ERROR) {
            return "✗";
        }
        return "○";
    }
}
