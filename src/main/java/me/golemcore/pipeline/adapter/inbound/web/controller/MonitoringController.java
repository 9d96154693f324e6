package me.golemcore.pipeline.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.pipeline.adapter.inbound.web.dto.MetricsResponse;
import me.golemcore.pipeline.adapter.inbound.web.dto.TraceVisualizationResponse;
import me.golemcore.pipeline.domain.model.ConversationSummary;
import me.golemcore.pipeline.domain.model.PerformanceSummary;
import me.golemcore.pipeline.domain.model.RecentActivity;
import me.golemcore.pipeline.domain.model.SpanSummary;
import me.golemcore.pipeline.domain.model.Trace;
import me.golemcore.pipeline.domain.service.MonitoringService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read-only endpoints over persisted traces and metrics.
 */
@RestController
@RequestMapping("/api/monitoring")
@RequiredArgsConstructor
public class MonitoringController {

    private static final String FORMAT_MERMAID = "mermaid";
    private static final String FORMAT_JSON = "json";

    private final MonitoringService monitoringService;

    @GetMapping("/conversations")
    public Mono<ResponseEntity<List<ConversationSummary>>> listConversations(
            @RequestParam(required = false) String sessionId,
            @RequestParam(defaultValue = "50") int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return Mono.just(ResponseEntity.ok(monitoringService.listConversations(sessionId, limit)));
    }

    @GetMapping("/traces/{conversationId}")
    public Mono<ResponseEntity<Trace>> getTrace(@PathVariable String conversationId) {
        Trace trace = monitoringService.loadTrace(conversationId)
                .orElseThrow(() -> traceNotFound(conversationId));
        return Mono.just(ResponseEntity.ok(trace));
    }

    @GetMapping("/traces/{conversationId}/visualize")
    public Mono<ResponseEntity<TraceVisualizationResponse>> visualize(@PathVariable String conversationId,
            @RequestParam(defaultValue = FORMAT_MERMAID) String format) {
        TraceVisualizationResponse.TraceVisualizationResponseBuilder response = TraceVisualizationResponse.builder()
                .conversationId(conversationId)
                .format(format);
        if (FORMAT_MERMAID.equals(format)) {
            response.diagram(monitoringService.visualize(conversationId)
                    .orElseThrow(() -> traceNotFound(conversationId)));
        } else if (FORMAT_JSON.equals(format)) {
            response.rootSpan(monitoringService.loadTrace(conversationId)
                    .orElseThrow(() -> traceNotFound(conversationId))
                    .getRootSpan());
        } else {
            throw new IllegalArgumentException("Unsupported format: " + format);
        }
        return Mono.just(ResponseEntity.ok(response.build()));
    }

    @GetMapping("/spans/{conversationId}")
    public Mono<ResponseEntity<List<SpanSummary>>> getSpans(@PathVariable String conversationId) {
        List<SpanSummary> spans = monitoringService.getSpans(conversationId)
                .orElseThrow(() -> traceNotFound(conversationId));
        return Mono.just(ResponseEntity.ok(spans));
    }

    @GetMapping("/metrics")
    public Mono<ResponseEntity<MetricsResponse>> getMetrics(
            @RequestParam(required = false) String conversationId,
            @RequestParam(required = false) String sessionId,
            @RequestParam(required = false) Long startTime,
            @RequestParam(required = false) Long endTime) {
        MetricsResponse response;
        if (conversationId != null && !conversationId.isBlank()) {
            response = MetricsResponse.builder()
                    .conversationId(conversationId)
                    .turns(monitoringService.getConversationMetrics(conversationId, startTime, endTime))
                    .build();
        } else {
            response = MetricsResponse.builder()
                    .summary(monitoringService.getAggregatedMetrics(sessionId, startTime, endTime))
                    .build();
        }
        return Mono.just(ResponseEntity.ok(response));
    }

    @GetMapping("/performance/{conversationId}")
    public Mono<ResponseEntity<PerformanceSummary>> getPerformance(@PathVariable String conversationId) {
        PerformanceSummary summary = monitoringService.getPerformanceSummary(conversationId)
                .orElseThrow(() -> traceNotFound(conversationId));
        return Mono.just(ResponseEntity.ok(summary));
    }

    @GetMapping("/recent")
    public Mono<ResponseEntity<RecentActivity>> getRecentActivity(@RequestParam(defaultValue = "24") int hours) {
        return Mono.just(ResponseEntity.ok(monitoringService.recentActivity(hours)));
    }

    private static ResponseStatusException traceNotFound(String conversationId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "No trace for conversation " + conversationId);
    }
}
