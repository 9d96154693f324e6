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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pipeline.domain.model.AgentMetrics;
import me.golemcore.pipeline.domain.model.ConversationSummary;
import me.golemcore.pipeline.domain.model.MetricsSummary;
import me.golemcore.pipeline.domain.model.PerformanceSummary;
import me.golemcore.pipeline.domain.model.RecentActivity;
import me.golemcore.pipeline.domain.model.Span;
import me.golemcore.pipeline.domain.model.SpanStatus;
import me.golemcore.pipeline.domain.model.SpanSummary;
import me.golemcore.pipeline.domain.model.Trace;
import me.golemcore.pipeline.domain.model.TraceRecord;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the persisted traces and metrics, plus the write path that
 * flushes a finished turn.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonitoringService {

    private static final String LOG_PREFIX = "[Monitoring]";
    public static final int MIN_RECENT_HOURS = 1;
    public static final int MAX_RECENT_HOURS = 168;
    private static final int RECENT_TRACE_LIMIT = 100;

    private final TraceStore traceStore;
    private final MetricsStore metricsStore;
    private final TraceDiagramRenderer diagramRenderer;
    private final Clock clock;

    public List<ConversationSummary> listConversations(String sessionId, int limit) {
        return traceStore.listConversations(sessionId, limit);
    }

    public Optional<Trace> loadTrace(String conversationId) {
        return traceStore.loadTrace(conversationId);
    }

    public List<AgentMetrics> getConversationMetrics(String conversationId, Long startTime, Long endTime) {
        return metricsStore.getMetrics(conversationId, startTime, endTime);
    }

    public MetricsSummary getAggregatedMetrics(String sessionId, Long startTime, Long endTime) {
        return metricsStore.getAggregatedMetrics(sessionId, startTime, endTime);
    }

    /**
     * Time breakdown of the latest turn of a conversation. Percentages are of
     * the total duration and zero when the total is zero.
     */
    public Optional<PerformanceSummary> getPerformanceSummary(String conversationId) {
        return traceStore.loadTrace(conversationId).map(trace -> {
            AgentMetrics metrics = trace.getMetrics();
            long total = metrics != null
                    ? metrics.getTotalDurationMs()
                    : trace.getTotalDurationMs() != null ? trace.getTotalDurationMs() : 0L;
            long llm = metrics != null ? metrics.getLlmDurationMs() : 0L;
            long tool = metrics != null ? metrics.getToolDurationMs() : 0L;
            long other = metrics != null ? metrics.getOtherDurationMs() : 0L;
            return PerformanceSummary.builder()
                    .conversationId(conversationId)
                    .totalDurationMs(total)
                    .llmDurationMs(llm)
                    .toolDurationMs(tool)
                    .otherDurationMs(other)
                    .llmPercentage(percentage(llm, total))
                    .toolPercentage(percentage(tool, total))
                    .otherPercentage(percentage(other, total))
                    .totalTokens(metrics != null ? metrics.getTotalTokens() : 0L)
                    .toolCallsCount(metrics != null ? metrics.getToolCallsCount() : 0)
                    .estimatedCostUsd(metrics != null ? metrics.getEstimatedCostUsd() : 0.0)
                    .build();
        });
    }

    /**
     * Depth-first flattening of the latest span tree of a conversation.
     */
    public Optional<List<SpanSummary>> getSpans(String conversationId) {
        return traceStore.loadTrace(conversationId).map(trace -> {
            List<SpanSummary> result = new ArrayList<>();
            if (trace.getRootSpan() != null) {
                flatten(trace.getRootSpan(), 0, result);
            }
            return result;
        });
    }

    public Optional<String> visualize(String conversationId) {
        return traceStore.loadTrace(conversationId).map(diagramRenderer::render);
    }

    /**
     * Traces started during the last {@code hours} hours, newest first and
     * capped at 100 entries. The count covers all matches.
     */
    public RecentActivity recentActivity(int hours) {
        if (hours < MIN_RECENT_HOURS || hours > MAX_RECENT_HOURS) {
            throw new IllegalArgumentException("hours must be between " + MIN_RECENT_HOURS + " and "
                    + MAX_RECENT_HOURS);
        }
        long endTime = clock.millis();
        long startTime = endTime - Duration.ofHours(hours).toMillis();
        List<TraceRecord> traces = traceStore.findByTimeRange(startTime, endTime);
        return RecentActivity.builder()
                .hours(hours)
                .startTime(startTime)
                .endTime(endTime)
                .traceCount(traces.size())
                .traces(traces.subList(0, Math.min(RECENT_TRACE_LIMIT, traces.size())))
                .build();
    }

    /**
     * Closes any spans still open, finalizes the metrics and writes both.
     * Persistence failures are logged and reported as {@code false}.
     *
     * @return {@code true} if a trace document was written
     */
    public boolean persistTurn(TurnContext context) {
        ExecutionTracer tracer = context.getTracer();
        closeOpenSpans(tracer);

        MetricsCollector collector = context.getCollector();
        AgentMetrics metrics = collector.isActive() ? collector.finalizeMetrics() : null;
        Trace trace = tracer.getTrace();

        boolean traceWritten = false;
        try {
            if (trace != null) {
                traceStore.saveTrace(trace, metrics);
                traceWritten = true;
            }
            if (metrics != null) {
                metricsStore.saveMetrics(metrics);
            }
            log.info("{} Persisted turn {} (trace: {}, metrics: {})", LOG_PREFIX, context.key(), traceWritten,
                    metrics != null);
        } catch (RuntimeException e) {
            log.warn("{} Failed to persist turn {}: {}", LOG_PREFIX, context.key(), e.getMessage());
        }
        return traceWritten;
    }

    private void closeOpenSpans(ExecutionTracer tracer) {
        Span root = tracer.getRootSpan();
        while (tracer.getActiveSpan() != null) {
            tracer.endActiveSpan(tracer.getActiveSpan() == root ? SpanStatus.SUCCESS : SpanStatus.CANCELLED);
        }
    }

    private static void flatten(Span span, int depth, List<SpanSummary> result) {
        result.add(SpanSummary.builder()
                .spanId(span.getSpanId())
                .parentSpanId(span.getParentSpanId())
                .name(span.getName())
                .spanType(span.getSpanType())
                .depth(depth)
                .durationMs(span.getDurationMs())
                .status(span.getStatus())
                .attributes(span.getAttributes())
                .eventCount(span.getEvents() != null ? span.getEvents().size() : 0)
                .build());
        if (span.getChildren() != null) {
            for (Span child : span.getChildren()) {
                flatten(child, depth + 1, result);
            }
        }
    }

    private static double percentage(long part, long total) {
        return total > 0 ? (double) part / total * 100.0 : 0.0;
    }
}
