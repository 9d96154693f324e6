package me.golemcore.pipeline.adapter.inbound.web.controller;

import me.golemcore.pipeline.adapter.inbound.web.dto.MetricsResponse;
import me.golemcore.pipeline.adapter.inbound.web.dto.TraceVisualizationResponse;
import me.golemcore.pipeline.domain.model.AgentMetrics;
import me.golemcore.pipeline.domain.model.ConversationSummary;
import me.golemcore.pipeline.domain.model.MetricsSummary;
import me.golemcore.pipeline.domain.model.PerformanceSummary;
import me.golemcore.pipeline.domain.model.RecentActivity;
import me.golemcore.pipeline.domain.model.Span;
import me.golemcore.pipeline.domain.model.SpanSummary;
import me.golemcore.pipeline.domain.model.Trace;
import me.golemcore.pipeline.domain.service.MonitoringService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import reactor.test.StepVerifier;

class MonitoringControllerTest {

    private static final String CONVERSATION_ID = "conv-1";

    private MonitoringService monitoringService;
    private MonitoringController controller;

    @BeforeEach
    void setUp() {
        monitoringService = mock(MonitoringService.class);
        controller = new MonitoringController(monitoringService);
    }

    private static Trace trace() {
        return Trace.builder()
                .traceId("trace_1")
                .conversationId(CONVERSATION_ID)
                .rootSpan(Span.builder().spanId("span_root").name("agent_turn").build())
                .build();
    }

    @Test
    void shouldListConversations() {
        List<ConversationSummary> summaries = List.of(ConversationSummary.builder()
                .conversationId(CONVERSATION_ID)
                .build());
        when(monitoringService.listConversations("session-1", 50)).thenReturn(summaries);

        StepVerifier.create(controller.listConversations("session-1", 50))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(summaries, response.getBody());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> controller.listConversations(null, 0));
        verify(monitoringService, never()).listConversations(null, 0);
    }

    @Test
    void shouldReturnTrace() {
        Trace trace = trace();
        when(monitoringService.loadTrace(CONVERSATION_ID)).thenReturn(Optional.of(trace));

        StepVerifier.create(controller.getTrace(CONVERSATION_ID))
                .assertNext(response -> assertSame(trace, response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForMissingTrace() {
        when(monitoringService.loadTrace("missing")).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.getTrace("missing"));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }

    @Test
    void shouldRenderMermaidByDefault() {
        when(monitoringService.visualize(CONVERSATION_ID)).thenReturn(Optional.of("graph TD"));

        StepVerifier.create(controller.visualize(CONVERSATION_ID, "mermaid"))
                .assertNext(response -> {
                    TraceVisualizationResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("mermaid", body.getFormat());
                    assertEquals("graph TD", body.getDiagram());
                    assertNull(body.getRootSpan());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnSpanTreeForJsonFormat() {
        Trace trace = trace();
        when(monitoringService.loadTrace(CONVERSATION_ID)).thenReturn(Optional.of(trace));

        StepVerifier.create(controller.visualize(CONVERSATION_ID, "json"))
                .assertNext(response -> {
                    TraceVisualizationResponse body = response.getBody();
                    assertNotNull(body);
                    assertSame(trace.getRootSpan(), body.getRootSpan());
                    assertNull(body.getDiagram());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectUnknownVisualizationFormat() {
        assertThrows(IllegalArgumentException.class, () -> controller.visualize(CONVERSATION_ID, "svg"));
    }

    @Test
    void shouldReturnNotFoundWhenNothingToVisualize() {
        when(monitoringService.visualize("missing")).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.visualize("missing", "mermaid"));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }

    @Test
    void shouldReturnSpans() {
        List<SpanSummary> spans = List.of(SpanSummary.builder().name("agent_turn").depth(0).build());
        when(monitoringService.getSpans(CONVERSATION_ID)).thenReturn(Optional.of(spans));

        StepVerifier.create(controller.getSpans(CONVERSATION_ID))
                .assertNext(response -> assertEquals(spans, response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldReturnConversationMetrics() {
        List<AgentMetrics> turns = List.of(AgentMetrics.builder().conversationId(CONVERSATION_ID).build());
        when(monitoringService.getConversationMetrics(CONVERSATION_ID, 10L, null)).thenReturn(turns);

        StepVerifier.create(controller.getMetrics(CONVERSATION_ID, null, 10L, null))
                .assertNext(response -> {
                    MetricsResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(CONVERSATION_ID, body.getConversationId());
                    assertEquals(turns, body.getTurns());
                    assertNull(body.getSummary());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnAggregatedMetricsWithoutConversation() {
        MetricsSummary summary = MetricsSummary.builder().totalConversations(3).build();
        when(monitoringService.getAggregatedMetrics("session-1", null, null)).thenReturn(summary);

        StepVerifier.create(controller.getMetrics(null, "session-1", null, null))
                .assertNext(response -> {
                    MetricsResponse body = response.getBody();
                    assertNotNull(body);
                    assertSame(summary, body.getSummary());
                    assertNull(body.getTurns());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnPerformance() {
        PerformanceSummary summary = PerformanceSummary.builder().conversationId(CONVERSATION_ID).build();
        when(monitoringService.getPerformanceSummary(CONVERSATION_ID)).thenReturn(Optional.of(summary));
        when(monitoringService.getPerformanceSummary("missing")).thenReturn(Optional.empty());

        StepVerifier.create(controller.getPerformance(CONVERSATION_ID))
                .assertNext(response -> assertSame(summary, response.getBody()))
                .verifyComplete();
        assertThrows(ResponseStatusException.class, () -> controller.getPerformance("missing"));
    }

    @Test
    void shouldReturnRecentActivity() {
        RecentActivity activity = RecentActivity.builder().hours(6).traces(List.of()).build();
        when(monitoringService.recentActivity(6)).thenReturn(activity);

        StepVerifier.create(controller.getRecentActivity(6))
                .assertNext(response -> assertSame(activity, response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldPropagateInvalidHours() {
        when(monitoringService.recentActivity(anyInt())).thenThrow(new IllegalArgumentException("hours"));

        assertThrows(IllegalArgumentException.class, () -> controller.getRecentActivity(500));
    }
}
