package me.golemcore.pipeline.domain.service;

import me.golemcore.pipeline.domain.component.ToolComponent;
import me.golemcore.pipeline.domain.model.AgentMetrics;
import me.golemcore.pipeline.domain.model.Span;
import me.golemcore.pipeline.domain.model.SpanEvent;
import me.golemcore.pipeline.domain.model.SpanStatus;
import me.golemcore.pipeline.domain.model.SpanType;
import me.golemcore.pipeline.domain.model.ToolCachePolicy;
import me.golemcore.pipeline.domain.model.ToolExecutionResult;
import me.golemcore.pipeline.domain.model.ToolFailureKind;
import me.golemcore.pipeline.domain.model.ToolInvocationRequest;
import me.golemcore.pipeline.infrastructure.config.AutoConfiguration;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.outbound.ArtifactStoragePort;
import me.golemcore.pipeline.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class ToolInvocationServiceTest {

    private MutableClock clock;
    private PipelineProperties properties;
    private IdempotencyCache cache;
    private ToolTimeoutIsolator isolator;
    private ToolInvocationService service;
    private TurnContext context;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T12:00:00Z"));
        properties = new PipelineProperties();
        cache = new IdempotencyCache(100, clock);
        isolator = new ToolTimeoutIsolator("test-worker-", clock);
        ToolResultShaper shaper = new ToolResultShaper(mock(ArtifactStoragePort.class), properties,
                AutoConfiguration.objectMapper(), clock);
        service = new ToolInvocationService(cache, isolator, shaper, new ToolCachePolicyRegistry(properties),
                properties, clock);

        context = new TurnContext("conv-1", "session-1",
                new ExecutionTracer("conv-1", "session-1", true, clock),
                new MetricsCollector("conv-1", "session-1", true, clock));
        context.getTracer().createRootSpan("agent_turn", null);
    }

    @AfterEach
    void tearDown() {
        isolator.shutdown();
    }

    @Test
    void shouldServeRepeatedDatabaseQueryFromCache() {
        CountingTool tool = new CountingTool("query_database", params -> List.of(
                Map.of("id", 1, "name", "alice"),
                Map.of("id", 2, "name", "bob")));
        Map<String, Object> params = Map.of("query", "SELECT id, name FROM users");

        ToolExecutionResult first = service.invoke(service.requestFor(tool, "call_1", params), tool, context);
        ToolExecutionResult second = service.invoke(service.requestFor(tool, "call_2", params), tool, context);

        assertEquals(1, tool.executions.get());
        assertTrue(first.isSuccess());
        assertFalse(first.isCacheHit());
        assertTrue(second.isCacheHit());
        assertEquals("call_2", second.getToolCallId());
        assertEquals(first.getObservation(), second.getObservation());
        assertEquals(ToolCachePolicy.TTL_SHORT, second.getCachePolicy());

        List<Span> toolSpans = context.getTracer().getRootSpan().getChildren();
        assertEquals(2, toolSpans.size());
        assertEquals(SpanType.TOOL_CALL, toolSpans.get(0).getSpanType());
        assertEquals("call_1", toolSpans.get(0).getAttributes().get("toolCallId"));
        assertEquals("ttl_short", toolSpans.get(0).getAttributes().get("cachePolicy"));
        assertEquals(List.of(ToolInvocationService.EVENT_CACHE_MISS), eventNames(toolSpans.get(0)));
        assertEquals(List.of(ToolInvocationService.EVENT_CACHE_HIT), eventNames(toolSpans.get(1)));
        assertEquals(SpanStatus.SUCCESS, toolSpans.get(1).getStatus());
        assertFalse(toolSpans.get(1).isOpen());

        AgentMetrics metrics = context.getCollector().getMetrics();
        assertEquals(2, metrics.getToolCallsCount());
        assertEquals(2, metrics.getToolCallsByName().get("query_database").getSuccessCount());

        clock.advance(Duration.ofSeconds(301));
        ToolExecutionResult third = service.invoke(service.requestFor(tool, "call_3", params), tool, context);

        assertEquals(2, tool.executions.get());
        assertTrue(third.isSuccess());
        assertFalse(third.isCacheHit());
        assertEquals(List.of(ToolInvocationService.EVENT_CACHE_MISS),
                eventNames(context.getTracer().getRootSpan().getChildren().get(2)));
    }

    @Test
    void shouldReportLookupTimeForCacheHits() {
        CountingTool tool = new CountingTool("query_database", params -> {
            Thread.sleep(200);
            return List.of(Map.of("id", 1));
        });
        Map<String, Object> params = Map.of("query", "SELECT id FROM users");

        ToolExecutionResult first = service.invoke(service.requestFor(tool, "call_1", params), tool, context);
        ToolExecutionResult second = service.invoke(service.requestFor(tool, "call_2", params), tool, context);

        assertTrue(second.isCacheHit());
        assertTrue(first.getDurationMs() >= 200);
        assertTrue(second.getDurationMs() < 200);
        assertEquals(first.getDurationMs(),
                second.getMetadata().get(ToolInvocationService.METADATA_ORIGINAL_DURATION_MS));

        AgentMetrics metrics = context.getCollector().getMetrics();
        assertEquals(first.getDurationMs() + second.getDurationMs(), metrics.getToolDurationMs());
        assertEquals(first.getDurationMs() + second.getDurationMs(),
                metrics.getToolCallsByName().get("query_database").getTotalDurationMs());
    }

    @Test
    void shouldExecuteNoCacheToolsEveryTime() {
        CountingTool tool = new CountingTool("file_write", params -> Map.of("success", true));

        for (int i = 0; i < 3; i++) {
            ToolExecutionResult result = service.invoke(
                    service.requestFor(tool, "call_" + i, Map.of("path", "/tmp/out.txt")), tool, context);
            assertFalse(result.isCacheHit());
        }

        assertEquals(3, tool.executions.get());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldHonorConfiguredPolicyOverride() {
        properties.getToolCachePolicies().put("web_search", ToolCachePolicy.NO_CACHE);
        CountingTool tool = new CountingTool("web_search", params -> "results");

        ToolInvocationRequest request = service.requestFor(tool, "call_1", Map.of("q", "java"));

        assertEquals(ToolCachePolicy.NO_CACHE, request.getCachePolicy());
        assertEquals(30_000L, request.getTimeoutMs());
    }

    @Test
    void shouldRetryTimedOutCallsAndRecordRetryCount() {
        AtomicInteger attempts = new AtomicInteger();
        CountingTool tool = new CountingTool("web_search", params -> {
            if (attempts.getAndIncrement() == 0) {
                Thread.sleep(1_000);
            }
            return "results";
        });
        ToolInvocationRequest request = service.requestFor(tool, "call_1", Map.of("q", "java")).toBuilder()
                .timeoutMs(100L)
                .maxRetries(2)
                .build();

        ToolExecutionResult result = service.invoke(request, tool, context);

        assertTrue(result.isSuccess());
        assertEquals(1, result.getRetryCount());
        assertEquals(2, attempts.get());
        Span span = context.getTracer().getRootSpan().getChildren().get(0);
        assertEquals(List.of(ToolInvocationService.EVENT_RETRY, ToolInvocationService.EVENT_CACHE_MISS),
                eventNames(span));
        assertEquals(1, span.getAttributes().get("retryCount"));
    }

    @Test
    void shouldReturnTimeoutWhenRetriesAreDisabled() {
        CountingTool tool = new CountingTool("web_search", params -> {
            Thread.sleep(1_000);
            return "late";
        });
        ToolInvocationRequest request = service.requestFor(tool, "call_1", Map.of("q", "java")).toBuilder()
                .timeoutMs(100L)
                .retryOnTimeout(false)
                .build();

        ToolExecutionResult result = service.invoke(request, tool, context);

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.TIMEOUT, result.getFailureKind());
        assertEquals(0, result.getRetryCount());
        assertEquals(1, tool.executions.get());
        assertEquals(0, cache.size());
        Span span = context.getTracer().getRootSpan().getChildren().get(0);
        assertEquals(SpanStatus.ERROR, span.getStatus());
        assertEquals("timeout", span.getAttributes().get("errorType"));
        assertEquals(1, context.getCollector().getMetrics().getToolErrors());
    }

    @Test
    void shouldTurnToolExceptionsIntoErrorResults() {
        CountingTool tool = new CountingTool("query_database", params -> {
            throw new IllegalStateException("connection refused");
        });
        Map<String, Object> params = Map.of("query", "SELECT 1");

        ToolExecutionResult first = service.invoke(service.requestFor(tool, "call_1", params), tool, context);
        ToolExecutionResult second = service.invoke(service.requestFor(tool, "call_2", params), tool, context);

        assertFalse(first.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, first.getFailureKind());
        assertEquals("IllegalStateException", first.getErrorType());
        assertEquals("Error: connection refused", first.getObservation());
        assertFalse(second.isCacheHit());
        assertEquals(2, tool.executions.get());
    }

    @Test
    void shouldClassifyInvalidArgumentsAsValidationFailures() {
        CountingTool tool = new CountingTool("query_database", params -> {
            throw new IllegalArgumentException("query is required");
        });

        ToolExecutionResult result = service.invoke(service.requestFor(tool, "call_1", Map.of()), tool, null);

        assertEquals(ToolFailureKind.VALIDATION, result.getFailureKind());
    }

    @Test
    void shouldRejectDisabledTools() {
        CountingTool tool = new CountingTool("web_search", params -> "results");
        tool.enabled = false;

        ToolExecutionResult result = service.invoke(service.requestFor(tool, "call_1", Map.of()), tool, context);

        assertFalse(result.isSuccess());
        assertEquals("TOOL_DISABLED", result.getErrorCode());
        assertEquals(0, tool.executions.get());
        assertEquals(1, context.getCollector().getMetrics().getToolErrors());
    }

    @Test
    void shouldInvokeBareFunctionWithoutContext() {
        ToolInvocationRequest request = ToolInvocationRequest.builder()
                .toolCallId("call_1")
                .toolName("analyze_data")
                .parameters(Map.of("dataset", "sales"))
                .build();

        ToolExecutionResult first = service.invoke(request, params -> Map.of("count", 3), null);
        ToolExecutionResult second = service.invoke(request, params -> Map.of("count", 4), null);

        assertTrue(first.isSuccess());
        assertTrue(second.isCacheHit());
        assertEquals(first.getObservation(), second.getObservation());
    }

    @Test
    void shouldExecuteUncachedWhenKeyCannotBeBuilt() {
        AtomicInteger executions = new AtomicInteger();
        ToolInvocationRequest request = ToolInvocationRequest.builder()
                .toolCallId("call_1")
                .toolName("web_search")
                .parameters(Map.of("bean", new ExplodingBean()))
                .build();

        for (int i = 0; i < 2; i++) {
            ToolExecutionResult result = service.invoke(request, params -> {
                executions.incrementAndGet();
                return "ok";
            }, context);
            assertTrue(result.isSuccess());
        }

        assertEquals(2, executions.get());
    }

    private static List<String> eventNames(Span span) {
        return span.getEvents().stream().map(SpanEvent::getName).toList();
    }

    @FunctionalInterface
    interface Body {
        Object apply(Map<String, Object> parameters) throws Exception;
    }

    static class CountingTool implements ToolComponent {
        private final String name;
        private final Body body;
        private final AtomicInteger executions = new AtomicInteger();
        private boolean enabled = true;

        CountingTool(String name, Body body) {
            this.name = name;
            this.body = body;
        }

        @Override
        public String getToolName() {
            return name;
        }

        @Override
        public Object execute(Map<String, Object> parameters) throws Exception {
            executions.incrementAndGet();
            return body.apply(parameters);
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }
    }

    static class ExplodingBean {
        public String getValue() {
            throw new IllegalStateException("not serializable");
        }
    }
}
