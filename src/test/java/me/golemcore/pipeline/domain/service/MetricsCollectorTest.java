package me.golemcore.pipeline.domain.service;

import me.golemcore.pipeline.domain.model.AgentMetrics;
import me.golemcore.pipeline.domain.model.ToolCallStats;
import me.golemcore.pipeline.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsCollectorTest {

    private static final double DELTA = 1e-9;

    private MutableClock clock;
    private MetricsCollector collector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T12:00:00Z"));
        collector = new MetricsCollector("conv-1", "session-1", true, clock);
    }

    @Test
    void shouldPriceTokensPerMillion() {
        collector.recordLlmCall("claude-sonnet-4-5-20250929", 1_000_000, 1_000_000, 500, false);

        AgentMetrics metrics = collector.finalizeMetrics();

        assertEquals(18.0, metrics.getEstimatedCostUsd(), DELTA);
        assertEquals(2_000_000, metrics.getTotalTokens());
        assertEquals("claude-sonnet-4-5-20250929", metrics.getPrimaryModel());
    }

    @Test
    void shouldUseDefaultPriceForUnknownModels() {
        collector.recordLlmCall("local-model", 1_000_000, 1_000_000, 10, false);

        assertEquals(3.0, collector.finalizeMetrics().getEstimatedCostUsd(), DELTA);
    }

    @Test
    void shouldCountCachedCallsInTotalsButNotInCost() {
        collector.recordLlmCall("gpt-4o", 1_000, 500, 100, false);
        collector.recordLlmCall("gpt-4o", 1_000, 500, 5, true);

        AgentMetrics metrics = collector.finalizeMetrics();

        assertEquals(3_000, metrics.getTotalTokens());
        assertEquals(1_000, metrics.getTokensByModel().get("gpt-4o").getInput());
        assertEquals(2, metrics.getTokensByModel().get("gpt-4o").getCalls());
        assertEquals(List.of("gpt-4o"), metrics.getModelsUsed());
        assertEquals(1_000 / 1e6 * 5.0 + 500 / 1e6 * 15.0, metrics.getEstimatedCostUsd(), DELTA);
    }

    @Test
    void shouldAggregateToolCalls() {
        collector.recordToolCall("web_search", 100, true);
        collector.recordToolCall("web_search", 300, false);
        collector.recordToolCall("query_database", 50, true, 10, 20);

        AgentMetrics metrics = collector.getMetrics();

        assertEquals(3, metrics.getToolCallsCount());
        assertEquals(1, metrics.getToolErrors());
        assertEquals(450, metrics.getToolDurationMs());
        ToolCallStats search = metrics.getToolCallsByName().get("web_search");
        assertEquals(2, search.getCallCount());
        assertEquals(1, search.getErrorCount());
        assertEquals(200.0, search.getAvgDurationMs(), DELTA);
        assertEquals(0.5, search.getSuccessRate(), DELTA);
        assertEquals(20, metrics.getToolCallsByName().get("query_database").getTotalOutputTokens());
    }

    @Test
    void shouldDeriveOtherDurationOnFinalize() {
        collector.recordLlmCall("gpt-4o", 10, 10, 300, false);
        collector.recordToolCall("web_search", 200, true);
        clock.advanceMillis(1_000);

        AgentMetrics metrics = collector.finalizeMetrics();

        assertEquals(1_000, metrics.getTotalDurationMs());
        assertEquals(500, metrics.getOtherDurationMs());
    }

    @Test
    void shouldClampOtherDurationAtZero() {
        collector.recordLlmCall("gpt-4o", 10, 10, 5_000, false);
        clock.advanceMillis(1_000);

        assertEquals(0, collector.finalizeMetrics().getOtherDurationMs());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldRecordMemoryFlushesAndErrors() {
        collector.recordMemoryFlush(10_000, 4_000, 250);
        collector.recordError("timeout", "web_search timed out", Map.of("toolName", "web_search"));

        AgentMetrics metrics = collector.getMetrics();

        List<Map<String, Object>> flushes = (List<Map<String, Object>>) metrics.getMetadata()
                .get(AgentMetrics.METADATA_MEMORY_FLUSHES);
        assertEquals(6_000L, flushes.get(0).get("tokensSaved"));
        assertEquals(250L, metrics.getOtherDurationMs());

        List<Map<String, Object>> errors = (List<Map<String, Object>>) metrics.getMetadata()
                .get(AgentMetrics.METADATA_ERRORS);
        assertEquals("timeout", errors.get(0).get("type"));
        assertEquals(Map.of("toolName", "web_search"), errors.get(0).get("context"));
    }

    @Test
    void shouldIgnoreEverythingWhenDisabled() {
        MetricsCollector disabled = new MetricsCollector("conv-1", null, false, clock);

        disabled.recordLlmCall("gpt-4o", 100, 100, 10, false);
        disabled.recordToolCall("web_search", 10, true);

        assertFalse(disabled.isActive());
        assertEquals(0, disabled.finalizeMetrics().getTotalTokens());
        assertEquals("default", disabled.getMetrics().getSessionId());
        assertTrue(disabled.getMetrics().getToolCallsByName().isEmpty());
    }
}
