package me.golemcore.pipeline.domain.service;

import lombok.Value;

/**
 * Observability handles for one agent turn: the span tree under construction
 * and the running metrics. Passed explicitly to every component that records
 * into them.
 */
@Value
public class TurnContext {

    String conversationId;
    String sessionId;
    ExecutionTracer tracer;
    MetricsCollector collector;

    public String key() {
        return keyOf(conversationId, sessionId);
    }

    static String keyOf(String conversationId, String sessionId) {
        return conversationId + ":" + sessionId;
    }
}
