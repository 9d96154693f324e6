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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pipeline.domain.model.Span;
import me.golemcore.pipeline.domain.model.SpanStatus;
import me.golemcore.pipeline.domain.model.SpanType;
import me.golemcore.pipeline.domain.model.Trace;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the span tree of one agent turn.
 *
 * <p>
 * A stack of open spans provides implicit parenting: a new span becomes a child
 * of the innermost open span, or of the root when the stack is empty. A tracer
 * belongs to a single turn and is not thread-safe. A disabled tracer records
 * nothing and returns {@code null} from every factory method.
 */
@Slf4j
public class ExecutionTracer {

    private final String conversationId;
    private final String sessionId;
    private final boolean enabled;
    private final Clock clock;
    private final String traceId;

    private Span rootSpan;
    private final Deque<Span> spanStack = new ArrayDeque<>();
    private final Map<String, Span> spans = new LinkedHashMap<>();

    public ExecutionTracer(String conversationId, String sessionId, boolean enabled, Clock clock) {
        this.conversationId = conversationId;
        this.sessionId = sessionId != null ? sessionId : "default";
        this.enabled = enabled;
        this.clock = clock;
        this.traceId = "trace_" + randomHex(16) + "_" + clock.instant().getEpochSecond();
    }

    public String getTraceId() {
        return traceId;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isActive() {
        return enabled && rootSpan != null;
    }

    public Span createRootSpan(String name, Map<String, Object> attributes) {
        return createRootSpan(name, SpanType.AGENT_INVOKE, attributes);
    }

    /**
     * Starts the turn. Replaces any previous root and resets the open-span
     * stack to contain only the new root.
     */
    public Span createRootSpan(String name, SpanType spanType, Map<String, Object> attributes) {
        if (!enabled) {
            return null;
        }
        Span span = newSpan("span_root_" + traceId, null, name, spanType, attributes);
        rootSpan = span;
        spanStack.clear();
        spanStack.push(span);
        spans.clear();
        spans.put(span.getSpanId(), span);
        log.debug("[Trace] Root span {} opened for conversation {}", span.getSpanId(), conversationId);
        return span;
    }

    public Span createSpan(String name, SpanType spanType, Map<String, Object> attributes) {
        return createSpan(name, spanType, null, attributes);
    }

    /**
     * Opens a child span and makes it the innermost open span.
     *
     * @param parent
     *            explicit parent, or {@code null} for the innermost open span
     * @return the span, or {@code null} when disabled or no root exists yet
     */
    public Span createSpan(String name, SpanType spanType, Span parent, Map<String, Object> attributes) {
        if (!enabled) {
            return null;
        }
        Span effectiveParent = parent != null ? parent : spanStack.isEmpty() ? rootSpan : spanStack.peek();
        if (effectiveParent == null) {
            return null;
        }
        Span span = newSpan("span_" + spanType.getCode() + "_" + randomHex(8), effectiveParent.getSpanId(), name,
                spanType, attributes);
        effectiveParent.addChild(span);
        spans.put(span.getSpanId(), span);
        spanStack.push(span);
        return span;
    }

    /**
     * Ends {@code span}. It leaves the open-span stack only if it is the
     * innermost open span.
     */
    public void endSpan(Span span, SpanStatus status) {
        if (span == null) {
            return;
        }
        span.end(status, clock.millis());
        if (!spanStack.isEmpty() && spanStack.peek() == span) {
            spanStack.pop();
        }
    }

    /**
     * Pops the innermost open span and ends it. A span that was already ended
     * out of order is popped without touching its status.
     */
    public Span endActiveSpan(SpanStatus status) {
        if (spanStack.isEmpty()) {
            return null;
        }
        Span span = spanStack.pop();
        if (span.isOpen()) {
            span.end(status, clock.millis());
        }
        return span;
    }

    /**
     * Adds an event to {@code span}, or to the innermost open span when
     * {@code span} is null.
     */
    public void addEvent(String name, Map<String, Object> attributes, Span span) {
        if (!enabled) {
            return;
        }
        Span target = span != null ? span : spanStack.peek();
        if (target != null) {
            target.addEvent(name, attributes, clock.millis());
        }
    }

    public Span getActiveSpan() {
        return spanStack.peek();
    }

    public Span getRootSpan() {
        return rootSpan;
    }

    public Trace getTrace() {
        if (rootSpan == null) {
            return null;
        }
        return Trace.builder()
                .traceId(traceId)
                .conversationId(conversationId)
                .sessionId(sessionId)
                .rootSpan(rootSpan)
                .startTime(rootSpan.getStartTime())
                .endTime(rootSpan.getEndTime())
                .totalDurationMs(rootSpan.getDurationMs())
                .build();
    }

    public Span getSpanById(String spanId) {
        return spans.get(spanId);
    }

    public List<Span> getAllSpans() {
        return new ArrayList<>(spans.values());
    }

    public List<Span> breadthFirst() {
        return breadthFirst(rootSpan);
    }

    public List<Span> depthFirst() {
        List<Span> result = new ArrayList<>();
        if (rootSpan == null) {
            return result;
        }
        Deque<Span> stack = new ArrayDeque<>();
        stack.push(rootSpan);
        while (!stack.isEmpty()) {
            Span span = stack.pop();
            result.add(span);
            List<Span> children = span.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    static List<Span> breadthFirst(Span root) {
        List<Span> result = new ArrayList<>();
        if (root == null) {
            return result;
        }
        Deque<Span> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            Span span = queue.poll();
            result.add(span);
            queue.addAll(span.getChildren());
        }
        return result;
    }

    private Span newSpan(String spanId, String parentSpanId, String name, SpanType spanType,
            Map<String, Object> attributes) {
        return Span.builder()
                .traceId(traceId)
                .spanId(spanId)
                .parentSpanId(parentSpanId)
                .name(name)
                .spanType(spanType)
                .startTime(clock.millis())
                .attributes(attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>())
                .build();
    }

    private static String randomHex(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length);
    }
}
