package me.golemcore.pipeline.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Timed unit of work inside a trace. Times are epoch millis; a span is open
 * while {@code endTime} is null, and once ended
 * {@code durationMs == endTime - startTime}.
 *
 * <p>
 * Spans are mutated only by the tracer that created them, from the thread
 * driving the turn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Span {

    private String traceId;
    private String spanId;
    private String parentSpanId;
    private String name;
    private SpanType spanType;
    private long startTime;
    private Long endTime;
    private Long durationMs;
    @Builder.Default
    private SpanStatus status = SpanStatus.UNKNOWN;
    @Builder.Default
    private List<SpanEvent> events = new ArrayList<>();
    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();
    @Builder.Default
    private List<Span> children = new ArrayList<>();

    @JsonIgnore
    public boolean isOpen() {
        return endTime == null;
    }

    public void end(SpanStatus finalStatus, long endTimeMillis) {
        this.endTime = endTimeMillis;
        this.status = finalStatus;
        this.durationMs = endTimeMillis - startTime;
    }

    public void addEvent(String eventName, Map<String, Object> eventAttributes, long timestampMillis) {
        events.add(SpanEvent.builder()
                .timestamp(timestampMillis)
                .name(eventName)
                .attributes(eventAttributes != null ? new LinkedHashMap<>(eventAttributes) : new LinkedHashMap<>())
                .build());
    }

    public void addChild(Span child) {
        children.add(child);
    }

    public Span findSpanById(String id) {
        if (spanId != null && spanId.equals(id)) {
            return this;
        }
        for (Span child : children) {
            Span found = child.findSpanById(id);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * This span followed by all descendants, depth-first.
     */
    public List<Span> flatten() {
        List<Span> result = new ArrayList<>();
        result.add(this);
        for (Span child : children) {
            result.addAll(child.flatten());
        }
        return result;
    }
}
