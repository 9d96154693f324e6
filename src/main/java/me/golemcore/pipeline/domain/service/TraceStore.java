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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pipeline.domain.model.AgentMetrics;
import me.golemcore.pipeline.domain.model.ConversationSummary;
import me.golemcore.pipeline.domain.model.SpanStatus;
import me.golemcore.pipeline.domain.model.Trace;
import me.golemcore.pipeline.domain.model.TraceRecord;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.outbound.StoragePort;
import me.golemcore.pipeline.port.outbound.TraceIndexPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists finished turns as JSON documents under {@code traces/} and indexes
 * them in SQLite.
 *
 * <p>
 * Files are named {@code trace_<conversationId>_<yyyyMMdd_HHmmss>.json} after
 * the root span's start time. The index stores paths relative to the storage
 * base directory.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TraceStore {

    private static final String LOG_PREFIX = "[Trace]";
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String PATH_SEPARATOR = "/";

    private final StoragePort storagePort;
    private final TraceIndexPort traceIndex;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Writes the trace document, with {@code metrics} embedded when given, and
     * indexes it.
     *
     * @return path of the document relative to the storage base directory
     */
    public String saveTrace(Trace trace, AgentMetrics metrics) {
        if (metrics != null) {
            trace.setMetrics(metrics);
        }
        String filename = "trace_" + trace.getConversationId() + "_"
                + FILE_TIMESTAMP.format(Instant.ofEpochMilli(trace.getStartTime()).atZone(clock.getZone()))
                + ".json";
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(trace);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize trace " + trace.getTraceId(), e);
        }
        storagePort.putTextAtomic(tracesDirectory(), filename, json).join();

        String filePath = tracesDirectory() + PATH_SEPARATOR + filename;
        SpanStatus status = trace.getRootSpan() != null ? trace.getRootSpan().getStatus() : SpanStatus.UNKNOWN;
        traceIndex.insertTrace(TraceRecord.builder()
                .traceId(trace.getTraceId())
                .conversationId(trace.getConversationId())
                .sessionId(trace.getSessionId())
                .startTime(trace.getStartTime())
                .endTime(trace.getEndTime())
                .durationMs(trace.getTotalDurationMs())
                .status(status.getCode())
                .filePath(filePath)
                .createdAt(clock.millis())
                .model(metrics != null ? metrics.getPrimaryModel() : null)
                .totalTokens(metrics != null ? metrics.getTotalTokens() : 0)
                .toolCallsCount(metrics != null ? metrics.getToolCallsCount() : 0)
                .build());

        log.debug("{} Saved trace {} to {}", LOG_PREFIX, trace.getTraceId(), filePath);
        return filePath;
    }

    /**
     * Loads the most recent trace document of a conversation. Empty when the
     * conversation is unknown or its document has been removed.
     */
    public Optional<Trace> loadTrace(String conversationId) {
        List<TraceRecord> records = traceIndex.findTracesByConversation(conversationId);
        if (records.isEmpty()) {
            return Optional.empty();
        }
        return readTrace(records.get(0).getFilePath());
    }

    public List<ConversationSummary> listConversations(String sessionId, int limit) {
        List<TraceRecord> records = sessionId != null && !sessionId.isBlank()
                ? traceIndex.findTracesBySession(sessionId)
                : traceIndex.findRecentTraces(limit);

        Map<String, ConversationSummary> conversations = new LinkedHashMap<>();
        for (TraceRecord record : records) {
            ConversationSummary summary = conversations.computeIfAbsent(record.getConversationId(),
                    id -> ConversationSummary.builder()
                            .conversationId(id)
                            .sessionId(record.getSessionId())
                            .startTime(record.getStartTime())
                            .build());
            long duration = record.getDurationMs() != null ? record.getDurationMs() : 0L;
            summary.setTotalDurationMs(Math.max(summary.getTotalDurationMs(), duration));
            summary.setTraceCount(summary.getTraceCount() + 1);
            summary.setTotalTokens(summary.getTotalTokens() + record.getTotalTokens());
            summary.setToolCalls(summary.getToolCalls() + record.getToolCallsCount());
        }
        return new ArrayList<>(conversations.values()).subList(0, Math.min(Math.max(0, limit),
                conversations.size()));
    }

    public List<TraceRecord> findByConversation(String conversationId) {
        return traceIndex.findTracesByConversation(conversationId);
    }

    public List<TraceRecord> findBySession(String sessionId) {
        return traceIndex.findTracesBySession(sessionId);
    }

    public List<TraceRecord> findByTimeRange(long startTime, long endTime) {
        return traceIndex.findTracesByTimeRange(startTime, endTime);
    }

    public List<TraceRecord> findRecent(int limit) {
        return traceIndex.findRecentTraces(limit);
    }

    /**
     * Deletes index rows created more than {@code days} ago together with their
     * documents. Documents that are already gone are skipped.
     *
     * @return number of removed index rows
     */
    public int cleanupOldTraces(int days) {
        long cutoff = clock.millis() - Duration.ofDays(days).toMillis();
        for (TraceRecord record : traceIndex.findTracesCreatedBefore(cutoff)) {
            deleteDocument(record.getFilePath());
        }
        int removed = traceIndex.deleteTracesCreatedBefore(cutoff);
        if (removed > 0) {
            log.info("{} Removed {} trace(s) older than {}d", LOG_PREFIX, removed, days);
        }
        return removed;
    }

    private Optional<Trace> readTrace(String filePath) {
        String filename = filenameOf(filePath);
        String json = storagePort.getText(tracesDirectory(), filename).join();
        if (json == null) {
            log.debug("{} Trace document {} is missing", LOG_PREFIX, filePath);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Trace.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted trace document: " + filePath, e);
        }
    }

    private void deleteDocument(String filePath) {
        if (filePath == null) {
            return;
        }
        try {
            storagePort.deleteObject(tracesDirectory(), filenameOf(filePath)).join();
        } catch (RuntimeException e) {
            log.warn("{} Failed to delete {}: {}", LOG_PREFIX, filePath, e.getMessage());
        }
    }

    private String filenameOf(String filePath) {
        int separator = filePath.lastIndexOf(PATH_SEPARATOR);
        return separator >= 0 ? filePath.substring(separator + 1) : filePath;
    }

    private String tracesDirectory() {
        return properties.getStorage().getDirectories().getTraces();
    }
}
