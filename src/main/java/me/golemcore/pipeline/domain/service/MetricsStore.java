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
import me.golemcore.pipeline.domain.model.MetricsRecord;
import me.golemcore.pipeline.domain.model.MetricsSummary;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.outbound.StoragePort;
import me.golemcore.pipeline.port.outbound.TraceIndexPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Appends finalized turn metrics to per-session, per-day JSONL files and
 * indexes every line in SQLite.
 *
 * <p>
 * Files are named {@code metrics_<sessionId>_<yyyyMMdd>.jsonl}; several turns
 * share one file, so a file is only deleted once no index row refers to it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MetricsStore {

    private static final String LOG_PREFIX = "[Metrics]";
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String NEWLINE = "\n";
    private static final String PATH_SEPARATOR = "/";

    private final StoragePort storagePort;
    private final TraceIndexPort traceIndex;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @return path of the JSONL file relative to the storage base directory
     */
    public String saveMetrics(AgentMetrics metrics) {
        String filename = "metrics_" + metrics.getSessionId() + "_"
                + FILE_DATE.format(Instant.ofEpochMilli(metrics.getTimestamp()).atZone(clock.getZone()))
                + JSONL_EXTENSION;
        String line;
        try {
            line = objectMapper.writeValueAsString(metrics);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize metrics of " + metrics.getConversationId(), e);
        }
        storagePort.appendText(metricsDirectory(), filename, line + NEWLINE).join();

        String filePath = metricsDirectory() + PATH_SEPARATOR + filename;
        traceIndex.insertMetrics(MetricsRecord.builder()
                .conversationId(metrics.getConversationId())
                .sessionId(metrics.getSessionId())
                .timestamp(metrics.getTimestamp())
                .totalTokens(metrics.getTotalTokens())
                .totalDurationMs(metrics.getTotalDurationMs())
                .toolCallsCount(metrics.getToolCallsCount())
                .estimatedCostUsd(metrics.getEstimatedCostUsd())
                .model(metrics.getPrimaryModel())
                .filePath(filePath)
                .createdAt(clock.millis())
                .build());

        log.debug("{} Appended metrics of {} to {}", LOG_PREFIX, metrics.getConversationId(), filePath);
        return filePath;
    }

    /**
     * Full metrics documents of a conversation, optionally restricted to a
     * turn-start window. Each backing file is read once; malformed lines are
     * skipped.
     */
    public List<AgentMetrics> getMetrics(String conversationId, Long startTime, Long endTime) {
        Set<String> files = new LinkedHashSet<>();
        for (MetricsRecord record : traceIndex.findMetricsByConversation(conversationId)) {
            if (inWindow(record.getTimestamp(), startTime, endTime)) {
                files.add(record.getFilePath());
            }
        }

        List<AgentMetrics> results = new ArrayList<>();
        for (String filePath : files) {
            String content = storagePort.getText(metricsDirectory(), filenameOf(filePath)).join();
            if (content == null) {
                continue;
            }
            for (String line : content.split(NEWLINE)) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    AgentMetrics metrics = objectMapper.readValue(line, AgentMetrics.class);
                    if (conversationId.equals(metrics.getConversationId())
                            && inWindow(metrics.getTimestamp(), startTime, endTime)) {
                        results.add(metrics);
                    }
                } catch (JsonProcessingException e) {
                    log.debug("{} Skipping malformed line in {}: {}", LOG_PREFIX, filePath, e.getMessage());
                }
            }
        }
        return results;
    }

    public List<MetricsRecord> findBySession(String sessionId) {
        return traceIndex.findMetricsBySession(sessionId);
    }

    /**
     * Totals and per-conversation averages across indexed turns. The time window
     * applies only when both bounds are given.
     */
    public MetricsSummary getAggregatedMetrics(String sessionId, Long startTime, Long endTime) {
        List<MetricsRecord> records = startTime != null && endTime != null
                ? traceIndex.findMetricsByTimeRange(startTime, endTime)
                : traceIndex.findAllMetrics();
        if (sessionId != null && !sessionId.isBlank()) {
            records = records.stream().filter(r -> sessionId.equals(r.getSessionId())).toList();
        }

        int conversations = (int) records.stream().map(MetricsRecord::getConversationId).distinct().count();
        long totalTokens = records.stream().mapToLong(MetricsRecord::getTotalTokens).sum();
        long totalDuration = records.stream().mapToLong(MetricsRecord::getTotalDurationMs).sum();
        return MetricsSummary.builder()
                .totalConversations(conversations)
                .totalTokens(totalTokens)
                .totalDurationMs(totalDuration)
                .totalToolCalls(records.stream().mapToLong(MetricsRecord::getToolCallsCount).sum())
                .totalCostUsd(records.stream().mapToDouble(MetricsRecord::getEstimatedCostUsd).sum())
                .avgTokensPerConversation(conversations > 0 ? (double) totalTokens / conversations : 0.0)
                .avgDurationMsPerConversation(conversations > 0 ? (double) totalDuration / conversations : 0.0)
                .build();
    }

    /**
     * Deletes index rows created more than {@code days} ago, then every JSONL
     * file no longer referenced by any row.
     *
     * @return number of removed index rows
     */
    public int cleanupOldMetrics(int days) {
        long cutoff = clock.millis() - Duration.ofDays(days).toMillis();
        Set<String> candidateFiles = new LinkedHashSet<>();
        for (MetricsRecord record : traceIndex.findMetricsCreatedBefore(cutoff)) {
            if (record.getFilePath() != null) {
                candidateFiles.add(record.getFilePath());
            }
        }
        int removed = traceIndex.deleteMetricsCreatedBefore(cutoff);

        for (String filePath : candidateFiles) {
            if (traceIndex.countMetricsByFile(filePath) > 0) {
                continue;
            }
            try {
                storagePort.deleteObject(metricsDirectory(), filenameOf(filePath)).join();
            } catch (RuntimeException e) {
                log.warn("{} Failed to delete {}: {}", LOG_PREFIX, filePath, e.getMessage());
            }
        }
        if (removed > 0) {
            log.info("{} Removed {} metrics row(s) older than {}d", LOG_PREFIX, removed, days);
        }
        return removed;
    }

    private static boolean inWindow(long timestamp, Long startTime, Long endTime) {
        return (startTime == null || timestamp >= startTime) && (endTime == null || timestamp <= endTime);
    }

    private String filenameOf(String filePath) {
        int separator = filePath.lastIndexOf(PATH_SEPARATOR);
        return separator >= 0 ? filePath.substring(separator + 1) : filePath;
    }

    private String metricsDirectory() {
        return properties.getStorage().getDirectories().getMetrics();
    }
}
