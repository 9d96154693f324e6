package me.golemcore.pipeline.port.outbound;

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

import me.golemcore.pipeline.domain.model.MetricsRecord;
import me.golemcore.pipeline.domain.model.TraceRecord;

import java.util.List;

/**
 * Secondary index over persisted traces and metrics lines, used to answer
 * range queries without scanning files. All times are epoch millis; results
 * are ordered newest first.
 */
public interface TraceIndexPort {

    void insertTrace(TraceRecord record);

    List<TraceRecord> findTracesByConversation(String conversationId);

    List<TraceRecord> findTracesBySession(String sessionId);

    List<TraceRecord> findTracesByTimeRange(long startTime, long endTime);

    List<TraceRecord> findRecentTraces(int limit);

    List<TraceRecord> findTracesCreatedBefore(long cutoff);

    int deleteTracesCreatedBefore(long cutoff);

    long insertMetrics(MetricsRecord record);

    List<MetricsRecord> findMetricsByConversation(String conversationId);

    List<MetricsRecord> findMetricsBySession(String sessionId);

    List<MetricsRecord> findMetricsByTimeRange(long startTime, long endTime);

    List<MetricsRecord> findAllMetrics();

    List<MetricsRecord> findMetricsCreatedBefore(long cutoff);

    int deleteMetricsCreatedBefore(long cutoff);

    int countMetricsByFile(String filePath);
}
