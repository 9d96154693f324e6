package me.golemcore.pipeline.adapter.outbound.index;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pipeline.domain.model.MetricsRecord;
import me.golemcore.pipeline.domain.model.TraceRecord;
import me.golemcore.pipeline.port.outbound.TraceIndexPort;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.List;

/**
 * SQLite index over persisted trace documents and metrics lines.
 *
 * <p>
 * The index only answers "which file holds what"; the documents themselves
 * live on disk. All timestamps are epoch milliseconds. The data source hands
 * out a fresh connection per operation, so callers on different threads never
 * share one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SqliteTraceIndexAdapter implements TraceIndexPort {

    private static final String TRACE_COLUMNS = "trace_id, conversation_id, session_id, start_time, end_time, "
            + "duration_ms, status, file_path, created_at, model, total_tokens, tool_calls_count";
    private static final String METRICS_COLUMNS = "id, conversation_id, session_id, timestamp, total_tokens, "
            + "total_duration_ms, tool_calls_count, estimated_cost_usd, model, file_path, created_at";

    private static final List<String> SCHEMA = List.of(
            """
                    CREATE TABLE IF NOT EXISTS traces (
                        trace_id TEXT PRIMARY KEY,
                        conversation_id TEXT NOT NULL,
                        session_id TEXT NOT NULL,
                        start_time INTEGER NOT NULL,
                        end_time INTEGER,
                        duration_ms INTEGER,
                        status TEXT,
                        file_path TEXT,
                        created_at INTEGER NOT NULL,
                        model TEXT,
                        total_tokens INTEGER,
                        tool_calls_count INTEGER
                    )""",
            "CREATE INDEX IF NOT EXISTS idx_conversation ON traces(conversation_id)",
            "CREATE INDEX IF NOT EXISTS idx_session ON traces(session_id)",
            "CREATE INDEX IF NOT EXISTS idx_start_time ON traces(start_time)",
            "CREATE INDEX IF NOT EXISTS idx_created_at ON traces(created_at)",
            """
                    CREATE TABLE IF NOT EXISTS metrics (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        conversation_id TEXT NOT NULL,
                        session_id TEXT NOT NULL,
                        timestamp INTEGER NOT NULL,
                        total_tokens INTEGER,
                        total_duration_ms INTEGER,
                        tool_calls_count INTEGER,
                        estimated_cost_usd REAL,
                        model TEXT,
                        file_path TEXT,
                        created_at INTEGER NOT NULL
                    )""",
            "CREATE INDEX IF NOT EXISTS idx_metrics_conversation ON metrics(conversation_id)",
            "CREATE INDEX IF NOT EXISTS idx_metrics_session ON metrics(session_id)",
            "CREATE INDEX IF NOT EXISTS idx_metrics_timestamp ON metrics(timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_metrics_created_at ON metrics(created_at)");

    private static final RowMapper<TraceRecord> TRACE_ROW_MAPPER = (rs, rowNum) -> TraceRecord.builder()
            .traceId(rs.getString("trace_id"))
            .conversationId(rs.getString("conversation_id"))
            .sessionId(rs.getString("session_id"))
            .startTime(rs.getLong("start_time"))
            .endTime(nullableLong(rs, "end_time"))
            .durationMs(nullableLong(rs, "duration_ms"))
            .status(rs.getString("status"))
            .filePath(rs.getString("file_path"))
            .createdAt(rs.getLong("created_at"))
            .model(rs.getString("model"))
            .totalTokens(rs.getLong("total_tokens"))
            .toolCallsCount(rs.getInt("tool_calls_count"))
            .build();

    private static final RowMapper<MetricsRecord> METRICS_ROW_MAPPER = (rs, rowNum) -> MetricsRecord.builder()
            .id(rs.getLong("id"))
            .conversationId(rs.getString("conversation_id"))
            .sessionId(rs.getString("session_id"))
            .timestamp(rs.getLong("timestamp"))
            .totalTokens(rs.getLong("total_tokens"))
            .totalDurationMs(rs.getLong("total_duration_ms"))
            .toolCallsCount(rs.getInt("tool_calls_count"))
            .estimatedCostUsd(rs.getDouble("estimated_cost_usd"))
            .model(rs.getString("model"))
            .filePath(rs.getString("file_path"))
            .createdAt(rs.getLong("created_at"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @PostConstruct
    public void init() {
        SCHEMA.forEach(jdbcTemplate::execute);
        log.info("[Monitoring] Trace index schema ready");
    }

    @Override
    public void insertTrace(TraceRecord record) {
        jdbcTemplate.update("INSERT OR REPLACE INTO traces (" + TRACE_COLUMNS + ") "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                record.getTraceId(),
                record.getConversationId(),
                record.getSessionId(),
                record.getStartTime(),
                record.getEndTime(),
                record.getDurationMs(),
                record.getStatus(),
                record.getFilePath(),
                record.getCreatedAt(),
                record.getModel(),
                record.getTotalTokens(),
                record.getToolCallsCount());
    }

    @Override
    public List<TraceRecord> findTracesByConversation(String conversationId) {
        return jdbcTemplate.query("SELECT " + TRACE_COLUMNS + " FROM traces WHERE conversation_id = ? "
                + "ORDER BY start_time DESC", TRACE_ROW_MAPPER, conversationId);
    }

    @Override
    public List<TraceRecord> findTracesBySession(String sessionId) {
        return jdbcTemplate.query("SELECT " + TRACE_COLUMNS + " FROM traces WHERE session_id = ? "
                + "ORDER BY start_time DESC", TRACE_ROW_MAPPER, sessionId);
    }

    @Override
    public List<TraceRecord> findTracesByTimeRange(long startTime, long endTime) {
        return jdbcTemplate.query("SELECT " + TRACE_COLUMNS + " FROM traces WHERE start_time >= ? AND start_time <= ? "
                + "ORDER BY start_time DESC", TRACE_ROW_MAPPER, startTime, endTime);
    }

    @Override
    public List<TraceRecord> findRecentTraces(int limit) {
        return jdbcTemplate.query("SELECT " + TRACE_COLUMNS + " FROM traces ORDER BY start_time DESC LIMIT ?",
                TRACE_ROW_MAPPER, limit);
    }

    @Override
    public List<TraceRecord> findTracesCreatedBefore(long cutoff) {
        return jdbcTemplate.query("SELECT " + TRACE_COLUMNS + " FROM traces WHERE created_at < ?",
                TRACE_ROW_MAPPER, cutoff);
    }

    @Override
    public int deleteTracesCreatedBefore(long cutoff) {
        return jdbcTemplate.update("DELETE FROM traces WHERE created_at < ?", cutoff);
    }

    @Override
    public long insertMetrics(MetricsRecord record) {
        Long id = jdbcTemplate.execute((ConnectionCallback<Long>) connection -> {
            try (PreparedStatement statement = connection.prepareStatement("INSERT INTO metrics "
                    + "(conversation_id, session_id, timestamp, total_tokens, total_duration_ms, tool_calls_count, "
                    + "estimated_cost_usd, model, file_path, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                statement.setString(1, record.getConversationId());
                statement.setString(2, record.getSessionId());
                statement.setLong(3, record.getTimestamp());
                statement.setLong(4, record.getTotalTokens());
                statement.setLong(5, record.getTotalDurationMs());
                statement.setInt(6, record.getToolCallsCount());
                statement.setDouble(7, record.getEstimatedCostUsd());
                if (record.getModel() != null) {
                    statement.setString(8, record.getModel());
                } else {
                    statement.setNull(8, Types.VARCHAR);
                }
                statement.setString(9, record.getFilePath());
                statement.setLong(10, record.getCreatedAt());
                statement.executeUpdate();
            }
            try (Statement statement = connection.createStatement();
                    ResultSet rs = statement.executeQuery("SELECT last_insert_rowid()")) {
                return rs.next() ? rs.getLong(1) : -1L;
            }
        });
        return id != null ? id : -1L;
    }

    @Override
    public List<MetricsRecord> findMetricsByConversation(String conversationId) {
        return jdbcTemplate.query("SELECT " + METRICS_COLUMNS + " FROM metrics WHERE conversation_id = ? "
                + "ORDER BY timestamp DESC", METRICS_ROW_MAPPER, conversationId);
    }

    @Override
    public List<MetricsRecord> findMetricsBySession(String sessionId) {
        return jdbcTemplate.query("SELECT " + METRICS_COLUMNS + " FROM metrics WHERE session_id = ? "
                + "ORDER BY timestamp DESC", METRICS_ROW_MAPPER, sessionId);
    }

    @Override
    public List<MetricsRecord> findMetricsByTimeRange(long startTime, long endTime) {
        return jdbcTemplate.query("SELECT " + METRICS_COLUMNS + " FROM metrics WHERE timestamp >= ? AND timestamp <= ? "
                + "ORDER BY timestamp DESC", METRICS_ROW_MAPPER, startTime, endTime);
    }

    @Override
    public List<MetricsRecord> findAllMetrics() {
        return jdbcTemplate.query("SELECT " + METRICS_COLUMNS + " FROM metrics ORDER BY timestamp DESC",
                METRICS_ROW_MAPPER);
    }

    @Override
    public List<MetricsRecord> findMetricsCreatedBefore(long cutoff) {
        return jdbcTemplate.query("SELECT " + METRICS_COLUMNS + " FROM metrics WHERE created_at < ?",
                METRICS_ROW_MAPPER, cutoff);
    }

    @Override
    public int deleteMetricsCreatedBefore(long cutoff) {
        return jdbcTemplate.update("DELETE FROM metrics WHERE created_at < ?", cutoff);
    }

    @Override
    public int countMetricsByFile(String filePath) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM metrics WHERE file_path = ?",
                Integer.class, filePath);
        return count != null ? count : 0;
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
