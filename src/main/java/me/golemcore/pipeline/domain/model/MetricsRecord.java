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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Index row for one metrics line appended to a session JSONL file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsRecord {

    private Long id;
    private String conversationId;
    private String sessionId;
    private long timestamp;
    private long totalTokens;
    private long totalDurationMs;
    private int toolCallsCount;
    private double estimatedCostUsd;
    private String model;
    private String filePath;
    private long createdAt;
}
