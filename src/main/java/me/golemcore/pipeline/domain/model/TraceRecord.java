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
 * Index row pointing at a persisted trace document. Times are epoch millis and
 * {@code filePath} is relative to the storage base path.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraceRecord {

    private String traceId;
    private String conversationId;
    private String sessionId;
    private long startTime;
    private Long endTime;
    private Long durationMs;
    private String status;
    private String filePath;
    private long createdAt;
    private String model;
    private long totalTokens;
    private int toolCallsCount;
}
