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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-tool call statistics within one conversation turn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolCallStats {

    private String toolName;
    private int callCount;
    private int successCount;
    private int errorCount;
    private long totalDurationMs;
    private long totalInputTokens;
    private long totalOutputTokens;

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public double getAvgDurationMs() {
        return callCount > 0 ? (double) totalDurationMs / callCount : 0.0;
    }

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public double getSuccessRate() {
        return callCount > 0 ? (double) successCount / callCount : 0.0;
    }
}
