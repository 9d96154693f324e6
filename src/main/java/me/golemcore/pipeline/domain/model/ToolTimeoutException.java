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

/**
 * Raised when a tool does not finish within its deadline. The worker that was
 * running the tool is not interrupted and may still complete later.
 */
public class ToolTimeoutException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String toolCallId;
    private final long timeoutMs;

    public ToolTimeoutException(String toolCallId, long timeoutMs) {
        super("Tool execution for " + toolCallId + " timed out after " + timeoutMs + "ms");
        this.toolCallId = toolCallId;
        this.timeoutMs = timeoutMs;
    }

    public String getToolCallId() {
        return toolCallId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
