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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verbosity of the observation text handed back to the LLM.
 *
 * <p>
 * The level is an engineering knob: it controls how much of the tool output is
 * rendered into the observation, not what the tool semantically returned.
 */
public enum OutputLevel {

    BRIEF("brief", 50), STANDARD("standard", 500), FULL("full", 200_000);

    public static final long FULL_INLINE_LIMIT_BYTES = 10_000L;
    public static final long ARTIFACT_THRESHOLD_BYTES = 1_000_000L;

    private final String code;
    private final int maxTokens;

    OutputLevel(String code, int maxTokens) {
        this.code = code;
        this.maxTokens = maxTokens;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Approximate token budget of an observation rendered at this level.
     */
    public int getMaxTokens() {
        return maxTokens;
    }

    /**
     * Picks a level from the serialized size of the raw output. Small payloads
     * are inlined in full, medium ones are summarized, and anything at or above
     * 1 MB goes back to FULL so that it is offloaded to the artifact store.
     */
    public static OutputLevel fromSize(long dataSizeBytes) {
        if (dataSizeBytes < FULL_INLINE_LIMIT_BYTES) {
            return FULL;
        }
        if (dataSizeBytes < ARTIFACT_THRESHOLD_BYTES) {
            return STANDARD;
        }
        return FULL;
    }

    public boolean shouldUseArtifact(long dataSizeBytes) {
        return shouldUseArtifact(dataSizeBytes, ARTIFACT_THRESHOLD_BYTES);
    }

    public boolean shouldUseArtifact(long dataSizeBytes, long thresholdBytes) {
        return this == FULL && dataSizeBytes >= thresholdBytes;
    }
}
