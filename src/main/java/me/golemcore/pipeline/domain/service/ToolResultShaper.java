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
import me.golemcore.pipeline.domain.model.ContentHashSupport;
import me.golemcore.pipeline.domain.model.OutputLevel;
import me.golemcore.pipeline.domain.model.ShapeableValue;
import me.golemcore.pipeline.domain.model.StoredArtifact;
import me.golemcore.pipeline.domain.model.ToolExecutionResult;
import me.golemcore.pipeline.domain.model.ToolFailureKind;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.outbound.ArtifactStoragePort;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns raw tool output into the observation the LLM sees.
 *
 * <ul>
 * <li>BRIEF - a one-line summary</li>
 * <li>STANDARD - up to ten key/value lines, or the first list item</li>
 * <li>FULL - pretty JSON, or an artifact reference once the payload reaches
 * the offload threshold</li>
 * </ul>
 *
 * Every shaped result carries the UTF-8 size and MD5 of the compact JSON form
 * of the raw data.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolResultShaper {

    public static final String SERIALIZATION_ERROR_TYPE = "serialization";

    private static final int BRIEF_TEXT_LIMIT = 100;
    private static final int BRIEF_INLINE_FIELDS = 3;
    private static final int STANDARD_FIELD_LIMIT = 10;
    private static final int STANDARD_VALUE_LIMIT = 100;
    private static final int STANDARD_FIRST_ITEM_LIMIT = 200;
    private static final int STANDARD_TEXT_LIMIT = 1000;
    private static final int SUMMARY_KEY_LIMIT = 10;

    private final ArtifactStoragePort artifactStorage;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Shapes {@code rawData} at {@code outputLevel}; a {@code null} level is
     * chosen from the payload size. Never throws for unserializable data.
     */
    public ToolExecutionResult shape(String toolCallId, String toolName, Object rawData, OutputLevel outputLevel) {
        long now = clock.millis();
        ShapeableValue value = ShapeableValue.of(rawData);

        String compactJson;
        try {
            compactJson = objectMapper.writeValueAsString(value.raw());
        } catch (JsonProcessingException e) {
            log.warn("[Shaper] Output of {} is not serializable: {}", toolName, e.getOriginalMessage());
            return ToolExecutionResult.error(toolCallId, toolName, ToolFailureKind.EXECUTION_FAILED,
                    SERIALIZATION_ERROR_TYPE, null, "Tool output could not be serialized: " + e.getOriginalMessage(),
                    now);
        }
        byte[] bytes = compactJson.getBytes(StandardCharsets.UTF_8);
        long dataSize = bytes.length;
        String dataHash = ContentHashSupport.md5Hex(bytes);
        OutputLevel level = outputLevel != null ? outputLevel : OutputLevel.fromSize(dataSize);

        ToolExecutionResult.ToolExecutionResultBuilder builder = ToolExecutionResult.builder()
                .toolCallId(toolCallId)
                .toolName(toolName)
                .outputLevel(level)
                .success(true)
                .dataSizeBytes(dataSize)
                .dataHash(dataHash)
                .createdAt(now);

        try {
            switch (level) {
                case BRIEF -> builder.observation(formatBrief(value));
                case STANDARD -> builder.observation(formatStandard(value));
                case FULL -> {
                    if (properties.getArtifacts().isEnabled()
                            && level.shouldUseArtifact(dataSize, properties.getArtifacts().getThresholdBytes())) {
                        offloadOrInline(builder, value, toolName);
                    } else {
                        builder.observation(prettyJson(value));
                    }
                }
                default -> throw new IllegalStateException("Unknown output level: " + level);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[Shaper] Failed to render output of {}: {}", toolName, e.getMessage());
            return ToolExecutionResult.error(toolCallId, toolName, ToolFailureKind.EXECUTION_FAILED,
                    SERIALIZATION_ERROR_TYPE, null, "Tool output could not be serialized: " + e.getMessage(), now);
        }
        return builder.build();
    }

    /**
     * Stores the payload as an artifact. If the store fails the payload is
     * inlined as pretty JSON instead.
     */
    private void offloadOrInline(ToolExecutionResult.ToolExecutionResultBuilder builder, ShapeableValue value,
            String toolName) throws JsonProcessingException {
        String summary = artifactSummary(value);
        StoredArtifact artifact;
        try {
            artifact = artifactStorage.store(value.raw(), toolName, summary);
        } catch (RuntimeException e) {
            log.warn("[Shaper] Artifact store failed for {}, inlining output: {}", toolName, e.getMessage());
            builder.observation(prettyJson(value))
                    .dataSummary(summary);
            return;
        }
        builder.observation(artifact.observation())
                .artifactId(artifact.artifactId())
                .dataFile(artifact.metadata().getFilename())
                .dataSummary(summary);
    }

    private String prettyJson(ShapeableValue value) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value.raw());
    }

    String formatBrief(ShapeableValue value) {
        if (value instanceof ShapeableValue.MapValue map) {
            Map<String, Object> entries = map.entries();
            if (entries.containsKey("success")) {
                if (isTruthy(entries.get("success"))) {
                    return "Success";
                }
                Object error = entries.get("error");
                return "Error: " + (error != null ? error : "Unknown");
            }
            if (entries.containsKey("count")) {
                return "Found " + entries.get("count") + " items";
            }
            if (entries.size() <= BRIEF_INLINE_FIELDS) {
                return "Result: " + entries.entrySet().stream()
                        .map(e -> e.getKey() + "=" + e.getValue())
                        .collect(Collectors.joining(", "));
            }
            return "Result with " + entries.size() + " fields";
        }
        if (value instanceof ShapeableValue.SequenceValue sequence) {
            return "List of " + sequence.items().size() + " items";
        }
        if (value instanceof ShapeableValue.TextValue text) {
            return truncate(text.text(), BRIEF_TEXT_LIMIT);
        }
        if (value instanceof ShapeableValue.NullValue) {
            return "No data";
        }
        return truncate(String.valueOf(value.raw()), BRIEF_TEXT_LIMIT);
    }

    String formatStandard(ShapeableValue value) throws JsonProcessingException {
        if (value instanceof ShapeableValue.MapValue map) {
            Map<String, Object> entries = map.entries();
            List<String> lines = new ArrayList<>();
            lines.add("Result (" + entries.size() + " fields):");
            entries.entrySet().stream()
                    .limit(STANDARD_FIELD_LIMIT)
                    .forEach(e -> lines.add("  " + e.getKey() + ": "
                            + truncate(String.valueOf(e.getValue()), STANDARD_VALUE_LIMIT)));
            if (entries.size() > STANDARD_FIELD_LIMIT) {
                lines.add("  ... and " + (entries.size() - STANDARD_FIELD_LIMIT) + " more fields");
            }
            return String.join("\n", lines);
        }
        if (value instanceof ShapeableValue.SequenceValue sequence) {
            List<Object> items = sequence.items();
            if (items.isEmpty()) {
                return "Empty list";
            }
            String firstItem = truncate(objectMapper.writeValueAsString(items.get(0)), STANDARD_FIRST_ITEM_LIMIT);
            return "List of " + items.size() + " items\nFirst item: " + firstItem;
        }
        return truncate(String.valueOf(value.raw()), STANDARD_TEXT_LIMIT);
    }

    static String artifactSummary(ShapeableValue value) {
        if (value instanceof ShapeableValue.SequenceValue sequence) {
            List<Object> items = sequence.items();
            String summary = "List with " + items.size() + " items";
            if (!items.isEmpty()) {
                Object first = items.get(0);
                String keys = first instanceof Map<?, ?> firstMap
                        ? firstMap.keySet().stream().map(String::valueOf).collect(Collectors.joining(", "))
                        : "scalar";
                summary += ". First item keys: [" + keys + "]";
            }
            return summary;
        }
        if (value instanceof ShapeableValue.MapValue map) {
            String keys = map.entries().keySet().stream()
                    .limit(SUMMARY_KEY_LIMIT)
                    .collect(Collectors.joining(", "));
            return "Dict with " + map.entries().size() + " keys: [" + keys + "]";
        }
        if (value instanceof ShapeableValue.TextValue text) {
            return "String (" + text.text().length() + " chars)";
        }
        return value.raw() == null ? "null" : value.raw().getClass().getSimpleName();
    }

    private static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        if (value instanceof CharSequence text) {
            return !text.isEmpty();
        }
        return true;
    }

    private static String truncate(String text, int maxLength) {
        return text.length() > maxLength ? text.substring(0, maxLength) : text;
    }
}
