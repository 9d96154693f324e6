package me.golemcore.pipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Timestamped point inside a span (cache hit, token update, error...).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpanEvent {

    private long timestamp;
    private String name;
    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();
}
