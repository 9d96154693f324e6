package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Traces that started within the last {@code hours} hours.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecentActivity {

    private int hours;
    private long startTime;
    private long endTime;
    private int traceCount;
    private List<TraceRecord> traces;
}
