package me.golemcore.pipeline.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of the idempotency cache for diagnostics.
 */
@Value
@Builder
public class CacheStats {

    int size;
    int maxSize;
    long totalHits;
    int expiredCount;
    List<EntrySummary> newestEntries;

    @Value
    @Builder
    public static class EntrySummary {
        String key;
        String toolName;
        Instant createdAt;
        long ageSeconds;
        long hitCount;
    }
}
