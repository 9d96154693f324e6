package me.golemcore.pipeline.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregate numbers over the artifact store.
 */
@Value
@Builder
public class ArtifactStats {

    int artifactCount;
    long totalSizeBytes;
    int maxAgeHours;

    public double getTotalSizeMb() {
        return totalSizeBytes / (1024.0 * 1024.0);
    }
}
