package me.golemcore.pipeline.infrastructure.config;

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

import me.golemcore.pipeline.domain.model.ToolCachePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the pipeline, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code pipeline.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location and subdirectories</li>
 * <li>{@link ArtifactProperties} - offloading of large tool outputs</li>
 * <li>{@link CacheProperties} - idempotency cache capacity</li>
 * <li>{@link TimeoutProperties} - worker pool for the timeout isolator</li>
 * <li>{@link TracingProperties}, {@link MetricsProperties} - per-turn
 * observability switches</li>
 * <li>{@link RetentionProperties}, {@link HousekeepingProperties} - cleanup of
 * persisted data</li>
 * <li>{@code toolCachePolicies} - per-tool cache policy overrides</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "pipeline")
@Data
public class PipelineProperties {

    private StorageProperties storage = new StorageProperties();
    private ArtifactProperties artifacts = new ArtifactProperties();
    private CacheProperties cache = new CacheProperties();
    private TimeoutProperties timeout = new TimeoutProperties();
    private TracingProperties tracing = new TracingProperties();
    private MetricsProperties metrics = new MetricsProperties();
    private RetentionProperties retention = new RetentionProperties();
    private HousekeepingProperties housekeeping = new HousekeepingProperties();
    private Map<String, ToolCachePolicy> toolCachePolicies = new HashMap<>();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/pipeline";
        private DirectoriesProperties directories = new DirectoriesProperties();
        private String indexFile = "monitoring.db";

        /**
         * Absolute, normalized base path with {@code ${user.home}} expanded.
         */
        public Path resolveBasePath() {
            return Paths.get(basePath.replace("${user.home}", System.getProperty("user.home")))
                    .toAbsolutePath().normalize();
        }
    }

    @Data
    public static class DirectoriesProperties {
        private String artifacts = "artifacts";
        private String traces = "traces";
        private String metrics = "metrics";
    }

    @Data
    public static class ArtifactProperties {
        private boolean enabled = true;
        private int maxAgeHours = 24;
        private long thresholdBytes = 1_000_000L;
        private String metadataFile = "metadata.json";
    }

    @Data
    public static class CacheProperties {
        private int maxSize = 1000;
    }

    @Data
    public static class TimeoutProperties {
        private long defaultMs = 30_000L;
        private String threadNamePrefix = "tool-worker-";
    }

    @Data
    public static class TracingProperties {
        private boolean enabled = true;
    }

    @Data
    public static class MetricsProperties {
        private boolean enabled = true;
    }

    @Data
    public static class RetentionProperties {
        private int traceDays = 7;
        private int metricsDays = 30;
    }

    @Data
    public static class HousekeepingProperties {
        private boolean enabled = true;
        private long intervalMinutes = 60;
    }
}
