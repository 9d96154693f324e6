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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.outbound.ArtifactStoragePort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

/**
 * Periodically purges expired cache entries, stale artifacts and traces and
 * metrics past their retention. Each step runs independently; a failing step
 * is logged and does not stop the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HousekeepingService {

    private static final String LOG_PREFIX = "[Housekeeping]";
    private static final long EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 5;

    private final IdempotencyCache idempotencyCache;
    private final ArtifactStoragePort artifactStore;
    private final TraceStore traceStore;
    private final MetricsStore metricsStore;
    private final PipelineProperties properties;

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "pipeline-housekeeping");
        t.setDaemon(true);
        return t;
    });

    @PostConstruct
    void init() {
        PipelineProperties.HousekeepingProperties housekeeping = properties.getHousekeeping();
        if (!housekeeping.isEnabled() || housekeeping.getIntervalMinutes() <= 0) {
            log.info("{} Disabled", LOG_PREFIX);
            return;
        }
        executor.scheduleAtFixedRate(this::runSafely, housekeeping.getIntervalMinutes(),
                housekeeping.getIntervalMinutes(), TimeUnit.MINUTES);
        log.info("{} Scheduled every {} min", LOG_PREFIX, housekeeping.getIntervalMinutes());
    }

    @PreDestroy
    void destroy() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs every cleanup step once.
     *
     * @return removed item count per step; {@code -1} for a step that failed
     */
    public Map<String, Integer> runOnce() {
        Map<String, Integer> removed = new LinkedHashMap<>();
        removed.put("cache", step("cache", idempotencyCache::cleanupExpired));
        if (properties.getArtifacts().isEnabled()) {
            removed.put("artifacts",
                    step("artifacts", () -> artifactStore.cleanup(properties.getArtifacts().getMaxAgeHours())));
        }
        removed.put("traces",
                step("traces", () -> traceStore.cleanupOldTraces(properties.getRetention().getTraceDays())));
        removed.put("metrics",
                step("metrics", () -> metricsStore.cleanupOldMetrics(properties.getRetention().getMetricsDays())));
        log.debug("{} Pass finished: {}", LOG_PREFIX, removed);
        return removed;
    }

    private void runSafely() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the schedule
            log.error("{} Pass failed", LOG_PREFIX, e);
        }
    }

    private int step(String name, IntSupplier action) {
        try {
            return action.getAsInt();
        } catch (RuntimeException e) {
            log.warn("{} {} cleanup failed: {}", LOG_PREFIX, name, e.getMessage());
            return -1;
        }
    }
}
