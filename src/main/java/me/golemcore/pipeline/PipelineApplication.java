package me.golemcore.pipeline;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore tool pipeline.
 *
 * <p>
 * The pipeline gives LLM tool calls the guarantees the model itself cannot
 * provide and records everything that happened during a turn.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Timeout Isolation</b> - every tool runs on an isolated worker under a
 * wall-clock deadline</li>
 * <li><b>Idempotency Cache</b> - semantic cache keys and per-tool cache
 * policies allow cross-round reuse of read-only results</li>
 * <li><b>Result Shaping</b> - BRIEF/STANDARD/FULL observations, large payloads
 * offloaded to the artifact store behind opaque ids</li>
 * <li><b>Tracing &amp; Metrics</b> - span trees, token/cost accounting,
 * JSON/JSONL persistence with a SQLite index</li>
 * <li><b>Monitoring API</b> - read-only WebFlux endpoints for dashboards</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → MonitoringController
 * Domain Layer       → ToolInvocationService, IdempotencyCache, ExecutionTracer, ...
 * Infrastructure     → Local storage, artifact store, SQLite index adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code pipeline.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PipelineApplication.class, args);
    }

}
