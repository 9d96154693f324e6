package me.golemcore.pipeline.port.outbound;

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

import me.golemcore.pipeline.domain.model.ArtifactMetadata;
import me.golemcore.pipeline.domain.model.ArtifactStats;
import me.golemcore.pipeline.domain.model.StoredArtifact;

import java.util.List;
import java.util.Optional;

/**
 * Content-keyed storage for tool outputs too large to inline. Payloads are
 * addressed by opaque ids of the form {@code artifact_<16 hex>}; real file
 * locations never leave the adapter.
 */
public interface ArtifactStoragePort {

    /**
     * Store a JSON-serializable payload. Storing identical data twice returns
     * the existing metadata without rewriting the payload.
     *
     * @throws IllegalArgumentException
     *             when the payload cannot be serialized
     */
    StoredArtifact store(Object data, String toolName, String summary);

    /**
     * Load a payload.
     *
     * @throws me.golemcore.pipeline.domain.model.ArtifactSecurityException
     *             when the id fails validation; no file is touched in that case
     */
    Optional<Object> retrieve(String artifactId);

    Optional<ArtifactMetadata> getMetadata(String artifactId);

    /**
     * @return true if the artifact existed and was removed
     */
    boolean delete(String artifactId);

    /**
     * Remove artifacts older than {@code maxAgeHours}.
     *
     * @return number of removed artifacts
     */
    int cleanup(int maxAgeHours);

    /**
     * Newest first, optionally filtered by tool name.
     */
    List<ArtifactMetadata> list(String toolName, int limit);

    ArtifactStats getStats();
}
