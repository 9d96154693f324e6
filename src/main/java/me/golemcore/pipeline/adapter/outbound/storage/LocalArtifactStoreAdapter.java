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

package me.golemcore.pipeline.adapter.outbound.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pipeline.domain.model.ArtifactMetadata;
import me.golemcore.pipeline.domain.model.ArtifactSecurityException;
import me.golemcore.pipeline.domain.model.ArtifactStats;
import me.golemcore.pipeline.domain.model.ContentHashSupport;
import me.golemcore.pipeline.domain.model.StoredArtifact;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.outbound.ArtifactStoragePort;
import me.golemcore.pipeline.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Content-addressed store for tool outputs too large to show to the LLM.
 *
 * <p>
 * Payloads are written as pretty-printed JSON to {@code artifacts/<id>.json};
 * the id is derived from the MD5 of the key-sorted payload, so storing the
 * same data twice yields the same id. Metadata for every artifact is kept in
 * memory and mirrored to {@code metadata.json} next to the artifacts folder
 * with an atomic write.
 *
 * <p>
 * Artifact ids come back from the LLM and are untrusted. Every id is validated
 * before any file is touched and the resolved real path must stay inside the
 * artifacts directory.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalArtifactStoreAdapter implements ArtifactStoragePort {

    static final String ID_PREFIX = "artifact_";
    static final int ID_HASH_LENGTH = 16;
    static final int ID_LENGTH = ID_PREFIX.length() + ID_HASH_LENGTH;
    private static final String PAYLOAD_SUFFIX = ".json";
    private static final String ROOT_DIRECTORY = "";
    private static final long MILLIS_PER_HOUR = 3_600_000L;

    private final StoragePort storagePort;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, ArtifactMetadata> metadata = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    @PostConstruct
    public void init() {
        lock.lock();
        try {
            metadata.clear();
            metadata.putAll(loadMetadata());
            log.info("[Artifacts] Loaded {} artifact(s) from {}", metadata.size(), metadataFile());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public StoredArtifact store(Object data, String toolName, String summary) {
        String hash;
        String prettyJson;
        try {
            hash = ContentHashSupport.md5Hex(ContentHashSupport.canonicalJson(data));
            prettyJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Artifact payload is not JSON-serializable: " + e.getOriginalMessage(),
                    e);
        }
        String artifactId = ID_PREFIX + hash.substring(0, ID_HASH_LENGTH);
        byte[] payload = prettyJson.getBytes(StandardCharsets.UTF_8);

        lock.lock();
        try {
            ArtifactMetadata existing = metadata.get(artifactId);
            if (existing != null && hash.equals(existing.getHash())
                    && Boolean.TRUE.equals(storagePort.exists(artifactsDirectory(), existing.getFilename()).join())) {
                log.debug("[Artifacts] Reusing existing artifact {}", artifactId);
                return new StoredArtifact(artifactId, buildObservation(existing), existing);
            }

            String filename = artifactId + PAYLOAD_SUFFIX;
            storagePort.putText(artifactsDirectory(), filename, prettyJson).join();

            ArtifactMetadata entry = ArtifactMetadata.builder()
                    .artifactId(artifactId)
                    .filename(filename)
                    .createdAt(clock.millis())
                    .sizeBytes(payload.length)
                    .hash(hash)
                    .toolName(toolName)
                    .summary(summary != null ? summary : defaultSummary(data))
                    .build();
            metadata.put(artifactId, entry);
            saveMetadata();

            log.info("[Artifacts] Stored {} ({} bytes) from tool {}", artifactId, payload.length, toolName);
            return new StoredArtifact(artifactId, buildObservation(entry), entry);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Object> retrieve(String artifactId) {
        validateArtifactId(artifactId);

        lock.lock();
        try {
            ArtifactMetadata entry = metadata.get(artifactId);
            if (entry == null) {
                return Optional.empty();
            }
            if (!requireInsideArtifacts(payloadPath(artifactId))) {
                log.warn("[Artifacts] Payload for {} is missing, pruning metadata", artifactId);
                metadata.remove(artifactId);
                saveMetadata();
                return Optional.empty();
            }

            String json = storagePort.getText(artifactsDirectory(), entry.getFilename()).join();
            if (json == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.readValue(json, Object.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted artifact payload: " + artifactId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ArtifactMetadata> getMetadata(String artifactId) {
        validateArtifactId(artifactId);
        lock.lock();
        try {
            return Optional.ofNullable(metadata.get(artifactId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String artifactId) {
        validateArtifactId(artifactId);

        lock.lock();
        try {
            ArtifactMetadata removed = metadata.remove(artifactId);
            if (removed == null) {
                return false;
            }
            storagePort.deleteObject(artifactsDirectory(), removed.getFilename()).join();
            saveMetadata();
            log.debug("[Artifacts] Deleted {}", artifactId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int cleanup(int maxAgeHours) {
        long cutoff = clock.millis() - maxAgeHours * MILLIS_PER_HOUR;

        lock.lock();
        try {
            List<ArtifactMetadata> expired = metadata.values().stream()
                    .filter(entry -> entry.getCreatedAt() < cutoff)
                    .toList();
            for (ArtifactMetadata entry : expired) {
                try {
                    storagePort.deleteObject(artifactsDirectory(), entry.getFilename()).join();
                } catch (RuntimeException e) {
                    log.warn("[Artifacts] Failed to delete payload {}: {}", entry.getFilename(), e.getMessage());
                }
                metadata.remove(entry.getArtifactId());
            }
            if (!expired.isEmpty()) {
                saveMetadata();
                log.info("[Artifacts] Cleaned up {} artifact(s) older than {}h", expired.size(), maxAgeHours);
            }
            return expired.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ArtifactMetadata> list(String toolName, int limit) {
        lock.lock();
        try {
            return metadata.values().stream()
                    .filter(entry -> toolName == null || toolName.equals(entry.getToolName()))
                    .sorted(Comparator.comparingLong(ArtifactMetadata::getCreatedAt).reversed())
                    .limit(Math.max(0, limit))
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ArtifactStats getStats() {
        lock.lock();
        try {
            long totalSize = metadata.values().stream().mapToLong(ArtifactMetadata::getSizeBytes).sum();
            return ArtifactStats.builder()
                    .artifactCount(metadata.size())
                    .totalSizeBytes(totalSize)
                    .maxAgeHours(properties.getArtifacts().getMaxAgeHours())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rejects ids that could address anything other than a payload file.
     */
    static void validateArtifactId(String artifactId) {
        if (artifactId == null || !artifactId.startsWith(ID_PREFIX)) {
            throw new ArtifactSecurityException("Invalid artifact ID format: " + artifactId);
        }
        if (artifactId.contains("/") || artifactId.contains("\\") || artifactId.contains("..")) {
            throw new ArtifactSecurityException("Path traversal attempt detected: " + artifactId);
        }
        if (artifactId.length() != ID_LENGTH) {
            throw new ArtifactSecurityException("Invalid artifact ID length: " + artifactId.length());
        }
        for (int i = ID_PREFIX.length(); i < artifactId.length(); i++) {
            char c = artifactId.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                throw new ArtifactSecurityException("Invalid artifact ID characters: " + artifactId);
            }
        }
    }

    static String buildObservation(ArtifactMetadata entry) {
        String summary = entry.getSummary() != null ? entry.getSummary() : "See artifact metadata";
        return "Data stored as artifact: " + entry.getArtifactId() + "\n"
                + "Large dataset available for subsequent tool access.\n"
                + "To access this data, reference the artifact_id in your next tool call.\n"
                + "The system will securely retrieve the data for you.\n"
                + "Data summary: " + summary + "\n"
                + String.format(Locale.ROOT, "Size: %,d bytes", entry.getSizeBytes());
    }

    static String defaultSummary(Object data) {
        if (data instanceof Map<?, ?> map) {
            return "Dict with " + map.size() + " keys";
        }
        if (data instanceof Collection<?> collection) {
            return "List with " + collection.size() + " items";
        }
        if (data instanceof CharSequence text) {
            return "String (" + text.length() + " chars)";
        }
        return data == null ? "null" : data.getClass().getSimpleName();
    }

    private Map<String, ArtifactMetadata> loadMetadata() {
        try {
            String json = storagePort.getText(ROOT_DIRECTORY, metadataFile()).join();
            if (json == null || json.isBlank()) {
                return Map.of();
            }
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, ArtifactMetadata>>() {
            });
        } catch (IOException | RuntimeException e) {
            log.warn("[Artifacts] Failed to load artifact metadata, starting empty: {}", e.getMessage());
            return Map.of();
        }
    }

    private void saveMetadata() {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(new LinkedHashMap<>(metadata));
            storagePort.putTextAtomic(ROOT_DIRECTORY, metadataFile(), json).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize artifact metadata", e);
        }
    }

    /**
     * Checks that the payload's real path stays under the artifacts directory.
     *
     * @return {@code false} if the payload file does not exist
     */
    private boolean requireInsideArtifacts(Path payloadPath) {
        try {
            Path artifactsRoot = artifactsRoot().toRealPath();
            if (!payloadPath.toRealPath().startsWith(artifactsRoot)) {
                throw new ArtifactSecurityException("Artifact path escapes storage directory: "
                        + payloadPath.getFileName());
            }
            return true;
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to resolve artifact path: " + payloadPath.getFileName(), e);
        }
    }

    private Path payloadPath(String artifactId) {
        return artifactsRoot().resolve(artifactId + PAYLOAD_SUFFIX).normalize();
    }

    private Path artifactsRoot() {
        return properties.getStorage().resolveBasePath().resolve(artifactsDirectory());
    }

    private String artifactsDirectory() {
        return properties.getStorage().getDirectories().getArtifacts();
    }

    private String metadataFile() {
        return properties.getArtifacts().getMetadataFile();
    }
}
