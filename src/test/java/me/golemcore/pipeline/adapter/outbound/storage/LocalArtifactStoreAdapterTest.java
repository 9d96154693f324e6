package me.golemcore.pipeline.adapter.outbound.storage;

import me.golemcore.pipeline.domain.model.ArtifactMetadata;
import me.golemcore.pipeline.domain.model.ArtifactSecurityException;
import me.golemcore.pipeline.domain.model.StoredArtifact;
import me.golemcore.pipeline.infrastructure.config.AutoConfiguration;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.testsupport.MutableClock;
import me.golemcore.pipeline.testsupport.PipelineFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class LocalArtifactStoreAdapterTest {

    private static final String TOOL_NAME = "query_database";

    @TempDir
    Path tempDir;

    private PipelineProperties properties;
    private LocalStorageAdapter storage;
    private MutableClock clock;
    private LocalArtifactStoreAdapter artifactStore;

    @BeforeEach
    void setUp() {
        properties = PipelineFixtures.properties(tempDir);
        storage = PipelineFixtures.storage(properties);
        clock = new MutableClock(Instant.parse("2026-01-01T12:00:00Z"));
        artifactStore = newStore();
    }

    private LocalArtifactStoreAdapter newStore() {
        LocalArtifactStoreAdapter store = new LocalArtifactStoreAdapter(storage, properties,
                AutoConfiguration.objectMapper(), clock);
        store.init();
        return store;
    }

    private static Map<String, Object> rows(int count) {
        return Map.of("rows", IntStream.range(0, count).boxed().toList());
    }

    @Test
    void shouldStoreAndRetrievePayload() {
        StoredArtifact stored = artifactStore.store(rows(3), TOOL_NAME, null);

        assertTrue(stored.artifactId().startsWith("artifact_"));
        assertEquals(LocalArtifactStoreAdapter.ID_LENGTH, stored.artifactId().length());
        assertTrue(Files.exists(tempDir.resolve("artifacts").resolve(stored.artifactId() + ".json")));
        assertEquals(Map.of("rows", List.of(0, 1, 2)), artifactStore.retrieve(stored.artifactId()).orElseThrow());

        ArtifactMetadata metadata = artifactStore.getMetadata(stored.artifactId()).orElseThrow();
        assertEquals(TOOL_NAME, metadata.getToolName());
        assertEquals("Dict with 1 keys", metadata.getSummary());
        assertEquals(clock.millis(), metadata.getCreatedAt());
    }

    @Test
    void shouldReuseArtifactForIdenticalContent() {
        StoredArtifact first = artifactStore.store(rows(3), TOOL_NAME, null);
        clock.advanceMillis(1_000);
        StoredArtifact second = artifactStore.store(rows(3), TOOL_NAME, "again");

        assertEquals(first.artifactId(), second.artifactId());
        assertEquals(first.metadata().getCreatedAt(), second.metadata().getCreatedAt());
        assertEquals(1, artifactStore.list(null, 10).size());
    }

    @Test
    void shouldNotRewriteSameContentStoredWithDifferentKeyOrder() throws Exception {
        Map<String, Object> ordered = new LinkedHashMap<>();
        ordered.put("alpha", 1);
        ordered.put("beta", 2);
        Map<String, Object> reversed = new LinkedHashMap<>();
        reversed.put("beta", 2);
        reversed.put("alpha", 1);

        StoredArtifact first = artifactStore.store(ordered, TOOL_NAME, null);
        clock.advanceMillis(1_000);
        StoredArtifact second = artifactStore.store(reversed, TOOL_NAME, null);

        assertEquals(first.artifactId(), second.artifactId());
        assertEquals(first.metadata().getCreatedAt(), second.metadata().getCreatedAt());
        String payload = Files.readString(tempDir.resolve("artifacts").resolve(first.artifactId() + ".json"));
        assertTrue(payload.indexOf("alpha") < payload.indexOf("beta"));
    }

    @Test
    void shouldBuildObservationWithSummaryAndSize() {
        StoredArtifact stored = artifactStore.store(rows(500), TOOL_NAME, "500 rows");

        String observation = stored.observation();

        assertTrue(observation.startsWith("Data stored as artifact: " + stored.artifactId() + "\n"));
        assertTrue(observation.contains("reference the artifact_id in your next tool call"));
        assertTrue(observation.contains("Data summary: 500 rows\n"));
        assertTrue(observation.matches("(?s).*Size: \\d{1,3}(,\\d{3})* bytes$"));
    }

    @Test
    void shouldSurviveRestart() {
        StoredArtifact stored = artifactStore.store(List.of("a", "b"), TOOL_NAME, null);

        LocalArtifactStoreAdapter reopened = newStore();

        assertEquals("List with 2 items", reopened.getMetadata(stored.artifactId()).orElseThrow().getSummary());
        assertEquals(List.of("a", "b"), reopened.retrieve(stored.artifactId()).orElseThrow());
        assertTrue(Files.exists(tempDir.resolve("metadata.json")));
    }

    @ParameterizedTest
    @ValueSource(strings = { "../etc/passwd", "artifact_../../../x", "artifact_0123", "artifact_0123456789ABCDEF",
            "file_0123456789abcdef" })
    void shouldRejectInvalidIds(String artifactId) {
        assertThrows(ArtifactSecurityException.class, () -> artifactStore.retrieve(artifactId));
        assertThrows(ArtifactSecurityException.class, () -> artifactStore.delete(artifactId));
    }

    @Test
    void shouldReturnEmptyForUnknownId() {
        assertTrue(artifactStore.retrieve("artifact_0123456789abcdef").isEmpty());
        assertFalse(artifactStore.delete("artifact_0123456789abcdef"));
    }

    @Test
    void shouldPruneMetadataWhenPayloadIsMissing() throws Exception {
        StoredArtifact stored = artifactStore.store(rows(2), TOOL_NAME, null);
        Files.delete(tempDir.resolve("artifacts").resolve(stored.artifactId() + ".json"));

        assertTrue(artifactStore.retrieve(stored.artifactId()).isEmpty());
        assertTrue(artifactStore.getMetadata(stored.artifactId()).isEmpty());
    }

    @Test
    void shouldRejectPayloadLinkedOutsideArtifacts() throws Exception {
        StoredArtifact stored = artifactStore.store(rows(2), TOOL_NAME, null);
        Path payload = tempDir.resolve("artifacts").resolve(stored.artifactId() + ".json");
        Path outside = Files.createTempDirectory("outside").resolve("secret.json");
        Files.writeString(outside, "{\"secret\":true}");
        Files.delete(payload);
        Files.createSymbolicLink(payload, outside);

        assertThrows(ArtifactSecurityException.class, () -> artifactStore.retrieve(stored.artifactId()));
        assertTrue(artifactStore.getMetadata(stored.artifactId()).isPresent());
    }

    @Test
    void shouldDeleteArtifact() {
        StoredArtifact stored = artifactStore.store(rows(2), TOOL_NAME, null);

        assertTrue(artifactStore.delete(stored.artifactId()));
        assertFalse(Files.exists(tempDir.resolve("artifacts").resolve(stored.artifactId() + ".json")));
        assertEquals(0, artifactStore.getStats().getArtifactCount());
    }

    @Test
    void shouldCleanupExpiredArtifacts() {
        StoredArtifact old = artifactStore.store(rows(1), TOOL_NAME, null);
        clock.advance(Duration.ofHours(25));
        StoredArtifact fresh = artifactStore.store(rows(2), TOOL_NAME, null);

        assertEquals(1, artifactStore.cleanup(24));

        assertTrue(artifactStore.getMetadata(old.artifactId()).isEmpty());
        assertTrue(artifactStore.getMetadata(fresh.artifactId()).isPresent());
        assertEquals(1, newStore().list(null, 10).size());
    }

    @Test
    void shouldListNewestFirstFilteredByTool() {
        StoredArtifact first = artifactStore.store(rows(1), TOOL_NAME, null);
        clock.advanceMillis(10);
        StoredArtifact second = artifactStore.store(rows(2), TOOL_NAME, null);
        clock.advanceMillis(10);
        artifactStore.store(rows(3), "web_search", null);

        List<ArtifactMetadata> listed = artifactStore.list(TOOL_NAME, 10);

        assertEquals(List.of(second.artifactId(), first.artifactId()),
                listed.stream().map(ArtifactMetadata::getArtifactId).toList());
        assertEquals(1, artifactStore.list(null, 1).size());
    }

    @Test
    void shouldReportStats() {
        StoredArtifact a = artifactStore.store(rows(1), TOOL_NAME, null);
        StoredArtifact b = artifactStore.store(rows(2), TOOL_NAME, null);

        assertEquals(2, artifactStore.getStats().getArtifactCount());
        assertEquals(a.metadata().getSizeBytes() + b.metadata().getSizeBytes(),
                artifactStore.getStats().getTotalSizeBytes());
        assertEquals(24, artifactStore.getStats().getMaxAgeHours());
    }

    @Test
    void shouldRejectNonSerializablePayload() {
        assertThrows(IllegalArgumentException.class, () -> artifactStore.store(new ExplodingBean(), TOOL_NAME, null));
    }

    static class ExplodingBean {
        public String getValue() {
            throw new IllegalStateException("not serializable");
        }
    }
}
