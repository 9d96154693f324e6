package me.golemcore.pipeline.infrastructure.config;

import me.golemcore.pipeline.domain.model.ToolCachePolicy;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelinePropertiesTest {

    @Test
    void shouldExpandUserHomeInBasePath() {
        PipelineProperties properties = new PipelineProperties();

        Path resolved = properties.getStorage().resolveBasePath();

        assertEquals(Paths.get(System.getProperty("user.home"), ".golemcore", "pipeline").toAbsolutePath().normalize(),
                resolved);
    }

    @Test
    void shouldNormalizeRelativeBasePath() {
        PipelineProperties properties = new PipelineProperties();
        properties.getStorage().setBasePath("data/../pipeline");

        Path resolved = properties.getStorage().resolveBasePath();

        assertTrue(resolved.isAbsolute());
        assertEquals("pipeline", resolved.getFileName().toString());
    }

    @Test
    void shouldProvideDocumentedDefaults() {
        PipelineProperties properties = new PipelineProperties();

        assertEquals(1000, properties.getCache().getMaxSize());
        assertEquals(30_000L, properties.getTimeout().getDefaultMs());
        assertEquals(1_000_000L, properties.getArtifacts().getThresholdBytes());
        assertEquals(24, properties.getArtifacts().getMaxAgeHours());
        assertEquals(7, properties.getRetention().getTraceDays());
        assertEquals(30, properties.getRetention().getMetricsDays());
        assertEquals(60, properties.getHousekeeping().getIntervalMinutes());
        assertNull(properties.getToolCachePolicies().get("web_search"));
        properties.getToolCachePolicies().put("web_search", ToolCachePolicy.TTL_LONG);
        assertEquals(ToolCachePolicy.TTL_LONG, properties.getToolCachePolicies().get("web_search"));
    }
}
