package me.golemcore.pipeline.domain.model;

/**
 * Result of storing a payload: the opaque id, the observation text to show the
 * LLM and the persisted metadata.
 */
public record StoredArtifact(String artifactId, String observation, ArtifactMetadata metadata) {
}
