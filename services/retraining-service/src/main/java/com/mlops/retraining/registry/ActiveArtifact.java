package com.mlops.retraining.registry;

import com.mlops.retraining.metrics.ModelMetrics;
import java.time.Instant;
import java.util.Objects;

/**
 * The artifact currently serving a model. Instances are never modified; a swap publishes a new one.
 */
public final class ActiveArtifact {
    private final String modelId;
    private final String artifactUri;
    private final String version;
    private final Instant trainedAt;
    private final ModelMetrics metrics;

    public ActiveArtifact(String modelId, String artifactUri, String version, Instant trainedAt, ModelMetrics metrics) {
        this.modelId = modelId;
        this.artifactUri = artifactUri;
        this.version = version;
        this.trainedAt = trainedAt;
        this.metrics = metrics;
    }

    public String getModelId() {
        return modelId;
    }

    public String getArtifactUri() {
        return artifactUri;
    }

    public String getVersion() {
        return version;
    }

    public Instant getTrainedAt() {
        return trainedAt;
    }

    /**
     * Metrics reported when the artifact was trained; {@code null} for bootstrap artifacts.
     */
    public ModelMetrics getMetrics() {
        return metrics;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ActiveArtifact)) {
            return false;
        }
        ActiveArtifact that = (ActiveArtifact) other;
        return Objects.equals(modelId, that.modelId)
            && Objects.equals(artifactUri, that.artifactUri)
            && Objects.equals(version, that.version)
            && Objects.equals(trainedAt, that.trainedAt)
            && Objects.equals(metrics, that.metrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modelId, artifactUri, version, trainedAt, metrics);
    }

    @Override
    public String toString() {
        return "ActiveArtifact{modelId=" + modelId
            + ", artifactUri=" + artifactUri
            + ", version=" + version
            + ", trainedAt=" + trainedAt
            + ", metrics=" + metrics + "}";
    }
}
