package com.mlops.retraining.trainer;

import com.mlops.retraining.metrics.ModelMetrics;

/**
 * Output of one training run. Metrics may be missing or malformed; callers validate before use.
 */
public final class TrainedModel {
    private final String artifactUri;
    private final String version;
    private final ModelMetrics metrics;

    public TrainedModel(String artifactUri, String version, ModelMetrics metrics) {
        this.artifactUri = artifactUri;
        this.version = version;
        this.metrics = metrics;
    }

    public String getArtifactUri() {
        return artifactUri;
    }

    public String getVersion() {
        return version;
    }

    public ModelMetrics getMetrics() {
        return metrics;
    }
}
