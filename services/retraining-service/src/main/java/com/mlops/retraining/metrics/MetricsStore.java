package com.mlops.retraining.metrics;

import com.mlops.retraining.registry.ActiveArtifact;

public interface MetricsStore {

    /**
     * Recent serving window for the model. A model without recorded predictions has zero samples.
     *
     * @throws MetricsStoreUnavailableException when the store cannot be reached
     */
    ModelMetrics getRecentMetrics(String modelId);

    /**
     * Records the metrics of a freshly activated artifact as the model's new baseline.
     *
     * @throws MetricsStoreUnavailableException when the store cannot be reached
     */
    void recordBaseline(String modelId, ActiveArtifact artifact);
}
