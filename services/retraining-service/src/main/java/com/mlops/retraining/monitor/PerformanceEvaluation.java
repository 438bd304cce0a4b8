package com.mlops.retraining.monitor;

import com.mlops.retraining.metrics.ModelMetrics;

public final class PerformanceEvaluation {
    private final String modelId;
    private final boolean needsRetraining;
    private final String reason;
    private final ModelMetrics metrics;

    private PerformanceEvaluation(String modelId, boolean needsRetraining, String reason, ModelMetrics metrics) {
        this.modelId = modelId;
        this.needsRetraining = needsRetraining;
        this.reason = reason;
        this.metrics = metrics;
    }

    public static PerformanceEvaluation degraded(String modelId, String reason, ModelMetrics metrics) {
        return new PerformanceEvaluation(modelId, true, reason, metrics);
    }

    public static PerformanceEvaluation noAction(String modelId, String reason, ModelMetrics metrics) {
        return new PerformanceEvaluation(modelId, false, reason, metrics);
    }

    public String getModelId() {
        return modelId;
    }

    public boolean isNeedsRetraining() {
        return needsRetraining;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Metrics the decision was based on; {@code null} when the store was unavailable.
     */
    public ModelMetrics getMetrics() {
        return metrics;
    }

    @Override
    public String toString() {
        return "PerformanceEvaluation{modelId=" + modelId
            + ", needsRetraining=" + needsRetraining
            + ", reason=" + reason
            + ", metrics=" + metrics + "}";
    }
}
