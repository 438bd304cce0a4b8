package com.mlops.retraining.orchestrator;

public final class RetrainingRequest {
    private final String modelId;
    private final TriggerReason reason;
    private final boolean force;
    private final String datasetRef;

    public RetrainingRequest(String modelId, TriggerReason reason, boolean force, String datasetRef) {
        this.modelId = modelId;
        this.reason = reason;
        this.force = force;
        this.datasetRef = datasetRef;
    }

    public static RetrainingRequest scheduled(String modelId) {
        return new RetrainingRequest(modelId, TriggerReason.SCHEDULED, false, null);
    }

    public static RetrainingRequest degraded(String modelId) {
        return new RetrainingRequest(modelId, TriggerReason.PERFORMANCE_DEGRADED, false, null);
    }

    public static RetrainingRequest manual(String modelId, boolean force, String datasetRef) {
        return new RetrainingRequest(modelId, TriggerReason.MANUAL, force, datasetRef);
    }

    public String getModelId() {
        return modelId;
    }

    public TriggerReason getReason() {
        return reason;
    }

    public boolean isForce() {
        return force;
    }

    public String getDatasetRef() {
        return datasetRef;
    }
}
