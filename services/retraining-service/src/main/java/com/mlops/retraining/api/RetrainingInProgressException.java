package com.mlops.retraining.api;

public class RetrainingInProgressException extends RuntimeException {
    private final String modelId;
    private final String jobId;

    public RetrainingInProgressException(String modelId, String jobId) {
        super("retraining already in progress for model " + modelId);
        this.modelId = modelId;
        this.jobId = jobId;
    }

    public String getModelId() {
        return modelId;
    }

    public String getJobId() {
        return jobId;
    }
}
