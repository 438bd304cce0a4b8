package com.mlops.retraining.config;

public class UnknownModelException extends RuntimeException {
    private final String modelId;

    public UnknownModelException(String modelId) {
        super("unknown model_id: " + modelId);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
