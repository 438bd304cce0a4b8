package com.mlops.retraining.trainer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class TrainRequest {
    private String version;

    @JsonProperty("model_id")
    private String modelId;

    @JsonProperty("dataset_ref")
    private String datasetRef;

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getModelId() {
        return modelId;
    }

    public void setModelId(String modelId) {
        this.modelId = modelId;
    }

    public String getDatasetRef() {
        return datasetRef;
    }

    public void setDatasetRef(String datasetRef) {
        this.datasetRef = datasetRef;
    }
}
