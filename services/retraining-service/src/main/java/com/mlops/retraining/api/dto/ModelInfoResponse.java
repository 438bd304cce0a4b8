package com.mlops.retraining.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

public class ModelInfoResponse {
    private List<ModelInfo> models = new ArrayList<>();

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    public List<ModelInfo> getModels() {
        return models;
    }

    public void setModels(List<ModelInfo> models) {
        this.models = models;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public static class ModelInfo {
        @JsonProperty("model_id")
        private String modelId;

        @JsonProperty("model_name")
        private String modelName;

        private boolean loaded;

        @JsonProperty("model_version")
        private String modelVersion;

        @JsonProperty("artifact_uri")
        private String artifactUri;

        @JsonProperty("last_trained")
        private String lastTrained;

        @JsonProperty("performance_metrics")
        private MetricsDto performanceMetrics;

        public String getModelId() {
            return modelId;
        }

        public void setModelId(String modelId) {
            this.modelId = modelId;
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public boolean isLoaded() {
            return loaded;
        }

        public void setLoaded(boolean loaded) {
            this.loaded = loaded;
        }

        public String getModelVersion() {
            return modelVersion;
        }

        public void setModelVersion(String modelVersion) {
            this.modelVersion = modelVersion;
        }

        public String getArtifactUri() {
            return artifactUri;
        }

        public void setArtifactUri(String artifactUri) {
            this.artifactUri = artifactUri;
        }

        public String getLastTrained() {
            return lastTrained;
        }

        public void setLastTrained(String lastTrained) {
            this.lastTrained = lastTrained;
        }

        public MetricsDto getPerformanceMetrics() {
            return performanceMetrics;
        }

        public void setPerformanceMetrics(MetricsDto performanceMetrics) {
            this.performanceMetrics = performanceMetrics;
        }
    }
}
