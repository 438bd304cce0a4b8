package com.mlops.retraining.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class RegistrySnapshot {
    private String version = "v1";

    @JsonProperty("updated_at")
    private String updatedAt;

    private List<Entry> models = new ArrayList<>();

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(String updatedAt) {
        this.updatedAt = updatedAt;
    }

    public List<Entry> getModels() {
        return models;
    }

    public void setModels(List<Entry> models) {
        this.models = models;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {
        @JsonProperty("model_id")
        private String modelId;

        @JsonProperty("artifact_uri")
        private String artifactUri;

        @JsonProperty("model_version")
        private String modelVersion;

        @JsonProperty("trained_at")
        private String trainedAt;

        @JsonProperty("sample_count")
        private Long sampleCount;

        @JsonProperty("quality_score")
        private Double qualityScore;

        @JsonProperty("error_score")
        private Double errorScore;

        public String getModelId() {
            return modelId;
        }

        public void setModelId(String modelId) {
            this.modelId = modelId;
        }

        public String getArtifactUri() {
            return artifactUri;
        }

        public void setArtifactUri(String artifactUri) {
            this.artifactUri = artifactUri;
        }

        public String getModelVersion() {
            return modelVersion;
        }

        public void setModelVersion(String modelVersion) {
            this.modelVersion = modelVersion;
        }

        public String getTrainedAt() {
            return trainedAt;
        }

        public void setTrainedAt(String trainedAt) {
            this.trainedAt = trainedAt;
        }

        public Long getSampleCount() {
            return sampleCount;
        }

        public void setSampleCount(Long sampleCount) {
            this.sampleCount = sampleCount;
        }

        public Double getQualityScore() {
            return qualityScore;
        }

        public void setQualityScore(Double qualityScore) {
            this.qualityScore = qualityScore;
        }

        public Double getErrorScore() {
            return errorScore;
        }

        public void setErrorScore(Double errorScore) {
            this.errorScore = errorScore;
        }
    }
}
