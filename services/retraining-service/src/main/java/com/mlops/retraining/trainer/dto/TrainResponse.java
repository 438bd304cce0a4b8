package com.mlops.retraining.trainer.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TrainResponse {
    @JsonProperty("artifact_uri")
    private String artifactUri;

    @JsonProperty("model_version")
    private String modelVersion;

    private Metrics metrics;

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

    public Metrics getMetrics() {
        return metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metrics {
        @JsonProperty("sample_count")
        private Long sampleCount;

        @JsonProperty("quality_score")
        private Double qualityScore;

        @JsonProperty("error_score")
        private Double errorScore;

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
