package com.mlops.retraining.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mlops.retraining.metrics.ModelMetrics;

public class MetricsDto {
    @JsonProperty("sample_count")
    private long sampleCount;

    @JsonProperty("quality_score")
    private double qualityScore;

    @JsonProperty("error_score")
    private double errorScore;

    public static MetricsDto from(ModelMetrics metrics) {
        if (metrics == null) {
            return null;
        }
        MetricsDto dto = new MetricsDto();
        dto.setSampleCount(metrics.getSampleCount());
        dto.setQualityScore(metrics.getQualityScore());
        dto.setErrorScore(metrics.getErrorScore());
        return dto;
    }

    public long getSampleCount() {
        return sampleCount;
    }

    public void setSampleCount(long sampleCount) {
        this.sampleCount = sampleCount;
    }

    public double getQualityScore() {
        return qualityScore;
    }

    public void setQualityScore(double qualityScore) {
        this.qualityScore = qualityScore;
    }

    public double getErrorScore() {
        return errorScore;
    }

    public void setErrorScore(double errorScore) {
        this.errorScore = errorScore;
    }
}
