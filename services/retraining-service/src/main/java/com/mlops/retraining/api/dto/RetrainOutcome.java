package com.mlops.retraining.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a retrain request for one model: {@code started}, {@code skipped} or {@code already_running}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetrainOutcome {
    @JsonProperty("model_id")
    private String modelId;

    private String status;
    private String reason;
    private JobResponse job;
    private MetricsDto metrics;

    public String getModelId() {
        return modelId;
    }

    public void setModelId(String modelId) {
        this.modelId = modelId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public JobResponse getJob() {
        return job;
    }

    public void setJob(JobResponse job) {
        this.job = job;
    }

    public MetricsDto getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsDto metrics) {
        this.metrics = metrics;
    }
}
