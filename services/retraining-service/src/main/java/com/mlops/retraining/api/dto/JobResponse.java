package com.mlops.retraining.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mlops.retraining.orchestrator.RetrainingJob;
import java.time.Instant;

public class JobResponse {
    @JsonProperty("job_id")
    private String jobId;

    @JsonProperty("model_id")
    private String modelId;

    private String reason;
    private boolean force;

    @JsonProperty("dataset_ref")
    private String datasetRef;

    private String status;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("started_at")
    private String startedAt;

    @JsonProperty("ended_at")
    private String endedAt;

    private MetricsDto metrics;

    @JsonProperty("artifact_version")
    private String artifactVersion;

    @JsonProperty("failure_kind")
    private String failureKind;

    @JsonProperty("failure_reason")
    private String failureReason;

    public static JobResponse from(RetrainingJob job) {
        if (job == null) {
            return null;
        }
        JobResponse response = new JobResponse();
        response.setJobId(job.getId());
        response.setModelId(job.getModelId());
        response.setReason(job.getReason() == null ? null : job.getReason().name());
        response.setForce(job.isForce());
        response.setDatasetRef(job.getDatasetRef());
        response.setStatus(job.getStatus().name());
        response.setCreatedAt(format(job.getCreatedAt()));
        response.setStartedAt(format(job.getStartedAt()));
        response.setEndedAt(format(job.getEndedAt()));
        response.setMetrics(MetricsDto.from(job.getMetrics()));
        response.setArtifactVersion(job.getArtifactVersion());
        response.setFailureKind(job.getFailureKind() == null ? null : job.getFailureKind().name());
        response.setFailureReason(job.getFailureReason());
        return response;
    }

    private static String format(Instant value) {
        return value == null ? null : value.toString();
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public String getModelId() {
        return modelId;
    }

    public void setModelId(String modelId) {
        this.modelId = modelId;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public boolean isForce() {
        return force;
    }

    public void setForce(boolean force) {
        this.force = force;
    }

    public String getDatasetRef() {
        return datasetRef;
    }

    public void setDatasetRef(String datasetRef) {
        this.datasetRef = datasetRef;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    public String getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(String startedAt) {
        this.startedAt = startedAt;
    }

    public String getEndedAt() {
        return endedAt;
    }

    public void setEndedAt(String endedAt) {
        this.endedAt = endedAt;
    }

    public MetricsDto getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsDto metrics) {
        this.metrics = metrics;
    }

    public String getArtifactVersion() {
        return artifactVersion;
    }

    public void setArtifactVersion(String artifactVersion) {
        this.artifactVersion = artifactVersion;
    }

    public String getFailureKind() {
        return failureKind;
    }

    public void setFailureKind(String failureKind) {
        this.failureKind = failureKind;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }
}
