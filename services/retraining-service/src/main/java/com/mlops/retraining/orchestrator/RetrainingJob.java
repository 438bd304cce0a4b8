package com.mlops.retraining.orchestrator;

import com.mlops.retraining.metrics.ModelMetrics;
import java.time.Instant;
import java.util.UUID;

/**
 * One retraining attempt. Every transition returns a new instance; terminal jobs return themselves.
 */
public final class RetrainingJob {
    private final String id;
    private final String modelId;
    private final TriggerReason reason;
    private final boolean force;
    private final String datasetRef;
    private final JobStatus status;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant endedAt;
    private final ModelMetrics metrics;
    private final String artifactVersion;
    private final FailureKind failureKind;
    private final String failureReason;

    private RetrainingJob(
        String id,
        String modelId,
        TriggerReason reason,
        boolean force,
        String datasetRef,
        JobStatus status,
        Instant createdAt,
        Instant startedAt,
        Instant endedAt,
        ModelMetrics metrics,
        String artifactVersion,
        FailureKind failureKind,
        String failureReason
    ) {
        this.id = id;
        this.modelId = modelId;
        this.reason = reason;
        this.force = force;
        this.datasetRef = datasetRef;
        this.status = status;
        this.createdAt = createdAt;
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.metrics = metrics;
        this.artifactVersion = artifactVersion;
        this.failureKind = failureKind;
        this.failureReason = failureReason;
    }

    public static String newJobId() {
        return "job_" + UUID.randomUUID().toString().replace("-", "");
    }

    public static RetrainingJob queued(
        String id,
        String modelId,
        TriggerReason reason,
        boolean force,
        String datasetRef,
        Instant createdAt
    ) {
        return new RetrainingJob(
            id, modelId, reason, force, datasetRef, JobStatus.QUEUED, createdAt,
            null, null, null, null, null, null
        );
    }

    public RetrainingJob markRunning(Instant now) {
        if (status != JobStatus.QUEUED) {
            return this;
        }
        return new RetrainingJob(
            id, modelId, reason, force, datasetRef, JobStatus.RUNNING, createdAt,
            now, null, null, null, null, null
        );
    }

    public RetrainingJob markSucceeded(Instant now, ModelMetrics trainedMetrics, String version) {
        if (isTerminal()) {
            return this;
        }
        return new RetrainingJob(
            id, modelId, reason, force, datasetRef, JobStatus.SUCCEEDED, createdAt,
            startedAt, now, trainedMetrics, version, null, null
        );
    }

    public RetrainingJob markFailed(Instant now, FailureKind kind, String message) {
        if (isTerminal()) {
            return this;
        }
        return new RetrainingJob(
            id, modelId, reason, force, datasetRef, JobStatus.FAILED, createdAt,
            startedAt, now, null, null, kind, message
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public String getId() {
        return id;
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

    public JobStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public ModelMetrics getMetrics() {
        return metrics;
    }

    public String getArtifactVersion() {
        return artifactVersion;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getFailureReason() {
        return failureReason;
    }

    @Override
    public String toString() {
        return "RetrainingJob{id=" + id
            + ", modelId=" + modelId
            + ", reason=" + reason
            + ", status=" + status
            + ", failureKind=" + failureKind + "}";
    }
}
