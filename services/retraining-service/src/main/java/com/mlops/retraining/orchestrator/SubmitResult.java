package com.mlops.retraining.orchestrator;

import com.mlops.retraining.monitor.PerformanceEvaluation;

public final class SubmitResult {
    private final String modelId;
    private final SubmitOutcome outcome;
    private final RetrainingJob job;
    private final PerformanceEvaluation evaluation;

    private SubmitResult(String modelId, SubmitOutcome outcome, RetrainingJob job, PerformanceEvaluation evaluation) {
        this.modelId = modelId;
        this.outcome = outcome;
        this.job = job;
        this.evaluation = evaluation;
    }

    public static SubmitResult accepted(String modelId, RetrainingJob job) {
        return new SubmitResult(modelId, SubmitOutcome.ACCEPTED, job, null);
    }

    public static SubmitResult rejected(String modelId, RetrainingJob running) {
        return new SubmitResult(modelId, SubmitOutcome.REJECTED_ALREADY_RUNNING, running, null);
    }

    public static SubmitResult skipped(String modelId, PerformanceEvaluation evaluation) {
        return new SubmitResult(modelId, SubmitOutcome.SKIPPED, null, evaluation);
    }

    public String getModelId() {
        return modelId;
    }

    public SubmitOutcome getOutcome() {
        return outcome;
    }

    public RetrainingJob getJob() {
        return job;
    }

    public PerformanceEvaluation getEvaluation() {
        return evaluation;
    }

    public boolean isAccepted() {
        return outcome == SubmitOutcome.ACCEPTED;
    }
}
