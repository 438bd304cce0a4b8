package com.mlops.retraining.orchestrator;

import java.util.List;

public final class ModelJobStatus {
    private final String modelId;
    private final String inFlightJobId;
    private final RetrainingJob latestJob;
    private final List<RetrainingJob> history;

    public ModelJobStatus(String modelId, String inFlightJobId, RetrainingJob latestJob, List<RetrainingJob> history) {
        this.modelId = modelId;
        this.inFlightJobId = inFlightJobId;
        this.latestJob = latestJob;
        this.history = history == null ? List.of() : List.copyOf(history);
    }

    public String getModelId() {
        return modelId;
    }

    public boolean isInFlight() {
        return inFlightJobId != null;
    }

    public String getInFlightJobId() {
        return inFlightJobId;
    }

    public RetrainingJob getLatestJob() {
        return latestJob;
    }

    public List<RetrainingJob> getHistory() {
        return history;
    }
}
