package com.mlops.retraining.orchestrator;

public enum SubmitOutcome {
    ACCEPTED,
    REJECTED_ALREADY_RUNNING,
    SKIPPED
}
