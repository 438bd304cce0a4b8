package com.mlops.retraining.orchestrator;

public enum TriggerReason {
    SCHEDULED,
    PERFORMANCE_DEGRADED,
    MANUAL
}
