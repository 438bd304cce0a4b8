package com.mlops.retraining.orchestrator;

import com.mlops.retraining.trainer.TrainingErrorKind;

public enum FailureKind {
    DATA_INVALID,
    TRAINING_FAILED,
    TIMEOUT,
    INVALID_METRICS,
    REGISTRY_UNAVAILABLE,
    INTERNAL_ERROR;

    public static FailureKind from(TrainingErrorKind kind) {
        if (kind == null) {
            return TRAINING_FAILED;
        }
        switch (kind) {
            case DATA_INVALID:
                return DATA_INVALID;
            case TIMEOUT:
                return TIMEOUT;
            default:
                return TRAINING_FAILED;
        }
    }
}
