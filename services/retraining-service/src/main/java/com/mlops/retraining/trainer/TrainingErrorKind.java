package com.mlops.retraining.trainer;

public enum TrainingErrorKind {
    DATA_INVALID,
    TRAINING_FAILED,
    TIMEOUT
}
