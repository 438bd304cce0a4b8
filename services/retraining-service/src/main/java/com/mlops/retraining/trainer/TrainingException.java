package com.mlops.retraining.trainer;

public class TrainingException extends RuntimeException {
    private final TrainingErrorKind kind;

    public TrainingException(TrainingErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TrainingException(TrainingErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public TrainingErrorKind getKind() {
        return kind;
    }
}
