package com.mlops.retraining.metrics;

public class MetricsStoreUnavailableException extends RuntimeException {
    public MetricsStoreUnavailableException(String message) {
        super(message);
    }

    public MetricsStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
