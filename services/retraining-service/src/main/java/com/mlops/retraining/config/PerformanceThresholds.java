package com.mlops.retraining.config;

public final class PerformanceThresholds {
    private final double minQuality;
    private final double maxError;
    private final int minSamples;

    public PerformanceThresholds(double minQuality, double maxError, int minSamples) {
        this.minQuality = minQuality;
        this.maxError = maxError;
        this.minSamples = Math.max(0, minSamples);
    }

    public double getMinQuality() {
        return minQuality;
    }

    public double getMaxError() {
        return maxError;
    }

    public int getMinSamples() {
        return minSamples;
    }

    @Override
    public String toString() {
        return "PerformanceThresholds{minQuality=" + minQuality
            + ", maxError=" + maxError
            + ", minSamples=" + minSamples + "}";
    }
}
