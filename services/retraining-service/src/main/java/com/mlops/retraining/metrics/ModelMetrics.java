package com.mlops.retraining.metrics;

import java.util.Objects;

/**
 * Quality summary of a model: either the recent serving window from the metrics store
 * or the evaluation a training run reports for its artifact.
 */
public final class ModelMetrics {
    private static final ModelMetrics EMPTY = new ModelMetrics(0L, 0.0, 0.0);

    private final long sampleCount;
    private final double qualityScore;
    private final double errorScore;

    public ModelMetrics(long sampleCount, double qualityScore, double errorScore) {
        this.sampleCount = sampleCount;
        this.qualityScore = qualityScore;
        this.errorScore = errorScore;
    }

    public static ModelMetrics empty() {
        return EMPTY;
    }

    public long getSampleCount() {
        return sampleCount;
    }

    public double getQualityScore() {
        return qualityScore;
    }

    public double getErrorScore() {
        return errorScore;
    }

    /**
     * Quality must be a finite score in [0, 1], error a finite non-negative value.
     */
    public boolean isWellFormed() {
        return sampleCount >= 0
            && Double.isFinite(qualityScore)
            && Double.isFinite(errorScore)
            && qualityScore >= 0.0
            && qualityScore <= 1.0
            && errorScore >= 0.0;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ModelMetrics)) {
            return false;
        }
        ModelMetrics that = (ModelMetrics) other;
        return sampleCount == that.sampleCount
            && Double.compare(qualityScore, that.qualityScore) == 0
            && Double.compare(errorScore, that.errorScore) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sampleCount, qualityScore, errorScore);
    }

    @Override
    public String toString() {
        return "ModelMetrics{sampleCount=" + sampleCount
            + ", qualityScore=" + qualityScore
            + ", errorScore=" + errorScore + "}";
    }
}
