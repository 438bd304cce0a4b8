package com.mlops.retraining.monitor;

import com.mlops.retraining.config.ModelCatalog;
import com.mlops.retraining.config.PerformanceThresholds;
import com.mlops.retraining.metrics.MetricsStore;
import com.mlops.retraining.metrics.MetricsStoreUnavailableException;
import com.mlops.retraining.metrics.ModelMetrics;
import io.micrometer.core.instrument.Metrics;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class PerformanceMonitor {
    private static final Logger logger = LoggerFactory.getLogger(PerformanceMonitor.class);

    public static final String INSUFFICIENT_DATA = "insufficient data";
    public static final String METRICS_UNAVAILABLE = "metrics unavailable";
    public static final String PERFORMANCE_ACCEPTABLE = "performance acceptable";

    private final ModelCatalog catalog;
    private final MetricsStore metricsStore;

    public PerformanceMonitor(ModelCatalog catalog, MetricsStore metricsStore) {
        this.catalog = catalog;
        this.metricsStore = metricsStore;
    }

    public PerformanceEvaluation evaluate(String modelId) {
        PerformanceThresholds thresholds = catalog.require(modelId).getThresholds();

        ModelMetrics metrics;
        try {
            metrics = metricsStore.getRecentMetrics(modelId);
        } catch (MetricsStoreUnavailableException ex) {
            logger.warn("performance_evaluation_unavailable model_id={} error={}", modelId, ex.getMessage());
            return record(PerformanceEvaluation.noAction(modelId, METRICS_UNAVAILABLE, null), "unavailable");
        }
        if (metrics == null) {
            metrics = ModelMetrics.empty();
        }

        if (metrics.getSampleCount() < thresholds.getMinSamples()) {
            return record(PerformanceEvaluation.noAction(modelId, INSUFFICIENT_DATA, metrics), "insufficient_data");
        }

        List<String> violations = new ArrayList<>();
        if (metrics.getQualityScore() < thresholds.getMinQuality()) {
            violations.add(String.format(
                Locale.ROOT,
                "quality_score %.4f below %.4f",
                metrics.getQualityScore(),
                thresholds.getMinQuality()
            ));
        }
        if (metrics.getErrorScore() > thresholds.getMaxError()) {
            violations.add(String.format(
                Locale.ROOT,
                "error_score %.4f above %.4f",
                metrics.getErrorScore(),
                thresholds.getMaxError()
            ));
        }

        if (violations.isEmpty()) {
            return record(PerformanceEvaluation.noAction(modelId, PERFORMANCE_ACCEPTABLE, metrics), "acceptable");
        }
        String reason = String.join("; ", violations);
        logger.info(
            "performance_degraded model_id={} samples={} reason={}",
            modelId,
            metrics.getSampleCount(),
            reason
        );
        return record(PerformanceEvaluation.degraded(modelId, reason, metrics), "degraded");
    }

    private PerformanceEvaluation record(PerformanceEvaluation evaluation, String outcome) {
        Metrics.counter("retraining.monitor.evaluations.total", "outcome", outcome).increment();
        return evaluation;
    }
}
