package com.mlops.retraining.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.mlops.retraining.config.ModelCatalog;
import com.mlops.retraining.config.RetrainingProperties;
import com.mlops.retraining.config.UnknownModelException;
import com.mlops.retraining.metrics.MetricsStore;
import com.mlops.retraining.metrics.MetricsStoreUnavailableException;
import com.mlops.retraining.metrics.ModelMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PerformanceMonitorTest {

    @Mock
    private MetricsStore metricsStore;

    private PerformanceMonitor monitor;

    @BeforeEach
    void setUp() {
        RetrainingProperties properties = new RetrainingProperties();
        RetrainingProperties.ModelSettings iris = new RetrainingProperties.ModelSettings();
        iris.setMinQuality(0.85);
        iris.setMaxError(1.0);
        iris.setMinSamples(50);
        properties.getModels().put("iris", iris);
        monitor = new PerformanceMonitor(new ModelCatalog(properties), metricsStore);
    }

    @Test
    void recommendsRetrainingWhenQualityDropsBelowThreshold() {
        when(metricsStore.getRecentMetrics("iris")).thenReturn(new ModelMetrics(60, 0.70, 0.5));

        PerformanceEvaluation evaluation = monitor.evaluate("iris");

        assertThat(evaluation.isNeedsRetraining()).isTrue();
        assertThat(evaluation.getReason()).isEqualTo("quality_score 0.7000 below 0.8500");
        assertThat(evaluation.getMetrics().getSampleCount()).isEqualTo(60);
    }

    @Test
    void reportsEveryViolatedThreshold() {
        when(metricsStore.getRecentMetrics("iris")).thenReturn(new ModelMetrics(500, 0.5, 2.5));

        PerformanceEvaluation evaluation = monitor.evaluate("iris");

        assertThat(evaluation.isNeedsRetraining()).isTrue();
        assertThat(evaluation.getReason())
            .isEqualTo("quality_score 0.5000 below 0.8500; error_score 2.5000 above 1.0000");
    }

    @Test
    void doesNotRecommendBelowMinimumSamples() {
        when(metricsStore.getRecentMetrics("iris")).thenReturn(new ModelMetrics(10, 0.1, 9.0));

        PerformanceEvaluation evaluation = monitor.evaluate("iris");

        assertThat(evaluation.isNeedsRetraining()).isFalse();
        assertThat(evaluation.getReason()).isEqualTo(PerformanceMonitor.INSUFFICIENT_DATA);
    }

    @Test
    void treatsMissingMetricsAsInsufficientData() {
        when(metricsStore.getRecentMetrics("iris")).thenReturn(null);

        assertThat(monitor.evaluate("iris").getReason()).isEqualTo(PerformanceMonitor.INSUFFICIENT_DATA);
    }

    @Test
    void acceptsHealthyModel() {
        when(metricsStore.getRecentMetrics("iris")).thenReturn(new ModelMetrics(200, 0.91, 0.4));

        PerformanceEvaluation evaluation = monitor.evaluate("iris");

        assertThat(evaluation.isNeedsRetraining()).isFalse();
        assertThat(evaluation.getReason()).isEqualTo(PerformanceMonitor.PERFORMANCE_ACCEPTABLE);
    }

    @Test
    void boundaryValuesAreAcceptable() {
        when(metricsStore.getRecentMetrics("iris")).thenReturn(new ModelMetrics(50, 0.85, 1.0));

        assertThat(monitor.evaluate("iris").isNeedsRetraining()).isFalse();
    }

    @Test
    void unavailableStoreYieldsNoRecommendation() {
        when(metricsStore.getRecentMetrics("iris")).thenThrow(new MetricsStoreUnavailableException("down"));

        PerformanceEvaluation evaluation = monitor.evaluate("iris");

        assertThat(evaluation.isNeedsRetraining()).isFalse();
        assertThat(evaluation.getReason()).isEqualTo(PerformanceMonitor.METRICS_UNAVAILABLE);
        assertThat(evaluation.getMetrics()).isNull();
    }

    @Test
    void unknownModelIsRejected() {
        assertThatThrownBy(() -> monitor.evaluate("churn")).isInstanceOf(UnknownModelException.class);
    }
}
