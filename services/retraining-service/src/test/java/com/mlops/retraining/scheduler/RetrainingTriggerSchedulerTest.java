package com.mlops.retraining.scheduler;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.mlops.retraining.config.ModelCatalog;
import com.mlops.retraining.config.RetrainingProperties;
import com.mlops.retraining.metrics.ModelMetrics;
import com.mlops.retraining.monitor.PerformanceEvaluation;
import com.mlops.retraining.monitor.PerformanceMonitor;
import com.mlops.retraining.orchestrator.RetrainingJob;
import com.mlops.retraining.orchestrator.RetrainingOrchestrator;
import com.mlops.retraining.orchestrator.RetrainingRequest;
import com.mlops.retraining.orchestrator.SubmitResult;
import com.mlops.retraining.orchestrator.TriggerReason;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetrainingTriggerSchedulerTest {

    @Mock
    private PerformanceMonitor monitor;

    @Mock
    private RetrainingOrchestrator orchestrator;

    private RetrainingProperties properties;
    private RetrainingTriggerScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new RetrainingProperties();
        properties.getModels().put("iris", new RetrainingProperties.ModelSettings());
        properties.getModels().put("housing", new RetrainingProperties.ModelSettings());
        scheduler = new RetrainingTriggerScheduler(new ModelCatalog(properties), monitor, orchestrator, properties);
    }

    @Test
    void skipsWhenScheduleDisabled() {
        properties.getSchedule().setEnabled(false);

        scheduler.runDailyRetraining();
        scheduler.runHealthCheck();

        verifyNoInteractions(monitor, orchestrator);
    }

    @Test
    void dailyTickSubmitsEveryModelAsScheduled() {
        when(orchestrator.submit(any())).thenAnswer(invocation -> SubmitResult.accepted(
            "iris",
            RetrainingJob.queued("job_1", "iris", TriggerReason.SCHEDULED, false, null, Instant.now())
        ));

        scheduler.runDailyRetraining();

        verify(orchestrator, times(2)).submit(argThat(request -> request.getReason() == TriggerReason.SCHEDULED));
        verify(orchestrator).submit(argThat(request -> "iris".equals(request.getModelId())));
        verify(orchestrator).submit(argThat(request -> "housing".equals(request.getModelId())));
        verifyNoInteractions(monitor);
    }

    @Test
    void dailyTickContinuesAfterSubmitFailure() {
        when(orchestrator.submit(any())).thenAnswer(invocation -> {
            RetrainingRequest request = invocation.getArgument(0);
            if ("iris".equals(request.getModelId())) {
                throw new IllegalStateException("boom");
            }
            return SubmitResult.rejected(request.getModelId(), null);
        });

        scheduler.runDailyRetraining();

        verify(orchestrator).submit(argThat(request -> "housing".equals(request.getModelId())));
    }

    @Test
    void healthCheckSubmitsOnlyDegradedModels() {
        when(monitor.evaluate("iris")).thenReturn(
            PerformanceEvaluation.degraded("iris", "quality_score 0.7000 below 0.8500", new ModelMetrics(60, 0.7, 0.5))
        );
        when(monitor.evaluate("housing")).thenReturn(
            PerformanceEvaluation.noAction("housing", "insufficient data", new ModelMetrics(3, 0.2, 4.0))
        );
        when(orchestrator.submit(any())).thenReturn(SubmitResult.rejected("iris", null));

        scheduler.runHealthCheck();

        verify(orchestrator).submit(argThat(request ->
            "iris".equals(request.getModelId()) && request.getReason() == TriggerReason.PERFORMANCE_DEGRADED
        ));
        verify(orchestrator, never()).submit(argThat(request -> "housing".equals(request.getModelId())));
    }

    @Test
    void healthCheckContinuesWhenEvaluationFails() {
        when(monitor.evaluate("iris")).thenThrow(new IllegalStateException("store exploded"));
        when(monitor.evaluate("housing")).thenReturn(
            PerformanceEvaluation.degraded("housing", "error_score 2.0000 above 1.0000", new ModelMetrics(500, 0.9, 2.0))
        );
        when(orchestrator.submit(any())).thenReturn(SubmitResult.rejected("housing", null));

        scheduler.runHealthCheck();

        verify(orchestrator).submit(argThat(request -> "housing".equals(request.getModelId())));
    }
}
