package com.mlops.retraining.scheduler;

import com.mlops.retraining.config.ModelCatalog;
import com.mlops.retraining.config.RetrainingProperties;
import com.mlops.retraining.monitor.PerformanceEvaluation;
import com.mlops.retraining.monitor.PerformanceMonitor;
import com.mlops.retraining.orchestrator.RetrainingOrchestrator;
import com.mlops.retraining.orchestrator.RetrainingRequest;
import com.mlops.retraining.orchestrator.SubmitResult;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Emits retraining triggers: a daily calendar tick for every model and a periodic health check
 * that submits only the degraded ones. Both hand off to the orchestrator and never wait on training.
 */
@Component
public class RetrainingTriggerScheduler {
    private static final Logger logger = LoggerFactory.getLogger(RetrainingTriggerScheduler.class);

    private final ModelCatalog catalog;
    private final PerformanceMonitor monitor;
    private final RetrainingOrchestrator orchestrator;
    private final RetrainingProperties properties;

    public RetrainingTriggerScheduler(
        ModelCatalog catalog,
        PerformanceMonitor monitor,
        RetrainingOrchestrator orchestrator,
        RetrainingProperties properties
    ) {
        this.catalog = catalog;
        this.monitor = monitor;
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Scheduled(
        cron = "${retraining.schedule.daily-cron:0 0 2 * * *}",
        zone = "${retraining.schedule.zone:UTC}"
    )
    public void runDailyRetraining() {
        if (!properties.getSchedule().isEnabled()) {
            return;
        }
        logger.info("retraining_daily_tick models={}", catalog.modelIds());
        for (String modelId : catalog.modelIds()) {
            try {
                SubmitResult result = orchestrator.submit(RetrainingRequest.scheduled(modelId));
                Metrics.counter("retraining.trigger.total", "trigger", "scheduled", "outcome", outcomeTag(result))
                    .increment();
                logger.info("retraining_daily_submitted model_id={} outcome={}", modelId, result.getOutcome());
            } catch (Exception ex) {
                Metrics.counter("retraining.trigger.total", "trigger", "scheduled", "outcome", "error").increment();
                logger.warn("retraining_daily_submit_failed model_id={} message={}", modelId, ex.getMessage());
            }
        }
    }

    @Scheduled(
        fixedDelayString = "${retraining.schedule.health-check-interval-ms:900000}",
        initialDelayString = "${retraining.schedule.health-check-initial-delay-ms:60000}"
    )
    public void runHealthCheck() {
        if (!properties.getSchedule().isEnabled()) {
            return;
        }
        for (String modelId : catalog.modelIds()) {
            try {
                PerformanceEvaluation evaluation = monitor.evaluate(modelId);
                if (!evaluation.isNeedsRetraining()) {
                    logger.debug("retraining_health_ok model_id={} reason={}", modelId, evaluation.getReason());
                    continue;
                }
                SubmitResult result = orchestrator.submit(RetrainingRequest.degraded(modelId));
                Metrics.counter("retraining.trigger.total", "trigger", "degraded", "outcome", outcomeTag(result))
                    .increment();
                logger.info(
                    "retraining_health_degraded model_id={} reason={} outcome={}",
                    modelId,
                    evaluation.getReason(),
                    result.getOutcome()
                );
            } catch (Exception ex) {
                Metrics.counter("retraining.trigger.total", "trigger", "degraded", "outcome", "error").increment();
                logger.warn("retraining_health_check_failed model_id={} message={}", modelId, ex.getMessage());
            }
        }
    }

    private static String outcomeTag(SubmitResult result) {
        return result.getOutcome().name().toLowerCase();
    }
}
