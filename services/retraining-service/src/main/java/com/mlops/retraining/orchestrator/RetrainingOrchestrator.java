package com.mlops.retraining.orchestrator;

import com.mlops.retraining.config.ModelCatalog;
import com.mlops.retraining.config.ModelDefinition;
import com.mlops.retraining.config.RetrainingProperties;
import com.mlops.retraining.metrics.MetricsStore;
import com.mlops.retraining.metrics.MetricsStoreUnavailableException;
import com.mlops.retraining.metrics.ModelMetrics;
import com.mlops.retraining.monitor.PerformanceEvaluation;
import com.mlops.retraining.monitor.PerformanceMonitor;
import com.mlops.retraining.registry.ActiveArtifact;
import com.mlops.retraining.registry.ModelRegistry;
import com.mlops.retraining.registry.RegistryUnavailableException;
import com.mlops.retraining.trainer.TrainedModel;
import com.mlops.retraining.trainer.TrainingException;
import com.mlops.retraining.trainer.TrainingExecutor;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs at most one retraining job per model at a time.
 *
 * <p>The per-model marker in {@code inFlight} maps a model id to the queued job holding it. It is
 * taken with {@code putIfAbsent} once the job exists and only ever released by that same job.
 */
@Service
public class RetrainingOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(RetrainingOrchestrator.class);

    static final String TIMEOUT_REASON = "timeout";

    private final ConcurrentHashMap<String, RetrainingJob> inFlight = new ConcurrentHashMap<>();

    private final ModelCatalog catalog;
    private final PerformanceMonitor monitor;
    private final TrainingExecutor trainingExecutor;
    private final ModelRegistry registry;
    private final MetricsStore metricsStore;
    private final RetrainingJobStore jobStore;
    private final Executor workerExecutor;
    private final RetrainingProperties properties;
    private final Clock clock;

    public RetrainingOrchestrator(
        ModelCatalog catalog,
        PerformanceMonitor monitor,
        TrainingExecutor trainingExecutor,
        ModelRegistry registry,
        MetricsStore metricsStore,
        RetrainingJobStore jobStore,
        @Qualifier("retrainingWorkerExecutor") Executor workerExecutor,
        RetrainingProperties properties,
        Clock clock
    ) {
        this.catalog = catalog;
        this.monitor = monitor;
        this.trainingExecutor = trainingExecutor;
        this.registry = registry;
        this.metricsStore = metricsStore;
        this.jobStore = jobStore;
        this.workerExecutor = workerExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Starts a retraining job unless one is already running for the model. Never waits for training.
     *
     * @throws com.mlops.retraining.config.UnknownModelException when the model is not configured
     */
    public SubmitResult submit(RetrainingRequest request) {
        ModelDefinition definition = catalog.require(request.getModelId());
        String modelId = definition.getId();

        if (request.getReason() == TriggerReason.MANUAL && !request.isForce()) {
            PerformanceEvaluation evaluation = monitor.evaluate(modelId);
            if (!evaluation.isNeedsRetraining()) {
                logger.info("retraining_submit_skipped model_id={} reason={}", modelId, evaluation.getReason());
                countSubmit("skipped");
                return SubmitResult.skipped(modelId, evaluation);
            }
        }

        String datasetRef = isBlank(request.getDatasetRef())
            ? definition.getDatasetRef()
            : request.getDatasetRef().trim();
        RetrainingJob job = RetrainingJob.queued(
            RetrainingJob.newJobId(),
            modelId,
            request.getReason(),
            request.isForce(),
            datasetRef,
            clock.instant()
        );

        RetrainingJob holder = inFlight.putIfAbsent(modelId, job);
        if (holder != null) {
            RetrainingJob running = jobStore.find(holder.getId()).orElse(holder);
            logger.info(
                "retraining_submit_rejected model_id={} reason={} running_job_id={}",
                modelId,
                request.getReason(),
                running.getId()
            );
            countSubmit("rejected");
            return SubmitResult.rejected(modelId, running);
        }

        try {
            jobStore.append(job);
        } catch (RuntimeException ex) {
            release(job);
            throw ex;
        }

        logger.info(
            "retraining_job_queued job_id={} model_id={} reason={} force={} dataset_ref={}",
            job.getId(),
            modelId,
            job.getReason(),
            job.isForce(),
            job.getDatasetRef()
        );
        countSubmit("accepted");
        dispatch(job);
        return SubmitResult.accepted(modelId, jobStore.find(job.getId()).orElse(job));
    }

    public List<ModelJobStatus> status(String modelFilter) {
        List<ModelJobStatus> statuses = new ArrayList<>();
        for (String modelId : catalog.resolve(modelFilter)) {
            statuses.add(new ModelJobStatus(
                modelId,
                inFlightJobId(modelId),
                jobStore.latest(modelId).orElse(null),
                jobStore.history(modelId)
            ));
        }
        return statuses;
    }

    public RetrainingJob results(String jobId) {
        return jobStore.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private void dispatch(RetrainingJob job) {
        CompletableFuture<TrainedModel> future;
        try {
            future = CompletableFuture.supplyAsync(() -> runTraining(job), workerExecutor);
        } catch (RejectedExecutionException ex) {
            try {
                fail(job, FailureKind.INTERNAL_ERROR, "worker pool rejected job");
            } finally {
                release(job);
            }
            return;
        }
        future
            .orTimeout(properties.getJob().getTimeoutMs(), TimeUnit.MILLISECONDS)
            .whenComplete((trained, error) -> complete(job, trained, error));
    }

    private TrainedModel runTraining(RetrainingJob job) {
        if (!jobStore.transition(job.getId(), current -> current.markRunning(clock.instant()))) {
            throw new CancellationException("job " + job.getId() + " is no longer queued");
        }
        logger.info("retraining_job_started job_id={} model_id={}", job.getId(), job.getModelId());
        return trainingExecutor.train(job.getModelId(), job.getDatasetRef());
    }

    private void complete(RetrainingJob job, TrainedModel trained, Throwable error) {
        try {
            if (error != null) {
                handleFailure(job, unwrap(error));
            } else {
                handleSuccess(job, trained);
            }
        } catch (RuntimeException ex) {
            logger.error("retraining_job_completion_error job_id={} model_id={}", job.getId(), job.getModelId(), ex);
            fail(job, FailureKind.INTERNAL_ERROR, describe(ex));
        } finally {
            release(job);
        }
    }

    private void handleFailure(RetrainingJob job, Throwable cause) {
        if (cause instanceof TimeoutException) {
            fail(job, FailureKind.TIMEOUT, TIMEOUT_REASON);
        } else if (cause instanceof TrainingException) {
            TrainingException trainingError = (TrainingException) cause;
            FailureKind kind = FailureKind.from(trainingError.getKind());
            fail(job, kind, kind == FailureKind.TIMEOUT ? TIMEOUT_REASON : trainingError.getMessage());
        } else if (cause instanceof CancellationException) {
            logger.warn("retraining_job_abandoned job_id={} model_id={}", job.getId(), job.getModelId());
        } else {
            logger.error("retraining_job_unexpected_error job_id={} model_id={}", job.getId(), job.getModelId(), cause);
            fail(job, FailureKind.INTERNAL_ERROR, describe(cause));
        }
    }

    private void handleSuccess(RetrainingJob job, TrainedModel trained) {
        if (trained == null || isBlank(trained.getArtifactUri())) {
            fail(job, FailureKind.TRAINING_FAILED, "trainer returned no artifact");
            return;
        }
        ModelMetrics metrics = trained.getMetrics();
        if (metrics == null || !metrics.isWellFormed()) {
            fail(job, FailureKind.INVALID_METRICS, "invalid metrics: " + metrics);
            return;
        }

        ActiveArtifact artifact;
        try {
            artifact = registry.activate(job.getModelId(), trained);
        } catch (RegistryUnavailableException ex) {
            fail(job, FailureKind.REGISTRY_UNAVAILABLE, ex.getMessage());
            return;
        }

        jobStore.transition(
            job.getId(),
            current -> current.markSucceeded(clock.instant(), metrics, artifact.getVersion())
        );
        logger.info(
            "retraining_job_succeeded job_id={} model_id={} version={} quality_score={} error_score={}",
            job.getId(),
            job.getModelId(),
            artifact.getVersion(),
            metrics.getQualityScore(),
            metrics.getErrorScore()
        );
        Metrics.counter("retraining.job.total", "outcome", "succeeded").increment();

        try {
            metricsStore.recordBaseline(job.getModelId(), artifact);
        } catch (MetricsStoreUnavailableException ex) {
            logger.warn(
                "retraining_baseline_record_failed job_id={} model_id={} error={}",
                job.getId(),
                job.getModelId(),
                ex.getMessage()
            );
        }
    }

    private void fail(RetrainingJob job, FailureKind kind, String reason) {
        boolean applied = jobStore.transition(
            job.getId(),
            current -> current.markFailed(clock.instant(), kind, reason)
        );
        if (!applied) {
            logger.warn("retraining_job_late_failure_ignored job_id={} kind={}", job.getId(), kind);
            return;
        }
        logger.warn(
            "retraining_job_failed job_id={} model_id={} kind={} reason={}",
            job.getId(),
            job.getModelId(),
            kind,
            reason
        );
        Metrics.counter("retraining.job.total", "outcome", "failed").increment();
    }

    private String inFlightJobId(String modelId) {
        RetrainingJob holder = inFlight.get(modelId);
        return holder == null ? null : holder.getId();
    }

    private void release(RetrainingJob job) {
        inFlight.remove(job.getModelId(), job);
    }

    private static void countSubmit(String outcome) {
        Metrics.counter("retraining.submit.total", "outcome", outcome).increment();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
