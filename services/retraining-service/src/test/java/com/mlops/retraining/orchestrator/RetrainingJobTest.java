package com.mlops.retraining.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;

import com.mlops.retraining.metrics.ModelMetrics;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class RetrainingJobTest {
    private static final Instant T0 = Instant.parse("2024-05-01T02:00:00Z");

    @Test
    void newJobIdHasPrefixAndThirtyTwoHexChars() {
        String id = RetrainingJob.newJobId();

        assertThat(id).matches("job_[0-9a-f]{32}");
        assertThat(RetrainingJob.newJobId()).isNotEqualTo(id);
    }

    @Test
    void walksQueuedRunningSucceeded() {
        RetrainingJob queued = RetrainingJob.queued("job_1", "iris", TriggerReason.MANUAL, true, "ds", T0);
        RetrainingJob running = queued.markRunning(T0.plusSeconds(1));
        RetrainingJob succeeded = running.markSucceeded(T0.plusSeconds(5), new ModelMetrics(10, 0.9, 0.1), "v2");

        assertThat(queued.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(running.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(running.getStartedAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(succeeded.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(succeeded.getEndedAt()).isEqualTo(T0.plusSeconds(5));
        assertThat(succeeded.getArtifactVersion()).isEqualTo("v2");
        assertThat(succeeded.getDatasetRef()).isEqualTo("ds");
        assertThat(succeeded.isForce()).isTrue();
        assertThat(succeeded.isTerminal()).isTrue();
    }

    @Test
    void terminalJobIgnoresFurtherTransitions() {
        RetrainingJob failed = RetrainingJob.queued("job_2", "iris", TriggerReason.SCHEDULED, false, null, T0)
            .markRunning(T0)
            .markFailed(T0.plusSeconds(2), FailureKind.TIMEOUT, "timeout");

        assertThat(failed.markSucceeded(T0.plusSeconds(3), new ModelMetrics(1, 1.0, 0.0), "v3")).isSameAs(failed);
        assertThat(failed.markFailed(T0.plusSeconds(3), FailureKind.TRAINING_FAILED, "late")).isSameAs(failed);
        assertThat(failed.markRunning(T0.plusSeconds(3))).isSameAs(failed);
        assertThat(failed.getFailureKind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(failed.getFailureReason()).isEqualTo("timeout");
    }

    @Test
    void runningCannotBeStartedTwice() {
        RetrainingJob running = RetrainingJob.queued("job_3", "iris", TriggerReason.SCHEDULED, false, null, T0)
            .markRunning(T0);

        assertThat(running.markRunning(T0.plusSeconds(1))).isSameAs(running);
    }
}
