package com.mlops.retraining.orchestrator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory job history. Jobs are appended once and replaced atomically per id.
 */
@Component
public class RetrainingJobStore {
    private static final Logger logger = LoggerFactory.getLogger(RetrainingJobStore.class);

    private final ConcurrentHashMap<String, RetrainingJob> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<String>> jobIdsByModel = new ConcurrentHashMap<>();

    public void append(RetrainingJob job) {
        if (jobs.putIfAbsent(job.getId(), job) != null) {
            throw new IllegalStateException("duplicate job id " + job.getId());
        }
        jobIdsByModel.computeIfAbsent(job.getModelId(), key -> new CopyOnWriteArrayList<>()).add(job.getId());
    }

    public Optional<RetrainingJob> find(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    /**
     * Applies a transition unless the job is already terminal.
     *
     * @return {@code true} when the stored job changed
     */
    public boolean transition(String jobId, UnaryOperator<RetrainingJob> change) {
        boolean[] applied = {false};
        jobs.computeIfPresent(jobId, (id, current) -> {
            if (current.isTerminal()) {
                return current;
            }
            RetrainingJob next = change.apply(current);
            if (next == null || next == current) {
                return current;
            }
            applied[0] = true;
            return next;
        });
        if (!applied[0]) {
            logger.debug("retraining_job_transition_ignored job_id={}", jobId);
        }
        return applied[0];
    }

    /**
     * Jobs of the model, newest first.
     */
    public List<RetrainingJob> history(String modelId) {
        List<String> ids = jobIdsByModel.get(modelId);
        if (ids == null) {
            return List.of();
        }
        List<RetrainingJob> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            RetrainingJob job = jobs.get(id);
            if (job != null) {
                result.add(job);
            }
        }
        Collections.reverse(result);
        return result;
    }

    public Optional<RetrainingJob> latest(String modelId) {
        List<String> ids = jobIdsByModel.get(modelId);
        if (ids == null || ids.isEmpty()) {
            return Optional.empty();
        }
        return find(ids.get(ids.size() - 1));
    }
}
