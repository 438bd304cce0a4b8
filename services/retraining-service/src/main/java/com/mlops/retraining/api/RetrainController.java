package com.mlops.retraining.api;

import com.mlops.retraining.api.dto.JobResponse;
import com.mlops.retraining.api.dto.MetricsDto;
import com.mlops.retraining.api.dto.RetrainOutcome;
import com.mlops.retraining.api.dto.RetrainRequest;
import com.mlops.retraining.api.dto.RetrainResponse;
import com.mlops.retraining.api.dto.StatusResponse;
import com.mlops.retraining.config.ModelCatalog;
import com.mlops.retraining.orchestrator.ModelJobStatus;
import com.mlops.retraining.orchestrator.RetrainingOrchestrator;
import com.mlops.retraining.orchestrator.RetrainingRequest;
import com.mlops.retraining.orchestrator.SubmitOutcome;
import com.mlops.retraining.orchestrator.SubmitResult;
import jakarta.servlet.http.HttpServletRequest;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RetrainController {
    private final RetrainingOrchestrator orchestrator;
    private final ModelCatalog catalog;

    public RetrainController(RetrainingOrchestrator orchestrator, ModelCatalog catalog) {
        this.orchestrator = orchestrator;
        this.catalog = catalog;
    }

    /**
     * Manual trigger. Without {@code model_id} every known model is submitted and each gets its own outcome;
     * with one, a conflicting run answers 409.
     */
    @PostMapping("/retrain")
    public ResponseEntity<RetrainResponse> retrain(
        @RequestBody(required = false) RetrainRequest request,
        HttpServletRequest httpRequest
    ) {
        String modelId = request == null ? null : request.getModelId();
        boolean force = request != null && Boolean.TRUE.equals(request.getForce());
        String datasetRef = request == null ? null : request.getDatasetRef();

        RetrainResponse response = new RetrainResponse();
        response.setTraceId(RequestIdUtil.traceId(httpRequest));
        response.setRequestId(RequestIdUtil.requestId(httpRequest));

        if (modelId != null && !modelId.isBlank()) {
            SubmitResult result = orchestrator.submit(RetrainingRequest.manual(modelId.trim(), force, datasetRef));
            if (result.getOutcome() == SubmitOutcome.REJECTED_ALREADY_RUNNING) {
                throw new RetrainingInProgressException(result.getModelId(), result.getJob().getId());
            }
            fill(response, result);
            return ResponseEntity.status(result.isAccepted() ? HttpStatus.ACCEPTED : HttpStatus.OK).body(response);
        }

        List<RetrainOutcome> results = new ArrayList<>();
        boolean anyAccepted = false;
        for (String id : catalog.modelIds()) {
            SubmitResult result = orchestrator.submit(RetrainingRequest.manual(id, force, datasetRef));
            RetrainOutcome outcome = new RetrainOutcome();
            fill(outcome, result);
            results.add(outcome);
            anyAccepted = anyAccepted || result.isAccepted();
        }
        response.setStatus(anyAccepted ? "started" : "no_action");
        response.setResults(results);
        return ResponseEntity.status(anyAccepted ? HttpStatus.ACCEPTED : HttpStatus.OK).body(response);
    }

    @GetMapping("/retrain/status")
    public StatusResponse status(
        @RequestParam(value = "model_id", required = false) String modelId,
        HttpServletRequest httpRequest
    ) {
        StatusResponse response = new StatusResponse();
        for (ModelJobStatus status : orchestrator.status(modelId)) {
            response.getModels().add(StatusResponse.ModelStatus.from(status));
        }
        response.setTraceId(RequestIdUtil.traceId(httpRequest));
        response.setRequestId(RequestIdUtil.requestId(httpRequest));
        return response;
    }

    @GetMapping("/retrain/results/{job_id}")
    public JobResponse results(@PathVariable("job_id") String jobId) {
        return JobResponse.from(orchestrator.results(jobId));
    }

    private static void fill(RetrainOutcome outcome, SubmitResult result) {
        outcome.setModelId(result.getModelId());
        switch (result.getOutcome()) {
            case ACCEPTED:
                outcome.setStatus("started");
                outcome.setJob(JobResponse.from(result.getJob()));
                break;
            case SKIPPED:
                outcome.setStatus("skipped");
                outcome.setReason(result.getEvaluation().getReason());
                outcome.setMetrics(MetricsDto.from(result.getEvaluation().getMetrics()));
                break;
            default:
                outcome.setStatus("already_running");
                outcome.setJob(JobResponse.from(result.getJob()));
                break;
        }
    }
}
