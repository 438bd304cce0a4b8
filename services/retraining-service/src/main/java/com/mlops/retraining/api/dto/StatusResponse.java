package com.mlops.retraining.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mlops.retraining.orchestrator.ModelJobStatus;
import com.mlops.retraining.orchestrator.RetrainingJob;
import java.util.ArrayList;
import java.util.List;

public class StatusResponse {
    private List<ModelStatus> models = new ArrayList<>();

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    public List<ModelStatus> getModels() {
        return models;
    }

    public void setModels(List<ModelStatus> models) {
        this.models = models;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public static class ModelStatus {
        @JsonProperty("model_id")
        private String modelId;

        @JsonProperty("in_flight")
        private boolean inFlight;

        @JsonProperty("in_flight_job_id")
        private String inFlightJobId;

        @JsonProperty("latest_job")
        private JobResponse latestJob;

        private List<JobResponse> history = new ArrayList<>();

        public static ModelStatus from(ModelJobStatus status) {
            ModelStatus dto = new ModelStatus();
            dto.setModelId(status.getModelId());
            dto.setInFlight(status.isInFlight());
            dto.setInFlightJobId(status.getInFlightJobId());
            dto.setLatestJob(JobResponse.from(status.getLatestJob()));
            List<JobResponse> history = new ArrayList<>();
            for (RetrainingJob job : status.getHistory()) {
                history.add(JobResponse.from(job));
            }
            dto.setHistory(history);
            return dto;
        }

        public String getModelId() {
            return modelId;
        }

        public void setModelId(String modelId) {
            this.modelId = modelId;
        }

        public boolean isInFlight() {
            return inFlight;
        }

        public void setInFlight(boolean inFlight) {
            this.inFlight = inFlight;
        }

        public String getInFlightJobId() {
            return inFlightJobId;
        }

        public void setInFlightJobId(String inFlightJobId) {
            this.inFlightJobId = inFlightJobId;
        }

        public JobResponse getLatestJob() {
            return latestJob;
        }

        public void setLatestJob(JobResponse latestJob) {
            this.latestJob = latestJob;
        }

        public List<JobResponse> getHistory() {
            return history;
        }

        public void setHistory(List<JobResponse> history) {
            this.history = history;
        }
    }
}
