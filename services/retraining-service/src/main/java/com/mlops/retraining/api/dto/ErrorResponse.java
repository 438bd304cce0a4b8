package com.mlops.retraining.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

public class ErrorResponse {
    private final ErrorDetail error;

    @JsonProperty("trace_id")
    private final String traceId;

    @JsonProperty("request_id")
    private final String requestId;

    public ErrorResponse(ErrorDetail error, String traceId, String requestId) {
        this.error = error;
        this.traceId = traceId;
        this.requestId = requestId;
    }

    public ErrorDetail getError() {
        return error;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    /**
     * Error code and message; model and job ids are present only when the error concerns a job.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        private final String code;
        private final String message;

        @JsonProperty("model_id")
        private final String modelId;

        @JsonProperty("job_id")
        private final String jobId;

        public ErrorDetail(String code, String message) {
            this(code, message, null, null);
        }

        public ErrorDetail(String code, String message, String modelId, String jobId) {
            this.code = code;
            this.message = message;
            this.modelId = modelId;
            this.jobId = jobId;
        }

        public String getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }

        public String getModelId() {
            return modelId;
        }

        public String getJobId() {
            return jobId;
        }
    }
}
