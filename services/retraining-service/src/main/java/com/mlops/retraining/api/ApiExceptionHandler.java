package com.mlops.retraining.api;

import com.mlops.retraining.api.dto.ErrorResponse;
import com.mlops.retraining.config.UnknownModelException;
import com.mlops.retraining.orchestrator.JobNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", "Invalid request body", request);
    }

    @ExceptionHandler(UnknownModelException.class)
    public ResponseEntity<ErrorResponse> handleUnknownModel(UnknownModelException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "unknown_model", ex.getMessage(), request);
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleJobNotFound(JobNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "job_not_found", ex.getMessage(), request);
    }

    @ExceptionHandler(RetrainingInProgressException.class)
    public ResponseEntity<ErrorResponse> handleInProgress(
        RetrainingInProgressException ex,
        HttpServletRequest request
    ) {
        ErrorResponse.ErrorDetail detail = new ErrorResponse.ErrorDetail(
            "already_running",
            ex.getMessage(),
            ex.getModelId(),
            ex.getJobId()
        );
        return respond(HttpStatus.CONFLICT, detail, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        logger.error("api_unexpected_error path={}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected error", request);
    }

    private ResponseEntity<ErrorResponse> respond(
        HttpStatus status,
        String code,
        String message,
        HttpServletRequest request
    ) {
        return respond(status, new ErrorResponse.ErrorDetail(code, message), request);
    }

    private ResponseEntity<ErrorResponse> respond(
        HttpStatus status,
        ErrorResponse.ErrorDetail detail,
        HttpServletRequest request
    ) {
        ErrorResponse body = new ErrorResponse(
            detail,
            RequestIdUtil.traceId(request),
            RequestIdUtil.requestId(request)
        );
        return ResponseEntity.status(status).body(body);
    }
}
