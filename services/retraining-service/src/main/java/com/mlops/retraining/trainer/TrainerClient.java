package com.mlops.retraining.trainer;

import com.mlops.retraining.metrics.ModelMetrics;
import com.mlops.retraining.trainer.dto.TrainRequest;
import com.mlops.retraining.trainer.dto.TrainResponse;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Calls the external training sidecar over HTTP.
 */
@Component
public class TrainerClient implements TrainingExecutor {
    private static final Logger logger = LoggerFactory.getLogger(TrainerClient.class);

    private final RestTemplate restTemplate;
    private final TrainerProperties properties;

    public TrainerClient(@Qualifier("trainerRestTemplate") RestTemplate restTemplate, TrainerProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public TrainedModel train(String modelId, String datasetRef) {
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new TrainingException(TrainingErrorKind.TRAINING_FAILED, "trainer baseUrl not configured");
        }

        TrainRequest trainRequest = new TrainRequest();
        trainRequest.setVersion("v1");
        trainRequest.setModelId(modelId);
        trainRequest.setDatasetRef(datasetRef);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<TrainRequest> entity = new HttpEntity<>(trainRequest, headers);

        TrainResponse body;
        try {
            ResponseEntity<TrainResponse> response = restTemplate.exchange(
                buildUrl("/v1/train"),
                HttpMethod.POST,
                entity,
                TrainResponse.class
            );
            body = response.getBody();
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            logger.warn("trainer_call_failed model_id={} status={}", modelId, status);
            if (status == 400 || status == 422) {
                throw new TrainingException(
                    TrainingErrorKind.DATA_INVALID,
                    "dataset rejected: " + describe(e),
                    e
                );
            }
            throw new TrainingException(TrainingErrorKind.TRAINING_FAILED, "trainer error: " + e.getStatusCode(), e);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new TrainingException(TrainingErrorKind.TIMEOUT, "timeout", e);
            }
            throw new TrainingException(TrainingErrorKind.TRAINING_FAILED, "trainer unavailable", e);
        }

        if (body == null) {
            throw new TrainingException(TrainingErrorKind.TRAINING_FAILED, "trainer returned empty body");
        }
        return new TrainedModel(body.getArtifactUri(), body.getModelVersion(), toMetrics(body.getMetrics()));
    }

    private ModelMetrics toMetrics(TrainResponse.Metrics metrics) {
        if (metrics == null
            || metrics.getSampleCount() == null
            || metrics.getQualityScore() == null
            || metrics.getErrorScore() == null) {
            return null;
        }
        return new ModelMetrics(metrics.getSampleCount(), metrics.getQualityScore(), metrics.getErrorScore());
    }

    private String describe(HttpStatusCodeException e) {
        String body = e.getResponseBodyAsString();
        if (body == null || body.isBlank()) {
            return String.valueOf(e.getStatusCode().value());
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }
}
