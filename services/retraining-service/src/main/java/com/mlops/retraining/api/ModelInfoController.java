package com.mlops.retraining.api;

import com.mlops.retraining.api.dto.MetricsDto;
import com.mlops.retraining.api.dto.ModelInfoResponse;
import com.mlops.retraining.config.ModelCatalog;
import com.mlops.retraining.config.ModelDefinition;
import com.mlops.retraining.registry.ActiveArtifact;
import com.mlops.retraining.registry.ModelRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ModelInfoController {
    private final ModelCatalog catalog;
    private final ModelRegistry registry;

    public ModelInfoController(ModelCatalog catalog, ModelRegistry registry) {
        this.catalog = catalog;
        this.registry = registry;
    }

    @GetMapping("/model-info")
    public ModelInfoResponse modelInfo(
        @RequestParam(value = "model_id", required = false) String modelId,
        HttpServletRequest httpRequest
    ) {
        ModelInfoResponse response = new ModelInfoResponse();
        for (String id : catalog.resolve(modelId)) {
            response.getModels().add(toInfo(catalog.require(id), registry.get(id)));
        }
        response.setTraceId(RequestIdUtil.traceId(httpRequest));
        response.setRequestId(RequestIdUtil.requestId(httpRequest));
        return response;
    }

    private static ModelInfoResponse.ModelInfo toInfo(ModelDefinition definition, Optional<ActiveArtifact> active) {
        ModelInfoResponse.ModelInfo info = new ModelInfoResponse.ModelInfo();
        info.setModelId(definition.getId());
        info.setModelName(definition.getModelName());
        if (active.isPresent()) {
            ActiveArtifact artifact = active.get();
            info.setLoaded(true);
            info.setModelVersion(artifact.getVersion());
            info.setArtifactUri(artifact.getArtifactUri());
            info.setLastTrained(artifact.getTrainedAt() == null ? null : artifact.getTrainedAt().toString());
            info.setPerformanceMetrics(MetricsDto.from(artifact.getMetrics()));
        }
        return info;
    }
}
