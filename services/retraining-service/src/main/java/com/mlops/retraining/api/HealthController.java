package com.mlops.retraining.api;

import com.mlops.retraining.config.ModelCatalog;
import com.mlops.retraining.orchestrator.RetrainingOrchestrator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
    private final RetrainingOrchestrator orchestrator;
    private final ModelCatalog catalog;

    public HealthController(RetrainingOrchestrator orchestrator, ModelCatalog catalog) {
        this.orchestrator = orchestrator;
        this.catalog = catalog;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("models", catalog.modelIds().size());
        body.put("in_flight_jobs", orchestrator.inFlightCount());
        return body;
    }
}
