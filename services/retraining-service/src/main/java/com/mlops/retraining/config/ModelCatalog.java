package com.mlops.retraining.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ModelCatalog {
    private static final Logger logger = LoggerFactory.getLogger(ModelCatalog.class);

    private final Map<String, ModelDefinition> models;

    public ModelCatalog(RetrainingProperties properties) {
        Map<String, ModelDefinition> resolved = new LinkedHashMap<>();
        Map<String, RetrainingProperties.ModelSettings> configured = properties.getModels();
        if (configured != null) {
            for (Map.Entry<String, RetrainingProperties.ModelSettings> entry : configured.entrySet()) {
                String id = entry.getKey() == null ? null : entry.getKey().trim();
                if (id == null || id.isEmpty()) {
                    throw new IllegalStateException("retraining.models contains a blank model id");
                }
                RetrainingProperties.ModelSettings settings = entry.getValue() == null
                    ? new RetrainingProperties.ModelSettings()
                    : entry.getValue();
                resolved.put(id, toDefinition(id, settings));
            }
        }
        this.models = Collections.unmodifiableMap(resolved);
        logger.info("model_catalog_loaded models={}", models.keySet());
    }

    public List<String> modelIds() {
        return new ArrayList<>(models.keySet());
    }

    public List<ModelDefinition> definitions() {
        return new ArrayList<>(models.values());
    }

    public boolean isKnown(String modelId) {
        return modelId != null && models.containsKey(modelId);
    }

    public ModelDefinition require(String modelId) {
        ModelDefinition definition = modelId == null ? null : models.get(modelId);
        if (definition == null) {
            throw new UnknownModelException(modelId);
        }
        return definition;
    }

    /**
     * Resolves an optional model filter: a blank value selects every known model.
     */
    public List<String> resolve(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            return modelIds();
        }
        return List.of(require(modelId.trim()).getId());
    }

    private static ModelDefinition toDefinition(String id, RetrainingProperties.ModelSettings settings) {
        PerformanceThresholds thresholds = new PerformanceThresholds(
            settings.getMinQuality(),
            settings.getMaxError(),
            settings.getMinSamples()
        );
        return new ModelDefinition(
            id,
            settings.getModelName(),
            settings.getDatasetRef(),
            thresholds,
            settings.getInitialArtifactUri(),
            settings.getInitialVersion()
        );
    }
}
