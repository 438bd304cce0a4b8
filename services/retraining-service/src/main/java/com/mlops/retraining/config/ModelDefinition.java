package com.mlops.retraining.config;

/**
 * Startup-time description of one retrainable model. Immutable once the catalog is built.
 */
public final class ModelDefinition {
    private final String id;
    private final String modelName;
    private final String datasetRef;
    private final PerformanceThresholds thresholds;
    private final String initialArtifactUri;
    private final String initialVersion;

    public ModelDefinition(
        String id,
        String modelName,
        String datasetRef,
        PerformanceThresholds thresholds,
        String initialArtifactUri,
        String initialVersion
    ) {
        this.id = id;
        this.modelName = modelName;
        this.datasetRef = datasetRef;
        this.thresholds = thresholds;
        this.initialArtifactUri = initialArtifactUri;
        this.initialVersion = initialVersion;
    }

    public String getId() {
        return id;
    }

    public String getModelName() {
        return modelName;
    }

    public String getDatasetRef() {
        return datasetRef;
    }

    public PerformanceThresholds getThresholds() {
        return thresholds;
    }

    public String getInitialArtifactUri() {
        return initialArtifactUri;
    }

    public String getInitialVersion() {
        return initialVersion;
    }
}
