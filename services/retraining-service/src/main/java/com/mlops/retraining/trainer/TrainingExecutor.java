package com.mlops.retraining.trainer;

public interface TrainingExecutor {

    /**
     * Trains a new artifact for the model from the referenced dataset. May block for the whole
     * training run.
     *
     * @throws TrainingException with the failure kind when training does not produce an artifact
     */
    TrainedModel train(String modelId, String datasetRef);
}
