package com.mlops.retraining.config;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "retraining")
public class RetrainingProperties {
    private Map<String, ModelSettings> models = new LinkedHashMap<>();
    private Schedule schedule = new Schedule();
    private Job job = new Job();
    private Registry registry = new Registry();

    public Map<String, ModelSettings> getModels() {
        return models;
    }

    public void setModels(Map<String, ModelSettings> models) {
        this.models = models;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Job getJob() {
        return job;
    }

    public void setJob(Job job) {
        this.job = job;
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public static class ModelSettings {
        private String modelName = "model";
        private String datasetRef;
        private double minQuality = 0.85;
        private double maxError = 1.0;
        private int minSamples = 50;
        private String initialArtifactUri;
        private String initialVersion;

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public String getDatasetRef() {
            return datasetRef;
        }

        public void setDatasetRef(String datasetRef) {
            this.datasetRef = datasetRef;
        }

        public double getMinQuality() {
            return minQuality;
        }

        public void setMinQuality(double minQuality) {
            this.minQuality = minQuality;
        }

        public double getMaxError() {
            return maxError;
        }

        public void setMaxError(double maxError) {
            this.maxError = maxError;
        }

        public int getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }

        public String getInitialArtifactUri() {
            return initialArtifactUri;
        }

        public void setInitialArtifactUri(String initialArtifactUri) {
            this.initialArtifactUri = initialArtifactUri;
        }

        public String getInitialVersion() {
            return initialVersion;
        }

        public void setInitialVersion(String initialVersion) {
            this.initialVersion = initialVersion;
        }
    }

    public static class Schedule {
        private boolean enabled = true;
        private String dailyCron = "0 0 2 * * *";
        private String zone = "UTC";
        private long healthCheckIntervalMs = 900000;
        private long healthCheckInitialDelayMs = 60000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDailyCron() {
            return dailyCron;
        }

        public void setDailyCron(String dailyCron) {
            this.dailyCron = dailyCron;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public long getHealthCheckIntervalMs() {
            return healthCheckIntervalMs;
        }

        public void setHealthCheckIntervalMs(long healthCheckIntervalMs) {
            this.healthCheckIntervalMs = healthCheckIntervalMs;
        }

        public long getHealthCheckInitialDelayMs() {
            return healthCheckInitialDelayMs;
        }

        public void setHealthCheckInitialDelayMs(long healthCheckInitialDelayMs) {
            this.healthCheckInitialDelayMs = healthCheckInitialDelayMs;
        }
    }

    public static class Job {
        private long timeoutMs = 1800000;
        private int workerThreads = 2;
        private int queueCapacity = 100;

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    public static class Registry {
        /**
         * JSON snapshot of the active artifacts. Blank keeps the registry in memory only.
         */
        private String snapshotPath;

        public String getSnapshotPath() {
            return snapshotPath;
        }

        public void setSnapshotPath(String snapshotPath) {
            this.snapshotPath = snapshotPath;
        }
    }
}
