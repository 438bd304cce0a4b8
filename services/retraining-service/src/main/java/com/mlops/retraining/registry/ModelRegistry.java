package com.mlops.retraining.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlops.retraining.config.ModelCatalog;
import com.mlops.retraining.config.ModelDefinition;
import com.mlops.retraining.config.RetrainingProperties;
import com.mlops.retraining.metrics.ModelMetrics;
import com.mlops.retraining.trainer.TrainedModel;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the serving artifact of every model.
 *
 * <p>Readers go straight to the map and never lock. Writers are serialized on {@code writeLock};
 * each activation builds a complete {@link ActiveArtifact}, persists the snapshot when one is
 * configured, and only then publishes the new instance with a single {@code put}.
 */
@Component
public class ModelRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ModelRegistry.class);

    private final ConcurrentHashMap<String, ActiveArtifact> active = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    private final ModelCatalog catalog;
    private final ObjectMapper objectMapper;
    private final RetrainingProperties properties;
    private final Clock clock;

    public ModelRegistry(
        ModelCatalog catalog,
        ObjectMapper objectMapper,
        RetrainingProperties properties,
        Clock clock
    ) {
        this.catalog = catalog;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void load() {
        synchronized (writeLock) {
            Path path = snapshotPath();
            if (path != null && Files.exists(path)) {
                RegistrySnapshot snapshot = readSnapshot(path);
                for (RegistrySnapshot.Entry entry : snapshot.getModels()) {
                    if (!catalog.isKnown(entry.getModelId())) {
                        logger.warn("model_registry_snapshot_skip model_id={} reason=unknown_model", entry.getModelId());
                        continue;
                    }
                    ActiveArtifact artifact = fromEntry(entry);
                    if (artifact != null) {
                        active.put(artifact.getModelId(), artifact);
                    }
                }
            }
            for (ModelDefinition definition : catalog.definitions()) {
                if (active.containsKey(definition.getId()) || isBlank(definition.getInitialArtifactUri())) {
                    continue;
                }
                String version = isBlank(definition.getInitialVersion()) ? "bootstrap" : definition.getInitialVersion();
                active.put(
                    definition.getId(),
                    new ActiveArtifact(definition.getId(), definition.getInitialArtifactUri(), version, clock.instant(), null)
                );
            }
            logger.info("model_registry_loaded models={} snapshot_path={}", active.keySet(), path);
        }
    }

    public Optional<ActiveArtifact> get(String modelId) {
        if (modelId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(active.get(modelId));
    }

    public Map<String, ActiveArtifact> snapshot() {
        return Map.copyOf(active);
    }

    /**
     * Replaces the serving artifact of the model.
     *
     * @throws RegistryUnavailableException when the snapshot cannot be written; the previous
     *     artifact stays active in that case
     */
    public ActiveArtifact activate(String modelId, TrainedModel trained) {
        catalog.require(modelId);
        synchronized (writeLock) {
            ActiveArtifact previous = active.get(modelId);
            Instant trainedAt = nextTrainedAt(previous);
            String version = isBlank(trained.getVersion()) ? "v" + trainedAt.toEpochMilli() : trained.getVersion();
            ActiveArtifact next = new ActiveArtifact(
                modelId,
                trained.getArtifactUri(),
                version,
                trainedAt,
                trained.getMetrics()
            );

            Path path = snapshotPath();
            if (path != null) {
                Map<String, ActiveArtifact> staged = new TreeMap<>(active);
                staged.put(modelId, next);
                writeSnapshot(path, staged.values(), trainedAt);
            }

            active.put(modelId, next);
            logger.info(
                "model_activated model_id={} version={} previous_version={} trained_at={}",
                modelId,
                version,
                previous == null ? null : previous.getVersion(),
                trainedAt
            );
            return next;
        }
    }

    // trainedAt must strictly increase per model even when the clock stalls or steps back
    private Instant nextTrainedAt(ActiveArtifact previous) {
        Instant now = clock.instant();
        if (previous == null || previous.getTrainedAt() == null) {
            return now;
        }
        Instant floor = previous.getTrainedAt().plusMillis(1);
        return now.isBefore(floor) ? floor : now;
    }

    private Path snapshotPath() {
        String configured = properties.getRegistry().getSnapshotPath();
        if (isBlank(configured)) {
            return null;
        }
        return Path.of(configured);
    }

    private RegistrySnapshot readSnapshot(Path path) {
        try {
            RegistrySnapshot snapshot = objectMapper.readValue(path.toFile(), RegistrySnapshot.class);
            return snapshot == null ? new RegistrySnapshot() : snapshot;
        } catch (IOException ex) {
            throw new RegistryUnavailableException("model registry read failed", ex);
        }
    }

    private void writeSnapshot(Path path, Collection<ActiveArtifact> artifacts, Instant updatedAt) {
        RegistrySnapshot snapshot = new RegistrySnapshot();
        snapshot.setUpdatedAt(updatedAt.toString());
        for (ActiveArtifact artifact : artifacts) {
            snapshot.getModels().add(toEntry(artifact));
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            logger.warn("model_registry_write_failed path={} error={}", path, ex.getMessage());
            throw new RegistryUnavailableException("model registry write failed", ex);
        }
    }

    private static RegistrySnapshot.Entry toEntry(ActiveArtifact artifact) {
        RegistrySnapshot.Entry entry = new RegistrySnapshot.Entry();
        entry.setModelId(artifact.getModelId());
        entry.setArtifactUri(artifact.getArtifactUri());
        entry.setModelVersion(artifact.getVersion());
        entry.setTrainedAt(artifact.getTrainedAt() == null ? null : artifact.getTrainedAt().toString());
        ModelMetrics metrics = artifact.getMetrics();
        if (metrics != null) {
            entry.setSampleCount(metrics.getSampleCount());
            entry.setQualityScore(metrics.getQualityScore());
            entry.setErrorScore(metrics.getErrorScore());
        }
        return entry;
    }

    private ActiveArtifact fromEntry(RegistrySnapshot.Entry entry) {
        if (isBlank(entry.getArtifactUri())) {
            return null;
        }
        Instant trainedAt;
        try {
            trainedAt = isBlank(entry.getTrainedAt()) ? clock.instant() : Instant.parse(entry.getTrainedAt());
        } catch (DateTimeParseException ex) {
            logger.warn("model_registry_snapshot_bad_timestamp model_id={} value={}", entry.getModelId(), entry.getTrainedAt());
            trainedAt = clock.instant();
        }
        ModelMetrics metrics = null;
        if (entry.getSampleCount() != null && entry.getQualityScore() != null && entry.getErrorScore() != null) {
            metrics = new ModelMetrics(entry.getSampleCount(), entry.getQualityScore(), entry.getErrorScore());
        }
        return new ActiveArtifact(entry.getModelId(), entry.getArtifactUri(), entry.getModelVersion(), trainedAt, metrics);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
