package com.mlops.retraining.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlops.retraining.config.ModelCatalog;
import com.mlops.retraining.config.RetrainingProperties;
import com.mlops.retraining.config.UnknownModelException;
import com.mlops.retraining.metrics.ModelMetrics;
import com.mlops.retraining.trainer.TrainedModel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ModelRegistryTest {
    private static final Instant NOW = Instant.parse("2024-05-01T02:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void seedsBootstrapArtifactsFromConfiguration() {
        ModelRegistry registry = registry(properties(null), Clock.fixed(NOW, ZoneOffset.UTC));

        ActiveArtifact iris = registry.get("iris").orElseThrow();
        assertThat(iris.getArtifactUri()).isEqualTo("models/iris/bootstrap.pkl");
        assertThat(iris.getVersion()).isEqualTo("v0");
        assertThat(iris.getMetrics()).isNull();
        assertThat(registry.get("housing")).isEmpty();
        assertThat(registry.get(null)).isEmpty();
    }

    @Test
    void activateReplacesArtifactWithStrictlyIncreasingTimestamp() {
        ModelRegistry registry = registry(properties(null), Clock.fixed(NOW, ZoneOffset.UTC));
        ActiveArtifact bootstrap = registry.get("iris").orElseThrow();

        ActiveArtifact first = registry.activate("iris", trained("s3://iris/v1", "v1"));
        ActiveArtifact second = registry.activate("iris", trained("s3://iris/v2", "v2"));

        assertThat(first.getTrainedAt()).isAfter(bootstrap.getTrainedAt());
        assertThat(second.getTrainedAt()).isAfter(first.getTrainedAt());
        assertThat(registry.get("iris")).contains(second);
        assertThat(bootstrap.getVersion()).isEqualTo("v0");
    }

    @Test
    void blankVersionGetsGeneratedOne() {
        ModelRegistry registry = registry(properties(null), Clock.fixed(NOW, ZoneOffset.UTC));

        ActiveArtifact artifact = registry.activate("housing", trained("s3://housing/a", " "));

        assertThat(artifact.getVersion()).isEqualTo("v" + NOW.toEpochMilli());
    }

    @Test
    void activateRejectsUnknownModel() {
        ModelRegistry registry = registry(properties(null), Clock.systemUTC());

        assertThatThrownBy(() -> registry.activate("churn", trained("s3://churn/v1", "v1")))
            .isInstanceOf(UnknownModelException.class);
    }

    @Test
    void persistsSnapshotAndReloadsIt() throws Exception {
        Path snapshot = tempDir.resolve("registry/model-registry.json");
        RetrainingProperties properties = properties(snapshot.toString());
        ModelRegistry registry = registry(properties, Clock.fixed(NOW, ZoneOffset.UTC));

        registry.activate("iris", trained("s3://iris/v3", "v3"));

        assertThat(Files.exists(snapshot)).isTrue();
        assertThat(Files.exists(tempDir.resolve("registry/model-registry.json.tmp"))).isFalse();
        assertThat(Files.readString(snapshot)).contains("\"model_id\" : \"iris\"").contains("s3://iris/v3");

        ModelRegistry reloaded = registry(properties, Clock.systemUTC());
        ActiveArtifact iris = reloaded.get("iris").orElseThrow();
        assertThat(iris.getVersion()).isEqualTo("v3");
        assertThat(iris.getMetrics()).isEqualTo(new ModelMetrics(120, 0.92, 0.2));
        assertThat(iris.getTrainedAt()).isEqualTo(registry.get("iris").orElseThrow().getTrainedAt());
    }

    @Test
    void writeFailureLeavesPreviousArtifactServing() throws Exception {
        Path blocker = Files.createFile(tempDir.resolve("not-a-directory"));
        ModelRegistry registry = registry(
            properties(blocker.resolve("model-registry.json").toString()),
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
        ActiveArtifact before = registry.get("iris").orElseThrow();

        assertThatThrownBy(() -> registry.activate("iris", trained("s3://iris/v4", "v4")))
            .isInstanceOf(RegistryUnavailableException.class);

        assertThat(registry.get("iris")).contains(before);
    }

    @Test
    void unreadableSnapshotFailsStartup() throws Exception {
        Path snapshot = Files.writeString(tempDir.resolve("broken.json"), "{not json");

        assertThatThrownBy(() -> registry(properties(snapshot.toString()), Clock.systemUTC()))
            .isInstanceOf(RegistryUnavailableException.class);
    }

    @Test
    void readersNeverObserveMixedArtifacts() throws Exception {
        ModelRegistry registry = registry(properties(null), Clock.systemUTC());
        AtomicBoolean done = new AtomicBoolean(false);
        List<String> torn = new ArrayList<>();

        Thread reader = new Thread(() -> {
            while (!done.get()) {
                ActiveArtifact artifact = registry.get("iris").orElseThrow();
                String suffix = artifact.getArtifactUri().substring(artifact.getArtifactUri().lastIndexOf('/') + 1);
                boolean bootstrap = "v0".equals(artifact.getVersion());
                if (!bootstrap && !suffix.equals(artifact.getVersion())) {
                    synchronized (torn) {
                        torn.add(artifact.toString());
                    }
                }
            }
        });
        reader.start();
        for (int i = 1; i <= 500; i++) {
            registry.activate("iris", trained("s3://iris/v" + i, "v" + i));
        }
        done.set(true);
        reader.join(5000);

        assertThat(torn).isEmpty();
        assertThat(registry.get("iris").orElseThrow().getVersion()).isEqualTo("v500");
    }

    private static ModelRegistry registry(RetrainingProperties properties, Clock clock) {
        ModelRegistry registry = new ModelRegistry(new ModelCatalog(properties), new ObjectMapper(), properties, clock);
        registry.load();
        return registry;
    }

    private static TrainedModel trained(String uri, String version) {
        return new TrainedModel(uri, version, new ModelMetrics(120, 0.92, 0.2));
    }

    private static RetrainingProperties properties(String snapshotPath) {
        RetrainingProperties properties = new RetrainingProperties();
        RetrainingProperties.ModelSettings iris = new RetrainingProperties.ModelSettings();
        iris.setInitialArtifactUri("models/iris/bootstrap.pkl");
        iris.setInitialVersion("v0");
        properties.getModels().put("iris", iris);
        properties.getModels().put("housing", new RetrainingProperties.ModelSettings());
        properties.getRegistry().setSnapshotPath(snapshotPath);
        return properties;
    }
}
