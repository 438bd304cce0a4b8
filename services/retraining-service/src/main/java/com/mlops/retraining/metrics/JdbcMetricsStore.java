package com.mlops.retraining.metrics;

import com.mlops.retraining.registry.ActiveArtifact;
import java.sql.Timestamp;
import java.util.List;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcMetricsStore implements MetricsStore {
    static final String RECENT_METRICS_SQL =
        "SELECT sample_count, quality_score, error_score FROM model_quality_snapshot "
            + "WHERE model_id = ? ORDER BY computed_at DESC LIMIT 1";
    static final String INSERT_BASELINE_SQL =
        "INSERT INTO model_baseline "
            + "(model_id, model_version, artifact_uri, trained_at, sample_count, quality_score, error_score) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;

    public JdbcMetricsStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public ModelMetrics getRecentMetrics(String modelId) {
        List<ModelMetrics> rows;
        try {
            rows = jdbcTemplate.query(
                RECENT_METRICS_SQL,
                (rs, rowNum) -> new ModelMetrics(
                    rs.getLong("sample_count"),
                    rs.getDouble("quality_score"),
                    rs.getDouble("error_score")
                ),
                modelId
            );
        } catch (DataAccessException ex) {
            throw new MetricsStoreUnavailableException("metrics store unavailable", ex);
        }
        if (rows == null || rows.isEmpty()) {
            return ModelMetrics.empty();
        }
        return rows.get(0);
    }

    @Override
    public void recordBaseline(String modelId, ActiveArtifact artifact) {
        ModelMetrics metrics = artifact.getMetrics() == null ? ModelMetrics.empty() : artifact.getMetrics();
        try {
            jdbcTemplate.update(
                INSERT_BASELINE_SQL,
                modelId,
                artifact.getVersion(),
                artifact.getArtifactUri(),
                Timestamp.from(artifact.getTrainedAt()),
                metrics.getSampleCount(),
                metrics.getQualityScore(),
                metrics.getErrorScore()
            );
        } catch (DataAccessException ex) {
            throw new MetricsStoreUnavailableException("metrics store unavailable", ex);
        }
    }
}
