package com.aicommerce.retraining.infrastructure.persistence;

import com.aicommerce.retraining.domain.model.ModelArtifact;
import com.aicommerce.retraining.domain.model.ModelArtifactEntity;
import com.aicommerce.retraining.domain.model.ModelTask;
import com.aicommerce.retraining.exception.PersistenceFailureException;
import com.aicommerce.retraining.repository.ModelArtifactRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Durable store of committed model artifacts, keyed by task and version.
 *
 * The archive mirrors the in-memory model store so that production models and
 * their rollback history survive a restart. It is never read on the serving path.
 *
 * @author Retraining Team
 */
@Service
public class ModelArtifactArchive {

    private static final Logger logger = LoggerFactory.getLogger(ModelArtifactArchive.class);

    private static final TypeReference<Map<String, Double>> METRICS_TYPE = new TypeReference<>() {
    };

    private final ModelArtifactRepository modelArtifactRepository;
    private final ObjectMapper objectMapper;

    public ModelArtifactArchive(ModelArtifactRepository modelArtifactRepository, ObjectMapper objectMapper) {
        this.modelArtifactRepository = modelArtifactRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Store an artifact, flag it as the task's production model and drop
     * archived versions that fell out of rollback retention.
     *
     * @param artifact Newly committed production artifact
     * @param oldestRetainedVersion Oldest backup version still retained, or the
     *                              artifact's own version when no backups remain
     * @throws PersistenceFailureException if the write fails
     */
    @Transactional
    public void saveProduction(ModelArtifact artifact, long oldestRetainedVersion) {
        ModelTask task = artifact.getTask();
        try {
            if (modelArtifactRepository.findByTaskAndVersion(task, artifact.getVersion()).isEmpty()) {
                modelArtifactRepository.save(toEntity(artifact));
            }
            modelArtifactRepository.clearProduction(task);
            modelArtifactRepository.markProduction(task, artifact.getVersion());
            int pruned = modelArtifactRepository.deleteOlderThan(task, oldestRetainedVersion);

            logger.debug("Archived {} v{} as production, pruned {} old versions",
                    task, artifact.getVersion(), pruned);

        } catch (DataAccessException | JsonProcessingException e) {
            throw new PersistenceFailureException("artifact",
                    "Failed to archive " + task + " v" + artifact.getVersion(), e);
        }
    }

    /**
     * Move the production flag to an already archived version.
     *
     * @param task Model task
     * @param version Version to flag as production
     * @throws PersistenceFailureException if the write fails or the version is not archived
     */
    @Transactional
    public void markProduction(ModelTask task, long version) {
        try {
            modelArtifactRepository.clearProduction(task);
            int updated = modelArtifactRepository.markProduction(task, version);
            if (updated == 0) {
                throw new PersistenceFailureException("artifact",
                        task + " v" + version + " is not archived", null);
            }
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("artifact",
                    "Failed to flag " + task + " v" + version + " as production", e);
        }
    }

    /**
     * Flag a retained backup as production after a rollback and delete the versions
     * rolled away from, so they never come back as rollback targets after a restart.
     *
     * @param task Model task
     * @param restoredVersion Backup version that becomes production
     * @throws PersistenceFailureException if the write fails or the version is not archived
     */
    @Transactional
    public void rollbackProduction(ModelTask task, long restoredVersion) {
        markProduction(task, restoredVersion);
        try {
            int discarded = modelArtifactRepository.deleteNewerThan(task, restoredVersion);
            logger.debug("Rolled back archived {} to v{}, discarded {} newer versions",
                    task, restoredVersion, discarded);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("artifact",
                    "Failed to discard " + task + " versions newer than v" + restoredVersion, e);
        }
    }

    /**
     * Load archived artifacts for a task, newest version first.
     *
     * @param task Model task
     * @return archived artifacts
     * @throws PersistenceFailureException if the archive cannot be read
     */
    @Transactional(readOnly = true)
    public List<ArchivedArtifact> load(ModelTask task) {
        try {
            List<ModelArtifactEntity> entities = modelArtifactRepository.findByTaskOrderByVersionDesc(task);
            List<ArchivedArtifact> artifacts = new ArrayList<>(entities.size());
            for (ModelArtifactEntity entity : entities) {
                artifacts.add(new ArchivedArtifact(toArtifact(entity), entity.isProduction()));
            }
            return artifacts;
        } catch (DataAccessException | JsonProcessingException e) {
            throw new PersistenceFailureException("artifact", "Failed to load archived " + task + " models", e);
        }
    }

    private ModelArtifactEntity toEntity(ModelArtifact artifact) throws JsonProcessingException {
        return ModelArtifactEntity.builder()
                .task(artifact.getTask())
                .version(artifact.getVersion())
                .state(artifact.getState())
                .metricsJson(objectMapper.writeValueAsString(artifact.getMetrics()))
                .trainingSamples(artifact.getTrainingSamples())
                .trainedAt(artifact.getTrainedAt())
                .datasetMarker(artifact.getDatasetMarker())
                .production(false)
                .build();
    }

    private ModelArtifact toArtifact(ModelArtifactEntity entity) throws JsonProcessingException {
        Map<String, Double> metrics = objectMapper.readValue(entity.getMetricsJson(), METRICS_TYPE);
        return new ModelArtifact(
                entity.getTask(),
                entity.getVersion(),
                entity.getState(),
                metrics,
                entity.getTrainingSamples(),
                entity.getTrainedAt(),
                entity.getDatasetMarker()
        );
    }

    /**
     * Archived artifact together with its production flag.
     */
    public record ArchivedArtifact(ModelArtifact artifact, boolean production) {
    }
}
