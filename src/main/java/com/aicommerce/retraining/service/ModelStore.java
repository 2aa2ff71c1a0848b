package com.aicommerce.retraining.service;

import com.aicommerce.retraining.domain.model.ModelArtifact;
import com.aicommerce.retraining.domain.model.ModelTask;
import com.aicommerce.retraining.exception.NoRollbackTargetException;
import com.aicommerce.retraining.exception.PersistenceFailureException;
import com.aicommerce.retraining.infrastructure.metrics.RetrainingMetricsService;
import com.aicommerce.retraining.infrastructure.persistence.ModelArtifactArchive;
import com.aicommerce.retraining.infrastructure.persistence.ModelArtifactArchive.ArchivedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of the production model per task and its bounded rollback history.
 *
 * Concurrency contract:
 * - Mutators ({@link #commit}, {@link #rollbackToPrevious}, {@link #nextVersion}, {@link #restore})
 *   are NOT synchronized. Callers must hold the per-task retraining lock of the orchestrator.
 * - Readers ({@link #getProduction}, {@link #backups}) are lock-free and always observe either the
 *   old or the new production artifact, never a partial one: the production pointer is a single
 *   atomic reference and the backup list is replaced as a whole.
 *
 * Every production change is mirrored to the {@link ModelArtifactArchive}. Archive writes are
 * retried once and then logged; the in-memory pointer stays authoritative for serving.
 *
 * @author Retraining Team
 */
public class ModelStore {

    private static final Logger logger = LoggerFactory.getLogger(ModelStore.class);

    private final int maxBackupVersions;
    private final ModelArtifactArchive archive;
    private final RetrainingMetricsService metricsService;
    private final Map<ModelTask, TaskModels> models = new EnumMap<>(ModelTask.class);

    public ModelStore(int maxBackupVersions, ModelArtifactArchive archive, RetrainingMetricsService metricsService) {
        if (maxBackupVersions < 1) {
            throw new IllegalArgumentException("maxBackupVersions must be >= 1");
        }
        this.maxBackupVersions = maxBackupVersions;
        this.archive = archive;
        this.metricsService = metricsService;
        for (ModelTask task : ModelTask.values()) {
            models.put(task, new TaskModels());
        }
    }

    /**
     * Current production artifact of a task.
     *
     * @param task Model task
     * @return production artifact, empty if the task was never trained
     */
    public Optional<ModelArtifact> getProduction(ModelTask task) {
        return Optional.ofNullable(models.get(task).production.get());
    }

    /**
     * Retained backups of a task, newest first. The current production artifact is not included.
     *
     * @param task Model task
     * @return immutable list of backups
     */
    public List<ModelArtifact> backups(ModelTask task) {
        return models.get(task).backups;
    }

    /**
     * Reserve the next candidate version of a task. Versions are never reused,
     * even when the candidate is rejected.
     *
     * @param task Model task
     * @return new version number
     */
    public long nextVersion(ModelTask task) {
        return models.get(task).versionCounter.incrementAndGet();
    }

    /**
     * Make {@code artifact} the production model of its task.
     * The previous production artifact is pushed on the backup stack and backups beyond
     * {@code maxBackupVersions} are pruned, oldest first.
     *
     * @param task Model task
     * @param artifact Validated artifact to promote
     * @return the previous production artifact, empty on first promotion
     */
    public Optional<ModelArtifact> commit(ModelTask task, ModelArtifact artifact) {
        if (artifact.getTask() != task) {
            throw new IllegalArgumentException("Artifact for " + artifact.getTask() + " committed as " + task);
        }

        TaskModels taskModels = models.get(task);
        ModelArtifact previous = taskModels.production.get();
        if (previous != null && artifact.getVersion() <= previous.getVersion()) {
            throw new IllegalArgumentException("Version " + artifact.getVersion()
                    + " does not supersede production version " + previous.getVersion());
        }

        List<ModelArtifact> backups = new ArrayList<>(maxBackupVersions + 1);
        if (previous != null) {
            backups.add(previous);
        }
        backups.addAll(taskModels.backups);
        while (backups.size() > maxBackupVersions) {
            ModelArtifact pruned = backups.remove(backups.size() - 1);
            logger.info("Pruned {} v{} from rollback history", task, pruned.getVersion());
        }

        taskModels.backups = List.copyOf(backups);
        taskModels.production.set(artifact);
        taskModels.versionCounter.accumulateAndGet(artifact.getVersion(), Math::max);

        logger.info("Committed {} v{} as production (previous: {}, backups: {})",
                task, artifact.getVersion(), previous == null ? "none" : "v" + previous.getVersion(),
                backups.size());

        long oldestRetained = backups.isEmpty()
                ? artifact.getVersion()
                : backups.get(backups.size() - 1).getVersion();
        archiveWithRetry(task, artifact.getVersion(), () -> archive.saveProduction(artifact, oldestRetained));

        return Optional.ofNullable(previous);
    }

    /**
     * Restore the newest backup as production. The replaced artifact is discarded, in memory
     * and in the archive, so repeated calls walk further back through the history.
     *
     * @param task Model task
     * @return the restored artifact
     * @throws NoRollbackTargetException if no backup is retained
     */
    public ModelArtifact rollbackToPrevious(ModelTask task) {
        TaskModels taskModels = models.get(task);
        List<ModelArtifact> backups = taskModels.backups;
        if (backups.isEmpty()) {
            throw new NoRollbackTargetException(task);
        }

        ModelArtifact restored = backups.get(0);
        ModelArtifact replaced = taskModels.production.get();

        taskModels.backups = List.copyOf(backups.subList(1, backups.size()));
        taskModels.production.set(restored);

        logger.info("Rolled back {} from {} to v{}",
                task, replaced == null ? "none" : "v" + replaced.getVersion(), restored.getVersion());

        archiveWithRetry(task, restored.getVersion(), () -> archive.rollbackProduction(task, restored.getVersion()));

        return restored;
    }

    /**
     * Reload production artifacts and backups from the archive.
     * Intended for startup, before the retraining loop runs.
     */
    public void restore() {
        for (ModelTask task : ModelTask.values()) {
            try {
                restore(task, archive.load(task));
            } catch (PersistenceFailureException e) {
                logger.warn("Could not restore {} models from archive, starting empty: {}", task, e.getMessage());
                metricsService.recordPersistenceFailure("artifact");
            }
        }
    }

    private void restore(ModelTask task, List<ArchivedArtifact> archived) {
        TaskModels taskModels = models.get(task);
        ModelArtifact production = null;
        long maxVersion = 0;
        for (ArchivedArtifact entry : archived) {
            maxVersion = Math.max(maxVersion, entry.artifact().getVersion());
            if (entry.production() && production == null) {
                production = entry.artifact();
            }
        }

        List<ModelArtifact> backups = new ArrayList<>();
        if (production != null) {
            for (ArchivedArtifact entry : archived) {
                if (entry.artifact().getVersion() < production.getVersion() && backups.size() < maxBackupVersions) {
                    backups.add(entry.artifact());
                }
            }
        }

        taskModels.backups = List.copyOf(backups);
        taskModels.production.set(production);
        taskModels.versionCounter.accumulateAndGet(maxVersion, Math::max);

        if (production != null) {
            logger.info("Restored {} v{} as production with {} backups", task, production.getVersion(), backups.size());
        }
    }

    private void archiveWithRetry(ModelTask task, long version, Runnable write) {
        try {
            write.run();
        } catch (PersistenceFailureException first) {
            logger.warn("Archiving {} v{} failed, retrying once: {}", task, version, first.getMessage());
            try {
                write.run();
            } catch (PersistenceFailureException second) {
                logger.warn("Archiving {} v{} failed after retry; production pointer updated in memory only",
                        task, version, second);
                metricsService.recordPersistenceFailure("artifact");
            }
        }
    }

    private static final class TaskModels {
        private final AtomicReference<ModelArtifact> production = new AtomicReference<>();
        private final AtomicLong versionCounter = new AtomicLong();
        private volatile List<ModelArtifact> backups = List.of();
    }
}
