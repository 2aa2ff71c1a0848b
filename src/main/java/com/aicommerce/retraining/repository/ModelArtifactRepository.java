package com.aicommerce.retraining.repository;

import com.aicommerce.retraining.domain.model.ModelArtifactEntity;
import com.aicommerce.retraining.domain.model.ModelTask;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for archived model artifacts keyed by task and version.
 *
 * @author Retraining Team
 */
@Repository
public interface ModelArtifactRepository extends JpaRepository<ModelArtifactEntity, Long> {

    Optional<ModelArtifactEntity> findByTaskAndVersion(ModelTask task, Long version);

    /**
     * Newest artifacts first, used to rebuild the backup stack on startup.
     */
    List<ModelArtifactEntity> findByTaskOrderByVersionDesc(ModelTask task);

    /**
     * Clear the production flag of every artifact of a task.
     *
     * @param task Model task
     * @return number of rows updated
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ModelArtifactEntity a SET a.production = false WHERE a.task = :task AND a.production = true")
    int clearProduction(@Param("task") ModelTask task);

    /**
     * Mark a single version as production.
     *
     * @param task Model task
     * @param version Version to flag
     * @return number of rows updated (0 if the version is not archived)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ModelArtifactEntity a SET a.production = true WHERE a.task = :task AND a.version = :version")
    int markProduction(@Param("task") ModelTask task, @Param("version") Long version);

    /**
     * Remove archived artifacts older than the given version, keeping the
     * current production row regardless of its version.
     *
     * @param task Model task
     * @param version Exclusive lower bound of versions to keep
     * @return number of rows deleted
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ModelArtifactEntity a WHERE a.task = :task AND a.version < :version AND a.production = false")
    int deleteOlderThan(@Param("task") ModelTask task, @Param("version") Long version);

    /**
     * Remove archived artifacts newer than the given version. Used when a rollback
     * discards the versions it rolled away from.
     *
     * @param task Model task
     * @param version Exclusive upper bound of versions to keep
     * @return number of rows deleted
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ModelArtifactEntity a WHERE a.task = :task AND a.version > :version AND a.production = false")
    int deleteNewerThan(@Param("task") ModelTask task, @Param("version") Long version);
}
