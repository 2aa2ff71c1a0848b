package com.aicommerce.retraining.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable copy of a committed model artifact, keyed by task and version.
 * Exactly one row per task carries {@code production = true}.
 *
 * @author Retraining Team
 */
@Entity
@Table(name = "model_artifacts",
        uniqueConstraints = @UniqueConstraint(name = "uq_model_artifact_task_version",
                columnNames = {"task", "version"}),
        indexes = {
            @Index(name = "idx_model_artifact_task_production", columnList = "task, production")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelArtifactEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "task", nullable = false, length = 32)
    private ModelTask task;

    @Column(name = "version", nullable = false)
    private Long version;

    @Lob
    @Column(name = "state", nullable = false)
    private byte[] state;

    /**
     * Metrics as a JSON object, e.g. {"accuracy":0.91,"auc":0.88}.
     */
    @Column(name = "metrics_json", nullable = false, length = 2048)
    private String metricsJson;

    @Column(name = "training_samples", nullable = false)
    private Integer trainingSamples;

    @Column(name = "trained_at", nullable = false)
    private Instant trainedAt;

    /**
     * Marker of the dataset snapshot the model was trained on. New samples are
     * counted from here after a restart.
     */
    @Column(name = "dataset_marker")
    private Instant datasetMarker;

    @Column(name = "production", nullable = false)
    private boolean production;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
    }
}
