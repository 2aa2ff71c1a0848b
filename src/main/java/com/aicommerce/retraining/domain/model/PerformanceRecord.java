package com.aicommerce.retraining.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit entry, one per retrain decision.
 * Mapped as immutable: rows are inserted once and never updated or deleted.
 *
 * @author Retraining Team
 */
@Entity
@Immutable
@Table(name = "performance_records", indexes = {
    @Index(name = "idx_perf_task_recorded", columnList = "task, recorded_at"),
    @Index(name = "idx_perf_recorded", columnList = "recorded_at")
})
@Getter
@ToString
@Builder
@NoArgsConstructor(access = lombok.AccessLevel.PROTECTED)
@AllArgsConstructor
public class PerformanceRecord {

    @Id
    @Column(name = "record_id", nullable = false, length = 36, updatable = false)
    private String recordId;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "task", nullable = false, length = 32, updatable = false)
    private ModelTask task;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 32, updatable = false)
    private RetrainTrigger trigger;

    /**
     * Production version before the attempt, null if the task had never been trained.
     */
    @Column(name = "previous_version", updatable = false)
    private Long previousVersion;

    /**
     * Version assigned to the candidate, null when no candidate was trained.
     */
    @Column(name = "candidate_version", updatable = false)
    private Long candidateVersion;

    @Column(name = "previous_metric", updatable = false)
    private Double previousMetric;

    @Column(name = "candidate_metric", updatable = false)
    private Double candidateMetric;

    @Enumerated(EnumType.STRING)
    @Column(name = "decision", nullable = false, length = 32, updatable = false)
    private RetrainDecision decision;

    @Column(name = "reason", nullable = false, length = 512, updatable = false)
    private String reason;

    /**
     * Create a new record stamped with a fresh id.
     */
    public static PerformanceRecord of(Instant timestamp, ModelTask task, RetrainTrigger trigger,
                                       Long previousVersion, Long candidateVersion,
                                       Double previousMetric, Double candidateMetric,
                                       RetrainDecision decision, String reason) {
        return PerformanceRecord.builder()
                .recordId(UUID.randomUUID().toString())
                .timestamp(timestamp)
                .task(task)
                .trigger(trigger)
                .previousVersion(previousVersion)
                .candidateVersion(candidateVersion)
                .previousMetric(finiteOrNull(previousMetric))
                .candidateMetric(finiteOrNull(candidateMetric))
                .decision(decision)
                .reason(truncate(reason))
                .build();
    }

    // NaN cannot be stored in most databases; the reason carries the detail
    private static Double finiteOrNull(Double value) {
        return value == null || value.isNaN() || value.isInfinite() ? null : value;
    }

    private static String truncate(String reason) {
        if (reason == null) {
            return "";
        }
        return reason.length() > 512 ? reason.substring(0, 512) : reason;
    }
}
