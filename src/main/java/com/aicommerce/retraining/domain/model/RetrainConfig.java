package com.aicommerce.retraining.domain.model;

import java.time.Duration;

/**
 * Immutable retraining configuration.
 * Supplied once when the orchestrator is constructed; every option is validated here.
 *
 * Options:
 * - minNewSamples: new behavioral records required since the last successful retrain
 * - checkIntervalHours: how often the loop evaluates triggers
 * - performanceImprovementThreshold: minimal relative improvement to promote a candidate
 * - maxBackupVersions: how many previous production artifacts are kept for rollback
 * - pollInterval: how often the sleeping loop wakes to re-check elapsed time
 * - minTrainableSamples: smallest dataset the trainer accepts
 *
 * @author Retraining Team
 */
public final class RetrainConfig {

    public static final int DEFAULT_MIN_NEW_SAMPLES = 100;
    public static final double DEFAULT_CHECK_INTERVAL_HOURS = 24.0;
    public static final double DEFAULT_IMPROVEMENT_THRESHOLD = 0.05;
    public static final int DEFAULT_MAX_BACKUP_VERSIONS = 5;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMinutes(1);
    public static final int DEFAULT_MIN_TRAINABLE_SAMPLES = 50;

    private final int minNewSamples;
    private final double checkIntervalHours;
    private final double performanceImprovementThreshold;
    private final int maxBackupVersions;
    private final Duration pollInterval;
    private final int minTrainableSamples;

    private RetrainConfig(Builder builder) {
        if (builder.minNewSamples < 1) {
            throw new IllegalArgumentException("minNewSamples must be >= 1, got " + builder.minNewSamples);
        }
        if (!(builder.checkIntervalHours > 0) || Double.isInfinite(builder.checkIntervalHours)) {
            throw new IllegalArgumentException("checkIntervalHours must be a positive number, got "
                    + builder.checkIntervalHours);
        }
        if (!(builder.performanceImprovementThreshold >= 0)
                || Double.isInfinite(builder.performanceImprovementThreshold)) {
            throw new IllegalArgumentException("performanceImprovementThreshold must be >= 0, got "
                    + builder.performanceImprovementThreshold);
        }
        if (builder.maxBackupVersions < 1) {
            throw new IllegalArgumentException("maxBackupVersions must be >= 1, got " + builder.maxBackupVersions);
        }
        if (builder.pollInterval == null || builder.pollInterval.isZero() || builder.pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive, got " + builder.pollInterval);
        }
        if (builder.minTrainableSamples < 1) {
            throw new IllegalArgumentException("minTrainableSamples must be >= 1, got "
                    + builder.minTrainableSamples);
        }

        this.minNewSamples = builder.minNewSamples;
        this.checkIntervalHours = builder.checkIntervalHours;
        this.performanceImprovementThreshold = builder.performanceImprovementThreshold;
        this.maxBackupVersions = builder.maxBackupVersions;
        this.minTrainableSamples = builder.minTrainableSamples;

        // Never sleep past the next scheduled check
        Duration interval = getCheckInterval();
        this.pollInterval = builder.pollInterval.compareTo(interval) > 0 ? interval : builder.pollInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RetrainConfig defaults() {
        return builder().build();
    }

    public int getMinNewSamples() {
        return minNewSamples;
    }

    public double getCheckIntervalHours() {
        return checkIntervalHours;
    }

    public Duration getCheckInterval() {
        return Duration.ofMillis(Math.max(1L, Math.round(checkIntervalHours * 3_600_000d)));
    }

    public double getPerformanceImprovementThreshold() {
        return performanceImprovementThreshold;
    }

    public int getMaxBackupVersions() {
        return maxBackupVersions;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public int getMinTrainableSamples() {
        return minTrainableSamples;
    }

    @Override
    public String toString() {
        return "RetrainConfig{minNewSamples=" + minNewSamples
                + ", checkIntervalHours=" + checkIntervalHours
                + ", performanceImprovementThreshold=" + performanceImprovementThreshold
                + ", maxBackupVersions=" + maxBackupVersions
                + ", pollInterval=" + pollInterval
                + ", minTrainableSamples=" + minTrainableSamples + '}';
    }

    public static final class Builder {

        private int minNewSamples = DEFAULT_MIN_NEW_SAMPLES;
        private double checkIntervalHours = DEFAULT_CHECK_INTERVAL_HOURS;
        private double performanceImprovementThreshold = DEFAULT_IMPROVEMENT_THRESHOLD;
        private int maxBackupVersions = DEFAULT_MAX_BACKUP_VERSIONS;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private int minTrainableSamples = DEFAULT_MIN_TRAINABLE_SAMPLES;

        private Builder() {
        }

        public Builder minNewSamples(int minNewSamples) {
            this.minNewSamples = minNewSamples;
            return this;
        }

        public Builder checkIntervalHours(double checkIntervalHours) {
            this.checkIntervalHours = checkIntervalHours;
            return this;
        }

        public Builder performanceImprovementThreshold(double performanceImprovementThreshold) {
            this.performanceImprovementThreshold = performanceImprovementThreshold;
            return this;
        }

        public Builder maxBackupVersions(int maxBackupVersions) {
            this.maxBackupVersions = maxBackupVersions;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder minTrainableSamples(int minTrainableSamples) {
            this.minTrainableSamples = minTrainableSamples;
            return this;
        }

        public RetrainConfig build() {
            return new RetrainConfig(this);
        }
    }
}
