package com.aicommerce.retraining.domain.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * A versioned, immutable model for one task.
 * Production artifacts are owned by the model store.
 *
 * @author Retraining Team
 */
public final class ModelArtifact {

    private final ModelTask task;
    private final long version;
    private final byte[] state;
    private final Map<String, Double> metrics;
    private final int trainingSamples;
    private final Instant trainedAt;
    private final Instant datasetMarker;

    /**
     * @param datasetMarker marker of the dataset snapshot the model was trained on,
     *                      null when unknown (artifacts archived before markers were kept)
     */
    public ModelArtifact(ModelTask task, long version, byte[] state, Map<String, Double> metrics,
                         int trainingSamples, Instant trainedAt, Instant datasetMarker) {
        this.task = Objects.requireNonNull(task, "task");
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1, got " + version);
        }
        this.version = version;
        this.state = Objects.requireNonNull(state, "state").clone();
        this.metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
        this.trainingSamples = trainingSamples;
        this.trainedAt = Objects.requireNonNull(trainedAt, "trainedAt");
        this.datasetMarker = datasetMarker;
    }

    public static ModelArtifact fromCandidate(CandidateModel candidate, long version, Instant trainedAt,
                                              Instant datasetMarker) {
        return new ModelArtifact(candidate.task(), version, candidate.state(), candidate.metrics(),
                candidate.trainingSamples(), trainedAt, datasetMarker);
    }

    public ModelTask getTask() {
        return task;
    }

    public long getVersion() {
        return version;
    }

    public byte[] getState() {
        return state.clone();
    }

    public int getStateSize() {
        return state.length;
    }

    public Map<String, Double> getMetrics() {
        return metrics;
    }

    public double getPrimaryMetric() {
        Double value = metrics.get(task.getPrimaryMetric());
        return value == null ? Double.NaN : value;
    }

    public int getTrainingSamples() {
        return trainingSamples;
    }

    public Instant getTrainedAt() {
        return trainedAt;
    }

    public Instant getDatasetMarker() {
        return datasetMarker;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ModelArtifact other)) {
            return false;
        }
        return task == other.task && version == other.version && Arrays.equals(state, other.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(task, version);
    }

    @Override
    public String toString() {
        return "ModelArtifact{task=" + task + ", version=" + version + ", metrics=" + metrics
                + ", trainedAt=" + trainedAt + '}';
    }
}
