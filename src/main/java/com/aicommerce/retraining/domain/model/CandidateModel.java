package com.aicommerce.retraining.domain.model;

import java.util.Map;
import java.util.Objects;

/**
 * Output of a training run before it has been assigned a version.
 *
 * @param task task the model was trained for
 * @param state serialized model state
 * @param metrics hold-out metrics keyed by name; must contain the task's primary metric
 * @param trainingSamples rows used for training and evaluation
 * @author Retraining Team
 */
public record CandidateModel(
        ModelTask task,
        byte[] state,
        Map<String, Double> metrics,
        int trainingSamples
) {

    public CandidateModel {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(state, "state");
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    /**
     * @return primary metric value, NaN when the trainer did not report it
     */
    public double primaryMetric() {
        Double value = metrics.get(task.getPrimaryMetric());
        return value == null ? Double.NaN : value;
    }
}
