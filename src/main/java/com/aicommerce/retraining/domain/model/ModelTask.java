package com.aicommerce.retraining.domain.model;

import java.util.Locale;

/**
 * Predictive tasks that are retrained independently.
 * Each task declares the metric used to compare candidates against production
 * and whether a larger value of that metric is better.
 *
 * @author Retraining Team
 */
public enum ModelTask {

    /**
     * Churn classification. Compared on hold-out accuracy.
     */
    CHURN("accuracy", true),

    /**
     * Next-period spending regression. Compared on hold-out mean squared error.
     */
    SPENDING("mse", false);

    private final String primaryMetric;
    private final boolean higherIsBetter;

    ModelTask(String primaryMetric, boolean higherIsBetter) {
        this.primaryMetric = primaryMetric;
        this.higherIsBetter = higherIsBetter;
    }

    public String getPrimaryMetric() {
        return primaryMetric;
    }

    public boolean isHigherBetter() {
        return higherIsBetter;
    }

    /**
     * Resolve a task from user input such as {@code "churn"} or {@code "SPENDING"}.
     *
     * @param value task name, case-insensitive
     * @return matching task
     * @throws IllegalArgumentException if the value does not name a task
     */
    public static ModelTask fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Task must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ModelTask task : values()) {
            if (task.name().equals(normalized)) {
                return task;
            }
        }
        throw new IllegalArgumentException("Unknown model task: " + value);
    }
}
