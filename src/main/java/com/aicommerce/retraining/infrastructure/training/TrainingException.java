package com.aicommerce.retraining.infrastructure.training;

import com.aicommerce.retraining.domain.model.ModelTask;

/**
 * Raised by a {@link Trainer} when it cannot produce a usable candidate
 * (numerical failure, degenerate labels, library error).
 *
 * @author Retraining Team
 */
public class TrainingException extends Exception {

    private final ModelTask task;

    public TrainingException(ModelTask task, String message) {
        super(message);
        this.task = task;
    }

    public TrainingException(ModelTask task, String message, Throwable cause) {
        super(message, cause);
        this.task = task;
    }

    public ModelTask getTask() {
        return task;
    }
}
