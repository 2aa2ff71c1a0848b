package com.aicommerce.retraining.exception;

import com.aicommerce.retraining.domain.model.ModelTask;

/**
 * Thrown when a caller asks to retrain or roll back a task while another
 * retrain for the same task is in flight. The condition is transient and the
 * caller may retry once the running attempt completes.
 *
 * @author Retraining Team
 */
public class RetrainInProgressException extends RuntimeException {

    private final ModelTask task;

    public RetrainInProgressException(ModelTask task) {
        super(String.format("A retrain for task %s is already in progress", task));
        this.task = task;
    }

    public ModelTask getTask() {
        return task;
    }
}
