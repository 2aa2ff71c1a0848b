package com.aicommerce.retraining.exception;

import com.aicommerce.retraining.domain.model.ModelTask;

/**
 * Thrown when a manual rollback is requested but no backup artifact is retained for the task.
 *
 * @author Retraining Team
 */
public class NoRollbackTargetException extends RuntimeException {

    private final ModelTask task;

    public NoRollbackTargetException(ModelTask task) {
        super(String.format("No backup version available to roll back task %s", task));
        this.task = task;
    }

    public ModelTask getTask() {
        return task;
    }
}
