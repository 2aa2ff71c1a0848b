package com.aicommerce.retraining.exception;

import com.aicommerce.retraining.domain.model.ModelTask;

/**
 * Thrown when a stored model artifact cannot be turned back into a usable model.
 *
 * @author Retraining Team
 */
public class ModelLoadException extends RuntimeException {

    private final ModelTask task;
    private final long version;

    public ModelLoadException(ModelTask task, long version, Throwable cause) {
        super(String.format("Failed to load %s model v%d", task, version), cause);
        this.task = task;
        this.version = version;
    }

    public ModelTask getTask() {
        return task;
    }

    public long getVersion() {
        return version;
    }
}
