package com.aicommerce.retraining.infrastructure.training;

import com.aicommerce.retraining.domain.model.ModelTask;

/**
 * Raised when the dataset is smaller than the minimum trainable size.
 * Recorded as a skipped attempt rather than a failed one.
 *
 * @author Retraining Team
 */
public class InsufficientDataException extends TrainingException {

    private final int available;
    private final int required;

    public InsufficientDataException(ModelTask task, int available, int required) {
        super(task, String.format("Insufficient data for %s: %d rows available, %d required",
                task, available, required));
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
