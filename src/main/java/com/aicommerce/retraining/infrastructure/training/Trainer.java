package com.aicommerce.retraining.infrastructure.training;

import com.aicommerce.retraining.domain.model.CandidateModel;
import com.aicommerce.retraining.domain.model.DatasetSnapshot;
import com.aicommerce.retraining.domain.model.ModelTask;

/**
 * Pluggable training capability.
 *
 * Implementations must be deterministic for a fixed input and report the task's
 * primary metric in its natural unit: accuracy (higher is better) for churn,
 * mean squared error (lower is better) for spending.
 *
 * @author Retraining Team
 */
public interface Trainer {

    /**
     * Train a candidate model for one task.
     *
     * @param task task to train
     * @param snapshot dataset to train and evaluate on
     * @return candidate with serialized state and hold-out metrics
     * @throws InsufficientDataException if the snapshot has too few rows
     * @throws TrainingException if training fails
     */
    CandidateModel train(ModelTask task, DatasetSnapshot snapshot) throws TrainingException;
}
