package com.aicommerce.retraining.infrastructure.dataset;

import com.aicommerce.retraining.domain.model.DatasetSnapshot;

import java.time.Instant;

/**
 * Source of behavioral training data.
 *
 * @author Retraining Team
 */
public interface DatasetSnapshotProvider {

    /**
     * Take a snapshot of the full dataset.
     *
     * @param since marker of the last successful retrain, null if the task was never trained
     * @return snapshot whose new-sample count covers records after {@code since}
     * @throws com.aicommerce.retraining.exception.DataUnavailableException if the data store cannot be read
     */
    DatasetSnapshot snapshot(Instant since);

    /**
     * Count records newer than the marker without loading the dataset.
     *
     * @param since marker of the last successful retrain, null counts everything
     * @return number of new records
     * @throws com.aicommerce.retraining.exception.DataUnavailableException if the data store cannot be read
     */
    long countNewSamples(Instant since);
}
