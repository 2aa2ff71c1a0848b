package com.aicommerce.retraining.domain.model;

import java.util.Map;

/**
 * Status of the retraining service as reported to the control surface.
 *
 * @param state lifecycle snapshot
 * @param tasks data progress per task
 * @author Retraining Team
 */
public record RetrainingStatus(ServiceState state, Map<ModelTask, TaskProgress> tasks) {

    public RetrainingStatus {
        tasks = Map.copyOf(tasks);
    }

    /**
     * @param newSampleCount records since the task's last successful retrain, null if the data store is unavailable
     * @param minNewSamples configured sample trigger
     * @param productionVersion current production version, null if never trained
     * @param retraining whether a retrain for the task is in flight
     */
    public record TaskProgress(
            Long newSampleCount,
            int minNewSamples,
            Long productionVersion,
            boolean retraining
    ) {

        /**
         * Fraction of the sample trigger reached, capped at 1.0; null when unknown.
         */
        public Double progress() {
            if (newSampleCount == null) {
                return null;
            }
            return Math.min(1.0, (double) newSampleCount / minNewSamples);
        }
    }
}
