package com.aicommerce.retraining.service;

import com.aicommerce.retraining.domain.model.DatasetSnapshot;
import com.aicommerce.retraining.domain.model.ModelTask;
import com.aicommerce.retraining.domain.model.RetrainConfig;
import com.aicommerce.retraining.domain.model.ServiceState;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a task is due for retraining.
 *
 * Fires when either:
 * - at least {@code minNewSamples} new records arrived since the last successful retrain, or
 * - {@code checkIntervalHours} elapsed since the last successful retrain and there is at least one new record.
 *
 * Zero new samples never fires, however stale the model is. A task that was never
 * trained counts as stale.
 *
 * Pure: no I/O, no state.
 *
 * @author Retraining Team
 */
@Component
public class TriggerEvaluator {

    public boolean shouldRetrain(ServiceState state, ModelTask task, DatasetSnapshot snapshot,
                                 RetrainConfig config, Instant now) {
        long newSamples = snapshot.getNewSampleCount();
        if (newSamples >= config.getMinNewSamples()) {
            return true;
        }
        return newSamples > 0 && intervalElapsed(state, task, config, now);
    }

    /**
     * Human-readable reason for the decision returned by {@link #shouldRetrain}.
     */
    public String explain(ServiceState state, ModelTask task, DatasetSnapshot snapshot,
                          RetrainConfig config, Instant now) {
        long newSamples = snapshot.getNewSampleCount();
        if (newSamples >= config.getMinNewSamples()) {
            return String.format("%d new samples (threshold %d)", newSamples, config.getMinNewSamples());
        }
        if (newSamples == 0) {
            return "No new samples since last retrain";
        }
        Instant lastRetrainAt = state.task(task).lastRetrainAt();
        if (intervalElapsed(state, task, config, now)) {
            return String.format("Check interval of %.1fh elapsed with %d new samples",
                    config.getCheckIntervalHours(), newSamples);
        }
        double elapsedHours = Duration.between(lastRetrainAt, now).toMillis() / 3_600_000d;
        return String.format("Only %d new samples (need %d) and %.1fh since last retrain (interval %.1fh)",
                newSamples, config.getMinNewSamples(), elapsedHours, config.getCheckIntervalHours());
    }

    private static boolean intervalElapsed(ServiceState state, ModelTask task, RetrainConfig config, Instant now) {
        Instant lastRetrainAt = state.task(task).lastRetrainAt();
        if (lastRetrainAt == null) {
            return true;
        }
        return Duration.between(lastRetrainAt, now).compareTo(config.getCheckInterval()) >= 0;
    }
}
