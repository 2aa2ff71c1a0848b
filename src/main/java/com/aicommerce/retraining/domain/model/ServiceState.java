package com.aicommerce.retraining.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time copy of the orchestrator's lifecycle state.
 * The live state is owned by the orchestrator and only mutated under its state lock;
 * callers only ever see these immutable copies.
 *
 * @author Retraining Team
 */
public final class ServiceState {

    private final LifecycleState lifecycle;
    private final Instant lastCheckAt;
    private final Map<ModelTask, TaskState> tasks;

    public ServiceState(LifecycleState lifecycle, Instant lastCheckAt, Map<ModelTask, TaskState> tasks) {
        this.lifecycle = lifecycle;
        this.lastCheckAt = lastCheckAt;
        Map<ModelTask, TaskState> copy = new EnumMap<>(ModelTask.class);
        for (ModelTask task : ModelTask.values()) {
            copy.put(task, tasks != null && tasks.containsKey(task) ? tasks.get(task) : TaskState.NEVER_TRAINED);
        }
        this.tasks = Collections.unmodifiableMap(copy);
    }

    public LifecycleState getLifecycle() {
        return lifecycle;
    }

    public boolean isRunning() {
        return lifecycle == LifecycleState.RUNNING;
    }

    public Instant getLastCheckAt() {
        return lastCheckAt;
    }

    public Map<ModelTask, TaskState> getTasks() {
        return tasks;
    }

    public TaskState task(ModelTask task) {
        return tasks.get(task);
    }

    /**
     * Most recent successful retrain across all tasks, null if none.
     */
    public Instant getLastRetrainAt() {
        Instant latest = null;
        for (TaskState state : tasks.values()) {
            Instant at = state.lastRetrainAt();
            if (at != null && (latest == null || at.isAfter(latest))) {
                latest = at;
            }
        }
        return latest;
    }

    @Override
    public String toString() {
        return "ServiceState{lifecycle=" + lifecycle + ", lastCheckAt=" + lastCheckAt + ", tasks=" + tasks + '}';
    }

    /**
     * Per-task retrain bookkeeping.
     *
     * @param lastRetrainAt when the last candidate for the task was promoted
     * @param lastDatasetMarker snapshot marker the last promoted candidate was trained on;
     *                          new samples are counted from here
     */
    public record TaskState(Instant lastRetrainAt, Instant lastDatasetMarker) {

        public static final TaskState NEVER_TRAINED = new TaskState(null, null);
    }
}
