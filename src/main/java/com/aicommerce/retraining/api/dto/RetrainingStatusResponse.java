package com.aicommerce.retraining.api.dto;

import com.aicommerce.retraining.domain.model.ModelTask;
import com.aicommerce.retraining.domain.model.RetrainingStatus;
import com.aicommerce.retraining.domain.model.ServiceState;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response DTO for the retraining service status.
 *
 * @author Retraining Team
 */
public class RetrainingStatusResponse {

    private Boolean running;
    private Instant lastCheckAt;
    private Instant lastRetrainAt;
    private Map<String, TaskStatus> tasks;

    public RetrainingStatusResponse() {
    }

    /**
     * Create response from the orchestrator's status.
     *
     * @param status Retraining status
     * @return RetrainingStatusResponse
     */
    public static RetrainingStatusResponse fromStatus(RetrainingStatus status) {
        ServiceState state = status.state();

        RetrainingStatusResponse response = new RetrainingStatusResponse();
        response.setRunning(state.isRunning());
        response.setLastCheckAt(state.getLastCheckAt());
        response.setLastRetrainAt(state.getLastRetrainAt());

        Map<String, TaskStatus> tasks = new LinkedHashMap<>();
        for (ModelTask task : ModelTask.values()) {
            RetrainingStatus.TaskProgress progress = status.tasks().get(task);
            TaskStatus taskStatus = new TaskStatus();
            taskStatus.setLastRetrainAt(state.task(task).lastRetrainAt());
            if (progress != null) {
                taskStatus.setNewSampleCount(progress.newSampleCount());
                taskStatus.setMinNewSamples(progress.minNewSamples());
                taskStatus.setProgress(progress.progress());
                taskStatus.setProductionVersion(progress.productionVersion());
                taskStatus.setRetraining(progress.retraining());
            }
            tasks.put(task.name(), taskStatus);
        }
        response.setTasks(tasks);

        return response;
    }

    // Getters and setters
    public Boolean getRunning() {
        return running;
    }

    public void setRunning(Boolean running) {
        this.running = running;
    }

    public Instant getLastCheckAt() {
        return lastCheckAt;
    }

    public void setLastCheckAt(Instant lastCheckAt) {
        this.lastCheckAt = lastCheckAt;
    }

    public Instant getLastRetrainAt() {
        return lastRetrainAt;
    }

    public void setLastRetrainAt(Instant lastRetrainAt) {
        this.lastRetrainAt = lastRetrainAt;
    }

    public Map<String, TaskStatus> getTasks() {
        return tasks;
    }

    public void setTasks(Map<String, TaskStatus> tasks) {
        this.tasks = tasks;
    }

    /**
     * Per-task portion of the status.
     */
    public static class TaskStatus {

        private Instant lastRetrainAt;
        private Long newSampleCount;
        private Integer minNewSamples;
        private Double progress;
        private Long productionVersion;
        private Boolean retraining;

        public Instant getLastRetrainAt() {
            return lastRetrainAt;
        }

        public void setLastRetrainAt(Instant lastRetrainAt) {
            this.lastRetrainAt = lastRetrainAt;
        }

        public Long getNewSampleCount() {
            return newSampleCount;
        }

        public void setNewSampleCount(Long newSampleCount) {
            this.newSampleCount = newSampleCount;
        }

        public Integer getMinNewSamples() {
            return minNewSamples;
        }

        public void setMinNewSamples(Integer minNewSamples) {
            this.minNewSamples = minNewSamples;
        }

        public Double getProgress() {
            return progress;
        }

        public void setProgress(Double progress) {
            this.progress = progress;
        }

        public Long getProductionVersion() {
            return productionVersion;
        }

        public void setProductionVersion(Long productionVersion) {
            this.productionVersion = productionVersion;
        }

        public Boolean getRetraining() {
            return retraining;
        }

        public void setRetraining(Boolean retraining) {
            this.retraining = retraining;
        }
    }
}
