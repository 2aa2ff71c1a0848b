package com.aicommerce.retraining.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for forcing a retrain of one task.
 *
 * @author Retraining Team
 */
public class ForceRetrainRequest {

    @NotBlank(message = "Task is required")
    private String task;

    public ForceRetrainRequest() {
    }

    public ForceRetrainRequest(String task) {
        this.task = task;
    }

    public String getTask() {
        return task;
    }

    public void setTask(String task) {
        this.task = task;
    }
}
