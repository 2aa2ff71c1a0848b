package com.aicommerce.retraining.api.dto;

import com.aicommerce.retraining.domain.model.Prediction;

/**
 * Response DTO for a model score.
 *
 * @author Retraining Team
 */
public class PredictionResponse {

    private String task;
    private Long modelVersion;
    private Double score;

    public PredictionResponse() {
    }

    public static PredictionResponse fromPrediction(Prediction prediction) {
        PredictionResponse response = new PredictionResponse();
        response.setTask(prediction.task().name());
        response.setModelVersion(prediction.version());
        response.setScore(prediction.score());
        return response;
    }

    public String getTask() {
        return task;
    }

    public void setTask(String task) {
        this.task = task;
    }

    public Long getModelVersion() {
        return modelVersion;
    }

    public void setModelVersion(Long modelVersion) {
        this.modelVersion = modelVersion;
    }

    public Double getScore() {
        return score;
    }

    public void setScore(Double score) {
        this.score = score;
    }
}
