package com.aicommerce.retraining.api.dto;

import com.aicommerce.retraining.domain.model.ModelArtifact;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO describing a stored model artifact. The serialized state itself is not exposed.
 *
 * @author Retraining Team
 */
public class ModelInfoResponse {

    private String task;
    private Long version;
    private String primaryMetric;
    private Double primaryMetricValue;
    private Map<String, Double> metrics;
    private Integer trainingSamples;
    private Integer stateSizeBytes;
    private Instant trainedAt;

    public ModelInfoResponse() {
    }

    public static ModelInfoResponse fromArtifact(ModelArtifact artifact) {
        ModelInfoResponse response = new ModelInfoResponse();
        response.setTask(artifact.getTask().name());
        response.setVersion(artifact.getVersion());
        response.setPrimaryMetric(artifact.getTask().getPrimaryMetric());
        response.setPrimaryMetricValue(artifact.getPrimaryMetric());
        response.setMetrics(artifact.getMetrics());
        response.setTrainingSamples(artifact.getTrainingSamples());
        response.setStateSizeBytes(artifact.getStateSize());
        response.setTrainedAt(artifact.getTrainedAt());
        return response;
    }

    // Getters and setters
    public String getTask() {
        return task;
    }

    public void setTask(String task) {
        this.task = task;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    public String getPrimaryMetric() {
        return primaryMetric;
    }

    public void setPrimaryMetric(String primaryMetric) {
        this.primaryMetric = primaryMetric;
    }

    public Double getPrimaryMetricValue() {
        return primaryMetricValue;
    }

    public void setPrimaryMetricValue(Double primaryMetricValue) {
        this.primaryMetricValue = primaryMetricValue;
    }

    public Map<String, Double> getMetrics() {
        return metrics;
    }

    public void setMetrics(Map<String, Double> metrics) {
        this.metrics = metrics;
    }

    public Integer getTrainingSamples() {
        return trainingSamples;
    }

    public void setTrainingSamples(Integer trainingSamples) {
        this.trainingSamples = trainingSamples;
    }

    public Integer getStateSizeBytes() {
        return stateSizeBytes;
    }

    public void setStateSizeBytes(Integer stateSizeBytes) {
        this.stateSizeBytes = stateSizeBytes;
    }

    public Instant getTrainedAt() {
        return trainedAt;
    }

    public void setTrainedAt(Instant trainedAt) {
        this.trainedAt = trainedAt;
    }
}
