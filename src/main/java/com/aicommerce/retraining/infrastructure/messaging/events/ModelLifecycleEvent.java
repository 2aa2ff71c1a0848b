package com.aicommerce.retraining.infrastructure.messaging.events;

import com.aicommerce.retraining.domain.model.ModelTask;

import java.time.Instant;
import java.util.Map;

/**
 * Event published when the production model of a task changes.
 * Serving replicas consume it to reload the artifact for the task.
 *
 * Event Types:
 * - PROMOTED: a validated candidate became production
 * - ROLLED_BACK: production was manually reverted to a backup
 *
 * @author Retraining Team
 */
public class ModelLifecycleEvent {

    private ModelTask task;
    private EventType eventType;
    private Long previousVersion;
    private Long productionVersion;
    private Map<String, Double> metrics;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public ModelLifecycleEvent() {
    }

    public ModelLifecycleEvent(
            ModelTask task,
            EventType eventType,
            Long previousVersion,
            Long productionVersion,
            Map<String, Double> metrics
    ) {
        this.task = task;
        this.eventType = eventType;
        this.previousVersion = previousVersion;
        this.productionVersion = productionVersion;
        this.metrics = metrics;
        this.timestamp = Instant.now();
    }

    // Getters and setters
    public ModelTask getTask() {
        return task;
    }

    public void setTask(ModelTask task) {
        this.task = task;
    }

    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public Long getPreviousVersion() {
        return previousVersion;
    }

    public void setPreviousVersion(Long previousVersion) {
        this.previousVersion = previousVersion;
    }

    public Long getProductionVersion() {
        return productionVersion;
    }

    public void setProductionVersion(Long productionVersion) {
        this.productionVersion = productionVersion;
    }

    public Map<String, Double> getMetrics() {
        return metrics;
    }

    public void setMetrics(Map<String, Double> metrics) {
        this.metrics = metrics;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public enum EventType {
        PROMOTED,
        ROLLED_BACK
    }

    @Override
    public String toString() {
        return "ModelLifecycleEvent{" +
                "task=" + task +
                ", eventType=" + eventType +
                ", previousVersion=" + previousVersion +
                ", productionVersion=" + productionVersion +
                ", timestamp=" + timestamp +
                '}';
    }
}
