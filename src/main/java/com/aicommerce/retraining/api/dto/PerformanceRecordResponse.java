package com.aicommerce.retraining.api.dto;

import com.aicommerce.retraining.domain.model.PerformanceRecord;
import com.aicommerce.retraining.domain.model.RetrainOutcome;

import java.time.Instant;

/**
 * Response DTO for one retrain decision.
 *
 * @author Retraining Team
 */
public class PerformanceRecordResponse {

    private String recordId;
    private Instant timestamp;
    private String task;
    private String trigger;
    private Long previousVersion;
    private Long candidateVersion;
    private Double previousMetric;
    private Double candidateMetric;
    private String decision;
    private String reason;
    private Boolean auditPersisted;

    public PerformanceRecordResponse() {
    }

    /**
     * Create response from a stored record. {@code auditPersisted} is left null.
     *
     * @param record Performance record
     * @return PerformanceRecordResponse
     */
    public static PerformanceRecordResponse fromEntity(PerformanceRecord record) {
        PerformanceRecordResponse response = new PerformanceRecordResponse();
        response.setRecordId(record.getRecordId());
        response.setTimestamp(record.getTimestamp());
        response.setTask(record.getTask().name());
        response.setTrigger(record.getTrigger().name());
        response.setPreviousVersion(record.getPreviousVersion());
        response.setCandidateVersion(record.getCandidateVersion());
        response.setPreviousMetric(record.getPreviousMetric());
        response.setCandidateMetric(record.getCandidateMetric());
        response.setDecision(record.getDecision().name());
        response.setReason(record.getReason());
        return response;
    }

    /**
     * Create response from the outcome of an attempt made by this request.
     *
     * @param outcome Retrain outcome
     * @return PerformanceRecordResponse
     */
    public static PerformanceRecordResponse fromOutcome(RetrainOutcome outcome) {
        PerformanceRecordResponse response = fromEntity(outcome.record());
        response.setAuditPersisted(outcome.auditPersisted());
        return response;
    }

    // Getters and setters
    public String getRecordId() {
        return recordId;
    }

    public void setRecordId(String recordId) {
        this.recordId = recordId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getTask() {
        return task;
    }

    public void setTask(String task) {
        this.task = task;
    }

    public String getTrigger() {
        return trigger;
    }

    public void setTrigger(String trigger) {
        this.trigger = trigger;
    }

    public Long getPreviousVersion() {
        return previousVersion;
    }

    public void setPreviousVersion(Long previousVersion) {
        this.previousVersion = previousVersion;
    }

    public Long getCandidateVersion() {
        return candidateVersion;
    }

    public void setCandidateVersion(Long candidateVersion) {
        this.candidateVersion = candidateVersion;
    }

    public Double getPreviousMetric() {
        return previousMetric;
    }

    public void setPreviousMetric(Double previousMetric) {
        this.previousMetric = previousMetric;
    }

    public Double getCandidateMetric() {
        return candidateMetric;
    }

    public void setCandidateMetric(Double candidateMetric) {
        this.candidateMetric = candidateMetric;
    }

    public String getDecision() {
        return decision;
    }

    public void setDecision(String decision) {
        this.decision = decision;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public Boolean getAuditPersisted() {
        return auditPersisted;
    }

    public void setAuditPersisted(Boolean auditPersisted) {
        this.auditPersisted = auditPersisted;
    }
}
