package com.aicommerce.retraining.domain.model;

/**
 * Result of one retrain attempt.
 *
 * @param record the appended performance record
 * @param auditPersisted false when the record could not be written to durable storage
 *                       even after a retry; the record is still in the in-memory log
 * @author Retraining Team
 */
public record RetrainOutcome(PerformanceRecord record, boolean auditPersisted) {

    public RetrainDecision decision() {
        return record.getDecision();
    }

    public boolean promoted() {
        return record.getDecision() == RetrainDecision.PROMOTED;
    }
}
