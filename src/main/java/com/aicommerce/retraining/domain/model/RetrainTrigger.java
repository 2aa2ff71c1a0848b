package com.aicommerce.retraining.domain.model;

/**
 * What started a retrain attempt.
 */
public enum RetrainTrigger {
    SCHEDULED,
    FORCED,
    MANUAL_ROLLBACK
}
