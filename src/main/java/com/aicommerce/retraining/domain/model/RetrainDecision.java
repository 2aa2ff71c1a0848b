package com.aicommerce.retraining.domain.model;

/**
 * Outcome of a retrain attempt as recorded in the performance history.
 */
public enum RetrainDecision {
    /** Candidate replaced the production artifact. */
    PROMOTED,
    /** Candidate discarded, or production manually reverted to a backup. */
    ROLLED_BACK,
    /** No training happened (trigger not met or not enough data). */
    SKIPPED
}
