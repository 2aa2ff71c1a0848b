package com.aicommerce.retraining.domain.model;

/**
 * Lifecycle of the retraining loop.
 * STOPPED --start()--> RUNNING --stop()--> STOPPED
 */
public enum LifecycleState {
    STOPPED,
    RUNNING
}
