package com.aicommerce.retraining.exception;

/**
 * Thrown when a history record or model artifact cannot be written to durable storage.
 *
 * Targets:
 * - history: performance record insert
 * - artifact: model artifact archive write
 *
 * @author Retraining Team
 */
public class PersistenceFailureException extends RuntimeException {

    private final String target;

    public PersistenceFailureException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
