package com.aicommerce.retraining.exception;

/**
 * Thrown by a dataset provider when the behavioral data store cannot be read.
 * The current tick is abandoned and retried on the next interval.
 *
 * @author Retraining Team
 */
public class DataUnavailableException extends RuntimeException {

    public DataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
