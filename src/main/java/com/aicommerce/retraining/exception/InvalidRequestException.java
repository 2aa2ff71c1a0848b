package com.aicommerce.retraining.exception;

/**
 * Exception thrown when a client request names an unknown task or carries an
 * out-of-range parameter. Mapped to 400; other argument errors are server faults.
 *
 * @author Retraining Team
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
