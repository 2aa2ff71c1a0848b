package com.aicommerce.retraining.api.dto;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Body of every non-2xx response of the retraining and model endpoints.
 * {@code details} carries error-specific context: the affected task, whether a
 * 409 is {@code retryable}, the model version that failed to load, or
 * {@code fieldErrors} of a rejected request.
 *
 * @author Retraining Team
 */
@Getter
@Setter
public class ErrorResponse {

    private Instant timestamp;
    private Integer status;
    private String error;
    private String message;
    private String path;
    private Map<String, Object> details;

    public ErrorResponse() {
        this.timestamp = Instant.now();
        this.details = new HashMap<>();
    }

    public ErrorResponse(Integer status, String error, String message, String path) {
        this();
        this.status = status;
        this.error = error;
        this.message = message;
        this.path = path;
    }

    /**
     * Attach one entry to {@code details}; returns this response.
     */
    public ErrorResponse addDetail(String key, Object value) {
        this.details.put(key, value);
        return this;
    }
}
