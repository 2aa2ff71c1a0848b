package com.aicommerce.retraining.api.exception;

import com.aicommerce.retraining.api.dto.ErrorResponse;
import com.aicommerce.retraining.exception.InvalidRequestException;
import com.aicommerce.retraining.exception.ModelLoadException;
import com.aicommerce.retraining.exception.NoRollbackTargetException;
import com.aicommerce.retraining.exception.ResourceNotFoundException;
import com.aicommerce.retraining.exception.RetrainInProgressException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the retraining API.
 * Converts exceptions thrown by controllers to standardized error responses.
 *
 * @author Retraining Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle RetrainInProgressException.
     * Returns 409 CONFLICT; the caller may retry once the in-flight retrain finishes.
     */
    @ExceptionHandler(RetrainInProgressException.class)
    public ResponseEntity<ErrorResponse> handleRetrainInProgressException(
            RetrainInProgressException ex,
            HttpServletRequest request
    ) {
        logger.warn("Retrain busy: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.CONFLICT.value(),
                "Retrain In Progress",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("task", ex.getTask().name());
        error.addDetail("retryable", true);

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle NoRollbackTargetException.
     * Returns 409 CONFLICT when the task has no retained backup.
     */
    @ExceptionHandler(NoRollbackTargetException.class)
    public ResponseEntity<ErrorResponse> handleNoRollbackTargetException(
            NoRollbackTargetException ex,
            HttpServletRequest request
    ) {
        logger.warn("Rollback rejected: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.CONFLICT.value(),
                "No Rollback Target",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("task", ex.getTask().name());
        error.addDetail("retryable", false);

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle ResourceNotFoundException.
     * Returns 404 NOT FOUND, e.g. for a task that has never been trained.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.NOT_FOUND.value(),
                "Resource Not Found",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("resourceType", ex.getResourceType());
        error.addDetail("resourceId", ex.getResourceId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * Handle ModelLoadException.
     * Returns 500 INTERNAL SERVER ERROR when a stored model cannot be used.
     */
    @ExceptionHandler(ModelLoadException.class)
    public ResponseEntity<ErrorResponse> handleModelLoadException(
            ModelLoadException ex,
            HttpServletRequest request
    ) {
        logger.error("Model load failed: {}", ex.getMessage(), ex);

        ErrorResponse error = new ErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Model Unavailable",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("task", ex.getTask().name());
        error.addDetail("version", ex.getVersion());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    /**
     * Handle InvalidRequestException.
     * Returns 400 BAD REQUEST for unknown tasks and out-of-range parameters.
     */
    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequestException(
            InvalidRequestException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid request: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Invalid Request",
                ex.getMessage(),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle malformed request bodies and parameters.
     * Returns 400 BAD REQUEST.
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.warn("Malformed request: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Malformed Request",
                "Request body or parameters could not be read.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle validation errors from @Valid annotation.
     * Returns 400 BAD REQUEST with field-level validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Failed",
                "Request validation failed. Please check the field errors.",
                request.getRequestURI()
        );
        error.addDetail("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);

        ErrorResponse error = new ErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "An unexpected error occurred. Please try again later.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
