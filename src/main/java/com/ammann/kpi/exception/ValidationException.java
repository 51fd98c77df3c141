/* (C)2026 */
package com.ammann.kpi.exception;

/**
 * Exception indicating that a client-supplied parameter or payload does not meet
 * the required constraints for the requested operation.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 * Provides factory methods for common validation failure patterns.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for a required field that was not supplied.
     */
    public static ValidationException missingField(String fieldName) {
        return new ValidationException(
                String.format("Missing required field '%s'", fieldName));
    }
}
