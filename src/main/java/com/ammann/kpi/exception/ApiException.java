/* (C)2026 */
package com.ammann.kpi.exception;

/**
 * Base unchecked exception for all application-level errors in the KPI reporting API.
 *
 * <p>Subclasses represent specific error categories (validation, calendar bounds, metric
 * store failures) and are mapped to appropriate HTTP status codes by
 * {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
    public ApiException(String message) {
        super(message);
    }
}
