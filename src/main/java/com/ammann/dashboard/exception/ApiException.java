/* (C)2026 */
package com.ammann.dashboard.exception;

/**
 * Base unchecked exception for all application-level errors raised while ingesting or
 * analyzing a dataset.
 *
 * <p>Subclasses represent specific error categories (request validation, malformed tables)
 * and are mapped to HTTP status codes by {@link GlobalExceptionHandler}.
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
