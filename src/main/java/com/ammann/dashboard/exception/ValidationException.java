/* (C)2026 */
package com.ammann.dashboard.exception;

/**
 * Exception indicating that a client request cannot be processed as submitted, for example
 * an unsupported file format or an empty upload.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for a file whose extension is not supported.
     */
    public static ValidationException unsupportedFormat(String filename) {
        return new ValidationException(
                String.format("Unsupported file format: '%s' (expected a .csv, .xlsx or .xls file)", filename));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
