/* (C)2026 */
package com.ammann.dashboard.exception;

/**
 * Exception indicating that a table handed to the analysis pipeline is structurally
 * malformed, such as duplicate column names or columns of different lengths.
 *
 * <p>Never recovered inside the pipeline. Mapped to HTTP 422 (Unprocessable Entity) by
 * {@link GlobalExceptionHandler}.
 */
public class UnsupportedInputException extends ApiException {

    public UnsupportedInputException(String message) {
        super(message);
    }

    public UnsupportedInputException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates exception for a column name that occurs more than once.
     */
    public static UnsupportedInputException duplicateColumn(String name) {
        return new UnsupportedInputException(
                String.format("Duplicate column name '%s'", name));
    }

    /**
     * Creates exception for a column whose length differs from the first column.
     */
    public static UnsupportedInputException raggedColumn(String name, int expected, int actual) {
        return new UnsupportedInputException(
                String.format("Column '%s' has %d values, expected %d", name, actual, expected));
    }
}
