/* (C)2026 */
package com.ammann.dashboard.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic classification of a dataset column.
 *
 * <p>The kind is decided once while a table is cleaned and carried by the column from then on.
 * It drives both the imputation strategy and which chart families a column is eligible for.
 */
public enum ColumnKind
{
    /** Finite decimal values, held as {@link Double}. */
    NUMERIC("numeric"),
    /** Text labels, held as {@link String}. */
    CATEGORICAL("categorical"),
    /** Parsed points in time, held as {@link java.time.Instant}. */
    TEMPORAL("temporal"),
    /** Values that fit none of the other kinds (for example booleans). */
    UNKNOWN("unknown");

    private final String label;

    ColumnKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() { return label; }
}
