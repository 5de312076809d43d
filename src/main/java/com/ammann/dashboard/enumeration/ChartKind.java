/* (C)2026 */
package com.ammann.dashboard.enumeration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Chart families the planner can emit, declared in the order the planner applies them.
 */
public enum ChartKind
{
    DISTRIBUTION("distribution"),
    CORRELATION("correlation"),
    BOXPLOT("boxplot"),
    CATEGORICAL("categorical"),
    SCATTER_MATRIX("scatter_matrix"),
    TIMESERIES("timeseries");

    private final String label;

    ChartKind(String label) {
        this.label = label;
    }

    /**
     * Returns the kind with the given wire label. Used by Jackson when chart specs are read back.
     *
     * @param label lower-case label as used in serialized chart specs
     * @return matching chart kind
     * @throws IllegalArgumentException if no kind carries the label
     */
    @JsonCreator
    public static ChartKind fromLabel(String label) {
        for (ChartKind kind : values()) {
            if (kind.label.equals(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown chart kind: " + label);
    }

    @JsonValue
    public String getLabel() { return label; }
}
