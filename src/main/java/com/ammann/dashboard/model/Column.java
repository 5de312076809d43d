/* (C)2026 */
package com.ammann.dashboard.model;

import com.ammann.dashboard.enumeration.ColumnKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A cleaned column: a name, its inferred kind and its values.
 *
 * <p>Values never contain {@code null}. Their Java type follows the kind: {@link Double}
 * for {@link ColumnKind#NUMERIC}, {@link String} for {@link ColumnKind#CATEGORICAL} and
 * {@link Instant} for {@link ColumnKind#TEMPORAL}.
 *
 * @param name   column name
 * @param kind   inferred semantic kind
 * @param values cell values in row order
 */
public record Column(String name, ColumnKind kind, List<Object> values)
{
    public Column
    {
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public int size()
    {
        return values.size();
    }

    /**
     * Returns the values of a numeric column as primitive doubles.
     *
     * @throws IllegalStateException if the column is not numeric
     */
    public double[] numericValues()
    {
        requireKind(ColumnKind.NUMERIC);
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = ((Number) values.get(i)).doubleValue();
        }
        return result;
    }

    /**
     * Returns the values of a temporal column.
     *
     * @throws IllegalStateException if the column is not temporal
     */
    public List<Instant> temporalValues()
    {
        requireKind(ColumnKind.TEMPORAL);
        List<Instant> result = new ArrayList<>(values.size());
        for (Object value : values) {
            result.add((Instant) value);
        }
        return result;
    }

    private void requireKind(ColumnKind expected)
    {
        if (kind != expected) {
            throw new IllegalStateException(String.format(
                    "Column '%s' is %s, not %s", name, kind.getLabel(), expected.getLabel()));
        }
    }
}
