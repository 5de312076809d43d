/* (C)2026 */
package com.ammann.dashboard.model;

import com.ammann.dashboard.exception.UnsupportedInputException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Unprocessed tabular data as handed over by the ingest layer.
 *
 * <p>Columns are kept in declaration order and cells may hold values of any type,
 * including {@code null}. Construction validates the structure only: column names must be
 * non-blank and unique, and all columns must have the same length.
 *
 * @param columns ordered columns of the table
 */
public record RawTable(List<RawColumn> columns)
{
    public RawTable
    {
        columns = List.copyOf(columns);
        Set<String> seen = new HashSet<>();
        int expectedLength = columns.isEmpty() ? 0 : columns.get(0).values().size();
        for (RawColumn column : columns) {
            if (!seen.add(column.name())) {
                throw UnsupportedInputException.duplicateColumn(column.name());
            }
            if (column.values().size() != expectedLength) {
                throw UnsupportedInputException.raggedColumn(
                        column.name(), expectedLength, column.values().size());
            }
        }
    }

    /**
     * Builds a table from a header and row-major cell values. Short rows are padded with
     * {@code null}; rows longer than the header are rejected.
     *
     * @param header column names in order
     * @param rows   row-major cell values
     * @return a new raw table
     */
    public static RawTable fromRows(List<String> header, List<List<Object>> rows)
    {
        List<List<Object>> values = new ArrayList<>(header.size());
        for (int c = 0; c < header.size(); c++) {
            values.add(new ArrayList<>(rows.size()));
        }

        for (int r = 0; r < rows.size(); r++) {
            List<Object> row = rows.get(r);
            if (row.size() > header.size()) {
                throw new UnsupportedInputException(String.format(
                        "Row %d has %d cells but the header declares %d columns",
                        r + 1, row.size(), header.size()));
            }
            for (int c = 0; c < header.size(); c++) {
                values.get(c).add(c < row.size() ? row.get(c) : null);
            }
        }

        List<RawColumn> columns = new ArrayList<>(header.size());
        for (int c = 0; c < header.size(); c++) {
            columns.add(new RawColumn(header.get(c), values.get(c)));
        }
        return new RawTable(columns);
    }

    public int rowCount()
    {
        return columns.isEmpty() ? 0 : columns.get(0).values().size();
    }

    public int columnCount()
    {
        return columns.size();
    }

    /**
     * A named sequence of raw cell values. The value list may contain {@code null}.
     *
     * @param name   column name, unique within the table
     * @param values cell values in row order
     */
    public record RawColumn(String name, List<Object> values)
    {
        public RawColumn
        {
            if (name == null || name.isBlank()) {
                throw new UnsupportedInputException("Column names must not be blank");
            }
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }
    }
}
