/* (C)2026 */
package com.ammann.dashboard.model;

import com.ammann.dashboard.enumeration.ColumnKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Canonical result of cleaning a {@link RawTable}.
 *
 * <p>Holds no missing values, no all-empty rows or columns and no duplicate rows, and every
 * column carries its final {@link ColumnKind}. Instances are immutable and can be shared
 * between threads without synchronization.
 *
 * @param columns  columns in original left-to-right order
 * @param rowCount number of rows (also tracked for tables without columns)
 */
public record CleanedTable(List<Column> columns, int rowCount)
{
    public CleanedTable
    {
        columns = List.copyOf(columns);
    }

    /** Returns a table with no rows and no columns. */
    public static CleanedTable empty()
    {
        return new CleanedTable(List.of(), 0);
    }

    public int columnCount()
    {
        return columns.size();
    }

    public boolean isEmpty()
    {
        return columns.isEmpty() || rowCount == 0;
    }

    /**
     * Returns the columns of the given kind in table order.
     */
    public List<Column> columnsOfKind(ColumnKind kind)
    {
        return columns.stream().filter(c -> c.kind() == kind).toList();
    }

    public Optional<Column> column(String name)
    {
        return columns.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public List<String> columnNames()
    {
        return columns.stream().map(Column::name).toList();
    }

    /**
     * Converts the table back into raw form so it can be fed through the cleaner again.
     */
    public RawTable toRawTable()
    {
        List<RawTable.RawColumn> raw = new ArrayList<>(columns.size());
        for (Column column : columns) {
            raw.add(new RawTable.RawColumn(column.name(), column.values()));
        }
        return new RawTable(raw);
    }
}
