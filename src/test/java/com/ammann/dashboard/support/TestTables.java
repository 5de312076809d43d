/* (C)2026 */
package com.ammann.dashboard.support;

import com.ammann.dashboard.enumeration.ColumnKind;
import com.ammann.dashboard.model.CleanedTable;
import com.ammann.dashboard.model.Column;
import com.ammann.dashboard.model.RawTable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class TestTables {

    private TestTables() {}

    public static RawTable.RawColumn raw(String name, Object... values) {
        return new RawTable.RawColumn(name, Arrays.asList(values));
    }

    public static RawTable rawTable(RawTable.RawColumn... columns) {
        return new RawTable(List.of(columns));
    }

    /** sales with one NaN, region with one null, date as ISO text. */
    public static RawTable salesTable() {
        return rawTable(
                raw("sales", 10, 20, Double.NaN, 40),
                raw("region", "N", "S", "N", null),
                raw("date", "2023-01-01", "2023-01-02", "2023-01-03", "2023-01-04"));
    }

    public static Column numeric(String name, double... values) {
        List<Object> boxed = new ArrayList<>(values.length);
        for (double value : values) {
            boxed.add(value);
        }
        return new Column(name, ColumnKind.NUMERIC, boxed);
    }

    public static Column categorical(String name, String... values) {
        return new Column(name, ColumnKind.CATEGORICAL, new ArrayList<>(Arrays.asList(values)));
    }

    public static Column temporal(String name, String... isoInstants) {
        List<Object> instants = new ArrayList<>(isoInstants.length);
        for (String text : isoInstants) {
            instants.add(Instant.parse(text));
        }
        return new Column(name, ColumnKind.TEMPORAL, instants);
    }

    public static CleanedTable cleaned(Column... columns) {
        int rows = columns.length == 0 ? 0 : columns[0].size();
        return new CleanedTable(List.of(columns), rows);
    }

    /** {@code count} numeric columns n0..n(count-1), each with {@code rows} distinct values. */
    public static List<Column> numericColumns(int count, int rows) {
        List<Column> columns = new ArrayList<>(count);
        for (int c = 0; c < count; c++) {
            double[] values = new double[rows];
            for (int r = 0; r < rows; r++) {
                values[r] = (r + 1) * (c + 1) + (r % 3) * c;
            }
            columns.add(numeric("n" + c, values));
        }
        return columns;
    }

    /** {@code count} categorical columns c0..c(count-1) cycling through a few labels. */
    public static List<Column> categoricalColumns(int count, int rows) {
        List<Column> columns = new ArrayList<>(count);
        for (int c = 0; c < count; c++) {
            String[] values = new String[rows];
            for (int r = 0; r < rows; r++) {
                values[r] = "v" + ((r + c) % 4);
            }
            columns.add(categorical("c" + c, values));
        }
        return columns;
    }
}
