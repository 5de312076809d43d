/* (C)2026 */
package com.ammann.dashboard.model;

import static com.ammann.dashboard.support.TestTables.raw;
import static com.ammann.dashboard.support.TestTables.rawTable;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.dashboard.exception.UnsupportedInputException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class RawTableTest {

    @Test
    void rejectsDuplicateColumnNames() {
        assertThatThrownBy(() -> rawTable(raw("a", 1), raw("a", 2)))
                .isInstanceOf(UnsupportedInputException.class)
                .hasMessageContaining("Duplicate column name 'a'");
    }

    @Test
    void rejectsRaggedColumns() {
        assertThatThrownBy(() -> rawTable(raw("a", 1, 2), raw("b", 1)))
                .isInstanceOf(UnsupportedInputException.class)
                .hasMessageContaining("Column 'b' has 1 values, expected 2");
    }

    @Test
    void rejectsBlankColumnName() {
        assertThatThrownBy(() -> raw("  ", 1))
                .isInstanceOf(UnsupportedInputException.class);
    }

    @Test
    void fromRowsTransposesAndPads() {
        RawTable table = RawTable.fromRows(
                List.of("x", "y"),
                List.of(Arrays.asList((Object) 1, "a"), List.of((Object) 2)));

        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.columns().get(0).values()).containsExactly(1, 2);
        assertThat(table.columns().get(1).values()).containsExactly("a", null);
    }

    @Test
    void columnValuesAreCopiedAndReadOnly() {
        List<Object> values = new ArrayList<>(List.of("a"));
        RawTable.RawColumn column = new RawTable.RawColumn("c", values);
        values.add("b");

        assertThat(column.values()).containsExactly("a");
        assertThatThrownBy(() -> column.values().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void emptyTableHasNoRows() {
        RawTable table = new RawTable(List.of());

        assertThat(table.rowCount()).isZero();
        assertThat(table.columnCount()).isZero();
    }
}
