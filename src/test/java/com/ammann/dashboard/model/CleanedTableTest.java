/* (C)2026 */
package com.ammann.dashboard.model;

import static com.ammann.dashboard.support.TestTables.categorical;
import static com.ammann.dashboard.support.TestTables.cleaned;
import static com.ammann.dashboard.support.TestTables.numeric;
import static com.ammann.dashboard.support.TestTables.temporal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.dashboard.enumeration.ColumnKind;
import org.junit.jupiter.api.Test;

class CleanedTableTest {

    private final CleanedTable table = cleaned(
            numeric("n", 1, 2),
            categorical("c", "x", "y"),
            temporal("t", "2024-01-01T00:00:00Z", "2024-01-02T00:00:00Z"),
            numeric("m", 3, 4));

    @Test
    void filtersColumnsByKindInTableOrder() {
        assertThat(table.columnsOfKind(ColumnKind.NUMERIC)).extracting(Column::name).containsExactly("n", "m");
        assertThat(table.columnsOfKind(ColumnKind.UNKNOWN)).isEmpty();
    }

    @Test
    void looksUpColumnsByName() {
        assertThat(table.column("c")).isPresent();
        assertThat(table.column("missing")).isEmpty();
        assertThat(table.columnNames()).containsExactly("n", "c", "t", "m");
    }

    @Test
    void typedAccessorsCheckKind() {
        assertThat(table.column("n").orElseThrow().numericValues()).containsExactly(1.0, 2.0);
        assertThat(table.column("t").orElseThrow().temporalValues()).hasSize(2);
        assertThatThrownBy(() -> table.column("c").orElseThrow().numericValues())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("categorical");
    }

    @Test
    void convertsBackToRawTable() {
        RawTable raw = table.toRawTable();

        assertThat(raw.columnCount()).isEqualTo(4);
        assertThat(raw.rowCount()).isEqualTo(2);
        assertThat(raw.columns().get(1).values()).containsExactly("x", "y");
    }

    @Test
    void emptyTable() {
        assertThat(CleanedTable.empty().isEmpty()).isTrue();
        assertThat(table.isEmpty()).isFalse();
    }
}
