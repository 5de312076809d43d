/* (C)2026 */
package com.ammann.dashboard.service;

import com.ammann.dashboard.dto.CategoricalSummaryDTO;
import com.ammann.dashboard.dto.DatasetInfoDTO;
import com.ammann.dashboard.dto.DatasetProfileDTO;
import com.ammann.dashboard.dto.NumericSummaryDTO;
import com.ammann.dashboard.enumeration.ColumnKind;
import com.ammann.dashboard.model.CleanedTable;
import com.ammann.dashboard.model.Column;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the statistical and structural profile of a cleaned dataset.
 *
 * <p>The profile covers dataset shape and footprint, the inferred kind and missing count of
 * every column, descriptive statistics for numeric columns, a Pearson correlation matrix when
 * at least two numeric columns exist, and frequency tables for categorical columns.
 *
 * <p>The number of values listed per categorical frequency table is configurable via
 * {@code dashboard.profile.categorical-top-values}.
 */
@ApplicationScoped
public class DatasetProfilingService {

    private static final Logger LOG = Logger.getLogger(DatasetProfilingService.class);

    static final int DEFAULT_CATEGORICAL_TOP_VALUES = 5;
    static final double BYTES_PER_MB = 1024.0 * 1024.0;

    // approximate byte costs used for the memory estimate
    static final long INDEX_OVERHEAD_BYTES = 128;
    static final long COLUMN_OVERHEAD_BYTES = 64;
    static final long FIXED_WIDTH_CELL_BYTES = 8;
    static final long TEXT_REFERENCE_BYTES = 8;
    static final long TEXT_HEADER_BYTES = 40;
    static final long BOXED_CELL_BYTES = 16;

    @ConfigProperty(name = "dashboard.profile.categorical-top-values", defaultValue = "5")
    int categoricalTopValues = DEFAULT_CATEGORICAL_TOP_VALUES;

    private final StatisticsService statistics;

    @Inject
    public DatasetProfilingService(StatisticsService statistics) {
        this.statistics = statistics;
    }

    /**
     * Profiles a cleaned table. Never fails on a well-formed table; an empty table yields an
     * empty profile with zero rows and columns.
     *
     * @param table cleaned table (not modified)
     * @return profile snapshot
     */
    public DatasetProfileDTO profile(CleanedTable table) {
        Map<String, ColumnKind> columnTypes = new LinkedHashMap<>();
        Map<String, Long> missingCounts = new LinkedHashMap<>();
        Map<String, NumericSummaryDTO> numericSummary = new LinkedHashMap<>();
        Map<String, CategoricalSummaryDTO> categoricalSummary = new LinkedHashMap<>();

        for (Column column : table.columns()) {
            columnTypes.put(column.name(), column.kind());
            missingCounts.put(column.name(), countMissing(column));

            if (column.kind() == ColumnKind.NUMERIC) {
                numericSummary.put(column.name(),
                        NumericSummaryDTO.from(statistics.describe(column.numericValues())));
            } else if (column.kind() == ColumnKind.CATEGORICAL) {
                categoricalSummary.put(column.name(), summarizeCategorical(column));
            }
        }

        List<Column> numericColumns = table.columnsOfKind(ColumnKind.NUMERIC);
        Map<String, Map<String, Double>> correlations = numericColumns.size() >= 2
                ? statistics.correlationMatrix(numericColumns)
                : Map.of();

        DatasetInfoDTO datasetInfo = new DatasetInfoDTO(
                table.rowCount(), table.columnCount(), estimateMemoryMB(table));

        LOG.infof("Profiled %d rows x %d columns: %d numeric, %d categorical, %.3f MB",
                table.rowCount(), table.columnCount(), numericSummary.size(),
                categoricalSummary.size(), datasetInfo.memoryEstimateMB());

        return new DatasetProfileDTO(
                datasetInfo,
                columnTypes,
                missingCounts,
                numericSummary,
                correlations,
                categoricalSummary);
    }

    /**
     * Approximates the in-memory footprint of all cells in MiB. Grows with every added row
     * and column.
     */
    public double estimateMemoryMB(CleanedTable table) {
        long bytes = INDEX_OVERHEAD_BYTES;
        for (Column column : table.columns()) {
            bytes += COLUMN_OVERHEAD_BYTES;
            for (Object value : column.values()) {
                bytes += cellBytes(column.kind(), value);
            }
        }
        return bytes / BYTES_PER_MB;
    }

    private CategoricalSummaryDTO summarizeCategorical(Column column) {
        LinkedHashMap<Object, Long> counts = statistics.valueCounts(column.values());
        int limit = categoricalTopValues > 0 ? categoricalTopValues : DEFAULT_CATEGORICAL_TOP_VALUES;

        Map<String, Long> topValues = new LinkedHashMap<>();
        for (Map.Entry<Object, Long> entry : counts.entrySet()) {
            if (topValues.size() >= limit) {
                break;
            }
            topValues.put(entry.getKey().toString(), entry.getValue());
        }

        String mostFrequent = counts.isEmpty() ? null : counts.keySet().iterator().next().toString();
        return new CategoricalSummaryDTO(counts.size(), topValues, mostFrequent);
    }

    private static long countMissing(Column column) {
        return column.values().stream().filter(v -> v == null).count();
    }

    private static long cellBytes(ColumnKind kind, Object value) {
        return switch (kind) {
            case NUMERIC, TEMPORAL -> FIXED_WIDTH_CELL_BYTES;
            case CATEGORICAL -> TEXT_REFERENCE_BYTES + TEXT_HEADER_BYTES + 2L * value.toString().length();
            case UNKNOWN -> BOXED_CELL_BYTES;
        };
    }
}
