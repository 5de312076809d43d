/* (C)2026 */
package com.ammann.dashboard.service;

import com.ammann.dashboard.enumeration.ColumnKind;
import com.ammann.dashboard.model.CleanedTable;
import com.ammann.dashboard.model.Column;
import com.ammann.dashboard.model.RawTable;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Turns a {@link RawTable} into a {@link CleanedTable}.
 *
 * <p>Processing order:
 * <ol>
 *   <li>normalize missing markers to {@code null} and coerce each column to a kind</li>
 *   <li>drop all-missing rows, then all-missing columns</li>
 *   <li>drop exact duplicate rows, keeping the first occurrence</li>
 *   <li>impute: median for numeric and temporal columns, mode (or {@value #UNKNOWN_FILL_VALUE})
 *       for everything else</li>
 *   <li>promote text columns whose every value parses as a date/time to temporal</li>
 *   <li>drop duplicate rows created by imputation or promotion</li>
 * </ol>
 *
 * <p>Cleaning never fails on a structurally valid table: a column that cannot be coerced keeps
 * its text representation.
 */
@ApplicationScoped
public class DataCleaningService {

    private static final Logger LOG = Logger.getLogger(DataCleaningService.class);

    static final String UNKNOWN_FILL_VALUE = "Unknown";

    static final Set<String> MISSING_MARKERS = Set.of(
            "NA", "N/A", "n/a", "NaN", "nan", "-NaN", "null", "NULL", "None", "#N/A", "<NA>");

    private static final Pattern DECIMAL =
            Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    private static final List<DateTimeFormatter> LOCAL_DATE_TIME_FORMATTERS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            strict("uuuu-MM-dd HH:mm:ss"),
            strict("uuuu-MM-dd HH:mm"),
            strict("uuuu/MM/dd HH:mm:ss"),
            strict("dd-MM-uuuu HH:mm:ss"));

    private static final List<DateTimeFormatter> LOCAL_DATE_FORMATTERS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            strict("uuuu/MM/dd"),
            strict("MM/dd/uuuu"));

    private static final List<Function<String, Instant>> INSTANT_PARSERS = instantParsers();

    private final StatisticsService statistics;

    @Inject
    public DataCleaningService(StatisticsService statistics) {
        this.statistics = statistics;
    }

    /**
     * Cleans a raw table.
     *
     * @param raw structurally valid raw table
     * @return cleaned table; empty if every cell was missing
     */
    public CleanedTable clean(RawTable raw) {
        List<WorkingColumn> columns = new ArrayList<>(raw.columnCount());
        for (RawTable.RawColumn rawColumn : raw.columns()) {
            columns.add(coerce(rawColumn));
        }
        int rowCount = raw.rowCount();

        List<Integer> rows = nonEmptyRows(columns, rowCount);
        int emptyRows = rowCount - rows.size();
        columns = project(columns, rows);

        int columnsBefore = columns.size();
        columns = columns.stream().filter(WorkingColumn::hasObservedValue).toList();
        int emptyColumns = columnsBefore - columns.size();

        if (columns.isEmpty()) {
            LOG.infof("All %d rows and %d columns are empty, returning empty table",
                    rowCount, raw.columnCount());
            return CleanedTable.empty();
        }

        int beforeDedup = columns.get(0).values.size();
        columns = dropDuplicateRows(columns);
        int duplicates = beforeDedup - columns.get(0).values.size();

        for (WorkingColumn column : columns) {
            impute(column);
        }
        for (WorkingColumn column : columns) {
            promoteToTemporal(column);
        }

        int beforeFinalDedup = columns.get(0).values.size();
        columns = dropDuplicateRows(columns);
        duplicates += beforeFinalDedup - columns.get(0).values.size();

        List<Column> cleaned = columns.stream()
                .map(c -> new Column(c.name, c.kind, c.values))
                .toList();
        int cleanedRows = cleaned.get(0).size();

        LOG.infof("Cleaned table: %d rows x %d columns (removed %d empty rows, %d empty columns, %d duplicate rows)",
                cleanedRows, cleaned.size(), emptyRows, emptyColumns, duplicates);

        return new CleanedTable(cleaned, cleanedRows);
    }

    /**
     * Returns {@code true} if the cell counts as missing: {@code null}, a NaN float, a blank
     * string or one of the conventional NA markers.
     */
    static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double d) {
            return d.isNaN();
        }
        if (value instanceof Float f) {
            return f.isNaN();
        }
        if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            return trimmed.isEmpty() || MISSING_MARKERS.contains(trimmed);
        }
        return false;
    }

    /**
     * Attempts to parse text as a date or date-time, interpreting local values as UTC.
     *
     * @param text candidate value
     * @return parsed instant, or empty if no supported format matches
     */
    static Optional<Instant> parseInstant(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        return INSTANT_PARSERS.stream()
                .map(parser -> tryParse(trimmed, parser))
                .flatMap(Optional::stream)
                .findFirst();
    }

    private static Optional<Instant> tryParse(String text, Function<String, Instant> parser) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private WorkingColumn coerce(RawTable.RawColumn rawColumn) {
        List<Object> values = new ArrayList<>(rawColumn.values().size());
        boolean allNumeric = true;
        boolean allBoolean = true;
        boolean allTemporal = true;
        boolean anyObserved = false;

        for (Object value : rawColumn.values()) {
            if (isMissing(value)) {
                values.add(null);
                continue;
            }
            anyObserved = true;
            values.add(value);
            allNumeric &= isFiniteNumber(value);
            allBoolean &= value instanceof Boolean;
            allTemporal &= isTemporalObject(value);
        }

        ColumnKind kind;
        if (!anyObserved) {
            kind = ColumnKind.UNKNOWN;
        } else if (allNumeric) {
            kind = ColumnKind.NUMERIC;
        } else if (allTemporal) {
            kind = ColumnKind.TEMPORAL;
        } else if (allBoolean) {
            kind = ColumnKind.UNKNOWN;
        } else {
            kind = ColumnKind.CATEGORICAL;
        }

        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (value != null) {
                values.set(i, convert(value, kind));
            }
        }
        return new WorkingColumn(rawColumn.name(), kind, values);
    }

    private static Object convert(Object value, ColumnKind kind) {
        return switch (kind) {
            case NUMERIC -> value instanceof Number n
                    ? Double.valueOf(n.doubleValue())
                    : Double.valueOf(value.toString().trim());
            case TEMPORAL -> toInstant(value);
            case CATEGORICAL -> value.toString();
            case UNKNOWN -> value;
        };
    }

    /** Numbers and decimal texts qualify only when their double value is finite. */
    private static boolean isFiniteNumber(Object value) {
        if (value instanceof Number n) {
            return Double.isFinite(n.doubleValue());
        }
        if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            return DECIMAL.matcher(trimmed).matches() && Double.isFinite(Double.parseDouble(trimmed));
        }
        return false;
    }

    private static boolean isTemporalObject(Object value) {
        return value instanceof Instant
                || value instanceof LocalDate
                || value instanceof LocalDateTime
                || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime
                || value instanceof Date;
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toInstant();
        }
        if (value instanceof ZonedDateTime dateTime) {
            return dateTime.toInstant();
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        throw new IllegalArgumentException("Not a temporal value: " + value.getClass().getName());
    }

    private static List<Integer> nonEmptyRows(List<WorkingColumn> columns, int rowCount) {
        List<Integer> rows = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            for (WorkingColumn column : columns) {
                if (column.values.get(r) != null) {
                    rows.add(r);
                    break;
                }
            }
        }
        return rows;
    }

    private static List<WorkingColumn> project(List<WorkingColumn> columns, List<Integer> rows) {
        List<WorkingColumn> projected = new ArrayList<>(columns.size());
        for (WorkingColumn column : columns) {
            List<Object> values = new ArrayList<>(rows.size());
            for (int row : rows) {
                values.add(column.values.get(row));
            }
            projected.add(new WorkingColumn(column.name, column.kind, values));
        }
        return projected;
    }

    private static List<WorkingColumn> dropDuplicateRows(List<WorkingColumn> columns) {
        int rowCount = columns.get(0).values.size();
        Set<List<Object>> seen = new HashSet<>();
        List<Integer> keep = new ArrayList<>(rowCount);

        for (int r = 0; r < rowCount; r++) {
            List<Object> key = new ArrayList<>(columns.size());
            for (WorkingColumn column : columns) {
                key.add(column.values.get(r));
            }
            if (seen.add(key)) {
                keep.add(r);
            }
        }

        return keep.size() == rowCount ? columns : project(columns, keep);
    }

    private void impute(WorkingColumn column) {
        List<Object> observed = column.values.stream().filter(v -> v != null).toList();
        if (observed.size() == column.values.size()) {
            return;
        }

        Object fill = switch (column.kind) {
            case NUMERIC -> statistics.median(observed.stream()
                    .mapToDouble(v -> (Double) v)
                    .toArray());
            case TEMPORAL -> medianInstant(observed);
            case CATEGORICAL, UNKNOWN -> statistics.mode(observed).orElse(UNKNOWN_FILL_VALUE);
        };

        long filled = 0;
        for (int i = 0; i < column.values.size(); i++) {
            if (column.values.get(i) == null) {
                column.values.set(i, fill);
                filled++;
            }
        }
        LOG.debugf("Filled %d missing cells in %s column '%s' with %s",
                filled, column.kind.getLabel(), column.name, fill);
    }

    private static Instant medianInstant(List<Object> observed) {
        List<Instant> sorted = observed.stream().map(v -> (Instant) v).sorted().toList();
        int middle = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(middle);
        }
        Instant lower = sorted.get(middle - 1);
        Instant upper = sorted.get(middle);
        return lower.plus(Duration.between(lower, upper).dividedBy(2));
    }

    private static void promoteToTemporal(WorkingColumn column) {
        if (column.kind != ColumnKind.CATEGORICAL) {
            return;
        }

        List<Object> parsed = new ArrayList<>(column.values.size());
        for (Object value : column.values) {
            Optional<Instant> instant = parseInstant(value.toString());
            if (instant.isEmpty()) {
                LOG.debugf("Column '%s' kept as categorical: '%s' is not a date/time", column.name, value);
                return;
            }
            parsed.add(instant.get());
        }

        column.kind = ColumnKind.TEMPORAL;
        column.values.clear();
        column.values.addAll(parsed);
        LOG.debugf("Column '%s' promoted to temporal (%d values)", column.name, parsed.size());
    }

    private static List<Function<String, Instant>> instantParsers() {
        List<Function<String, Instant>> parsers = new ArrayList<>();
        parsers.add(Instant::parse);
        parsers.add(text -> OffsetDateTime.parse(text).toInstant());
        parsers.add(text -> ZonedDateTime.parse(text).toInstant());
        for (DateTimeFormatter formatter : LOCAL_DATE_TIME_FORMATTERS) {
            parsers.add(text -> LocalDateTime.parse(text, formatter).toInstant(ZoneOffset.UTC));
        }
        for (DateTimeFormatter formatter : LOCAL_DATE_FORMATTERS) {
            parsers.add(text -> LocalDate.parse(text, formatter).atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        return List.copyOf(parsers);
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    /** Mutable column state used while a single table is being cleaned. */
    private static final class WorkingColumn {
        private final String name;
        private ColumnKind kind;
        private final List<Object> values;

        private WorkingColumn(String name, ColumnKind kind, List<Object> values) {
            this.name = name;
            this.kind = kind;
            this.values = values;
        }

        private boolean hasObservedValue() {
            return values.stream().anyMatch(v -> v != null);
        }
    }
}
