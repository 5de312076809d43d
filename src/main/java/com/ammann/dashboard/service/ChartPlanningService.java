/* (C)2026 */
package com.ammann.dashboard.service;

import com.ammann.dashboard.dto.ChartSpecDTO;
import com.ammann.dashboard.enumeration.ChartKind;
import com.ammann.dashboard.enumeration.ColumnKind;
import com.ammann.dashboard.model.CleanedTable;
import com.ammann.dashboard.model.Column;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Decides which charts to draw for a cleaned dataset.
 *
 * <p>Chart families are applied in a fixed order, each gated on the column kinds present:
 * <ol>
 *   <li>distribution: one histogram per numeric column (first N numeric columns)</li>
 *   <li>correlation: one heatmap over all numeric columns, needs two or more</li>
 *   <li>boxplot: one multi-series box plot over the first N numeric columns</li>
 *   <li>categorical: one top-values bar chart per categorical column (first N)</li>
 *   <li>scatter_matrix: one pairwise grid over the first N numeric columns, needs two or more</li>
 *   <li>timeseries: first temporal column against first numeric column</li>
 * </ol>
 *
 * <p>Caps slice the column list in table order. A family whose gate is not met contributes
 * nothing. Caps and the histogram bin count are configurable under {@code dashboard.charts.*};
 * non-positive values fall back to the defaults.
 */
@ApplicationScoped
public class ChartPlanningService {

    private static final Logger LOG = Logger.getLogger(ChartPlanningService.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final int DEFAULT_HISTOGRAM_BINS = 30;
    static final int DEFAULT_MAX_DISTRIBUTION_COLUMNS = 5;
    static final int DEFAULT_MAX_BOXPLOT_COLUMNS = 5;
    static final int DEFAULT_MAX_CATEGORICAL_COLUMNS = 3;
    static final int DEFAULT_CATEGORICAL_TOP_VALUES = 10;
    static final int DEFAULT_MAX_SCATTER_MATRIX_COLUMNS = 4;

    static final String CORRELATION_TITLE = "Correlation Heatmap";
    static final String BOXPLOT_TITLE = "Box Plots - Outlier Detection";
    static final String SCATTER_MATRIX_TITLE = "Scatter Plot Matrix";

    @ConfigProperty(name = "dashboard.charts.histogram-bins", defaultValue = "30")
    int histogramBins = DEFAULT_HISTOGRAM_BINS;

    @ConfigProperty(name = "dashboard.charts.max-distribution-columns", defaultValue = "5")
    int maxDistributionColumns = DEFAULT_MAX_DISTRIBUTION_COLUMNS;

    @ConfigProperty(name = "dashboard.charts.max-boxplot-columns", defaultValue = "5")
    int maxBoxplotColumns = DEFAULT_MAX_BOXPLOT_COLUMNS;

    @ConfigProperty(name = "dashboard.charts.max-categorical-columns", defaultValue = "3")
    int maxCategoricalColumns = DEFAULT_MAX_CATEGORICAL_COLUMNS;

    @ConfigProperty(name = "dashboard.charts.categorical-top-values", defaultValue = "10")
    int categoricalTopValues = DEFAULT_CATEGORICAL_TOP_VALUES;

    @ConfigProperty(name = "dashboard.charts.max-scatter-matrix-columns", defaultValue = "4")
    int maxScatterMatrixColumns = DEFAULT_MAX_SCATTER_MATRIX_COLUMNS;

    private final StatisticsService statistics;

    @Inject
    public ChartPlanningService(StatisticsService statistics) {
        this.statistics = statistics;
    }

    /**
     * Plans the charts for a cleaned table. Deterministic and never fails; the result order is
     * the family order above, and within a family the column order of the table.
     *
     * @param table cleaned table (not modified)
     * @return ordered chart specifications, possibly empty
     */
    public List<ChartSpecDTO> planCharts(CleanedTable table) {
        List<Column> numeric = table.columnsOfKind(ColumnKind.NUMERIC);
        List<Column> categorical = table.columnsOfKind(ColumnKind.CATEGORICAL);
        List<Column> temporal = table.columnsOfKind(ColumnKind.TEMPORAL);

        List<ChartSpecDTO> charts = new ArrayList<>();

        for (Column column : head(numeric, cap(maxDistributionColumns, DEFAULT_MAX_DISTRIBUTION_COLUMNS))) {
            charts.add(distribution(column));
        }
        if (numeric.size() >= 2) {
            charts.add(correlationHeatmap(numeric));
        }
        if (!numeric.isEmpty()) {
            charts.add(boxPlot(head(numeric, cap(maxBoxplotColumns, DEFAULT_MAX_BOXPLOT_COLUMNS))));
        }
        for (Column column : head(categorical, cap(maxCategoricalColumns, DEFAULT_MAX_CATEGORICAL_COLUMNS))) {
            charts.add(categoricalBar(column));
        }
        if (numeric.size() >= 2) {
            charts.add(scatterMatrix(head(numeric,
                    cap(maxScatterMatrixColumns, DEFAULT_MAX_SCATTER_MATRIX_COLUMNS))));
        }
        if (!temporal.isEmpty() && !numeric.isEmpty()) {
            charts.add(timeSeries(temporal.get(0), numeric.get(0)));
        }

        LOG.infof("Planned %d charts for %d numeric, %d categorical, %d temporal columns",
                charts.size(), numeric.size(), categorical.size(), temporal.size());
        return charts;
    }

    /** Chart families in the order the planner applies them. */
    public List<ChartKind> supportedKinds() {
        return List.of(ChartKind.values());
    }

    private ChartSpecDTO distribution(Column column) {
        String title = "Distribution of " + column.name();
        double[] values = column.numericValues();
        StatisticsService.Histogram histogram =
                statistics.histogram(values, cap(histogramBins, DEFAULT_HISTOGRAM_BINS));

        ObjectNode plot = basePlot("histogram", title, 400, 300, false);
        plot.putObject("x").put("field", column.name());
        plot.put("color", "#1f77b4");
        plot.set("values", numbers(values));

        ObjectNode bins = plot.putObject("bins");
        bins.put("count", histogram.counts().length);
        bins.set("edges", numbers(histogram.edges()));
        ArrayNode counts = bins.putArray("counts");
        for (long count : histogram.counts()) {
            counts.add(count);
        }

        return new ChartSpecDTO(ChartKind.DISTRIBUTION, title, plot);
    }

    private ChartSpecDTO correlationHeatmap(List<Column> numeric) {
        Map<String, Map<String, Double>> matrix = statistics.correlationMatrix(numeric);

        ObjectNode plot = basePlot("heatmap", CORRELATION_TITLE, 500, 400, true);
        ArrayNode axis = plot.putArray("x");
        numeric.forEach(c -> axis.add(c.name()));
        plot.set("y", axis.deepCopy());
        ArrayNode z = plot.putArray("z");
        for (Map<String, Double> row : matrix.values()) {
            ArrayNode cells = z.addArray();
            row.values().forEach(cells::add);
        }
        plot.put("colorScale", "RdBu");
        plot.put("zMin", -1.0);
        plot.put("zMax", 1.0);

        return new ChartSpecDTO(ChartKind.CORRELATION, CORRELATION_TITLE, plot);
    }

    private ChartSpecDTO boxPlot(List<Column> columns) {
        ObjectNode plot = basePlot("box", BOXPLOT_TITLE, 600, 400, true);
        ArrayNode series = plot.putArray("series");
        for (Column column : columns) {
            ObjectNode entry = series.addObject();
            entry.put("name", column.name());
            entry.set("values", numbers(column.numericValues()));
        }
        return new ChartSpecDTO(ChartKind.BOXPLOT, BOXPLOT_TITLE, plot);
    }

    private ChartSpecDTO categoricalBar(Column column) {
        int limit = cap(categoricalTopValues, DEFAULT_CATEGORICAL_TOP_VALUES);
        String title = "Top " + limit + " Values in " + column.name();
        LinkedHashMap<Object, Long> counts = statistics.valueCounts(column.values());

        ObjectNode plot = basePlot("bar", title, 400, 300, false);
        ObjectNode x = plot.putObject("x");
        x.put("field", column.name());
        ArrayNode labels = x.putArray("values");
        ObjectNode y = plot.putObject("y");
        y.put("field", "Count");
        ArrayNode heights = y.putArray("values");

        counts.entrySet().stream().limit(limit).forEach(entry -> {
            labels.add(entry.getKey().toString());
            heights.add(entry.getValue());
        });

        return new ChartSpecDTO(ChartKind.CATEGORICAL, title, plot);
    }

    private ChartSpecDTO scatterMatrix(List<Column> columns) {
        ObjectNode plot = basePlot("scatter_matrix", SCATTER_MATRIX_TITLE, 800, 600, false);
        ArrayNode dimensions = plot.putArray("dimensions");
        for (Column column : columns) {
            ObjectNode dimension = dimensions.addObject();
            dimension.put("label", column.name());
            dimension.set("values", numbers(column.numericValues()));
        }
        return new ChartSpecDTO(ChartKind.SCATTER_MATRIX, SCATTER_MATRIX_TITLE, plot);
    }

    private ChartSpecDTO timeSeries(Column timeColumn, Column valueColumn) {
        String title = "Time Series: " + valueColumn.name() + " over " + timeColumn.name();
        List<Instant> times = timeColumn.temporalValues();
        double[] values = valueColumn.numericValues();

        // stable sort keeps row order among equal timestamps
        List<Integer> order = IntStream.range(0, times.size())
                .boxed()
                .sorted(Comparator.comparing(times::get))
                .toList();

        ObjectNode plot = basePlot("line", title, 600, 400, false);
        ObjectNode x = plot.putObject("x");
        x.put("field", timeColumn.name());
        x.put("type", "temporal");
        ArrayNode xValues = x.putArray("values");
        ObjectNode y = plot.putObject("y");
        y.put("field", valueColumn.name());
        ArrayNode yValues = y.putArray("values");
        for (int row : order) {
            xValues.add(times.get(row).toString());
            yValues.add(values[row]);
        }

        return new ChartSpecDTO(ChartKind.TIMESERIES, title, plot);
    }

    private static ObjectNode basePlot(String mark, String title, int width, int height, boolean showLegend) {
        ObjectNode plot = MAPPER.createObjectNode();
        plot.put("mark", mark);
        plot.put("title", title);
        ObjectNode layout = plot.putObject("layout");
        layout.put("width", width);
        layout.put("height", height);
        layout.put("showLegend", showLegend);
        ObjectNode margin = layout.putObject("margin");
        margin.put("l", 20);
        margin.put("r", 20);
        margin.put("t", 40);
        margin.put("b", 20);
        return plot;
    }

    private static ArrayNode numbers(double[] values) {
        ArrayNode array = MAPPER.createArrayNode();
        for (double value : values) {
            array.add(value);
        }
        return array;
    }

    private static List<Column> head(List<Column> columns, int limit) {
        return columns.subList(0, Math.min(limit, columns.size()));
    }

    private static int cap(int configured, int fallback) {
        return configured > 0 ? configured : fallback;
    }
}
