/* (C)2026 */
package com.ammann.dashboard.service;

import com.ammann.dashboard.dto.ChartSpecDTO;
import com.ammann.dashboard.dto.DatasetProfileDTO;
import com.ammann.dashboard.dto.UploadSummaryDTO;
import com.ammann.dashboard.enumeration.ColumnKind;
import com.ammann.dashboard.model.CleanedTable;
import com.ammann.dashboard.model.Column;
import com.ammann.dashboard.model.RawTable;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs the full analysis of a raw table: cleaning, then profiling and chart planning.
 *
 * <p>Profiling and chart planning only read the cleaned table. When
 * {@code dashboard.pipeline.parallel-enabled} is true, planning is handed to the
 * {@code analysis-executor} while profiling runs on the calling thread. A saturated executor
 * makes the caller plan the charts itself. The result is the same in every mode.
 *
 * <p>Metrics (registered at startup when a {@link MeterRegistry} is available):
 * <ul>
 *   <li>{@code dataset_analysis_duration} - wall time of one run</li>
 *   <li>{@code dataset_rows_dropped_total} - rows removed by cleaning</li>
 *   <li>{@code dataset_charts_planned_total} - chart specifications emitted</li>
 * </ul>
 */
@ApplicationScoped
public class AnalysisPipelineService {

    private static final Logger LOG = Logger.getLogger(AnalysisPipelineService.class);

    @ConfigProperty(name = "dashboard.pipeline.parallel-enabled", defaultValue = "true")
    boolean parallelEnabled = true;

    private final DataCleaningService cleaningService;
    private final DatasetProfilingService profilingService;
    private final ChartPlanningService chartPlanningService;
    private final ManagedExecutor executor;
    private final MeterRegistry meterRegistry;

    private Timer analysisTimer;
    private Counter rowsDroppedCounter;
    private Counter chartsPlannedCounter;

    @Inject
    public AnalysisPipelineService(
            DataCleaningService cleaningService,
            DatasetProfilingService profilingService,
            ChartPlanningService chartPlanningService,
            @Named("analysis-executor") ManagedExecutor executor,
            MeterRegistry meterRegistry) {
        this.cleaningService = cleaningService;
        this.profilingService = profilingService;
        this.chartPlanningService = chartPlanningService;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Cleans, profiles and plans charts for a raw table and records the run in the analysis
     * metrics.
     *
     * @param raw raw table (not modified)
     * @return cleaned table together with its profile and chart plan
     */
    public AnalysisResult run(RawTable raw) {
        long start = System.nanoTime();
        AnalysisResult result = analyze(raw);
        long elapsedNanos = System.nanoTime() - start;

        if (analysisTimer != null) {
            analysisTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
            rowsDroppedCounter.increment(raw.rowCount() - result.cleaned().rowCount());
            chartsPlannedCounter.increment(result.charts().size());
        }

        LOG.infof("Analysis finished in %d ms: %d -> %d rows, %d charts",
                elapsedNanos / 1_000_000, raw.rowCount(), result.cleaned().rowCount(),
                result.charts().size());
        return result;
    }

    /**
     * Same as {@link #run(RawTable)} but leaves the analysis metrics untouched. Used for
     * internal self-checks that must not count as user analyses.
     *
     * @param raw raw table (not modified)
     * @return cleaned table together with its profile and chart plan
     */
    public AnalysisResult runUnrecorded(RawTable raw) {
        return analyze(raw);
    }

    private AnalysisResult analyze(RawTable raw) {
        CleanedTable cleaned = cleaningService.clean(raw);

        CompletableFuture<List<ChartSpecDTO>> chartsFuture = parallelEnabled ? submitPlanning(cleaned) : null;
        DatasetProfileDTO profile = profilingService.profile(cleaned);
        List<ChartSpecDTO> charts = chartsFuture != null
                ? await(chartsFuture)
                : chartPlanningService.planCharts(cleaned);
        return new AnalysisResult(cleaned, profile, charts);
    }

    /**
     * Submits chart planning to the analysis executor.
     *
     * @return the pending plan, or {@code null} when no executor is available or it rejected
     *         the task, in which case the caller plans on its own thread
     */
    private CompletableFuture<List<ChartSpecDTO>> submitPlanning(CleanedTable cleaned) {
        if (executor == null) {
            return null;
        }
        try {
            return executor.supplyAsync(() -> chartPlanningService.planCharts(cleaned));
        } catch (RejectedExecutionException e) {
            LOG.warnf("Analysis executor saturated, planning charts on the request thread: %s",
                    e.getMessage());
            return null;
        }
    }

    /**
     * Cleans a raw table and summarizes its structure, without profiling or planning.
     *
     * @param filename original file name, echoed in the summary
     * @param raw      raw table (not modified)
     * @return structural summary of the cleaned table
     */
    public UploadSummaryDTO summarize(String filename, RawTable raw) {
        CleanedTable cleaned = cleaningService.clean(raw);

        Map<String, ColumnKind> columnTypes = new LinkedHashMap<>();
        Map<String, Long> missingValues = new LinkedHashMap<>();
        for (Column column : cleaned.columns()) {
            columnTypes.put(column.name(), column.kind());
            missingValues.put(column.name(), column.values().stream().filter(v -> v == null).count());
        }

        return new UploadSummaryDTO(
                filename,
                cleaned.rowCount(),
                cleaned.columnCount(),
                cleaned.columnNames(),
                columnTypes,
                missingValues,
                namesOf(cleaned.columnsOfKind(ColumnKind.NUMERIC)),
                namesOf(cleaned.columnsOfKind(ColumnKind.CATEGORICAL)));
    }

    @PostConstruct
    void initMetrics() {
        if (meterRegistry == null) {
            return;
        }

        analysisTimer =
                Timer.builder("dataset_analysis_duration")
                        .description("Duration of one dataset analysis run")
                        .register(meterRegistry);

        rowsDroppedCounter =
                Counter.builder("dataset_rows_dropped_total")
                        .description("Rows removed while cleaning uploaded datasets")
                        .register(meterRegistry);

        chartsPlannedCounter =
                Counter.builder("dataset_charts_planned_total")
                        .description("Chart specifications emitted by the planner")
                        .register(meterRegistry);

        LOG.debug("Analysis metrics initialized");
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    private static List<String> namesOf(List<Column> columns) {
        return columns.stream().map(Column::name).toList();
    }

    /**
     * Output of one pipeline run.
     *
     * @param cleaned cleaned table
     * @param profile statistical profile of {@code cleaned}
     * @param charts  ordered chart plan for {@code cleaned}
     */
    public record AnalysisResult(CleanedTable cleaned, DatasetProfileDTO profile, List<ChartSpecDTO> charts) {}
}
