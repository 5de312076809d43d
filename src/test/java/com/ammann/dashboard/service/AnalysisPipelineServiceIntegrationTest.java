/* (C)2026 */
package com.ammann.dashboard.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.dashboard.dto.ChartSpecDTO;
import com.ammann.dashboard.enumeration.ChartKind;
import com.ammann.dashboard.health.PipelineReadinessCheck;
import com.ammann.dashboard.model.CleanedTable;
import com.ammann.dashboard.model.Column;
import com.ammann.dashboard.support.TestTables;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.junit.jupiter.api.Test;

@QuarkusTest
class AnalysisPipelineServiceIntegrationTest {

    @Inject
    AnalysisPipelineService pipeline;

    @Inject
    ChartPlanningService chartPlanningService;

    @Inject
    @Named("analysis-executor")
    ManagedExecutor executor;

    @Inject
    @Readiness
    PipelineReadinessCheck readinessCheck;

    @Test
    void configuredChartLimitsApply() {
        List<Column> columns = new ArrayList<>(TestTables.numericColumns(7, 4));
        columns.addAll(TestTables.categoricalColumns(5, 4));

        List<ChartSpecDTO> charts = chartPlanningService.planCharts(new CleanedTable(columns, 4));

        assertThat(charts.stream().filter(c -> c.kind() == ChartKind.DISTRIBUTION)).hasSize(5);
        assertThat(charts.stream().filter(c -> c.kind() == ChartKind.CATEGORICAL)).hasSize(3);
        assertThat(charts.get(0).plotDefinition().get("bins").get("count").asInt()).isEqualTo(30);
        assertThat(executor).isNotNull();
    }

    @Test
    void pipelineRunsOnManagedExecutor() {
        AnalysisPipelineService.AnalysisResult result = pipeline.run(TestTables.salesTable());

        assertThat(result.cleaned().rowCount()).isEqualTo(4);
        assertThat(result.profile().numericSummary().get("sales").mean()).isEqualTo(22.5);
        assertThat(result.charts()).extracting(ChartSpecDTO::kind).containsExactly(
                ChartKind.DISTRIBUTION, ChartKind.BOXPLOT, ChartKind.CATEGORICAL, ChartKind.TIMESERIES);
    }

    @Test
    void readinessCheckIsUp() {
        assertThat(readinessCheck.call().getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
    }
}
