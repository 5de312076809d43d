/* (C)2026 */
package com.ammann.dashboard.health;

import com.ammann.dashboard.model.RawTable;
import com.ammann.dashboard.service.AnalysisPipelineService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Readiness health check that runs the analysis pipeline over a small built-in table.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>UP: the pipeline cleaned the probe table and planned at least one chart</li>
 *   <li>DOWN: the pipeline failed or produced no charts</li>
 * </ul>
 */
@Readiness
@ApplicationScoped
public class PipelineReadinessCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(PipelineReadinessCheck.class);
    private static final String NAME = "analysis-pipeline";

    static final RawTable PROBE_TABLE = RawTable.fromRows(
            List.of("value", "label"),
            List.of(
                    List.<Object>of("1.5", "a"),
                    List.<Object>of("2.5", "b"),
                    List.<Object>of("4.0", "a")));

    private final AnalysisPipelineService pipeline;

    @Inject
    public PipelineReadinessCheck(AnalysisPipelineService pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public HealthCheckResponse call() {
        try {
            Instant start = Instant.now();
            AnalysisPipelineService.AnalysisResult result = pipeline.runUnrecorded(PROBE_TABLE);
            Duration elapsed = Duration.between(start, Instant.now());
            boolean ok = !result.charts().isEmpty();

            return HealthCheckResponse.named(NAME)
                    .status(ok)
                    .withData("probe-rows", result.cleaned().rowCount())
                    .withData("probe-charts", result.charts().size())
                    .withData("run-time-ms", elapsed.toMillis())
                    .build();

        } catch (RuntimeException e) {
            LOG.warnf("Pipeline readiness probe failed: %s", e.getMessage());
            return HealthCheckResponse.named(NAME)
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
