/* (C)2026 */
package com.ammann.dashboard.dto;

import com.ammann.dashboard.service.StatisticsService;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Descriptive statistics of one numeric column.
 *
 * <p>The standard deviation uses the sample (n-1) denominator; quartiles are linearly
 * interpolated between order statistics.
 */
@Schema(description = "Descriptive statistics of a numeric column")
public record NumericSummaryDTO(
        @Schema(description = "Number of values")
        long count,

        @Schema(description = "Arithmetic mean")
        double mean,

        @Schema(description = "Sample standard deviation")
        double std,

        @Schema(description = "Minimum value")
        double min,

        @JsonProperty("25%")
        @Schema(description = "25th percentile")
        double q25,

        @JsonProperty("50%")
        @Schema(description = "Median")
        double q50,

        @JsonProperty("75%")
        @Schema(description = "75th percentile")
        double q75,

        @Schema(description = "Maximum value")
        double max
) {
    /**
     * Creates a DTO from the service-layer statistics record.
     *
     * @param stats statistics computed by {@link StatisticsService#describe(double[])}
     * @return a new {@code NumericSummaryDTO} populated with the given values
     */
    public static NumericSummaryDTO from(StatisticsService.NumericStatistics stats) {
        return new NumericSummaryDTO(
                stats.count(),
                stats.mean(),
                stats.standardDeviation(),
                stats.min(),
                stats.q1(),
                stats.median(),
                stats.q3(),
                stats.max()
        );
    }
}
