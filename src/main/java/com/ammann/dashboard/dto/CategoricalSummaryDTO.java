/* (C)2026 */
package com.ammann.dashboard.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * Frequency summary of one categorical column.
 *
 * @param distinctCount number of distinct values
 * @param topValues     most frequent values with their counts, in descending order
 * @param mostFrequent  single most frequent value, {@code null} for an empty column
 */
@Schema(description = "Frequency summary of a categorical column")
public record CategoricalSummaryDTO(
        @Schema(description = "Number of distinct values")
        long distinctCount,

        @Schema(description = "Most frequent values with counts, ties in first-seen order")
        Map<String, Long> topValues,

        @Schema(description = "Most frequent value", nullable = true)
        String mostFrequent
) {}
