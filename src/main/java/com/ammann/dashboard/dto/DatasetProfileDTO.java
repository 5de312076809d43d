/* (C)2026 */
package com.ammann.dashboard.dto;

import com.ammann.dashboard.enumeration.ColumnKind;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * Read-only statistical and structural profile of a cleaned dataset.
 *
 * <p>All maps preserve column order. {@code numericSummary} covers numeric columns only,
 * {@code categoricalSummary} categorical columns only, and {@code correlations} is empty
 * unless the dataset has at least two numeric columns.
 */
@Schema(description = "Statistical profile of a cleaned dataset")
public record DatasetProfileDTO(
        @Schema(description = "Dataset shape and memory footprint")
        DatasetInfoDTO datasetInfo,

        @Schema(description = "Inferred kind per column")
        Map<String, ColumnKind> columnTypes,

        @Schema(description = "Missing cell count per column")
        Map<String, Long> missingCounts,

        @Schema(description = "Descriptive statistics per numeric column")
        Map<String, NumericSummaryDTO> numericSummary,

        @Schema(description = "Pearson correlation matrix over numeric columns")
        Map<String, Map<String, Double>> correlations,

        @Schema(description = "Frequency summary per categorical column")
        Map<String, CategoricalSummaryDTO> categoricalSummary
) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Returns the profile as nested plain maps, the shape consumed by report and narrative
     * collaborators.
     */
    public Map<String, Object> toMap() {
        return MAPPER.convertValue(this, new TypeReference<Map<String, Object>>() {});
    }
}
