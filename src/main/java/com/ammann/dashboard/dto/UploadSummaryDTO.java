/* (C)2026 */
package com.ammann.dashboard.dto;

import com.ammann.dashboard.enumeration.ColumnKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;
import java.util.Map;

/**
 * Quick structural summary of an uploaded file after cleaning.
 */
@Schema(description = "Structural summary of an uploaded dataset")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UploadSummaryDTO(
        @Schema(description = "Original file name")
        String filename,

        @Schema(description = "Rows after cleaning")
        long rows,

        @Schema(description = "Columns after cleaning")
        int columns,

        @Schema(description = "Column names in order")
        List<String> columnNames,

        @Schema(description = "Inferred kind per column")
        Map<String, ColumnKind> columnTypes,

        @Schema(description = "Missing cell count per column")
        Map<String, Long> missingValues,

        @Schema(description = "Names of numeric columns")
        List<String> numericColumns,

        @Schema(description = "Names of categorical columns")
        List<String> categoricalColumns
) {}
