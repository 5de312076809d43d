/* (C)2026 */
package com.ammann.dashboard.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Shape and approximate in-memory footprint of a cleaned dataset.
 */
@Schema(description = "Dataset shape and approximate memory footprint")
public record DatasetInfoDTO(
        @Schema(description = "Number of rows after cleaning")
        long rowCount,

        @Schema(description = "Number of columns after cleaning")
        int columnCount,

        @Schema(description = "Approximate in-memory size of all cells in MiB")
        double memoryEstimateMB
) {}
