/* (C)2026 */
package com.ammann.dashboard.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

/**
 * Full analysis of an uploaded dataset: planned charts, statistical profile and a short
 * narrative.
 */
@Schema(description = "Charts, profile and narrative for an uploaded dataset")
public record AnalysisResponseDTO(
        @Schema(description = "Whether the analysis completed")
        boolean success,

        @Schema(description = "Ordered chart specifications")
        List<ChartSpecDTO> charts,

        @Schema(description = "Statistical profile")
        DatasetProfileDTO analysis,

        @Schema(description = "Narrative summary of the profile")
        String insights
) {}
