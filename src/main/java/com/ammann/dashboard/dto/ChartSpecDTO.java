/* (C)2026 */
package com.ammann.dashboard.dto;

import com.ammann.dashboard.enumeration.ChartKind;
import com.fasterxml.jackson.databind.JsonNode;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Declarative description of one chart to render.
 *
 * <p>The plot definition is an opaque JSON document (axis bindings, data arrays and display
 * hints) that is passed to the renderer untouched.
 */
@Schema(description = "Chart specification consumed by a downstream renderer")
public record ChartSpecDTO(
        @Schema(description = "Chart family")
        ChartKind kind,

        @Schema(description = "Human-readable chart title")
        String title,

        @Schema(description = "Declarative plot definition")
        JsonNode plotDefinition
) {}
