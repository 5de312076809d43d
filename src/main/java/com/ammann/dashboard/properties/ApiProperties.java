/* (C)2026 */
package com.ammann.dashboard.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Dataset upload and analysis endpoints
     */
    public static final class Datasets {
        private Datasets() {}

        public static final String BASE = "/datasets";
        public static final String UPLOAD = "/upload";
        public static final String ANALYZE = "/analyze";
        public static final String CHART_KINDS = "/charts/kinds";
    }
}
