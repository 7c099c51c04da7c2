/* (C)2026 */
package com.ammann.glycemia.properties;

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
     * Glycemic index endpoints
     */
    public static final class Indices {
        private Indices() {}

        public static final String BASE = "/indices";
        public static final String CALCULATE = BASE + "/calculate";
    }
}
