/* (C)2026 */
package com.ammann.kpi.properties;

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
     * Monthly KPI report endpoints
     */
    public static final class Kpi {
        private Kpi() {}

        public static final String BASE = "/kpi";
        public static final String SOLUTION = "/solution";
        public static final String VOTE = "/vote";
        public static final String FAST_RESPONSE = "/fast-response";
        public static final String ACTIVE_KB_CONTRIBUTORS = "/active-kb-contributors";
        public static final String ACTIVE_ANSWERERS = "/active-answerers";
    }

    /**
     * Weekly search clickthrough endpoints, one per configured engine
     */
    public static final class Clickthrough {
        private Clickthrough() {}

        public static final String ENGINE_PARAM = "engine";
        public static final String BASE = "/search/{" + ENGINE_PARAM + "}-clickthrough-rate";
        public static final String MIN_START_PARAM = "min_start";
    }

}
