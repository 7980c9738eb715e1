package com.jobbergate.api.api;

/**
 * Request headers understood by every controller.
 */
public final class ApiHeaders {

    /** Email of the caller; new resources are owned by it and {@code user=true} filters on it. */
    public static final String OWNER = "X-Jobbergate-Owner";

    private ApiHeaders() {}
}
