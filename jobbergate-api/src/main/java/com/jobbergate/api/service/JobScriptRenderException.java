package com.jobbergate.api.service;

/**
 * An application's templates could not be rendered into a job script.
 * Mapped to HTTP 422.
 */
public class JobScriptRenderException extends RuntimeException {

    public JobScriptRenderException(String message) {
        super(message);
    }

    public JobScriptRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
