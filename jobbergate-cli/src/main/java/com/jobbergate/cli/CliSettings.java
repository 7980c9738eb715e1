package com.jobbergate.cli;

import java.time.Duration;
import java.util.Map;

/**
 * CLI configuration read from the environment.
 *
 * JOBBERGATE_API_URL          base URL of the API (default http://localhost:8000)
 * JOBBERGATE_USER_EMAIL       sent as the owner header; unset means the API's default owner
 * JOBBERGATE_REQUEST_TIMEOUT  per-request timeout in seconds (default 30)
 * JOBBERGATE_SUPPORT_CONTACT  shown in error messages
 */
public record CliSettings(String apiUrl, String userEmail, Duration requestTimeout, String supportContact) {

    public static final String DEFAULT_API_URL         = "http://localhost:8000";
    public static final String DEFAULT_SUPPORT_CONTACT = "your Jobbergate administrator";
    public static final int    DEFAULT_TIMEOUT_SECONDS = 30;

    public CliSettings {
        apiUrl = stripTrailingSlash(apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl);
        if (userEmail != null && userEmail.isBlank()) {
            userEmail = null;
        }
        if (requestTimeout == null) {
            requestTimeout = Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS);
        }
        if (supportContact == null || supportContact.isBlank()) {
            supportContact = DEFAULT_SUPPORT_CONTACT;
        }
    }

    public static CliSettings fromEnvironment(Map<String, String> env) {
        return new CliSettings(
                env.get("JOBBERGATE_API_URL"),
                env.get("JOBBERGATE_USER_EMAIL"),
                Duration.ofSeconds(parseTimeout(env.get("JOBBERGATE_REQUEST_TIMEOUT"))),
                env.get("JOBBERGATE_SUPPORT_CONTACT"));
    }

    public CliSettings withApiUrl(String url) {
        return new CliSettings(url, userEmail, requestTimeout, supportContact);
    }

    private static long parseTimeout(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_TIMEOUT_SECONDS;
        }
        try {
            long seconds = Long.parseLong(raw.trim());
            if (seconds <= 0) {
                throw new IllegalArgumentException("JOBBERGATE_REQUEST_TIMEOUT must be a positive number of seconds");
            }
            return seconds;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("JOBBERGATE_REQUEST_TIMEOUT is not a number: " + raw, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
