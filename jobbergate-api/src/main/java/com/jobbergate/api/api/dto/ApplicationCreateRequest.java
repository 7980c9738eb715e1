package com.jobbergate.api.api.dto;

/**
 * Request body for POST /jobbergate/applications.
 *
 * Required: applicationName. Files are uploaded separately.
 */
public record ApplicationCreateRequest(String applicationName,
                                       String applicationIdentifier,
                                       String applicationDescription) {}
