package com.jobbergate.api.api.dto;

/**
 * Request body for PUT /jobbergate/applications/{id}.
 * Null fields are left unchanged.
 */
public record ApplicationUpdateRequest(String applicationName,
                                       String applicationIdentifier,
                                       String applicationDescription) {}
