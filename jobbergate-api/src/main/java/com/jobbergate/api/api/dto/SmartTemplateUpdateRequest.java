package com.jobbergate.api.api.dto;

import java.util.Map;

/**
 * Request body for PUT /jobbergate/smart-templates/{id}. Null fields are left unchanged.
 */
public record SmartTemplateUpdateRequest(String              name,
                                         String              identifier,
                                         String              description,
                                         Map<String, Object> templateVars) {}
