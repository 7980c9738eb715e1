package com.jobbergate.api.api.dto;

import java.util.Map;

/**
 * Request body for POST /jobbergate/smart-templates. Required: name.
 */
public record SmartTemplateCreateRequest(String              name,
                                         String              identifier,
                                         String              description,
                                         Map<String, Object> templateVars) {}
