package com.jobbergate.api.api.dto;

import java.util.Map;

/**
 * Request body for PUT /jobbergate/job-scripts/{id}. Null fields are left unchanged.
 */
public record JobScriptUpdateRequest(String              jobScriptName,
                                     String              jobScriptDescription,
                                     Map<String, String> jobScriptFiles,
                                     String              jobScriptMainFile) {}
