package com.jobbergate.api.api.dto;

import java.util.Map;

/**
 * Request body for POST /jobbergate/job-scripts.
 *
 * Required: jobScriptName and either
 *   - jobScriptFiles (explicit file name -> content), or
 *   - applicationId, whose templates are rendered with paramDict.
 * When both are present the explicit files win and applicationId is only recorded.
 */
public record JobScriptCreateRequest(String              jobScriptName,
                                     String              jobScriptDescription,
                                     Long                applicationId,
                                     Map<String, Object> paramDict,
                                     Map<String, String> jobScriptFiles,
                                     String              jobScriptMainFile) {}
