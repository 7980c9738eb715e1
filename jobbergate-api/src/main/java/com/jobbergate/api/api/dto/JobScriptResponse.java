package com.jobbergate.api.api.dto;

import com.jobbergate.api.model.JobScript;

import java.time.Instant;
import java.util.Map;

public record JobScriptResponse(
        Long                id,
        String              jobScriptName,
        String              jobScriptDescription,
        String              jobScriptOwnerEmail,
        Long                applicationId,
        String              jobScriptMainFile,
        Map<String, Object> jobScriptFiles,
        Instant             createdAt,
        Instant             updatedAt
) {
    public static JobScriptResponse from(JobScript s) {
        return new JobScriptResponse(
                s.getId(),
                s.getJobScriptName(),
                s.getJobScriptDescription(),
                s.getJobScriptOwnerEmail(),
                s.getApplicationId(),
                s.getJobScriptMainFile(),
                s.getJobScriptFiles(),
                s.getCreatedAt(),
                s.getUpdatedAt()
        );
    }
}
