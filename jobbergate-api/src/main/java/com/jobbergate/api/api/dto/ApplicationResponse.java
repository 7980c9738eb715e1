package com.jobbergate.api.api.dto;

import com.jobbergate.api.model.Application;

import java.time.Instant;
import java.util.Map;

/**
 * Response body for the application endpoints.
 */
public record ApplicationResponse(
        Long                id,
        String              applicationName,
        String              applicationIdentifier,
        String              applicationDescription,
        String              applicationOwnerEmail,
        String              applicationFile,
        String              applicationConfig,
        Map<String, Object> applicationTemplates,
        boolean             applicationUploaded,
        Instant             createdAt,
        Instant             updatedAt
) {
    public static ApplicationResponse from(Application a) {
        return new ApplicationResponse(
                a.getId(),
                a.getApplicationName(),
                a.getApplicationIdentifier(),
                a.getApplicationDescription(),
                a.getApplicationOwnerEmail(),
                a.getApplicationFile(),
                a.getApplicationConfig(),
                a.getApplicationTemplates(),
                a.isApplicationUploaded(),
                a.getCreatedAt(),
                a.getUpdatedAt()
        );
    }
}
