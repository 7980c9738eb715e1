package com.jobbergate.api.api.dto;

import com.jobbergate.api.model.SmartTemplate;

import java.time.Instant;
import java.util.Map;

public record SmartTemplateResponse(
        Long                id,
        String              name,
        String              identifier,
        String              description,
        String              ownerEmail,
        Map<String, Object> templateVars,
        Instant             createdAt,
        Instant             updatedAt
) {
    public static SmartTemplateResponse from(SmartTemplate t) {
        return new SmartTemplateResponse(
                t.getId(),
                t.getName(),
                t.getIdentifier(),
                t.getDescription(),
                t.getOwnerEmail(),
                t.getTemplateVars(),
                t.getCreatedAt(),
                t.getUpdatedAt()
        );
    }
}
