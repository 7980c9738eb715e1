package com.jobbergate.api.repository;

import com.jobbergate.api.model.SmartTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Optional;

/**
 * CRUD + query operations for the smart_templates table.
 */
public interface SmartTemplateRepository
        extends JpaRepository<SmartTemplate, Long>, JpaSpecificationExecutor<SmartTemplate> {

    Optional<SmartTemplate> findByIdentifier(String identifier);
}
