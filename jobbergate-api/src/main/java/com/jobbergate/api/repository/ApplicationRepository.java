package com.jobbergate.api.repository;

import com.jobbergate.api.model.Application;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Optional;

/**
 * CRUD + query operations for the applications table.
 *
 * Spring Data JPA generates the implementation at startup.
 * List filters are composed as Specifications in the service layer.
 */
public interface ApplicationRepository
        extends JpaRepository<Application, Long>, JpaSpecificationExecutor<Application> {

    Optional<Application> findByApplicationIdentifier(String applicationIdentifier);
}
