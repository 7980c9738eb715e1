package com.jobbergate.api.repository;

import com.jobbergate.api.model.JobScript;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

/**
 * CRUD + query operations for the job_scripts table.
 */
public interface JobScriptRepository
        extends JpaRepository<JobScript, Long>, JpaSpecificationExecutor<JobScript> {

    long countByApplicationId(Long applicationId);
}
