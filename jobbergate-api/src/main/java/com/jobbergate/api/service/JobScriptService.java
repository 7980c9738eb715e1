package com.jobbergate.api.service;

import com.jobbergate.api.api.dto.JobScriptCreateRequest;
import com.jobbergate.api.api.dto.JobScriptUpdateRequest;
import com.jobbergate.api.model.Application;
import com.jobbergate.api.model.JobScript;
import com.jobbergate.api.pagination.ListResponseEnvelope;
import com.jobbergate.api.pagination.PageResponses;
import com.jobbergate.api.pagination.Pagination;
import com.jobbergate.api.repository.ApplicationRepository;
import com.jobbergate.api.repository.JobScriptRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.jobbergate.api.service.ResourceSpecifications.*;

/**
 * Create / read / update / delete for job scripts.
 *
 * A job script is created either from explicit files or by rendering an
 * application's templates with a parameter map.
 */
@Service
public class JobScriptService {

    private static final Logger log = LoggerFactory.getLogger(JobScriptService.class);

    private static final Map<String, String> SORTABLE_FIELDS = Map.of(
            "id",                     "id",
            "job_script_name",        "jobScriptName",
            "job_script_owner_email", "jobScriptOwnerEmail",
            "application_id",         "applicationId",
            "created_at",             "createdAt",
            "updated_at",             "updatedAt"
    );

    private final JobScriptRepository   repo;
    private final ApplicationRepository applicationRepo;
    private final JobScriptRenderer     renderer;

    public JobScriptService(JobScriptRepository repo,
                            ApplicationRepository applicationRepo,
                            JobScriptRenderer renderer) {
        this.repo            = repo;
        this.applicationRepo = applicationRepo;
        this.renderer        = renderer;
    }

    /**
     * Persist a new job script.
     *
     * @throws ResourceNotFoundException  if {@code applicationId} names no application
     * @throws JobScriptRenderException   if rendering the application's templates fails
     * @throws IllegalArgumentException   if neither files nor an application are supplied
     */
    @Transactional
    public JobScript create(JobScriptCreateRequest req, String ownerEmail) {
        JobScript jobScript = new JobScript(requireText(req.jobScriptName(), "job_script_name"), ownerEmail);
        jobScript.setJobScriptDescription(req.jobScriptDescription());

        if (req.jobScriptFiles() != null && !req.jobScriptFiles().isEmpty()) {
            if (req.applicationId() != null) {
                requireApplication(req.applicationId());
            }
            jobScript.setApplicationId(req.applicationId());
            applyFiles(jobScript, req.jobScriptFiles(), req.jobScriptMainFile(), null);
        } else if (req.applicationId() != null) {
            Application application = requireApplication(req.applicationId());
            JobScriptRenderer.Rendered rendered = renderer.render(application, req.paramDict());
            jobScript.setApplicationId(application.getId());
            jobScript.setJobScriptFiles(rendered.files());
            jobScript.setJobScriptMainFile(rendered.mainFile());
        } else {
            throw new IllegalArgumentException("Either job_script_files or application_id must be supplied");
        }

        JobScript saved = repo.saveAndFlush(jobScript);
        log.info("Created job script {} (application={}, files={}, owner={})",
                saved.getId(), saved.getApplicationId(), saved.getJobScriptFiles().size(), ownerEmail);
        return saved;
    }

    @Transactional(readOnly = true)
    public JobScript get(Long id) {
        return repo.findById(id).orElseThrow(() -> {
            log.debug("Job script {} not found", id);
            return new ResourceNotFoundException("JobScript", id);
        });
    }

    @Transactional(readOnly = true)
    public long count() {
        return repo.count();
    }

    @Transactional(readOnly = true)
    public ListResponseEnvelope<JobScript> list(ListQuery query, Long fromApplicationId, Pagination pagination) {
        List<Specification<JobScript>> filters = new ArrayList<>();
        if (query.owner() != null) {
            filters.add(equalTo("jobScriptOwnerEmail", query.owner()));
        }
        if (fromApplicationId != null) {
            filters.add(equalTo("applicationId", fromApplicationId));
        }
        if (query.search() != null && !query.search().isBlank()) {
            filters.add(containsIgnoreCase(query.search(), "jobScriptName", "jobScriptDescription"));
        }
        return PageResponses.packageResponse(
                repo, Specification.allOf(filters), sortFor(query, SORTABLE_FIELDS), pagination);
    }

    @Transactional
    public JobScript update(Long id, JobScriptUpdateRequest req) {
        JobScript jobScript = get(id);
        if (req.jobScriptName() != null) {
            jobScript.setJobScriptName(requireText(req.jobScriptName(), "job_script_name"));
        }
        if (req.jobScriptDescription() != null) {
            jobScript.setJobScriptDescription(req.jobScriptDescription());
        }
        if (req.jobScriptFiles() != null) {
            applyFiles(jobScript, req.jobScriptFiles(), req.jobScriptMainFile(), jobScript.getJobScriptMainFile());
        } else if (req.jobScriptMainFile() != null) {
            requireMainFile(jobScript.getJobScriptFiles(), req.jobScriptMainFile());
            jobScript.setJobScriptMainFile(req.jobScriptMainFile());
        }
        JobScript saved = repo.saveAndFlush(jobScript);
        log.info("Updated job script {}", id);
        return saved;
    }

    @Transactional
    public void delete(Long id) {
        JobScript jobScript = get(id);
        repo.delete(jobScript);
        repo.flush();
        log.info("Deleted job script {}", id);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Application requireApplication(Long applicationId) {
        return applicationRepo.findById(applicationId)
                .orElseThrow(() -> new ResourceNotFoundException("Application", applicationId));
    }

    /**
     * Replace the files. The main file is the requested one (which must exist),
     * else {@code previousMain} when still present, else the first name in order.
     */
    private static void applyFiles(JobScript jobScript, Map<String, String> files,
                                   String requestedMain, String previousMain) {
        Map<String, Object> copy = new LinkedHashMap<>(files);
        String main;
        if (requestedMain != null) {
            requireMainFile(copy, requestedMain);
            main = requestedMain;
        } else if (previousMain != null && copy.containsKey(previousMain)) {
            main = previousMain;
        } else {
            main = copy.keySet().stream().sorted().findFirst().orElse(null);
        }
        jobScript.setJobScriptFiles(copy);
        jobScript.setJobScriptMainFile(main);
    }

    private static void requireMainFile(Map<String, Object> files, String mainFile) {
        if (!files.containsKey(mainFile)) {
            throw new IllegalArgumentException("job_script_main_file '" + mainFile + "' is not one of the job script files");
        }
    }
}
