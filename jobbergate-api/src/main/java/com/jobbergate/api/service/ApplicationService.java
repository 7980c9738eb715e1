package com.jobbergate.api.service;

import com.jobbergate.api.api.dto.ApplicationCreateRequest;
import com.jobbergate.api.api.dto.ApplicationUpdateRequest;
import com.jobbergate.api.files.ApplicationArchive;
import com.jobbergate.api.files.FileValidation;
import com.jobbergate.api.files.FileValidationException;
import com.jobbergate.api.model.Application;
import com.jobbergate.api.pagination.ListResponseEnvelope;
import com.jobbergate.api.pagination.PageResponses;
import com.jobbergate.api.pagination.Pagination;
import com.jobbergate.api.repository.ApplicationRepository;
import com.jobbergate.api.repository.JobScriptRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.jobbergate.api.service.ResourceSpecifications.*;

/**
 * Create / read / update / delete for applications, plus the file upload
 * that attaches source, config and templates to an existing row.
 *
 * Every public method runs in its own transaction; there is no coordination
 * beyond that.
 */
@Service
public class ApplicationService {

    private static final Logger log = LoggerFactory.getLogger(ApplicationService.class);

    private static final Map<String, String> SORTABLE_FIELDS = Map.of(
            "id",                     "id",
            "application_name",       "applicationName",
            "application_identifier", "applicationIdentifier",
            "application_owner_email","applicationOwnerEmail",
            "created_at",             "createdAt",
            "updated_at",             "updatedAt"
    );

    private final ApplicationRepository repo;
    private final JobScriptRepository   jobScriptRepo;
    private final MeterRegistry         meterRegistry;

    public ApplicationService(ApplicationRepository repo,
                              JobScriptRepository jobScriptRepo,
                              MeterRegistry meterRegistry) {
        this.repo          = repo;
        this.jobScriptRepo = jobScriptRepo;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // CRUD
    // ------------------------------------------------------------------

    @Transactional
    public Application create(ApplicationCreateRequest req, String ownerEmail) {
        Application application = new Application(
                requireText(req.applicationName(), "application_name"), ownerEmail);
        application.setApplicationIdentifier(req.applicationIdentifier());
        application.setApplicationDescription(req.applicationDescription());
        Application saved = repo.saveAndFlush(application);
        log.info("Created application {} (identifier={}, owner={})",
                saved.getId(), saved.getApplicationIdentifier(), ownerEmail);
        return saved;
    }

    @Transactional(readOnly = true)
    public Application get(Long id) {
        return repo.findById(id).orElseThrow(() -> {
            log.debug("Application {} not found", id);
            return new ResourceNotFoundException("Application", id);
        });
    }

    /**
     * Look up by numeric id, or by identifier when the key is not a number.
     * A key of digits too long for an id is looked up as an identifier.
     */
    @Transactional(readOnly = true)
    public Application get(String idOrIdentifier) {
        Long id = parseId(idOrIdentifier);
        if (id != null) {
            return get(id);
        }
        return repo.findByApplicationIdentifier(idOrIdentifier)
                .orElseThrow(() -> new ResourceNotFoundException("Application", idOrIdentifier));
    }

    @Transactional(readOnly = true)
    public long count() {
        return repo.count();
    }

    @Transactional(readOnly = true)
    public ListResponseEnvelope<Application> list(ListQuery query, Pagination pagination) {
        List<Specification<Application>> filters = new ArrayList<>();
        if (!query.all()) {
            filters.add(isNotNull("applicationIdentifier"));
        }
        if (query.owner() != null) {
            filters.add(equalTo("applicationOwnerEmail", query.owner()));
        }
        if (query.search() != null && !query.search().isBlank()) {
            filters.add(containsIgnoreCase(query.search(),
                    "applicationName", "applicationIdentifier", "applicationDescription"));
        }
        return PageResponses.packageResponse(
                repo, Specification.allOf(filters), sortFor(query, SORTABLE_FIELDS), pagination);
    }

    /** Apply the non-null fields of {@code req}; everything else is left as is. */
    @Transactional
    public Application update(Long id, ApplicationUpdateRequest req) {
        Application application = get(id);
        if (req.applicationName() != null) {
            application.setApplicationName(requireText(req.applicationName(), "application_name"));
        }
        if (req.applicationIdentifier() != null) {
            application.setApplicationIdentifier(req.applicationIdentifier());
        }
        if (req.applicationDescription() != null) {
            application.setApplicationDescription(req.applicationDescription());
        }
        Application saved = repo.saveAndFlush(application);
        log.info("Updated application {}", id);
        return saved;
    }

    @Transactional
    public void delete(Long id) {
        Application application = get(id);
        long detached = jobScriptRepo.countByApplicationId(id);
        repo.delete(application);
        repo.flush();
        log.info("Deleted application {} ({} job scripts detached)", id, detached);
    }

    // ------------------------------------------------------------------
    // Files
    // ------------------------------------------------------------------

    /**
     * Replace the application's files with the contents of a gzip tarball.
     *
     * Every file is syntax-checked first; nothing is stored unless all pass.
     *
     * @throws FileValidationException if the archive is unreadable, incomplete or has invalid files
     */
    @Transactional
    public Application uploadFiles(Long id, InputStream archive) {
        Application application = get(id);
        ApplicationArchive.Contents contents = ApplicationArchive.extract(archive);

        Map<String, String> checked = new LinkedHashMap<>();
        checked.put(ApplicationArchive.SOURCE_FILE, contents.source());
        checked.put(ApplicationArchive.CONFIG_FILE, contents.config());
        List<String> invalid = new ArrayList<>(FileValidation.findInvalidFiles(checked));
        record("python", !invalid.contains(ApplicationArchive.SOURCE_FILE));
        record("yaml",   !invalid.contains(ApplicationArchive.CONFIG_FILE));

        // Templates are Jinja2 whatever their extension (job_script.sh, run.py.j2, ...).
        contents.templates().forEach((name, source) -> {
            boolean valid = FileValidation.isValidJinja2Template(source);
            record("template", valid);
            if (!valid) {
                invalid.add(ApplicationArchive.TEMPLATE_PREFIX + name);
            }
        });

        if (!invalid.isEmpty()) {
            log.warn("Rejected upload for application {}: invalid files {}", id, invalid);
            throw new FileValidationException("Uploaded files failed syntax validation: " + invalid, invalid);
        }

        application.setApplicationFile(contents.source());
        application.setApplicationConfig(contents.config());
        application.setApplicationTemplates(new LinkedHashMap<>(contents.templates()));
        application.setApplicationUploaded(true);
        Application saved = repo.saveAndFlush(application);
        log.info("Uploaded files for application {} ({} templates)", id, contents.templates().size());
        return saved;
    }

    @Transactional
    public Application clearFiles(Long id) {
        Application application = get(id);
        application.setApplicationFile(null);
        application.setApplicationConfig(null);
        application.setApplicationTemplates(Map.of());
        application.setApplicationUploaded(false);
        log.info("Cleared files for application {}", id);
        return repo.saveAndFlush(application);
    }

    private void record(String kind, boolean valid) {
        meterRegistry.counter("jobbergate.upload.files",
                "kind", kind, "status", valid ? "valid" : "invalid").increment();
    }

    private static Long parseId(String key) {
        if (key.isEmpty() || !key.chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            return Long.valueOf(key);
        } catch (NumberFormatException e) {
            log.debug("Key {} is out of id range; trying it as an identifier", key);
            return null;
        }
    }
}
