package com.jobbergate.api.service;

import com.jobbergate.api.api.dto.SmartTemplateCreateRequest;
import com.jobbergate.api.api.dto.SmartTemplateUpdateRequest;
import com.jobbergate.api.model.SmartTemplate;
import com.jobbergate.api.pagination.ListResponseEnvelope;
import com.jobbergate.api.pagination.PageResponses;
import com.jobbergate.api.pagination.Pagination;
import com.jobbergate.api.repository.SmartTemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.jobbergate.api.service.ResourceSpecifications.*;

/**
 * Create / read / update / delete for smart templates.
 */
@Service
public class SmartTemplateService {

    private static final Logger log = LoggerFactory.getLogger(SmartTemplateService.class);

    private static final Map<String, String> SORTABLE_FIELDS = Map.of(
            "id",          "id",
            "name",        "name",
            "identifier",  "identifier",
            "owner_email", "ownerEmail",
            "created_at",  "createdAt",
            "updated_at",  "updatedAt"
    );

    private final SmartTemplateRepository repo;

    public SmartTemplateService(SmartTemplateRepository repo) {
        this.repo = repo;
    }

    @Transactional
    public SmartTemplate create(SmartTemplateCreateRequest req, String ownerEmail) {
        SmartTemplate template = new SmartTemplate(requireText(req.name(), "name"), ownerEmail);
        template.setIdentifier(req.identifier());
        template.setDescription(req.description());
        template.setTemplateVars(req.templateVars());
        SmartTemplate saved = repo.saveAndFlush(template);
        log.info("Created smart template {} (identifier={}, owner={})",
                saved.getId(), saved.getIdentifier(), ownerEmail);
        return saved;
    }

    @Transactional(readOnly = true)
    public SmartTemplate get(Long id) {
        return repo.findById(id).orElseThrow(() -> {
            log.debug("Smart template {} not found", id);
            return new ResourceNotFoundException("SmartTemplate", id);
        });
    }

    /**
     * Look up by numeric id, or by identifier when the key is not a number.
     * A key of digits too long for an id is looked up as an identifier.
     */
    @Transactional(readOnly = true)
    public SmartTemplate get(String idOrIdentifier) {
        Long id = parseId(idOrIdentifier);
        if (id != null) {
            return get(id);
        }
        return repo.findByIdentifier(idOrIdentifier)
                .orElseThrow(() -> new ResourceNotFoundException("SmartTemplate", idOrIdentifier));
    }

    @Transactional(readOnly = true)
    public long count() {
        return repo.count();
    }

    @Transactional(readOnly = true)
    public ListResponseEnvelope<SmartTemplate> list(ListQuery query, Pagination pagination) {
        List<Specification<SmartTemplate>> filters = new ArrayList<>();
        if (!query.all()) {
            filters.add(isNotNull("identifier"));
        }
        if (query.owner() != null) {
            filters.add(equalTo("ownerEmail", query.owner()));
        }
        if (query.search() != null && !query.search().isBlank()) {
            filters.add(containsIgnoreCase(query.search(), "name", "identifier", "description"));
        }
        return PageResponses.packageResponse(
                repo, Specification.allOf(filters), sortFor(query, SORTABLE_FIELDS), pagination);
    }

    @Transactional
    public SmartTemplate update(Long id, SmartTemplateUpdateRequest req) {
        SmartTemplate template = get(id);
        if (req.name() != null) {
            template.setName(requireText(req.name(), "name"));
        }
        if (req.identifier() != null) {
            template.setIdentifier(req.identifier());
        }
        if (req.description() != null) {
            template.setDescription(req.description());
        }
        if (req.templateVars() != null) {
            template.setTemplateVars(req.templateVars());
        }
        SmartTemplate saved = repo.saveAndFlush(template);
        log.info("Updated smart template {}", id);
        return saved;
    }

    @Transactional
    public void delete(Long id) {
        SmartTemplate template = get(id);
        repo.delete(template);
        repo.flush();
        log.info("Deleted smart template {}", id);
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
