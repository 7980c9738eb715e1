package com.jobbergate.api.api;

import com.jobbergate.api.api.dto.SmartTemplateCreateRequest;
import com.jobbergate.api.api.dto.SmartTemplateResponse;
import com.jobbergate.api.api.dto.SmartTemplateUpdateRequest;
import com.jobbergate.api.pagination.ListResponseEnvelope;
import com.jobbergate.api.pagination.Pagination;
import com.jobbergate.api.service.ListQuery;
import com.jobbergate.api.service.SmartTemplateService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for smart templates. Same shape as the application endpoints,
 * without file upload.
 */
@RestController
@RequestMapping("/jobbergate/smart-templates")
public class SmartTemplateController {

    private final SmartTemplateService smartTemplateService;
    private final String               defaultOwner;
    private final int                  defaultPerPage;

    public SmartTemplateController(SmartTemplateService smartTemplateService,
                                   @Value("${jobbergate.default-owner:anonymous@jobbergate.local}") String defaultOwner,
                                   @Value("${jobbergate.pagination.default-per-page:10}") int defaultPerPage) {
        this.smartTemplateService = smartTemplateService;
        this.defaultOwner         = defaultOwner;
        this.defaultPerPage       = defaultPerPage;
    }

    @GetMapping
    public ListResponseEnvelope<SmartTemplateResponse> list(
            @RequestParam(defaultValue = "false") boolean all,
            @RequestParam(defaultValue = "false") boolean user,
            @RequestParam(required = false) String search,
            @RequestParam(name = "sort_field", required = false) String sortField,
            @RequestParam(name = "sort_ascending", defaultValue = "true") boolean sortAscending,
            @RequestParam(required = false) Integer page,
            @RequestParam(name = "per_page", required = false) Integer perPage,
            @RequestHeader(name = ApiHeaders.OWNER, required = false) String owner) {
        ListQuery query = new ListQuery(all, user ? ownerOrDefault(owner) : null, search, sortField, sortAscending);
        return smartTemplateService.list(query, Pagination.fromRequest(page, perPage, defaultPerPage))
                .map(SmartTemplateResponse::from);
    }

    @GetMapping("/{idOrIdentifier}")
    public SmartTemplateResponse get(@PathVariable String idOrIdentifier) {
        return SmartTemplateResponse.from(smartTemplateService.get(idOrIdentifier));
    }

    @PostMapping
    public ResponseEntity<SmartTemplateResponse> create(
            @RequestBody SmartTemplateCreateRequest req,
            @RequestHeader(name = ApiHeaders.OWNER, required = false) String owner) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(SmartTemplateResponse.from(smartTemplateService.create(req, ownerOrDefault(owner))));
    }

    @PutMapping("/{id}")
    public SmartTemplateResponse update(@PathVariable Long id, @RequestBody SmartTemplateUpdateRequest req) {
        return SmartTemplateResponse.from(smartTemplateService.update(id, req));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        smartTemplateService.delete(id);
        return ResponseEntity.noContent().build();
    }

    private String ownerOrDefault(String owner) {
        return owner == null || owner.isBlank() ? defaultOwner : owner;
    }
}
